package com.phillippitts.shato.service.routing;

/**
 * States of one request travelling through the router.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * RECEIVED → GENERATING
 * GENERATING → DONE_CHAT (no command proposed)
 * GENERATING → VALIDATING (command proposed)
 * VALIDATING → DONE_COMMAND (valid)
 * VALIDATING → RETRYING (first invalid outcome)
 * VALIDATING → FAILED (second invalid outcome, or internal error)
 * RETRYING → GENERATING (with validator feedback)
 * </pre>
 */
public enum RouterState {
    RECEIVED,
    GENERATING,
    VALIDATING,
    RETRYING,
    DONE_CHAT,
    DONE_COMMAND,
    FAILED;

    public boolean isTerminal() {
        return this == DONE_CHAT || this == DONE_COMMAND || this == FAILED;
    }
}
