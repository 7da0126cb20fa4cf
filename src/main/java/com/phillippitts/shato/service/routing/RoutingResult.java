package com.phillippitts.shato.service.routing;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.domain.CorrelationContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Final outcome of routing one request.
 *
 * @param state              terminal state
 * @param proposal           last proposal returned by the generation client
 * @param execution          last validator result, or {@code null} if validation never ran
 * @param generationAttempts number of generation calls made (1 or 2)
 * @param correlation        correlation of the request
 */
public record RoutingResult(RouterState state,
                            CommandProposal proposal,
                            CommandExecutionResult execution,
                            int generationAttempts,
                            CorrelationContext correlation) {

    public RoutingResult {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(proposal, "proposal must not be null");
        Objects.requireNonNull(correlation, "correlation must not be null");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("RoutingResult requires a terminal state, got " + state);
        }
    }

    public boolean isFailed() {
        return state == RouterState.FAILED;
    }

    public boolean isRetried() {
        return generationAttempts > 1;
    }

    /**
     * @return validator message when the final validation succeeded, empty otherwise
     */
    public Optional<String> validationResult() {
        if (state == RouterState.DONE_COMMAND && execution != null && execution.success()) {
            return Optional.ofNullable(execution.message());
        }
        return Optional.empty();
    }
}
