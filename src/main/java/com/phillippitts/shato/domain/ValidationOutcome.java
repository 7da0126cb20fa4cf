package com.phillippitts.shato.domain;

import com.phillippitts.shato.domain.command.RobotCommand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of validating a command proposal against the command schema: exactly one of
 * {@link Valid} or {@link Invalid}.
 */
public sealed interface ValidationOutcome permits ValidationOutcome.Valid, ValidationOutcome.Invalid {

    /**
     * @return {@code true} for {@link Valid}
     */
    boolean isValid();

    /**
     * Proposal matched its schema.
     *
     * @param command              typed command bound from the normalized parameters
     * @param normalizedParameters parameters with kinds normalized and defaults applied
     * @param message              human-readable confirmation
     */
    record Valid(RobotCommand command, Map<String, Object> normalizedParameters, String message)
            implements ValidationOutcome {

        public Valid {
            Objects.requireNonNull(command, "command must not be null");
            Objects.requireNonNull(message, "message must not be null");
            normalizedParameters = Collections.unmodifiableMap(new LinkedHashMap<>(normalizedParameters));
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    /**
     * Proposal was rejected.
     *
     * @param errorCode {@link ErrorCode#UNKNOWN_COMMAND} or {@link ErrorCode#SCHEMA_VIOLATION}
     * @param field     offending parameter name, {@code null} for unknown commands
     * @param message   human-readable message, also used as retry feedback
     * @param details   raw detail (valid command names, or the violated rule)
     */
    record Invalid(ErrorCode errorCode, String field, String message, String details)
            implements ValidationOutcome {

        public Invalid {
            Objects.requireNonNull(errorCode, "errorCode must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
