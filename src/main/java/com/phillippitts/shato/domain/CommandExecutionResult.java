package com.phillippitts.shato.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Response of the robot validator: a validated and simulated command, or a rejection.
 *
 * <p>On success {@code message}, {@code command} and {@code commandParameters} are set; on
 * failure {@code errorCode}, {@code error} and {@code details} are set.
 *
 * @param success           whether the command was accepted
 * @param message           validation message followed by the simulation description
 * @param command           accepted command name
 * @param commandParameters accepted (normalized) parameters
 * @param errorCode         failure category
 * @param error             failure message, fed back to the model on retry
 * @param details           failure detail
 */
public record CommandExecutionResult(boolean success,
                                     String message,
                                     String command,
                                     Map<String, Object> commandParameters,
                                     ErrorCode errorCode,
                                     String error,
                                     String details) {

    public CommandExecutionResult {
        commandParameters = commandParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(commandParameters));
        if (success) {
            Objects.requireNonNull(message, "message must not be null on success");
        } else {
            Objects.requireNonNull(errorCode, "errorCode must not be null on failure");
            Objects.requireNonNull(error, "error must not be null on failure");
        }
    }

    public static CommandExecutionResult accepted(String message, String command, Map<String, Object> parameters) {
        return new CommandExecutionResult(true, message, command, parameters, null, null, null);
    }

    public static CommandExecutionResult rejected(ErrorCode errorCode, String error, String details) {
        return new CommandExecutionResult(false, null, null, null, errorCode, error, details);
    }

    public static CommandExecutionResult rejected(ValidationOutcome.Invalid invalid) {
        return rejected(invalid.errorCode(), invalid.message(), invalid.details());
    }
}
