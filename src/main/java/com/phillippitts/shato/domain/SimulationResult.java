package com.phillippitts.shato.domain;

import java.util.Objects;

/**
 * Textual stand-in for driving the robot.
 *
 * @param description action description, or the internal error message
 * @param errorCode   {@code null} when the action was simulated, {@link ErrorCode#INTERNAL_ERROR} otherwise
 */
public record SimulationResult(String description, ErrorCode errorCode) {

    public SimulationResult {
        Objects.requireNonNull(description, "description must not be null");
    }

    public static SimulationResult performed(String description) {
        return new SimulationResult(description, null);
    }

    public static SimulationResult internalError(String message) {
        return new SimulationResult(message, ErrorCode.INTERNAL_ERROR);
    }

    /**
     * @return {@code true} if the action was simulated
     */
    public boolean isPerformed() {
        return errorCode == null;
    }
}
