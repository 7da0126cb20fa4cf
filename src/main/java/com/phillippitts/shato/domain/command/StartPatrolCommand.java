package com.phillippitts.shato.domain.command;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Patrol a predefined route.
 *
 * <p>{@code speed} defaults to {@value #DEFAULT_SPEED} and {@code repeat_count} to
 * {@value #DEFAULT_REPEAT_COUNT} when absent. A repeat count of {@value #CONTINUOUS} means
 * continuous patrol; zero is rejected.
 *
 * @param routeId     route identifier
 * @param speed       patrol speed
 * @param repeatCount number of loops, or {@value #CONTINUOUS} for continuous patrol
 */
public record StartPatrolCommand(String routeId, String speed, long repeatCount) implements RobotCommand {

    public static final String NAME = "start_patrol";
    public static final String DEFAULT_SPEED = "medium";
    public static final long DEFAULT_REPEAT_COUNT = 1L;
    public static final long CONTINUOUS = -1L;

    public static final CommandSchema SCHEMA = new CommandSchema(NAME, List.of(
            ParameterDefinition.required("route_id", ParameterKind.ENUM,
                    ParameterDefinition.oneOf("first_floor", "bedrooms", "second_floor")),
            ParameterDefinition.optional("speed", ParameterKind.ENUM, DEFAULT_SPEED,
                    ParameterDefinition.oneOf("slow", "medium", "fast")),
            ParameterDefinition.optional("repeat_count", ParameterKind.INTEGER, DEFAULT_REPEAT_COUNT,
                    ParameterConstraint.Range.atLeast(CONTINUOUS),
                    new ParameterConstraint.NotEqual(0,
                            "repeat_count cannot be 0. Use -1 for continuous or >= 1 for finite loops"))
    ), StartPatrolCommand::fromParameters);

    public StartPatrolCommand {
        Objects.requireNonNull(routeId, "routeId must not be null");
        Objects.requireNonNull(speed, "speed must not be null");
    }

    static StartPatrolCommand fromParameters(Map<String, Object> params) {
        return new StartPatrolCommand(
                (String) params.get("route_id"),
                (String) params.get("speed"),
                ((Number) params.get("repeat_count")).longValue());
    }

    /**
     * @return {@code true} if the patrol repeats until stopped
     */
    public boolean isContinuous() {
        return repeatCount == CONTINUOUS;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("route_id", routeId);
        params.put("speed", speed);
        params.put("repeat_count", repeatCount);
        return params;
    }
}
