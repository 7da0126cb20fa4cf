package com.phillippitts.shato.domain.command;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rotate in place.
 *
 * @param angle     rotation angle in degrees
 * @param direction {@value #CLOCKWISE} or {@value #COUNTER_CLOCKWISE}
 */
public record RotateCommand(double angle, String direction) implements RobotCommand {

    public static final String NAME = "rotate";
    public static final String CLOCKWISE = "clockwise";
    public static final String COUNTER_CLOCKWISE = "counter-clockwise";

    public static final CommandSchema SCHEMA = new CommandSchema(NAME, List.of(
            ParameterDefinition.required("angle", ParameterKind.NUMBER),
            ParameterDefinition.required("direction", ParameterKind.ENUM,
                    ParameterDefinition.oneOf(CLOCKWISE, COUNTER_CLOCKWISE))
    ), RotateCommand::fromParameters);

    public RotateCommand {
        Objects.requireNonNull(direction, "direction must not be null");
    }

    static RotateCommand fromParameters(Map<String, Object> params) {
        return new RotateCommand(
                ((Number) params.get("angle")).doubleValue(),
                (String) params.get("direction"));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("angle", angle);
        params.put("direction", direction);
        return params;
    }
}
