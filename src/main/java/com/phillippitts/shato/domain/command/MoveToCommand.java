package com.phillippitts.shato.domain.command;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Navigate to absolute coordinates.
 *
 * @param x target x coordinate
 * @param y target y coordinate
 */
public record MoveToCommand(double x, double y) implements RobotCommand {

    public static final String NAME = "move_to";

    public static final CommandSchema SCHEMA = new CommandSchema(NAME, List.of(
            ParameterDefinition.required("x", ParameterKind.NUMBER),
            ParameterDefinition.required("y", ParameterKind.NUMBER)
    ), MoveToCommand::fromParameters);

    static MoveToCommand fromParameters(Map<String, Object> params) {
        return new MoveToCommand(
                ((Number) params.get("x")).doubleValue(),
                ((Number) params.get("y")).doubleValue());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("x", x);
        params.put("y", y);
        return params;
    }
}
