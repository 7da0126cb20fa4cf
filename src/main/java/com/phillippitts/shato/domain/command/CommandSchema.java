package com.phillippitts.shato.domain.command;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ordered parameter schema of one robot command, together with the binder that turns
 * normalized parameters into the command's typed record.
 *
 * @param name       command name
 * @param parameters parameter definitions in declaration (validation) order
 * @param binder     creates the typed command from normalized parameters
 */
public record CommandSchema(String name,
                            List<ParameterDefinition> parameters,
                            Function<Map<String, Object>, ? extends RobotCommand> binder) {

    public CommandSchema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(binder, "binder must not be null");
        parameters = List.copyOf(parameters);
    }

    /**
     * Binds normalized parameters to the typed command.
     *
     * @param normalized parameters that already passed validation against this schema
     * @return typed command
     */
    public RobotCommand bind(Map<String, Object> normalized) {
        return binder.apply(normalized);
    }
}
