package com.phillippitts.shato.service.schema;

import com.phillippitts.shato.domain.command.CommandSchema;
import com.phillippitts.shato.domain.command.MoveToCommand;
import com.phillippitts.shato.domain.command.RotateCommand;
import com.phillippitts.shato.domain.command.StartPatrolCommand;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static table of the commands the robot understands.
 *
 * <p>Built once and never mutated afterwards, so it is shared across request threads without
 * locking.
 */
@Component
public class CommandSchemaRegistry {

    private final Map<String, CommandSchema> schemas;

    public CommandSchemaRegistry() {
        this(List.of(MoveToCommand.SCHEMA, RotateCommand.SCHEMA, StartPatrolCommand.SCHEMA));
    }

    CommandSchemaRegistry(List<CommandSchema> schemas) {
        Map<String, CommandSchema> byName = new LinkedHashMap<>();
        for (CommandSchema schema : schemas) {
            if (byName.putIfAbsent(schema.name(), schema) != null) {
                throw new IllegalArgumentException("Duplicate command schema: " + schema.name());
            }
        }
        this.schemas = Collections.unmodifiableMap(byName);
    }

    /**
     * Looks up the schema of a command.
     *
     * @param commandName command name (nullable)
     * @return schema, or empty for unknown commands
     */
    public Optional<CommandSchema> schemaFor(String commandName) {
        return commandName == null ? Optional.empty() : Optional.ofNullable(schemas.get(commandName));
    }

    /**
     * @return known command names in declaration order
     */
    public List<String> commandNames() {
        return List.copyOf(schemas.keySet());
    }
}
