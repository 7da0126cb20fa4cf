package com.phillippitts.shato.service.validation;

import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.domain.ValidationOutcome;
import com.phillippitts.shato.domain.command.CommandSchema;
import com.phillippitts.shato.domain.command.ParameterConstraint;
import com.phillippitts.shato.domain.command.ParameterDefinition;
import com.phillippitts.shato.domain.command.ParameterKind;
import com.phillippitts.shato.domain.command.RobotCommand;
import com.phillippitts.shato.service.schema.CommandSchemaRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Enforces the closed command schema on a proposed command.
 *
 * <p>Parameters are checked in declaration order and validation stops at the first violation.
 * For each parameter: presence (or default), kind, then each constraint in turn. Unknown keys
 * are ignored. The validator is a pure function of its inputs; it never throws for bad input.
 */
@Component
public class CommandValidator {

    private static final Logger LOG = LogManager.getLogger(CommandValidator.class);

    private final CommandSchemaRegistry registry;

    public CommandValidator(CommandSchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Validates a command against its schema.
     *
     * @param commandName proposed command name
     * @param parameters  proposed parameters (nullable, treated as empty)
     * @return {@link ValidationOutcome.Valid} or {@link ValidationOutcome.Invalid}
     */
    public ValidationOutcome validate(String commandName, Map<String, Object> parameters) {
        Map<String, Object> params = parameters == null ? Map.of() : parameters;

        Optional<CommandSchema> schema = registry.schemaFor(commandName);
        if (schema.isEmpty()) {
            String message = "Invalid command. Reason: Unknown command name '" + commandName + "'";
            LOG.error("[ROBOT-VALIDATOR-ERROR] {}", message);
            return new ValidationOutcome.Invalid(ErrorCode.UNKNOWN_COMMAND, null, message,
                    "Valid commands are: " + String.join(", ", registry.commandNames()));
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        for (ParameterDefinition definition : schema.get().parameters()) {
            Optional<ValidationOutcome.Invalid> violation = checkParameter(commandName, definition, params, normalized);
            if (violation.isPresent()) {
                LOG.error("[ROBOT-VALIDATOR-ERROR] {}", violation.get().message());
                return violation.get();
            }
        }

        RobotCommand command = schema.get().bind(normalized);
        String message = "Received and validated command: '" + commandName + "' with params " + toJson(params);
        LOG.info("[ROBOT-VALIDATOR-SUCCESS] {}", message);
        return new ValidationOutcome.Valid(command, normalized, message);
    }

    private Optional<ValidationOutcome.Invalid> checkParameter(String commandName,
                                                              ParameterDefinition definition,
                                                              Map<String, Object> params,
                                                              Map<String, Object> normalized) {
        String field = definition.name();
        if (!params.containsKey(field)) {
            if (definition.required()) {
                return Optional.of(violation(commandName, field,
                        "Missing required key '" + field + "'", "type=missing"));
            }
            normalized.put(field, definition.defaultValue());
            return Optional.empty();
        }

        Object raw = params.get(field);
        Object value;
        if (definition.kind() == ParameterKind.ENUM) {
            // membership is checked by the OneOf constraint, which also reports non-string values
            value = raw;
        } else {
            Optional<Object> coerced = definition.kind().coerce(raw);
            if (coerced.isEmpty()) {
                return Optional.of(violation(commandName, field,
                        "Wrong data type for '" + field + "'. " + definition.kind().expectation(),
                        "type=" + definition.kind().name().toLowerCase() + "_type, input=" + raw));
            }
            value = coerced.get();
        }

        for (ParameterConstraint constraint : definition.constraints()) {
            Optional<String> failure = constraint.check(field, value);
            if (failure.isPresent()) {
                return Optional.of(violation(commandName, field, failure.get(),
                        "type=" + constraint.getClass().getSimpleName() + ", input=" + raw));
            }
        }

        normalized.put(field, value);
        return Optional.empty();
    }

    private static ValidationOutcome.Invalid violation(String commandName, String field, String detail, String raw) {
        return new ValidationOutcome.Invalid(ErrorCode.SCHEMA_VIOLATION, field,
                "Invalid params for '" + commandName + "': " + detail,
                "command_params -> " + field + ": " + raw);
    }

    /**
     * Renders parameters as a JSON object in the caller's key order.
     */
    static String toJson(Map<String, Object> params) {
        StringJoiner joiner = new StringJoiner(",", "{", "}");
        params.forEach((key, value) -> joiner.add(JSONObject.quote(key) + ":" + JSONObject.valueToString(value)));
        return joiner.toString();
    }
}
