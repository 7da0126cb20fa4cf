package com.phillippitts.shato.service.simulation;

import com.phillippitts.shato.domain.SimulationResult;
import com.phillippitts.shato.domain.command.CommandSchema;
import com.phillippitts.shato.domain.command.MoveToCommand;
import com.phillippitts.shato.domain.command.RobotCommand;
import com.phillippitts.shato.domain.command.RotateCommand;
import com.phillippitts.shato.domain.command.StartPatrolCommand;
import com.phillippitts.shato.service.schema.CommandSchemaRegistry;
import com.phillippitts.shato.util.NumberFormats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces a deterministic description of what the robot would do for a validated command.
 *
 * <p>Never throws: a command outside the closed set (or parameters that cannot be bound) is
 * reported as an {@link com.phillippitts.shato.domain.ErrorCode#INTERNAL_ERROR} result.
 */
@Component
public class RobotSimulator {

    private static final Logger LOG = LogManager.getLogger(RobotSimulator.class);

    private final CommandSchemaRegistry registry;

    public RobotSimulator(CommandSchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Simulates a validated command.
     *
     * @param commandName         validated command name
     * @param validatedParameters normalized parameters from the validator
     * @return description of the simulated action, or an internal error
     */
    public SimulationResult simulate(String commandName, Map<String, Object> validatedParameters) {
        Optional<CommandSchema> schema = registry.schemaFor(commandName);
        if (schema.isEmpty()) {
            return internalError("Unknown command in simulation: " + commandName);
        }
        RobotCommand command;
        try {
            command = schema.get().bind(validatedParameters);
        } catch (RuntimeException e) {
            LOG.error("[ROBOT-SIMULATOR-ERROR] Cannot bind parameters {} for '{}'", validatedParameters, commandName, e);
            return internalError("Unbindable parameters in simulation for: " + commandName);
        }
        return simulate(command);
    }

    /**
     * Simulates a typed command.
     *
     * @param command typed command
     * @return description of the simulated action
     */
    public SimulationResult simulate(RobotCommand command) {
        String description;
        if (command instanceof MoveToCommand move) {
            description = "Robot navigating to coordinates ("
                    + NumberFormats.plain(move.x()) + ", " + NumberFormats.plain(move.y()) + ")";
        } else if (command instanceof RotateCommand rotate) {
            description = "Robot rotating " + NumberFormats.plain(rotate.angle()) + " degrees " + rotate.direction();
        } else if (command instanceof StartPatrolCommand patrol) {
            String repeat = patrol.isContinuous() ? "continuous patrol" : patrol.repeatCount() + " time(s)";
            description = "Robot starting " + patrol.routeId() + " patrol at " + patrol.speed()
                    + " speed, repeating " + repeat;
        } else {
            return internalError("Unknown command in simulation: " + (command == null ? null : command.name()));
        }
        LOG.info("[ROBOT-SIMULATOR] SIMULATION: {}", description);
        return SimulationResult.performed(description);
    }

    private static SimulationResult internalError(String message) {
        LOG.error("[ROBOT-SIMULATOR-ERROR] {}", message);
        return SimulationResult.internalError(message);
    }
}
