package com.phillippitts.shato.service.execution;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.domain.SimulationResult;
import com.phillippitts.shato.domain.ValidationOutcome;
import com.phillippitts.shato.service.simulation.RobotSimulator;
import com.phillippitts.shato.service.validation.CommandValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;

/**
 * Robot validator: validates a command and, if it is valid, simulates it.
 *
 * <p>Backs both the {@code /execute_command} endpoint and the in-process
 * {@link LocalCommandExecutionClient}.
 */
@Service
public class CommandExecutionService {

    private static final Logger LOG = LogManager.getLogger(CommandExecutionService.class);

    private final CommandValidator validator;
    private final RobotSimulator simulator;

    public CommandExecutionService(CommandValidator validator, RobotSimulator simulator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.simulator = Objects.requireNonNull(simulator, "simulator must not be null");
    }

    /**
     * Validates and simulates a command.
     *
     * @param command    command name
     * @param parameters command parameters (nullable)
     * @return accepted result carrying the simulation, or a rejection
     */
    public CommandExecutionResult execute(String command, Map<String, Object> parameters) {
        LOG.info("[ROBOT-VALIDATOR] Received command request: {} with params {}", command, parameters);

        ValidationOutcome outcome = validator.validate(command, parameters);
        if (outcome instanceof ValidationOutcome.Invalid invalid) {
            return CommandExecutionResult.rejected(invalid);
        }

        ValidationOutcome.Valid valid = (ValidationOutcome.Valid) outcome;
        SimulationResult simulation = simulator.simulate(valid.command());
        if (!simulation.isPerformed()) {
            return CommandExecutionResult.rejected(ErrorCode.INTERNAL_ERROR,
                    "Internal error while simulating '" + command + "'", simulation.description());
        }
        return CommandExecutionResult.accepted(valid.message() + ". SIMULATION: " + simulation.description(),
                command, valid.normalizedParameters());
    }
}
