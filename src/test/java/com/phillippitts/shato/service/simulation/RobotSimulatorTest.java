package com.phillippitts.shato.service.simulation;

import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.domain.SimulationResult;
import com.phillippitts.shato.domain.command.MoveToCommand;
import com.phillippitts.shato.domain.command.RotateCommand;
import com.phillippitts.shato.domain.command.StartPatrolCommand;
import com.phillippitts.shato.service.schema.CommandSchemaRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RobotSimulatorTest {

    private RobotSimulator simulator;

    @BeforeEach
    void setUp() {
        simulator = new RobotSimulator(new CommandSchemaRegistry());
    }

    @Test
    void describesNavigationWithPlainCoordinates() {
        SimulationResult result = simulator.simulate(new MoveToCommand(5.0, 7.0));

        assertThat(result.isPerformed()).isTrue();
        assertThat(result.description()).isEqualTo("Robot navigating to coordinates (5, 7)");
    }

    @Test
    void keepsFractionalCoordinates() {
        assertThat(simulator.simulate(new MoveToCommand(1.5, -2.25)).description())
                .contains("(1.5, -2.25)");
    }

    @Test
    void describesRotation() {
        assertThat(simulator.simulate(new RotateCommand(90.0, RotateCommand.COUNTER_CLOCKWISE)).description())
                .isEqualTo("Robot rotating 90 degrees counter-clockwise");
    }

    @Test
    void describesContinuousPatrol() {
        assertThat(simulator.simulate(new StartPatrolCommand("bedrooms", "medium", -1)).description())
                .isEqualTo("Robot starting bedrooms patrol at medium speed, repeating continuous patrol");
    }

    @Test
    void describesFinitePatrol() {
        assertThat(simulator.simulate(new StartPatrolCommand("first_floor", "fast", 3)).description())
                .endsWith("repeating 3 time(s)");
    }

    @Test
    void simulatesFromValidatedParameters() {
        SimulationResult result = simulator.simulate("move_to", Map.of("x", 5.0, "y", 7.0));

        assertThat(result.description()).contains("(5, 7)");
    }

    @Test
    void unknownCommandIsAnInternalError() {
        SimulationResult result = simulator.simulate("fly", Map.of());

        assertThat(result.isPerformed()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(result.description()).contains("fly");
    }

    @Test
    void unbindableParametersAreAnInternalError() {
        SimulationResult result = simulator.simulate("rotate", Map.of("angle", "ninety"));

        assertThat(result.errorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
    }

    @Test
    void nullCommandIsAnInternalError() {
        assertThat(simulator.simulate(null).isPerformed()).isFalse();
    }

    @Test
    void simulationIsDeterministic() {
        StartPatrolCommand patrol = new StartPatrolCommand("second_floor", "slow", 2);

        assertThat(simulator.simulate(patrol)).isEqualTo(simulator.simulate(patrol));
    }
}
