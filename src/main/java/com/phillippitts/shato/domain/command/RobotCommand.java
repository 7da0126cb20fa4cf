package com.phillippitts.shato.domain.command;

import java.util.Map;

/**
 * Closed set of commands the robot understands. Each variant declares its own
 * {@link CommandSchema} and binds its typed fields from validated parameters.
 */
public sealed interface RobotCommand permits MoveToCommand, RotateCommand, StartPatrolCommand {

    /**
     * @return command name as used on the wire
     */
    String name();

    /**
     * @return normalized parameters of this command, in schema order
     */
    Map<String, Object> parameters();
}
