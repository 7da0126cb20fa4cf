/**
 * Request routing.
 *
 * <p>{@link com.phillippitts.shato.service.routing.CommandRouter} asks the generation client for a
 * proposal, sends commands to the robot validator and, after a first rejection, asks the model
 * once more with the validator's message as feedback. A second rejection ends the request in
 * {@link com.phillippitts.shato.service.routing.RouterState#FAILED}.
 */
package com.phillippitts.shato.service.routing;
