package com.phillippitts.shato.service.execution;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CorrelationContext;

import java.util.Map;

/**
 * Access to the robot validator from the router.
 *
 * <p>Schema violations come back as unsuccessful {@link CommandExecutionResult}s. Exceptions are
 * reserved for transport problems.
 */
public interface CommandExecutionClient {

    /**
     * Validates and simulates a proposed command.
     *
     * @param command     proposed command name
     * @param parameters  proposed parameters (nullable)
     * @param correlation correlation of the current request
     * @return validator result
     * @throws com.phillippitts.shato.exception.UpstreamUnavailableException if the validator cannot
     *         be reached, fails, or times out
     * @throws com.phillippitts.shato.exception.RequestCancelledException if the calling thread is
     *         interrupted while waiting
     */
    CommandExecutionResult execute(String command, Map<String, Object> parameters, CorrelationContext correlation);
}
