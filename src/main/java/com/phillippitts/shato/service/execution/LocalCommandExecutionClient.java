package com.phillippitts.shato.service.execution;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CorrelationContext;
import com.phillippitts.shato.exception.RequestCancelledException;
import com.phillippitts.shato.exception.UpstreamUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the robot validator in-process on a dedicated executor with a bounded wait.
 */
public class LocalCommandExecutionClient implements CommandExecutionClient {

    private static final Logger LOG = LogManager.getLogger(LocalCommandExecutionClient.class);
    static final String SERVICE = "robot-validator";

    private final CommandExecutionService executionService;
    private final Executor executor;
    private final long timeoutMs;

    public LocalCommandExecutionClient(CommandExecutionService executionService, Executor executor, long timeoutMs) {
        this.executionService = Objects.requireNonNull(executionService, "executionService must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public CommandExecutionResult execute(String command, Map<String, Object> parameters,
                                          CorrelationContext correlation) {
        CompletableFuture<CommandExecutionResult> future =
                CompletableFuture.supplyAsync(() -> executionService.execute(command, parameters), executor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Validation of '{}' timed out after {}ms", command, timeoutMs);
            throw new UpstreamUnavailableException(SERVICE, "Validation timed out after " + timeoutMs + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Validation of '{}' failed", command, cause);
            throw new UpstreamUnavailableException(SERVICE, "Validation failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(correlation.correlationId(), "Interrupted while validating command", e);
        }
    }
}
