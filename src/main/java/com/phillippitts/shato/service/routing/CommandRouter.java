package com.phillippitts.shato.service.routing;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.domain.CorrelationContext;
import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.exception.InvalidRequestException;
import com.phillippitts.shato.exception.RequestCancelledException;
import com.phillippitts.shato.exception.UpstreamUnavailableException;
import com.phillippitts.shato.service.execution.CommandExecutionClient;
import com.phillippitts.shato.service.generation.GenerationClient;
import com.phillippitts.shato.service.generation.GenerationRequest;
import com.phillippitts.shato.service.metrics.RoutingMetrics;
import com.phillippitts.shato.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Drives one request through generation, validation and at most one corrective retry.
 *
 * <p>Each call runs on the caller's thread and keeps all state on the stack, so one instance
 * serves concurrent requests. Generation always precedes validation, and the retried generation
 * starts only after the first validation has failed.
 *
 * <p>Collaborator exceptions ({@link UpstreamUnavailableException},
 * {@link RequestCancelledException}) propagate to the caller and never consume the retry.
 */
public class CommandRouter {

    private static final Logger LOG = LogManager.getLogger(CommandRouter.class);

    static final int MAX_GENERATION_ATTEMPTS = 2;

    private final GenerationClient generationClient;
    private final CommandExecutionClient executionClient;
    private final RoutingMetrics metrics;

    public CommandRouter(GenerationClient generationClient,
                         CommandExecutionClient executionClient,
                         RoutingMetrics metrics) {
        this.generationClient = Objects.requireNonNull(generationClient, "generationClient must not be null");
        this.executionClient = Objects.requireNonNull(executionClient, "executionClient must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Routes a user utterance to a chat reply, an accepted command, or a failure.
     *
     * @param userText    user utterance
     * @param correlation correlation of the request
     * @return terminal routing result
     * @throws InvalidRequestException if {@code userText} is blank
     * @throws UpstreamUnavailableException if a collaborator fails
     * @throws RequestCancelledException if the thread is interrupted mid-route
     */
    public RoutingResult route(String userText, CorrelationContext correlation) {
        Objects.requireNonNull(correlation, "correlation must not be null");
        if (userText == null || userText.isBlank()) {
            throw new InvalidRequestException("user_input is required");
        }

        long start = System.nanoTime();
        LOG.info("[ORCHESTRATOR] request_received correlation_id={} user_input={}",
                correlation, LogSanitizer.preview(userText, 120));

        RouterState state = RouterState.RECEIVED;
        CommandProposal proposal = null;
        CommandExecutionResult execution = null;
        String feedback = null;
        int attempts = 0;

        try {
            while (!state.isTerminal()) {
                checkNotCancelled(correlation, state);
                switch (state) {
                    case RECEIVED:
                    case RETRYING:
                        state = RouterState.GENERATING;
                        break;
                    case GENERATING:
                        attempts++;
                        proposal = generationClient.generate(new GenerationRequest(userText, feedback, correlation));
                        if (proposal.hasCommand()) {
                            LOG.info("[ORCHESTRATOR] command_detected correlation_id={} command={} attempt={}",
                                    correlation, proposal.command(), attempts);
                            state = RouterState.VALIDATING;
                        } else {
                            state = RouterState.DONE_CHAT;
                        }
                        break;
                    case VALIDATING:
                        execution = executionClient.execute(proposal.command(), proposal.parameters(), correlation);
                        state = afterValidation(execution, attempts, correlation);
                        if (state == RouterState.RETRYING) {
                            feedback = execution.error();
                            metrics.incrementRetry(execution.errorCode());
                        }
                        break;
                    default:
                        throw new IllegalStateException("Unhandled router state: " + state);
                }
            }
        } catch (UpstreamUnavailableException e) {
            metrics.incrementUpstreamFailure(e.getService());
            LOG.error("[ORCHESTRATOR] upstream_failure correlation_id={} state={} attempts={}: {}",
                    correlation, state, attempts, e.getMessage());
            throw e;
        }

        RoutingResult result = new RoutingResult(state, proposal, execution, attempts, correlation);
        long durationNanos = System.nanoTime() - start;
        metrics.recordOutcome(state, durationNanos);
        LOG.info("[ORCHESTRATOR] request_completed correlation_id={} status={} attempts={} duration_ms={} command={}",
                correlation, state, attempts, durationNanos / 1_000_000, proposal.command());
        return result;
    }

    private static RouterState afterValidation(CommandExecutionResult execution, int attempts,
                                               CorrelationContext correlation) {
        if (execution.success()) {
            return RouterState.DONE_COMMAND;
        }
        if (execution.errorCode() == ErrorCode.INTERNAL_ERROR) {
            LOG.error("[ORCHESTRATOR] internal_error correlation_id={} error={}", correlation, execution.error());
            return RouterState.FAILED;
        }
        if (attempts < MAX_GENERATION_ATTEMPTS) {
            LOG.info("[ORCHESTRATOR] validation_failed_retrying correlation_id={} error={}",
                    correlation, execution.error());
            return RouterState.RETRYING;
        }
        LOG.warn("[ORCHESTRATOR] validation_failed_final correlation_id={} error={}", correlation, execution.error());
        return RouterState.FAILED;
    }

    private static void checkNotCancelled(CorrelationContext correlation, RouterState state) {
        if (Thread.currentThread().isInterrupted()) {
            throw new RequestCancelledException(correlation.correlationId(),
                    "Request cancelled in state " + state);
        }
    }
}
