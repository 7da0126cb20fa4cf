package com.phillippitts.shato.service.metrics;

import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.service.routing.RouterState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for request routing.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Routing latency and outcome per terminal state</li>
 *   <li>Corrective retries per validator error code</li>
 *   <li>Collaborator failures per service</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class RoutingMetrics {

    private static final String METRIC_PREFIX = "shato.routing";

    private final MeterRegistry registry;

    public RoutingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of a finished request and counts its outcome.
     *
     * @param outcome terminal router state
     * @param durationNanos duration in nanoseconds
     */
    public void recordOutcome(RouterState outcome, long durationNanos) {
        String tag = outcome.name().toLowerCase(Locale.ROOT);
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to route a request")
                .tag("outcome", tag)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of routed requests by terminal state")
                .tag("outcome", tag)
                .register(registry)
                .increment();
    }

    /**
     * Counts a corrective retry.
     *
     * @param reason validator error code that triggered the retry
     */
    public void incrementRetry(ErrorCode reason) {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Number of corrective generation retries")
                .tag("reason", reason == null ? "unknown" : reason.code())
                .register(registry)
                .increment();
    }

    /**
     * Counts a collaborator failure.
     *
     * @param service failing collaborator (model-runner, llm-service, robot-validator)
     */
    public void incrementUpstreamFailure(String service) {
        Counter.builder(METRIC_PREFIX + ".upstream.failure")
                .description("Number of requests aborted by a collaborator failure")
                .tag("service", service == null ? "unknown" : service)
                .register(registry)
                .increment();
    }
}
