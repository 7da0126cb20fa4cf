package com.phillippitts.shato.service.health;

import com.phillippitts.shato.config.properties.GenerationProperties;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator for the generation collaborator.
 *
 * <p>In model-runner mode probes {@code GET <model-runner-url>/models}; in service mode probes
 * {@code GET <service-url>/health}. Any 2xx answer is UP.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ModelRunnerHealthIndicator implements HealthIndicator {

    private static final long PROBE_TIMEOUT_MS = 3_000;

    private final OkHttpClient httpClient;
    private final GenerationProperties properties;

    public ModelRunnerHealthIndicator(OkHttpClient sharedClient, GenerationProperties properties) {
        this.httpClient = sharedClient.newBuilder()
                .callTimeout(PROBE_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .build();
        this.properties = properties;
    }

    @Override
    public Health health() {
        String probeUrl = probeUrl();
        Request request = new Request.Builder().url(probeUrl).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return Health.up()
                        .withDetail("mode", properties.getMode().name())
                        .withDetail("endpoint", probeUrl)
                        .withDetail("model", properties.getModelName())
                        .build();
            }
            return Health.down()
                    .withDetail("mode", properties.getMode().name())
                    .withDetail("endpoint", probeUrl)
                    .withDetail("status", "HTTP " + response.code())
                    .build();
        } catch (IOException e) {
            return Health.down(e)
                    .withDetail("mode", properties.getMode().name())
                    .withDetail("endpoint", probeUrl)
                    .build();
        }
    }

    private String probeUrl() {
        if (properties.getMode() == GenerationProperties.Mode.SERVICE) {
            return properties.getServiceUrl() + "/health";
        }
        return properties.getModelRunnerUrl() + "/models";
    }
}
