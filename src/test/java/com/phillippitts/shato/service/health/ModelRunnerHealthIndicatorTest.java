package com.phillippitts.shato.service.health;

import com.phillippitts.shato.config.properties.GenerationProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ModelRunnerHealthIndicatorTest {

    private MockWebServer mockServer;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private String baseUrl() {
        return mockServer.url("/").toString().replaceAll("/$", "");
    }

    @Test
    void shouldReportUpWhenModelsEndpointAnswers() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"data\":[{\"id\":\"shato/gemma-270m-finetuned\"}]}"));
        ModelRunnerHealthIndicator indicator =
                new ModelRunnerHealthIndicator(new OkHttpClient(), new GenerationProperties(baseUrl() + "/v1"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("model", "shato/gemma-270m-finetuned");
        assertThat(mockServer.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/v1/models");
    }

    @Test
    void shouldReportDownOnErrorStatus() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));
        ModelRunnerHealthIndicator indicator =
                new ModelRunnerHealthIndicator(new OkHttpClient(), new GenerationProperties(baseUrl()));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "HTTP 503");
    }

    @Test
    void shouldReportDownWhenUnreachable() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String url = stopped.url("/").toString().replaceAll("/$", "");
        stopped.shutdown();
        ModelRunnerHealthIndicator indicator =
                new ModelRunnerHealthIndicator(new OkHttpClient(), new GenerationProperties(url));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void shouldProbeServiceHealthInServiceMode() throws Exception {
        mockServer.enqueue(new MockResponse().setBody("{\"status\":\"healthy\"}"));
        GenerationProperties properties = new GenerationProperties(GenerationProperties.Mode.SERVICE,
                null, null, baseUrl(), null, null, null, null);

        Health health = new ModelRunnerHealthIndicator(new OkHttpClient(), properties).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(mockServer.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/health");
    }
}
