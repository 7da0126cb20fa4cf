package com.phillippitts.shato.service.execution;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CorrelationContext;
import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.exception.RequestCancelledException;
import com.phillippitts.shato.exception.UpstreamUnavailableException;
import com.phillippitts.shato.testutil.ScheduledInterrupt;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteCommandExecutionClientTest {

    private static final CorrelationContext CORRELATION = new CorrelationContext("abcd1234");

    private MockWebServer mockServer;
    private RemoteCommandExecutionClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        String baseUrl = mockServer.url("/").toString().replaceAll("/$", "");
        client = new RemoteCommandExecutionClient(new OkHttpClient(), baseUrl, 500);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void postsCommandWithCorrelation() throws Exception {
        mockServer.enqueue(new MockResponse()
                .setBody("{\"success\":true,\"message\":\"ok. SIMULATION: Robot navigating to coordinates (5, 7)\","
                        + "\"command\":\"move_to\",\"command_params\":{\"x\":5,\"y\":7}}")
                .addHeader("Content-Type", "application/json"));

        client.execute("move_to", Map.of("x", 5, "y", 7), CORRELATION);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/execute_command");
        assertThat(request.getHeader(CorrelationContext.HEADER)).isEqualTo("abcd1234");
        JSONObject body = new JSONObject(request.getBody().readUtf8());
        assertThat(body.getString("command")).isEqualTo("move_to");
        assertThat(body.getJSONObject("command_params").getInt("x")).isEqualTo(5);
        assertThat(body.getString("correlation_id")).isEqualTo("abcd1234");
    }

    @Test
    void parsesAcceptedResult() {
        mockServer.enqueue(new MockResponse()
                .setBody("{\"success\":true,\"message\":\"done\",\"command\":\"rotate\","
                        + "\"command_params\":{\"angle\":90,\"direction\":\"clockwise\"}}"));

        CommandExecutionResult result = client.execute("rotate", Map.of(), CORRELATION);

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("done");
        assertThat(result.command()).isEqualTo("rotate");
        assertThat(result.commandParameters()).containsEntry("direction", "clockwise");
    }

    @Test
    void parsesRejectionWithErrorCode() {
        mockServer.enqueue(new MockResponse()
                .setBody("{\"success\":false,\"error\":\"Invalid command. Reason: Unknown command name 'fly'\","
                        + "\"details\":\"Valid commands are: move_to, rotate, start_patrol\",\"error_code\":\"UnknownCommand\"}"));

        CommandExecutionResult result = client.execute("fly", Map.of(), CORRELATION);

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.UNKNOWN_COMMAND);
        assertThat(result.error()).contains("fly");
        assertThat(result.details()).contains("start_patrol");
    }

    @Test
    void rejectionWithoutErrorCodeIsASchemaViolation() {
        mockServer.enqueue(new MockResponse().setBody("{\"success\":false,\"error\":\"bad\"}"));

        assertThat(client.execute("rotate", Map.of(), CORRELATION).errorCode()).isEqualTo(ErrorCode.SCHEMA_VIOLATION);
    }

    @Test
    void serverErrorIsUpstreamUnavailable() {
        mockServer.enqueue(new MockResponse().setResponseCode(500).setBody("Internal Server Error"));

        assertThatThrownBy(() -> client.execute("move_to", Map.of(), CORRELATION))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void malformedBodyIsUpstreamUnavailable() {
        mockServer.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        assertThatThrownBy(() -> client.execute("move_to", Map.of(), CORRELATION))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void slowServerIsUpstreamUnavailable() {
        mockServer.enqueue(new MockResponse()
                .setBody("{\"success\":true,\"message\":\"late\"}")
                .setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> client.execute("move_to", Map.of(), CORRELATION))
                .isInstanceOf(UpstreamUnavailableException.class)
                .satisfies(ex -> assertThat(((UpstreamUnavailableException) ex).getService()).isEqualTo("robot-validator"));
    }

    @Test
    void unreachableServerIsUpstreamUnavailable() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        String baseUrl = stopped.url("/").toString().replaceAll("/$", "");
        stopped.shutdown();
        RemoteCommandExecutionClient unreachable = new RemoteCommandExecutionClient(new OkHttpClient(), baseUrl, 500);

        assertThatThrownBy(() -> unreachable.execute("move_to", Map.of(), CORRELATION))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void interruptAbortsInFlightCall() {
        mockServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        String baseUrl = mockServer.url("/").toString().replaceAll("/$", "");
        RemoteCommandExecutionClient patientClient = new RemoteCommandExecutionClient(new OkHttpClient(), baseUrl, 10_000);

        long start = System.nanoTime();
        try (ScheduledInterrupt ignored = ScheduledInterrupt.ofCurrentThreadAfter(300)) {
            assertThatThrownBy(() -> patientClient.execute("move_to", Map.of("x", 1, "y", 2), CORRELATION))
                    .isInstanceOf(RequestCancelledException.class)
                    .hasMessageContaining("robot validator");
        }

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(2_000);
    }
}
