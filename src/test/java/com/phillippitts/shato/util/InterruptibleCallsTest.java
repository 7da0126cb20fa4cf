package com.phillippitts.shato.util;

import com.phillippitts.shato.testutil.ScheduledInterrupt;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterruptibleCallsTest {

    private MockWebServer mockServer;
    private OkHttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();
        client = new OkHttpClient.Builder()
                .callTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private Call newCall() {
        return client.newCall(new Request.Builder().url(mockServer.url("/ping")).build());
    }

    @Test
    void returnsResponse() throws Exception {
        mockServer.enqueue(new MockResponse().setResponseCode(202).setBody("ok"));

        try (Response response = InterruptibleCalls.execute(newCall())) {
            assertThat(response.code()).isEqualTo(202);
            assertThat(response.body().string()).isEqualTo("ok");
        }
    }

    @Test
    void propagatesTransportFailure() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        Request request = new Request.Builder().url(stopped.url("/ping")).build();
        stopped.shutdown();

        assertThatThrownBy(() -> InterruptibleCalls.execute(client.newCall(request)))
                .isInstanceOf(IOException.class);
    }

    @Test
    void interruptCancelsCallWithoutWaitingForServer() {
        mockServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        Call call = newCall();

        long start = System.nanoTime();
        try (ScheduledInterrupt ignored = ScheduledInterrupt.ofCurrentThreadAfter(300)) {
            assertThatThrownBy(() -> InterruptibleCalls.execute(call))
                    .isInstanceOf(InterruptedException.class);
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(call.isCanceled()).isTrue();
        assertThat(elapsedMs).isLessThan(2_000);
    }
}
