package com.phillippitts.shato.config.http;

import com.phillippitts.shato.config.properties.HttpClientProperties;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for calls to the generation and validator collaborators.
 *
 * <p>Clients derive per-collaborator call timeouts with {@code newBuilder()}, which shares the
 * connection pool and dispatcher of this instance. Calls run on the dispatcher (see
 * {@link com.phillippitts.shato.util.InterruptibleCalls}), so its limits bound concurrent
 * collaborator calls.
 */
@Configuration
public class OkHttpConfig {

    private final HttpClientProperties properties;

    public OkHttpConfig(HttpClientProperties properties) {
        this.properties = properties;
    }

    @Bean
    public OkHttpClient okHttpClient() {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(properties.getMaxRequests());
        dispatcher.setMaxRequestsPerHost(properties.getMaxRequestsPerHost());
        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectTimeout(properties.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(properties.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .writeTimeout(properties.getWriteTimeoutMs(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        properties.getMaxIdleConnections(),
                        properties.getKeepAliveMs(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(true)
                .build();
    }
}
