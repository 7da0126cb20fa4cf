package com.phillippitts.shato.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings of the shared OkHttp client. Collaborator-specific call timeouts are
 * configured on {@link GenerationProperties} and {@link ValidatorProperties}.
 */
@ConfigurationProperties(prefix = "shato.http")
public class HttpClientProperties {

    private long connectTimeoutMs = 5_000;
    private long readTimeoutMs = 30_000;
    private long writeTimeoutMs = 30_000;
    private int maxIdleConnections = 5;
    private long keepAliveMs = 300_000;
    private int maxRequests = 64;
    private int maxRequestsPerHost = 32;

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public long getWriteTimeoutMs() {
        return writeTimeoutMs;
    }

    public void setWriteTimeoutMs(long writeTimeoutMs) {
        this.writeTimeoutMs = writeTimeoutMs;
    }

    public int getMaxIdleConnections() {
        return maxIdleConnections;
    }

    public void setMaxIdleConnections(int maxIdleConnections) {
        this.maxIdleConnections = maxIdleConnections;
    }

    public long getKeepAliveMs() {
        return keepAliveMs;
    }

    public void setKeepAliveMs(long keepAliveMs) {
        this.keepAliveMs = keepAliveMs;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public void setMaxRequests(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    public int getMaxRequestsPerHost() {
        return maxRequestsPerHost;
    }

    public void setMaxRequestsPerHost(int maxRequestsPerHost) {
        this.maxRequestsPerHost = maxRequestsPerHost;
    }
}
