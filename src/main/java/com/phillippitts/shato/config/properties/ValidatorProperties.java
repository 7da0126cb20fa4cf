package com.phillippitts.shato.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the robot validator collaborator.
 */
@Validated
@ConfigurationProperties(prefix = "shato.validator")
public class ValidatorProperties {

    /** In-process validation, or a remote robot validator exposing {@code /execute_command}. */
    public enum Mode { LOCAL, REMOTE }

    @NotNull
    private final Mode mode;

    @NotBlank
    private final String url;

    /**
     * Per-call timeout. Validation does no network-bound work of its own, so this is short.
     */
    @Positive
    private final long timeoutMs;

    @ConstructorBinding
    public ValidatorProperties(Mode mode, String url, Long timeoutMs) {
        this.mode = mode == null ? Mode.LOCAL : mode;
        this.url = url == null ? "http://robot-validator:8000" : (url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        this.timeoutMs = timeoutMs == null ? 30_000L : timeoutMs;
    }

    public Mode getMode() {
        return mode;
    }

    public String getUrl() {
        return url;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
