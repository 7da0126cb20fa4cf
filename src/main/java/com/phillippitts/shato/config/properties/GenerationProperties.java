package com.phillippitts.shato.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the generation collaborator.
 *
 * <p>Example application.properties:
 * <pre>
 * shato.generation.mode=model-runner
 * shato.generation.model-runner-url=http://localhost:11434/v1
 * shato.generation.model-name=shato/gemma-270m-finetuned
 * shato.generation.timeout-ms=120000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "shato.generation")
public class GenerationProperties {

    /**
     * Where proposals come from: an OpenAI-compatible model runner called directly, or a remote
     * generation service exposing {@code /generate_response}.
     */
    public enum Mode { MODEL_RUNNER, SERVICE }

    @NotNull
    private final Mode mode;

    @NotBlank
    private final String modelRunnerUrl;

    @NotBlank
    private final String modelName;

    @NotBlank
    private final String serviceUrl;

    /**
     * Per-call timeout. The model call is the dominant latency source, so this is long.
     */
    @Positive
    private final long timeoutMs;

    @Positive
    private final int maxTokens;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @NotBlank
    private final String systemPromptLocation;

    @ConstructorBinding
    public GenerationProperties(Mode mode,
                                String modelRunnerUrl,
                                String modelName,
                                String serviceUrl,
                                Long timeoutMs,
                                Integer maxTokens,
                                Double temperature,
                                String systemPromptLocation) {
        this.mode = mode == null ? Mode.MODEL_RUNNER : mode;
        this.modelRunnerUrl = modelRunnerUrl == null ? "http://localhost:11434/v1" : stripTrailingSlash(modelRunnerUrl);
        this.modelName = modelName == null ? "shato/gemma-270m-finetuned" : modelName;
        this.serviceUrl = serviceUrl == null ? "http://llm-service:8002" : stripTrailingSlash(serviceUrl);
        this.timeoutMs = timeoutMs == null ? 120_000L : timeoutMs;
        this.maxTokens = maxTokens == null ? 512 : maxTokens;
        this.temperature = temperature == null ? 0.1 : temperature;
        this.systemPromptLocation = systemPromptLocation == null
                ? "classpath:prompts/system_prompt.txt" : systemPromptLocation;
    }

    /**
     * Convenience constructor for tests: model-runner mode against the given URL with defaults.
     */
    public GenerationProperties(String modelRunnerUrl) {
        this(Mode.MODEL_RUNNER, modelRunnerUrl, null, null, null, null, null, null);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public Mode getMode() {
        return mode;
    }

    public String getModelRunnerUrl() {
        return modelRunnerUrl;
    }

    public String getModelName() {
        return modelName;
    }

    public String getServiceUrl() {
        return serviceUrl;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public String getSystemPromptLocation() {
        return systemPromptLocation;
    }
}
