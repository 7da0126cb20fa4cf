package com.phillippitts.shato.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationPropertiesTest {

    @Test
    void appliesDefaults() {
        GenerationProperties properties = new GenerationProperties(null, null, null, null, null, null, null, null);

        assertThat(properties.getMode()).isEqualTo(GenerationProperties.Mode.MODEL_RUNNER);
        assertThat(properties.getModelName()).isEqualTo("shato/gemma-270m-finetuned");
        assertThat(properties.getTimeoutMs()).isEqualTo(120_000L);
        assertThat(properties.getMaxTokens()).isEqualTo(512);
        assertThat(properties.getTemperature()).isEqualTo(0.1);
        assertThat(properties.getSystemPromptLocation()).isEqualTo("classpath:prompts/system_prompt.txt");
    }

    @Test
    void stripsTrailingSlashFromUrls() {
        GenerationProperties properties = new GenerationProperties(GenerationProperties.Mode.SERVICE,
                "http://runner:11434/v1/", null, "http://llm:8002/", null, null, null, null);

        assertThat(properties.getModelRunnerUrl()).isEqualTo("http://runner:11434/v1");
        assertThat(properties.getServiceUrl()).isEqualTo("http://llm:8002");
    }
}
