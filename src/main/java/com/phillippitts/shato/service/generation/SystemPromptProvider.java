package com.phillippitts.shato.service.generation;

import com.phillippitts.shato.config.properties.GenerationProperties;
import com.phillippitts.shato.exception.ShatoException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the system prompt the model was fine-tuned with. Read once at construction.
 */
public class SystemPromptProvider {

    private static final Logger LOG = LogManager.getLogger(SystemPromptProvider.class);

    private final String systemPrompt;

    public SystemPromptProvider(ResourceLoader resourceLoader, GenerationProperties properties) {
        String location = properties.getSystemPromptLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ShatoException("System prompt not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            this.systemPrompt = StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ShatoException("Failed to read system prompt from " + location, e);
        }
        if (systemPrompt.isEmpty()) {
            throw new ShatoException("System prompt at " + location + " is empty");
        }
        LOG.info("System prompt loaded from {} ({} chars)", location, systemPrompt.length());
    }

    public String systemPrompt() {
        return systemPrompt;
    }
}
