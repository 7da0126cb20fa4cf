package com.phillippitts.shato.presentation.controller;

import com.phillippitts.shato.service.generation.SystemPromptProvider;
import com.phillippitts.shato.service.health.ModelRunnerHealthIndicator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints reporting the generation collaborator's status.
 */
@RestController
class AdminController {

    private static final Logger LOG = LogManager.getLogger(AdminController.class);

    private final ModelRunnerHealthIndicator modelRunnerHealth;
    private final ObjectProvider<SystemPromptProvider> promptProvider;
    private final String serviceName;

    AdminController(ModelRunnerHealthIndicator modelRunnerHealth,
                    ObjectProvider<SystemPromptProvider> promptProvider,
                    @Value("${spring.application.name:shato-command-router}") String serviceName) {
        this.modelRunnerHealth = modelRunnerHealth;
        this.promptProvider = promptProvider;
        this.serviceName = serviceName;
    }

    @GetMapping("/stats")
    ResponseEntity<Map<String, Object>> stats() {
        SystemPromptProvider prompt = promptProvider.getIfAvailable();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model_runner_status", describe(modelRunnerHealth.health()));
        payload.put("prompt_loaded", prompt != null && !prompt.systemPrompt().isEmpty());
        payload.put("service", serviceName);
        return ResponseEntity.ok(payload);
    }

    /**
     * Re-probes the generation collaborator. The model itself is managed by the runner.
     */
    @PostMapping("/reload_model")
    ResponseEntity<Map<String, Object>> reloadModel() {
        Health health = modelRunnerHealth.health();
        boolean healthy = Status.UP.equals(health.getStatus());
        LOG.info("Model runner re-probed: {}", health.getStatus());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", healthy);
        payload.put("message", healthy ? "Model runner is healthy" : "Model runner not available");
        payload.put("model_status", describe(health));
        return ResponseEntity.ok(payload);
    }

    private static Map<String, Object> describe(Health health) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("health", health.getStatus().getCode());
        status.putAll(health.getDetails());
        return status;
    }
}
