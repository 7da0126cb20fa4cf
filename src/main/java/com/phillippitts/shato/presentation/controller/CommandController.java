package com.phillippitts.shato.presentation.controller;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.exception.InvalidRequestException;
import com.phillippitts.shato.service.execution.CommandExecutionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Robot validator endpoint. Rejections are regular 200 answers with {@code success: false}.
 */
@RestController
class CommandController {

    private final CommandExecutionService executionService;

    CommandController(CommandExecutionService executionService) {
        this.executionService = executionService;
    }

    @PostMapping("/execute_command")
    ResponseEntity<Map<String, Object>> executeCommand(@RequestBody ExecuteCommandRequest body,
                                                       HttpServletRequest request,
                                                       HttpServletResponse response) {
        CorrelationResolver.resolve(request, response, body.correlationId());
        if (body.command() == null || body.command().isBlank()) {
            throw new InvalidRequestException("command is required");
        }
        CommandExecutionResult result = executionService.execute(body.command(), body.commandParams());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", result.success());
        if (result.success()) {
            payload.put("message", result.message());
            payload.put("command", result.command());
            payload.put("command_params", result.commandParameters());
        } else {
            payload.put("error", result.error());
            payload.put("details", result.details());
            payload.put("error_code", result.errorCode().code());
        }
        return ResponseEntity.ok(payload);
    }
}
