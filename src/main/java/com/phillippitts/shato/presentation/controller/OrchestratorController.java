package com.phillippitts.shato.presentation.controller;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.domain.CorrelationContext;
import com.phillippitts.shato.service.routing.CommandRouter;
import com.phillippitts.shato.service.routing.RoutingResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of the pipeline: routes a user utterance to a chat reply or a validated command.
 *
 * <p>Chat replies and accepted commands answer 200. A request that ends in FAILED answers 422
 * with the last proposal and the validator's error.
 */
@RestController
class OrchestratorController {

    private final CommandRouter router;

    OrchestratorController(CommandRouter router) {
        this.router = router;
    }

    @PostMapping("/process")
    ResponseEntity<Map<String, Object>> process(@RequestBody ProcessRequest body,
                                                HttpServletRequest request,
                                                HttpServletResponse response) {
        CorrelationContext correlation = CorrelationResolver.resolve(request, response, body.correlationId());
        RoutingResult result = router.route(body.userInput(), correlation);

        Map<String, Object> payload = proposalPayload(result.proposal());
        CommandExecutionResult execution = result.execution();
        if (execution != null) {
            payload.put("validation_result", result.validationResult().orElse(null));
        }
        if (result.isFailed()) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("code", execution.errorCode().code());
            error.put("message", execution.error());
            error.put("details", execution.details());
            payload.put("error", error);
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(payload);
        }
        return ResponseEntity.ok(payload);
    }

    static Map<String, Object> proposalPayload(CommandProposal proposal) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("response", proposal.replyText());
        payload.put("command", proposal.command());
        payload.put("command_params", proposal.hasCommand() ? proposal.parameters() : null);
        return payload;
    }
}
