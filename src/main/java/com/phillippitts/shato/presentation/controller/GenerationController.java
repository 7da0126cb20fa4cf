package com.phillippitts.shato.presentation.controller;

import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.domain.CorrelationContext;
import com.phillippitts.shato.exception.InvalidRequestException;
import com.phillippitts.shato.service.generation.GenerationClient;
import com.phillippitts.shato.service.generation.GenerationRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Exposes the generation client over HTTP, so other pipelines can use this service as their
 * generation collaborator.
 */
@RestController
class GenerationController {

    private final GenerationClient generationClient;

    GenerationController(GenerationClient generationClient) {
        this.generationClient = generationClient;
    }

    @PostMapping("/generate_response")
    ResponseEntity<Map<String, Object>> generate(@RequestBody GenerateRequest body,
                                                 HttpServletRequest request,
                                                 HttpServletResponse response) {
        CorrelationContext correlation = CorrelationResolver.resolve(request, response, body.correlationId());
        if (body.userInput() == null || body.userInput().isBlank()) {
            throw new InvalidRequestException("user_input is required");
        }
        CommandProposal proposal = generationClient.generate(
                new GenerationRequest(body.userInput(), body.retryContext(), correlation));
        return ResponseEntity.ok(OrchestratorController.proposalPayload(proposal));
    }
}
