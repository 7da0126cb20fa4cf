package com.phillippitts.shato.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /generate_response}.
 *
 * @param userInput     user utterance
 * @param retryContext  validator feedback from a failed attempt (optional)
 * @param correlationId optional caller-supplied correlation id
 */
public record GenerateRequest(@JsonProperty("user_input") String userInput,
                              @JsonProperty("retry_context") String retryContext,
                              @JsonProperty("correlation_id") String correlationId) {
}
