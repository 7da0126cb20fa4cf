package com.phillippitts.shato.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /process}.
 *
 * @param userInput     user utterance
 * @param correlationId optional caller-supplied correlation id
 */
public record ProcessRequest(@JsonProperty("user_input") String userInput,
                             @JsonProperty("correlation_id") String correlationId) {
}
