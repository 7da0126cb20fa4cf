package com.phillippitts.shato.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /execute_command}.
 *
 * @param command       command name
 * @param commandParams command parameters
 * @param correlationId optional caller-supplied correlation id
 */
public record ExecuteCommandRequest(@JsonProperty("command") String command,
                                    @JsonProperty("command_params") Map<String, Object> commandParams,
                                    @JsonProperty("correlation_id") String correlationId) {
}
