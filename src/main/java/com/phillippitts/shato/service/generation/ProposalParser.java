package com.phillippitts.shato.service.generation;

import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the model's raw text into a {@link CommandProposal}.
 *
 * <p>Expected shape: {@code {"response": ..., "command": ..., "command_params": {...}}}. A blank or
 * absent command means a chat reply. Anything that is not a JSON object yields the fallback reply.
 */
@Component
public class ProposalParser {

    private static final Logger LOG = LogManager.getLogger(ProposalParser.class);

    public static final String FALLBACK_REPLY = "I'm ready to help with robot commands!";
    static final String DEFAULT_COMMAND_REPLY = "Command received";
    static final String DEFAULT_CHAT_REPLY = "I'm ready to help!";

    public CommandProposal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            LOG.warn("{}: empty model output, using fallback reply", ErrorCode.GENERATION_PARSE_ERROR.code());
            return CommandProposal.chat(FALLBACK_REPLY);
        }
        JSONObject json;
        try {
            json = new JSONObject(raw.strip());
        } catch (JSONException e) {
            LOG.warn("{}: {} (output: {})", ErrorCode.GENERATION_PARSE_ERROR.code(), e.getMessage(),
                    LogSanitizer.preview(raw, 200));
            return CommandProposal.chat(FALLBACK_REPLY);
        }
        return fromJson(json);
    }

    /**
     * Builds a proposal from an already parsed payload.
     *
     * @param json payload with {@code response}, {@code command} and {@code command_params}
     * @return proposal
     */
    public CommandProposal fromJson(JSONObject json) {
        String command = json.optString("command", "");
        if (json.isNull("command") || command.isBlank()) {
            return CommandProposal.chat(replyOr(json, DEFAULT_CHAT_REPLY));
        }
        JSONObject params = json.optJSONObject("command_params");
        Map<String, Object> parameters = params == null ? Map.of() : new LinkedHashMap<>(params.toMap());
        return CommandProposal.command(replyOr(json, DEFAULT_COMMAND_REPLY), command.strip(), parameters);
    }

    private static String replyOr(JSONObject json, String fallback) {
        if (json.isNull("response")) {
            return fallback;
        }
        return json.optString("response", fallback);
    }
}
