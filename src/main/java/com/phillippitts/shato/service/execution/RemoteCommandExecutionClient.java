package com.phillippitts.shato.service.execution;

import com.phillippitts.shato.domain.CommandExecutionResult;
import com.phillippitts.shato.domain.CorrelationContext;
import com.phillippitts.shato.domain.ErrorCode;
import com.phillippitts.shato.exception.RequestCancelledException;
import com.phillippitts.shato.exception.UpstreamUnavailableException;
import com.phillippitts.shato.util.InterruptibleCalls;
import com.phillippitts.shato.util.LogSanitizer;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Calls a robot validator service over HTTP ({@code POST /execute_command}).
 */
public class RemoteCommandExecutionClient implements CommandExecutionClient {

    private static final Logger LOG = LogManager.getLogger(RemoteCommandExecutionClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String SERVICE = "robot-validator";

    private final OkHttpClient httpClient;
    private final String endpoint;

    public RemoteCommandExecutionClient(OkHttpClient sharedClient, String baseUrl, long timeoutMs) {
        Objects.requireNonNull(sharedClient, "sharedClient must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.httpClient = sharedClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.endpoint = baseUrl + "/execute_command";
    }

    @Override
    public CommandExecutionResult execute(String command, Map<String, Object> parameters,
                                          CorrelationContext correlation) {
        JSONObject body = new JSONObject();
        body.put("command", command);
        body.put("command_params", parameters == null ? new JSONObject() : new JSONObject(parameters));
        body.put("correlation_id", correlation.correlationId());

        Request request = new Request.Builder()
                .url(endpoint)
                .header(CorrelationContext.HEADER, correlation.correlationId())
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        LOG.info("Sending '{}' to robot validator at {}", command, endpoint);
        try (Response response = InterruptibleCalls.execute(httpClient.newCall(request))) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                LOG.warn("Robot validator returned HTTP {}: {}", response.code(), LogSanitizer.preview(text, 200));
                throw new UpstreamUnavailableException(SERVICE, "HTTP " + response.code());
            }
            return parse(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(correlation.correlationId(), "Interrupted while calling robot validator", e);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(SERVICE, "Request failed: " + e.getMessage(), e);
        }
    }

    static CommandExecutionResult parse(String text) {
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new UpstreamUnavailableException(SERVICE, "Malformed response body", e);
        }
        if (json.optBoolean("success", false)) {
            JSONObject params = json.optJSONObject("command_params");
            Map<String, Object> map = params == null ? Map.of() : new LinkedHashMap<>(params.toMap());
            return CommandExecutionResult.accepted(json.optString("message", ""),
                    json.optString("command", null), map);
        }
        String error = json.optString("error", "Command rejected by robot validator");
        ErrorCode code = ErrorCode.fromCode(json.optString("error_code", null));
        return CommandExecutionResult.rejected(code, error, json.optString("details", null));
    }
}
