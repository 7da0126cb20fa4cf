package com.phillippitts.shato.service.generation;

import com.phillippitts.shato.config.properties.GenerationProperties;
import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.domain.CorrelationContext;
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
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Calls an OpenAI-compatible model runner ({@code POST /chat/completions}) directly.
 *
 * <p>Each call sends the system prompt and the user content, asks for a JSON object response and
 * parses {@code choices[0].message.content} as a proposal.
 */
public class ModelRunnerGenerationClient implements GenerationClient {

    private static final Logger LOG = LogManager.getLogger(ModelRunnerGenerationClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String SERVICE = "model-runner";

    private final OkHttpClient httpClient;
    private final GenerationProperties properties;
    private final SystemPromptProvider promptProvider;
    private final ProposalParser parser;
    private final String endpoint;

    public ModelRunnerGenerationClient(OkHttpClient sharedClient,
                                       GenerationProperties properties,
                                       SystemPromptProvider promptProvider,
                                       ProposalParser parser) {
        Objects.requireNonNull(sharedClient, "sharedClient must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.promptProvider = Objects.requireNonNull(promptProvider, "promptProvider must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.httpClient = sharedClient.newBuilder()
                .callTimeout(properties.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(properties.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
        this.endpoint = properties.getModelRunnerUrl() + "/chat/completions";
    }

    @Override
    public CommandProposal generate(GenerationRequest request) {
        CorrelationContext correlation = request.correlation();
        if (request.isRetry()) {
            LOG.info("Retrying generation with feedback: {}", LogSanitizer.preview(request.retryFeedback(), 200));
        } else {
            LOG.info("Generating proposal for: {}", LogSanitizer.preview(request.userText(), 120));
        }

        Request httpRequest = new Request.Builder()
                .url(endpoint)
                .header(CorrelationContext.HEADER, correlation.correlationId())
                .post(RequestBody.create(buildBody(request).toString(), JSON))
                .build();

        String content;
        try (Response response = InterruptibleCalls.execute(httpClient.newCall(httpRequest))) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                LOG.warn("Model runner returned HTTP {}: {}", response.code(), LogSanitizer.preview(text, 200));
                throw new UpstreamUnavailableException(SERVICE, "HTTP " + response.code());
            }
            content = extractContent(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(correlation.correlationId(), "Interrupted while calling model runner", e);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(SERVICE, "Request failed: " + e.getMessage(), e);
        }

        LOG.debug("Model raw output: {}", LogSanitizer.preview(content, 500));
        return parser.parse(content);
    }

    JSONObject buildBody(GenerationRequest request) {
        JSONArray messages = new JSONArray()
                .put(new JSONObject().put("role", "system").put("content", promptProvider.systemPrompt()))
                .put(new JSONObject().put("role", "user").put("content", request.userContent()));
        return new JSONObject()
                .put("model", properties.getModelName())
                .put("messages", messages)
                .put("max_tokens", properties.getMaxTokens())
                .put("temperature", properties.getTemperature())
                .put("response_format", new JSONObject().put("type", "json_object"))
                .put("stream", false);
    }

    /**
     * Pulls the assistant message out of a chat completion. A completion without content is
     * handed to the parser as empty text, which yields the fallback reply.
     */
    private static String extractContent(String text) {
        try {
            JSONObject json = new JSONObject(text);
            JSONArray choices = json.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                return "";
            }
            JSONObject message = choices.getJSONObject(0).optJSONObject("message");
            return message == null ? "" : message.optString("content", "");
        } catch (JSONException e) {
            LOG.warn("Unreadable chat completion: {}", e.getMessage());
            return "";
        }
    }
}
