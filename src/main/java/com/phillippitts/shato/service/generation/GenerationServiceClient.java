package com.phillippitts.shato.service.generation;

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
import org.json.JSONObject;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Calls a remote generation service ({@code POST /generate_response}).
 */
public class GenerationServiceClient implements GenerationClient {

    private static final Logger LOG = LogManager.getLogger(GenerationServiceClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String SERVICE = "llm-service";

    private final OkHttpClient httpClient;
    private final ProposalParser parser;
    private final String endpoint;

    public GenerationServiceClient(OkHttpClient sharedClient, String baseUrl, long timeoutMs, ProposalParser parser) {
        Objects.requireNonNull(sharedClient, "sharedClient must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.httpClient = sharedClient.newBuilder()
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        this.endpoint = baseUrl + "/generate_response";
    }

    @Override
    public CommandProposal generate(GenerationRequest request) {
        CorrelationContext correlation = request.correlation();
        JSONObject body = new JSONObject()
                .put("user_input", request.userText())
                .put("correlation_id", correlation.correlationId());
        if (request.isRetry()) {
            body.put("retry_context", request.retryFeedback());
        }

        Request httpRequest = new Request.Builder()
                .url(endpoint)
                .header(CorrelationContext.HEADER, correlation.correlationId())
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        LOG.info("Requesting {} from generation service at {}", request.isRetry() ? "retry" : "proposal", endpoint);
        try (Response response = InterruptibleCalls.execute(httpClient.newCall(httpRequest))) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                LOG.warn("Generation service returned HTTP {}: {}", response.code(), LogSanitizer.preview(text, 200));
                throw new UpstreamUnavailableException(SERVICE, "HTTP " + response.code());
            }
            return parser.parse(text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(correlation.correlationId(), "Interrupted while calling generation service", e);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(SERVICE, "Request failed: " + e.getMessage(), e);
        }
    }
}
