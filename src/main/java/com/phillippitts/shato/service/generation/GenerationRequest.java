package com.phillippitts.shato.service.generation;

import com.phillippitts.shato.domain.CorrelationContext;

import java.util.Objects;

/**
 * One call to the generative model.
 *
 * @param userText      raw user utterance
 * @param retryFeedback validator message from the failed first attempt (nullable)
 * @param correlation   correlation of the current request
 */
public record GenerationRequest(String userText, String retryFeedback, CorrelationContext correlation) {

    static final String FEEDBACK_SEPARATOR = "\n\nPrevious error: ";

    public GenerationRequest {
        Objects.requireNonNull(userText, "userText must not be null");
        Objects.requireNonNull(correlation, "correlation must not be null");
        if (retryFeedback != null && retryFeedback.isBlank()) {
            retryFeedback = null;
        }
    }

    public static GenerationRequest firstAttempt(String userText, CorrelationContext correlation) {
        return new GenerationRequest(userText, null, correlation);
    }

    public static GenerationRequest retry(String userText, String feedback, CorrelationContext correlation) {
        return new GenerationRequest(userText, feedback, correlation);
    }

    public boolean isRetry() {
        return retryFeedback != null;
    }

    /**
     * @return user message content sent to the model, with the feedback appended on retries
     */
    public String userContent() {
        return isRetry() ? userText + FEEDBACK_SEPARATOR + retryFeedback : userText;
    }
}
