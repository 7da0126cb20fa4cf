package com.phillippitts.shato.service.generation;

import com.phillippitts.shato.domain.CommandProposal;

/**
 * Abstraction over the generative model that turns user text into a {@link CommandProposal}.
 *
 * <p>Implementations are blocking. Unparseable model output is absorbed into a conversational
 * fallback reply; transport failures are not.
 */
public interface GenerationClient {

    /**
     * Issues exactly one request to the model.
     *
     * @param request user text, optional retry feedback and correlation
     * @return parsed proposal, or the conversational fallback on parse failure
     * @throws com.phillippitts.shato.exception.UpstreamUnavailableException on transport failure,
     *         non-success status, or timeout
     * @throws com.phillippitts.shato.exception.RequestCancelledException if the calling thread is
     *         interrupted during the call
     */
    CommandProposal generate(GenerationRequest request);
}
