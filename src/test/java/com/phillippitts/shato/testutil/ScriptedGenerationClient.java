package com.phillippitts.shato.testutil;

import com.phillippitts.shato.domain.CommandProposal;
import com.phillippitts.shato.service.generation.GenerationClient;
import com.phillippitts.shato.service.generation.GenerationRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Generation client double that replays queued proposals and records every request.
 * Fails the test if asked for more proposals than were scripted.
 */
public class ScriptedGenerationClient implements GenerationClient {

    private final Deque<CommandProposal> script = new ArrayDeque<>();
    private final List<GenerationRequest> requests = new ArrayList<>();

    public ScriptedGenerationClient thenReturn(CommandProposal proposal) {
        script.addLast(proposal);
        return this;
    }

    @Override
    public CommandProposal generate(GenerationRequest request) {
        requests.add(request);
        if (script.isEmpty()) {
            throw new AssertionError("Unexpected generation call #" + requests.size());
        }
        return script.removeFirst();
    }

    public List<GenerationRequest> requests() {
        return requests;
    }

    public int callCount() {
        return requests.size();
    }
}
