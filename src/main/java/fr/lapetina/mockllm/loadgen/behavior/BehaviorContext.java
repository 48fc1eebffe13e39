package fr.lapetina.mockllm.loadgen.behavior;

import fr.lapetina.mockllm.infrastructure.http.LoadHttpClient;
import fr.lapetina.mockllm.loadgen.OutcomeRecorder;
import fr.lapetina.mockllm.loadgen.SlaClassifier;
import fr.lapetina.mockllm.loadgen.TurnLatencyPoller;

import java.util.Objects;

/**
 * Collaborators shared by every virtual user of a run.
 *
 * @param client        HTTP client bound to the target base URL
 * @param recorder      outcome sink
 * @param slaClassifier success criteria of the direct agent endpoints
 * @param poller        turn-latency measurement for session backends
 * @param targetAgentId agent to converse with, or null to discover it
 */
public record BehaviorContext(
        LoadHttpClient client,
        OutcomeRecorder recorder,
        SlaClassifier slaClassifier,
        TurnLatencyPoller poller,
        String targetAgentId
) {
    public BehaviorContext {
        Objects.requireNonNull(client, "Client is required");
        Objects.requireNonNull(recorder, "Recorder is required");
        Objects.requireNonNull(slaClassifier, "SLA classifier is required");
        Objects.requireNonNull(poller, "Poller is required");
        if (targetAgentId != null && targetAgentId.isBlank()) {
            targetAgentId = null;
        }
    }
}
