package fr.lapetina.mockllm.loadgen;

import fr.lapetina.mockllm.domain.model.RequestOutcome;

/**
 * Sink for request outcomes reported by virtual users. Must be safe for concurrent callers.
 */
@FunctionalInterface
public interface OutcomeRecorder {

    void report(RequestOutcome outcome);
}
