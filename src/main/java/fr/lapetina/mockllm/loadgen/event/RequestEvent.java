package fr.lapetina.mockllm.loadgen.event;

import fr.lapetina.mockllm.domain.model.RequestOutcome;

/**
 * Event object for the LMAX Disruptor ring buffer.
 *
 * Mutable holder reused across the ring buffer. Only the pipeline handlers may read it,
 * and only while they own the sequence.
 */
public final class RequestEvent {

    private RequestOutcome outcome;
    private long publishedAtNanos;

    public void clear() {
        this.outcome = null;
        this.publishedAtNanos = 0;
    }

    public void initialize(RequestOutcome outcome, long publishedAtNanos) {
        this.outcome = outcome;
        this.publishedAtNanos = publishedAtNanos;
    }

    public RequestOutcome getOutcome() {
        return outcome;
    }

    public long getPublishedAtNanos() {
        return publishedAtNanos;
    }

    @Override
    public String toString() {
        return "RequestEvent{outcome=" + outcome + "}";
    }
}
