package fr.lapetina.mockllm.simulator;

import fr.lapetina.mockllm.domain.model.StreamEvent;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single-use stream of generated chunks, filled by the scheduler and drained by one consumer.
 *
 * Iteration blocks until the next event is produced and ends after {@link StreamEvent#END}
 * has been returned.
 */
public final class TokenStream implements Iterator<StreamEvent> {

    private final Duration thinkingDelay;
    private final BlockingQueue<StreamEvent> events = new LinkedBlockingQueue<>();
    private boolean finished;

    TokenStream(Duration thinkingDelay) {
        this.thinkingDelay = thinkingDelay;
    }

    /**
     * Delay sampled before the first chunk.
     */
    public Duration getThinkingDelay() {
        return thinkingDelay;
    }

    void emit(StreamEvent event) {
        events.add(event);
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public StreamEvent next() {
        if (finished) {
            throw new NoSuchElementException("Stream already terminated");
        }
        StreamEvent event;
        try {
            event = events.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the next chunk", e);
        }
        if (event.isTerminator()) {
            finished = true;
        }
        return event;
    }
}
