package fr.lapetina.mockllm.loadgen.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates ring buffer slots.
 */
public final class RequestEventFactory implements EventFactory<RequestEvent> {

    @Override
    public RequestEvent newInstance() {
        return new RequestEvent();
    }
}
