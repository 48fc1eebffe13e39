package fr.lapetina.mockllm.loadgen.event;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mockllm.domain.model.RequestOutcome;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;

/**
 * Records every outcome into the Micrometer registry.
 */
public final class MetricsHandler implements EventHandler<RequestEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        RequestOutcome outcome = event.getOutcome();
        if (outcome != null) {
            metricsRegistry.recordLoadTestRequest(outcome.name(), outcome.success(), outcome.responseTime());
        }
    }
}
