package fr.lapetina.mockllm.loadgen.event;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mockllm.domain.model.RequestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Logs requests slower than a threshold, whatever their outcome.
 */
public final class SlownessAlertHandler implements EventHandler<RequestEvent> {

    private static final Logger log = LoggerFactory.getLogger(SlownessAlertHandler.class);

    public static final Duration DEFAULT_THRESHOLD = Duration.ofSeconds(4);

    private final Duration threshold;
    private final AtomicLong alerts = new AtomicLong();

    public SlownessAlertHandler(Duration threshold) {
        this.threshold = threshold;
    }

    public SlownessAlertHandler() {
        this(DEFAULT_THRESHOLD);
    }

    @Override
    public void onEvent(RequestEvent event, long sequence, boolean endOfBatch) {
        RequestOutcome outcome = event.getOutcome();
        if (outcome != null && outcome.responseTime().compareTo(threshold) > 0) {
            alerts.incrementAndGet();
            log.warn("[CRITICAL SLOWNESS] {} took {}ms", outcome.name(), outcome.responseTime().toMillis());
        }
    }

    public long getAlertCount() {
        return alerts.get();
    }

    public Duration getThreshold() {
        return threshold;
    }
}
