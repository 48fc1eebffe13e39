package fr.lapetina.mockllm.loadgen.event;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.mockllm.domain.model.RequestOutcome;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mockllm.loadgen.OutcomeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Disruptor pipeline fanning request outcomes out to the statistics, metrics and
 * slowness-alert handlers.
 *
 * PRODUCER TYPE: MULTI, every virtual user thread publishes concurrently.
 *
 * Handlers run in parallel on their own threads; each sees every outcome. Publishing
 * blocks while the ring buffer is full so no outcome is lost from the statistics.
 * {@link #close()} drains everything already published.
 */
public final class RequestEventPipeline implements OutcomeRecorder, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestEventPipeline.class);

    private static final EventTranslatorOneArg<RequestEvent, RequestOutcome> TRANSLATOR =
            (event, sequence, outcome) -> event.initialize(outcome, System.nanoTime());

    private final Disruptor<RequestEvent> disruptor;
    private final RingBuffer<RequestEvent> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    private final StatsHandler statsHandler;
    private final SlownessAlertHandler slownessAlertHandler;

    private RequestEventPipeline(Builder builder) {
        this.disruptor = new Disruptor<>(
                new RequestEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("outcome-handler"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        this.statsHandler = new StatsHandler();
        this.slownessAlertHandler = new SlownessAlertHandler(builder.slownessThreshold);

        List<EventHandler<RequestEvent>> handlers = new ArrayList<>();
        handlers.add(statsHandler);
        handlers.add(slownessAlertHandler);
        if (builder.metricsRegistry != null) {
            handlers.add(new MetricsHandler(builder.metricsRegistry));
        }

        @SuppressWarnings("unchecked")
        EventHandler<RequestEvent>[] array = handlers.toArray(new EventHandler[0]);
        disruptor.handleEventsWith(array);
        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("RequestEventPipeline created: ringBufferSize={}, waitStrategy={}, slownessThresholdMs={}, metrics={}",
                builder.ringBufferSize, builder.waitStrategy, builder.slownessThreshold.toMillis(),
                builder.metricsRegistry != null);
    }

    public RequestEventPipeline start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("RequestEventPipeline started");
        }
        return this;
    }

    /**
     * Publishes an outcome. Outcomes reported after {@link #close()} are dropped.
     */
    @Override
    public void report(RequestOutcome outcome) {
        if (!running.get()) {
            dropped.incrementAndGet();
            log.debug("Pipeline not running, outcome dropped: name={}", outcome.name());
            return;
        }
        ringBuffer.publishEvent(TRANSLATOR, outcome);
    }

    public StatsHandler getStatsHandler() {
        return statsHandler;
    }

    public SlownessAlertHandler getSlownessAlertHandler() {
        return slownessAlertHandler;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Waits for every published outcome to be handled, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down RequestEventPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("RequestEventPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("RequestEventPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class PipelineExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<RequestEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, RequestEvent event) {
            log.error("Exception in outcome handler: sequence={}, event={}", sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during pipeline start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during pipeline shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private Duration slownessThreshold = SlownessAlertHandler.DEFAULT_THRESHOLD;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder slownessThreshold(Duration threshold) {
            this.slownessThreshold = threshold;
            return this;
        }

        /**
         * Optional; without it outcomes are not exported as meters.
         */
        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public RequestEventPipeline build() {
            return new RequestEventPipeline(this);
        }
    }
}
