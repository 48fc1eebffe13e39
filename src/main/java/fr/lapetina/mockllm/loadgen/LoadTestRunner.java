package fr.lapetina.mockllm.loadgen;

import fr.lapetina.mockllm.domain.model.Stage;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mockllm.loadgen.behavior.BehaviorContext;
import fr.lapetina.mockllm.loadgen.behavior.UserBehaviorFactory;
import fr.lapetina.mockllm.loadgen.event.RequestEventPipeline;
import fr.lapetina.mockllm.loadgen.event.RequestStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Drives a staged load test.
 *
 * Every tick the load shape gives the target population; the runner starts or stops at
 * most {@code spawnRate x tickInterval} users to converge on it. Stopped users finish
 * their current task before exiting. The run ends when the shape is exhausted (or on
 * {@link #requestStop()}), after which every outcome is drained and a summary is logged.
 */
public final class LoadTestRunner {

    private static final Logger log = LoggerFactory.getLogger(LoadTestRunner.class);

    private final LoadShapeScheduler shape;
    private final BehaviorContext context;
    private final WeightedSelector<String> userMix;
    private final RequestEventPipeline pipeline;
    private final MetricsRegistry metricsRegistry;
    private final Duration tickInterval;
    private final Duration shutdownGrace;
    private final Duration sleepChunk;
    private final Random random;
    private final LongSupplier nanoClock;

    private final List<VirtualUser> activeUsers = new ArrayList<>();
    private final List<VirtualUser> stoppingUsers = new ArrayList<>();
    private final AtomicInteger nextUserId = new AtomicInteger();
    private volatile boolean stopRequested;
    private volatile int activeUserCount;
    private volatile int peakUserCount;

    private LoadTestRunner(Builder builder) {
        this.shape = builder.shape;
        this.context = builder.context;
        this.userMix = builder.userMix;
        this.pipeline = builder.pipeline;
        this.metricsRegistry = builder.metricsRegistry;
        this.tickInterval = builder.tickInterval;
        this.shutdownGrace = builder.shutdownGrace;
        this.sleepChunk = builder.sleepChunk;
        this.random = builder.random;
        this.nanoClock = builder.nanoClock;
    }

    /**
     * Runs the whole shape on the calling thread.
     *
     * @return per-request-name statistics of the run
     */
    public List<RequestStats.Summary> run() throws InterruptedException {
        ExecutorService executor = Executors.newCachedThreadPool(new UserThreadFactory());
        long start = nanoClock.getAsLong();
        int lastStageIndex = -2;

        log.info("Load test started: stages={}, totalDurationMs={}, userMix={}, tickIntervalMs={}",
                shape.getStages().size(), shape.totalDuration().toMillis(),
                userMix.getItems(), tickInterval.toMillis());

        try {
            while (!stopRequested) {
                Duration elapsed = Duration.ofNanos(nanoClock.getAsLong() - start);
                int stageIndex = shape.stageIndex(elapsed);
                if (stageIndex < 0) {
                    log.info("Load shape exhausted: elapsedMs={}", elapsed.toMillis());
                    break;
                }

                Stage stage = shape.getStages().get(stageIndex);
                if (stageIndex != lastStageIndex) {
                    log.info("Entering stage {}: targetUsers={}, spawnRate={}, endsAtMs={}",
                            stageIndex + 1, stage.concurrency(), stage.spawnRate(), stage.endsAt().toMillis());
                    lastStageIndex = stageIndex;
                }

                adjustPopulation(stage, executor);
                Thread.sleep(tickInterval.toMillis());
            }
        } finally {
            stopAll(executor);
        }

        pipeline.close();
        List<RequestStats.Summary> summaries = pipeline.getStatsHandler().getSummaries();
        logSummary(summaries);
        return summaries;
    }

    /**
     * Moves the population towards the stage target by at most one tick's worth of spawns.
     */
    void adjustPopulation(Stage stage, ExecutorService executor) {
        activeUsers.removeIf(VirtualUser::isFinished);
        stoppingUsers.removeIf(VirtualUser::isFinished);

        int maxChange = maxChangePerTick(stage.spawnRate(), tickInterval);
        int delta = stage.concurrency() - activeUsers.size();

        if (delta > 0) {
            int toStart = Math.min(delta, maxChange);
            for (int i = 0; i < toStart; i++) {
                String type = userMix.select(random);
                VirtualUser user = new VirtualUser(
                        nextUserId.incrementAndGet(),
                        UserBehaviorFactory.create(type, context),
                        new Random(random.nextLong()),
                        sleepChunk
                );
                activeUsers.add(user);
                executor.execute(user);
            }
            log.debug("Spawned users: count={}, active={}", toStart, activeUsers.size());
        } else if (delta < 0) {
            int toStop = Math.min(-delta, maxChange);
            for (int i = 0; i < toStop; i++) {
                VirtualUser user = activeUsers.remove(activeUsers.size() - 1);
                user.requestStop();
                stoppingUsers.add(user);
            }
            log.debug("Stopping users: count={}, active={}", toStop, activeUsers.size());
        }

        activeUserCount = activeUsers.size();
        peakUserCount = Math.max(peakUserCount, activeUserCount);
        if (metricsRegistry != null) {
            metricsRegistry.setActiveUsers(activeUserCount);
        }
    }

    static int maxChangePerTick(int spawnRate, Duration tickInterval) {
        return Math.max(1, (int) Math.ceil(spawnRate * tickInterval.toMillis() / 1000.0));
    }

    private void stopAll(ExecutorService executor) throws InterruptedException {
        for (VirtualUser user : activeUsers) {
            user.requestStop();
        }
        stoppingUsers.addAll(activeUsers);
        activeUsers.clear();
        activeUserCount = 0;
        if (metricsRegistry != null) {
            metricsRegistry.setActiveUsers(0);
        }

        long deadline = System.nanoTime() + shutdownGrace.toNanos();
        Iterator<VirtualUser> it = stoppingUsers.iterator();
        while (it.hasNext()) {
            VirtualUser user = it.next();
            long remaining = deadline - System.nanoTime();
            if (remaining > 0 && user.awaitFinished(Duration.ofNanos(remaining))) {
                it.remove();
            }
        }
        if (!stoppingUsers.isEmpty()) {
            log.warn("Users still busy after grace period, interrupting: count={}", stoppingUsers.size());
        }

        executor.shutdownNow();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Virtual user threads did not terminate");
        }
        stoppingUsers.clear();
    }

    private void logSummary(List<RequestStats.Summary> summaries) {
        log.info("Load test finished: peakUsers={}, requestNames={}", peakUserCount, summaries.size());
        for (RequestStats.Summary summary : summaries) {
            log.info("{} {}: requests={}, failures={}, avgMs={}, minMs={}, maxMs={}",
                    summary.requestType(), summary.name(), summary.count(), summary.failures(),
                    Math.round(summary.avgMillis()), summary.minMillis(), summary.maxMillis());
            for (Map.Entry<String, Long> failure : summary.failureMessages().entrySet()) {
                log.info("    {} x{}", failure.getKey(), failure.getValue());
            }
        }
    }

    /**
     * Ends the run at the next tick.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public int getActiveUserCount() {
        return activeUserCount;
    }

    public int getPeakUserCount() {
        return peakUserCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class UserThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "virtual-user-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    public static final class Builder {
        private LoadShapeScheduler shape = LoadShapeScheduler.defaultShape();
        private BehaviorContext context;
        private WeightedSelector<String> userMix;
        private RequestEventPipeline pipeline;
        private MetricsRegistry metricsRegistry;
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private Duration sleepChunk = VirtualUser.DEFAULT_SLEEP_CHUNK;
        private Random random = new Random();
        private LongSupplier nanoClock = System::nanoTime;

        public Builder shape(LoadShapeScheduler shape) {
            this.shape = shape;
            return this;
        }

        public Builder context(BehaviorContext context) {
            this.context = context;
            return this;
        }

        public Builder userMix(WeightedSelector<String> userMix) {
            this.userMix = userMix;
            return this;
        }

        /**
         * Builds the user mix from {@code type -> weight}, rejecting unknown types.
         */
        public Builder userMix(Map<String, Integer> weights) {
            WeightedSelector.Builder<String> builder = WeightedSelector.builder();
            for (Map.Entry<String, Integer> entry : weights.entrySet()) {
                if (UserBehaviorFactory.find(entry.getKey()).isEmpty()) {
                    throw new IllegalArgumentException("Unknown user type: " + entry.getKey()
                            + ", known types: " + UserBehaviorFactory.getRegisteredNames());
                }
                builder.add(entry.getKey(), entry.getValue() != null ? entry.getValue() : 0);
            }
            this.userMix = builder.build();
            return this;
        }

        public Builder pipeline(RequestEventPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder tickInterval(Duration tickInterval) {
            if (tickInterval.isNegative() || tickInterval.isZero()) {
                throw new IllegalArgumentException("Tick interval must be positive");
            }
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder sleepChunk(Duration sleepChunk) {
            this.sleepChunk = sleepChunk;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        Builder nanoClock(LongSupplier nanoClock) {
            this.nanoClock = nanoClock;
            return this;
        }

        public LoadTestRunner build() {
            if (context == null) {
                throw new IllegalStateException("BehaviorContext is required");
            }
            if (pipeline == null) {
                throw new IllegalStateException("RequestEventPipeline is required");
            }
            if (userMix == null) {
                userMix = WeightedSelector.<String>builder().add("ai", 1).build();
            }
            return new LoadTestRunner(this);
        }
    }
}
