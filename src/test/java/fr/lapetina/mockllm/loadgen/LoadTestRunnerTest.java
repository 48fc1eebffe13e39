package fr.lapetina.mockllm.loadgen;

import fr.lapetina.mockllm.domain.model.RequestOutcome;
import fr.lapetina.mockllm.domain.model.Stage;
import fr.lapetina.mockllm.loadgen.behavior.BehaviorContext;
import fr.lapetina.mockllm.loadgen.behavior.UserBehavior;
import fr.lapetina.mockllm.loadgen.behavior.UserBehaviorFactory;
import fr.lapetina.mockllm.loadgen.event.RequestEventPipeline;
import fr.lapetina.mockllm.loadgen.event.RequestStats;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadTestRunnerTest {

    private static final String TICKING = "ticking";

    /**
     * Reports one 1ms outcome per task and waits 10 to 20ms between tasks.
     */
    private static final class TickingBehavior implements UserBehavior {
        private final BehaviorContext context;

        TickingBehavior(BehaviorContext context) {
            this.context = context;
        }

        @Override
        public String getName() {
            return TICKING;
        }

        @Override
        public Duration getMinWait() {
            return Duration.ofMillis(10);
        }

        @Override
        public Duration getMaxWait() {
            return Duration.ofMillis(20);
        }

        @Override
        public void runNextTask(Random random) {
            context.recorder().report(RequestOutcome.success("GET", "tick", Duration.ofMillis(1), 0));
        }
    }

    @BeforeAll
    static void registerBehavior() {
        UserBehaviorFactory.register(TICKING, TickingBehavior::new);
    }

    private static BehaviorContext context(OutcomeRecorder recorder) {
        StubLoadHttpClient client = new StubLoadHttpClient(request -> StubLoadHttpClient.respond(200, "{}"));
        TurnLatencyPoller poller = new TurnLatencyPoller(client, recorder, Duration.ofSeconds(1), Duration.ofSeconds(1));
        return new BehaviorContext(client, recorder, new SlaClassifier(), poller, null);
    }

    @Test
    @DisplayName("should spawn at most spawnRate x tick users per tick")
    void shouldComputeMaxChangePerTick() {
        assertThat(LoadTestRunner.maxChangePerTick(5, Duration.ofSeconds(1))).isEqualTo(5);
        assertThat(LoadTestRunner.maxChangePerTick(20, Duration.ofMillis(100))).isEqualTo(2);
        assertThat(LoadTestRunner.maxChangePerTick(5, Duration.ofMillis(100))).isEqualTo(1);
        assertThat(LoadTestRunner.maxChangePerTick(3, Duration.ofMillis(500))).isEqualTo(2);
    }

    @Test
    @DisplayName("should converge on the stage target and stop the newest users first")
    void shouldAdjustPopulation() throws InterruptedException {
        RequestEventPipeline pipeline = RequestEventPipeline.builder().ringBufferSize(256).build().start();
        LoadTestRunner runner = LoadTestRunner.builder()
                .context(context(pipeline))
                .pipeline(pipeline)
                .userMix(Map.of(TICKING, 1))
                .tickInterval(Duration.ofSeconds(1))
                .sleepChunk(Duration.ofMillis(5))
                .build();
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            runner.adjustPopulation(Stage.of(Duration.ofSeconds(10), 8, 3), executor);
            assertThat(runner.getActiveUserCount()).isEqualTo(3);

            runner.adjustPopulation(Stage.of(Duration.ofSeconds(10), 8, 3), executor);
            runner.adjustPopulation(Stage.of(Duration.ofSeconds(10), 8, 3), executor);
            assertThat(runner.getActiveUserCount()).isEqualTo(8);

            runner.adjustPopulation(Stage.of(Duration.ofSeconds(10), 2, 4), executor);
            assertThat(runner.getActiveUserCount()).isEqualTo(4);
            runner.adjustPopulation(Stage.of(Duration.ofSeconds(10), 2, 4), executor);
            assertThat(runner.getActiveUserCount()).isEqualTo(2);
            assertThat(runner.getPeakUserCount()).isEqualTo(8);
        } finally {
            runner.adjustPopulation(Stage.of(Duration.ofSeconds(10), 0, 100), executor);
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
            pipeline.close();
        }
    }

    @Test
    @DisplayName("should run the whole shape and return the aggregated statistics")
    void shouldRunShape() throws InterruptedException {
        RequestEventPipeline pipeline = RequestEventPipeline.builder().ringBufferSize(256).build().start();
        LoadTestRunner runner = LoadTestRunner.builder()
                .shape(new LoadShapeScheduler(List.of(
                        Stage.of(Duration.ofMillis(300), 4, 40),
                        Stage.of(Duration.ofMillis(600), 1, 40))))
                .context(context(pipeline))
                .pipeline(pipeline)
                .userMix(Map.of(TICKING, 1))
                .tickInterval(Duration.ofMillis(50))
                .sleepChunk(Duration.ofMillis(5))
                .shutdownGrace(Duration.ofSeconds(2))
                .build();

        long start = System.nanoTime();
        List<RequestStats.Summary> summaries = runner.run();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(elapsedMs).isGreaterThanOrEqualTo(600);
        assertThat(runner.getPeakUserCount()).isEqualTo(4);
        assertThat(runner.getActiveUserCount()).isZero();
        assertThat(summaries).extracting(RequestStats.Summary::name).containsExactly("tick");
        assertThat(summaries.get(0).count()).isPositive();
        assertThat(summaries.get(0).failures()).isZero();
    }

    @Test
    @DisplayName("should end early when a stop is requested")
    void shouldStopOnRequest() throws Exception {
        RequestEventPipeline pipeline = RequestEventPipeline.builder().ringBufferSize(256).build().start();
        LoadTestRunner runner = LoadTestRunner.builder()
                .shape(new LoadShapeScheduler(List.of(Stage.of(Duration.ofMinutes(10), 2, 10))))
                .context(context(pipeline))
                .pipeline(pipeline)
                .userMix(Map.of(TICKING, 1))
                .tickInterval(Duration.ofMillis(50))
                .sleepChunk(Duration.ofMillis(5))
                .shutdownGrace(Duration.ofSeconds(2))
                .build();
        AtomicReference<List<RequestStats.Summary>> result = new AtomicReference<>();
        Thread thread = new Thread(() -> {
            try {
                result.set(runner.run());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        thread.start();
        Thread.sleep(300);
        runner.requestStop();
        thread.join(10_000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(result.get()).isNotNull();
        assertThat(pipeline.getDroppedCount()).isZero();
    }

    @Test
    @DisplayName("should reject unknown user types in the mix")
    void shouldRejectUnknownUserType() {
        assertThatThrownBy(() -> LoadTestRunner.builder().userMix(Map.of("robot", 1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("robot");
    }

    @Test
    @DisplayName("should require a context and a pipeline")
    void shouldRequireCollaborators() {
        assertThatThrownBy(() -> LoadTestRunner.builder().build())
                .isInstanceOf(IllegalStateException.class);
    }
}
