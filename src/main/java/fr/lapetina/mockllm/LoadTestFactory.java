package fr.lapetina.mockllm;

import fr.lapetina.mockllm.infrastructure.config.SimulatorConfig;
import fr.lapetina.mockllm.infrastructure.http.LoadHttpClient;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mockllm.loadgen.LoadShapeScheduler;
import fr.lapetina.mockllm.loadgen.LoadTestRunner;
import fr.lapetina.mockllm.loadgen.SlaClassifier;
import fr.lapetina.mockllm.loadgen.TurnLatencyPoller;
import fr.lapetina.mockllm.loadgen.behavior.BehaviorContext;
import fr.lapetina.mockllm.loadgen.event.RequestEventPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Wires a load test run from configuration: client, outcome pipeline, behaviours and shape.
 */
public final class LoadTestFactory {

    private static final Logger log = LoggerFactory.getLogger(LoadTestFactory.class);

    private LoadTestFactory() {
        // Utility class
    }

    /**
     * Builds a runner against {@code loadTest.host}.
     *
     * @param metricsRegistry registry for outcome meters, or null to skip them
     */
    public static LoadTestRunner createRunner(SimulatorConfig config, MetricsRegistry metricsRegistry) {
        SimulatorConfig.LoadTestConfig loadTest = config.getLoadTest();
        LoadHttpClient client = LoadHttpClient.create(
                loadTest.getHost(),
                Duration.ofMillis(loadTest.getConnectTimeoutMs()),
                Duration.ofMillis(loadTest.getRequestTimeoutMs())
        );
        return createRunner(config, client, metricsRegistry);
    }

    public static LoadTestRunner createRunner(SimulatorConfig config, LoadHttpClient client,
                                              MetricsRegistry metricsRegistry) {
        SimulatorConfig.LoadTestConfig loadTest = config.getLoadTest();

        RequestEventPipeline.Builder pipelineBuilder = RequestEventPipeline.builder()
                .ringBufferSize(loadTest.getRingBufferSize())
                .slownessThreshold(Duration.ofMillis(loadTest.getSlownessAlertMs()));
        if (metricsRegistry != null && config.getMetrics().isEnabled()) {
            pipelineBuilder.metricsRegistry(metricsRegistry);
        }
        RequestEventPipeline pipeline = pipelineBuilder.build().start();

        TurnLatencyPoller poller = new TurnLatencyPoller(
                client,
                pipeline,
                seconds(loadTest.getPollTimeoutSeconds()),
                seconds(loadTest.getPollWaitForDataSeconds())
        );

        BehaviorContext context = new BehaviorContext(
                client,
                pipeline,
                new SlaClassifier(
                        Duration.ofMillis(loadTest.getAnalyzeSlaMs()),
                        Duration.ofMillis(loadTest.getHealthSlaMs())),
                poller,
                loadTest.getTargetAgentId()
        );

        log.info("Load test wired: host={}, targetAgentId={}, pollTimeoutS={}, pollWaitForDataS={}",
                loadTest.getHost(), loadTest.getTargetAgentId(),
                loadTest.getPollTimeoutSeconds(), loadTest.getPollWaitForDataSeconds());

        return LoadTestRunner.builder()
                .shape(LoadShapeScheduler.fromConfig(loadTest.getStages()))
                .context(context)
                .userMix(loadTest.getUserMix())
                .pipeline(pipeline)
                .metricsRegistry(metricsRegistry)
                .tickInterval(Duration.ofMillis(loadTest.getTickIntervalMs()))
                .shutdownGrace(seconds(loadTest.getPollTimeoutSeconds()))
                .build();
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }
}
