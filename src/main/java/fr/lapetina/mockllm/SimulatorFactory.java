package fr.lapetina.mockllm;

import fr.lapetina.mockllm.api.HttpServer;
import fr.lapetina.mockllm.infrastructure.config.ConfigLoader;
import fr.lapetina.mockllm.infrastructure.config.SimulatorConfig;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mockllm.session.SessionStore;
import fr.lapetina.mockllm.simulator.ChaosController;
import fr.lapetina.mockllm.simulator.CooperativeScheduler;
import fr.lapetina.mockllm.simulator.InferenceSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Factory for creating a fully-wired mock server from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SimulatorFactory factory = SimulatorFactory.create("simulator.yaml")) {
 *     HttpServer server = factory.createHttpServer();
 *     server.start();
 * }
 * }</pre>
 */
public class SimulatorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatorFactory.class);

    private static final Duration MAX_EVICTION_SWEEP = Duration.ofMinutes(1);

    private final SimulatorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final CooperativeScheduler scheduler;
    private final ChaosController chaos;
    private final InferenceSimulator simulator;
    private final SessionStore sessionStore;

    protected SimulatorFactory(SimulatorConfig config) {
        this.config = config;

        SimulatorConfig.SimulationConfig simulation = config.getSimulation();
        log.info("Initializing SimulatorFactory: latencyMin={}s, latencyMax={}s, tokenDelay={}s, tokenCount={}",
                simulation.getLatencyMin(), simulation.getLatencyMax(),
                simulation.getTokenDelay(), simulation.getTokenCount());

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.scheduler = new CooperativeScheduler();
        this.chaos = new ChaosController(simulation.getLatencyMin(), simulation.getLatencyMax());

        this.simulator = InferenceSimulator.builder()
                .chaos(chaos)
                .scheduler(scheduler)
                .fromConfig(simulation)
                .build();

        SimulatorConfig.SessionConfig sessions = config.getSessions();
        this.sessionStore = new SessionStore(
                simulator,
                sessions.getAgentId(),
                sessions.getAgentName(),
                Duration.ofMillis(Math.round(sessions.getIdleTimeoutSeconds() * 1000))
        );
        if (!sessionStore.getIdleTimeout().isZero()) {
            Duration sweep = sessionStore.getIdleTimeout().compareTo(MAX_EVICTION_SWEEP) < 0
                    ? sessionStore.getIdleTimeout()
                    : MAX_EVICTION_SWEEP;
            scheduler.runEvery(sweep, sessionStore::evictIdle);
            log.info("Session eviction enabled: idleTimeout={}, sweep={}", sessionStore.getIdleTimeout(), sweep);
        }

        metricsRegistry.registerChaosGauges(chaos::snapshot, chaos::getLeakedBytes);

        log.info("SimulatorFactory initialized");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SimulatorFactory create(String configPath) {
        return new SimulatorFactory(new ConfigLoader(configPath).load());
    }

    public static SimulatorFactory create(SimulatorConfig config) {
        return new SimulatorFactory(config);
    }

    /**
     * Creates an HTTP server bound to the configured port (0 picks an ephemeral one).
     */
    public HttpServer createHttpServer() throws IOException {
        SimulatorConfig.ServerConfig server = config.getServer();
        return new HttpServer(
                server.getPort(),
                server.getBacklog(),
                server.getWorkerThreads(),
                Duration.ofMillis(server.getRequestTimeoutMs()),
                Duration.ofMillis(Math.round(config.getSessions().getMaxWaitForDataSeconds() * 1000)),
                simulator,
                sessionStore,
                metricsRegistry
        );
    }

    public SimulatorConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ChaosController getChaos() {
        return chaos;
    }

    public InferenceSimulator getSimulator() {
        return simulator;
    }

    public SessionStore getSessionStore() {
        return sessionStore;
    }

    @Override
    public void close() {
        log.info("Shutting down SimulatorFactory...");

        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error closing scheduler", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("SimulatorFactory shut down");
    }
}
