package fr.lapetina.mockllm;

import fr.lapetina.mockllm.api.HttpServer;
import fr.lapetina.mockllm.infrastructure.config.ConfigLoader;
import fr.lapetina.mockllm.infrastructure.config.SimulatorConfig;
import fr.lapetina.mockllm.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mockllm.loadgen.LoadTestRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point.
 *
 * <pre>
 * java -jar mock-llm-chaos.jar [server|loadtest] [config.yaml]
 * </pre>
 * {@code server} (the default) runs the mock generative API; {@code loadtest} drives the
 * staged load shape against {@code loadTest.host}.
 */
public class MockLlmApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MockLlmApplication.class);

    static final String DEFAULT_CONFIG = "simulator.yaml";

    private final SimulatorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public MockLlmApplication(String configPath) throws Exception {
        log.info("Starting Mock LLM Server...");

        this.factory = SimulatorFactory.create(configPath);
        this.httpServer = factory.createHttpServer();

        log.info("Mock LLM Server initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Mock LLM Server started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public SimulatorFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Mock LLM Server...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Mock LLM Server shut down");
    }

    static void runLoadTest(String configPath) throws InterruptedException {
        SimulatorConfig config = new ConfigLoader(configPath).load();
        try (MetricsRegistry metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix())) {
            LoadTestRunner runner = LoadTestFactory.createRunner(config, metricsRegistry);
            Runtime.getRuntime().addShutdownHook(new Thread(runner::requestStop));
            runner.run();
        }
    }

    public static void main(String[] args) {
        String mode = args.length > 0 ? args[0] : "server";
        String configPath = args.length > 1 ? args[1] : DEFAULT_CONFIG;

        try {
            switch (mode) {
                case "server" -> {
                    MockLlmApplication app = new MockLlmApplication(configPath);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        app.requestShutdown();
                        app.close();
                    }));

                    app.start();
                    app.awaitShutdown();
                }
                case "loadtest" -> runLoadTest(configPath);
                default -> {
                    log.error("Unknown mode '{}', expected 'server' or 'loadtest'", mode);
                    System.exit(2);
                }
            }
        } catch (Exception e) {
            log.error("Failed to run Mock LLM {}", mode, e);
            System.exit(1);
        }
    }
}
