package fr.lapetina.mockllm.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Configuration loader.
 *
 * Resolution order:
 * - YAML file on the file system, else the same name on the classpath
 * - Environment variable overrides (MOCK_*, POLL_*, TARGET_AGENT_ID, ...)
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String MOCK_MIN_LATENCY = "MOCK_MIN_LATENCY";
    public static final String MOCK_MAX_LATENCY = "MOCK_MAX_LATENCY";
    public static final String MOCK_TOKEN_DELAY = "MOCK_TOKEN_DELAY";
    public static final String MOCK_TOKEN_COUNT = "MOCK_TOKEN_COUNT";
    public static final String POLL_TIMEOUT = "POLL_TIMEOUT";
    public static final String POLL_WAIT_FOR_DATA = "POLL_WAIT_FOR_DATA";
    public static final String TARGET_AGENT_ID = "TARGET_AGENT_ID";
    public static final String SERVER_PORT = "SERVER_PORT";
    public static final String LOAD_TEST_HOST = "LOAD_TEST_HOST";

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(SimulatorConfig.class, loaderOptions));
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    /**
     * Loads configuration from file or classpath and applies environment overrides.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails or an override cannot be parsed
     */
    public SimulatorConfig load() {
        SimulatorConfig config = loadFromPath();
        applyEnvironment(config);
        validate(config);
        return config;
    }

    private SimulatorConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return orDefault(yaml.load(is));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SimulatorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return orDefault(yaml.load(is));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream and applies environment overrides.
     */
    public SimulatorConfig loadFromStream(InputStream inputStream) {
        SimulatorConfig config = orDefault(yaml.load(inputStream));
        applyEnvironment(config);
        validate(config);
        return config;
    }

    private static SimulatorConfig orDefault(SimulatorConfig config) {
        // An empty document yields null
        return config != null ? config : new SimulatorConfig();
    }

    private void applyEnvironment(SimulatorConfig config) {
        SimulatorConfig.SimulationConfig simulation = config.getSimulation();
        SimulatorConfig.LoadTestConfig loadTest = config.getLoadTest();

        override(MOCK_MIN_LATENCY, Double::parseDouble, simulation::setLatencyMin);
        override(MOCK_MAX_LATENCY, Double::parseDouble, simulation::setLatencyMax);
        override(MOCK_TOKEN_DELAY, Double::parseDouble, simulation::setTokenDelay);
        override(MOCK_TOKEN_COUNT, Integer::parseInt, simulation::setTokenCount);
        override(POLL_TIMEOUT, Double::parseDouble, loadTest::setPollTimeoutSeconds);
        override(POLL_WAIT_FOR_DATA, Double::parseDouble, loadTest::setPollWaitForDataSeconds);
        override(TARGET_AGENT_ID, Function.identity(), loadTest::setTargetAgentId);
        override(SERVER_PORT, Integer::parseInt, config.getServer()::setPort);
        override(LOAD_TEST_HOST, Function.identity(), loadTest::setHost);
    }

    private <T> void override(String name, Function<String, T> parser, Consumer<T> setter) {
        String raw = environment.get(name);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            setter.accept(parser.apply(raw.trim()));
            log.info("Configuration override from environment: {}={}", name, raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + name + ": " + raw, e);
        }
    }

    private static void validate(SimulatorConfig config) {
        SimulatorConfig.SimulationConfig simulation = config.getSimulation();
        if (simulation.getLatencyMin() < 0 || simulation.getLatencyMin() > simulation.getLatencyMax()) {
            throw new ConfigurationException("Latency bounds must satisfy 0 <= min <= max, got ["
                    + simulation.getLatencyMin() + ", " + simulation.getLatencyMax() + "]");
        }
        if (simulation.getTokenDelay() < 0 || simulation.getTokenCount() < 0) {
            throw new ConfigurationException("Token delay and token count must not be negative");
        }
        if (simulation.getEmbeddingDimension() <= 0) {
            throw new ConfigurationException("Embedding dimension must be positive");
        }
        if (config.getSessions().getIdleTimeoutSeconds() < 0) {
            throw new ConfigurationException("Session idle timeout must not be negative");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static SimulatorConfig createDefault() {
        return new SimulatorConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
