package fr.lapetina.mockllm.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the simulator and the load generator.
 * Designed to be populated from YAML.
 */
public class SimulatorConfig {

    private ServerConfig server = new ServerConfig();
    private SimulationConfig simulation = new SimulationConfig();
    private SessionConfig sessions = new SessionConfig();
    private LoadTestConfig loadTest = new LoadTestConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public SimulationConfig getSimulation() { return simulation; }
    public void setSimulation(SimulationConfig simulation) { this.simulation = simulation; }

    public SessionConfig getSessions() { return sessions; }
    public void setSessions(SessionConfig sessions) { this.sessions = sessions; }

    public LoadTestConfig getLoadTest() { return loadTest; }
    public void setLoadTest(LoadTestConfig loadTest) { this.loadTest = loadTest; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8000;
        private int backlog = 100;
        private int workerThreads = 64;
        private long requestTimeoutMs = 120_000;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Synthetic inference behaviour. Latencies are in seconds.
     */
    public static class SimulationConfig {
        private double latencyMin = 0.5;
        private double latencyMax = 2.0;
        private double tokenDelay = 0.05;
        private int tokenCount = 20;
        private int embeddingDimension = 768;
        private int leakBlockBytes = 1024 * 1024;

        public double getLatencyMin() { return latencyMin; }
        public void setLatencyMin(double latencyMin) { this.latencyMin = latencyMin; }

        public double getLatencyMax() { return latencyMax; }
        public void setLatencyMax(double latencyMax) { this.latencyMax = latencyMax; }

        public double getTokenDelay() { return tokenDelay; }
        public void setTokenDelay(double tokenDelay) { this.tokenDelay = tokenDelay; }

        public int getTokenCount() { return tokenCount; }
        public void setTokenCount(int tokenCount) { this.tokenCount = tokenCount; }

        public int getEmbeddingDimension() { return embeddingDimension; }
        public void setEmbeddingDimension(int embeddingDimension) { this.embeddingDimension = embeddingDimension; }

        public int getLeakBlockBytes() { return leakBlockBytes; }
        public void setLeakBlockBytes(int leakBlockBytes) { this.leakBlockBytes = leakBlockBytes; }
    }

    /**
     * Session backend served by the mock (stand-in conversational agent).
     */
    public static class SessionConfig {
        private String agentId = "mock-agent";
        private String agentName = "Mock Agent";
        private double maxWaitForDataSeconds = 30;
        private double idleTimeoutSeconds = 1800;

        public String getAgentId() { return agentId; }
        public void setAgentId(String agentId) { this.agentId = agentId; }

        public String getAgentName() { return agentName; }
        public void setAgentName(String agentName) { this.agentName = agentName; }

        public double getMaxWaitForDataSeconds() { return maxWaitForDataSeconds; }
        public void setMaxWaitForDataSeconds(double maxWaitForDataSeconds) { this.maxWaitForDataSeconds = maxWaitForDataSeconds; }

        /** Sessions untouched for longer than this are evicted; 0 keeps them forever. */
        public double getIdleTimeoutSeconds() { return idleTimeoutSeconds; }
        public void setIdleTimeoutSeconds(double idleTimeoutSeconds) { this.idleTimeoutSeconds = idleTimeoutSeconds; }
    }

    /**
     * Load generator configuration.
     */
    public static class LoadTestConfig {
        private String host = "http://localhost:8000";
        private long tickIntervalMs = 1000;
        private long connectTimeoutMs = 10_000;
        private long requestTimeoutMs = 30_000;
        private String targetAgentId;
        private double pollTimeoutSeconds = 60;
        private double pollWaitForDataSeconds = 10;
        private long analyzeSlaMs = 2000;
        private long healthSlaMs = 1000;
        private long slownessAlertMs = 4000;
        private int ringBufferSize = 1024;
        private List<StageConfig> stages = defaultStages();
        private Map<String, Integer> userMix = defaultUserMix();

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public long getTickIntervalMs() { return tickIntervalMs; }
        public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public String getTargetAgentId() { return targetAgentId; }
        public void setTargetAgentId(String targetAgentId) { this.targetAgentId = targetAgentId; }

        public double getPollTimeoutSeconds() { return pollTimeoutSeconds; }
        public void setPollTimeoutSeconds(double pollTimeoutSeconds) { this.pollTimeoutSeconds = pollTimeoutSeconds; }

        public double getPollWaitForDataSeconds() { return pollWaitForDataSeconds; }
        public void setPollWaitForDataSeconds(double pollWaitForDataSeconds) { this.pollWaitForDataSeconds = pollWaitForDataSeconds; }

        public long getAnalyzeSlaMs() { return analyzeSlaMs; }
        public void setAnalyzeSlaMs(long analyzeSlaMs) { this.analyzeSlaMs = analyzeSlaMs; }

        public long getHealthSlaMs() { return healthSlaMs; }
        public void setHealthSlaMs(long healthSlaMs) { this.healthSlaMs = healthSlaMs; }

        public long getSlownessAlertMs() { return slownessAlertMs; }
        public void setSlownessAlertMs(long slownessAlertMs) { this.slownessAlertMs = slownessAlertMs; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public List<StageConfig> getStages() { return stages; }
        public void setStages(List<StageConfig> stages) { this.stages = stages; }

        public Map<String, Integer> getUserMix() { return userMix; }
        public void setUserMix(Map<String, Integer> userMix) { this.userMix = userMix; }

        private static List<StageConfig> defaultStages() {
            List<StageConfig> stages = new ArrayList<>();
            stages.add(StageConfig.of(30_000, 10, 5));    // warm-up
            stages.add(StageConfig.of(60_000, 50, 10));   // load
            stages.add(StageConfig.of(90_000, 100, 20));  // stress
            stages.add(StageConfig.of(120_000, 10, 5));   // cool-down
            return stages;
        }

        private static Map<String, Integer> defaultUserMix() {
            Map<String, Integer> mix = new LinkedHashMap<>();
            mix.put("ai", 1);
            return mix;
        }
    }

    /**
     * One load stage. {@code endsAtMs} is the cumulative elapsed time at which the
     * stage ends, not the length of the stage.
     */
    public static class StageConfig {
        private long endsAtMs;
        private int users;
        private int spawnRate;

        public static StageConfig of(long endsAtMs, int users, int spawnRate) {
            StageConfig stage = new StageConfig();
            stage.setEndsAtMs(endsAtMs);
            stage.setUsers(users);
            stage.setSpawnRate(spawnRate);
            return stage;
        }

        public long getEndsAtMs() { return endsAtMs; }
        public void setEndsAtMs(long endsAtMs) { this.endsAtMs = endsAtMs; }

        public int getUsers() { return users; }
        public void setUsers(int users) { this.users = users; }

        public int getSpawnRate() { return spawnRate; }
        public void setSpawnRate(int spawnRate) { this.spawnRate = spawnRate; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "mock_llm";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
