package fr.lapetina.mockllm.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Nested
    @DisplayName("YAML loading")
    class YamlLoading {

        @Test
        @DisplayName("should load test configuration from the classpath")
        void shouldLoadFromClasspath() {
            SimulatorConfig config = new ConfigLoader("test-config.yaml", Map.of()).load();

            assertThat(config.getServer().getPort()).isZero();
            assertThat(config.getSimulation().getLatencyMin()).isEqualTo(0.05);
            assertThat(config.getSimulation().getLatencyMax()).isEqualTo(0.1);
            assertThat(config.getSimulation().getEmbeddingDimension()).isEqualTo(16);
            assertThat(config.getSessions().getAgentId()).isEqualTo("test-agent");
            assertThat(config.getLoadTest().getStages()).hasSize(2);
            assertThat(config.getLoadTest().getStages().get(1).getEndsAtMs()).isEqualTo(1000);
            assertThat(config.getLoadTest().getUserMix()).containsEntry("ai", 1).containsEntry("conversation", 1);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_llm");
        }

        @Test
        @DisplayName("should use defaults for an empty document")
        void shouldUseDefaultsForEmptyDocument() {
            ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of());

            SimulatorConfig config = loader.loadFromStream(new ByteArrayInputStream(new byte[0]));

            assertThat(config.getServer().getPort()).isEqualTo(8000);
            assertThat(config.getSimulation().getLatencyMin()).isEqualTo(0.5);
            assertThat(config.getSimulation().getLatencyMax()).isEqualTo(2.0);
            assertThat(config.getSimulation().getTokenCount()).isEqualTo(20);
            assertThat(config.getLoadTest().getPollTimeoutSeconds()).isEqualTo(60);
            assertThat(config.getLoadTest().getStages()).hasSize(4);
            assertThat(config.getLoadTest().getUserMix()).containsOnlyKeys("ai");
        }

        @Test
        @DisplayName("should keep defaults for sections a partial document omits")
        void shouldMergePartialDocument() {
            String yaml = "simulation:\n  latencyMin: 0.2\n  latencyMax: 0.4\n";
            ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of());

            SimulatorConfig config = loader.loadFromStream(
                    new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

            assertThat(config.getSimulation().getLatencyMin()).isEqualTo(0.2);
            assertThat(config.getSimulation().getTokenDelay()).isEqualTo(0.05);
            assertThat(config.getServer().getPort()).isEqualTo(8000);
        }

        @Test
        @DisplayName("should read the session idle timeout and reject negative values")
        void shouldValidateSessionIdleTimeout() {
            ConfigLoader loader = new ConfigLoader("unused.yaml", Map.of());

            SimulatorConfig config = loader.loadFromStream(new ByteArrayInputStream(
                    "sessions:\n  idleTimeoutSeconds: 90\n".getBytes(StandardCharsets.UTF_8)));
            assertThat(config.getSessions().getIdleTimeoutSeconds()).isEqualTo(90);
            assertThat(new SimulatorConfig().getSessions().getIdleTimeoutSeconds()).isEqualTo(1800);

            assertThatThrownBy(() -> loader.loadFromStream(new ByteArrayInputStream(
                    "sessions:\n  idleTimeoutSeconds: -1\n".getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("idle timeout");
        }

        @Test
        @DisplayName("should fail when the file exists nowhere")
        void shouldFailForMissingFile() {
            ConfigLoader loader = new ConfigLoader("does-not-exist.yaml", Map.of());

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class EnvironmentOverrides {

        @Test
        @DisplayName("should apply latency, token and polling overrides")
        void shouldApplyOverrides() {
            Map<String, String> env = Map.of(
                    ConfigLoader.MOCK_MIN_LATENCY, "0.01",
                    ConfigLoader.MOCK_MAX_LATENCY, "0.02",
                    ConfigLoader.MOCK_TOKEN_DELAY, "0",
                    ConfigLoader.MOCK_TOKEN_COUNT, "3",
                    ConfigLoader.POLL_TIMEOUT, "12",
                    ConfigLoader.POLL_WAIT_FOR_DATA, "2",
                    ConfigLoader.TARGET_AGENT_ID, "agent-7",
                    ConfigLoader.SERVER_PORT, "9100",
                    ConfigLoader.LOAD_TEST_HOST, "http://target:8800"
            );

            SimulatorConfig config = new ConfigLoader("test-config.yaml", env).load();

            assertThat(config.getSimulation().getLatencyMin()).isEqualTo(0.01);
            assertThat(config.getSimulation().getLatencyMax()).isEqualTo(0.02);
            assertThat(config.getSimulation().getTokenDelay()).isZero();
            assertThat(config.getSimulation().getTokenCount()).isEqualTo(3);
            assertThat(config.getLoadTest().getPollTimeoutSeconds()).isEqualTo(12);
            assertThat(config.getLoadTest().getPollWaitForDataSeconds()).isEqualTo(2);
            assertThat(config.getLoadTest().getTargetAgentId()).isEqualTo("agent-7");
            assertThat(config.getServer().getPort()).isEqualTo(9100);
            assertThat(config.getLoadTest().getHost()).isEqualTo("http://target:8800");
        }

        @Test
        @DisplayName("should ignore blank values")
        void shouldIgnoreBlankValues() {
            SimulatorConfig config = new ConfigLoader("test-config.yaml",
                    Map.of(ConfigLoader.MOCK_MIN_LATENCY, "  ")).load();

            assertThat(config.getSimulation().getLatencyMin()).isEqualTo(0.05);
        }

        @Test
        @DisplayName("should reject unparseable numbers")
        void shouldRejectUnparseableNumbers() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml",
                    Map.of(ConfigLoader.MOCK_TOKEN_COUNT, "many"));

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining(ConfigLoader.MOCK_TOKEN_COUNT);
        }

        @Test
        @DisplayName("should reject a minimum latency above the maximum")
        void shouldRejectInvertedLatencyBounds() {
            ConfigLoader loader = new ConfigLoader("test-config.yaml",
                    Map.of(ConfigLoader.MOCK_MIN_LATENCY, "5"));

            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Latency bounds");
        }
    }
}
