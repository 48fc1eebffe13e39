package fr.lapetina.mockllm.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaNodeTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("JSON parsing")
    class Parsing {

        @Test
        @DisplayName("should keep property declaration order and nested kinds")
        void shouldParseNestedSchema() throws Exception {
            SchemaNode node = SchemaNode.fromJson(mapper.readTree(
                    "{\"type\": \"OBJECT\", \"title\": \"Example\", \"properties\": {"
                            + "\"zeta\": {\"type\": \"string\", \"enum\": [\"a\", \"b\"]},"
                            + "\"alpha\": {\"type\": \"array\", \"items\": {\"type\": \"integer\"}},"
                            + "\"flag\": {\"type\": \"boolean\"}}}"));

            assertThat(node.kind()).isEqualTo(SchemaKind.OBJECT);
            assertThat(node.title()).isEqualTo("Example");
            assertThat(node.properties()).containsOnlyKeys("zeta", "alpha", "flag");
            assertThat(node.properties().keySet()).containsExactly("zeta", "alpha", "flag");
            assertThat(node.properties().get("zeta").enumValues()).containsExactly("a", "b");
            assertThat(node.properties().get("alpha").items().kind()).isEqualTo(SchemaKind.INTEGER);
        }

        @Test
        @DisplayName("should default a missing type to object")
        void shouldDefaultToObject() throws Exception {
            SchemaNode node = SchemaNode.fromJson(mapper.readTree("{\"properties\": {}}"));

            assertThat(node.kind()).isEqualTo(SchemaKind.OBJECT);
            assertThat(node.isKnownKind()).isTrue();
        }

        @Test
        @DisplayName("should mark an unrecognised type as unknown")
        void shouldMarkUnknownType() throws Exception {
            SchemaNode node = SchemaNode.fromJson(mapper.readTree("{\"type\": \"tuple\"}"));

            assertThat(node.kind()).isNull();
            assertThat(node.isKnownKind()).isFalse();
        }

        @Test
        @DisplayName("should return null for absent or non-object JSON")
        void shouldReturnNullForNonObject() throws Exception {
            assertThat(SchemaNode.fromJson(null)).isNull();
            assertThat(SchemaNode.fromJson(mapper.readTree("[1, 2]"))).isNull();
        }
    }

    @Nested
    @DisplayName("Simulation state")
    class State {

        @Test
        @DisplayName("should start healthy from a baseline")
        void shouldStartHealthy() {
            SimulationState state = SimulationState.baseline(0.5, 2.0);

            assertThat(state.errorRate()).isZero();
            assertThat(state.memoryLeakActive()).isFalse();
            assertThat(state.cpuStressActive()).isFalse();
        }

        @Test
        @DisplayName("should change one field per transition")
        void shouldChangeOneField() {
            SimulationState state = SimulationState.baseline(0.5, 2.0)
                    .withErrorRate(0.3)
                    .withCpuStress(true);

            assertThat(state.latencyMin()).isEqualTo(0.5);
            assertThat(state.latencyMax()).isEqualTo(2.0);
            assertThat(state.errorRate()).isEqualTo(0.3);
            assertThat(state.cpuStressActive()).isTrue();
            assertThat(state.memoryLeakActive()).isFalse();
        }

        @Test
        @DisplayName("should reject inverted latency bounds and out of range error rates")
        void shouldRejectInvalidValues() {
            assertThatThrownBy(() -> SimulationState.baseline(2.0, 1.0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Latency bounds");
            assertThatThrownBy(() -> SimulationState.baseline(0.1, 0.2).withErrorRate(1.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
