package fr.lapetina.mockllm.simulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.mockllm.domain.model.FinishReason;
import fr.lapetina.mockllm.domain.model.FunctionDeclaration;
import fr.lapetina.mockllm.domain.model.GenerateRequest;
import fr.lapetina.mockllm.domain.model.GenerateResult;
import fr.lapetina.mockllm.domain.model.SchemaKind;
import fr.lapetina.mockllm.domain.model.SchemaNode;
import fr.lapetina.mockllm.domain.model.SimulationState;
import fr.lapetina.mockllm.domain.model.StreamChunk;
import fr.lapetina.mockllm.domain.model.StreamEvent;
import fr.lapetina.mockllm.domain.model.UsageMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InferenceSimulatorTest {

    private static final String JSON = GenerateRequest.JSON_MIME_TYPE;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ChaosController chaos;
    private CooperativeScheduler scheduler;
    private InferenceSimulator simulator;

    @BeforeEach
    void setUp() {
        chaos = new ChaosController(0.05, 0.1);
        scheduler = new CooperativeScheduler("test-loop");
        simulator = InferenceSimulator.builder()
                .chaos(chaos)
                .scheduler(scheduler)
                .random(new Random(42))
                .tokenDelay(Duration.ofMillis(2))
                .tokenCount(5)
                .embeddingDimension(8)
                .leakBlockBytes(1024)
                .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        @Test
        @DisplayName("should answer plain prompts with the canned text")
        void shouldAnswerWithText() {
            GenerateResult result = simulator.generate(GenerateRequest.ofPrompt("Hello"));

            assertThat(result.isFunctionCall()).isFalse();
            assertThat(result.text()).isEqualTo(InferenceSimulator.TEXT_RESPONSE);
            assertThat(result.usage()).isEqualTo(UsageMetadata.TEXT);
        }

        @Test
        @DisplayName("should use the known schema named by the title")
        void shouldUseSchemaTitle() throws Exception {
            SchemaNode schema = new SchemaNode(SchemaKind.OBJECT, "ToolRunningActionSchema", null, null, null);

            GenerateResult result = simulator.generate(
                    new GenerateRequest("mentions is_customer_dependent", null, JSON, schema));

            JsonNode json = objectMapper.readTree(result.text());
            assertThat(json.get("is_tool_running_only").asBoolean()).isFalse();
            assertThat(json.has("is_customer_dependent")).isFalse();
            assertThat(result.usage()).isEqualTo(UsageMetadata.STRUCTURED);
        }

        @Test
        @DisplayName("should synthesize from the schema when the title is unknown")
        void shouldSynthesizeUnknownTitle() throws Exception {
            SchemaNode schema = new SchemaNode(SchemaKind.OBJECT, "WeatherReport",
                    Map.of("temperature", SchemaNode.of(SchemaKind.NUMBER)), null, null);

            GenerateResult result = simulator.generate(new GenerateRequest("weather", null, JSON, schema));

            assertThat(objectMapper.readTree(result.text()).get("temperature").asDouble()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fall back to prompt keywords when no title was sent")
        void shouldMatchPromptKeywords() throws Exception {
            GenerateResult result = simulator.generate(
                    new GenerateRequest("Decide whether is_agent_intention holds", null, JSON, null));

            JsonNode json = objectMapper.readTree(result.text());
            assertThat(json.get("condition").asText()).isEqualTo("The user greets");
        }

        @Test
        @DisplayName("should return the fallback document when nothing identifies the schema")
        void shouldReturnFallbackDocument() throws Exception {
            GenerateResult result = simulator.generate(new GenerateRequest("Tell me a joke", null, JSON, null));

            JsonNode json = objectMapper.readTree(result.text());
            assertThat(json.get("status").asText()).isEqualTo("mock_json_response");
            assertThat(json.get("note").asText()).isEqualTo("Unidentified schema in prompt");
        }

        @Test
        @DisplayName("should prefer a function call over JSON mode")
        void shouldPreferFunctionCall() {
            GenerateResult result = simulator.generate(new GenerateRequest(
                    "is_agent_intention",
                    List.of(new FunctionDeclaration("CoherenceCheck", null),
                            new FunctionDeclaration("other", null)),
                    JSON,
                    null));

            assertThat(result.isFunctionCall()).isTrue();
            assertThat(result.functionCall().name()).isEqualTo("CoherenceCheck");
            assertThat(result.functionCall().args()).containsEntry("is_coherent", true);
        }
    }

    @Nested
    @DisplayName("Streaming")
    class Streaming {

        @Test
        @DisplayName("should emit one chunk per word up to the token count, then the terminator")
        void shouldEmitBoundedChunks() {
            TokenStream stream = simulator.streamGenerate("Hello");

            List<StreamEvent> events = new ArrayList<>();
            while (stream.hasNext()) {
                events.add(stream.next());
            }

            assertThat(events).hasSize(6);
            assertThat(events.get(5)).isSameAs(StreamEvent.END);
            List<StreamChunk> chunks = events.subList(0, 5).stream().map(StreamChunk.class::cast).toList();
            assertThat(chunks).extracting(StreamChunk::index).containsExactly(0, 1, 2, 3, 4);
            assertThat(chunks).extracting(StreamChunk::cumulativeTokenCount).containsExactly(1, 2, 3, 4, 5);
            assertThat(chunks).filteredOn(StreamChunk::isLast).hasSize(1);
            assertThat(chunks.get(4).finishReason()).isEqualTo(FinishReason.STOP);
            assertThat(chunks.get(0).text()).isEqualTo("I ");
        }

        @Test
        @DisplayName("should stop at the word count when the token count is larger")
        void shouldStopAtWordCount() {
            InferenceSimulator wide = InferenceSimulator.builder()
                    .chaos(chaos)
                    .scheduler(scheduler)
                    .tokenDelay(Duration.ZERO)
                    .tokenCount(1000)
                    .build();

            TokenStream stream = wide.streamGenerate("Hello");
            int chunks = 0;
            while (!stream.next().isTerminator()) {
                chunks++;
            }

            assertThat(chunks).isEqualTo(InferenceSimulator.STREAM_TEXT.split("\\s+").length);
            assertThat(stream.hasNext()).isFalse();
        }

        @Test
        @DisplayName("should sample the thinking delay from the current latency bounds")
        void shouldSampleThinkingDelay() {
            TokenStream stream = simulator.streamGenerate("Hello");

            assertThat(stream.getThinkingDelay())
                    .isBetween(Duration.ofMillis(50), Duration.ofMillis(100));
            while (stream.hasNext()) {
                stream.next();
            }
        }
    }

    @Test
    @DisplayName("should produce distinct vectors of the configured dimension")
    void shouldEmbedDistinctVectors() {
        List<double[]> vectors = simulator.embed(3);

        assertThat(vectors).hasSize(3);
        assertThat(vectors).allSatisfy(vector -> assertThat(vector).hasSize(8));
        assertThat(vectors.get(0)[0]).isEqualTo(0.9);
        assertThat(vectors.get(1)[0]).isEqualTo(0.1);
        assertThat(vectors.get(1)[1]).isEqualTo(0.9);
        assertThat(vectors.get(0)).isNotEqualTo(vectors.get(1));
        assertThat(simulator.embedding(9)[1]).isCloseTo(0.901, within(1e-9));
    }

    @Test
    @DisplayName("should keep vectors distinct when a batch is larger than the dimension")
    void shouldEmbedDistinctVectorsBeyondDimension() {
        List<double[]> vectors = simulator.embed(8 * 3 + 1);

        Set<List<Double>> distinct = new HashSet<>();
        for (double[] vector : vectors) {
            distinct.add(Arrays.stream(vector).boxed().collect(Collectors.toList()));
        }

        assertThat(distinct).hasSize(vectors.size());
        assertThat(vectors.get(0)).isNotEqualTo(vectors.get(8));
        assertThat(vectors.get(8)[0]).isCloseTo(0.901, within(1e-9));
        assertThat(vectors.get(16)[0]).isCloseTo(0.902, within(1e-9));
    }

    @Nested
    @DisplayName("Agent")
    class Agent {

        @Test
        @DisplayName("should echo the query after the simulated latency")
        void shouldChat() throws Exception {
            ChatResult result = simulator.chat("Summarize email").get(5, TimeUnit.SECONDS);

            assertThat(result.responseText()).isEqualTo("Simulated AI response to: Summarize email");
            assertThat(result.processingTime()).isBetween(Duration.ofMillis(50), Duration.ofMillis(100));
            assertThat(result.formattedProcessingTime()).endsWith("s");
        }

        @Test
        @DisplayName("should fail every chat at error rate 1")
        void shouldFailAtFullErrorRate() {
            chaos.setErrorRate(1.0);

            CompletableFuture<ChatResult> future = simulator.chat("hi");

            assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(ServiceUnavailableException.class);
        }

        @Test
        @DisplayName("should grow the leak on each successful chat while leaking")
        void shouldLeakOnChat() throws Exception {
            chaos.activateMemoryLeak();

            simulator.chat("a").get(5, TimeUnit.SECONDS);
            simulator.chat("b").get(5, TimeUnit.SECONDS);

            assertThat(chaos.getLeakedBytes()).isEqualTo(2048);
        }

        @Test
        @DisplayName("should wait without holding the loop when CPU stress is off")
        void shouldAnalyzeConcurrently() throws Exception {
            InferenceSimulator idle = InferenceSimulator.builder()
                    .chaos(new ChaosController(0.2, 0.2))
                    .scheduler(scheduler)
                    .build();
            long start = System.nanoTime();

            CompletableFuture<AnalyzeResult> first = idle.analyze();
            CompletableFuture<AnalyzeResult> second = idle.analyze();
            AnalyzeResult result = first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(result.mode()).isEqualTo(AnalyzeResult.Mode.IO_BOUND);
            assertThat(result.status()).isEqualTo("Analysis Complete");
            assertThat(elapsedMs).isBetween(390L, 750L);
        }

        @Test
        @DisplayName("should serialize analysis under CPU stress")
        void shouldSerializeUnderCpuStress() throws Exception {
            ChaosController slow = new ChaosController(0.1, 0.1);
            InferenceSimulator stressed = InferenceSimulator.builder()
                    .chaos(slow)
                    .scheduler(scheduler)
                    .build();
            slow.activateCpuStress();
            long start = System.nanoTime();

            CompletableFuture<AnalyzeResult> first = stressed.analyze();
            CompletableFuture<AnalyzeResult> second = stressed.analyze();
            CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertThat(first.get().mode()).isEqualTo(AnalyzeResult.Mode.CPU_BOUND);
            assertThat(first.get().status()).isEqualTo("Heavy Analysis Complete");
            assertThat(elapsedMs).isGreaterThanOrEqualTo(400);
        }
    }

    @Test
    @DisplayName("should sample latency within the snapshot bounds")
    void shouldSampleWithinBounds() {
        SimulationState state = SimulationState.baseline(0.2, 0.3);

        for (int i = 0; i < 100; i++) {
            assertThat(simulator.sampleLatency(state))
                    .isBetween(Duration.ofMillis(200), Duration.ofMillis(300));
        }
        assertThat(simulator.sampleLatency(SimulationState.baseline(0.25, 0.25)))
                .isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("should require chaos and scheduler")
    void shouldRequireCollaborators() {
        assertThatThrownBy(() -> InferenceSimulator.builder().scheduler(scheduler).build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> InferenceSimulator.builder().chaos(chaos).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
