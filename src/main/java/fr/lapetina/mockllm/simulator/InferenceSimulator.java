package fr.lapetina.mockllm.simulator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.mockllm.domain.model.FinishReason;
import fr.lapetina.mockllm.domain.model.FunctionCall;
import fr.lapetina.mockllm.domain.model.FunctionDeclaration;
import fr.lapetina.mockllm.domain.model.GenerateRequest;
import fr.lapetina.mockllm.domain.model.GenerateResult;
import fr.lapetina.mockllm.domain.model.SimulationState;
import fr.lapetina.mockllm.domain.model.StreamChunk;
import fr.lapetina.mockllm.domain.model.StreamEvent;
import fr.lapetina.mockllm.domain.model.UsageMetadata;
import fr.lapetina.mockllm.domain.synthesis.FunctionCallSynthesizer;
import fr.lapetina.mockllm.domain.synthesis.KnownSchemaRegistry;
import fr.lapetina.mockllm.domain.synthesis.SchemaSynthesizer;
import fr.lapetina.mockllm.infrastructure.config.SimulatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * Synthetic inference engine behind every generative and agent endpoint.
 *
 * Each call reads the current chaos snapshot once, at call time. All latency is spent on
 * the {@link CooperativeScheduler}; callers receive futures or a {@link TokenStream}.
 */
public final class InferenceSimulator {

    private static final Logger log = LoggerFactory.getLogger(InferenceSimulator.class);

    public static final String TEXT_RESPONSE =
            "I understand your request. Here is my response based on the information provided.";

    public static final String STREAM_TEXT =
            "I understand your request. Let me help you with that. "
                    + "Based on the information provided, here is my response. "
                    + "Please let me know if you need any clarification.";

    public static final int STREAM_PROMPT_TOKENS = 10;
    public static final int COUNT_TOKENS_RESULT = 50;

    static final double EMBEDDING_BASE = 0.1;
    static final double EMBEDDING_MARKER = 0.9;
    static final double EMBEDDING_MARKER_STEP = 0.001;

    private static final List<String> STREAM_WORDS = List.of(STREAM_TEXT.split("\\s+"));

    private final ChaosController chaos;
    private final CooperativeScheduler scheduler;
    private final KnownSchemaRegistry registry;
    private final SchemaSynthesizer schemaSynthesizer;
    private final FunctionCallSynthesizer functionCallSynthesizer;
    private final ObjectMapper objectMapper;
    private final Random random;

    private final Duration tokenDelay;
    private final int tokenCount;
    private final int embeddingDimension;
    private final int leakBlockBytes;

    private InferenceSimulator(Builder builder) {
        this.chaos = builder.chaos;
        this.scheduler = builder.scheduler;
        this.registry = builder.registry;
        this.schemaSynthesizer = builder.schemaSynthesizer;
        this.functionCallSynthesizer = new FunctionCallSynthesizer(schemaSynthesizer);
        this.objectMapper = builder.objectMapper;
        this.random = builder.random;
        this.tokenDelay = builder.tokenDelay;
        this.tokenCount = builder.tokenCount;
        this.embeddingDimension = builder.embeddingDimension;
        this.leakBlockBytes = builder.leakBlockBytes;
    }

    // ==================== GENERATION ====================

    /**
     * Non-streaming generation. Tools take precedence over JSON mode, JSON mode over text.
     */
    public GenerateResult generate(GenerateRequest request) {
        Optional<FunctionDeclaration> function = request.firstFunction();
        if (function.isPresent()) {
            Map<String, Object> args = functionCallSynthesizer.synthesizeArgs(function.get());
            log.debug("Synthesized function call: function={}, args={}", function.get().name(), args.keySet());
            return GenerateResult.functionCall(new FunctionCall(function.get().name(), args));
        }

        if (request.isJsonMode()) {
            Map<String, Object> document = resolveJsonDocument(request);
            return GenerateResult.text(toJson(document), UsageMetadata.STRUCTURED);
        }

        return GenerateResult.text(TEXT_RESPONSE, UsageMetadata.TEXT);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> resolveJsonDocument(GenerateRequest request) {
        String title = request.responseSchemaTitle();

        Optional<KnownSchemaRegistry.KnownSchema> known;
        if (title != null && !title.isEmpty()) {
            known = registry.byIdentifier(title);
        } else {
            // Legacy heuristic, only used when the caller sent no schema identifier
            known = registry.byPromptKeywords(request.promptText());
        }
        if (known.isPresent()) {
            log.debug("JSON response from known schema: schema={}", known.get().id());
            return known.get().generate();
        }

        if (request.responseSchema() != null) {
            Object synthesized = schemaSynthesizer.synthesize(request.responseSchema());
            if (synthesized instanceof Map<?, ?> map && !map.isEmpty()) {
                log.debug("JSON response synthesized from schema: title={}", title);
                return (Map<String, Object>) map;
            }
        }

        log.debug("Unidentified schema, using fallback document: title={}", title);
        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put("status", "mock_json_response");
        fallback.put("note", "Unidentified schema in prompt");
        return fallback;
    }

    private String toJson(Map<String, Object> document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize synthesized document", e);
        }
    }

    /**
     * Starts a new streaming cycle: a thinking delay drawn from the current latency bounds,
     * then one chunk per word up to the configured token count, then the terminator.
     */
    public TokenStream streamGenerate(String prompt) {
        SimulationState state = chaos.snapshot();
        Duration thinking = sampleLatency(state);
        TokenStream stream = new TokenStream(thinking);

        int chunks = Math.min(STREAM_WORDS.size(), tokenCount);
        log.debug("Stream started: thinkingMs={}, chunks={}", thinking.toMillis(), chunks);

        scheduler.runAfter(thinking, () -> emitChunk(stream, 0, chunks));
        return stream;
    }

    private void emitChunk(TokenStream stream, int index, int total) {
        if (index >= total) {
            stream.emit(StreamEvent.END);
            return;
        }
        FinishReason finishReason = index == total - 1 ? FinishReason.STOP : null;
        stream.emit(new StreamChunk(STREAM_WORDS.get(index) + " ", finishReason, index, index + 1));
        scheduler.runAfter(tokenDelay, () -> emitChunk(stream, index + 1, total));
    }

    // ==================== EMBEDDINGS / TOKENS ====================

    /**
     * One distinct dense vector per item.
     */
    public List<double[]> embed(int count) {
        List<double[]> vectors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(embedding(i));
        }
        return vectors;
    }

    /**
     * Vector of the configured dimension filled with 0.1, with coordinate
     * {@code index % dimension} set to a marker of 0.9 raised by 0.001 for every
     * full pass over the dimension, so that vectors of any batch size are distinct.
     */
    public double[] embedding(int index) {
        double[] vector = new double[embeddingDimension];
        Arrays.fill(vector, EMBEDDING_BASE);
        vector[index % embeddingDimension] = EMBEDDING_MARKER + EMBEDDING_MARKER_STEP * (index / embeddingDimension);
        return vector;
    }

    public int countTokens() {
        return COUNT_TOKENS_RESULT;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    // ==================== AGENT ====================

    /**
     * Simulated chat: cooperative sleep, then the injected failure roll, then the leak.
     *
     * @return a future failing with {@link ServiceUnavailableException} when the roll fails
     */
    public CompletableFuture<ChatResult> chat(String query) {
        SimulationState state = chaos.snapshot();
        Duration delay = sampleLatency(state);

        return scheduler.sleep(delay).thenApply(ignored -> {
            if (random.nextDouble() < state.errorRate()) {
                log.debug("Injected failure: errorRate={}", state.errorRate());
                throw new ServiceUnavailableException();
            }
            if (state.memoryLeakActive()) {
                long leaked = chaos.leak(leakBlockBytes);
                log.debug("Leaked block appended: totalBytes={}", leaked);
            }
            return new ChatResult("Simulated AI response to: " + query, delay, usedMemoryMb());
        });
    }

    /**
     * Simulated analysis lasting {@code latencyMin * 2}. With CPU stress active the work is a
     * busy loop on the scheduler thread, which stalls every other simulated request.
     */
    public CompletableFuture<AnalyzeResult> analyze() {
        SimulationState state = chaos.snapshot();
        Duration target = seconds(state.latencyMin() * 2);

        if (state.cpuStressActive()) {
            return scheduler.submit(() -> {
                burnCpu(target);
                return AnalyzeResult.cpuBound();
            });
        }
        return scheduler.sleep(target).thenApply(ignored -> AnalyzeResult.ioBound());
    }

    private void burnCpu(Duration target) {
        long deadline = System.nanoTime() + target.toNanos();
        double sink = 0;
        while (System.nanoTime() < deadline) {
            sink += Math.sqrt(1 + random.nextInt(10_000)) * random.nextDouble();
        }
        log.trace("CPU burn finished: sink={}", sink);
    }

    // ==================== HELPERS ====================

    /**
     * Uniform sample in the snapshot's latency bounds.
     */
    Duration sampleLatency(SimulationState state) {
        double min = state.latencyMin();
        double max = state.latencyMax();
        double value = max > min ? min + random.nextDouble() * (max - min) : min;
        return seconds(value);
    }

    private static Duration seconds(double value) {
        return Duration.ofNanos(Math.round(value * 1_000_000_000L));
    }

    private static double usedMemoryMb() {
        Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) / 1024.0 / 1024.0;
    }

    public ChaosController getChaos() {
        return chaos;
    }

    public Duration getTokenDelay() {
        return tokenDelay;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for InferenceSimulator.
     */
    public static final class Builder {
        private ChaosController chaos;
        private CooperativeScheduler scheduler;
        private KnownSchemaRegistry registry = KnownSchemaRegistry.withDefaults();
        private SchemaSynthesizer schemaSynthesizer = new SchemaSynthesizer();
        private ObjectMapper objectMapper = new ObjectMapper();
        private Random random = new Random();
        private Duration tokenDelay = Duration.ofMillis(50);
        private int tokenCount = 20;
        private int embeddingDimension = 768;
        private int leakBlockBytes = 1024 * 1024;

        public Builder chaos(ChaosController chaos) {
            this.chaos = chaos;
            return this;
        }

        public Builder scheduler(CooperativeScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder registry(KnownSchemaRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder schemaSynthesizer(SchemaSynthesizer schemaSynthesizer) {
            this.schemaSynthesizer = schemaSynthesizer;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder tokenDelay(Duration tokenDelay) {
            this.tokenDelay = tokenDelay;
            return this;
        }

        public Builder tokenCount(int tokenCount) {
            this.tokenCount = tokenCount;
            return this;
        }

        public Builder embeddingDimension(int embeddingDimension) {
            if (embeddingDimension <= 0) {
                throw new IllegalArgumentException("Embedding dimension must be positive");
            }
            this.embeddingDimension = embeddingDimension;
            return this;
        }

        public Builder leakBlockBytes(int leakBlockBytes) {
            this.leakBlockBytes = leakBlockBytes;
            return this;
        }

        public Builder fromConfig(SimulatorConfig.SimulationConfig config) {
            this.tokenDelay = seconds(config.getTokenDelay());
            this.tokenCount = config.getTokenCount();
            this.embeddingDimension = config.getEmbeddingDimension();
            this.leakBlockBytes = config.getLeakBlockBytes();
            return this;
        }

        public InferenceSimulator build() {
            if (chaos == null) {
                throw new IllegalStateException("ChaosController is required");
            }
            if (scheduler == null) {
                throw new IllegalStateException("CooperativeScheduler is required");
            }
            return new InferenceSimulator(this);
        }
    }
}
