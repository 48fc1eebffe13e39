package fr.lapetina.mockllm.api.dto;

import fr.lapetina.mockllm.domain.model.GenerateResult;
import fr.lapetina.mockllm.domain.model.StreamChunk;
import fr.lapetina.mockllm.domain.model.UsageMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds generative API response bodies. Maps are ordered and may hold nulls,
 * which the wire format needs for {@code finishReason} on intermediate chunks.
 */
public final class GenerativeResponses {

    private GenerativeResponses() {
    }

    /**
     * Creates the body of a non-streaming generation.
     */
    public static Map<String, Object> fromResult(GenerateResult result) {
        Map<String, Object> part = new LinkedHashMap<>();
        if (result.isFunctionCall()) {
            Map<String, Object> call = new LinkedHashMap<>();
            call.put("name", result.functionCall().name());
            call.put("args", result.functionCall().args());
            part.put("functionCall", call);
        } else {
            part.put("text", result.text());
        }
        return body(part, "STOP", result.usage());
    }

    /**
     * Creates the body of one streamed chunk. The candidate index is always 0.
     */
    public static Map<String, Object> fromChunk(StreamChunk chunk, int promptTokens) {
        Map<String, Object> part = new LinkedHashMap<>();
        part.put("text", chunk.text());
        String finishReason = chunk.finishReason() != null ? chunk.finishReason().name() : null;
        return body(part, finishReason, UsageMetadata.of(promptTokens, chunk.cumulativeTokenCount()));
    }

    public static Map<String, Object> embedContent(double[] vector) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("embedding", values(vector));
        return response;
    }

    public static Map<String, Object> batchEmbedContents(List<double[]> vectors) {
        List<Map<String, Object>> embeddings = new ArrayList<>(vectors.size());
        for (double[] vector : vectors) {
            embeddings.add(values(vector));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("embeddings", embeddings);
        return response;
    }

    public static Map<String, Object> predict(List<double[]> vectors) {
        List<Map<String, Object>> predictions = new ArrayList<>(vectors.size());
        for (double[] vector : vectors) {
            Map<String, Object> prediction = new LinkedHashMap<>();
            prediction.put("embeddings", values(vector));
            predictions.add(prediction);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("predictions", predictions);
        return response;
    }

    public static Map<String, Object> countTokens(int totalTokens) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("totalTokens", totalTokens);
        return response;
    }

    private static Map<String, Object> values(double[] vector) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("values", vector);
        return values;
    }

    private static Map<String, Object> body(Map<String, Object> part, String finishReason, UsageMetadata usage) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("parts", List.of(part));
        content.put("role", "model");

        Map<String, Object> candidate = new LinkedHashMap<>();
        candidate.put("content", content);
        candidate.put("finishReason", finishReason);
        candidate.put("index", 0);

        Map<String, Object> usageMetadata = new LinkedHashMap<>();
        usageMetadata.put("promptTokenCount", usage.promptTokenCount());
        usageMetadata.put("candidatesTokenCount", usage.candidatesTokenCount());
        usageMetadata.put("totalTokenCount", usage.totalTokenCount());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("candidates", List.of(candidate));
        response.put("usageMetadata", usageMetadata);
        return response;
    }
}
