package fr.lapetina.mockllm.domain.model;

/**
 * Token accounting attached to a generation response.
 */
public record UsageMetadata(int promptTokenCount, int candidatesTokenCount, int totalTokenCount) {

    public static final UsageMetadata TEXT = new UsageMetadata(10, 15, 25);
    public static final UsageMetadata STRUCTURED = new UsageMetadata(50, 20, 70);

    public static UsageMetadata of(int prompt, int candidates) {
        return new UsageMetadata(prompt, candidates, prompt + candidates);
    }
}
