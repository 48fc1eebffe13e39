package fr.lapetina.mockllm.domain.model;

import java.util.Objects;

/**
 * Outcome of a non-streaming generation: exactly one of {@code text} and
 * {@code functionCall} is set.
 */
public record GenerateResult(String text, FunctionCall functionCall, UsageMetadata usage) {

    public GenerateResult {
        Objects.requireNonNull(usage, "Usage is required");
        if ((text == null) == (functionCall == null)) {
            throw new IllegalArgumentException("Exactly one of text and functionCall must be set");
        }
    }

    public static GenerateResult text(String text, UsageMetadata usage) {
        return new GenerateResult(text, null, usage);
    }

    public static GenerateResult functionCall(FunctionCall call) {
        return new GenerateResult(null, call, UsageMetadata.STRUCTURED);
    }

    public boolean isFunctionCall() {
        return functionCall != null;
    }
}
