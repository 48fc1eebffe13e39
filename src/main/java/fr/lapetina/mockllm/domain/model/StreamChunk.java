package fr.lapetina.mockllm.domain.model;

import java.util.Objects;

/**
 * One streamed word fragment.
 *
 * @param text                 fragment text, including its trailing space
 * @param finishReason         {@link FinishReason#STOP} on the last chunk, null otherwise
 * @param index                zero-based position in the stream
 * @param cumulativeTokenCount tokens emitted so far, this chunk included
 */
public record StreamChunk(
        String text,
        FinishReason finishReason,
        int index,
        int cumulativeTokenCount
) implements StreamEvent {

    public StreamChunk {
        Objects.requireNonNull(text, "Text is required");
    }

    public boolean isLast() {
        return finishReason == FinishReason.STOP;
    }
}
