package fr.lapetina.mockllm.session;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Event stored in a session log. Offsets are dense and start at 0.
 */
public record SessionEvent(
        String id,
        long offset,
        String kind,
        String source,
        String message,
        @JsonProperty("created_at") Instant createdAt
) {
    public static final String KIND_MESSAGE = "message";
    public static final String KIND_STATUS = "status";
    public static final String SOURCE_CUSTOMER = "customer";
    public static final String SOURCE_AI_AGENT = "ai_agent";

    public SessionEvent {
        Objects.requireNonNull(id, "Id is required");
        Objects.requireNonNull(kind, "Kind is required");
        Objects.requireNonNull(source, "Source is required");
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative, got " + offset);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isAgentMessage() {
        return SOURCE_AI_AGENT.equals(source) && KIND_MESSAGE.equals(kind);
    }
}
