package fr.lapetina.mockllm.loadgen;

import java.util.Objects;

/**
 * Client-side view of a conversation session, owned by a single virtual user.
 * The read offset only moves forward.
 */
public final class Session {

    private final String id;
    private long lastOffset;
    private boolean valid = true;

    public Session(String id) {
        this.id = Objects.requireNonNull(id, "Session id is required");
    }

    public String getId() {
        return id;
    }

    public long getLastOffset() {
        return lastOffset;
    }

    /**
     * Moves the offset forward; smaller values are ignored.
     */
    public void advanceTo(long offset) {
        if (offset > lastOffset) {
            lastOffset = offset;
        }
    }

    /**
     * Marks the session as gone on the server, so the owner creates a new one.
     */
    public void invalidate() {
        valid = false;
    }

    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", lastOffset=" + lastOffset + ", valid=" + valid + "}";
    }
}
