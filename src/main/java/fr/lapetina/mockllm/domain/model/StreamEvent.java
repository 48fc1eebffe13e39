package fr.lapetina.mockllm.domain.model;

/**
 * Element of a token stream: either a {@link StreamChunk} or the {@link #END} marker
 * that closes every stream.
 */
public interface StreamEvent {

    /** Terminator emitted once after the last chunk. */
    StreamEvent END = new StreamEvent() {
        @Override
        public boolean isTerminator() {
            return true;
        }

        @Override
        public String toString() {
            return "[DONE]";
        }
    };

    default boolean isTerminator() {
        return false;
    }
}
