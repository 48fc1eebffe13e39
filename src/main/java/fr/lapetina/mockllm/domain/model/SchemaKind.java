package fr.lapetina.mockllm.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Value kinds understood by the structural synthesizer.
 */
public enum SchemaKind {
    OBJECT,
    ARRAY,
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER;

    /**
     * Case-insensitive lookup; Gemini uses upper case, JSON Schema lower case.
     */
    public static Optional<SchemaKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
