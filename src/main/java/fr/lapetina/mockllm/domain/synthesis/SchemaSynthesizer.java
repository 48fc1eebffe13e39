package fr.lapetina.mockllm.domain.synthesis;

import fr.lapetina.mockllm.domain.model.SchemaNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic structural synthesis: builds a placeholder value that conforms to a schema.
 *
 * Deterministic: the same schema always yields an equal value.
 */
public final class SchemaSynthesizer {

    public static final String PLACEHOLDER_STRING = "mock_string";

    /**
     * Synthesizes a value for the node.
     *
     * @return a Map for OBJECT, a one-element List for ARRAY, a String, Boolean, Long or
     *         Double for scalars, and an empty Map for an absent or unknown schema
     */
    public Object synthesize(SchemaNode node) {
        if (node == null || !node.isKnownKind()) {
            return new LinkedHashMap<String, Object>();
        }

        return switch (node.kind()) {
            case OBJECT -> synthesizeObject(node);
            case ARRAY -> List.of(synthesize(node.items()));
            case STRING -> node.enumValues().isEmpty() ? PLACEHOLDER_STRING : node.enumValues().get(0);
            case BOOLEAN -> Boolean.FALSE;
            case INTEGER -> 1L;
            case NUMBER -> 1.0d;
        };
    }

    private Map<String, Object> synthesizeObject(SchemaNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<String, SchemaNode> property : node.properties().entrySet()) {
            result.put(property.getKey(), synthesize(property.getValue()));
        }
        return result;
    }
}
