package fr.lapetina.mockllm.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive, JSON-schema-like description of a value to synthesize.
 * Immutable; property order is the declaration order of the source schema.
 *
 * @param kind        value kind, null when the source declared a type we do not know
 * @param title       optional schema identifier
 * @param properties  declared properties for {@link SchemaKind#OBJECT}
 * @param items       element schema for {@link SchemaKind#ARRAY}, may be null
 * @param enumValues  allowed values for {@link SchemaKind#STRING}
 */
public record SchemaNode(
        SchemaKind kind,
        String title,
        Map<String, SchemaNode> properties,
        SchemaNode items,
        List<String> enumValues
) {
    public SchemaNode {
        properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Map.of();
        enumValues = enumValues != null ? List.copyOf(enumValues) : List.of();
    }

    public static SchemaNode of(SchemaKind kind) {
        return new SchemaNode(kind, null, null, null, null);
    }

    public static SchemaNode object(Map<String, SchemaNode> properties) {
        return new SchemaNode(SchemaKind.OBJECT, null, properties, null, null);
    }

    public static SchemaNode array(SchemaNode items) {
        return new SchemaNode(SchemaKind.ARRAY, null, null, items, null);
    }

    public static SchemaNode enumeration(String... values) {
        return new SchemaNode(SchemaKind.STRING, null, null, null, List.of(values));
    }

    public boolean isKnownKind() {
        return kind != null;
    }

    /**
     * Parses a schema from its JSON form. A missing {@code type} means OBJECT;
     * an unrecognised {@code type} yields a node of unknown kind.
     *
     * @return the parsed node, or null when the JSON is absent or not an object
     */
    public static SchemaNode fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            return null;
        }

        SchemaKind kind;
        JsonNode type = json.get("type");
        if (type == null || type.isNull()) {
            kind = SchemaKind.OBJECT;
        } else {
            kind = SchemaKind.fromName(type.asText()).orElse(null);
        }

        String title = json.hasNonNull("title") ? json.get("title").asText() : null;

        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        JsonNode props = json.get("properties");
        if (props != null && props.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.put(field.getKey(), fromJson(field.getValue()));
            }
        }

        List<String> enumValues = new ArrayList<>();
        JsonNode enumNode = json.get("enum");
        if (enumNode != null && enumNode.isArray()) {
            enumNode.forEach(value -> enumValues.add(value.asText()));
        }

        return new SchemaNode(kind, title, properties, fromJson(json.get("items")), enumValues);
    }
}
