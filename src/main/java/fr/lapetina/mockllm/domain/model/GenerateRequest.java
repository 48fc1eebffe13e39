package fr.lapetina.mockllm.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parsed non-streaming generation request.
 * Immutable and thread-safe.
 *
 * @param promptText        concatenated text of every content part, in order
 * @param functions         declared tool functions across all tools, in order
 * @param responseMimeType  requested response MIME type, empty when absent
 * @param responseSchema    requested response schema, may be null
 */
public record GenerateRequest(
        String promptText,
        List<FunctionDeclaration> functions,
        String responseMimeType,
        SchemaNode responseSchema
) {
    public static final String JSON_MIME_TYPE = "application/json";

    public GenerateRequest {
        promptText = promptText != null ? promptText : "";
        functions = functions != null ? List.copyOf(functions) : List.of();
        responseMimeType = responseMimeType != null ? responseMimeType : "";
    }

    public static GenerateRequest ofPrompt(String prompt) {
        return new GenerateRequest(prompt, null, null, null);
    }

    public Optional<FunctionDeclaration> firstFunction() {
        return functions.isEmpty() ? Optional.empty() : Optional.of(functions.get(0));
    }

    public boolean isJsonMode() {
        return responseMimeType.contains(JSON_MIME_TYPE);
    }

    /**
     * Schema title, or null when no schema or no title was sent.
     */
    public String responseSchemaTitle() {
        return responseSchema != null ? responseSchema.title() : null;
    }

    /**
     * Reads the generative wire format:
     * {@code contents[].parts[].text}, {@code tools[].functionDeclarations[]} and
     * {@code generationConfig.{responseMimeType,responseSchema}}.
     */
    public static GenerateRequest fromJson(JsonNode body) {
        StringBuilder prompt = new StringBuilder();
        for (JsonNode content : body.path("contents")) {
            for (JsonNode part : content.path("parts")) {
                prompt.append(part.path("text").asText(""));
            }
        }

        List<FunctionDeclaration> functions = new ArrayList<>();
        for (JsonNode tool : body.path("tools")) {
            for (JsonNode declaration : tool.path("functionDeclarations")) {
                String name = declaration.hasNonNull("name") ? declaration.get("name").asText() : null;
                functions.add(new FunctionDeclaration(name, SchemaNode.fromJson(declaration.get("parameters"))));
            }
        }

        JsonNode generationConfig = body.path("generationConfig");
        String mimeType = generationConfig.path("responseMimeType").asText("");
        SchemaNode schema = SchemaNode.fromJson(generationConfig.get("responseSchema"));

        return new GenerateRequest(prompt.toString(), functions, mimeType, schema);
    }
}
