package fr.lapetina.mockllm.domain.model;

/**
 * A tool function offered to the model.
 *
 * @param name       function name, never null
 * @param parameters parameter schema, may be null
 */
public record FunctionDeclaration(String name, SchemaNode parameters) {

    public FunctionDeclaration {
        if (name == null) {
            name = "unknown_function";
        }
    }
}
