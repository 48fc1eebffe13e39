package fr.lapetina.mockllm.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Function call returned by the model instead of text.
 * Argument values may be null, so the map is copied into an ordered map rather than {@code Map.copyOf}.
 */
public record FunctionCall(String name, Map<String, Object> args) {

    public FunctionCall {
        Objects.requireNonNull(name, "Name is required");
        args = args != null ? Collections.unmodifiableMap(new LinkedHashMap<>(args)) : Map.of();
    }
}
