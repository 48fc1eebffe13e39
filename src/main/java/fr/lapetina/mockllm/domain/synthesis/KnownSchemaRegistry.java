package fr.lapetina.mockllm.domain.synthesis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Registry of structured-output shapes the simulated agent is known to request,
 * keyed by schema identifier (the schema {@code title}).
 *
 * Lookup strategies, most reliable first:
 * <ol>
 *   <li>{@link #byIdentifier(String)} - exact identifier match</li>
 *   <li>{@link #byPropertyNames(Collection)} - a declared property that only one shape has</li>
 *   <li>{@link #byPromptKeywords(String)} - legacy substring match over prompt text</li>
 * </ol>
 *
 * The keyword match is fragile: a prompt that mentions several keywords resolves to the
 * first entry in registration order, which is the documented priority list.
 */
public final class KnownSchemaRegistry {

    /**
     * A known output shape.
     *
     * @param id             schema identifier
     * @param promptKeywords lower-case substrings that suggest this shape in prompt text
     * @param propertyKeys   property names that identify this shape in a parameter schema
     * @param generator      produces a fresh instance of the canned document
     */
    public record KnownSchema(
            String id,
            List<String> promptKeywords,
            List<String> propertyKeys,
            Supplier<Map<String, Object>> generator
    ) {
        public KnownSchema {
            Objects.requireNonNull(id, "Schema id is required");
            Objects.requireNonNull(generator, "Generator is required");
            promptKeywords = promptKeywords != null ? List.copyOf(promptKeywords) : List.of();
            propertyKeys = propertyKeys != null ? List.copyOf(propertyKeys) : List.of();
        }

        public Map<String, Object> generate() {
            return generator.get();
        }
    }

    private final Map<String, KnownSchema> registry = new LinkedHashMap<>();

    /**
     * Registers a shape. Registration order is the keyword-match priority.
     */
    public KnownSchemaRegistry register(KnownSchema schema) {
        registry.put(schema.id(), schema);
        return this;
    }

    public Optional<KnownSchema> byIdentifier(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.get(id));
    }

    /**
     * Finds the first shape owning one of the given property names.
     */
    public Optional<KnownSchema> byPropertyNames(Collection<String> propertyNames) {
        if (propertyNames == null || propertyNames.isEmpty()) {
            return Optional.empty();
        }
        for (KnownSchema schema : registry.values()) {
            for (String key : schema.propertyKeys()) {
                if (propertyNames.contains(key)) {
                    return Optional.of(schema);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Legacy heuristic: first shape (in priority order) whose keyword occurs in the prompt.
     */
    public Optional<KnownSchema> byPromptKeywords(String prompt) {
        if (prompt == null || prompt.isEmpty()) {
            return Optional.empty();
        }
        String haystack = prompt.toLowerCase(Locale.ROOT);
        for (KnownSchema schema : registry.values()) {
            for (String keyword : schema.promptKeywords()) {
                if (haystack.contains(keyword)) {
                    return Optional.of(schema);
                }
            }
        }
        return Optional.empty();
    }

    public List<String> getRegisteredIds() {
        return Collections.unmodifiableList(new ArrayList<>(registry.keySet()));
    }

    /**
     * Registry pre-loaded with the conversational agent's structured-output schemas,
     * in keyword priority order.
     */
    public static KnownSchemaRegistry withDefaults() {
        return new KnownSchemaRegistry()
                .register(new KnownSchema(
                        "CustomerDependentActionSchema",
                        List.of("is_customer_dependent"),
                        List.of("is_customer_dependent"),
                        () -> document(
                                "action", "reply",
                                "is_customer_dependent", false)))
                .register(new KnownSchema(
                        "AgentIntentionProposerSchema",
                        List.of("is_agent_intention"),
                        List.of("is_agent_intention"),
                        () -> document(
                                "condition", "The user greets",
                                "is_agent_intention", false)))
                .register(new KnownSchema(
                        "ToolRunningActionSchema",
                        List.of("is_tool_running_only"),
                        List.of("is_tool_running_only"),
                        () -> document(
                                "action", "reply",
                                "rationale", "No tool needed",
                                "is_tool_running_only", false)))
                .register(new KnownSchema(
                        "GuidelineContinuousPropositionSchema",
                        List.of("is_continuous"),
                        List.of("is_continuous"),
                        () -> document(
                                "rationale", "Greeting is polite",
                                "is_continuous", true)))
                .register(new KnownSchema(
                        "RelativeActionSchema",
                        List.of("needs_rewrite"),
                        List.of("actions"),
                        () -> document(
                                "actions", List.of(document(
                                        "index", "0",
                                        "conditions", List.of(),
                                        "action", "reply",
                                        "needs_rewrite_rationale", "No rewrite needed",
                                        "needs_rewrite", false)))))
                .register(new KnownSchema(
                        "ReachableNodesEvaluationSchema",
                        List.of("step_action"),
                        List.of("step_action"),
                        () -> document(
                                "step_action", "Do something",
                                "step_action_completed", "true",
                                "children_conditions", null)))
                .register(new KnownSchema(
                        "CannedResponsePreambleSchema",
                        List.of("preamble"),
                        List.of("preamble"),
                        () -> document("preamble", "I verified the information.")))
                .register(new KnownSchema(
                        "DisambiguationGuidelineMatchesSchema",
                        List.of("is_ambiguous", "ambiguity"),
                        List.of("is_ambiguous"),
                        () -> document(
                                "tldr", "User wants to do something",
                                "ambiguity_condition_met", false,
                                "disambiguation_requested", false,
                                "is_ambiguous", false,
                                "guidelines", List.of(),
                                "clarification_action", null)))
                .register(new KnownSchema(
                        "GenericObservationalGuidelineMatchesSchema",
                        List.of(),
                        List.of("checks"),
                        () -> document("checks", List.of())));
    }

    /**
     * Ordered map from alternating key/value arguments. Null values are kept.
     */
    static Map<String, Object> document(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            result.put((String) keyValues[i], keyValues[i + 1]);
        }
        return result;
    }
}
