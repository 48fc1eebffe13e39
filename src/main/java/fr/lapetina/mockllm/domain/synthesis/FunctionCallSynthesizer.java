package fr.lapetina.mockllm.domain.synthesis;

import fr.lapetina.mockllm.domain.model.FunctionDeclaration;
import fr.lapetina.mockllm.domain.model.SchemaKind;
import fr.lapetina.mockllm.domain.model.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static fr.lapetina.mockllm.domain.synthesis.KnownSchemaRegistry.document;

/**
 * Builds the arguments of a synthetic function call.
 *
 * Resolution order:
 * <ol>
 *   <li>exact match of the function name in the function-call shapes</li>
 *   <li>function-name fragment rules ({@code CustomerDependent}, {@code Guideline}, {@code Coherence})</li>
 *   <li>for the generic {@code log_data} function, property-key matching, unwrapping and
 *       re-wrapping a single {@code log_data} wrapper property</li>
 *   <li>structural synthesis of the parameter schema</li>
 *   <li>{@code {"status":"mock_response"}}</li>
 * </ol>
 * The JSON-mode registry is never consulted: a schema named exactly after a fragment resolves
 * to the same arguments as any other name carrying that fragment.
 * The returned arguments are never empty; callers downstream assert on that.
 */
public final class FunctionCallSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(FunctionCallSynthesizer.class);

    public static final String LOG_DATA = "log_data";

    private static final String CUSTOMER_DEPENDENT = "CustomerDependent";
    private static final String GUIDELINE = "Guideline";
    private static final String COHERENCE = "Coherence";

    private final KnownSchemaRegistry functionShapes;
    private final KnownSchemaRegistry logDataShapes;
    private final SchemaSynthesizer schemaSynthesizer;

    public FunctionCallSynthesizer(SchemaSynthesizer schemaSynthesizer) {
        this(functionCallShapes(), logDataShapes(), schemaSynthesizer);
    }

    public FunctionCallSynthesizer(
            KnownSchemaRegistry functionShapes,
            KnownSchemaRegistry logDataShapes,
            SchemaSynthesizer schemaSynthesizer
    ) {
        this.functionShapes = functionShapes;
        this.logDataShapes = logDataShapes;
        this.schemaSynthesizer = schemaSynthesizer;
    }

    public Map<String, Object> synthesizeArgs(FunctionDeclaration function) {
        String name = function.name() != null ? function.name() : "";

        Optional<KnownSchemaRegistry.KnownSchema> known = functionShapes.byIdentifier(name);
        if (known.isPresent()) {
            log.debug("Function args from known function shape: function={}", name);
            return known.get().generate();
        }

        Map<String, Object> args = byNameFragment(name);
        if (args.isEmpty() && LOG_DATA.equals(name)) {
            args = byLogDataProperties(function.parameters());
        }
        if (args.isEmpty()) {
            args = structural(function.parameters());
        }
        if (args.isEmpty()) {
            log.debug("No args could be derived, using fallback: function={}", name);
            args = document("status", "mock_response");
        }
        return args;
    }

    private static Map<String, Object> byNameFragment(String name) {
        if (name.contains(CUSTOMER_DEPENDENT)) {
            return customerDependentArgs();
        }
        if (name.contains(GUIDELINE)) {
            return guidelineArgs();
        }
        if (name.contains(COHERENCE)) {
            return coherenceArgs();
        }
        return new LinkedHashMap<>();
    }

    private static Map<String, Object> customerDependentArgs() {
        return document(
                "action", "reply",
                "is_customer_dependent", false,
                "customer_action", null,
                "agent_action", null);
    }

    private static Map<String, Object> guidelineArgs() {
        return document("propositions", List.of(document(
                "condition", "always",
                "action", "reply with a greeting",
                "rationale", "Greeting is polite",
                "is_continuous", true)));
    }

    private static Map<String, Object> coherenceArgs() {
        return document("is_coherent", true);
    }

    private Map<String, Object> byLogDataProperties(SchemaNode parameters) {
        if (parameters == null) {
            return new LinkedHashMap<>();
        }
        Map<String, SchemaNode> properties = parameters.properties();
        boolean wrapped = properties.containsKey(LOG_DATA);
        Map<String, SchemaNode> inspected = properties;
        if (wrapped) {
            SchemaNode wrapper = properties.get(LOG_DATA);
            inspected = wrapper != null ? wrapper.properties() : Map.of();
        }

        return logDataShapes.byPropertyNames(inspected.keySet())
                .map(shape -> {
                    Map<String, Object> inner = shape.generate();
                    if (!wrapped) {
                        return inner;
                    }
                    Map<String, Object> outer = new LinkedHashMap<>();
                    outer.put(LOG_DATA, inner);
                    return outer;
                })
                .orElseGet(LinkedHashMap::new);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> structural(SchemaNode parameters) {
        if (parameters == null || parameters.kind() != SchemaKind.OBJECT) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) schemaSynthesizer.synthesize(parameters);
    }

    /**
     * Tool-call shapes keyed by the schema names agents declare as functions. Each one yields
     * the arguments of the fragment rule its name carries.
     */
    public static KnownSchemaRegistry functionCallShapes() {
        return new KnownSchemaRegistry()
                .register(new KnownSchemaRegistry.KnownSchema(
                        "CustomerDependentActionSchema", List.of(), List.of(),
                        FunctionCallSynthesizer::customerDependentArgs))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "GuidelineContinuousPropositionSchema", List.of(), List.of(),
                        FunctionCallSynthesizer::guidelineArgs))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "DisambiguationGuidelineMatchesSchema", List.of(), List.of(),
                        FunctionCallSynthesizer::guidelineArgs))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "GenericObservationalGuidelineMatchesSchema", List.of(), List.of(),
                        FunctionCallSynthesizer::guidelineArgs))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "ConversationCoherenceCheckSchema", List.of(), List.of(),
                        FunctionCallSynthesizer::coherenceArgs));
    }

    /**
     * Shapes recognised inside the generic {@code log_data} function, in match priority order.
     */
    public static KnownSchemaRegistry logDataShapes() {
        return new KnownSchemaRegistry()
                .register(new KnownSchemaRegistry.KnownSchema(
                        "GuidelineContinuousPropositionSchema", List.of(), List.of("is_continuous"),
                        () -> document(
                                "rationale", "Greeting is polite",
                                "is_continuous", true)))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "CustomerDependentActionSchema", List.of(), List.of("is_customer_dependent"),
                        () -> document(
                                "action", "reply",
                                "is_customer_dependent", false,
                                "customer_action", null,
                                "agent_action", null)))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "AgentIntentionProposerSchema", List.of(), List.of("is_agent_intention"),
                        () -> document(
                                "condition", "The user wants to schedule an appointment",
                                "is_agent_intention", true)))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "ToolRunningActionSchema", List.of(), List.of("is_tool_running_only"),
                        () -> document(
                                "action", "Use the tool",
                                "rationale", "The user request requires a tool",
                                "is_tool_running_only", true)))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "RelativeActionSchema", List.of(), List.of("actions"),
                        () -> document("actions", List.of(document(
                                "index", "1",
                                "conditions", List.of("Always"),
                                "action", "Do something",
                                "needs_rewrite_rationale", "No need",
                                "needs_rewrite", false)))))
                .register(new KnownSchemaRegistry.KnownSchema(
                        "ReachableNodesEvaluationSchema", List.of(), List.of("step_action"),
                        () -> document(
                                "step_action", "Do something",
                                "step_action_completed", "true")));
    }
}
