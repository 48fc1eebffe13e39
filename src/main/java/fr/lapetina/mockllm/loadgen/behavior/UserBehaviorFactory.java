package fr.lapetina.mockllm.loadgen.behavior;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Creates user behaviours by configuration name.
 */
public final class UserBehaviorFactory {

    private static final Map<String, Function<BehaviorContext, UserBehavior>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(AiUserBehavior.NAME, AiUserBehavior::new);
        register(ConversationUserBehavior.NAME, ConversationUserBehavior::new);
        register(IdlerUserBehavior.NAME, IdlerUserBehavior::new);
    }

    private UserBehaviorFactory() {
        // Utility class
    }

    /**
     * Registers a custom behaviour.
     *
     * @param name    behaviour name used in the {@code userMix} configuration
     * @param creator creates one instance per virtual user
     */
    public static void register(String name, Function<BehaviorContext, UserBehavior> creator) {
        REGISTRY.put(name.toLowerCase(), creator);
    }

    public static Optional<Function<BehaviorContext, UserBehavior>> find(String name) {
        return Optional.ofNullable(REGISTRY.get(name.toLowerCase()));
    }

    public static UserBehavior create(String name, BehaviorContext context) {
        return find(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown user type: " + name))
                .apply(context);
    }

    public static Set<String> getRegisteredNames() {
        return Set.copyOf(REGISTRY.keySet());
    }
}
