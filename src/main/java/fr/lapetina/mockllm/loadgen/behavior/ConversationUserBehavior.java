package fr.lapetina.mockllm.loadgen.behavior;

import fr.lapetina.mockllm.loadgen.Session;
import fr.lapetina.mockllm.loadgen.WeightedSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Patient chatting with a conversational agent through sessions.
 *
 * Quick chats (3) and complex queries (1) are measured end to end by the turn poller.
 * The session is created on start and recreated lazily when missing or gone.
 */
public final class ConversationUserBehavior extends AbstractUserBehavior {

    private static final Logger log = LoggerFactory.getLogger(ConversationUserBehavior.class);

    public static final String NAME = "conversation";

    static final List<String> QUICK_MESSAGES = List.of(
            "Hello",
            "What are your office hours?",
            "Thank you"
    );

    static final List<String> COMPLEX_MESSAGES = List.of(
            "I would like to schedule an appointment for next week",
            "Can you check my lab results and explain what they mean?",
            "I need to see a specialist for my back pain, what are my options?"
    );

    private String agentId;
    private Session session;

    public ConversationUserBehavior(BehaviorContext context) {
        super(context, NAME, Duration.ofSeconds(1), Duration.ofSeconds(3));
    }

    @Override
    public void onStart() throws InterruptedException {
        agentId = resolveAgentId().orElse(null);
        ensureSession();
    }

    @Override
    protected void registerTasks(WeightedSelector.Builder<Task> builder) {
        builder.add(random -> turn(random, QUICK_MESSAGES, "Quick_Chat"), 3)
                .add(random -> turn(random, COMPLEX_MESSAGES, "Complex_Query"), 1);
    }

    private void turn(Random random, List<String> messages, String metricName) throws InterruptedException {
        if (!ensureSession()) {
            return;
        }
        String message = messages.get(random.nextInt(messages.size()));
        context.poller().runTurn(session, message, metricName);
    }

    private boolean ensureSession() throws InterruptedException {
        if (session != null && session.isValid()) {
            return true;
        }
        if (agentId == null) {
            log.debug("No agent available, skipping session creation");
            return false;
        }
        session = context.poller().createSession(agentId).orElse(null);
        return session != null;
    }

    Session getSession() {
        return session;
    }
}
