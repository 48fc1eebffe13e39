package fr.lapetina.mockllm.loadgen.behavior;

import fr.lapetina.mockllm.infrastructure.http.LoadHttpClient;
import fr.lapetina.mockllm.loadgen.WeightedSelector;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Application user hitting the agent endpoints directly: chat (3), analyze (1), health (1).
 */
public final class AiUserBehavior extends AbstractUserBehavior {

    public static final String NAME = "ai";

    static final String CHAT_PATH = "/api/v1/agent/chat";
    static final String ANALYZE_PATH = "/api/v1/agent/analyze";
    static final String HEALTH_PATH = "/health";

    public AiUserBehavior(BehaviorContext context) {
        super(context, NAME, Duration.ofSeconds(1), Duration.ofSeconds(5));
    }

    @Override
    protected void registerTasks(WeightedSelector.Builder<Task> builder) {
        builder.add(this::chat, 3)
                .add(random -> analyze(), 1)
                .add(random -> health(), 1);
    }

    void chat(Random random) throws InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", "Summarize email");
        payload.put("user_id", String.valueOf(1000 + random.nextInt(9000)));
        payload.put("mock_mode", true);

        Optional<LoadHttpClient.Response> response = post(CHAT_PATH, CHAT_PATH, payload);
        if (response.isPresent()) {
            report("POST", CHAT_PATH, response.get(),
                    context.slaClassifier().classifyChat(response.get().statusCode()));
        }
    }

    void analyze() throws InterruptedException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", "Analyze dataset");
        payload.put("user_id", "admin");
        payload.put("mock_mode", true);

        Optional<LoadHttpClient.Response> response = post(ANALYZE_PATH, ANALYZE_PATH, payload);
        if (response.isPresent()) {
            report("POST", ANALYZE_PATH, response.get(),
                    context.slaClassifier().classifyAnalyze(response.get().statusCode(), response.get().elapsed()));
        }
    }

    void health() throws InterruptedException {
        Optional<LoadHttpClient.Response> response = get(HEALTH_PATH, HEALTH_PATH);
        if (response.isPresent()) {
            report("GET", HEALTH_PATH, response.get(),
                    context.slaClassifier().classifyHealth(response.get().statusCode(), response.get().elapsed()));
        }
    }
}
