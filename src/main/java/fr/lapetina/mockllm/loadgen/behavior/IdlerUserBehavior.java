package fr.lapetina.mockllm.loadgen.behavior;

import fr.lapetina.mockllm.infrastructure.http.LoadHttpClient;
import fr.lapetina.mockllm.loadgen.Outcome;
import fr.lapetina.mockllm.loadgen.Session;
import fr.lapetina.mockllm.loadgen.WeightedSelector;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mostly idle session holder: sends "Hello" every 30 to 60 seconds and never waits for the reply.
 */
public final class IdlerUserBehavior extends AbstractUserBehavior {

    public static final String NAME = "idler";

    static final String CREATE_NAME = "/sessions (create idle)";
    static final String PING_NAME = "/sessions/{id}/events (idle ping)";

    private Session session;

    public IdlerUserBehavior(BehaviorContext context) {
        super(context, NAME, Duration.ofSeconds(30), Duration.ofSeconds(60));
    }

    @Override
    public void onStart() throws InterruptedException {
        Optional<String> agentId = resolveAgentId();
        if (agentId.isPresent()) {
            session = context.poller().createSession(agentId.get(), CREATE_NAME).orElse(null);
        }
    }

    @Override
    protected void registerTasks(WeightedSelector.Builder<Task> builder) {
        builder.add(random -> ping(), 1);
    }

    private void ping() throws InterruptedException {
        if (session == null) {
            return;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("kind", "message");
        event.put("source", "customer");
        event.put("message", "Hello");

        Optional<LoadHttpClient.Response> response =
                post(PING_NAME, "/sessions/" + session.getId() + "/events", event);
        if (response.isPresent()) {
            int status = response.get().statusCode();
            report("POST", PING_NAME, response.get(),
                    status == 200 ? Outcome.ok() : Outcome.failure("Error " + status));
        }
    }
}
