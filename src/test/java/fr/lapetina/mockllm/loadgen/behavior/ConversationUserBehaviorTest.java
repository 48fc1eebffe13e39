package fr.lapetina.mockllm.loadgen.behavior;

import fr.lapetina.mockllm.domain.model.RequestOutcome;
import fr.lapetina.mockllm.loadgen.SlaClassifier;
import fr.lapetina.mockllm.loadgen.StubLoadHttpClient;
import fr.lapetina.mockllm.loadgen.TurnLatencyPoller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationUserBehaviorTest {

    private final List<RequestOutcome> outcomes = new ArrayList<>();

    private ConversationUserBehavior behavior(StubLoadHttpClient client, String targetAgentId) {
        TurnLatencyPoller poller = new TurnLatencyPoller(client, outcomes::add, Duration.ofSeconds(5), Duration.ofSeconds(1));
        return new ConversationUserBehavior(
                new BehaviorContext(client, outcomes::add, new SlaClassifier(), poller, targetAgentId));
    }

    private static StubLoadHttpClient.Handler backend(AtomicInteger sessions, int sendStatus) {
        return request -> {
            String path = request.uri().getPath();
            if (path.equals("/agents")) {
                return StubLoadHttpClient.respond(200, "[{\"id\":\"discovered\",\"name\":\"Agent\"}]");
            }
            if (path.equals("/sessions")) {
                return StubLoadHttpClient.respond(200, "{\"id\":\"s-" + sessions.incrementAndGet() + "\"}");
            }
            if (request.method().equals("POST")) {
                return StubLoadHttpClient.respond(sendStatus, "{}");
            }
            return StubLoadHttpClient.respond(200, "[{\"offset\":1,\"kind\":\"message\",\"source\":\"ai_agent\"}]");
        };
    }

    @Test
    @DisplayName("should discover the agent and create a session on start")
    void shouldDiscoverAgent() throws InterruptedException {
        AtomicInteger sessions = new AtomicInteger();
        StubLoadHttpClient client = new StubLoadHttpClient(backend(sessions, 200));
        ConversationUserBehavior behavior = behavior(client, null);

        behavior.onStart();

        assertThat(client.getPaths()).containsExactly("GET /agents", "POST /sessions");
        assertThat(behavior.getSession().getId()).isEqualTo("s-1");
    }

    @Test
    @DisplayName("should use the configured agent without discovery")
    void shouldUseConfiguredAgent() throws InterruptedException {
        StubLoadHttpClient client = new StubLoadHttpClient(backend(new AtomicInteger(), 200));

        behavior(client, "agent-7").onStart();

        assertThat(client.getPaths()).containsExactly("POST /sessions");
    }

    @Test
    @DisplayName("should report a full turn for each task")
    void shouldMeasureTurns() throws InterruptedException {
        StubLoadHttpClient client = new StubLoadHttpClient(backend(new AtomicInteger(), 200));
        ConversationUserBehavior behavior = behavior(client, "agent-7");
        behavior.onStart();

        Random random = new Random(5);
        for (int i = 0; i < 20; i++) {
            behavior.runNextTask(random);
        }

        assertThat(outcomes)
                .filteredOn(o -> o.name().startsWith(TurnLatencyPoller.TURN_PREFIX))
                .hasSize(20)
                .allSatisfy(o -> assertThat(o.success()).isTrue())
                .extracting(RequestOutcome::name)
                .containsOnly("Full_Turn_Quick_Chat", "Full_Turn_Complex_Query");
    }

    @Test
    @DisplayName("should recreate the session after the backend lost it")
    void shouldRecreateLostSession() throws InterruptedException {
        AtomicInteger sessions = new AtomicInteger();
        StubLoadHttpClient client = new StubLoadHttpClient(backend(sessions, 404));
        ConversationUserBehavior behavior = behavior(client, "agent-7");
        behavior.onStart();

        behavior.runNextTask(new Random(1));
        assertThat(behavior.getSession().isValid()).isFalse();

        behavior.runNextTask(new Random(1));
        assertThat(sessions.get()).isEqualTo(2);
        assertThat(behavior.getSession().getId()).isEqualTo("s-2");
    }

    @Test
    @DisplayName("should report agent discovery failures and skip turns")
    void shouldReportDiscoveryFailure() throws InterruptedException {
        StubLoadHttpClient client = new StubLoadHttpClient(request -> StubLoadHttpClient.respond(200, "[]"));
        ConversationUserBehavior behavior = behavior(client, null);

        behavior.onStart();
        behavior.runNextTask(new Random(1));

        assertThat(outcomes).singleElement()
                .extracting(RequestOutcome::failureMessage)
                .isEqualTo("No agents found");
        assertThat(behavior.getSession()).isNull();
        assertThat(client.getPaths()).containsExactly("GET /agents");
    }
}
