package fr.lapetina.mockllm.loadgen.behavior;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.mockllm.domain.model.RequestOutcome;
import fr.lapetina.mockllm.infrastructure.http.LoadHttpClient;
import fr.lapetina.mockllm.loadgen.Outcome;
import fr.lapetina.mockllm.loadgen.WeightedSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;

/**
 * Base class for behaviours built from weighted tasks.
 *
 * Provides request helpers that turn transport errors into failed outcomes carrying the
 * exception message and the time spent until the error, so a task never aborts the user
 * loop on a network error.
 */
public abstract class AbstractUserBehavior implements UserBehavior {

    private static final Logger log = LoggerFactory.getLogger(AbstractUserBehavior.class);

    /**
     * One unit of user work.
     */
    @FunctionalInterface
    protected interface Task {
        void run(Random random) throws InterruptedException;
    }

    protected final BehaviorContext context;
    private final String name;
    private final Duration minWait;
    private final Duration maxWait;
    private WeightedSelector<Task> tasks;

    protected AbstractUserBehavior(BehaviorContext context, String name, Duration minWait, Duration maxWait) {
        if (minWait.compareTo(maxWait) > 0) {
            throw new IllegalArgumentException("minWait must not exceed maxWait");
        }
        this.context = context;
        this.name = name;
        this.minWait = minWait;
        this.maxWait = maxWait;
    }

    /**
     * Declares the weighted tasks of this behaviour.
     */
    protected abstract void registerTasks(WeightedSelector.Builder<Task> builder);

    @Override
    public final void runNextTask(Random random) throws InterruptedException {
        if (tasks == null) {
            WeightedSelector.Builder<Task> builder = WeightedSelector.builder();
            registerTasks(builder);
            tasks = builder.build();
        }
        tasks.select(random).run(random);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Duration getMinWait() {
        return minWait;
    }

    @Override
    public Duration getMaxWait() {
        return maxWait;
    }

    // ==================== Request helpers ====================

    protected Optional<LoadHttpClient.Response> get(String requestName, String path) throws InterruptedException {
        long start = System.nanoTime();
        try {
            return Optional.of(context.client().get(path));
        } catch (IOException e) {
            reportTransportFailure("GET", requestName, Duration.ofNanos(System.nanoTime() - start), e);
            return Optional.empty();
        }
    }

    protected Optional<LoadHttpClient.Response> post(String requestName, String path, Object body)
            throws InterruptedException {
        long start = System.nanoTime();
        try {
            return Optional.of(context.client().postJson(path, body));
        } catch (IOException e) {
            reportTransportFailure("POST", requestName, Duration.ofNanos(System.nanoTime() - start), e);
            return Optional.empty();
        }
    }

    protected void report(String method, String requestName, LoadHttpClient.Response response, Outcome outcome) {
        context.recorder().report(new RequestOutcome(
                method,
                requestName,
                response.elapsed(),
                response.bodyLength(),
                outcome.success(),
                outcome.failureMessage()
        ));
    }

    private void reportTransportFailure(String method, String requestName, Duration elapsed, IOException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.debug("Transport error: user={}, request={}, error={}", name, requestName, message);
        context.recorder().report(RequestOutcome.failure(method, requestName, elapsed, 0, message));
    }

    /**
     * Resolves the agent to talk to: the configured one, else the first listed by {@code GET /agents}.
     */
    protected Optional<String> resolveAgentId() throws InterruptedException {
        if (context.targetAgentId() != null) {
            return Optional.of(context.targetAgentId());
        }

        Optional<LoadHttpClient.Response> maybeResponse = get("/agents", "/agents");
        if (maybeResponse.isEmpty()) {
            return Optional.empty();
        }
        LoadHttpClient.Response response = maybeResponse.get();
        if (response.statusCode() != 200) {
            report("GET", "/agents", response, Outcome.failure("Failed to list agents: " + response.statusCode()));
            return Optional.empty();
        }

        try {
            JsonNode agents = context.client().readTree(response.body());
            if (agents.isArray() && !agents.isEmpty() && agents.get(0).hasNonNull("id")) {
                report("GET", "/agents", response, Outcome.ok());
                return Optional.of(agents.get(0).get("id").asText());
            }
            report("GET", "/agents", response, Outcome.failure("No agents found"));
        } catch (IOException e) {
            report("GET", "/agents", response, Outcome.failure(e.getMessage()));
        }
        return Optional.empty();
    }
}
