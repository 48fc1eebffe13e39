package fr.lapetina.mockllm.loadgen;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.mockllm.domain.model.RequestOutcome;
import fr.lapetina.mockllm.infrastructure.http.LoadHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Measures conversation turn latency against a session-oriented agent backend.
 *
 * A turn is: send a customer message, then long-poll the session events until an agent
 * message shows up, the deadline passes or a poll fails. Every HTTP exchange is reported
 * under its own name; the whole turn is reported as {@code Full_Turn_<name>} with request
 * type {@value #REQUEST_TYPE}, measured from the send.
 */
public final class TurnLatencyPoller {

    private static final Logger log = LoggerFactory.getLogger(TurnLatencyPoller.class);

    public static final String REQUEST_TYPE = "Conversation";
    public static final String TURN_PREFIX = "Full_Turn_";
    public static final String TIMEOUT_MESSAGE = "Agent response timeout";

    static final String CREATE_NAME = "/sessions (create)";
    static final String SEND_NAME = "/sessions/{id}/events (send)";
    static final String POLL_NAME = "/sessions/{id}/events (poll)";

    private final LoadHttpClient client;
    private final OutcomeRecorder recorder;
    private final Duration pollTimeout;
    private final Duration waitForData;
    private final LongSupplier nanoClock;

    public TurnLatencyPoller(LoadHttpClient client, OutcomeRecorder recorder,
                             Duration pollTimeout, Duration waitForData) {
        this(client, recorder, pollTimeout, waitForData, System::nanoTime);
    }

    TurnLatencyPoller(LoadHttpClient client, OutcomeRecorder recorder,
                      Duration pollTimeout, Duration waitForData, LongSupplier nanoClock) {
        this.client = client;
        this.recorder = recorder;
        this.pollTimeout = pollTimeout;
        this.waitForData = waitForData;
        this.nanoClock = nanoClock;
    }

    /**
     * Creates a session for the agent, reporting the exchange under {@code requestName}.
     */
    public Optional<Session> createSession(String agentId, String requestName) throws InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agent_id", agentId);

        LoadHttpClient.Response response;
        long requestStart = nanoClock.getAsLong();
        try {
            response = client.postJson("/sessions", body);
        } catch (IOException e) {
            recorder.report(RequestOutcome.failure("POST", requestName, since(requestStart), 0, describe(e)));
            return Optional.empty();
        }

        if (response.statusCode() != 200) {
            recorder.report(failure("POST", requestName, response,
                    "Failed to create session: " + response.statusCode()));
            return Optional.empty();
        }

        try {
            String id = client.readTree(response.body()).path("id").asText(null);
            if (id == null || id.isEmpty()) {
                recorder.report(failure("POST", requestName, response, "Session response has no id"));
                return Optional.empty();
            }
            recorder.report(success("POST", requestName, response));
            log.debug("Session created: sessionId={}, agentId={}", id, agentId);
            return Optional.of(new Session(id));
        } catch (IOException e) {
            recorder.report(failure("POST", requestName, response, describe(e)));
            return Optional.empty();
        }
    }

    public Optional<Session> createSession(String agentId) throws InterruptedException {
        return createSession(agentId, CREATE_NAME);
    }

    /**
     * Runs one turn and reports its latency.
     *
     * A turn ended by a failed poll is reported with the poll's failure message; one that ran
     * out of time is reported with {@value #TIMEOUT_MESSAGE}.
     *
     * @return true if an agent message was observed before the deadline
     */
    public boolean runTurn(Session session, String message, String metricName) throws InterruptedException {
        long start = nanoClock.getAsLong();

        if (!send(session, message)) {
            // Nothing was sent, so there is no turn to measure
            return false;
        }

        Optional<String> failure = pollForReply(session, start);
        Duration elapsed = since(start);

        String name = TURN_PREFIX + metricName;
        recorder.report(failure.isEmpty()
                ? RequestOutcome.success(REQUEST_TYPE, name, elapsed, 0)
                : RequestOutcome.failure(REQUEST_TYPE, name, elapsed, 0, failure.get()));

        failure.ifPresent(reason -> log.debug(
                "Turn without agent reply: sessionId={}, name={}, elapsedMs={}, reason={}",
                session.getId(), name, elapsed.toMillis(), reason));
        return failure.isEmpty();
    }

    private boolean send(Session session, String message) throws InterruptedException {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("kind", "message");
        event.put("source", "customer");
        event.put("message", message);

        LoadHttpClient.Response response;
        long requestStart = nanoClock.getAsLong();
        try {
            response = client.postJson(eventsPath(session), event);
        } catch (IOException e) {
            recorder.report(RequestOutcome.failure("POST", SEND_NAME, since(requestStart), 0, describe(e)));
            return false;
        }

        if (response.statusCode() != 200) {
            if (response.statusCode() == 404) {
                session.invalidate();
            }
            recorder.report(failure("POST", SEND_NAME, response,
                    "Failed to send message: " + response.statusCode()));
            return false;
        }
        recorder.report(success("POST", SEND_NAME, response));
        return true;
    }

    /**
     * @return empty once an agent message is observed, otherwise the reason the turn ended
     */
    private Optional<String> pollForReply(Session session, long start) throws InterruptedException {
        long deadline = start + pollTimeout.toNanos();
        Duration exchangeTimeout = waitForData.plus(client.getRequestTimeout());

        while (nanoClock.getAsLong() - deadline < 0) {
            String path = eventsPath(session)
                    + "?min_offset=" + session.getLastOffset()
                    + "&wait_for_data=" + formatSeconds(waitForData);

            LoadHttpClient.Response response;
            long requestStart = nanoClock.getAsLong();
            try {
                response = client.get(path, exchangeTimeout);
            } catch (IOException e) {
                String reason = describe(e);
                recorder.report(RequestOutcome.failure("GET", POLL_NAME, since(requestStart), 0, reason));
                return Optional.of(reason);
            }

            if (response.statusCode() != 200) {
                if (response.statusCode() == 404) {
                    session.invalidate();
                }
                String reason = "Polling failed: " + response.statusCode();
                recorder.report(failure("GET", POLL_NAME, response, reason));
                return Optional.of(reason);
            }

            JsonNode events;
            try {
                events = client.readTree(response.body());
            } catch (IOException e) {
                String reason = describe(e);
                recorder.report(failure("GET", POLL_NAME, response, reason));
                return Optional.of(reason);
            }

            recorder.report(success("GET", POLL_NAME, response));

            if (!events.isArray() || events.isEmpty()) {
                // Long poll expired without data
                continue;
            }

            long maxOffset = -1;
            boolean agentReplied = false;
            for (JsonNode event : events) {
                maxOffset = Math.max(maxOffset, event.path("offset").asLong(0));
                if ("ai_agent".equals(event.path("source").asText())
                        && "message".equals(event.path("kind").asText())) {
                    agentReplied = true;
                }
            }
            session.advanceTo(maxOffset + 1);

            if (agentReplied) {
                return Optional.empty();
            }
        }
        return Optional.of(TIMEOUT_MESSAGE);
    }

    private Duration since(long start) {
        return Duration.ofNanos(nanoClock.getAsLong() - start);
    }

    private static String eventsPath(Session session) {
        return "/sessions/" + session.getId() + "/events";
    }

    static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return Long.toString(millis / 1000);
        }
        return Double.toString(millis / 1000.0);
    }

    private static RequestOutcome success(String method, String name, LoadHttpClient.Response response) {
        return RequestOutcome.success(method, name, response.elapsed(), response.bodyLength());
    }

    private static RequestOutcome failure(String method, String name, LoadHttpClient.Response response,
                                          String message) {
        return RequestOutcome.failure(method, name, response.elapsed(), response.bodyLength(), message);
    }

    static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
