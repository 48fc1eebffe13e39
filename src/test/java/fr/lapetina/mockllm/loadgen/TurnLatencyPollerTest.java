package fr.lapetina.mockllm.loadgen;

import fr.lapetina.mockllm.domain.model.RequestOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class TurnLatencyPollerTest {

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration WAIT_FOR_DATA = Duration.ofSeconds(2);

    private final List<RequestOutcome> outcomes = new ArrayList<>();
    private final AtomicLong clock = new AtomicLong();

    private TurnLatencyPoller poller(StubLoadHttpClient client) {
        return new TurnLatencyPoller(client, outcomes::add, POLL_TIMEOUT, WAIT_FOR_DATA, clock::get);
    }

    private Optional<RequestOutcome> outcome(String name) {
        return outcomes.stream().filter(o -> o.name().equals(name)).findFirst();
    }

    private void advance(Duration duration) {
        clock.addAndGet(duration.toNanos());
    }

    @Nested
    @DisplayName("Session creation")
    class SessionCreation {

        @Test
        @DisplayName("should return the created session")
        void shouldCreateSession() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(
                    request -> StubLoadHttpClient.respond(200, "{\"id\":\"s-1\",\"agent_id\":\"a\"}"));

            Optional<Session> session = poller(client).createSession("a");

            assertThat(session).map(Session::getId).contains("s-1");
            assertThat(outcome(TurnLatencyPoller.CREATE_NAME)).get()
                    .satisfies(o -> {
                        assertThat(o.success()).isTrue();
                        assertThat(o.requestType()).isEqualTo("POST");
                    });
            assertThat(client.getPaths()).containsExactly("POST /sessions");
        }

        @Test
        @DisplayName("should report non-200 creation as a failure")
        void shouldReportCreationFailure() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(
                    request -> StubLoadHttpClient.respond(500, "boom"));

            assertThat(poller(client).createSession("a", "custom")).isEmpty();
            assertThat(outcome("custom")).get()
                    .extracting(RequestOutcome::failureMessage)
                    .isEqualTo("Failed to create session: 500");
        }

        @Test
        @DisplayName("should report transport errors with their message")
        void shouldReportTransportError() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(request -> {
                throw new ConnectException("Connection refused");
            });

            assertThat(poller(client).createSession("a")).isEmpty();
            assertThat(outcome(TurnLatencyPoller.CREATE_NAME)).get()
                    .extracting(RequestOutcome::failureMessage)
                    .isEqualTo("Connection refused");
        }
    }

    @Nested
    @DisplayName("Turns")
    class Turns {

        @Test
        @DisplayName("should keep polling after an empty batch and report the full turn")
        void shouldCompleteTurnAfterEmptyPoll() throws InterruptedException {
            AtomicInteger polls = new AtomicInteger();
            StubLoadHttpClient client = new StubLoadHttpClient(request -> {
                advance(Duration.ofSeconds(1));
                if (request.method().equals("POST")) {
                    return StubLoadHttpClient.respond(200, "{\"offset\":0}");
                }
                if (polls.incrementAndGet() == 1) {
                    return StubLoadHttpClient.respond(200, "[]");
                }
                return StubLoadHttpClient.respond(200, "["
                        + "{\"offset\":0,\"kind\":\"message\",\"source\":\"customer\",\"message\":\"Hi\"},"
                        + "{\"offset\":1,\"kind\":\"message\",\"source\":\"ai_agent\",\"message\":\"Hello\"}]");
            });
            Session session = new Session("s-1");

            boolean replied = poller(client).runTurn(session, "Hi", "Quick_Chat");

            assertThat(replied).isTrue();
            assertThat(session.getLastOffset()).isEqualTo(2);
            assertThat(client.getPaths()).containsExactly(
                    "POST /sessions/s-1/events",
                    "GET /sessions/s-1/events?min_offset=0&wait_for_data=2",
                    "GET /sessions/s-1/events?min_offset=0&wait_for_data=2");
            RequestOutcome turn = outcome("Full_Turn_Quick_Chat").orElseThrow();
            assertThat(turn.success()).isTrue();
            assertThat(turn.requestType()).isEqualTo(TurnLatencyPoller.REQUEST_TYPE);
            assertThat(turn.responseTime()).isEqualTo(Duration.ofSeconds(3));
            assertThat(turn.responseLength()).isZero();
        }

        @Test
        @DisplayName("should advance the offset past customer events and poll from there")
        void shouldAdvanceOffset() throws InterruptedException {
            AtomicInteger polls = new AtomicInteger();
            StubLoadHttpClient client = new StubLoadHttpClient(request -> {
                if (request.method().equals("POST")) {
                    return StubLoadHttpClient.respond(200, "{}");
                }
                if (polls.incrementAndGet() == 1) {
                    return StubLoadHttpClient.respond(200,
                            "[{\"offset\":4,\"kind\":\"message\",\"source\":\"customer\"}]");
                }
                return StubLoadHttpClient.respond(200,
                        "[{\"offset\":5,\"kind\":\"message\",\"source\":\"ai_agent\"}]");
            });
            Session session = new Session("s-2");
            session.advanceTo(4);

            assertThat(poller(client).runTurn(session, "Hi", "Quick_Chat")).isTrue();
            assertThat(client.getPaths()).element(2).isEqualTo("GET /sessions/s-2/events?min_offset=5&wait_for_data=2");
            assertThat(session.getLastOffset()).isEqualTo(6);
        }

        @Test
        @DisplayName("should report a timeout when no agent message arrives before the deadline")
        void shouldTimeOut() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(request -> {
                if (request.method().equals("GET")) {
                    advance(Duration.ofSeconds(4));
                }
                return StubLoadHttpClient.respond(200, request.method().equals("GET") ? "[]" : "{}");
            });

            boolean replied = poller(client).runTurn(new Session("s-1"), "Hi", "Complex_Query");

            assertThat(replied).isFalse();
            assertThat(client.getPaths()).filteredOn(p -> p.startsWith("GET")).hasSize(3);
            RequestOutcome turn = outcome("Full_Turn_Complex_Query").orElseThrow();
            assertThat(turn.success()).isFalse();
            assertThat(turn.failureMessage()).isEqualTo(TurnLatencyPoller.TIMEOUT_MESSAGE);
            assertThat(turn.responseTime()).isEqualTo(Duration.ofSeconds(12));
        }

        @Test
        @DisplayName("should stop polling on a non-200 poll")
        void shouldStopOnPollFailure() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(request -> request.method().equals("POST")
                    ? StubLoadHttpClient.respond(200, "{}")
                    : StubLoadHttpClient.respond(500, "oops"));
            Session session = new Session("s-1");

            assertThat(poller(client).runTurn(session, "Hi", "Quick_Chat")).isFalse();

            assertThat(outcome(TurnLatencyPoller.POLL_NAME)).get()
                    .extracting(RequestOutcome::failureMessage)
                    .isEqualTo("Polling failed: 500");
            assertThat(client.getPaths()).hasSize(2);
            assertThat(session.isValid()).isTrue();
            RequestOutcome turn = outcome("Full_Turn_Quick_Chat").orElseThrow();
            assertThat(turn.success()).isFalse();
            assertThat(turn.failureMessage()).isEqualTo("Polling failed: 500");
        }

        @Test
        @DisplayName("should invalidate the session and skip the turn when the send returns 404")
        void shouldInvalidateOnSendNotFound() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(
                    request -> StubLoadHttpClient.respond(404, "{\"error\":\"Session not found\"}"));
            Session session = new Session("gone");

            assertThat(poller(client).runTurn(session, "Hi", "Quick_Chat")).isFalse();

            assertThat(session.isValid()).isFalse();
            assertThat(outcome(TurnLatencyPoller.SEND_NAME)).get()
                    .extracting(RequestOutcome::failureMessage)
                    .isEqualTo("Failed to send message: 404");
            assertThat(outcome("Full_Turn_Quick_Chat")).isEmpty();
            assertThat(client.getPaths()).containsExactly("POST /sessions/gone/events");
        }

        @Test
        @DisplayName("should report a transport error on poll and end the turn")
        void shouldReportPollTransportError() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(request -> {
                if (request.method().equals("GET")) {
                    advance(Duration.ofMillis(1500));
                    throw new IOException();
                }
                return StubLoadHttpClient.respond(200, "{}");
            });

            assertThat(poller(client).runTurn(new Session("s-1"), "Hi", "Quick_Chat")).isFalse();

            RequestOutcome poll = outcome(TurnLatencyPoller.POLL_NAME).orElseThrow();
            assertThat(poll.failureMessage()).isEqualTo("IOException");
            assertThat(poll.responseTime()).isEqualTo(Duration.ofMillis(1500));
            RequestOutcome turn = outcome("Full_Turn_Quick_Chat").orElseThrow();
            assertThat(turn.failureMessage()).isEqualTo("IOException");
            assertThat(turn.failureMessage()).isNotEqualTo(TurnLatencyPoller.TIMEOUT_MESSAGE);
        }

        @Test
        @DisplayName("should record the time spent before a send transport error")
        void shouldMeasureSendTransportError() throws InterruptedException {
            StubLoadHttpClient client = new StubLoadHttpClient(request -> {
                advance(Duration.ofMillis(700));
                throw new ConnectException("Connection reset");
            });

            assertThat(poller(client).runTurn(new Session("s-1"), "Hi", "Quick_Chat")).isFalse();

            RequestOutcome send = outcome(TurnLatencyPoller.SEND_NAME).orElseThrow();
            assertThat(send.failureMessage()).isEqualTo("Connection reset");
            assertThat(send.responseTime()).isEqualTo(Duration.ofMillis(700));
            assertThat(outcome("Full_Turn_Quick_Chat")).isEmpty();
        }
    }

    @Test
    @DisplayName("should format wait durations in seconds")
    void shouldFormatSeconds() {
        assertThat(TurnLatencyPoller.formatSeconds(Duration.ofSeconds(10))).isEqualTo("10");
        assertThat(TurnLatencyPoller.formatSeconds(Duration.ofMillis(500))).isEqualTo("0.5");
    }
}
