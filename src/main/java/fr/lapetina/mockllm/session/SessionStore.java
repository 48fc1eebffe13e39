package fr.lapetina.mockllm.session;

import fr.lapetina.mockllm.simulator.InferenceSimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * In-memory session backend standing in for the conversational agent.
 *
 * A customer message schedules an agent reply produced by {@link InferenceSimulator#chat(String)},
 * so replies carry the current chaos latency, error rate and leak. Readers long-poll with
 * {@link #awaitEvents(String, long, Duration)} on their own thread.
 *
 * Sessions are only removed by {@link #evictIdle()}, once untouched for longer than the idle
 * timeout. With a zero timeout the map grows for the life of the process.
 */
public final class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final Map<String, SessionLog> sessions = new ConcurrentHashMap<>();
    private final InferenceSimulator simulator;
    private final String agentId;
    private final String agentName;
    private final Duration idleTimeout;
    private final LongSupplier nanoClock;

    public SessionStore(InferenceSimulator simulator, String agentId, String agentName) {
        this(simulator, agentId, agentName, Duration.ZERO);
    }

    public SessionStore(InferenceSimulator simulator, String agentId, String agentName, Duration idleTimeout) {
        this(simulator, agentId, agentName, idleTimeout, System::nanoTime);
    }

    SessionStore(InferenceSimulator simulator, String agentId, String agentName,
                 Duration idleTimeout, LongSupplier nanoClock) {
        if (idleTimeout.isNegative()) {
            throw new IllegalArgumentException("Idle timeout must not be negative");
        }
        this.simulator = simulator;
        this.agentId = agentId;
        this.agentName = agentName;
        this.idleTimeout = idleTimeout;
        this.nanoClock = nanoClock;
    }

    /**
     * Session handle returned on creation.
     */
    public record SessionInfo(String id, String agentId) {
    }

    /**
     * Agent descriptor listed by the agents endpoint.
     */
    public record AgentInfo(String id, String name) {
    }

    public List<AgentInfo> listAgents() {
        return List.of(new AgentInfo(agentId, agentName));
    }

    public SessionInfo createSession(String requestedAgentId) {
        String owner = requestedAgentId != null && !requestedAgentId.isBlank() ? requestedAgentId : agentId;
        String id = UUID.randomUUID().toString();
        sessions.put(id, new SessionLog(nanoClock.getAsLong()));
        log.debug("Session created: sessionId={}, agentId={}", id, owner);
        return new SessionInfo(id, owner);
    }

    /**
     * Appends an event. A customer message also schedules the agent reply.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public SessionEvent appendEvent(String sessionId, String kind, String source, String message) {
        SessionLog sessionLog = require(sessionId);
        SessionEvent event = sessionLog.append(kind, source, message);

        if (SessionEvent.SOURCE_CUSTOMER.equals(source) && SessionEvent.KIND_MESSAGE.equals(kind)) {
            scheduleReply(sessionId, sessionLog, message);
        }
        return event;
    }

    private void scheduleReply(String sessionId, SessionLog sessionLog, String message) {
        simulator.chat(message != null ? message : "").whenComplete((result, error) -> {
            if (error == null) {
                sessionLog.append(SessionEvent.KIND_MESSAGE, SessionEvent.SOURCE_AI_AGENT, result.responseText());
            } else {
                log.warn("Agent reply failed: sessionId={}, error={}", sessionId, rootMessage(error));
                sessionLog.append(SessionEvent.KIND_STATUS, SessionEvent.SOURCE_AI_AGENT, "error");
            }
        });
    }

    /**
     * Returns events with {@code offset >= minOffset}, waiting up to {@code waitForData}
     * for at least one to appear.
     *
     * @return the matching events, empty when none arrived in time
     * @throws SessionNotFoundException if the session does not exist
     */
    public List<SessionEvent> awaitEvents(String sessionId, long minOffset, Duration waitForData)
            throws InterruptedException {
        SessionLog sessionLog = require(sessionId);
        try {
            return sessionLog.await(minOffset, waitForData);
        } finally {
            sessionLog.touch(nanoClock.getAsLong());
        }
    }

    /**
     * Removes sessions untouched for longer than the idle timeout. A zero timeout disables eviction.
     *
     * @return the number of sessions removed
     */
    public int evictIdle() {
        if (idleTimeout.isZero()) {
            return 0;
        }
        long now = nanoClock.getAsLong();
        long timeoutNanos = idleTimeout.toNanos();
        int evicted = 0;
        Iterator<SessionLog> it = sessions.values().iterator();
        while (it.hasNext()) {
            if (now - it.next().lastAccess() > timeoutNanos) {
                it.remove();
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted idle sessions: count={}, remaining={}", evicted, sessions.size());
        }
        return evicted;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public boolean exists(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    private SessionLog require(String sessionId) {
        SessionLog sessionLog = sessions.get(sessionId);
        if (sessionLog == null) {
            throw new SessionNotFoundException(sessionId);
        }
        sessionLog.touch(nanoClock.getAsLong());
        return sessionLog;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    /**
     * Append-only event log of one session.
     */
    private static final class SessionLog {
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition appended = lock.newCondition();
        private final List<SessionEvent> events = new ArrayList<>();
        private volatile long lastAccess;

        SessionLog(long createdAt) {
            this.lastAccess = createdAt;
        }

        void touch(long now) {
            lastAccess = now;
        }

        long lastAccess() {
            return lastAccess;
        }

        SessionEvent append(String kind, String source, String message) {
            lock.lock();
            try {
                SessionEvent event = new SessionEvent(
                        UUID.randomUUID().toString(), events.size(), kind, source, message, null);
                events.add(event);
                appended.signalAll();
                return event;
            } finally {
                lock.unlock();
            }
        }

        List<SessionEvent> await(long minOffset, Duration waitForData) throws InterruptedException {
            long remaining = Math.max(0, waitForData.toNanos());
            lock.lock();
            try {
                while (events.size() <= minOffset && remaining > 0) {
                    remaining = appended.awaitNanos(remaining);
                }
                if (events.size() <= minOffset) {
                    return List.of();
                }
                int from = (int) Math.max(0, minOffset);
                return List.copyOf(events.subList(from, events.size()));
            } finally {
                lock.unlock();
            }
        }
    }
}
