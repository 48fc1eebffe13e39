package fr.lapetina.mockllm.loadgen.event;

import fr.lapetina.mockllm.domain.model.RequestOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running statistics for one request name.
 *
 * Written by the statistics handler thread, read by whoever asks for a summary.
 */
public final class RequestStats {

    private final String requestType;
    private final String name;
    private long count;
    private long failures;
    private long totalMillis;
    private long minMillis = Long.MAX_VALUE;
    private long maxMillis;
    private final Map<String, Long> failureMessages = new LinkedHashMap<>();

    public RequestStats(String requestType, String name) {
        this.requestType = requestType;
        this.name = name;
    }

    public synchronized void record(RequestOutcome outcome) {
        long millis = outcome.responseTime().toMillis();
        count++;
        totalMillis += millis;
        minMillis = Math.min(minMillis, millis);
        maxMillis = Math.max(maxMillis, millis);
        if (!outcome.success()) {
            failures++;
            failureMessages.merge(outcome.failureMessage(), 1L, Long::sum);
        }
    }

    public synchronized Summary snapshot() {
        return new Summary(
                requestType,
                name,
                count,
                failures,
                count > 0 ? minMillis : 0,
                count > 0 ? (double) totalMillis / count : 0.0,
                maxMillis,
                Collections.unmodifiableMap(new LinkedHashMap<>(failureMessages))
        );
    }

    /**
     * Point-in-time view of the statistics of one request name.
     */
    public record Summary(
            String requestType,
            String name,
            long count,
            long failures,
            long minMillis,
            double avgMillis,
            long maxMillis,
            Map<String, Long> failureMessages
    ) {
        public double failureRatio() {
            return count > 0 ? (double) failures / count : 0.0;
        }
    }
}
