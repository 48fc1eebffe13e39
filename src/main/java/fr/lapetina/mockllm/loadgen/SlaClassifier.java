package fr.lapetina.mockllm.loadgen;

import java.time.Duration;

/**
 * Client-side success criteria of the AI user's requests.
 * SLA breaches are decided here only; the server never enforces them.
 */
public final class SlaClassifier {

    public static final Duration DEFAULT_ANALYZE_SLA = Duration.ofSeconds(2);
    public static final Duration DEFAULT_HEALTH_SLA = Duration.ofSeconds(1);

    private final Duration analyzeSla;
    private final Duration healthSla;

    public SlaClassifier(Duration analyzeSla, Duration healthSla) {
        this.analyzeSla = analyzeSla;
        this.healthSla = healthSla;
    }

    public SlaClassifier() {
        this(DEFAULT_ANALYZE_SLA, DEFAULT_HEALTH_SLA);
    }

    public Outcome classifyChat(int statusCode) {
        return switch (statusCode) {
            case 200 -> Outcome.ok();
            case 503 -> Outcome.failure("503: Upstream Service Unavailable");
            case 504 -> Outcome.failure("504: Gateway Timeout");
            default -> Outcome.failure("Error " + statusCode);
        };
    }

    /**
     * A slow analysis fails whatever its status.
     */
    public Outcome classifyAnalyze(int statusCode, Duration elapsed) {
        if (elapsed.compareTo(analyzeSla) > 0) {
            return Outcome.failure("SLA Violation: > " + formatSeconds(analyzeSla) + " Response");
        }
        return statusCode == 200 ? Outcome.ok() : Outcome.failure("Error " + statusCode);
    }

    public Outcome classifyHealth(int statusCode, Duration elapsed) {
        if (elapsed.compareTo(healthSla) > 0) {
            return Outcome.failure("Health Check Timeout: > " + formatSeconds(healthSla) + " (Pod would be restarted)");
        }
        if (statusCode != 200) {
            return Outcome.failure("Health Check Failed: Non-200 Status");
        }
        return Outcome.ok();
    }

    private static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : (millis / 1000.0) + "s";
    }
}
