package fr.lapetina.mockllm.simulator;

import java.time.Duration;
import java.util.Locale;

/**
 * Successful chat reply.
 *
 * @param responseText   simulated answer
 * @param processingTime sampled latency
 * @param memoryUsageMb  JVM heap in use after the request
 */
public record ChatResult(String responseText, Duration processingTime, double memoryUsageMb) {

    /**
     * Processing time in the {@code 1.23s} form.
     */
    public String formattedProcessingTime() {
        return String.format(Locale.ROOT, "%.2fs", processingTime.toNanos() / 1_000_000_000.0);
    }
}
