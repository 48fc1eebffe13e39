package fr.lapetina.mockllm.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one virtual-user request, as reported to the statistics pipeline.
 *
 * @param requestType    protocol or grouping label, e.g. {@code POST} or {@code Conversation}
 * @param name           request name used to aggregate statistics
 * @param responseTime   wall-clock time of the request
 * @param responseLength response body length in bytes
 * @param success        whether the request met its success criteria
 * @param failureMessage failure reason, null on success
 */
public record RequestOutcome(
        String requestType,
        String name,
        Duration responseTime,
        long responseLength,
        boolean success,
        String failureMessage
) {
    public RequestOutcome {
        Objects.requireNonNull(requestType, "Request type is required");
        Objects.requireNonNull(name, "Name is required");
        Objects.requireNonNull(responseTime, "Response time is required");
        if (success) {
            failureMessage = null;
        } else if (failureMessage == null) {
            failureMessage = "Unknown failure";
        }
    }

    public static RequestOutcome success(String requestType, String name, Duration responseTime, long responseLength) {
        return new RequestOutcome(requestType, name, responseTime, responseLength, true, null);
    }

    public static RequestOutcome failure(String requestType, String name, Duration responseTime,
                                         long responseLength, String failureMessage) {
        return new RequestOutcome(requestType, name, responseTime, responseLength, false, failureMessage);
    }
}
