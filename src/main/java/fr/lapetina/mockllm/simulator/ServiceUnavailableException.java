package fr.lapetina.mockllm.simulator;

/**
 * Thrown when the injected error rate decides that a request fails.
 * Mapped to HTTP 503 by the API layer.
 */
public class ServiceUnavailableException extends RuntimeException {

    public static final String MESSAGE = "Service Unavailable - Overwhelmed";

    public ServiceUnavailableException() {
        super(MESSAGE);
    }
}
