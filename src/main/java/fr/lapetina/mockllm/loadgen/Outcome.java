package fr.lapetina.mockllm.loadgen;

/**
 * Verdict on one response: success, or failure with a message.
 */
public record Outcome(boolean success, String failureMessage) {

    private static final Outcome SUCCESS = new Outcome(true, null);

    public static Outcome ok() {
        return SUCCESS;
    }

    public static Outcome failure(String message) {
        return new Outcome(false, message);
    }
}
