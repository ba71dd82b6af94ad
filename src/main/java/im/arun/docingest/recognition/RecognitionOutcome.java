package im.arun.docingest.recognition;

import im.arun.docingest.model.RecognitionResult;

/**
 * Result of {@link RecognitionClient#recognize}: either a result or a qualified failure.
 */
public final class RecognitionOutcome {
    private final RecognitionResult result;
    private final FailureCause failureCause;
    private final String message;
    private final int attempts;

    private RecognitionOutcome(RecognitionResult result, FailureCause failureCause, String message, int attempts) {
        this.result = result;
        this.failureCause = failureCause;
        this.message = message;
        this.attempts = attempts;
    }

    public static RecognitionOutcome success(RecognitionResult result, int attempts) {
        return new RecognitionOutcome(result, null, null, attempts);
    }

    public static RecognitionOutcome failure(FailureCause cause, String message, int attempts) {
        return new RecognitionOutcome(null, cause, message, attempts);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public RecognitionResult getResult() {
        return result;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Number of calls that reached the service.
     */
    public int getAttempts() {
        return attempts;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "RecognitionOutcome[success after " + attempts + " attempt(s)]"
                : "RecognitionOutcome[" + failureCause + ": " + message + "]";
    }
}
