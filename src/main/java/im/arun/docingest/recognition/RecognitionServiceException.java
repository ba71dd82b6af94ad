package im.arun.docingest.recognition;

/**
 * A single failed call to the remote recognition service.
 */
public class RecognitionServiceException extends Exception {

    private final FailureCause failureCause;
    private final int statusCode;

    public RecognitionServiceException(FailureCause failureCause, String message) {
        this(failureCause, message, -1, null);
    }

    public RecognitionServiceException(FailureCause failureCause, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.failureCause = failureCause;
        this.statusCode = statusCode;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    /**
     * HTTP status, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
