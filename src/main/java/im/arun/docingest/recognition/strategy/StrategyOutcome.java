package im.arun.docingest.recognition.strategy;

import im.arun.docingest.model.RecognitionResult;
import im.arun.docingest.recognition.FailureCause;
import im.arun.docingest.recognition.RecognitionOutcome;

/**
 * What one {@link RecognitionStrategy} made of a logical document: a result, a skip
 * (let the next strategy try) or a failure that ends the chain.
 */
public final class StrategyOutcome {

    public enum Type { RESULT, SKIP, FAILURE }

    private final Type type;
    private final RecognitionResult result;
    private final boolean imageMode;
    private final String contentRef;
    private final FailureCause failureCause;
    private final String message;

    private StrategyOutcome(Type type, RecognitionResult result, boolean imageMode, String contentRef,
                            FailureCause failureCause, String message) {
        this.type = type;
        this.result = result;
        this.imageMode = imageMode;
        this.contentRef = contentRef;
        this.failureCause = failureCause;
        this.message = message;
    }

    public static StrategyOutcome result(RecognitionResult result, boolean imageMode, String contentRef) {
        return new StrategyOutcome(Type.RESULT, result, imageMode, contentRef, null, null);
    }

    public static StrategyOutcome skip(String reason) {
        return new StrategyOutcome(Type.SKIP, null, false, null, null, reason);
    }

    public static StrategyOutcome failure(FailureCause cause, String message) {
        return new StrategyOutcome(Type.FAILURE, null, false, null, cause, message);
    }

    public static StrategyOutcome failure(RecognitionOutcome outcome) {
        return failure(outcome.getFailureCause(), outcome.getMessage());
    }

    public Type getType() {
        return type;
    }

    public boolean isResult() {
        return type == Type.RESULT;
    }

    public boolean isSkip() {
        return type == Type.SKIP;
    }

    public RecognitionResult getResult() {
        return result;
    }

    public boolean isImageMode() {
        return imageMode;
    }

    /**
     * Content reference to persist with the record; empty for text-mode results.
     */
    public String getContentRef() {
        return contentRef;
    }

    public FailureCause getFailureCause() {
        return failureCause;
    }

    /**
     * Failure message, or the reason for a skip.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "StrategyOutcome[" + type + (message != null ? ": " + message : "") + "]";
    }
}
