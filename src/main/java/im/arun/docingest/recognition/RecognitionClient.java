package im.arun.docingest.recognition;

import im.arun.docingest.model.RecognitionRequest;
import im.arun.docingest.model.RecognitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the {@link RecognitionService} with bounded retries and linear backoff.
 * Never throws for service failures; the outcome says what went wrong.
 */
public class RecognitionClient {
    private static final Logger logger = LoggerFactory.getLogger(RecognitionClient.class);

    private final RecognitionService service;
    private final long maxPayloadBytes;
    private final long baseDelayMs;
    private final Sleeper sleeper;

    public RecognitionClient(RecognitionService service, long maxPayloadBytes, long baseDelayMs) {
        this(service, maxPayloadBytes, baseDelayMs, Sleeper.THREAD);
    }

    public RecognitionClient(RecognitionService service, long maxPayloadBytes, long baseDelayMs, Sleeper sleeper) {
        this.service = service;
        this.maxPayloadBytes = maxPayloadBytes;
        this.baseDelayMs = baseDelayMs;
        this.sleeper = sleeper;
    }

    /**
     * Make up to {@code maxRetries} calls, waiting {@code attempt * baseDelay} after each failed one.
     * The first successful response is returned immediately.
     */
    public RecognitionOutcome recognize(RecognitionRequest request, int maxRetries) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }

        long payloadSize = request.getPayloadSize();
        if (payloadSize > maxPayloadBytes) {
            String message = String.format("Payload of %d bytes exceeds the %d byte limit", payloadSize, maxPayloadBytes);
            logger.warn("Not sending {} request: {}", mode(request), message);
            return RecognitionOutcome.failure(FailureCause.PAYLOAD_TOO_LARGE, message, 0);
        }

        RecognitionServiceException lastError = null;
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                RecognitionResult result = service.recognize(request);
                if (result == null) {
                    throw new RecognitionServiceException(FailureCause.MALFORMED_RESPONSE, "Empty response from recognition service");
                }
                if (attempt > 1) {
                    logger.info("Recognition succeeded on attempt {}/{}", attempt, maxRetries);
                }
                return RecognitionOutcome.success(result, attempt);
            } catch (RecognitionServiceException e) {
                lastError = e;
                logger.warn("Recognition call failed (attempt {}/{}, {}): {}",
                        attempt, maxRetries, e.getFailureCause(), e.getMessage());
            }

            if (attempt < maxRetries) {
                long backoff = attempt * baseDelayMs;
                try {
                    if (backoff > 0) {
                        logger.debug("Retrying in {}ms", backoff);
                        sleeper.sleep(backoff);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return RecognitionOutcome.failure(FailureCause.INTERRUPTED,
                            "Interrupted during retry wait after: " + lastError.getMessage(), attempt);
                }
            }
        }

        logger.error("Recognition unavailable after {} attempts: {}", maxRetries, lastError.getMessage());
        return RecognitionOutcome.failure(lastError.getFailureCause(), lastError.getMessage(), maxRetries);
    }

    private static String mode(RecognitionRequest request) {
        return request.isTextMode() ? "text" : "image";
    }
}
