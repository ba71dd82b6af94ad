package im.arun.docingest.recognition;

import im.arun.docingest.model.RecognitionRequest;
import im.arun.docingest.model.RecognitionResult;

/**
 * The remote OCR / field-extraction engine. One call per request, no retries.
 */
public interface RecognitionService {

    RecognitionResult recognize(RecognitionRequest request) throws RecognitionServiceException;
}
