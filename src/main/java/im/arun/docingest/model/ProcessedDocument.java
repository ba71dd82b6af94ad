package im.arun.docingest.model;

import lombok.Value;

/**
 * A logical document that was recognised and saved.
 */
@Value
public class ProcessedDocument {
    String documentId;
    String name;
    int sourceIndex;
    int ordinal;
    int startPage;
    int endPage;
    boolean imageMode;
    RecognitionResult result;
}
