package im.arun.docingest.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Batch counters as the persistence side keeps them.
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class BatchState {
    String batchId;
    int totalDocuments;
    int processedDocuments;
    boolean readyForExport;
}
