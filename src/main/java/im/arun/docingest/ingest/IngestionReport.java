package im.arun.docingest.ingest;

import im.arun.docingest.model.ErrorKind;
import im.arun.docingest.model.ProcessedDocument;
import im.arun.docingest.model.UnitFailure;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured outcome of a run: saved documents in page order and every failure by name.
 */
@Value
@Builder
public class IngestionReport {
    String runId;
    String batchId;
    RunStatus status;
    @Singular List<ProcessedDocument> documents;
    @Singular List<UnitFailure> failures;
    Instant startedAt;
    Instant finishedAt;

    public List<String> getFailedUnitNames() {
        return failures.stream().map(UnitFailure::getUnitName).collect(Collectors.toList());
    }

    public long countFailures(ErrorKind kind) {
        return failures.stream().filter(f -> f.getErrorKind() == kind).count();
    }

    public int getSavedCount() {
        return documents.size();
    }
}
