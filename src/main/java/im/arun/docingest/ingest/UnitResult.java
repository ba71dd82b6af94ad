package im.arun.docingest.ingest;

import im.arun.docingest.model.ErrorKind;
import im.arun.docingest.model.LogicalDocument;
import im.arun.docingest.model.ProcessedDocument;
import im.arun.docingest.model.UnitFailure;

/**
 * Typed terminal state of one logical document.
 */
final class UnitResult {
    private final ProcessedDocument document;
    private final UnitFailure failure;

    private UnitResult(ProcessedDocument document, UnitFailure failure) {
        this.document = document;
        this.failure = failure;
    }

    static UnitResult saved(ProcessedDocument document) {
        return new UnitResult(document, null);
    }

    static UnitResult failed(LogicalDocument unit, ErrorKind kind, String message) {
        return new UnitResult(null, new UnitFailure(unit.getName(), kind, message));
    }

    boolean isSuccess() {
        return document != null;
    }

    ProcessedDocument getDocument() {
        return document;
    }

    UnitFailure getFailure() {
        return failure;
    }
}
