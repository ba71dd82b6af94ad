package im.arun.docingest.ingest;

public enum RunStatus {
    /** Every unit was saved. */
    SUCCEEDED,
    /** At least one unit saved and at least one failed. */
    PARTIAL_SUCCESS,
    /** Units were attempted and none was saved. */
    FAILED,
    /** Project/batch missing, batch deleted during the run, or batch already being processed. */
    PRECONDITION_FAILED,
    /** Stopped by {@link RunHandle#cancel()}; units not yet started were skipped. */
    CANCELLED
}
