package im.arun.docingest.model;

/**
 * Closed set of terminal failure kinds reported for a run or a unit.
 */
public enum ErrorKind {
    /** No project/batch selected, or the batch no longer exists. Aborts the run. */
    PRECONDITION_FAILED,
    /** The file could not be opened or decoded. Fatal for that file only. */
    CORRUPT_DOCUMENT,
    /** Not enough document capacity left. Recognition is never attempted. */
    QUOTA_EXCEEDED,
    /** Recognition retries exhausted or every strategy skipped. */
    RECOGNITION_UNAVAILABLE,
    /** Recognised but could not be saved; quota is not consumed. */
    PERSISTENCE_FAILED,
    /** Never started because the run was cancelled. */
    CANCELLED
}
