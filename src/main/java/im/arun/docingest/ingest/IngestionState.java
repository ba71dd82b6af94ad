package im.arun.docingest.ingest;

/**
 * Phases of one orchestrator run. Per-unit phases are tracked per worker and do not appear here.
 */
public enum IngestionState {
    IDLE,
    VALIDATING,
    SPLITTING,
    SCHEDULING,
    AGGREGATING,
    DONE
}
