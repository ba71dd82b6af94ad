package im.arun.docingest.persistence;

import im.arun.docingest.model.BatchState;

import java.util.Optional;

/**
 * Storage for document records and batch counters. Implementations must increment counters atomically.
 */
public interface PersistenceGateway {

    boolean batchExists(String batchId);

    /**
     * @return the id of the stored document
     */
    String saveDocument(DocumentRecord record) throws PersistenceException;

    /**
     * Add one to the batch's total and processed document counts.
     */
    void incrementBatchCounters(String batchId) throws PersistenceException;

    Optional<BatchState> getBatchState(String batchId);
}
