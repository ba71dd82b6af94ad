package im.arun.docingest.persistence;

import im.arun.docingest.model.BatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory store for embedding and tests.
 */
public class InMemoryPersistenceGateway implements PersistenceGateway {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryPersistenceGateway.class);

    private final Map<String, Counters> batches = new ConcurrentHashMap<>();
    private final Map<String, DocumentRecord> documents = new ConcurrentHashMap<>();

    public void createBatch(String batchId) {
        batches.putIfAbsent(batchId, new Counters());
    }

    /**
     * Remove a batch and its documents, as another session deleting it would.
     */
    public void deleteBatch(String batchId) {
        batches.remove(batchId);
        documents.values().removeIf(record -> batchId.equals(record.getBatchId()));
        logger.info("Deleted batch {}", batchId);
    }

    public void markReadyForExport(String batchId) {
        Counters counters = batches.get(batchId);
        if (counters != null) {
            counters.readyForExport = true;
        }
    }

    @Override
    public boolean batchExists(String batchId) {
        return batchId != null && batches.containsKey(batchId);
    }

    @Override
    public String saveDocument(DocumentRecord record) throws PersistenceException {
        if (!batchExists(record.getBatchId())) {
            throw new PersistenceException("Batch " + record.getBatchId() + " does not exist");
        }
        String documentId = UUID.randomUUID().toString();
        documents.put(documentId, record);
        logger.debug("Saved document {} as {}", record.getName(), documentId);
        return documentId;
    }

    @Override
    public void incrementBatchCounters(String batchId) throws PersistenceException {
        Counters counters = batches.get(batchId);
        if (counters == null) {
            throw new PersistenceException("Batch " + batchId + " does not exist");
        }
        counters.total.incrementAndGet();
        counters.processed.incrementAndGet();
    }

    @Override
    public Optional<BatchState> getBatchState(String batchId) {
        Counters counters = batches.get(batchId);
        if (counters == null) {
            return Optional.empty();
        }
        return Optional.of(new BatchState(batchId, counters.total.get(), counters.processed.get(), counters.readyForExport));
    }

    public Optional<DocumentRecord> getDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    /**
     * Documents of a batch in ordinal order.
     */
    public List<DocumentRecord> getDocuments(String batchId) {
        List<DocumentRecord> result = new ArrayList<>();
        for (DocumentRecord record : documents.values()) {
            if (batchId.equals(record.getBatchId())) {
                result.add(record);
            }
        }
        result.sort(Comparator.comparingInt(DocumentRecord::getOrdinal));
        return result;
    }

    public int getDocumentCount() {
        return documents.size();
    }

    private static final class Counters {
        final AtomicInteger total = new AtomicInteger();
        final AtomicInteger processed = new AtomicInteger();
        volatile boolean readyForExport;
    }
}
