package im.arun.docingest.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.docingest.model.BatchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores each batch as a directory holding {@code batch.json} and one JSON file per document.
 * Used by the command line tool.
 */
public class JsonDirectoryPersistenceGateway implements PersistenceGateway {
    private static final Logger logger = LoggerFactory.getLogger(JsonDirectoryPersistenceGateway.class);
    static final String BATCH_FILE = "batch.json";

    private final Path root;
    private final ObjectMapper objectMapper;

    public JsonDirectoryPersistenceGateway(Path root) {
        this.root = root;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void createBatch(String batchId) throws PersistenceException {
        Path batchDir = batchDir(batchId);
        try {
            Files.createDirectories(batchDir);
            if (!Files.exists(batchDir.resolve(BATCH_FILE))) {
                writeState(new BatchState(batchId, 0, 0, false));
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to create batch " + batchId, e);
        }
    }

    @Override
    public boolean batchExists(String batchId) {
        return batchId != null && Files.isRegularFile(batchDir(batchId).resolve(BATCH_FILE));
    }

    @Override
    public String saveDocument(DocumentRecord record) throws PersistenceException {
        if (!batchExists(record.getBatchId())) {
            throw new PersistenceException("Batch " + record.getBatchId() + " does not exist");
        }
        String documentId = UUID.randomUUID().toString();
        Path target = batchDir(record.getBatchId()).resolve(String.format("%04d_%s.json", record.getOrdinal(), documentId));
        try {
            objectMapper.writeValue(target.toFile(), record);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write " + target, e);
        }
        logger.debug("Wrote {} to {}", record.getName(), target);
        return documentId;
    }

    @Override
    public synchronized void incrementBatchCounters(String batchId) throws PersistenceException {
        BatchState state = getBatchState(batchId)
                .orElseThrow(() -> new PersistenceException("Batch " + batchId + " does not exist"));
        try {
            writeState(new BatchState(batchId, state.getTotalDocuments() + 1,
                    state.getProcessedDocuments() + 1, state.isReadyForExport()));
        } catch (IOException e) {
            throw new PersistenceException("Failed to update counters of batch " + batchId, e);
        }
    }

    @Override
    public synchronized Optional<BatchState> getBatchState(String batchId) {
        Path file = batchDir(batchId).resolve(BATCH_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), BatchState.class));
        } catch (IOException e) {
            logger.error("Unreadable batch state {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeState(BatchState state) throws IOException {
        objectMapper.writeValue(batchDir(state.getBatchId()).resolve(BATCH_FILE).toFile(), state);
    }

    private Path batchDir(String batchId) {
        return root.resolve(batchId);
    }
}
