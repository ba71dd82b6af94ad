package im.arun.docingest.ingest;

import im.arun.docingest.scheduler.CancellationToken;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Token for a run started with {@link IngestionOrchestrator#start}.
 */
public class RunHandle {
    private final String runId;
    private final String batchId;
    private final CancellationToken cancellationToken;
    private final CompletableFuture<IngestionReport> completion;
    private volatile IngestionState state = IngestionState.IDLE;

    RunHandle(String runId, String batchId, CancellationToken cancellationToken) {
        this.runId = runId;
        this.batchId = batchId;
        this.cancellationToken = cancellationToken;
        this.completion = new CompletableFuture<>();
    }

    public String getRunId() {
        return runId;
    }

    public String getBatchId() {
        return batchId;
    }

    public IngestionState getState() {
        return state;
    }

    void setState(IngestionState state) {
        this.state = state;
    }

    CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Ask the run to stop. Units already being processed finish; the rest are reported as cancelled.
     */
    public void cancel() {
        cancellationToken.cancel("Cancelled by caller");
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public Optional<IngestionReport> getReport() {
        return completion.isDone() ? Optional.of(completion.join()) : Optional.empty();
    }

    /**
     * Block until the run has finished.
     */
    public IngestionReport await() {
        return completion.join();
    }

    public IngestionReport await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId + " failed", e.getCause());
        }
    }

    void complete(IngestionReport report) {
        state = IngestionState.DONE;
        completion.complete(report);
    }

    void fail(Throwable error) {
        state = IngestionState.DONE;
        completion.completeExceptionally(error);
    }
}
