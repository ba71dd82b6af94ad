package im.arun.docingest.scheduler;

import im.arun.docingest.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Fixed-concurrency worker pool. Workers pull units from one FIFO queue and finish each unit
 * before taking the next, so at most {@code workerCount} units are ever in flight.
 */
public class BoundedWorkScheduler {
    private static final Logger logger = LoggerFactory.getLogger(BoundedWorkScheduler.class);

    private final long interItemDelayMs;

    public BoundedWorkScheduler() {
        this(0);
    }

    /**
     * @param interItemDelayMs pause each worker takes after a unit before pulling the next
     */
    public BoundedWorkScheduler(long interItemDelayMs) {
        this.interItemDelayMs = Math.max(0, interItemDelayMs);
    }

    public <T, R> List<WorkOutcome<T, R>> runAll(List<T> units, int workerCount, WorkFunction<T, R> fn) {
        return runAll(units, workerCount, fn, new CancellationToken());
    }

    /**
     * Process every unit and return one outcome per unit, in input order.
     * A unit that throws is recorded as failed; it never stops the other workers.
     * Returns only once every unit is terminal.
     */
    public <T, R> List<WorkOutcome<T, R>> runAll(List<T> units, int workerCount, WorkFunction<T, R> fn,
                                                 CancellationToken token) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got " + workerCount);
        }
        if (units.isEmpty()) {
            return List.of();
        }

        BlockingQueue<Integer> queue = new ArrayBlockingQueue<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            queue.add(i);
        }
        AtomicReferenceArray<WorkOutcome<T, R>> outcomes = new AtomicReferenceArray<>(units.size());

        int poolSize = Math.min(workerCount, units.size());
        logger.debug("Running {} units on {} workers", units.size(), poolSize);

        ExecutorService pool = ExecutorProvider.newWorkerPool(poolSize, "ingest-worker-");
        try {
            List<Future<?>> workers = new ArrayList<>(poolSize);
            for (int w = 0; w < poolSize; w++) {
                workers.add(pool.submit(() -> workLoop(units, queue, outcomes, fn, token)));
            }
            for (Future<?> worker : workers) {
                awaitWorker(worker);
            }
        } finally {
            pool.shutdownNow();
        }

        List<WorkOutcome<T, R>> result = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            WorkOutcome<T, R> outcome = outcomes.get(i);
            result.add(outcome != null ? outcome : WorkOutcome.notAttempted(units.get(i)));
        }
        return result;
    }

    private <T, R> void workLoop(List<T> units, BlockingQueue<Integer> queue,
                                 AtomicReferenceArray<WorkOutcome<T, R>> outcomes,
                                 WorkFunction<T, R> fn, CancellationToken token) {
        Integer index;
        while (!token.isCancelled() && (index = queue.poll()) != null) {
            T unit = units.get(index);
            try {
                outcomes.set(index, WorkOutcome.completed(unit, fn.apply(unit)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.set(index, WorkOutcome.failed(unit, e));
                return;
            } catch (Exception e) {
                logger.error("Unit {} failed: {}", index, e.getMessage(), e);
                outcomes.set(index, WorkOutcome.failed(unit, e));
            }

            if (interItemDelayMs > 0 && !queue.isEmpty()) {
                try {
                    Thread.sleep(interItemDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
        if (token.isCancelled()) {
            logger.info("Worker stopping: {}", token.getReason());
        }
    }

    private void awaitWorker(Future<?> worker) {
        try {
            worker.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            // workLoop catches per-unit failures, so this is an Error escaping a worker
            throw new IllegalStateException("Worker terminated abnormally", e.getCause());
        }
    }
}
