package im.arun.docingest.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for ingestion. Runs are coordinated on a shared cached pool; each scheduler run
 * gets its own fixed pool so the worker cap is exact.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService coordinator;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Shared pool for {@code IngestionOrchestrator.start()} runs. A coordinator thread mostly waits
     * on its workers, so the pool is unbounded in size but its threads are daemons.
     */
    public static ExecutorService getCoordinator() {
        if (coordinator == null) {
            synchronized (LOCK) {
                if (coordinator == null) {
                    coordinator = Executors.newCachedThreadPool(namedDaemonFactory("ingest-run-"));
                }
            }
        }
        return coordinator;
    }

    /**
     * A fixed pool of exactly {@code size} worker threads. The caller owns and shuts it down.
     */
    public static ExecutorService newWorkerPool(int size, String namePrefix) {
        if (size < 1) {
            throw new IllegalArgumentException("Worker pool size must be >= 1, got " + size);
        }
        return Executors.newFixedThreadPool(size, namedDaemonFactory(namePrefix));
    }

    private static ThreadFactory namedDaemonFactory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, namePrefix + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }

    /**
     * Shuts down the shared coordinator pool. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (coordinator != null) {
                coordinator.shutdown();
                coordinator = null;
            }
        }
    }
}
