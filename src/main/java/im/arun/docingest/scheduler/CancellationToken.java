package im.arun.docingest.scheduler;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative stop signal, checked by workers between units only.
 */
public class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }
}
