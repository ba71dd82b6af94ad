package im.arun.docingest.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Grants document capacity before work is committed. Capacity is reserved up front so concurrent
 * workers cannot all pass the check and then overrun the quota when they finish.
 * Capacity checks are serialized so the quota and the open reservations are always read together.
 * {@link QuotaService#consume} runs outside the gate lock; while a commit is in flight its units stay
 * reserved, and a reservation that does not fit waits for in-flight commits before it is refused.
 */
public class ResourceGate {
    private static final Logger logger = LoggerFactory.getLogger(ResourceGate.class);

    private final QuotaService quotaService;
    private final Object lock = new Object();
    private int reserved;
    private int committing;

    public ResourceGate(QuotaService quotaService) {
        this.quotaService = quotaService;
    }

    /**
     * Reserve {@code documents} units if the quota covers them on top of every open reservation.
     * Blocks while a refusal could still be lifted by a commit in flight.
     */
    public Optional<Reservation> reserve(int documents) {
        if (documents < 1) {
            throw new IllegalArgumentException("documents must be >= 1");
        }
        synchronized (lock) {
            while (!quotaService.hasCapacity(reserved + documents)) {
                if (committing == 0) {
                    logger.debug("No capacity for {} more document(s), {} already reserved", documents, reserved);
                    return Optional.empty();
                }
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.debug("Interrupted waiting for {} in-flight commit(s)", committing);
                    return Optional.empty();
                }
            }
            reserved += documents;
            return Optional.of(new Reservation(documents));
        }
    }

    public boolean hasCapacity(int documents) {
        synchronized (lock) {
            return quotaService.hasCapacity(reserved + documents);
        }
    }

    public int getReservedCount() {
        synchronized (lock) {
            return reserved;
        }
    }

    /**
     * Capacity held for one unit of work. Only the first {@link #commit} or {@link #release} takes effect.
     */
    public final class Reservation {
        private final int documents;
        private boolean settled;

        private Reservation(int documents) {
            this.documents = documents;
        }

        /**
         * Consume the reserved units against a saved document.
         *
         * @return whether the quota backend recorded the consumption
         */
        public boolean commit(String documentId) {
            synchronized (lock) {
                if (settled) {
                    throw new IllegalStateException("Reservation already settled");
                }
                settled = true;
                committing++;
            }
            try {
                return quotaService.consume(documentId, documents);
            } finally {
                synchronized (lock) {
                    reserved -= documents;
                    committing--;
                    lock.notifyAll();
                }
            }
        }

        /**
         * Give the units back without consuming.
         */
        public void release() {
            synchronized (lock) {
                if (!settled) {
                    settled = true;
                    reserved -= documents;
                    lock.notifyAll();
                }
            }
        }
    }
}
