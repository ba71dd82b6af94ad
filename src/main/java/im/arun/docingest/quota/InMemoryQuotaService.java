package im.arun.docingest.quota;

import im.arun.docingest.model.Quota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local quota with compare-and-set consumption.
 */
public class InMemoryQuotaService implements QuotaService {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryQuotaService.class);

    private final int total;
    private final AtomicInteger remaining;
    private final Instant expiry;
    private final boolean active;
    private final Clock clock;
    private final Map<String, Integer> consumedByDocument = new ConcurrentHashMap<>();

    public InMemoryQuotaService(Quota quota) {
        this(quota, Clock.systemUTC());
    }

    public InMemoryQuotaService(Quota quota, Clock clock) {
        this.total = quota.getTotal();
        this.remaining = new AtomicInteger(quota.getRemaining());
        this.expiry = quota.getExpiry();
        this.active = quota.isActive();
        this.clock = clock;
    }

    public static InMemoryQuotaService withRemaining(int remaining) {
        return new InMemoryQuotaService(new Quota(remaining, remaining, null, true));
    }

    /**
     * No license configured: everything is allowed.
     */
    public static InMemoryQuotaService unlimited() {
        return withRemaining(Integer.MAX_VALUE);
    }

    @Override
    public boolean hasCapacity(int documents) {
        if (!usable()) {
            return false;
        }
        return remaining.get() >= documents;
    }

    @Override
    public boolean consume(String documentId, int documents) {
        if (documents < 1) {
            throw new IllegalArgumentException("documents must be >= 1");
        }
        if (consumedByDocument.containsKey(documentId)) {
            logger.debug("Quota already consumed for document {}", documentId);
            return true;
        }
        if (!usable()) {
            logger.warn("Quota inactive or expired, not consuming for document {}", documentId);
            return false;
        }

        while (true) {
            int current = remaining.get();
            if (current < documents) {
                logger.warn("Insufficient quota for document {}: {} remaining", documentId, current);
                return false;
            }
            if (remaining.compareAndSet(current, current - documents)) {
                break;
            }
        }

        if (consumedByDocument.putIfAbsent(documentId, documents) != null) {
            // Lost a race with a concurrent consume for the same document; give ours back
            remaining.addAndGet(documents);
        }
        return true;
    }

    @Override
    public Quota snapshot() {
        return new Quota(total, remaining.get(), expiry, active);
    }

    public int getConsumedCount() {
        return consumedByDocument.size();
    }

    private boolean usable() {
        return active && (expiry == null || !expiry.isBefore(clock.instant()));
    }
}
