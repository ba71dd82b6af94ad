package im.arun.docingest.model;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Snapshot of a tenant's document allowance.
 */
@Value
@With
public class Quota {
    int total;
    int remaining;
    Instant expiry;
    boolean active;

    public Quota(int total, int remaining, Instant expiry, boolean active) {
        if (total < 0 || remaining < 0 || remaining > total) {
            throw new IllegalArgumentException("Invalid quota: remaining=" + remaining + ", total=" + total);
        }
        this.total = total;
        this.remaining = remaining;
        this.expiry = expiry;
        this.active = active;
    }

    public boolean isExpiredAt(Instant now) {
        return expiry != null && expiry.isBefore(now);
    }
}
