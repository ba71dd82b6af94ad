package im.arun.docingest.quota;

import im.arun.docingest.model.Quota;

/**
 * The tenant's document allowance, as the license backend exposes it.
 */
public interface QuotaService {

    /**
     * Whether {@code documents} more documents can be processed right now.
     */
    boolean hasCapacity(int documents);

    /**
     * Consume {@code documents} units for a saved document. Idempotent per {@code documentId}:
     * repeating a consumption that already succeeded returns {@code true} without consuming again.
     *
     * @return false when nothing was consumed
     */
    boolean consume(String documentId, int documents);

    Quota snapshot();
}
