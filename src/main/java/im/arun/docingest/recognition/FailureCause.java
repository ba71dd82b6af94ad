package im.arun.docingest.recognition;

/**
 * Why a recognition attempt did not produce a result.
 */
public enum FailureCause {
    /** Transport error, timeout, HTTP 429 or 5xx. */
    UNREACHABLE,
    /** The service answered with something that is not a result: error envelope, 4xx, unparseable body. */
    MALFORMED_RESPONSE,
    /** Payload over the transport limit; never sent. */
    PAYLOAD_TOO_LARGE,
    /** The document could not be rasterized; nothing was sent. */
    UNREADABLE_SOURCE,
    /** Every strategy ran out of options without data. */
    NO_DATA,
    /** The worker was interrupted while backing off. */
    INTERRUPTED
}
