package mail.digest.app.service.summary;

/**
 * How a provider call failed, which decides what the chain does next.
 */
public enum FailureKind {
    /** 429/529 or a quota error: fall through immediately. */
    RATE_LIMITED,
    /** Network error or timeout: one retry, then fall through. */
    TRANSIENT,
    /** Bad credentials or unsupported input: fall through, no retry. */
    UNUSABLE
}
