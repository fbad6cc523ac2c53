package mail.digest.app.service.summary;

import mail.digest.app.model.SummaryProvenance;

import java.time.Duration;

/**
 * One tier of the summarization chain. Adding a provider means adding an implementation,
 * not branching inside the chain.
 */
public interface SummaryProvider {

    /**
     * Base class of provider failures. These never leave {@link SummarizationChain}.
     */
    class ProviderException extends RuntimeException {
        private final FailureKind kind;
        private final Duration retryAfter;

        public ProviderException(FailureKind kind, String message, Duration retryAfter, Throwable cause) {
            super(message, cause);
            this.kind = kind;
            this.retryAfter = retryAfter;
        }

        public FailureKind getKind() {
            return kind;
        }

        /**
         * Retry hint sent by the provider, or null.
         */
        public Duration getRetryAfter() {
            return retryAfter;
        }
    }

    class RateLimitedException extends ProviderException {
        public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
            super(FailureKind.RATE_LIMITED, message, retryAfter, cause);
        }
    }

    class TransientException extends ProviderException {
        public TransientException(String message, Throwable cause) {
            super(FailureKind.TRANSIENT, message, null, cause);
        }
    }

    class UnusableException extends ProviderException {
        public UnusableException(String message, Throwable cause) {
            super(FailureKind.UNUSABLE, message, null, cause);
        }
    }

    /**
     * Which tier this provider fills.
     */
    SummaryProvenance tier();

    /**
     * Summarize the request's source text.
     * @param request subject, body and the character budget
     * @return raw summary text, before cleaning and truncation
     * @throws ProviderException classified failure
     */
    String summarize(SummaryRequest request);
}
