package mail.digest.app.service.summary;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps HTTP statuses and raw exceptions from remote model APIs onto {@link FailureKind}s.
 */
final class ProviderErrors {

    private ProviderErrors() {
    }

    static SummaryProvider.ProviderException fromStatus(String provider, int status, String body, Duration retryAfter,
                                                        Throwable cause) {
        String lower = body != null ? body.toLowerCase(Locale.ROOT) : "";
        if (status == 429 || status == 529 || looksLikeQuota(lower)) {
            return new SummaryProvider.RateLimitedException(
                    provider + " rate limit (HTTP " + status + ")", retryAfter, cause);
        }
        if (status == 408 || status >= 500) {
            return new SummaryProvider.TransientException(provider + " unavailable (HTTP " + status + ")", cause);
        }
        return new SummaryProvider.UnusableException(provider + " rejected request (HTTP " + status + ")", cause);
    }

    /**
     * Classify an exception that carries no structured status.
     */
    static SummaryProvider.ProviderException fromException(String provider, Exception e) {
        if (e instanceof SummaryProvider.ProviderException) {
            return (SummaryProvider.ProviderException) e;
        }
        String message = messageChain(e);
        if (message.contains("429") || message.contains("529") || looksLikeQuota(message)) {
            return new SummaryProvider.RateLimitedException(provider + " rate limit: " + e.getMessage(), null, e);
        }
        if (hasNetworkCause(e)) {
            return new SummaryProvider.TransientException(provider + " network failure: " + e.getMessage(), e);
        }
        if (message.contains("401") || message.contains("403") || message.contains("invalid api key")
                || message.contains("unauthorized")) {
            return new SummaryProvider.UnusableException(provider + " credentials rejected: " + e.getMessage(), e);
        }
        return new SummaryProvider.TransientException(provider + " error: " + e.getMessage(), e);
    }

    static boolean looksLikeQuota(String lowerText) {
        return lowerText.contains("quota")
                || lowerText.contains("rate limit")
                || lowerText.contains("rate_limit")
                || lowerText.contains("too many requests")
                || lowerText.contains("resource exhausted")
                || lowerText.contains("resource_exhausted")
                || lowerText.contains("overloaded");
    }

    private static boolean hasNetworkCause(Throwable e) {
        Throwable t = e;
        while (t != null) {
            if (t instanceof InterruptedIOException || t instanceof TimeoutException || t instanceof IOException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static String messageChain(Throwable e) {
        StringBuilder sb = new StringBuilder();
        Throwable t = e;
        while (t != null) {
            if (t.getMessage() != null) {
                sb.append(t.getMessage().toLowerCase(Locale.ROOT)).append(' ');
            }
            t = t.getCause();
        }
        return sb.toString();
    }
}
