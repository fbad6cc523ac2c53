package mail.digest.app.service.summary;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;

/**
 * Shared prompt, reply validation and bounded rate-limit retry for providers backed by a remote model API.
 * Retries on 429/529 back off exponentially up to {@code backoffCap}; running out of retries
 * surfaces as {@link SummaryProvider.RateLimitedException}.
 */
@Slf4j
public abstract class RemoteSummaryProvider implements SummaryProvider {
    private static final int MAX_PROMPT_CHARS = 6000;

    private final int rateLimitRetries;
    private final Duration backoffCap;

    protected RemoteSummaryProvider(int rateLimitRetries, Duration backoffCap) {
        this.rateLimitRetries = Math.max(0, rateLimitRetries);
        this.backoffCap = backoffCap;
    }

    /**
     * Send the prompt and return the model's reply text.
     * @throws SummaryProvider.ProviderException classified failure
     */
    protected abstract String complete(String prompt, int maxLength);

    /**
     * Whether credentials are present; an unconfigured provider is unusable for every call.
     */
    protected abstract boolean isConfigured();

    protected abstract String providerName();

    @Override
    public String summarize(SummaryRequest request) {
        if (!isConfigured()) {
            throw new UnusableException(providerName() + " API key not configured", null);
        }
        String prompt = buildPrompt(request);
        int attempt = 0;
        while (true) {
            try {
                return validateReply(complete(prompt, request.getMaxLength()));
            } catch (RateLimitedException e) {
                if (attempt >= rateLimitRetries) {
                    throw e;
                }
                Duration backoff = backoffFor(attempt, e.getRetryAfter());
                log.warn("{} rate limited (attempt {}/{}), retrying in {} ms",
                        providerName(), attempt + 1, rateLimitRetries + 1, backoff.toMillis());
                pause(backoff);
                attempt++;
            }
        }
    }

    static String buildPrompt(SummaryRequest request) {
        String source = request.sourceText();
        if (source.length() > MAX_PROMPT_CHARS) {
            source = source.substring(0, MAX_PROMPT_CHARS) + "...";
        }
        return String.format(
                "Summarize the following email in %d characters or less. "
                        + "Prioritize conciseness, key points, action items, and deadlines. "
                        + "Omit greetings, signatures, and boilerplate.%n%n%s",
                request.getMaxLength(), source);
    }

    private String validateReply(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new UnusableException(providerName() + " returned an empty reply", null);
        }
        String trimmed = reply.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("summarize the following email") || lower.startsWith("summarize this email")) {
            throw new UnusableException(providerName() + " echoed the prompt", null);
        }
        if (lower.contains("too many requests") || lower.contains("rate limit exceeded")) {
            throw new RateLimitedException(providerName() + " rate limit reported in reply body", null, null);
        }
        return trimmed;
    }

    Duration backoffFor(int attempt, Duration retryAfter) {
        Duration exponential = Duration.ofSeconds(1L << Math.min(attempt, 10));
        Duration wanted = retryAfter != null && retryAfter.compareTo(exponential) > 0 ? retryAfter : exponential;
        return wanted.compareTo(backoffCap) > 0 ? backoffCap : wanted;
    }

    protected void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException(providerName() + " retry interrupted", e);
        }
    }
}
