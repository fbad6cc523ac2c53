package mail.digest.app.service.summary;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryProvenance;
import mail.digest.app.model.SummaryResult;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tries each provider in priority order until one produces text, then cleans and truncates it.
 * {@link #summarize} never throws: provider failures are logged and absorbed here.
 */
@Slf4j
public class SummarizationChain {
    private static final HeuristicSummaryProvider HEURISTIC = new HeuristicSummaryProvider(3);

    private final List<SummaryProvider> providers;
    private final Executor providerExecutor;
    private final Duration providerTimeout;
    private final Duration transientRetryBackoff;
    private final Clock clock;

    public SummarizationChain(List<SummaryProvider> providers, Executor providerExecutor, Duration providerTimeout,
                              Duration transientRetryBackoff, Clock clock) {
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one summary provider is required");
        }
        this.providers = List.copyOf(providers);
        this.providerExecutor = providerExecutor;
        this.providerTimeout = providerTimeout;
        this.transientRetryBackoff = transientRetryBackoff;
        this.clock = clock;
    }

    public List<SummaryProvider> getProviders() {
        return providers;
    }

    public SummaryResult summarize(MailMessage message, int maxLength) {
        return summarize(new SummaryRequest(message.subjectOrEmpty(), message.bestBody(), maxLength));
    }

    public SummaryResult summarize(SummaryRequest request) {
        List<SummaryProvenance> failed = new ArrayList<>();
        for (SummaryProvider provider : providers) {
            String raw = attempt(provider, request);
            if (raw != null) {
                return finish(raw, provider.tier(), request, failed);
            }
            failed.add(provider.tier());
        }
        log.error("Every summary provider failed ({}), using subject line", failed);
        return finish(HeuristicSummaryProvider.fallbackText(request), SummaryProvenance.HEURISTIC, request, failed);
    }

    /**
     * Heuristic summary without calling any provider, for messages whose regular analysis failed.
     */
    public SummaryResult heuristic(SummaryRequest request) {
        return finish(HEURISTIC.summarize(request), SummaryProvenance.HEURISTIC, request, List.of());
    }

    /**
     * Run one provider with its retry policy. Returns null when the chain should move on.
     */
    private String attempt(SummaryProvider provider, SummaryRequest request) {
        boolean retried = false;
        while (true) {
            try {
                String raw = callWithTimeout(provider, request);
                if (raw == null || raw.isBlank()) {
                    log.warn("Provider {} returned empty text, falling through", provider.tier().code());
                    return null;
                }
                return raw;
            } catch (SummaryProvider.RateLimitedException e) {
                log.warn("Provider {} rate limited at {} (retry-after: {}): {}",
                        provider.tier().code(), clock.instant(),
                        e.getRetryAfter() != null ? e.getRetryAfter().toSeconds() + "s" : "none", e.getMessage());
                return null;
            } catch (SummaryProvider.TransientException e) {
                if (!retried) {
                    log.info("Provider {} transient failure, retrying once: {}", provider.tier().code(), e.getMessage());
                    retried = true;
                    if (!pause(transientRetryBackoff)) {
                        return null;
                    }
                    continue;
                }
                log.warn("Provider {} failed twice with transient errors at {}: {}",
                        provider.tier().code(), clock.instant(), e.getMessage());
                return null;
            } catch (SummaryProvider.ProviderException e) {
                log.warn("Provider {} unusable at {}: {}", provider.tier().code(), clock.instant(), e.getMessage());
                return null;
            } catch (RuntimeException e) {
                log.error("Provider {} threw unexpectedly: {}", provider.tier().code(), e.getMessage(), e);
                return null;
            }
        }
    }

    private String callWithTimeout(SummaryProvider provider, SummaryRequest request) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> provider.summarize(request), providerExecutor);
        try {
            return future.get(providerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SummaryProvider.TransientException(
                    provider.tier().code() + " timed out after " + providerTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SummaryProvider.TransientException(provider.tier().code() + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SummaryProvider.TransientException(provider.tier().code() + " failed: " + cause, cause);
        }
    }

    private boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private SummaryResult finish(String raw, SummaryProvenance provenance, SummaryRequest request,
                                 List<SummaryProvenance> failed) {
        int maxLength = request.getMaxLength();
        String cleaned = SummaryText.clean(raw);
        if (cleaned.isEmpty()) {
            cleaned = HeuristicSummaryProvider.fallbackText(request);
        }
        String text = SummaryText.truncate(cleaned, maxLength);
        boolean truncated = raw.length() > maxLength || text.length() < cleaned.length();
        String source = request.sourceText();
        if (provenance != SummaryProvenance.PRIMARY) {
            log.debug("Summary produced by {} after failures {}", provenance.code(), failed);
        }
        return new SummaryResult(text, provenance, truncated, source.length(), failed,
                SummaryText.readingTimeMinutes(source));
    }
}
