package mail.digest.app.service.summary;

import mail.digest.app.model.MailMessage;
import mail.digest.app.model.MailSender;
import mail.digest.app.model.SummaryProvenance;
import mail.digest.app.model.SummaryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class SummarizationChainTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void summarize_WhenPrimarySucceeds_ShouldTagPrimaryWithoutFallback() {
        // Given
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY, () -> "Budget approved for Q3.");
        SummarizationChain chain = chain(primary, heuristic());

        // When
        SummaryResult result = chain.summarize(message("Budget", "The budget for Q3 was approved today."), 500);

        // Then
        assertEquals(SummaryProvenance.PRIMARY, result.getProvider());
        assertFalse(result.isFallbackUsed());
        assertEquals("Budget approved for Q3.", result.getText());
        assertTrue(result.getFailedProviders().isEmpty());
    }

    @Test
    void summarize_WhenPrimaryRateLimited_ShouldFallThroughWithoutRetry() {
        // Given
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY, () -> {
            throw new SummaryProvider.RateLimitedException("429", Duration.ofSeconds(30), null);
        });
        ScriptedProvider secondary = new ScriptedProvider(SummaryProvenance.SECONDARY, () -> "From the secondary.");
        SummarizationChain chain = chain(primary, secondary, heuristic());

        // When
        SummaryResult result = chain.summarize(message("Hi", "Body text here."), 500);

        // Then
        assertTrue(result.isFallbackUsed());
        assertEquals(SummaryProvenance.SECONDARY, result.getProvider());
        assertEquals(List.of(SummaryProvenance.PRIMARY), result.getFailedProviders());
        assertEquals(1, primary.calls.get());
    }

    @Test
    void summarize_WhenTransientFailureOnce_ShouldRetrySameProvider() {
        // Given
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY,
                () -> {
                    throw new SummaryProvider.TransientException("503", null);
                },
                () -> "Recovered summary.");
        SummarizationChain chain = chain(primary, heuristic());

        // When
        SummaryResult result = chain.summarize(message("Hi", "Body."), 500);

        // Then
        assertEquals(SummaryProvenance.PRIMARY, result.getProvider());
        assertEquals("Recovered summary.", result.getText());
        assertEquals(2, primary.calls.get());
    }

    @Test
    void summarize_WhenTransientFailureTwice_ShouldMoveToNextProvider() {
        // Given
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY, () -> {
            throw new SummaryProvider.TransientException("503", null);
        });
        ScriptedProvider local = new ScriptedProvider(SummaryProvenance.LOCAL, () -> "Local text.");
        SummarizationChain chain = chain(primary, local, heuristic());

        // When
        SummaryResult result = chain.summarize(message("Hi", "Body."), 500);

        // Then
        assertEquals(SummaryProvenance.LOCAL, result.getProvider());
        assertEquals(2, primary.calls.get());
        assertEquals(1, local.calls.get());
    }

    @Test
    void summarize_WhenEveryProviderFails_ShouldStillReturnSubject() {
        // Given
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY, () -> {
            throw new SummaryProvider.UnusableException("no key", null);
        });
        ScriptedProvider local = new ScriptedProvider(SummaryProvenance.LOCAL, () -> {
            throw new IllegalStateException("bug");
        });
        ScriptedProvider last = new ScriptedProvider(SummaryProvenance.HEURISTIC, () -> "   ");
        SummarizationChain chain = chain(primary, local, last);

        // When
        SummaryResult result = assertDoesNotThrow(() -> chain.summarize(message("Quarterly review", ""), 500));

        // Then
        assertEquals(SummaryProvenance.HEURISTIC, result.getProvider());
        assertEquals("Quarterly review", result.getText());
        assertEquals(List.of(SummaryProvenance.PRIMARY, SummaryProvenance.LOCAL, SummaryProvenance.HEURISTIC),
                result.getFailedProviders());
    }

    @Test
    void summarize_WhenOutputExceedsMaxLength_ShouldTruncateWithEllipsis() {
        // Given
        String longText = "word ".repeat(200).trim();
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY, () -> longText);
        SummarizationChain chain = chain(primary, heuristic());

        // When
        SummaryResult result = chain.summarize(message("Hi", "Body."), 100);

        // Then
        assertTrue(result.getText().length() <= 100);
        assertTrue(result.getText().endsWith(SummaryText.ELLIPSIS));
        assertTrue(result.isTruncated());
    }

    @Test
    void summarize_WhenOutputHasMarkup_ShouldStripLinksAndTags() {
        // Given
        ScriptedProvider primary = new ScriptedProvider(SummaryProvenance.PRIMARY,
                () -> "<p>See <b>agenda</b> at https://example.com/agenda ![logo](https://x/y.png)</p>");
        SummarizationChain chain = chain(primary, heuristic());

        // When
        SummaryResult result = chain.summarize(message("Hi", "Body."), 500);

        // Then
        assertEquals("See agenda at", result.getText());
        assertFalse(result.isTruncated());
    }

    @Test
    void summarize_WhenProviderTimesOut_ShouldTreatAsTransientAndFallThrough() {
        // Given
        pool = Executors.newCachedThreadPool();
        ScriptedProvider slow = new ScriptedProvider(SummaryProvenance.PRIMARY, () -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "too late";
        });
        ScriptedProvider secondary = new ScriptedProvider(SummaryProvenance.SECONDARY, () -> "On time.");
        SummarizationChain chain = new SummarizationChain(List.of(slow, secondary, heuristic()), pool,
                Duration.ofMillis(50), Duration.ZERO, CLOCK);

        // When
        SummaryResult result = chain.summarize(message("Hi", "Body."), 500);

        // Then
        assertEquals(SummaryProvenance.SECONDARY, result.getProvider());
        assertTrue(slow.calls.get() >= 1);
    }

    private static SummarizationChain chain(SummaryProvider... providers) {
        return new SummarizationChain(List.of(providers), Runnable::run, Duration.ofSeconds(5), Duration.ZERO, CLOCK);
    }

    private static SummaryProvider heuristic() {
        return new HeuristicSummaryProvider(3);
    }

    private static MailMessage message(String subject, String body) {
        return MailMessage.builder()
                .id("m1")
                .sender(new MailSender("Alice", "alice@x.com"))
                .subject(subject)
                .bodyText(body)
                .receivedAt(CLOCK.instant())
                .build();
    }

    /**
     * Plays back one behaviour per call and repeats the last one.
     */
    private static class ScriptedProvider implements SummaryProvider {
        private final SummaryProvenance tier;
        private final Deque<Supplier<String>> script = new ArrayDeque<>();
        private Supplier<String> last;
        final AtomicInteger calls = new AtomicInteger();

        @SafeVarargs
        ScriptedProvider(SummaryProvenance tier, Supplier<String>... behaviours) {
            this.tier = tier;
            this.script.addAll(List.of(behaviours));
        }

        @Override
        public SummaryProvenance tier() {
            return tier;
        }

        @Override
        public String summarize(SummaryRequest request) {
            calls.incrementAndGet();
            Supplier<String> next;
            synchronized (script) {
                if (!script.isEmpty()) {
                    last = script.poll();
                }
                next = last;
            }
            return next.get();
        }
    }
}
