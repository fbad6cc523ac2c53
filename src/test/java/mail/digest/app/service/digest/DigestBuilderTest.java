package mail.digest.app.service.digest;

import mail.digest.app.model.DigestItem;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.MailSender;
import mail.digest.app.model.SummaryProvenance;
import mail.digest.app.model.SummaryResult;
import mail.digest.app.model.UrgencyTier;
import mail.digest.app.service.calendar.EventDetector;
import mail.digest.app.service.calendar.PatternDateTimeExtractor;
import mail.digest.app.service.summary.HeuristicSummaryProvider;
import mail.digest.app.service.summary.LocalExtractiveSummaryProvider;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.summary.SummaryRequest;
import mail.digest.app.service.urgency.DeadlineDetector;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class DigestBuilderTest {
    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final List<String> KEYWORDS = List.of("urgent", "asap", "deadline", "due", "important");

    private SummarizationChain chain;
    private UrgencyScorer scorer;
    private EventDetector detector;

    @BeforeEach
    void setUp() {
        chain = new SummarizationChain(
                List.of(new LocalExtractiveSummaryProvider(3), new HeuristicSummaryProvider(3)),
                Runnable::run, Duration.ofSeconds(5), Duration.ZERO, CLOCK);
        PatternDateTimeExtractor extractor = new PatternDateTimeExtractor();
        scorer = new UrgencyScorer(KEYWORDS, new DeadlineDetector(extractor), null, 3, ZoneOffset.UTC, CLOCK);
        detector = new EventDetector(extractor, ZoneOffset.UTC, Duration.ofHours(1), CLOCK);
    }

    @Test
    void build_WithTwoFromAliceAndOneFromBob_ShouldCombineAliceAndPutHerFirst() {
        // Given
        List<MailMessage> messages = List.of(
                message("a1", "alice@x.com", "Report", "Please send the report. The deadline is Friday 3pm.", 3),
                message("b1", "bob@y.com", "Lunch", "Lunch on Thursday? Let me know.", 2),
                message("a2", "alice@x.com", "Report follow-up", "Checking in on the report draft.", 1));

        // When
        List<DigestItem> items = builder(chain).build(messages, List.of(), Set.of());

        // Then
        assertEquals(2, items.size());
        DigestItem alice = items.get(0);
        assertEquals("alice@x.com", alice.getGroupKey());
        assertTrue(alice.isCombined());
        assertEquals(List.of("a1", "a2"), alice.getMessageIds());
        assertEquals(UrgencyTier.URGENT, alice.getUrgency().getTier());
        assertTrue(alice.getSummary().getText().length() <= 1000);
        assertEquals("Report; Report follow-up", alice.getSubject());

        DigestItem bob = items.get(1);
        assertEquals("bob@y.com", bob.getGroupKey());
        assertFalse(bob.isCombined());
        assertEquals(UrgencyTier.NORMAL, bob.getUrgency().getTier());
    }

    @Test
    void build_WithManyFromSameSender_ShouldYieldOneItem() {
        List<MailMessage> messages = List.of(
                message("n1", "news@z.com", "Issue 1", "First issue body.", 5),
                message("n2", "news@z.com", "Issue 2", "Second issue body.", 4),
                message("n3", "news@z.com", "Issue 3", "Third issue body.", 3),
                message("n4", "news@z.com", "Issue 4", "Fourth issue body.", 2));

        List<DigestItem> items = builder(chain).build(messages, List.of(), Set.of());

        assertEquals(1, items.size());
        assertEquals("news@z.com", items.get(0).getGroupKey());
        assertEquals(4, items.get(0).getMessageIds().size());
    }

    @Test
    void build_ShouldOrderByTierThenOldestFirst() {
        // Given
        List<MailMessage> messages = List.of(
                message("m1", "one@x.com", "Hello", "Nothing much.", 10),
                message("m2", "two@x.com", "Urgent fix", "Server is down.", 1),
                message("m3", "boss@x.com", "Chat", "Let's talk.", 2),
                message("m4", "three@x.com", "Hey", "Old news.", 20));

        // When
        List<DigestItem> items = builder(chain).build(messages, List.of(), Set.of("boss@x.com"));

        // Then
        assertEquals(List.of("m3", "m2", "m4", "m1"), items.stream().map(DigestItem::getMessageRef).toList());
        assertEquals(UrgencyTier.IMPORTANT, items.get(0).getUrgency().getTier());
    }

    @Test
    void build_WhenCombinedSummaryFails_ShouldKeepMembersAsSeparateItems() {
        // Given
        SummarizationChain failing = mock(SummarizationChain.class);
        SummaryResult single = new SummaryResult("Single.", SummaryProvenance.LOCAL, false, 7, List.of(), 0.0);
        when(failing.summarize(any(MailMessage.class), anyInt())).thenReturn(single);
        when(failing.summarize(any(SummaryRequest.class))).thenThrow(new IllegalStateException("boom"));
        List<MailMessage> messages = List.of(
                message("a1", "alice@x.com", "One", "First.", 2),
                message("a2", "alice@x.com", "Two", "Second.", 1));

        // When
        List<DigestItem> items = builder(failing).build(messages, List.of(), Set.of());

        // Then
        assertEquals(2, items.size());
        assertFalse(items.get(0).isCombined());
        assertFalse(items.get(1).isCombined());
        assertEquals("a1", items.get(0).getMessageRef());
    }

    @Test
    void build_WhenOneAnalysisFails_ShouldKeepThatMessageWithHeuristicSummary() {
        // Given
        EventDetector broken = mock(EventDetector.class);
        when(broken.detect(argThat(m -> m != null && m.getId().equals("m2")), any(), anyList()))
                .thenThrow(new IllegalStateException("extractor exploded"));
        List<MailMessage> messages = List.of(
                message("m1", "one@x.com", "Hello", "Nothing much.", 3),
                message("m2", "two@x.com", "Urgent fix", "Server is down. Please look now.", 2));
        DigestBuilder digestBuilder = new DigestBuilder(chain, scorer, broken, Runnable::run, CLOCK, 500, 1000, 2,
                Duration.ofHours(72));

        // When
        List<DigestItem> items = digestBuilder.build(messages, List.of(), Set.of());

        // Then
        assertEquals(2, items.size());
        DigestItem failed = items.stream().filter(i -> i.getMessageRef().equals("m2")).findFirst().orElseThrow();
        assertEquals(SummaryProvenance.HEURISTIC, failed.getSummary().getProvider());
        assertEquals("Server is down. Please look now.", failed.getSummary().getText());
        assertEquals(UrgencyTier.NORMAL, failed.getUrgency().getTier());
        assertNull(failed.getEventCandidate());
    }

    @Test
    void build_WhenExecutorRejectsWork_ShouldAnalyzeOnCallingThread() {
        // Given
        Executor saturated = command -> {
            throw new RejectedExecutionException("queue full");
        };
        DigestBuilder digestBuilder = new DigestBuilder(chain, scorer, detector, saturated, CLOCK, 500, 1000, 2,
                Duration.ofHours(72));
        List<MailMessage> messages = List.of(
                message("m1", "one@x.com", "Hello", "Nothing much.", 3),
                message("m2", "two@x.com", "Lunch", "Lunch later?", 2));

        // When
        List<DigestItem> items = digestBuilder.build(messages, List.of(), Set.of());

        // Then
        assertEquals(List.of("m1", "m2"), items.stream().map(DigestItem::getMessageRef).toList());
        assertEquals(SummaryProvenance.LOCAL, items.get(0).getSummary().getProvider());
    }

    @Test
    void build_WithNoMessages_ShouldReturnEmpty() {
        assertTrue(builder(chain).build(List.of(), List.of(), Set.of()).isEmpty());
    }

    private DigestBuilder builder(SummarizationChain summarizationChain) {
        return new DigestBuilder(summarizationChain, scorer, detector, Runnable::run, CLOCK, 500, 1000, 2,
                Duration.ofHours(72));
    }

    private static MailMessage message(String id, String from, String subject, String body, int hoursAgo) {
        return MailMessage.builder()
                .id(id)
                .threadId("thread-" + id)
                .sender(new MailSender(null, from))
                .subject(subject)
                .bodyText(body)
                .receivedAt(NOW.minus(Duration.ofHours(hoursAgo)))
                .build();
    }
}
