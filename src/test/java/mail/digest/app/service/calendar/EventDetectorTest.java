package mail.digest.app.service.calendar;

import mail.digest.app.model.EventCandidate;
import mail.digest.app.model.ExistingEvent;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.MailSender;
import mail.digest.app.model.SummaryProvenance;
import mail.digest.app.model.SummaryResult;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventDetectorTest {
    private static final Instant RECEIVED = Instant.parse("2026-03-10T09:00:00Z");

    private final EventDetector detector = new EventDetector(new PatternDateTimeExtractor(), ZoneOffset.UTC,
            Duration.ofHours(1), Clock.fixed(RECEIVED, ZoneOffset.UTC));

    @Test
    void overlapping_WhenIntervalsOverlap_ShouldReportConflict() {
        // Given
        ExistingEvent existing = event("evt-1", "2026-03-12T10:00:00Z", "2026-03-12T11:00:00Z");
        EventCandidate candidate = candidate("2026-03-12T10:30:00Z", "2026-03-12T11:30:00Z");

        // When
        List<ExistingEvent> conflicts = detector.overlapping(candidate, List.of(existing));

        // Then
        assertEquals(List.of(existing), conflicts);
    }

    @Test
    void overlapping_WhenIntervalsOnlyTouch_ShouldNotConflict() {
        ExistingEvent existing = event("evt-1", "2026-03-12T10:00:00Z", "2026-03-12T11:00:00Z");
        EventCandidate candidate = candidate("2026-03-12T11:00:00Z", "2026-03-12T12:00:00Z");

        assertTrue(detector.overlapping(candidate, List.of(existing)).isEmpty());
    }

    @Test
    void overlapping_WithoutEnd_ShouldAssumeDefaultDuration() {
        ExistingEvent existing = event("evt-1", "2026-03-12T10:45:00Z", "2026-03-12T11:15:00Z");
        EventCandidate candidate = candidate("2026-03-12T10:00:00Z", null);

        assertEquals(1, detector.overlapping(candidate, List.of(existing)).size());
    }

    @Test
    void detect_WithTimedMention_ShouldBuildCandidateWithDetailsAndConflicts() {
        // Given
        MailMessage message = message("Project sync",
                "Let's meet on March 12 at 10:30-11:30 in Room 4B. Join: https://meet.google.com/abc-defg-hij.");
        ExistingEvent busy = event("evt-9", "2026-03-12T10:00:00Z", "2026-03-12T11:00:00Z");
        ExistingEvent free = event("evt-10", "2026-03-12T11:30:00Z", "2026-03-12T12:00:00Z");

        // When
        Optional<EventCandidate> result = detector.detect(message, null, List.of(busy, free));

        // Then
        assertTrue(result.isPresent());
        EventCandidate candidate = result.get();
        assertEquals(Instant.parse("2026-03-12T10:30:00Z"), candidate.getStart());
        assertEquals(Instant.parse("2026-03-12T11:30:00Z"), candidate.getEnd());
        assertEquals("Project sync", candidate.getTitle());
        assertEquals("Room 4B", candidate.getLocation());
        assertEquals("https://meet.google.com/abc-defg-hij", candidate.getMeetingLink());
        assertEquals(List.of("evt-9"), candidate.getConflictsWith());
    }

    @Test
    void detect_WithSeveralMentions_ShouldPickHighestConfidence() {
        MailMessage message = message("Planning",
                "Maybe Friday 2pm, but the confirmed slot is 2026-03-16T14:00 in the big room.");

        Optional<EventCandidate> result = detector.detect(message, null, List.of());

        assertEquals(Instant.parse("2026-03-16T14:00:00Z"), result.orElseThrow().getStart());
    }

    @Test
    void detect_WithDateOnly_ShouldReturnEmpty() {
        assertTrue(detector.detect(message("Holiday", "Office closed on March 20."), null, List.of()).isEmpty());
    }

    @Test
    void detect_WithoutDates_ShouldReturnEmpty() {
        assertTrue(detector.detect(message("Hello", "Just checking in."), null, List.of()).isEmpty());
    }

    @Test
    void detect_WhenOnlySummaryHasTime_ShouldStillFindIt() {
        SummaryResult summary = new SummaryResult("Review on March 13 at 2pm.", SummaryProvenance.PRIMARY, false,
                40, List.of(), 0.5);

        Optional<EventCandidate> result = detector.detect(message("Review", "See attached."), summary, List.of());

        assertEquals(Instant.parse("2026-03-13T14:00:00Z"), result.orElseThrow().getStart());
        assertEquals(0.85 * 0.9, result.get().getConfidence(), 1e-9);
    }

    @Test
    void detect_WithoutReceivedTime_ShouldResolveDatesAgainstClock() {
        MailMessage message = MailMessage.builder()
                .id("m-undated")
                .sender(new MailSender("Carol", "carol@x.com"))
                .subject("Project sync")
                .bodyText("Let's meet on March 12 at 10:30-11:30.")
                .build();

        Optional<EventCandidate> result = detector.detect(message, null, List.of());

        assertEquals(Instant.parse("2026-03-12T10:30:00Z"), result.orElseThrow().getStart());
    }

    private static MailMessage message(String subject, String body) {
        return MailMessage.builder()
                .id("m-" + subject.hashCode())
                .sender(new MailSender("Carol", "carol@x.com"))
                .subject(subject)
                .bodyText(body)
                .receivedAt(RECEIVED)
                .build();
    }

    private static EventCandidate candidate(String start, String end) {
        return EventCandidate.builder()
                .title("Candidate")
                .start(Instant.parse(start))
                .end(end != null ? Instant.parse(end) : null)
                .confidence(0.9)
                .build();
    }

    private static ExistingEvent event(String id, String start, String end) {
        return new ExistingEvent(id, "Busy", Instant.parse(start), Instant.parse(end));
    }
}
