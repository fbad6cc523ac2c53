package mail.digest.app.service.calendar;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.EventCandidate;
import mail.digest.app.model.ExistingEvent;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryResult;
import mail.digest.app.service.summary.CombinedSummarySource;
import mail.digest.app.service.summary.SummaryText;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests at most one calendar event per message and tags it with the existing events it overlaps.
 * <p>
 * When several date/times are mentioned, the one with the highest extractor confidence wins;
 * ties go to the earliest mention. Matches from the subject and body outrank matches found only
 * in the summary. Expressions without a time of day never produce a candidate. This class never
 * writes to a calendar.
 */
@Slf4j
public class EventDetector {
    static final double MIN_CONFIDENCE = 0.6;
    private static final double SUMMARY_ONLY_PENALTY = 0.9;

    private static final Pattern LOCATION = Pattern.compile(
            "(?im)^\\s*(?:location|where|venue|place|room)\\s*:\\s*(.{2,120}?)\\s*$");
    private static final Pattern ROOM = Pattern.compile(
            "(?i)\\b(?:in|at)\\s+((?:conference\\s+|meeting\\s+)?room\\s+[\\w-]+)");
    private static final Pattern MEETING_LINK = Pattern.compile(
            "(?i)https?://(?:[\\w-]+\\.)*(?:zoom\\.us|meet\\.google\\.com|teams\\.microsoft\\.com|teams\\.live\\.com"
                    + "|webex\\.com|whereby\\.com|meet\\.jit\\.si)/[^\\s<>\"')\\]]+");

    private final DateTimeExtractor extractor;
    private final ZoneId zone;
    private final Duration defaultDuration;
    private final Clock clock;

    public EventDetector(DateTimeExtractor extractor, ZoneId zone, Duration defaultDuration, Clock clock) {
        this.extractor = extractor;
        this.zone = zone;
        this.defaultDuration = defaultDuration;
        this.clock = clock;
    }

    public Duration getDefaultDuration() {
        return defaultDuration;
    }

    /**
     * @return a candidate, or empty when no date/time was found with enough confidence (not an error)
     */
    public Optional<EventCandidate> detect(MailMessage message, SummaryResult summary, List<ExistingEvent> existingEvents) {
        ZonedDateTime reference = (message.getReceivedAt() != null ? message.getReceivedAt() : clock.instant()).atZone(zone);
        String rawBody = message.bestBody();
        String text = message.subjectOrEmpty() + "\n" + SummaryText.clean(rawBody);

        List<ExtractedDateTime> found = new ArrayList<>();
        for (ExtractedDateTime e : extractor.extract(text, reference)) {
            found.add(e);
        }
        if (summary != null) {
            for (ExtractedDateTime e : extractor.extract(summary.getText(), reference)) {
                found.add(new ExtractedDateTime(e.getStart(), e.getEnd(), e.isTimeOfDay(),
                        e.getConfidence() * SUMMARY_ONLY_PENALTY, text.length() + e.getPosition(), e.getMatchedText()));
            }
        }

        Optional<ExtractedDateTime> best = found.stream()
                .filter(ExtractedDateTime::isTimeOfDay)
                .filter(e -> e.getConfidence() >= MIN_CONFIDENCE)
                .filter(e -> !e.getStart().isBefore(reference))
                .max(Comparator.comparingDouble(ExtractedDateTime::getConfidence)
                        .thenComparing(Comparator.comparingInt(ExtractedDateTime::getPosition).reversed()));
        if (best.isEmpty()) {
            return Optional.empty();
        }

        ExtractedDateTime chosen = best.get();
        EventCandidate.EventCandidateBuilder candidate = EventCandidate.builder()
                .title(title(message))
                .start(chosen.getStart().toInstant())
                .end(chosen.getEnd() != null ? chosen.getEnd().toInstant() : null)
                .location(location(rawBody))
                .meetingLink(meetingLink(rawBody))
                .confidence(chosen.getConfidence());
        EventCandidate built = candidate.build();
        for (ExistingEvent other : overlapping(built, existingEvents)) {
            candidate.conflictWith(other.getId());
        }
        EventCandidate result = candidate.build();
        log.debug("Event candidate for message {} at {} ('{}'), conflicts {}",
                message.getId(), result.getStart(), chosen.getMatchedText(), result.getConflictsWith());
        return Optional.of(result);
    }

    /**
     * Existing events whose [start, end) interval overlaps the candidate's.
     */
    public List<ExistingEvent> overlapping(EventCandidate candidate, List<ExistingEvent> existingEvents) {
        List<ExistingEvent> conflicts = new ArrayList<>();
        if (existingEvents == null) {
            return conflicts;
        }
        Instant start = candidate.getStart();
        Instant end = candidate.effectiveEnd(defaultDuration);
        for (ExistingEvent other : existingEvents) {
            if (start.isBefore(other.getEnd()) && other.getStart().isBefore(end)) {
                conflicts.add(other);
            }
        }
        return conflicts;
    }

    private static String title(MailMessage message) {
        String subject = message.subjectOrEmpty().trim();
        if (!subject.isEmpty()) {
            return CombinedSummarySource.capSubject(subject);
        }
        return "Event from " + (message.getSender() != null ? message.getSender().getDisplayName() : "email");
    }

    static String location(String rawBody) {
        if (rawBody == null) {
            return null;
        }
        Matcher m = LOCATION.matcher(rawBody);
        if (m.find()) {
            return m.group(1).trim();
        }
        m = ROOM.matcher(rawBody);
        return m.find() ? m.group(1).trim() : null;
    }

    static String meetingLink(String rawBody) {
        if (rawBody == null) {
            return null;
        }
        Matcher m = MEETING_LINK.matcher(rawBody);
        if (!m.find()) {
            return null;
        }
        String link = m.group();
        while (!link.isEmpty() && ".,;:!?".indexOf(link.charAt(link.length() - 1)) >= 0) {
            link = link.substring(0, link.length() - 1);
        }
        return link;
    }
}
