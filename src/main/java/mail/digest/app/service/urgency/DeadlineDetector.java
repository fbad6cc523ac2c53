package mail.digest.app.service.urgency;

import mail.digest.app.service.calendar.DateTimeExtractor;
import mail.digest.app.service.calendar.ExtractedDateTime;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the closest future deadline introduced by a phrase such as "due by" or "deadline".
 */
public class DeadlineDetector {
    private static final Pattern DEADLINE_PHRASE = Pattern.compile(
            "\\b(?:due\\s+by|due\\s+date|deadline|submit\\s+by|complete\\s+by)\\b\\s*(?:is|:|-|of|on|at)?",
            Pattern.CASE_INSENSITIVE);
    // how far after the phrase a date expression may start
    private static final int LOOKAHEAD_CHARS = 60;

    private final DateTimeExtractor extractor;

    public DeadlineDetector(DateTimeExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * @param reference anchor for relative expressions, normally the message's receive time
     * @param now deadlines before this instant are ignored
     */
    public Optional<Instant> closestDeadline(String text, ZonedDateTime reference, Instant now) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Instant closest = null;
        Matcher m = DEADLINE_PHRASE.matcher(text);
        while (m.find()) {
            String tail = text.substring(m.end(), Math.min(text.length(), m.end() + LOOKAHEAD_CHARS));
            for (ExtractedDateTime found : extractor.extract(tail, reference)) {
                if (found.getPosition() > 12) {
                    continue;
                }
                Instant due = found.isTimeOfDay()
                        ? found.getStart().toInstant()
                        : found.getStart().toLocalDate().plusDays(1).atStartOfDay(found.getStart().getZone()).toInstant();
                if (due.isBefore(now)) {
                    continue;
                }
                if (closest == null || due.isBefore(closest)) {
                    closest = due;
                }
            }
        }
        return Optional.ofNullable(closest);
    }
}
