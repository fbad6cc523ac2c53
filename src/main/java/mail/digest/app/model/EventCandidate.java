package mail.digest.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A calendar event suggested from mail text, annotated with the existing events it overlaps.
 */
@Value
@Builder(toBuilder = true)
public class EventCandidate {
    String title;
    Instant start;
    /** May be null when the text only gives a start time. */
    Instant end;
    String location;
    String meetingLink;
    @Singular("conflictWith")
    List<String> conflictsWith;
    double confidence;

    /**
     * End of the interval used for overlap checks; a missing end is start plus the given duration.
     */
    public Instant effectiveEnd(Duration defaultDuration) {
        return end != null ? end : start.plus(defaultDuration);
    }

    public boolean hasConflicts() {
        return !conflictsWith.isEmpty();
    }
}
