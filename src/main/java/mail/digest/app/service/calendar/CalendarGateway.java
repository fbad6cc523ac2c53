package mail.digest.app.service.calendar;

import mail.digest.app.model.EventCandidate;
import mail.digest.app.model.ExistingEvent;

import java.time.Instant;
import java.util.List;

/**
 * Calendar operations the digest needs.
 */
public interface CalendarGateway {
    /**
     * Events on the target calendar overlapping [from, to).
     * @throws Exception if the provider call fails
     */
    List<ExistingEvent> listUpcomingEvents(Instant from, Instant to) throws Exception;

    /**
     * Create an event from a candidate.
     * @param description free text stored with the event
     * @return id of the created event
     * @throws Exception if the provider call fails
     */
    String createEvent(EventCandidate candidate, String description) throws Exception;
}
