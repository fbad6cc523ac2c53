package mail.digest.app.service.calendar;

import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.EventCandidate;
import mail.digest.app.model.ExistingEvent;
import mail.digest.app.service.mail.GoogleClientFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar adapter working on the user's primary calendar.
 */
@Slf4j
public class GoogleCalendarGateway implements CalendarGateway {
    private static final String CALENDAR_ID = "primary";
    private static final int MAX_EVENTS = 250;

    private final GoogleClientFactory clientFactory;
    private final ZoneId zone;
    private final Duration defaultDuration;

    public GoogleCalendarGateway(GoogleClientFactory clientFactory, ZoneId zone, Duration defaultDuration) {
        this.clientFactory = clientFactory;
        this.zone = zone;
        this.defaultDuration = defaultDuration;
    }

    @Override
    public List<ExistingEvent> listUpcomingEvents(Instant from, Instant to) throws Exception {
        Events events = clientFactory.calendar().events().list(CALENDAR_ID)
                .setTimeMin(new DateTime(from.toEpochMilli()))
                .setTimeMax(new DateTime(to.toEpochMilli()))
                .setSingleEvents(true)
                .setOrderBy("startTime")
                .setMaxResults(MAX_EVENTS)
                .execute();

        List<ExistingEvent> result = new ArrayList<>();
        if (events.getItems() == null) {
            return result;
        }
        for (Event event : events.getItems()) {
            Instant start = toInstant(event.getStart());
            Instant end = toInstant(event.getEnd());
            if (start == null) {
                continue;
            }
            if (end == null || !end.isAfter(start)) {
                end = start.plus(defaultDuration);
            }
            result.add(new ExistingEvent(event.getId(), event.getSummary(), start, end));
        }
        return result;
    }

    @Override
    public String createEvent(EventCandidate candidate, String description) throws Exception {
        Instant end = candidate.effectiveEnd(defaultDuration);
        StringBuilder details = new StringBuilder(description != null ? description : "");
        if (candidate.getMeetingLink() != null) {
            details.append("\n\nJoin: ").append(candidate.getMeetingLink());
        }
        Event event = new Event()
                .setSummary(candidate.getTitle())
                .setLocation(candidate.getLocation())
                .setDescription(details.toString().trim())
                .setStart(new EventDateTime()
                        .setDateTime(new DateTime(candidate.getStart().toEpochMilli()))
                        .setTimeZone(zone.getId()))
                .setEnd(new EventDateTime()
                        .setDateTime(new DateTime(end.toEpochMilli()))
                        .setTimeZone(zone.getId()));
        Event created = clientFactory.calendar().events().insert(CALENDAR_ID, event).execute();
        log.info("Created calendar event {} '{}' at {}", created.getId(), candidate.getTitle(), candidate.getStart());
        return created.getId();
    }

    private Instant toInstant(EventDateTime time) {
        if (time == null) {
            return null;
        }
        if (time.getDateTime() != null) {
            return Instant.ofEpochMilli(time.getDateTime().getValue());
        }
        if (time.getDate() != null) {
            // all-day events carry a date-only value at UTC midnight; reinterpret in the digest zone
            return Instant.ofEpochMilli(time.getDate().getValue())
                    .atZone(ZoneId.of("UTC")).toLocalDate().atStartOfDay(zone).toInstant();
        }
        return null;
    }
}
