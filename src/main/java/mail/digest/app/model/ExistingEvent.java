package mail.digest.app.model;

import lombok.Value;

import java.time.Instant;

/**
 * An event already on the target calendar, resolved to absolute instants.
 */
@Value
public class ExistingEvent {
    String id;
    String title;
    Instant start;
    Instant end;
}
