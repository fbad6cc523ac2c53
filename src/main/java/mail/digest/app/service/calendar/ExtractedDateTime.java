package mail.digest.app.service.calendar;

import lombok.Value;

import java.time.ZonedDateTime;

/**
 * A date/time expression found in text. {@code end} is set only for explicit ranges such as "3pm-4pm".
 */
@Value
public class ExtractedDateTime {
    ZonedDateTime start;
    ZonedDateTime end;
    boolean timeOfDay;
    double confidence;
    int position;
    String matchedText;
}
