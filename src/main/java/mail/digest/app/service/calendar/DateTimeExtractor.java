package mail.digest.app.service.calendar;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Finds date and time expressions in free text.
 */
public interface DateTimeExtractor {
    /**
     * @param text free text
     * @param reference the moment relative expressions ("tomorrow", "Friday") are resolved against
     * @return matches in text order, possibly empty
     */
    List<ExtractedDateTime> extract(String text, ZonedDateTime reference);
}
