package mail.digest.app.service.calendar;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based extractor for the date forms common in mail: ISO dates, "March 14", "14 March 2026",
 * "3/14", weekdays, "today"/"tomorrow", each optionally followed (or preceded) by a time or time range.
 * <p>
 * Confidence reflects how anchored the expression is: explicit calendar dates score higher than
 * weekday names, and any expression without a time of day scores below 0.5.
 */
public class PatternDateTimeExtractor implements DateTimeExtractor {
    private static final String MONTH = "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final String WEEKDAY = "(monday|tuesday|wednesday|thursday|friday|saturday|sunday"
            + "|mon|tues?|wed|thu(?:rs?)?|fri|sat|sun)";
    private static final String TIME = "(?:(\\d{1,2})(?::([0-5]\\d))?\\s*([ap])\\.?m\\.?|([01]?\\d|2[0-3]):([0-5]\\d)|(noon|midnight))";

    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})(?:[T ]([01]\\d|2[0-3]):([0-5]\\d))?");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTH + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b(?:,?\\s*(\\d{4}))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(?:of\\s+)?" + MONTH + "\\b\\.?(?:,?\\s*(\\d{4}))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{4}|\\d{2}))?\\b");
    private static final Pattern RELATIVE = Pattern.compile("\\b(today|tonight|tomorrow)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEKDAY_PATTERN = Pattern.compile(
            "\\b(?:(next|this)\\s+)?" + WEEKDAY + "\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern TIME_AFTER = Pattern.compile(
            "^[\\s,]*(?:at|@|from|,)?\\s*" + TIME + "(?:\\s*(?:-|–|to|until)\\s*" + TIME + ")?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TIME_BEFORE = Pattern.compile(
            TIME + "(?:\\s*(?:-|–|to|until)\\s*" + TIME + ")?\\s*(?:on\\s+)?$", Pattern.CASE_INSENSITIVE);
    private static final int TIME_LOOKAROUND = 32;

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));
    private static final Map<String, DayOfWeek> WEEKDAYS = Map.of(
            "mon", DayOfWeek.MONDAY, "tue", DayOfWeek.TUESDAY, "wed", DayOfWeek.WEDNESDAY,
            "thu", DayOfWeek.THURSDAY, "fri", DayOfWeek.FRIDAY, "sat", DayOfWeek.SATURDAY, "sun", DayOfWeek.SUNDAY);

    @Override
    public List<ExtractedDateTime> extract(String text, ZonedDateTime reference) {
        List<ExtractedDateTime> results = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return results;
        }

        Matcher m = ISO.matcher(text);
        while (m.find()) {
            LocalDate date = safeDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)));
            if (date == null) {
                continue;
            }
            if (m.group(4) != null) {
                LocalTime time = LocalTime.of(Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)));
                results.add(new ExtractedDateTime(date.atTime(time).atZone(reference.getZone()), null, true,
                        0.95, m.start(), m.group()));
            } else {
                results.add(withTime(text, m, date, reference, 0.95, 0.5));
            }
        }

        m = MONTH_DAY.matcher(text);
        while (m.find()) {
            LocalDate date = calendarDate(month(m.group(1)), Integer.parseInt(m.group(2)), m.group(3), reference);
            if (date != null) {
                results.add(withTime(text, m, date, reference, 0.85, 0.45));
            }
        }

        m = DAY_MONTH.matcher(text);
        while (m.find()) {
            LocalDate date = calendarDate(month(m.group(2)), Integer.parseInt(m.group(1)), m.group(3), reference);
            if (date != null) {
                results.add(withTime(text, m, date, reference, 0.85, 0.45));
            }
        }

        m = NUMERIC.matcher(text);
        while (m.find()) {
            String year = m.group(3);
            if (year != null && year.length() == 2) {
                year = "20" + year;
            }
            LocalDate date = calendarDate(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), year, reference);
            if (date != null) {
                results.add(withTime(text, m, date, reference, 0.7, 0.35));
            }
        }

        m = RELATIVE.matcher(text);
        while (m.find()) {
            String word = m.group(1).toLowerCase(Locale.ROOT);
            LocalDate date = word.equals("tomorrow") ? reference.toLocalDate().plusDays(1) : reference.toLocalDate();
            results.add(withTime(text, m, date, reference, 0.8, 0.4));
        }

        m = WEEKDAY_PATTERN.matcher(text);
        while (m.find()) {
            DayOfWeek day = WEEKDAYS.get(m.group(2).substring(0, 3).toLowerCase(Locale.ROOT));
            boolean next = m.group(1) != null && m.group(1).equalsIgnoreCase("next");
            LocalDate date = next
                    ? reference.toLocalDate().with(TemporalAdjusters.next(day))
                    : reference.toLocalDate().with(TemporalAdjusters.nextOrSame(day));
            ExtractedDateTime found = withTime(text, m, date, reference, 0.75, 0.4);
            if (!next && found.isTimeOfDay() && date.equals(reference.toLocalDate())
                    && found.getStart().isBefore(reference)) {
                LocalDate following = date.plusWeeks(1);
                found = withTime(text, m, following, reference, 0.75, 0.4);
            }
            results.add(found);
        }

        results.sort(Comparator.comparingInt(ExtractedDateTime::getPosition));
        return results;
    }

    private ExtractedDateTime withTime(String text, Matcher dateMatch, LocalDate date, ZonedDateTime reference,
                                       double timedConfidence, double dateOnlyConfidence) {
        String after = text.substring(dateMatch.end(), Math.min(text.length(), dateMatch.end() + TIME_LOOKAROUND));
        Matcher t = TIME_AFTER.matcher(after);
        if (t.find()) {
            LocalTime start = time(t, 1);
            if (start != null) {
                return timed(date, start, time(t, 7), reference, timedConfidence, dateMatch.start(),
                        dateMatch.group() + t.group());
            }
        }
        String before = text.substring(Math.max(0, dateMatch.start() - TIME_LOOKAROUND), dateMatch.start());
        t = TIME_BEFORE.matcher(before);
        if (t.find()) {
            LocalTime start = time(t, 1);
            if (start != null) {
                return timed(date, start, time(t, 7), reference, timedConfidence - 0.05,
                        dateMatch.start() - (before.length() - t.start()), t.group() + dateMatch.group());
            }
        }
        return new ExtractedDateTime(date.atStartOfDay(reference.getZone()), null, false, dateOnlyConfidence,
                dateMatch.start(), dateMatch.group());
    }

    private static ExtractedDateTime timed(LocalDate date, LocalTime start, LocalTime end, ZonedDateTime reference,
                                           double confidence, int position, String matched) {
        ZonedDateTime startAt = date.atTime(start).atZone(reference.getZone());
        ZonedDateTime endAt = null;
        if (end != null) {
            endAt = date.atTime(end).atZone(reference.getZone());
            if (!endAt.isAfter(startAt)) {
                endAt = endAt.plusDays(1);
            }
        }
        return new ExtractedDateTime(startAt, endAt, true, confidence, position, matched.trim());
    }

    /**
     * Parse the time captured by {@link #TIME} starting at capture group {@code base}.
     */
    private static LocalTime time(Matcher t, int base) {
        if (t.group(base + 5) != null) {
            return t.group(base + 5).equalsIgnoreCase("noon") ? LocalTime.NOON : LocalTime.MIDNIGHT;
        }
        if (t.group(base) != null) {
            int hour = Integer.parseInt(t.group(base));
            int minute = t.group(base + 1) != null ? Integer.parseInt(t.group(base + 1)) : 0;
            if (hour < 1 || hour > 12) {
                return null;
            }
            boolean pm = t.group(base + 2).equalsIgnoreCase("p");
            hour = hour % 12 + (pm ? 12 : 0);
            return LocalTime.of(hour, minute);
        }
        if (t.group(base + 3) != null) {
            return LocalTime.of(Integer.parseInt(t.group(base + 3)), Integer.parseInt(t.group(base + 4)));
        }
        return null;
    }

    private static int month(String name) {
        return MONTHS.get(name.substring(0, 3).toLowerCase(Locale.ROOT));
    }

    /**
     * Resolve a month/day with an optional year; without a year, the next occurrence on or after the reference.
     */
    private static LocalDate calendarDate(int month, int day, String year, ZonedDateTime reference) {
        if (year != null) {
            return safeDate(Integer.parseInt(year), month, day);
        }
        LocalDate candidate = safeDate(reference.getYear(), month, day);
        if (candidate != null && candidate.isBefore(reference.toLocalDate())) {
            candidate = safeDate(reference.getYear() + 1, month, day);
        }
        return candidate;
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
