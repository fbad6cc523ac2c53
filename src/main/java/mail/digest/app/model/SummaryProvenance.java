package mail.digest.app.model;

import java.util.Locale;

/**
 * Which summarization tier produced a summary.
 */
public enum SummaryProvenance {
    PRIMARY,
    SECONDARY,
    LOCAL,
    HEURISTIC;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SummaryProvenance fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
