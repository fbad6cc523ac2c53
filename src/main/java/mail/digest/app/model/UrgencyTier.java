package mail.digest.app.model;

/**
 * Display bucket for urgency. Declaration order is ascending priority.
 */
public enum UrgencyTier {
    NORMAL,
    URGENT,
    IMPORTANT;

    public static UrgencyTier max(UrgencyTier a, UrgencyTier b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
