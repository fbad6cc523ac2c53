package mail.digest.app.model;

import java.util.Locale;

/**
 * User actions on the current digest item.
 */
public enum ActionKind {
    MARK_IMPORTANT("⭐ Mark Important"),
    FORWARD("📤 Forward"),
    LEAVE_UNREAD("🚫 Leave Unread"),
    NEXT("➡️ Next"),
    ADD_EVENT("📅 Add to Calendar"),
    IGNORE_EVENT("🙈 Ignore Event");

    private final String label;

    ActionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether the action is only offered for items carrying an event candidate. */
    public boolean isEventAction() {
        return this == ADD_EVENT || this == IGNORE_EVENT;
    }

    public static ActionKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Action code is required");
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
