package mail.digest.app.model;

public enum ActionStatus {
    APPLIED,
    /** Same (session, item, action) seen before; nothing re-applied. */
    DUPLICATE,
    /** Targeted an acted or non-current item, or an event action without a candidate. */
    IGNORED,
    NO_MORE_ITEMS,
    SESSION_EXPIRED,
    SESSION_SUPERSEDED,
    FAILED
}
