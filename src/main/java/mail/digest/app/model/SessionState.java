package mail.digest.app.model;

public enum SessionState {
    BUILDING,
    ACTIVE,
    EXHAUSTED,
    CLOSED
}
