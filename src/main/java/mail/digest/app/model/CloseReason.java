package mail.digest.app.model;

public enum CloseReason {
    SUPERSEDED,
    EXPIRED
}
