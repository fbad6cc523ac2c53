package mail.digest.app.model;

public enum DigestItemState {
    PENDING,
    SHOWN,
    ACTED
}
