package mail.digest.app.service.digest;

/**
 * A digest could not be built for a conversation. Other conversations are unaffected.
 */
public class DigestBuildException extends Exception {
    public DigestBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
