package mail.digest.app.service.mail;

/**
 * Supplies a currently valid Google OAuth access token. Obtaining and refreshing the token
 * happens outside this application.
 */
@FunctionalInterface
public interface AccessTokenSource {
    String currentAccessToken();
}
