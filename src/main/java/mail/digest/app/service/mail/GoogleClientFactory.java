package mail.digest.app.service.mail;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.gmail.Gmail;

/**
 * Builds Gmail and Calendar API clients authorized with the current access token.
 */
public class GoogleClientFactory {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final String APPLICATION_NAME = "Mail Digest";

    private final NetHttpTransport httpTransport;
    private final AccessTokenSource accessTokenSource;

    public GoogleClientFactory(NetHttpTransport httpTransport, AccessTokenSource accessTokenSource) {
        this.httpTransport = httpTransport;
        this.accessTokenSource = accessTokenSource;
    }

    public Gmail gmail() {
        return new Gmail.Builder(httpTransport, JSON_FACTORY, credential())
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    public Calendar calendar() {
        return new Calendar.Builder(httpTransport, JSON_FACTORY, credential())
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    private Credential credential() {
        String accessToken = accessTokenSource.currentAccessToken();
        if (accessToken == null || accessToken.isEmpty()) {
            throw new IllegalStateException("No Google access token available. Set google.access-token.");
        }
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .build();
        credential.setAccessToken(accessToken);
        return credential;
    }
}
