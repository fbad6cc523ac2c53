package mail.digest.app.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import mail.digest.app.repository.ImportantSenderRepository;
import mail.digest.app.service.calendar.CalendarGateway;
import mail.digest.app.service.calendar.GoogleCalendarGateway;
import mail.digest.app.service.mail.AccessTokenSource;
import mail.digest.app.service.mail.GmailMailboxGateway;
import mail.digest.app.service.mail.GoogleClientFactory;
import mail.digest.app.service.mail.MailboxGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Gmail and Google Calendar collaborators. The access token comes from configuration and is
 * refreshed by whatever process owns the OAuth grant.
 */
@Configuration
public class GoogleApiConfig {

    @Bean
    public NetHttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public AccessTokenSource accessTokenSource(@Value("${google.access-token:}") String accessToken) {
        return () -> accessToken;
    }

    @Bean
    public GoogleClientFactory googleClientFactory(NetHttpTransport transport, AccessTokenSource accessTokenSource) {
        return new GoogleClientFactory(transport, accessTokenSource);
    }

    @Bean
    public MailboxGateway mailboxGateway(GoogleClientFactory clientFactory,
                                         ImportantSenderRepository importantSenderRepository,
                                         @Value("${google.user-id:me}") String userId,
                                         Clock clock) {
        return new GmailMailboxGateway(clientFactory, importantSenderRepository, userId, clock);
    }

    @Bean
    public CalendarGateway calendarGateway(GoogleClientFactory clientFactory, ZoneId digestZone,
                                           @Value("${digest.calendar.default-duration:PT1H}") Duration defaultDuration) {
        return new GoogleCalendarGateway(clientFactory, digestZone, defaultDuration);
    }
}
