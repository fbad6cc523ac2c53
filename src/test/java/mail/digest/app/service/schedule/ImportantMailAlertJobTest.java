package mail.digest.app.service.schedule;

import mail.digest.app.entity.ConversationSettings;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.MailSender;
import mail.digest.app.service.calendar.PatternDateTimeExtractor;
import mail.digest.app.service.delivery.DigestDelivery;
import mail.digest.app.service.digest.DigestRenderer;
import mail.digest.app.service.mail.MailboxGateway;
import mail.digest.app.service.settings.ConversationSettingsService;
import mail.digest.app.service.summary.HeuristicSummaryProvider;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.urgency.DeadlineDetector;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportantMailAlertJobTest {
    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Mock
    private ConversationSettingsService settingsService;

    @Mock
    private MailboxGateway mailbox;

    @Mock
    private DigestDelivery delivery;

    private ImportantMailAlertJob job;

    @BeforeEach
    void setUp() {
        SummarizationChain chain = new SummarizationChain(List.of(new HeuristicSummaryProvider(3)), Runnable::run,
                Duration.ofSeconds(1), Duration.ZERO, CLOCK);
        UrgencyScorer scorer = new UrgencyScorer(List.of("urgent", "asap", "deadline"),
                new DeadlineDetector(new PatternDateTimeExtractor()), null, 3, ZoneOffset.UTC, CLOCK);
        job = new ImportantMailAlertJob(settingsService, mailbox, chain, scorer, new DigestRenderer(ZoneOffset.UTC),
                delivery, CLOCK, 15, Duration.ofMinutes(15), Duration.ofHours(72), 500);
    }

    @Test
    void checkImportantMail_ShouldAlertEachConversationAboutMailSinceItsLastCheck() throws Exception {
        // Given
        ConversationSettings early = subscriber("chat-a", NOW.minus(Duration.ofMinutes(15)));
        ConversationSettings recent = subscriber("chat-b", NOW.minus(Duration.ofMinutes(5)));
        when(settingsService.alertSubscribers()).thenReturn(List.of(early, recent));
        when(mailbox.fetchUnread(15)).thenReturn(List.of(
                message("m1", "ops@x.com", "Server down", "Urgent: the API is failing.", 10),
                message("m2", "boss@x.com", "Lunch", "Want to grab lunch?", 2),
                message("m3", "news@x.com", "Weekly news", "Here is what happened this week.", 8),
                message("m4", "ops@x.com", "Old incident", "Urgent: disk full.", 30),
                message("m5", "ops@x.com", "Late incident", "Urgent: arrived after the check started.", -1)));
        when(mailbox.importantSenders()).thenReturn(Set.of("boss@x.com"));

        // When
        job.checkImportantMail();

        // Then
        ArgumentCaptor<String> toEarly = ArgumentCaptor.forClass(String.class);
        verify(delivery, times(2)).deliverAlert(eq("chat-a"), toEarly.capture());
        assertTrue(toEarly.getAllValues().get(0).contains("Server down"));
        assertTrue(toEarly.getAllValues().get(0).contains("Detected urgency: urgent"));
        assertTrue(toEarly.getAllValues().get(1).contains("<b>Reason:</b> Important sender"));

        ArgumentCaptor<String> toRecent = ArgumentCaptor.forClass(String.class);
        verify(delivery).deliverAlert(eq("chat-b"), toRecent.capture());
        assertTrue(toRecent.getValue().contains("Lunch"));

        verify(settingsService).recordAlertCheck("chat-a", NOW);
        verify(settingsService).recordAlertCheck("chat-b", NOW);
    }

    @Test
    void checkImportantMail_OnFirstCheck_ShouldLookBackOneInterval() throws Exception {
        when(settingsService.alertSubscribers()).thenReturn(List.of(subscriber("chat-a", null)));
        when(mailbox.fetchUnread(15)).thenReturn(List.of(
                message("m1", "ops@x.com", "Server down", "Urgent: the API is failing.", 10),
                message("m2", "ops@x.com", "Yesterday", "Urgent: old news.", 60 * 24)));

        job.checkImportantMail();

        verify(delivery, times(1)).deliverAlert(eq("chat-a"), contains("Server down"));
        verify(settingsService).recordAlertCheck("chat-a", NOW);
    }

    @Test
    void checkImportantMail_WhenMailboxFails_ShouldKeepLastCheckTime() throws Exception {
        when(settingsService.alertSubscribers()).thenReturn(List.of(subscriber("chat-a", NOW.minusSeconds(900))));
        when(mailbox.fetchUnread(15)).thenThrow(new IOException("401 Unauthorized"));

        job.checkImportantMail();

        verifyNoInteractions(delivery);
        verify(settingsService, never()).recordAlertCheck(anyString(), any());
    }

    @Test
    void checkImportantMail_WithoutSubscribers_ShouldNotReadMailbox() {
        when(settingsService.alertSubscribers()).thenReturn(List.of());

        job.checkImportantMail();

        verifyNoInteractions(mailbox, delivery);
    }

    private static ConversationSettings subscriber(String conversationId, Instant lastCheck) {
        ConversationSettings settings = new ConversationSettings(conversationId, Duration.ofHours(2), NOW.minus(Duration.ofDays(1)));
        settings.setLastAlertCheckAt(lastCheck);
        return settings;
    }

    private static MailMessage message(String id, String from, String subject, String body, int minutesAgo) {
        return MailMessage.builder()
                .id(id)
                .sender(new MailSender(null, from))
                .subject(subject)
                .bodyText(body)
                .threadId("t-" + id)
                .receivedAt(NOW.minus(Duration.ofMinutes(minutesAgo)))
                .build();
    }
}
