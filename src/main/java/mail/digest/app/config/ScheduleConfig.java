package mail.digest.app.config;

import mail.digest.app.repository.ConversationSettingsRepository;
import mail.digest.app.service.delivery.OutboxDigestDelivery;
import mail.digest.app.service.digest.DigestRenderer;
import mail.digest.app.service.digest.DigestService;
import mail.digest.app.service.mail.MailboxGateway;
import mail.digest.app.service.schedule.ImportantMailAlertJob;
import mail.digest.app.service.schedule.ScheduledDigestJob;
import mail.digest.app.service.settings.ConversationSettingsService;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Scheduled digests, important-mail alerts and the outbox they deliver to.
 */
@Configuration
public class ScheduleConfig {

    @Bean
    public ConversationSettingsService conversationSettingsService(
            ConversationSettingsRepository repository, Clock clock,
            @Value("${digest.schedule.default-interval:PT2H}") Duration defaultInterval) {
        return new ConversationSettingsService(repository, clock, defaultInterval);
    }

    @Bean
    public OutboxDigestDelivery outboxDigestDelivery(Clock clock,
                                                     @Value("${digest.outbox.capacity:200}") int capacity) {
        return new OutboxDigestDelivery(clock, capacity);
    }

    @Bean
    public ScheduledDigestJob scheduledDigestJob(ConversationSettingsService settingsService,
                                                 DigestService digestService,
                                                 OutboxDigestDelivery delivery, Clock clock) {
        return new ScheduledDigestJob(settingsService, digestService, delivery, clock);
    }

    @Bean
    public ImportantMailAlertJob importantMailAlertJob(ConversationSettingsService settingsService,
                                                       MailboxGateway mailbox,
                                                       SummarizationChain summarizationChain,
                                                       UrgencyScorer urgencyScorer, DigestRenderer digestRenderer,
                                                       OutboxDigestDelivery delivery, Clock clock,
                                                       @Value("${alerts.max-messages:15}") int maxMessages,
                                                       @Value("${alerts.check-interval:PT15M}") Duration checkInterval,
                                                       @Value("${digest.ordering-window:PT72H}") Duration orderingWindow,
                                                       @Value("${digest.item-char-cap:500}") int summaryCharCap) {
        return new ImportantMailAlertJob(settingsService, mailbox, summarizationChain, urgencyScorer, digestRenderer,
                delivery, clock, maxMessages, checkInterval, orderingWindow, summaryCharCap);
    }
}
