package mail.digest.app.service.schedule;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.entity.ConversationSettings;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryResult;
import mail.digest.app.model.UrgencyResult;
import mail.digest.app.model.UrgencyTier;
import mail.digest.app.service.delivery.DigestDelivery;
import mail.digest.app.service.digest.DigestRenderer;
import mail.digest.app.service.mail.MailboxGateway;
import mail.digest.app.service.settings.ConversationSettingsService;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.summary.SummaryRequest;
import mail.digest.app.service.urgency.ThreadActivity;
import mail.digest.app.service.urgency.UrgencyContext;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Polls unread mail and alerts every subscribed conversation about messages from important senders
 * or with urgency signals. Each message is alerted once per conversation: a check covers the mail
 * received after the conversation's previous check, up to the start of this one.
 */
@Slf4j
public class ImportantMailAlertJob {
    private final ConversationSettingsService settingsService;
    private final MailboxGateway mailbox;
    private final SummarizationChain summarizationChain;
    private final UrgencyScorer urgencyScorer;
    private final DigestRenderer renderer;
    private final DigestDelivery delivery;
    private final Clock clock;
    private final int maxMessages;
    private final Duration checkInterval;
    private final Duration orderingWindow;
    private final int summaryCharCap;

    public ImportantMailAlertJob(ConversationSettingsService settingsService, MailboxGateway mailbox,
                                 SummarizationChain summarizationChain, UrgencyScorer urgencyScorer,
                                 DigestRenderer renderer, DigestDelivery delivery, Clock clock, int maxMessages,
                                 Duration checkInterval, Duration orderingWindow, int summaryCharCap) {
        this.settingsService = settingsService;
        this.mailbox = mailbox;
        this.summarizationChain = summarizationChain;
        this.urgencyScorer = urgencyScorer;
        this.renderer = renderer;
        this.delivery = delivery;
        this.clock = clock;
        this.maxMessages = maxMessages;
        this.checkInterval = checkInterval;
        this.orderingWindow = orderingWindow;
        this.summaryCharCap = summaryCharCap;
    }

    @Scheduled(fixedDelayString = "${alerts.check-interval:PT15M}", initialDelayString = "${alerts.initial-delay:PT2M}")
    public void checkImportantMail() {
        List<ConversationSettings> subscribers;
        try {
            subscribers = settingsService.alertSubscribers();
        } catch (RuntimeException e) {
            log.error("Could not load alert subscribers: {}", e.getMessage(), e);
            return;
        }
        if (subscribers.isEmpty()) {
            return;
        }

        Instant checkStartedAt = clock.instant();
        List<MailMessage> messages;
        try {
            messages = mailbox.fetchUnread(maxMessages);
        } catch (Exception e) {
            log.warn("Could not fetch unread mail for alerts, will retry next round: {}", e.getMessage());
            return;
        }

        Instant earliest = checkStartedAt;
        for (ConversationSettings settings : subscribers) {
            Instant since = since(settings, checkStartedAt);
            if (since.isBefore(earliest)) {
                earliest = since;
            }
        }
        List<Alert> alerts = findAlerts(messages, earliest, checkStartedAt);
        log.debug("Alert check found {} flagged messages among {} unread", alerts.size(), messages.size());

        for (ConversationSettings settings : subscribers) {
            String conversationId = settings.getConversationId();
            Instant since = since(settings, checkStartedAt);
            int sent = 0;
            for (Alert alert : alerts) {
                if (alert.receivedAt().isAfter(since)) {
                    delivery.deliverAlert(conversationId, alert.text);
                    sent++;
                }
            }
            if (sent > 0) {
                log.info("Sent {} important-mail alerts to conversation {}", sent, conversationId);
            }
            try {
                settingsService.recordAlertCheck(conversationId, checkStartedAt);
            } catch (RuntimeException e) {
                log.error("Could not record alert check for conversation {}: {}", conversationId, e.getMessage(), e);
            }
        }
    }

    private Instant since(ConversationSettings settings, Instant checkStartedAt) {
        return settings.getLastAlertCheckAt() != null ? settings.getLastAlertCheckAt()
                : checkStartedAt.minus(checkInterval);
    }

    private List<Alert> findAlerts(List<MailMessage> messages, Instant after, Instant upTo) {
        UrgencyContext context = new UrgencyContext(importantSenders(), ThreadActivity.count(messages, upTo, orderingWindow));
        List<Alert> alerts = new ArrayList<>();
        for (MailMessage message : messages) {
            Instant received = message.getReceivedAt();
            // later arrivals belong to the next check
            if (received == null || !received.isAfter(after) || received.isAfter(upTo)) {
                continue;
            }
            try {
                SummaryResult summary = summarizationChain.heuristic(
                        new SummaryRequest(message.subjectOrEmpty(), message.bestBody(), summaryCharCap));
                UrgencyResult urgency = urgencyScorer.score(message, summary, context);
                if (urgency.getTier() != UrgencyTier.NORMAL) {
                    alerts.add(new Alert(message, renderer.renderAlert(message, urgency)));
                }
            } catch (RuntimeException e) {
                log.error("Could not score message {} for alerts: {}", message.getId(), e.getMessage(), e);
            }
        }
        return alerts;
    }

    private Set<String> importantSenders() {
        try {
            return mailbox.importantSenders();
        } catch (RuntimeException e) {
            log.warn("Could not load important senders for alerts: {}", e.getMessage());
            return Set.of();
        }
    }

    private static class Alert {
        private final MailMessage message;
        private final String text;

        Alert(MailMessage message, String text) {
            this.message = message;
            this.text = text;
        }

        Instant receivedAt() {
            return message.getReceivedAt();
        }
    }
}
