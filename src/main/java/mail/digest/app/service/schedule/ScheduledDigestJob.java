package mail.digest.app.service.schedule;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.entity.ConversationSettings;
import mail.digest.app.model.DigestView;
import mail.digest.app.service.delivery.DigestDelivery;
import mail.digest.app.service.digest.DigestBuildException;
import mail.digest.app.service.digest.DigestService;
import mail.digest.app.service.settings.ConversationSettingsService;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Sends each registered conversation a digest once its interval has passed.
 * A conversation that is still working through a digest is skipped for that round.
 */
@Slf4j
public class ScheduledDigestJob {
    static final String ERROR_NOTICE = "⚠️ Error generating digest. Please try again later.";

    private final ConversationSettingsService settingsService;
    private final DigestService digestService;
    private final DigestDelivery delivery;
    private final Clock clock;

    public ScheduledDigestJob(ConversationSettingsService settingsService, DigestService digestService,
                              DigestDelivery delivery, Clock clock) {
        this.settingsService = settingsService;
        this.digestService = digestService;
        this.delivery = delivery;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${digest.schedule.poll-interval:PT1M}",
            initialDelayString = "${digest.schedule.initial-delay:PT1M}")
    public void sendDueDigests() {
        List<ConversationSettings> due;
        try {
            due = settingsService.dueForDigest();
        } catch (RuntimeException e) {
            log.error("Could not load conversations due for a digest: {}", e.getMessage(), e);
            return;
        }
        if (due.isEmpty()) {
            return;
        }
        log.info("Scheduled digests started for {} conversations", due.size());
        for (ConversationSettings settings : due) {
            try {
                sendDigest(settings.getConversationId());
            } catch (RuntimeException e) {
                log.error("Scheduled digest failed for conversation {}: {}", settings.getConversationId(),
                        e.getMessage(), e);
            }
            try {
                settingsService.advanceDigest(settings, clock.instant());
            } catch (RuntimeException e) {
                log.error("Could not reschedule digest for conversation {}: {}", settings.getConversationId(),
                        e.getMessage(), e);
            }
        }
        log.info("Scheduled digests ended");
    }

    void sendDigest(String conversationId) {
        if (digestService.hasLiveDigest(conversationId)) {
            log.info("Conversation {} still has an open digest, skipping this round", conversationId);
            return;
        }
        try {
            Optional<DigestView> view = digestService.buildDigest(conversationId);
            if (view.isEmpty()) {
                log.info("Scheduled digest for conversation {} was superseded while building", conversationId);
                return;
            }
            if (view.get().getItemCount() == 0) {
                log.debug("No unread mail for conversation {}, nothing sent", conversationId);
                return;
            }
            delivery.deliverDigest(conversationId, view.get());
        } catch (DigestBuildException e) {
            log.warn("Scheduled digest for conversation {} could not be built: {}", conversationId, e.getMessage());
            delivery.deliverNotice(conversationId, ERROR_NOTICE);
        }
    }
}
