package mail.digest.app.service.settings;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.entity.ConversationSettings;
import mail.digest.app.repository.ConversationSettingsRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Registers conversations for scheduled digests and keeps their interval and alert preferences.
 * A conversation is registered the first time it asks for a digest or its settings.
 */
@Slf4j
public class ConversationSettingsService {
    public static final double MIN_INTERVAL_HOURS = 0.5;
    public static final double MAX_INTERVAL_HOURS = 24.0;

    private final ConversationSettingsRepository repository;
    private final Clock clock;
    private final Duration defaultInterval;

    public ConversationSettingsService(ConversationSettingsRepository repository, Clock clock, Duration defaultInterval) {
        this.repository = repository;
        this.clock = clock;
        this.defaultInterval = defaultInterval;
    }

    public ConversationSettings getOrCreate(String conversationId) {
        return repository.findById(conversationId).orElseGet(() -> {
            log.info("Registering conversation {} for scheduled digests every {}", conversationId, defaultInterval);
            return repository.save(new ConversationSettings(conversationId, defaultInterval, clock.instant()));
        });
    }

    /**
     * Change how often scheduled digests are sent. The next one is due a full interval from now.
     *
     * @throws IllegalArgumentException if {@code hours} is outside [0.5, 24]
     */
    public ConversationSettings setDigestInterval(String conversationId, double hours) {
        if (Double.isNaN(hours) || hours < MIN_INTERVAL_HOURS || hours > MAX_INTERVAL_HOURS) {
            throw new IllegalArgumentException("Interval must be between 0.5 and 24 hours");
        }
        ConversationSettings settings = getOrCreate(conversationId);
        int minutes = (int) Math.round(hours * 60);
        settings.setDigestIntervalMinutes(minutes);
        settings.setNextDigestAt(clock.instant().plus(Duration.ofMinutes(minutes)));
        log.info("Digest interval for conversation {} set to {} minutes", conversationId, minutes);
        return repository.save(settings);
    }

    public ConversationSettings toggleNotifications(String conversationId) {
        ConversationSettings settings = getOrCreate(conversationId);
        settings.setNotificationsEnabled(!settings.isNotificationsEnabled());
        log.info("Important-mail alerts for conversation {} {}", conversationId,
                settings.isNotificationsEnabled() ? "enabled" : "disabled");
        return repository.save(settings);
    }

    public List<ConversationSettings> dueForDigest() {
        return repository.findByNextDigestAtLessThanEqual(clock.instant());
    }

    public List<ConversationSettings> alertSubscribers() {
        return repository.findByNotificationsEnabledTrue();
    }

    /**
     * Schedule the next digest one interval after {@code sentAt}. Does nothing if the interval
     * was changed while the digest was being sent, since that change already set a new due time.
     */
    public boolean advanceDigest(ConversationSettings settings, Instant sentAt) {
        Instant next = sentAt.plus(settings.digestInterval());
        boolean advanced = repository.advanceNextDigestAt(settings.getConversationId(), settings.getNextDigestAt(), next) == 1;
        if (!advanced) {
            log.debug("Schedule of conversation {} changed meanwhile, keeping it", settings.getConversationId());
        }
        return advanced;
    }

    public void recordAlertCheck(String conversationId, Instant checkedAt) {
        repository.updateLastAlertCheckAt(conversationId, checkedAt);
    }
}
