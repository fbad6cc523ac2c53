package mail.digest.app.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-conversation preferences for scheduled digests and important-mail alerts.
 */
@Entity
@Table(name = "conversation_settings")
@Data
@NoArgsConstructor
public class ConversationSettings {
    @Id
    private String conversationId;

    private int digestIntervalMinutes;
    private boolean notificationsEnabled;
    private Instant nextDigestAt;
    private Instant lastAlertCheckAt; // null until the first alert check
    private Instant createdAt;

    public ConversationSettings(String conversationId, Duration digestInterval, Instant createdAt) {
        this.conversationId = conversationId;
        this.digestIntervalMinutes = (int) digestInterval.toMinutes();
        this.notificationsEnabled = true;
        this.nextDigestAt = createdAt.plus(digestInterval);
        this.createdAt = createdAt;
    }

    public double getDigestIntervalHours() {
        return digestIntervalMinutes / 60.0;
    }

    public Duration digestInterval() {
        return Duration.ofMinutes(digestIntervalMinutes);
    }
}
