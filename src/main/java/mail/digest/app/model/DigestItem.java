package mail.digest.app.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * The unit presented to the user. A combined item stands for every message of one sender group.
 * Mutated only by the session that owns it, under that session's lock.
 */
@Getter
@ToString
public class DigestItem {
    private final String messageRef;
    private final List<String> messageIds;
    private final MailSender sender;
    private final String subject;
    private final SummaryResult summary;
    private final String groupKey;
    private final Instant receivedAt;
    private final boolean combined;

    private UrgencyResult urgency;
    private EventCandidate eventCandidate;
    private String createdEventId;
    private DigestItemState state = DigestItemState.PENDING;

    @Builder
    public DigestItem(@Singular List<String> messageIds, MailSender sender, String subject, SummaryResult summary,
                      UrgencyResult urgency, EventCandidate eventCandidate, Instant receivedAt, boolean combined) {
        if (messageIds.isEmpty()) {
            throw new IllegalArgumentException("A digest item needs at least one message");
        }
        this.messageIds = List.copyOf(messageIds);
        this.messageRef = this.messageIds.get(0);
        this.sender = sender;
        this.subject = subject;
        this.summary = summary;
        this.urgency = urgency;
        this.eventCandidate = eventCandidate;
        this.groupKey = sender.getAddress();
        this.receivedAt = receivedAt;
        this.combined = combined;
    }

    public boolean hasPendingEvent() {
        return eventCandidate != null && createdEventId == null;
    }

    public void markShown() {
        if (state == DigestItemState.PENDING) {
            state = DigestItemState.SHOWN;
        }
    }

    public void markActed() {
        state = DigestItemState.ACTED;
    }

    public boolean isActed() {
        return state == DigestItemState.ACTED;
    }

    public void promoteToImportant(String reason) {
        urgency = urgency.withTier(UrgencyTier.IMPORTANT, reason);
    }

    public void clearEventCandidate() {
        eventCandidate = null;
    }

    public void recordCreatedEvent(String eventId) {
        createdEventId = eventId;
    }
}
