package mail.digest.app.service.digest;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.ActionKind;
import mail.digest.app.model.ActionResult;
import mail.digest.app.model.DigestItem;
import mail.digest.app.model.DigestSession;
import mail.digest.app.model.DigestView;
import mail.digest.app.model.ExistingEvent;
import mail.digest.app.model.MailMessage;
import mail.digest.app.service.calendar.CalendarGateway;
import mail.digest.app.service.mail.MailboxGateway;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for the two operations the chat side needs: build a digest and apply an action.
 */
@Slf4j
public class DigestService {
    private final MailboxGateway mailbox;
    private final CalendarGateway calendar;
    private final DigestBuilder builder;
    private final DigestSessionManager sessionManager;
    private final Clock clock;
    private final int maxUnread;
    private final Duration calendarLookahead;

    public DigestService(MailboxGateway mailbox, CalendarGateway calendar, DigestBuilder builder,
                         DigestSessionManager sessionManager, Clock clock, int maxUnread, Duration calendarLookahead) {
        this.mailbox = mailbox;
        this.calendar = calendar;
        this.builder = builder;
        this.sessionManager = sessionManager;
        this.clock = clock;
        this.maxUnread = maxUnread;
        this.calendarLookahead = calendarLookahead;
    }

    /**
     * Fetch unread mail and build a digest for the conversation, superseding its previous digest.
     *
     * @return the rendered digest, or empty if a newer request superseded this one while it was building
     * @throws DigestBuildException if the mailbox could not be read
     */
    public Optional<DigestView> buildDigest(String conversationId) throws DigestBuildException {
        DigestSession session = sessionManager.open(conversationId);
        List<MailMessage> messages;
        try {
            messages = mailbox.fetchUnread(maxUnread);
        } catch (Exception e) {
            sessionManager.abandon(session);
            log.error("Could not fetch unread mail for conversation {}: {}", conversationId, e.getMessage(), e);
            throw new DigestBuildException("Could not fetch unread mail: " + e.getMessage(), e);
        }
        return build(session, messages);
    }

    /**
     * Build a digest from messages the caller already fetched.
     */
    public Optional<DigestView> buildDigest(String conversationId, List<MailMessage> messages)
            throws DigestBuildException {
        return build(sessionManager.open(conversationId), messages);
    }

    /**
     * Whether the conversation still has a digest being built or being worked through.
     */
    public boolean hasLiveDigest(String conversationId) {
        return sessionManager.hasLiveSession(conversationId);
    }

    public ActionResult applyAction(String conversationId, String sessionId, int itemIndex, ActionKind action) {
        return sessionManager.applyAction(conversationId, sessionId, itemIndex, action);
    }

    private Optional<DigestView> build(DigestSession session, List<MailMessage> messages) throws DigestBuildException {
        try {
            List<DigestItem> items = builder.build(messages, upcomingEvents(), importantSenders());
            return sessionManager.activate(session, items);
        } catch (RuntimeException e) {
            sessionManager.abandon(session);
            log.error("Digest build failed for conversation {}: {}", session.getConversationId(), e.getMessage(), e);
            throw new DigestBuildException("Digest build failed: " + e.getMessage(), e);
        }
    }

    private List<ExistingEvent> upcomingEvents() {
        Instant now = clock.instant();
        try {
            return calendar.listUpcomingEvents(now, now.plus(calendarLookahead));
        } catch (Exception e) {
            log.warn("Could not list calendar events, conflicts will not be tagged: {}", e.getMessage());
            return List.of();
        }
    }

    private Set<String> importantSenders() {
        try {
            return mailbox.importantSenders();
        } catch (RuntimeException e) {
            log.warn("Could not load important senders: {}", e.getMessage());
            return Set.of();
        }
    }
}
