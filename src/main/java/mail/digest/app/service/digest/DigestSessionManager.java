package mail.digest.app.service.digest;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.ActionKind;
import mail.digest.app.model.ActionResult;
import mail.digest.app.model.ActionStatus;
import mail.digest.app.model.CloseReason;
import mail.digest.app.model.DigestItem;
import mail.digest.app.model.DigestSession;
import mail.digest.app.model.DigestView;
import mail.digest.app.model.RenderedBlock;
import mail.digest.app.model.SessionState;
import mail.digest.app.service.calendar.CalendarGateway;
import mail.digest.app.service.mail.MailboxGateway;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every digest session of the process and applies user actions to them.
 * <p>
 * At most one session per conversation is open. Every read or write of a session happens while
 * holding that session's lock, including the expiry sweep, so actions on one session are applied
 * one at a time in arrival order. Actions are matched by the key {@code sessionId:itemIndex:action};
 * a key that was already applied is reported as a duplicate and has no effect.
 * <p>
 * Map operations may run while a session lock is held, never the other way round: no session lock
 * is taken inside a map operation.
 */
@Slf4j
public class DigestSessionManager {
    private static final int CLOSED_SESSION_MEMORY = 1000;

    private final MailboxGateway mailbox;
    private final CalendarGateway calendar;
    private final DigestRenderer renderer;
    private final BlockPaginator paginator;
    private final Clock clock;
    private final Duration sessionTtl;
    private final String forwardAddress;
    private final boolean addEventOnNext;

    private final Map<String, DigestSession> sessionsById = new ConcurrentHashMap<>();
    private final Map<String, DigestSession> openByConversation = new ConcurrentHashMap<>();
    private final Map<String, CloseReason> closedSessions = new LinkedHashMap<String, CloseReason>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, CloseReason> eldest) {
            return size() > CLOSED_SESSION_MEMORY;
        }
    };

    public DigestSessionManager(MailboxGateway mailbox, CalendarGateway calendar, DigestRenderer renderer,
                                BlockPaginator paginator, Clock clock, Duration sessionTtl, String forwardAddress,
                                boolean addEventOnNext) {
        this.mailbox = mailbox;
        this.calendar = calendar;
        this.renderer = renderer;
        this.paginator = paginator;
        this.clock = clock;
        this.sessionTtl = sessionTtl;
        this.forwardAddress = forwardAddress;
        this.addEventOnNext = addEventOnNext;
    }

    /**
     * Start a new session in {@code building} state, closing any open session of the conversation first.
     */
    public DigestSession open(String conversationId) {
        DigestSession fresh = new DigestSession(UUID.randomUUID().toString(), conversationId, clock.instant(), sessionTtl);
        sessionsById.put(fresh.getSessionId(), fresh);
        DigestSession previous = openByConversation.put(conversationId, fresh);
        if (previous != null) {
            close(previous, CloseReason.SUPERSEDED);
        }
        log.info("Opened digest session {} for conversation {}", fresh.getSessionId(), conversationId);
        return fresh;
    }

    /**
     * Install built items and render the whole digest. Empty when the session was closed while building,
     * in which case the items are dropped.
     */
    public Optional<DigestView> activate(DigestSession session, List<DigestItem> items) {
        session.lock().lock();
        try {
            if (session.getState() != SessionState.BUILDING) {
                log.info("Session {} was {} during build, discarding {} items",
                        session.getSessionId(), session.getCloseReason(), items.size());
                return Optional.empty();
            }
            session.activate(items);
            session.touch(clock.instant(), sessionTtl);

            List<BlockPaginator.Segment> segments = new ArrayList<>();
            List<DigestItem> all = session.getItems();
            for (int i = 0; i < all.size(); i++) {
                segments.add(segment(session, i));
            }
            List<RenderedBlock> blocks = paginator.paginate(segments);
            log.info("Session {} active with {} items in {} blocks", session.getSessionId(), all.size(), blocks.size());
            return Optional.of(new DigestView(session.getSessionId(), session.getConversationId(), all.size(), blocks));
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Drop a session whose build could not complete.
     */
    public void abandon(DigestSession session) {
        openByConversation.remove(session.getConversationId(), session);
        close(session, CloseReason.EXPIRED);
    }

    public ActionResult applyAction(String conversationId, String sessionId, int itemIndex, ActionKind action) {
        DigestSession session = sessionsById.get(sessionId);
        if (session == null || !session.getConversationId().equals(conversationId)) {
            return ActionResult.stale(staleStatus(closedReason(sessionId)), sessionId);
        }

        session.lock().lock();
        try {
            Instant now = clock.instant();
            if (!session.isOpen()) {
                return ActionResult.stale(staleStatus(session.getCloseReason()), sessionId);
            }
            if (session.isExpired(now)) {
                expire(session);
                return ActionResult.stale(ActionStatus.SESSION_EXPIRED, sessionId);
            }
            if (session.getState() == SessionState.BUILDING) {
                return ActionResult.of(ActionStatus.IGNORED, sessionId, "Digest is still being built.", null);
            }

            if (session.isExhausted()) {
                return ActionResult.noMoreItems(sessionId);
            }
            String key = DigestSession.actionKey(sessionId, itemIndex, action);
            if (session.isApplied(key)) {
                log.debug("Duplicate action {}", key);
                return ActionResult.of(ActionStatus.DUPLICATE, sessionId, null, currentBlock(session));
            }
            if (itemIndex != session.getCursor()) {
                log.debug("Ignoring {} for item {}, cursor is at {}", action.code(), itemIndex, session.getCursor());
                return ActionResult.of(ActionStatus.IGNORED, sessionId, null, currentBlock(session));
            }
            DigestItem item = session.currentItem().orElseThrow();
            if (item.isActed() || (action.isEventAction() && !item.hasPendingEvent())) {
                return ActionResult.of(ActionStatus.IGNORED, sessionId, null, currentBlock(session));
            }

            try {
                perform(session, item, action);
            } catch (Exception e) {
                log.error("Action {} failed on session {} item {}: {}", action.code(), sessionId, itemIndex,
                        e.getMessage(), e);
                return ActionResult.of(ActionStatus.FAILED, sessionId,
                        "Could not apply " + action.code() + ": " + e.getMessage(), currentBlock(session));
            }
            session.recordAction(key);
            session.touch(now, sessionTtl);
            log.debug("Applied {} to session {} item {}, cursor now {}", action.code(), sessionId, itemIndex,
                    session.getCursor());

            if (session.isExhausted()) {
                return ActionResult.of(ActionStatus.APPLIED, sessionId, ActionResult.NO_MORE_ITEMS_MESSAGE, null);
            }
            return ActionResult.of(ActionStatus.APPLIED, sessionId, null, currentBlock(session));
        } finally {
            session.lock().unlock();
        }
    }

    private void perform(DigestSession session, DigestItem item, ActionKind action) throws Exception {
        switch (action) {
            case MARK_IMPORTANT:
                mailbox.setSenderImportant(item.getSender().getAddress(), true);
                List<DigestItem> items = session.getItems();
                for (int i = session.getCursor(); i < items.size(); i++) {
                    DigestItem later = items.get(i);
                    if (later.getGroupKey().equals(item.getGroupKey())) {
                        later.promoteToImportant(UrgencyScorer.REASON_IMPORTANT_SENDER);
                    }
                }
                break;
            case FORWARD:
                for (String id : item.getMessageIds()) {
                    mailbox.forward(id, forwardAddress);
                }
                archive(item);
                item.markActed();
                session.advance();
                break;
            case NEXT:
                if (addEventOnNext && item.hasPendingEvent()) {
                    createEvent(item);
                }
                archive(item);
                item.markActed();
                session.advance();
                break;
            case LEAVE_UNREAD:
                session.advance();
                break;
            case ADD_EVENT:
                createEvent(item);
                break;
            case IGNORE_EVENT:
                item.clearEventCandidate();
                break;
            default:
                throw new IllegalArgumentException("Unsupported action " + action);
        }
    }

    private void archive(DigestItem item) throws Exception {
        for (String id : item.getMessageIds()) {
            mailbox.markReadAndArchive(id);
        }
    }

    private void createEvent(DigestItem item) throws Exception {
        String description = "From " + item.getSender() + "\n\n" + item.getSummary().getText();
        String eventId = calendar.createEvent(item.getEventCandidate(), description);
        item.recordCreatedEvent(eventId);
    }

    /**
     * Close sessions whose TTL has passed. Runs on Spring's scheduler and takes each session's lock.
     */
    @Scheduled(fixedDelayString = "${digest.session-sweep-interval:PT1M}")
    public void expireSessions() {
        Instant now = clock.instant();
        int expired = 0;
        for (DigestSession session : new ArrayList<>(sessionsById.values())) {
            session.lock().lock();
            try {
                if (session.isOpen() && session.isExpired(now)) {
                    expire(session);
                    expired++;
                }
            } finally {
                session.lock().unlock();
            }
        }
        if (expired > 0) {
            log.info("Expired {} digest sessions", expired);
        }
    }

    /**
     * Whether the conversation has a digest that is still being built or worked through.
     */
    public boolean hasLiveSession(String conversationId) {
        DigestSession session = openByConversation.get(conversationId);
        if (session == null) {
            return false;
        }
        session.lock().lock();
        try {
            SessionState state = session.getState();
            return (state == SessionState.BUILDING || state == SessionState.ACTIVE) && !session.isExpired(clock.instant());
        } finally {
            session.lock().unlock();
        }
    }

    public Optional<DigestSession> openSession(String conversationId) {
        return Optional.ofNullable(openByConversation.get(conversationId));
    }

    private void expire(DigestSession session) {
        openByConversation.remove(session.getConversationId(), session);
        close(session, CloseReason.EXPIRED);
    }

    private void close(DigestSession session, CloseReason reason) {
        session.lock().lock();
        try {
            if (!session.isOpen()) {
                return;
            }
            session.close(reason);
        } finally {
            session.lock().unlock();
        }
        sessionsById.remove(session.getSessionId());
        synchronized (closedSessions) {
            closedSessions.put(session.getSessionId(), reason);
        }
        log.info("Closed digest session {} for conversation {}: {}",
                session.getSessionId(), session.getConversationId(), reason);
    }

    private CloseReason closedReason(String sessionId) {
        synchronized (closedSessions) {
            return closedSessions.getOrDefault(sessionId, CloseReason.EXPIRED);
        }
    }

    private static ActionStatus staleStatus(CloseReason reason) {
        return reason == CloseReason.SUPERSEDED ? ActionStatus.SESSION_SUPERSEDED : ActionStatus.SESSION_EXPIRED;
    }

    private RenderedBlock currentBlock(DigestSession session) {
        if (session.currentItem().isEmpty()) {
            return null;
        }
        return paginator.single(segment(session, session.getCursor()));
    }

    private BlockPaginator.Segment segment(DigestSession session, int index) {
        DigestItem item = session.getItems().get(index);
        int total = session.getItems().size();
        String text = renderer.render(item, index, total, paginator.getMaxChars());
        return new BlockPaginator.Segment(index, text, renderer.controls(session.getSessionId(), index, item));
    }
}
