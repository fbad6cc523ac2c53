package mail.digest.app.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cursor over one conversation's digest. All reads and writes after construction must
 * happen while holding {@link #lock()}; the lock is fair so actions run in arrival order.
 */
@Getter
public class DigestSession {
    private final String sessionId;
    private final String conversationId;
    private final Instant createdAt;
    private final List<DigestItem> items = new ArrayList<>();

    private Instant expiresAt;
    private int cursor;
    private SessionState state = SessionState.BUILDING;
    private CloseReason closeReason;

    @Getter(AccessLevel.NONE)
    private final Set<String> appliedActionKeys = new HashSet<>();
    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock(true);

    public DigestSession(String sessionId, String conversationId, Instant createdAt, Duration ttl) {
        this.sessionId = sessionId;
        this.conversationId = conversationId;
        this.createdAt = createdAt;
        this.expiresAt = createdAt.plus(ttl);
    }

    public ReentrantLock lock() {
        return lock;
    }

    public List<DigestItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Leave {@code building}: install the ordered items and point the cursor at the first one.
     */
    public void activate(List<DigestItem> orderedItems) {
        if (state != SessionState.BUILDING) {
            throw new IllegalStateException("Session " + sessionId + " is " + state + ", cannot activate");
        }
        items.addAll(orderedItems);
        cursor = 0;
        state = items.isEmpty() ? SessionState.EXHAUSTED : SessionState.ACTIVE;
        currentItem().ifPresent(DigestItem::markShown);
    }

    public Optional<DigestItem> currentItem() {
        if (state != SessionState.ACTIVE || cursor >= items.size()) {
            return Optional.empty();
        }
        return Optional.of(items.get(cursor));
    }

    /**
     * Move forward one item. The cursor never moves backwards.
     */
    public void advance() {
        if (state != SessionState.ACTIVE) {
            return;
        }
        cursor++;
        if (cursor >= items.size()) {
            cursor = items.size();
            state = SessionState.EXHAUSTED;
        } else {
            items.get(cursor).markShown();
        }
    }

    public boolean isOpen() {
        return state != SessionState.CLOSED;
    }

    public boolean isExhausted() {
        return state == SessionState.EXHAUSTED;
    }

    public void close(CloseReason reason) {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSED;
        closeReason = reason;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public void touch(Instant now, Duration ttl) {
        expiresAt = now.plus(ttl);
    }

    /**
     * Record an idempotency key; returns false when the same key was already applied.
     */
    public boolean recordAction(String actionKey) {
        return appliedActionKeys.add(actionKey);
    }

    public boolean isApplied(String actionKey) {
        return appliedActionKeys.contains(actionKey);
    }

    public static String actionKey(String sessionId, int itemIndex, ActionKind kind) {
        return sessionId + ":" + itemIndex + ":" + kind.code();
    }
}
