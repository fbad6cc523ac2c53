package mail.digest.app.service.delivery;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.DigestView;
import mail.digest.app.model.RenderedBlock;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps outbound messages per conversation until the transport drains them. Each outbox holds at
 * most {@code capacity} messages; the oldest is dropped when a new one does not fit.
 * A queue is only touched inside a map operation on its own key.
 */
@Slf4j
public class OutboxDigestDelivery implements DigestDelivery {
    private final ConcurrentMap<String, Deque<OutboundMessage>> outboxes = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int capacity;

    public OutboxDigestDelivery(Clock clock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.clock = clock;
        this.capacity = capacity;
    }

    @Override
    public void deliverDigest(String conversationId, DigestView view) {
        for (RenderedBlock block : view.getBlocks()) {
            enqueue(conversationId, new OutboundMessage(OutboundMessage.Kind.DIGEST, clock.instant(),
                    block.getText(), block.getControls()));
        }
        log.info("Queued digest {} ({} blocks) for conversation {}", view.getSessionId(), view.getBlocks().size(),
                conversationId);
    }

    @Override
    public void deliverAlert(String conversationId, String text) {
        enqueue(conversationId, new OutboundMessage(OutboundMessage.Kind.ALERT, clock.instant(), text, List.of()));
    }

    @Override
    public void deliverNotice(String conversationId, String text) {
        enqueue(conversationId, new OutboundMessage(OutboundMessage.Kind.NOTICE, clock.instant(), text, List.of()));
    }

    /**
     * Remove and return everything queued for the conversation, oldest first.
     */
    public List<OutboundMessage> drain(String conversationId) {
        Deque<OutboundMessage> queue = outboxes.remove(conversationId);
        return queue == null ? List.of() : List.copyOf(queue);
    }

    private void enqueue(String conversationId, OutboundMessage message) {
        outboxes.compute(conversationId, (id, queue) -> {
            Deque<OutboundMessage> target = queue != null ? queue : new ArrayDeque<>();
            target.addLast(message);
            while (target.size() > capacity) {
                OutboundMessage dropped = target.removeFirst();
                log.warn("Outbox of conversation {} is full, dropping {} from {}", id, dropped.getKind(),
                        dropped.getCreatedAt());
            }
            return target;
        });
    }
}
