package mail.digest.app.service.delivery;

import mail.digest.app.model.ActionControl;
import mail.digest.app.model.ActionKind;
import mail.digest.app.model.DigestView;
import mail.digest.app.model.RenderedBlock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutboxDigestDeliveryTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);

    @Test
    void deliverDigest_ShouldQueueOneMessagePerBlockWithItsControls() {
        // Given
        OutboxDigestDelivery outbox = new OutboxDigestDelivery(CLOCK, 10);
        ActionControl next = ActionControl.of("s1", 0, ActionKind.NEXT);
        DigestView view = new DigestView("s1", "chat-1", 2, List.of(
                new RenderedBlock("first", List.of(0), List.of(next)),
                new RenderedBlock("second", List.of(1), List.of())));

        // When
        outbox.deliverDigest("chat-1", view);
        outbox.deliverNotice("chat-1", "done");
        List<OutboundMessage> drained = outbox.drain("chat-1");

        // Then
        assertEquals(3, drained.size());
        assertEquals(OutboundMessage.Kind.DIGEST, drained.get(0).getKind());
        assertEquals("first", drained.get(0).getText());
        assertEquals(List.of(next), drained.get(0).getControls());
        assertEquals("second", drained.get(1).getText());
        assertEquals(OutboundMessage.Kind.NOTICE, drained.get(2).getKind());
        assertTrue(outbox.drain("chat-1").isEmpty());
    }

    @Test
    void deliverAlert_WhenOutboxFull_ShouldDropOldest() {
        OutboxDigestDelivery outbox = new OutboxDigestDelivery(CLOCK, 2);

        outbox.deliverAlert("chat-1", "a");
        outbox.deliverAlert("chat-1", "b");
        outbox.deliverAlert("chat-1", "c");

        List<OutboundMessage> drained = outbox.drain("chat-1");
        assertEquals(List.of("b", "c"), List.of(drained.get(0).getText(), drained.get(1).getText()));
    }

    @Test
    void drain_ShouldKeepConversationsApart() {
        OutboxDigestDelivery outbox = new OutboxDigestDelivery(CLOCK, 5);
        outbox.deliverAlert("chat-1", "for one");
        outbox.deliverAlert("chat-2", "for two");

        assertEquals("for one", outbox.drain("chat-1").get(0).getText());
        assertEquals(1, outbox.drain("chat-2").size());
        assertTrue(outbox.drain("chat-3").isEmpty());
    }

    @Test
    void constructor_WithNonPositiveCapacity_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new OutboxDigestDelivery(CLOCK, 0));
    }
}
