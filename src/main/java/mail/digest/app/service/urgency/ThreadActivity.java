package mail.digest.app.service.urgency;

import mail.digest.app.model.MailMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ThreadActivity {
    private ThreadActivity() {
    }

    /**
     * Count messages per thread received within {@code window} before {@code now}.
     */
    public static Map<String, Integer> count(List<MailMessage> messages, Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        Map<String, Integer> counts = new HashMap<>();
        for (MailMessage message : messages) {
            if (message.getThreadId() == null) {
                continue;
            }
            Instant received = message.getReceivedAt();
            if (received != null && received.isBefore(cutoff)) {
                continue;
            }
            counts.merge(message.getThreadId(), 1, Integer::sum);
        }
        return counts;
    }
}
