package mail.digest.app.service.urgency;

import lombok.Value;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mailbox-level facts the scorer needs besides the message itself: the flagged senders
 * and how many messages each thread received inside the trailing window.
 */
@Value
public class UrgencyContext {
    Set<String> importantSenders;
    Map<String, Integer> threadActivity;

    public static UrgencyContext empty() {
        return new UrgencyContext(Set.of(), Map.of());
    }

    public boolean isImportant(String address) {
        return address != null && importantSenders.contains(address.toLowerCase(Locale.ROOT));
    }

    public int messagesInThread(String threadId) {
        if (threadId == null) {
            return 0;
        }
        return threadActivity.getOrDefault(threadId, 0);
    }
}
