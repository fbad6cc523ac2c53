package mail.digest.app.service.summary;

import lombok.Value;

/**
 * Source text handed to a provider. {@code subject} is what the heuristic falls back to.
 */
@Value
public class SummaryRequest {
    String subject;
    String body;
    int maxLength;

    public String sourceText() {
        String s = subject == null ? "" : subject.trim();
        String b = body == null ? "" : body.trim();
        if (s.isEmpty()) {
            return b;
        }
        return b.isEmpty() ? s : s + "\n" + b;
    }
}
