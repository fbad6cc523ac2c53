package mail.digest.app.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One fetched email. Owned by the mailbox; the digest pipeline only reads it.
 */
@Value
@Builder
public class MailMessage {
    String id;
    MailSender sender;
    String subject;
    String bodyText;
    String bodyHtml;
    Instant receivedAt;
    String threadId;

    /**
     * Plain body if present, otherwise the HTML body, otherwise empty.
     */
    public String bestBody() {
        if (bodyText != null && !bodyText.isBlank()) {
            return bodyText;
        }
        return bodyHtml != null ? bodyHtml : "";
    }

    public String subjectOrEmpty() {
        return subject != null ? subject : "";
    }
}
