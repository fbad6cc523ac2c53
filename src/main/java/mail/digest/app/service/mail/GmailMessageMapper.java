package mail.digest.app.service.mail;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.MailSender;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;

/**
 * Converts Gmail API messages into {@link MailMessage}s.
 */
@Slf4j
public final class GmailMessageMapper {

    private GmailMessageMapper() {
    }

    /**
     * @param clock supplies the received time when Gmail reports no internal date
     */
    public static MailMessage toMailMessage(Message message, Clock clock) {
        String subject = "";
        String from = "";
        if (message.getPayload() != null && message.getPayload().getHeaders() != null) {
            for (MessagePartHeader header : message.getPayload().getHeaders()) {
                String name = header.getName().toLowerCase(Locale.ROOT);
                if (name.equals("subject")) {
                    subject = header.getValue();
                } else if (name.equals("from")) {
                    from = header.getValue();
                }
            }
        }

        Bodies bodies = new Bodies();
        if (message.getPayload() != null) {
            collectBodies(message.getPayload(), bodies);
        }
        String bodyText = bodies.plainText != null ? bodies.plainText.toString() : null;
        if ((bodyText == null || bodyText.isBlank()) && bodies.html == null && message.getSnippet() != null) {
            bodyText = message.getSnippet();
        }

        Instant receivedAt = message.getInternalDate() != null
                ? Instant.ofEpochMilli(message.getInternalDate())
                : clock.instant();

        return MailMessage.builder()
                .id(message.getId())
                .threadId(message.getThreadId())
                .sender(MailSender.parse(from))
                .subject(subject)
                .bodyText(bodyText)
                .bodyHtml(bodies.html != null ? bodies.html.toString() : null)
                .receivedAt(receivedAt)
                .build();
    }

    private static class Bodies {
        StringBuilder plainText;
        StringBuilder html;
    }

    private static void collectBodies(MessagePart part, Bodies bodies) {
        String mimeType = part.getMimeType();
        if (part.getBody() != null && part.getBody().getData() != null && mimeType != null) {
            if (mimeType.equals("text/plain") || mimeType.equals("text/html")) {
                String decoded = decode(part.getBody().getData(), mimeType);
                if (decoded != null) {
                    if (mimeType.equals("text/plain")) {
                        bodies.plainText = append(bodies.plainText, decoded);
                    } else {
                        bodies.html = append(bodies.html, decoded);
                    }
                }
            }
        }
        if (part.getParts() != null) {
            for (MessagePart sub : part.getParts()) {
                collectBodies(sub, bodies);
            }
        }
    }

    private static StringBuilder append(StringBuilder existing, String text) {
        if (existing == null) {
            return new StringBuilder(text);
        }
        return existing.append('\n').append(text);
    }

    static String decode(String data, String mimeType) {
        try {
            // Gmail uses URL-safe Base64
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                String padded = data;
                int remainder = padded.length() % 4;
                if (remainder > 0) {
                    padded += "=".repeat(4 - remainder);
                }
                return new String(Base64.getDecoder().decode(padded), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Error decoding email body part (mimeType: {}): {}", mimeType, e2.getMessage());
                return null;
            }
        }
    }
}
