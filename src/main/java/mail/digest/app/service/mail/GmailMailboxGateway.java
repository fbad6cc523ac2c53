package mail.digest.app.service.mail;

import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.entity.ImportantSender;
import mail.digest.app.model.MailMessage;
import mail.digest.app.repository.ImportantSenderRepository;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Gmail-backed mailbox. The important-sender set lives in the application database.
 */
@Slf4j
public class GmailMailboxGateway implements MailboxGateway {
    private static final String UNREAD_QUERY = "is:unread in:inbox";

    private final GoogleClientFactory clientFactory;
    private final ImportantSenderRepository importantSenderRepository;
    private final String userId;
    private final Clock clock;

    public GmailMailboxGateway(GoogleClientFactory clientFactory, ImportantSenderRepository importantSenderRepository,
                               String userId, Clock clock) {
        this.clientFactory = clientFactory;
        this.importantSenderRepository = importantSenderRepository;
        this.userId = userId;
        this.clock = clock;
    }

    @Override
    public List<MailMessage> fetchUnread(int maxResults) throws Exception {
        Gmail service = clientFactory.gmail();
        ListMessagesResponse response = service.users().messages().list(userId)
                .setQ(UNREAD_QUERY)
                .setMaxResults((long) maxResults)
                .execute();

        List<MailMessage> messages = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message ref : response.getMessages()) {
                Message full = service.users().messages().get(userId, ref.getId())
                        .setFormat("full")
                        .execute();
                messages.add(GmailMessageMapper.toMailMessage(full, clock));
            }
        }
        log.info("Fetched {} unread messages for {}", messages.size(), userId);
        return messages;
    }

    @Override
    public void markReadAndArchive(String messageId) throws Exception {
        ModifyMessageRequest mods = new ModifyMessageRequest()
                .setAddLabelIds(Collections.emptyList())
                .setRemoveLabelIds(List.of("UNREAD", "INBOX"));
        clientFactory.gmail().users().messages().modify(userId, messageId, mods).execute();
        log.debug("Marked message {} read and archived", messageId);
    }

    @Override
    public String forward(String messageId, String destination) throws Exception {
        if (destination == null || destination.isBlank()) {
            throw new IllegalStateException("No forward address configured. Set digest.forward-address.");
        }
        Gmail service = clientFactory.gmail();
        Message original = service.users().messages().get(userId, messageId).setFormat("full").execute();
        MailMessage mail = GmailMessageMapper.toMailMessage(original, clock);

        String raw = forwardMime(mail, destination);
        Message outgoing = new Message()
                .setRaw(Base64.getUrlEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8)))
                .setThreadId(mail.getThreadId());
        Message sent = service.users().messages().send(userId, outgoing).execute();
        log.info("Forwarded message {} to {} as {}", messageId, destination, sent.getId());
        return sent.getId();
    }

    static String forwardMime(MailMessage mail, String destination) {
        String subject = mail.subjectOrEmpty().replaceAll("[\\r\\n]+", " ");
        String body = mail.getBodyText() != null && !mail.getBodyText().isBlank()
                ? mail.getBodyText()
                : mail.bestBody();
        return "To: " + destination + "\r\n"
                + "Subject: Fwd: " + subject + "\r\n"
                + "MIME-Version: 1.0\r\n"
                + "Content-Type: text/plain; charset=UTF-8\r\n"
                + "\r\n"
                + "---------- Forwarded message ---------\r\n"
                + "From: " + mail.getSender() + "\r\n"
                + "Date: " + mail.getReceivedAt() + "\r\n"
                + "Subject: " + subject + "\r\n"
                + "\r\n"
                + body;
    }

    @Override
    @Transactional
    public void setSenderImportant(String address, boolean important) {
        String key = address.toLowerCase(Locale.ROOT);
        if (important) {
            importantSenderRepository.save(new ImportantSender(key, clock.instant()));
            log.info("Marked {} as important sender", key);
        } else if (importantSenderRepository.existsById(key)) {
            importantSenderRepository.deleteById(key);
            log.info("Cleared important flag for {}", key);
        }
    }

    @Override
    public boolean isSenderImportant(String address) {
        return address != null && importantSenderRepository.existsById(address.toLowerCase(Locale.ROOT));
    }

    @Override
    public Set<String> importantSenders() {
        Set<String> senders = new HashSet<>();
        for (ImportantSender sender : importantSenderRepository.findAll()) {
            senders.add(sender.getAddress());
        }
        return senders;
    }
}
