package mail.digest.app.service.mail;

import mail.digest.app.model.MailMessage;

import java.util.List;
import java.util.Set;

/**
 * Mailbox operations the digest needs. Implementations talk to the real mail provider.
 */
public interface MailboxGateway {
    /**
     * Fetch unread messages in the inbox.
     * @param maxResults upper bound on messages returned
     * @throws Exception if the provider call fails
     */
    List<MailMessage> fetchUnread(int maxResults) throws Exception;

    /**
     * Mark a message read and move it out of the inbox.
     * @throws Exception if the provider call fails
     */
    void markReadAndArchive(String messageId) throws Exception;

    /**
     * Forward a message to another address.
     * @return id of the sent message
     * @throws Exception if the provider call fails
     */
    String forward(String messageId, String destination) throws Exception;

    void setSenderImportant(String address, boolean important);

    boolean isSenderImportant(String address);

    /**
     * Snapshot of all senders currently flagged important.
     */
    Set<String> importantSenders();
}
