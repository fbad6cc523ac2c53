package mail.digest.app.service.delivery;

import mail.digest.app.model.DigestView;

/**
 * Outbound side of the chat transport, used by the scheduled jobs that have no request to answer.
 */
public interface DigestDelivery {
    void deliverDigest(String conversationId, DigestView view);

    void deliverAlert(String conversationId, String text);

    void deliverNotice(String conversationId, String text);
}
