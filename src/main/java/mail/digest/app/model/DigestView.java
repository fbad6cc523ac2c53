package mail.digest.app.model;

import lombok.Value;

import java.util.List;

/**
 * Result of building a digest: the new session id and the blocks to send, in order.
 */
@Value
public class DigestView {
    String sessionId;
    String conversationId;
    int itemCount;
    List<RenderedBlock> blocks;
}
