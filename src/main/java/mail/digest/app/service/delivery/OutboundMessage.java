package mail.digest.app.service.delivery;

import lombok.Value;
import mail.digest.app.model.ActionControl;

import java.time.Instant;
import java.util.List;

/**
 * A message produced without a request from the conversation, waiting for the transport to pick it up.
 */
@Value
public class OutboundMessage {
    Kind kind;
    Instant createdAt;
    String text;
    List<ActionControl> controls;

    public enum Kind {
        DIGEST,
        ALERT,
        NOTICE
    }
}
