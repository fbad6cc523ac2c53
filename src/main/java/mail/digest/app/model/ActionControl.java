package mail.digest.app.model;

import lombok.Value;

/**
 * A button attached to a rendered block. {@code callbackData} is what the transport echoes back.
 */
@Value
public class ActionControl {
    String label;
    ActionKind action;
    int itemIndex;
    String callbackData;

    public static ActionControl of(String sessionId, int itemIndex, ActionKind action) {
        return new ActionControl(action.label(), action, itemIndex,
                DigestSession.actionKey(sessionId, itemIndex, action));
    }
}
