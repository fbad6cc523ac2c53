package mail.digest.app.model;

import lombok.Value;

/**
 * Outcome of applying one action. {@code block} is null when the session is closed or exhausted.
 */
@Value
public class ActionResult {
    public static final String STALE_MESSAGE = "This digest is stale, run /digest again.";
    public static final String NO_MORE_ITEMS_MESSAGE = "No more emails in this digest.";

    ActionStatus status;
    String sessionId;
    String message;
    RenderedBlock block;

    public static ActionResult of(ActionStatus status, String sessionId, String message, RenderedBlock block) {
        return new ActionResult(status, sessionId, message, block);
    }

    public static ActionResult stale(ActionStatus status, String sessionId) {
        return new ActionResult(status, sessionId, STALE_MESSAGE, null);
    }

    public static ActionResult noMoreItems(String sessionId) {
        return new ActionResult(ActionStatus.NO_MORE_ITEMS, sessionId, NO_MORE_ITEMS_MESSAGE, null);
    }
}
