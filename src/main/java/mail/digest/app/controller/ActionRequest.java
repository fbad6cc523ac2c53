package mail.digest.app.controller;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionRequest {
    private String sessionId;
    private Integer itemIndex;
    private String action;
    private String callbackData;

    /**
     * Fill the explicit fields from {@code callbackData} when only the button payload was sent.
     */
    public ActionRequest resolve() {
        if (callbackData == null || callbackData.isBlank()) {
            if (sessionId == null || itemIndex == null || action == null) {
                throw new IllegalArgumentException("sessionId, itemIndex and action are required");
            }
            return this;
        }
        String[] parts = callbackData.split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("malformed callback data '" + callbackData + "'");
        }
        try {
            return new ActionRequest(parts[0], Integer.parseInt(parts[1]), parts[2], callbackData);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("item index is not a number in '" + callbackData + "'", e);
        }
    }
}
