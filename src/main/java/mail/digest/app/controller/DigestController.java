package mail.digest.app.controller;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.ActionKind;
import mail.digest.app.model.ActionResult;
import mail.digest.app.model.ActionStatus;
import mail.digest.app.model.DigestView;
import mail.digest.app.service.digest.DigestBuildException;
import mail.digest.app.service.digest.DigestService;
import mail.digest.app.service.settings.ConversationSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * HTTP seam for the chat transport: it posts {@code /digest} commands and button presses here
 * and relays the returned blocks to the conversation.
 */
@Slf4j
@RestController
@RequestMapping("/api/digest")
public class DigestController {
    private final DigestService digestService;
    private final ConversationSettingsService settingsService;

    public DigestController(DigestService digestService, ConversationSettingsService settingsService) {
        this.digestService = digestService;
        this.settingsService = settingsService;
    }

    @PostMapping("/{conversationId}")
    public ResponseEntity<?> buildDigest(@PathVariable String conversationId) {
        register(conversationId);
        try {
            Optional<DigestView> view = digestService.buildDigest(conversationId);
            if (view.isEmpty()) {
                return ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("message", ActionResult.STALE_MESSAGE));
            }
            return ResponseEntity.ok(view.get());
        } catch (DigestBuildException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("message", e.getMessage()));
        }
    }

    // the first digest request also subscribes the conversation to scheduled digests
    private void register(String conversationId) {
        try {
            settingsService.getOrCreate(conversationId);
        } catch (RuntimeException e) {
            log.warn("Could not register conversation {} for scheduled digests: {}", conversationId, e.getMessage());
        }
    }

    /**
     * Apply a button press. The body is {@code {"sessionId": ..., "itemIndex": ..., "action": ...}} or
     * {@code {"callbackData": "sessionId:itemIndex:action"}}.
     */
    @PostMapping("/{conversationId}/actions")
    public ResponseEntity<?> applyAction(@PathVariable String conversationId, @RequestBody ActionRequest request) {
        try {
            ActionRequest resolved = request.resolve();
            ActionResult result = digestService.applyAction(conversationId, resolved.getSessionId(),
                    resolved.getItemIndex(), ActionKind.fromCode(resolved.getAction()));
            if (result.getStatus() == ActionStatus.FAILED) {
                return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
            }
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected action request for conversation {}: {}", conversationId, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("message", "Invalid action: " + e.getMessage()));
        }
    }
}
