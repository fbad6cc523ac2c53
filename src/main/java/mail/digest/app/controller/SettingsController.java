package mail.digest.app.controller;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.entity.ConversationSettings;
import mail.digest.app.service.delivery.OutboundMessage;
import mail.digest.app.service.delivery.OutboxDigestDelivery;
import mail.digest.app.service.settings.ConversationSettingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Per-conversation schedule settings, and the outbox the transport polls for scheduled
 * digests and alerts.
 */
@Slf4j
@RestController
@RequestMapping("/api/digest/{conversationId}")
public class SettingsController {
    private final ConversationSettingsService settingsService;
    private final OutboxDigestDelivery outbox;

    public SettingsController(ConversationSettingsService settingsService, OutboxDigestDelivery outbox) {
        this.settingsService = settingsService;
        this.outbox = outbox;
    }

    @GetMapping("/settings")
    public ResponseEntity<ConversationSettings> getSettings(@PathVariable String conversationId) {
        return ResponseEntity.ok(settingsService.getOrCreate(conversationId));
    }

    /**
     * Body is {@code {"hours": 2}}; 0.5 to 24 hours are accepted.
     */
    @PutMapping("/settings/interval")
    public ResponseEntity<?> setInterval(@PathVariable String conversationId, @RequestBody IntervalRequest request) {
        if (request.getHours() == null) {
            return ResponseEntity.badRequest().body(Map.of("message", "hours is required"));
        }
        try {
            return ResponseEntity.ok(settingsService.setDigestInterval(conversationId, request.getHours()));
        } catch (IllegalArgumentException e) {
            log.debug("Rejected interval {} for conversation {}", request.getHours(), conversationId);
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }

    @PostMapping("/settings/notifications/toggle")
    public ResponseEntity<ConversationSettings> toggleNotifications(@PathVariable String conversationId) {
        return ResponseEntity.ok(settingsService.toggleNotifications(conversationId));
    }

    @PostMapping("/outbox/drain")
    public ResponseEntity<List<OutboundMessage>> drainOutbox(@PathVariable String conversationId) {
        return ResponseEntity.ok(outbox.drain(conversationId));
    }
}
