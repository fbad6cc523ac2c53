package mail.digest.app.service.digest;

import mail.digest.app.model.ActionControl;
import mail.digest.app.model.ActionKind;
import mail.digest.app.model.DigestItem;
import mail.digest.app.model.EventCandidate;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryProvenance;
import mail.digest.app.model.SummaryResult;
import mail.digest.app.model.UrgencyResult;
import mail.digest.app.model.UrgencyTier;
import mail.digest.app.service.summary.SummaryText;
import mail.digest.app.service.urgency.UrgencyScorer;
import org.springframework.web.util.HtmlUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders digest items as HTML-flavoured chat markup. Only {@code <b>}, {@code <i>} and
 * {@code <a>} tags are emitted; every piece of mail content is escaped.
 */
public class DigestRenderer {
    static final String LOCAL_MARKER = "[Local summary]";
    static final String FALLBACK_MARKER = "[Fallback summary]";

    private static final DateTimeFormatter EVENT_TIME = DateTimeFormatter.ofPattern("EEE d MMM yyyy, HH:mm", Locale.ENGLISH);
    private static final DateTimeFormatter ALERT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm", Locale.ENGLISH);

    private final ZoneId zone;

    public DigestRenderer(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Render one item, shortening its summary until the result fits in {@code maxChars}.
     */
    public String render(DigestItem item, int index, int total, int maxChars) {
        String summaryText = item.getSummary().getText();
        String text = render(item, index, total, summaryText);
        while (text.length() > maxChars && !summaryText.isEmpty()) {
            int excess = text.length() - maxChars;
            int target = Math.max(0, summaryText.length() - excess - SummaryText.ELLIPSIS.length());
            summaryText = target == 0 ? "" : SummaryText.truncate(summaryText, target);
            text = render(item, index, total, summaryText);
        }
        return text;
    }

    String render(DigestItem item, int index, int total, String summaryText) {
        StringBuilder sb = new StringBuilder();
        sb.append("<b>📧 Email ").append(index + 1).append('/').append(total).append("</b>");
        if (item.isCombined()) {
            sb.append(" <i>(").append(item.getMessageIds().size()).append(" messages)</i>");
        }
        sb.append('\n');
        sb.append("<b>From:</b> ").append(escape(item.getSender().toString())).append('\n');
        sb.append("<b>Subject:</b> ").append(escape(item.getSubject())).append('\n');
        sb.append(urgencyMarker(item.getUrgency().getTier()))
                .append(" | ⏱ ").append(readingTime(item.getSummary())).append('\n');

        String marker = provenanceMarker(item.getSummary().getProvider());
        if (marker != null) {
            sb.append("<i>").append(marker).append("</i>\n");
        }
        if (!summaryText.isEmpty()) {
            sb.append('\n').append(escape(summaryText)).append('\n');
        }

        if (item.hasPendingEvent()) {
            sb.append('\n').append(renderEvent(item.getEventCandidate()));
        } else if (item.getCreatedEventId() != null) {
            sb.append("\n📅 Added to calendar\n");
        }
        return sb.toString().trim();
    }

    private String renderEvent(EventCandidate event) {
        StringBuilder sb = new StringBuilder();
        sb.append("📅 <b>Event:</b> ").append(escape(event.getTitle())).append('\n');
        sb.append("🕒 ").append(EVENT_TIME.format(event.getStart().atZone(zone)));
        if (event.getEnd() != null) {
            sb.append(" - ").append(DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH).format(event.getEnd().atZone(zone)));
        }
        sb.append(" (").append(zone.getId()).append(")\n");
        if (event.getLocation() != null) {
            sb.append("📍 ").append(escape(event.getLocation())).append('\n');
        }
        if (event.getMeetingLink() != null) {
            sb.append("🔗 <a href=\"").append(escape(event.getMeetingLink())).append("\">Join meeting</a>\n");
        }
        if (event.hasConflicts()) {
            int n = event.getConflictsWith().size();
            sb.append("⚠️ Conflicts with ").append(n).append(n == 1 ? " existing event" : " existing events").append('\n');
        }
        return sb.toString();
    }

    /**
     * Proactive notice for a message that scored above normal while no digest was requested.
     */
    public String renderAlert(MailMessage message, UrgencyResult urgency) {
        StringBuilder sb = new StringBuilder();
        sb.append("🚨 <b>Important Email Alert!</b>\n\n");
        sb.append("<b>From:</b> ").append(escape(message.getSender().toString())).append('\n');
        sb.append("<b>Subject:</b> ").append(escape(message.getSubject())).append('\n');
        if (message.getReceivedAt() != null) {
            sb.append("<b>Received:</b> ").append(formatAlertTime(message.getReceivedAt())).append('\n');
        }
        sb.append("<b>Reason:</b> ").append(escape(alertReason(urgency)));
        return sb.toString();
    }

    String alertReason(UrgencyResult urgency) {
        List<String> reasons = urgency.getReasons();
        if (reasons.contains(UrgencyScorer.REASON_IMPORTANT_SENDER)) {
            return "Important sender";
        }
        List<String> keywords = new ArrayList<>();
        String deadline = null;
        for (String reason : reasons) {
            if (reason.startsWith("keyword:")) {
                keywords.add(reason.substring("keyword:".length()));
            } else if (reason.startsWith("deadline:") && deadline == null) {
                deadline = reason.substring("deadline:".length());
            }
        }
        if (!keywords.isEmpty()) {
            return "Detected urgency: " + String.join(", ", keywords);
        }
        if (deadline != null) {
            return "Deadline detected: " + formatAlertTime(Instant.parse(deadline));
        }
        if (reasons.contains(UrgencyScorer.REASON_THREAD_ACTIVITY)) {
            return "Busy thread";
        }
        return reasons.contains(UrgencyScorer.REASON_CLASSIFIER) ? "Flagged by classifier" : "Urgent";
    }

    private String formatAlertTime(Instant instant) {
        return ALERT_TIME.format(instant.atZone(zone));
    }

    /**
     * Controls for one item. Event actions are offered only while a candidate is pending.
     */
    public List<ActionControl> controls(String sessionId, int index, DigestItem item) {
        List<ActionControl> controls = new ArrayList<>();
        controls.add(ActionControl.of(sessionId, index, ActionKind.MARK_IMPORTANT));
        controls.add(ActionControl.of(sessionId, index, ActionKind.FORWARD));
        controls.add(ActionControl.of(sessionId, index, ActionKind.LEAVE_UNREAD));
        controls.add(ActionControl.of(sessionId, index, ActionKind.NEXT));
        if (item.hasPendingEvent()) {
            controls.add(ActionControl.of(sessionId, index, ActionKind.ADD_EVENT));
            controls.add(ActionControl.of(sessionId, index, ActionKind.IGNORE_EVENT));
        }
        return controls;
    }

    static String urgencyMarker(UrgencyTier tier) {
        switch (tier) {
            case IMPORTANT:
                return "🔴 Important sender";
            case URGENT:
                return "🔴 Urgent";
            default:
                return "🟢 Normal";
        }
    }

    static String provenanceMarker(SummaryProvenance provenance) {
        switch (provenance) {
            case PRIMARY:
                return null;
            case LOCAL:
                return LOCAL_MARKER;
            default:
                return FALLBACK_MARKER;
        }
    }

    private static String readingTime(SummaryResult summary) {
        double minutes = summary.getReadingTimeMinutes();
        if (minutes < 1.0) {
            return "&lt;1 min read";
        }
        return (minutes == Math.rint(minutes) ? String.valueOf((long) minutes) : String.valueOf(minutes)) + " min read";
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text, "UTF-8");
    }
}
