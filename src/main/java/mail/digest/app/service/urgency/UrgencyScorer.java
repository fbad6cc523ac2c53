package mail.digest.app.service.urgency;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryResult;
import mail.digest.app.model.UrgencyResult;
import mail.digest.app.model.UrgencyTier;
import mail.digest.app.service.summary.SummaryText;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rule-based urgency score. Signals add up and the total is clamped to [0, 1]:
 * <ul>
 *   <li>keyword in subject, body or summary: 0.7, plus 0.1 for each further keyword</li>
 *   <li>deadline within 72 hours: 0.5</li>
 *   <li>thread activity at or above the threshold: 0.3</li>
 * </ul>
 * A score of at least {@value #URGENT_THRESHOLD} is urgent. A flagged sender is always important.
 */
@Slf4j
public class UrgencyScorer {
    public static final double URGENT_THRESHOLD = 0.66;
    static final double KEYWORD_WEIGHT = 0.7;
    static final double EXTRA_KEYWORD_WEIGHT = 0.1;
    static final double DEADLINE_WEIGHT = 0.5;
    static final double THREAD_WEIGHT = 0.3;
    static final Duration DEADLINE_HORIZON = Duration.ofHours(72);

    public static final String REASON_IMPORTANT_SENDER = "important_sender";
    public static final String REASON_THREAD_ACTIVITY = "thread_activity";
    public static final String REASON_CLASSIFIER = "classifier";

    private final Map<String, Pattern> keywords;
    private final DeadlineDetector deadlineDetector;
    private final UrgencyClassifier classifier;
    private final int threadActivityThreshold;
    private final ZoneId zone;
    private final Clock clock;

    public UrgencyScorer(List<String> keywords, DeadlineDetector deadlineDetector, UrgencyClassifier classifier,
                         int threadActivityThreshold, ZoneId zone, Clock clock) {
        this.keywords = new LinkedHashMap<>();
        for (String keyword : keywords) {
            String k = keyword.trim().toLowerCase(Locale.ROOT);
            if (k.isEmpty()) {
                continue;
            }
            StringBuilder regex = new StringBuilder("\\b");
            String[] words = k.split("\\s+");
            for (int i = 0; i < words.length; i++) {
                regex.append(i > 0 ? "\\s+" : "").append(Pattern.quote(words[i]));
            }
            this.keywords.put(k, Pattern.compile(regex.append("\\b").toString(), Pattern.CASE_INSENSITIVE));
        }
        this.deadlineDetector = deadlineDetector;
        this.classifier = classifier;
        this.threadActivityThreshold = threadActivityThreshold;
        this.zone = zone;
        this.clock = clock;
    }

    public UrgencyResult score(MailMessage message, SummaryResult summary, UrgencyContext context) {
        Instant now = clock.instant();
        String text = message.subjectOrEmpty() + "\n" + SummaryText.clean(message.bestBody())
                + (summary != null ? "\n" + summary.getText() : "");
        List<String> reasons = new ArrayList<>();
        double score = 0.0;

        int matched = 0;
        for (Map.Entry<String, Pattern> keyword : keywords.entrySet()) {
            if (keyword.getValue().matcher(text).find()) {
                reasons.add("keyword:" + keyword.getKey());
                matched++;
            }
        }
        if (matched > 0) {
            score += KEYWORD_WEIGHT + EXTRA_KEYWORD_WEIGHT * (matched - 1);
        }

        ZonedDateTime reference = (message.getReceivedAt() != null ? message.getReceivedAt() : now).atZone(zone);
        Optional<Instant> deadline = deadlineDetector.closestDeadline(text, reference, now);
        if (deadline.isPresent() && !deadline.get().isAfter(now.plus(DEADLINE_HORIZON))) {
            score += DEADLINE_WEIGHT;
            reasons.add("deadline:" + deadline.get());
        }

        if (context.messagesInThread(message.getThreadId()) >= threadActivityThreshold) {
            score += THREAD_WEIGHT;
            reasons.add(REASON_THREAD_ACTIVITY);
        }

        if (classifier != null) {
            score = classify(message, summary, score, reasons);
        }

        double clamped = Math.min(1.0, score);
        UrgencyTier tier = clamped >= URGENT_THRESHOLD ? UrgencyTier.URGENT : UrgencyTier.NORMAL;
        if (context.isImportant(message.getSender().getAddress())) {
            tier = UrgencyTier.IMPORTANT;
            reasons.add(REASON_IMPORTANT_SENDER);
        }
        return new UrgencyResult(clamped, tier, reasons);
    }

    private double classify(MailMessage message, SummaryResult summary, double ruleScore, List<String> reasons) {
        try {
            if (!classifier.isTrained()) {
                return ruleScore;
            }
            double predicted = classifier.classify(message, summary);
            if (Double.isNaN(predicted)) {
                log.warn("Urgency classifier returned NaN for message {}, using rule score", message.getId());
                return ruleScore;
            }
            reasons.add(REASON_CLASSIFIER);
            return Math.max(0.0, predicted);
        } catch (RuntimeException e) {
            log.warn("Urgency classifier failed for message {}, using rule score: {}", message.getId(), e.getMessage());
            return ruleScore;
        }
    }
}
