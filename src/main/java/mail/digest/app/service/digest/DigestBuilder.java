package mail.digest.app.service.digest;

import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.DigestItem;
import mail.digest.app.model.EventCandidate;
import mail.digest.app.model.ExistingEvent;
import mail.digest.app.model.MailMessage;
import mail.digest.app.model.SummaryResult;
import mail.digest.app.model.UrgencyResult;
import mail.digest.app.model.UrgencyTier;
import mail.digest.app.service.calendar.EventDetector;
import mail.digest.app.service.summary.CombinedSummarySource;
import mail.digest.app.service.summary.SummarizationChain;
import mail.digest.app.service.summary.SummaryRequest;
import mail.digest.app.service.urgency.ThreadActivity;
import mail.digest.app.service.urgency.UrgencyContext;
import mail.digest.app.service.urgency.UrgencyScorer;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns fetched messages into ordered digest items.
 * <p>
 * Each message is summarized, scored and checked for an event on the digest executor. Senders with
 * at least {@code groupingThreshold} messages are then merged into one item whose summary comes from
 * a fresh summarization of the deduplicated source text. If merging a group fails, its members are
 * kept as individual items.
 */
@Slf4j
public class DigestBuilder {
    static final Comparator<DigestItem> ORDER = Comparator
            .comparing((DigestItem item) -> item.getUrgency().getTier(), Comparator.reverseOrder())
            .thenComparing(DigestItem::getReceivedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(DigestItem::getMessageRef);

    private final SummarizationChain summarizationChain;
    private final UrgencyScorer urgencyScorer;
    private final EventDetector eventDetector;
    private final Executor executor;
    private final Clock clock;
    private final int itemCharCap;
    private final int combinedCharCap;
    private final int groupingThreshold;
    private final Duration orderingWindow;

    public DigestBuilder(SummarizationChain summarizationChain, UrgencyScorer urgencyScorer, EventDetector eventDetector,
                         Executor executor, Clock clock, int itemCharCap, int combinedCharCap, int groupingThreshold,
                         Duration orderingWindow) {
        this.summarizationChain = summarizationChain;
        this.urgencyScorer = urgencyScorer;
        this.eventDetector = eventDetector;
        this.executor = executor;
        this.clock = clock;
        this.itemCharCap = itemCharCap;
        this.combinedCharCap = combinedCharCap;
        this.groupingThreshold = groupingThreshold;
        this.orderingWindow = orderingWindow;
    }

    public List<DigestItem> build(List<MailMessage> messages, List<ExistingEvent> existingEvents,
                                  Set<String> importantSenders) {
        if (messages.isEmpty()) {
            return List.of();
        }
        UrgencyContext context = new UrgencyContext(importantSenders,
                ThreadActivity.count(messages, clock.instant(), orderingWindow));

        List<CompletableFuture<Analysis>> futures = new ArrayList<>();
        for (MailMessage message : messages) {
            CompletableFuture<Analysis> future;
            try {
                future = CompletableFuture.supplyAsync(() -> analyzeSafely(message, existingEvents, context), executor);
            } catch (RejectedExecutionException e) {
                log.warn("Digest executor rejected message {}, analyzing on the calling thread", message.getId());
                future = CompletableFuture.completedFuture(analyzeSafely(message, existingEvents, context));
            }
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<String, List<Analysis>> bySender = new LinkedHashMap<>();
        for (CompletableFuture<Analysis> future : futures) {
            Analysis analysis = future.join();
            bySender.computeIfAbsent(analysis.message.getSender().getAddress(), k -> new ArrayList<>()).add(analysis);
        }

        List<DigestItem> items = new ArrayList<>();
        for (Map.Entry<String, List<Analysis>> group : bySender.entrySet()) {
            List<Analysis> members = group.getValue();
            if (members.size() >= groupingThreshold) {
                try {
                    items.add(combine(members));
                    continue;
                } catch (RuntimeException e) {
                    log.error("Could not combine {} messages from {}, keeping them separate: {}",
                            members.size(), group.getKey(), e.getMessage(), e);
                }
            }
            for (Analysis member : members) {
                items.add(single(member));
            }
        }
        items.sort(ORDER);
        log.info("Built {} digest items from {} messages", items.size(), messages.size());
        return items;
    }

    /**
     * Never throws: a message whose analysis fails is kept with a heuristic summary at normal urgency.
     */
    private Analysis analyzeSafely(MailMessage message, List<ExistingEvent> existingEvents, UrgencyContext context) {
        try {
            return analyze(message, existingEvents, context);
        } catch (RuntimeException e) {
            log.error("Analysis of message {} failed, keeping it with a heuristic summary: {}",
                    message.getId(), e.getMessage(), e);
            SummaryResult summary = summarizationChain.heuristic(
                    new SummaryRequest(message.subjectOrEmpty(), message.bestBody(), itemCharCap));
            return new Analysis(message, summary, UrgencyResult.normal(), null);
        }
    }

    private Analysis analyze(MailMessage message, List<ExistingEvent> existingEvents, UrgencyContext context) {
        SummaryResult summary = summarizationChain.summarize(message, itemCharCap);
        UrgencyResult urgency = urgencyScorer.score(message, summary, context);
        EventCandidate event = eventDetector.detect(message, summary, existingEvents).orElse(null);
        return new Analysis(message, summary, urgency, event);
    }

    private DigestItem single(Analysis analysis) {
        MailMessage message = analysis.message;
        return DigestItem.builder()
                .messageId(message.getId())
                .sender(message.getSender())
                .subject(CombinedSummarySource.capSubject(message.subjectOrEmpty()))
                .summary(analysis.summary)
                .urgency(analysis.urgency)
                .eventCandidate(analysis.event)
                .receivedAt(message.getReceivedAt())
                .combined(false)
                .build();
    }

    private DigestItem combine(List<Analysis> members) {
        List<MailMessage> messages = new ArrayList<>();
        for (Analysis member : members) {
            messages.add(member.message);
        }
        messages.sort(Comparator.comparing(MailMessage::getReceivedAt, Comparator.nullsLast(Comparator.naturalOrder())));

        SummaryRequest request = CombinedSummarySource.forGroup(messages, combinedCharCap);
        SummaryResult summary = summarizationChain.summarize(request);

        DigestItem.DigestItemBuilder item = DigestItem.builder()
                .sender(messages.get(0).getSender())
                .subject(request.getSubject())
                .summary(summary)
                .urgency(highestUrgency(members))
                .eventCandidate(bestEvent(members))
                .receivedAt(messages.get(0).getReceivedAt())
                .combined(true);
        for (MailMessage message : messages) {
            item.messageId(message.getId());
        }
        return item.build();
    }

    static UrgencyResult highestUrgency(List<Analysis> members) {
        UrgencyTier tier = UrgencyTier.NORMAL;
        double score = 0.0;
        Set<String> reasons = new LinkedHashSet<>();
        for (Analysis member : members) {
            tier = UrgencyTier.max(tier, member.urgency.getTier());
            score = Math.max(score, member.urgency.getScore());
            reasons.addAll(member.urgency.getReasons());
        }
        return new UrgencyResult(score, tier, new ArrayList<>(reasons));
    }

    private static EventCandidate bestEvent(List<Analysis> members) {
        EventCandidate best = null;
        for (Analysis member : members) {
            EventCandidate candidate = member.event;
            if (candidate == null) {
                continue;
            }
            if (best == null || candidate.getConfidence() > best.getConfidence()
                    || (candidate.getConfidence() == best.getConfidence() && candidate.getStart().isBefore(best.getStart()))) {
                best = candidate;
            }
        }
        return best;
    }

    static final class Analysis {
        final MailMessage message;
        final SummaryResult summary;
        final UrgencyResult urgency;
        final EventCandidate event;

        Analysis(MailMessage message, SummaryResult summary, UrgencyResult urgency, EventCandidate event) {
            this.message = message;
            this.summary = summary;
            this.urgency = urgency;
            this.event = event;
        }
    }
}
