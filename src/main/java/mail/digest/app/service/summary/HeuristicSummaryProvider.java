package mail.digest.app.service.summary;

import mail.digest.app.model.SummaryProvenance;

import java.util.List;

/**
 * Last tier: the first few sentences of the body, or the subject line when the body is empty.
 * Never fails.
 */
public class HeuristicSummaryProvider implements SummaryProvider {
    static final String NO_CONTENT = "(no content)";

    private final int sentenceCount;

    public HeuristicSummaryProvider(int sentenceCount) {
        this.sentenceCount = sentenceCount;
    }

    @Override
    public SummaryProvenance tier() {
        return SummaryProvenance.HEURISTIC;
    }

    @Override
    public String summarize(SummaryRequest request) {
        List<String> sentences = SummaryText.sentences(SummaryText.clean(request.getBody()));
        if (!sentences.isEmpty()) {
            return String.join(" ", sentences.subList(0, Math.min(sentenceCount, sentences.size())));
        }
        return fallbackText(request);
    }

    static String fallbackText(SummaryRequest request) {
        String subject = SummaryText.clean(request.getSubject());
        return subject.isEmpty() ? NO_CONTENT : subject;
    }
}
