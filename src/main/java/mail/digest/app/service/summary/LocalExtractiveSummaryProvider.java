package mail.digest.app.service.summary;

import mail.digest.app.model.SummaryProvenance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Local tier: offline extractive summary. Sentences are scored by the average document frequency
 * of their content words and the best ones are kept in source order.
 */
public class LocalExtractiveSummaryProvider implements SummaryProvider {
    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "but", "if", "of", "to", "in", "on", "at", "for", "with", "by",
            "from", "is", "are", "was", "were", "be", "been", "it", "this", "that", "these", "those", "i",
            "you", "we", "they", "he", "she", "me", "my", "your", "our", "as", "so", "not", "no", "do",
            "does", "did", "have", "has", "had", "will", "would", "can", "could", "should", "please",
            "thanks", "thank", "hi", "hello", "dear", "regards", "best");

    private final int sentenceCount;

    public LocalExtractiveSummaryProvider(int sentenceCount) {
        this.sentenceCount = sentenceCount;
    }

    @Override
    public SummaryProvenance tier() {
        return SummaryProvenance.LOCAL;
    }

    @Override
    public String summarize(SummaryRequest request) {
        List<String> sentences = SummaryText.sentences(SummaryText.clean(request.getBody()));
        if (sentences.isEmpty()) {
            throw new UnusableException("Nothing to summarize locally", null);
        }
        if (sentences.size() <= sentenceCount) {
            return String.join(" ", sentences);
        }

        Map<String, Integer> frequencies = new HashMap<>();
        List<List<String>> tokenized = new ArrayList<>();
        for (String sentence : sentences) {
            List<String> words = contentWords(sentence);
            tokenized.add(words);
            for (String word : words) {
                frequencies.merge(word, 1, Integer::sum);
            }
        }

        List<Integer> indexes = new ArrayList<>();
        double[] scores = new double[sentences.size()];
        for (int i = 0; i < sentences.size(); i++) {
            List<String> words = tokenized.get(i);
            double total = 0;
            for (String word : words) {
                total += frequencies.get(word);
            }
            scores[i] = words.isEmpty() ? 0 : total / words.size();
            indexes.add(i);
        }
        indexes.sort(Comparator.comparingDouble((Integer i) -> -scores[i]).thenComparingInt(i -> i));

        List<Integer> chosen = new ArrayList<>(indexes.subList(0, sentenceCount));
        chosen.sort(Comparator.naturalOrder());
        StringBuilder sb = new StringBuilder();
        for (int i : chosen) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(sentences.get(i));
        }
        return sb.toString();
    }

    private static List<String> contentWords(String sentence) {
        List<String> words = new ArrayList<>();
        for (String raw : sentence.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (raw.length() > 2 && !STOP_WORDS.contains(raw)) {
                words.add(raw);
            }
        }
        return words;
    }
}
