package mail.digest.app.service.summary;

import mail.digest.app.model.MailMessage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the single summarization request for a sender group: distinct subjects joined with "; "
 * and the members' bodies concatenated with near-identical sentences removed.
 */
public final class CombinedSummarySource {
    public static final int SUBJECT_CAP = 200;
    private static final double NEAR_DUPLICATE_SIMILARITY = 0.85;

    private CombinedSummarySource() {
    }

    public static SummaryRequest forGroup(List<MailMessage> members, int maxLength) {
        TreeSet<String> subjects = new TreeSet<>();
        for (MailMessage m : members) {
            String subject = m.subjectOrEmpty().trim();
            if (!subject.isEmpty()) {
                subjects.add(subject);
            }
        }
        return new SummaryRequest(capSubject(String.join("; ", subjects)), dedupedBody(members), maxLength);
    }

    public static String capSubject(String subject) {
        if (subject == null) {
            return "";
        }
        return subject.length() > SUBJECT_CAP ? subject.substring(0, SUBJECT_CAP - 3) + "..." : subject;
    }

    static String dedupedBody(List<MailMessage> members) {
        List<Set<String>> kept = new ArrayList<>();
        StringBuilder body = new StringBuilder();
        for (MailMessage m : members) {
            for (String sentence : SummaryText.sentences(SummaryText.clean(m.bestBody()))) {
                Set<String> tokens = tokens(sentence);
                if (tokens.isEmpty() || isNearDuplicate(tokens, kept)) {
                    continue;
                }
                kept.add(tokens);
                if (body.length() > 0) {
                    body.append(' ');
                }
                body.append(sentence);
            }
        }
        return body.toString();
    }

    private static boolean isNearDuplicate(Set<String> candidate, List<Set<String>> kept) {
        for (Set<String> existing : kept) {
            if (jaccard(candidate, existing) >= NEAR_DUPLICATE_SIMILARITY) {
                return true;
            }
        }
        return false;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return union.isEmpty() ? 0.0 : (double) intersection.size() / union.size();
    }

    private static Set<String> tokens(String sentence) {
        Set<String> tokens = new HashSet<>();
        for (String raw : sentence.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!raw.isEmpty()) {
                tokens.add(raw);
            }
        }
        return tokens;
    }
}
