package mail.digest.app.service.summary;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the providers and the chain's post-processing.
 */
public final class SummaryText {
    public static final String ELLIPSIS = "...";

    private static final Pattern STYLE_OR_SCRIPT = Pattern.compile("(?is)<(style|script|head)[^>]*>.*?</\\1>");
    private static final Pattern BLOCK_TAG = Pattern.compile("(?i)<\\s*(br|/p|/div|/li|/tr|/h\\d)\\s*/?>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*]\\([^)]*\\)");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)]\\((?:https?|mailto):[^)]*\\)");
    private static final Pattern BRACKET_REF = Pattern.compile("(?i)\\[(image|cid|file|attachment):[^\\]]*]");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)\\S+");
    private static final Pattern ANGLE_URL = Pattern.compile("<(?:https?|mailto):[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+(?=[\\p{Lu}\\d\"'(])");
    private static final int WORDS_PER_MINUTE = 225;

    private SummaryText() {
    }

    /**
     * Strip links, images and markup, decode common entities and collapse whitespace.
     */
    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String s = STYLE_OR_SCRIPT.matcher(text).replaceAll(" ");
        s = BLOCK_TAG.matcher(s).replaceAll("\n");
        s = ANGLE_URL.matcher(s).replaceAll(" ");
        s = TAG.matcher(s).replaceAll(" ");
        s = MARKDOWN_IMAGE.matcher(s).replaceAll(" ");
        s = MARKDOWN_LINK.matcher(s).replaceAll("$1");
        s = BRACKET_REF.matcher(s).replaceAll(" ");
        s = decodeEntities(s);
        s = URL.matcher(s).replaceAll(" ");
        s = s.replace("**", "").replace("__", "");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * Cut {@code text} to at most {@code maxLength} characters, ending in an ellipsis when cut.
     */
    public static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, Math.max(0, maxLength));
        }
        int limit = maxLength - ELLIPSIS.length();
        int cut = text.lastIndexOf(' ', limit);
        if (cut < limit / 2) {
            cut = limit;
        }
        return text.substring(0, cut).trim() + ELLIPSIS;
    }

    /**
     * Split whitespace-normalized text into sentences.
     */
    public static List<String> sentences(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        for (String paragraph : text.split("\\n\\s*\\n|\\r?\\n")) {
            String normalized = WHITESPACE.matcher(paragraph).replaceAll(" ").trim();
            if (normalized.isEmpty()) {
                continue;
            }
            for (String sentence : SENTENCE_END.split(normalized)) {
                String trimmed = sentence.trim();
                if (!trimmed.isEmpty()) {
                    result.add(trimmed);
                }
            }
        }
        return result;
    }

    /**
     * Estimated reading time at 225 words per minute, rounded to the nearest half minute.
     */
    public static double readingTimeMinutes(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        int words = text.trim().split("\\s+").length;
        double minutes = (double) words / WORDS_PER_MINUTE;
        return Math.round(minutes * 2) / 2.0;
    }

    private static String decodeEntities(String s) {
        return s.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
