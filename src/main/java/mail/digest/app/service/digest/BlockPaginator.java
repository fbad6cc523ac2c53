package mail.digest.app.service.digest;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import mail.digest.app.model.ActionControl;
import mail.digest.app.model.RenderedBlock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Packs rendered items into transport blocks of at most {@code maxChars} characters.
 * Blocks only split between items, so each block carries the controls of exactly the items it shows.
 */
@Slf4j
public class BlockPaginator {
    static final String SEPARATOR = "\n\n━━━━━━━━━━\n\n";
    private static final String ELLIPSIS = "...";
    private static final Pattern TAG = Pattern.compile("<(/?)([a-zA-Z]+)[^>]*>");

    private final int maxChars;

    public BlockPaginator(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive");
        }
        this.maxChars = maxChars;
    }

    public int getMaxChars() {
        return maxChars;
    }

    public List<RenderedBlock> paginate(List<Segment> segments) {
        List<RenderedBlock> blocks = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        List<Integer> indexes = new ArrayList<>();
        List<ActionControl> controls = new ArrayList<>();

        for (Segment segment : segments) {
            String body = fit(segment);
            int needed = text.length() == 0 ? body.length() : text.length() + SEPARATOR.length() + body.length();
            if (text.length() > 0 && needed > maxChars) {
                blocks.add(new RenderedBlock(text.toString(), List.copyOf(indexes), List.copyOf(controls)));
                text.setLength(0);
                indexes.clear();
                controls.clear();
            }
            if (text.length() > 0) {
                text.append(SEPARATOR);
            }
            text.append(body);
            indexes.add(segment.getIndex());
            controls.addAll(segment.getControls());
        }
        if (text.length() > 0) {
            blocks.add(new RenderedBlock(text.toString(), List.copyOf(indexes), List.copyOf(controls)));
        }
        return blocks;
    }

    public RenderedBlock single(Segment segment) {
        return new RenderedBlock(fit(segment), List.of(segment.getIndex()), List.copyOf(segment.getControls()));
    }

    private String fit(Segment segment) {
        String text = segment.getText();
        if (text.length() <= maxChars) {
            return text;
        }
        // the renderer already shortened the summary, so only the header can still be too long
        log.warn("Item {} renders to {} chars, cutting to {}", segment.getIndex(), text.length(), maxChars);
        return cut(text, maxChars);
    }

    /**
     * Shortens markup to at most {@code limit} chars. The cut never lands inside a tag, an entity or a
     * surrogate pair, and tags still open at the cut are closed after the ellipsis.
     */
    static String cut(String text, int limit) {
        if (limit <= ELLIPSIS.length()) {
            return text.substring(0, safeCut(text, limit));
        }
        int room = limit - ELLIPSIS.length();
        while (room > 0) {
            int end = safeCut(text, room);
            String head = text.substring(0, end);
            String closers = closingTags(head);
            int length = head.length() + ELLIPSIS.length() + closers.length();
            if (length <= limit) {
                return head + ELLIPSIS + closers;
            }
            room = end - (length - limit);
        }
        return ELLIPSIS;
    }

    private static int safeCut(String text, int limit) {
        int end = limit;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        int tagStart = text.lastIndexOf('<', end - 1);
        if (tagStart > text.lastIndexOf('>', end - 1)) {
            end = tagStart;
        }
        int entityStart = text.lastIndexOf('&', end - 1);
        if (entityStart >= 0) {
            int entityEnd = text.indexOf(';', entityStart);
            if (entityEnd < 0 || entityEnd >= end) {
                end = entityStart;
            }
        }
        return end;
    }

    private static String closingTags(String head) {
        Deque<String> open = new ArrayDeque<>();
        Matcher matcher = TAG.matcher(head);
        while (matcher.find()) {
            String name = matcher.group(2).toLowerCase();
            if (matcher.group(1).isEmpty()) {
                open.push(name);
            } else {
                open.remove(name);
            }
        }
        StringBuilder closers = new StringBuilder();
        for (String name : open) {
            closers.append("</").append(name).append('>');
        }
        return closers.toString();
    }

    /**
     * One rendered item waiting to be placed in a block.
     */
    @Value
    public static class Segment {
        int index;
        String text;
        List<ActionControl> controls;
    }
}
