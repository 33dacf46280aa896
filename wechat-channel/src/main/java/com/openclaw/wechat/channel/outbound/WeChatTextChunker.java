package com.openclaw.wechat.channel.outbound;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits outbound text into messages no longer than a limit, preferring
 * newline and then space boundaries.
 */
public final class WeChatTextChunker {

    private WeChatTextChunker() {
    }

    public static final int DEFAULT_LIMIT = 2000;

    /**
     * Chunk {@code text}. Each break prefers the last newline inside the
     * window, then the last space, then a hard cut at {@code limit}. Emitted
     * chunks lose trailing whitespace; one whitespace separator after a break
     * is consumed. A non-positive limit means no limit.
     *
     * @return the chunks, empty for empty input
     */
    public static List<String> chunk(String text, int limit) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        if (limit <= 0 || text.length() <= limit) {
            chunks.add(text);
            return chunks;
        }

        String remaining = text;
        while (remaining.length() > limit) {
            String window = remaining.substring(0, limit);
            int lastNewline = window.lastIndexOf('\n');
            int lastSpace = window.lastIndexOf(' ');
            int breakIdx = lastNewline > 0 ? lastNewline : lastSpace;
            if (breakIdx <= 0) {
                breakIdx = limit;
            }

            String chunk = stripTrailing(remaining.substring(0, breakIdx));
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }

            boolean brokeOnSeparator = breakIdx < remaining.length()
                    && Character.isWhitespace(remaining.charAt(breakIdx));
            int next = Math.min(remaining.length(), brokeOnSeparator ? breakIdx + 1 : breakIdx);
            remaining = remaining.substring(next);
        }
        if (!remaining.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }

    private static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0 && Character.isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
