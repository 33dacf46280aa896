package com.openclaw.wechat.channel.moments;

import com.openclaw.wechat.channel.protocol.MomentEntry;
import com.openclaw.wechat.common.infra.FormatAge;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders a moments post as a context block:
 * <pre>
 * [WeChat Moment — Alice, 5m ago]
 * body
 * [3 images] [12 likes]
 * [Comments: Bob: nice, Carol: wow]
 * </pre>
 */
public final class MomentFormatter {

    private MomentFormatter() {
    }

    static final int MAX_COMMENTS = 2;

    /**
     * @return the block, empty when the post has no text
     */
    public static Optional<String> format(MomentEntry entry, long nowMs) {
        String body = entry.body() != null ? entry.body().trim() : "";
        if (body.isEmpty()) {
            return Optional.empty();
        }
        String name = entry.authorName() != null && !entry.authorName().isBlank() ? entry.authorName() : "Unknown";
        String timeAgo = entry.createdAtEpoch() > 0
                ? FormatAge.formatAge(nowMs - entry.createdAtEpoch() * 1000)
                : "unknown time";

        List<String> lines = new ArrayList<>();
        lines.add("[WeChat Moment — " + name + ", " + timeAgo + "]");
        lines.add(body);

        List<String> extras = new ArrayList<>();
        if (entry.imageCount() > 0)
            extras.add(entry.imageCount() + " images");
        if (entry.likeCount() > 0)
            extras.add(entry.likeCount() + " likes");
        if (!extras.isEmpty()) {
            lines.add("[" + String.join("] [", extras) + "]");
        }

        if (!entry.comments().isEmpty()) {
            List<String> comments = new ArrayList<>();
            for (MomentEntry.Comment comment : entry.comments().subList(0, Math.min(MAX_COMMENTS, entry.comments().size()))) {
                String author = comment.author() != null ? comment.author() : "?";
                String content = comment.content() != null ? comment.content() : "";
                comments.add(author + ": " + content);
            }
            lines.add("[Comments: " + String.join(", ", comments) + "]");
        }
        return Optional.of(String.join("\n", lines));
    }
}
