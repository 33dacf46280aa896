package com.openclaw.wechat.channel.protocol;

import java.util.List;

/**
 * One post from the moments feed.
 *
 * @param createdAtEpoch creation time in epoch seconds, 0 when unknown
 */
public record MomentEntry(
        String authorId,
        String authorName,
        long createdAtEpoch,
        String body,
        int imageCount,
        int likeCount,
        List<Comment> comments) {

    public MomentEntry {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }

    public record Comment(String author, String content) {
    }
}
