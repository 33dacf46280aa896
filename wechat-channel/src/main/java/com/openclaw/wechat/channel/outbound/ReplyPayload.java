package com.openclaw.wechat.channel.outbound;

import java.util.ArrayList;
import java.util.List;

/**
 * One reply from the agent: optional text plus optional media references
 * (local paths, {@code file:} URIs or http(s) URLs).
 */
public record ReplyPayload(String text, String mediaUrl, List<String> mediaUrls) {

    public ReplyPayload {
        mediaUrls = mediaUrls == null ? List.of() : List.copyOf(mediaUrls);
    }

    public static ReplyPayload text(String text) {
        return new ReplyPayload(text, null, List.of());
    }

    /**
     * Media to send, in order: {@code mediaUrls} when non-empty, else the
     * single {@code mediaUrl}.
     */
    public List<String> mediaList() {
        if (!mediaUrls.isEmpty()) {
            return mediaUrls;
        }
        List<String> single = new ArrayList<>();
        if (mediaUrl != null && !mediaUrl.isBlank()) {
            single.add(mediaUrl);
        }
        return single;
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
