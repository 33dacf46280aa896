package com.openclaw.wechat.channel.inbound;

/**
 * Message content after type dispatch: display text plus optional saved media.
 */
public record NormalizedInbound(String text, SavedMedia media) {

    public static NormalizedInbound text(String text) {
        return new NormalizedInbound(text, null);
    }

    public boolean hasMedia() {
        return media != null;
    }
}
