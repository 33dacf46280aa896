package com.openclaw.wechat.channel.policy;

import java.util.Map;

/**
 * A pending pairing request. {@code senderId} is stored normalized.
 */
public record PairingRequest(
        String channel,
        String senderId,
        String code,
        long createdAt,
        Map<String, String> meta) {

    public PairingRequest {
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }
}
