package com.openclaw.wechat.channel.outbound;

import com.openclaw.wechat.channel.protocol.ProtocolBackend;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Direct sends outside a reply flow (agent actions, CLI-style sends).
 * <p>
 * Group targets ({@code @chatroom} ids or {@code @@} prefixed) are looked up
 * as rooms, everything else as contacts. Media goes first, then the text in
 * chunks.
 */
@Slf4j
public final class WeChatSend {

    private WeChatSend() {
    }

    public static SendResult send(ProtocolBackend backend, String target, String text, Path media) {
        if (backend == null) {
            return SendResult.error("No WeChat bot instance available");
        }
        String to = WeChatTargets.normalize(target);
        if (to.isEmpty()) {
            return SendResult.error("No recipient provided");
        }

        try {
            if (WeChatTargets.isGroupTarget(to)) {
                if (backend.lookupRoom(to).isEmpty()) {
                    return SendResult.error("Room not found: " + to);
                }
            } else if (backend.lookupPeer(to).isEmpty()) {
                return SendResult.error("Contact not found: " + to);
            }

            if (media != null) {
                backend.sendMedia(to, media);
            }
            if (text != null && !text.isBlank()) {
                for (String chunk : WeChatTextChunker.chunk(text, WeChatTextChunker.DEFAULT_LIMIT)) {
                    backend.sendText(to, chunk);
                }
            }
            return SendResult.ok(to);
        } catch (RuntimeException e) {
            String error = ErrorUtils.formatErrorMessage(e);
            log.warn("WeChat send to {} failed: {}", to, error);
            return SendResult.error(error);
        }
    }
}
