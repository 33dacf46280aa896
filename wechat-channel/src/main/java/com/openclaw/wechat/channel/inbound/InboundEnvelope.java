package com.openclaw.wechat.channel.inbound;

import java.nio.file.Path;

/**
 * Normalized inbound message handed to session recording and the agent.
 *
 * @param body    the formatted envelope line shown to the agent
 * @param rawBody the message text without envelope
 * @param from    {@code wechat:group:<chatId>} or {@code wechat:<senderId>}
 * @param to      {@code wechat:<chatId>}
 * @param chatType {@code group} or {@code direct}
 */
public record InboundEnvelope(
        String channel,
        String accountId,
        String agentId,
        String sessionKey,
        String body,
        String rawBody,
        String from,
        String to,
        String chatId,
        String chatType,
        String senderId,
        String senderName,
        String groupSubject,
        String messageSid,
        long timestamp,
        boolean wasMentioned,
        Path mediaPath,
        String mediaType) {

    public boolean isGroup() {
        return "group".equals(chatType);
    }
}
