package com.openclaw.wechat.channel.inbound;

import com.openclaw.wechat.common.infra.FormatAge;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Envelope header for inbound messages:
 * {@code [Channel from +elapsed yyyy-MM-dd HH:mm zone] body}.
 * The elapsed part appears only when a previous timestamp for the session is known.
 */
public class EnvelopeFormatter {

    private final DateTimeFormatter timestampFormat;

    public EnvelopeFormatter() {
        this(ZoneId.systemDefault());
    }

    public EnvelopeFormatter(ZoneId zone) {
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z").withZone(zone);
    }

    public String format(String channel, String from, Long timestamp, Long previousTimestamp, String body) {
        List<String> parts = new ArrayList<>();
        parts.add(channel != null && !channel.isBlank() ? channel.trim() : "Channel");

        String elapsed = null;
        if (timestamp != null && previousTimestamp != null) {
            elapsed = FormatAge.formatElapsed(timestamp, previousTimestamp);
        }
        String sender = from != null ? from.trim() : "";
        if (!sender.isEmpty()) {
            parts.add(elapsed != null ? sender + " +" + elapsed : sender);
        } else if (elapsed != null) {
            parts.add("+" + elapsed);
        }
        if (timestamp != null) {
            parts.add(timestampFormat.format(Instant.ofEpochMilli(timestamp)));
        }
        return "[" + String.join(" ", parts) + "] " + body;
    }

    /**
     * Label of the conversation: {@code group:<topic>} (falling back to the
     * chat id) for groups, the sender name or {@code user:<id>} for direct chats.
     */
    public static String fromLabel(boolean group, String topic, String chatId, String senderName, String senderId) {
        if (group) {
            return "group:" + (topic != null && !topic.isBlank() ? topic : chatId);
        }
        return senderName != null && !senderName.isBlank() ? senderName : "user:" + senderId;
    }
}
