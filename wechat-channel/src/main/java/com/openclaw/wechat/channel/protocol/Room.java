package com.openclaw.wechat.channel.protocol;

/**
 * A group chat. {@code topic} may be null or blank when the client has not
 * synced it.
 */
public record Room(String id, String topic) {

    public String topicOrId() {
        return topic != null && !topic.isBlank() ? topic : id;
    }
}
