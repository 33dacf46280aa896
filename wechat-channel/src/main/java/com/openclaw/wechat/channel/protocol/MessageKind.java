package com.openclaw.wechat.channel.protocol;

/**
 * Payload type of an inbound message.
 */
public enum MessageKind {
    TEXT,
    AUDIO,
    IMAGE,
    VIDEO,
    CONTACT_CARD,
    URL,
    STICKER,
    RECALLED,
    UNKNOWN
}
