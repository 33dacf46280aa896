package com.openclaw.wechat.channel.policy;

/**
 * Admission outcome for one inbound message.
 */
public enum AccessDecision {
    ALLOWED,
    BLOCKED,
    /** Sender is waiting for pairing approval; the message is not forwarded. */
    PAIRING_PENDING;

    public boolean admitted() {
        return this == ALLOWED;
    }
}
