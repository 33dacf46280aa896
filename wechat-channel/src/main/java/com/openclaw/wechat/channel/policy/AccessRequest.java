package com.openclaw.wechat.channel.policy;

import java.util.function.BooleanSupplier;

/**
 * What the policy engine needs to know about one inbound message.
 *
 * @param mentionCheck evaluated lazily, only for group messages under the
 *                     mention gate; may throw
 * @param replySender  sends the pairing reply to the sender; may throw
 */
public record AccessRequest(
        boolean group,
        String senderId,
        String senderName,
        BooleanSupplier mentionCheck,
        PairingReplySender replySender) {

    @FunctionalInterface
    public interface PairingReplySender {
        void send(String senderId, String text);
    }

    public static AccessRequest direct(String senderId, String senderName, PairingReplySender replySender) {
        return new AccessRequest(false, senderId, senderName, () -> false, replySender);
    }

    public static AccessRequest group(String senderId, String senderName, BooleanSupplier mentionCheck) {
        return new AccessRequest(true, senderId, senderName, mentionCheck, (id, text) -> {
        });
    }
}
