package com.openclaw.wechat.channel.policy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pairing state: pending requests and the ids approved through pairing.
 */
public interface PairingStore {

    record UpsertResult(String code, boolean created) {
    }

    /**
     * Sender ids approved through pairing for a channel.
     */
    List<String> readAllowFrom(String channel);

    /**
     * Return the open request for the sender, creating one when none exists.
     * {@code created} is true only for the call that created it.
     */
    UpsertResult upsertRequest(String channel, String senderId, Map<String, String> meta);

    /**
     * Approve a pending request by its code and add the sender to the allow list.
     */
    Optional<PairingRequest> approve(String channel, String code);

    List<PairingRequest> listPending(String channel);
}
