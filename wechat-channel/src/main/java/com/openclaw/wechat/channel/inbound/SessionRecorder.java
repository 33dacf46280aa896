package com.openclaw.wechat.channel.inbound;

import java.util.Optional;

/**
 * Session store seen from the channel: last activity time and inbound recording.
 */
public interface SessionRecorder {

    /** Epoch millis of the session's last update, if the session exists. */
    Optional<Long> readUpdatedAt(String sessionKey);

    void recordInbound(InboundEnvelope envelope);
}
