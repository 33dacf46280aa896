package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.protocol.Identity;

/**
 * Health probe of one account's session.
 */
public record ProbeResult(boolean ok, Identity user, String puppet, String error, long elapsedMs) {

    public static ProbeResult success(Identity user, String puppet, long elapsedMs) {
        return new ProbeResult(true, user, puppet, null, elapsedMs);
    }

    public static ProbeResult failure(String error, long elapsedMs) {
        return new ProbeResult(false, null, null, error, elapsedMs);
    }
}
