package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.protocol.Identity;

import java.time.Instant;

/**
 * Point-in-time status of one account, for status listings and issue checks.
 */
public record AccountSnapshot(
        String accountId,
        String name,
        boolean enabled,
        boolean configured,
        String puppet,
        String dmPolicy,
        boolean momentsEnabled,
        ConnectionState state,
        boolean loggedIn,
        Identity user,
        Instant lastStartAt,
        Instant lastStopAt,
        Instant lastInboundAt,
        Instant lastOutboundAt,
        String lastError) {

    public boolean running() {
        return state == ConnectionState.RUNNING;
    }
}
