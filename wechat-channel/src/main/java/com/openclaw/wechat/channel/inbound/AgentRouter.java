package com.openclaw.wechat.channel.inbound;

/**
 * Maps a conversation to the agent and session that handle it.
 */
@FunctionalInterface
public interface AgentRouter {

    AgentRoute resolveRoute(String channel, String accountId, RoutePeer peer);

    /**
     * Route used when no router is configured or routing fails.
     */
    static AgentRoute fallbackRoute(String channel, String accountId, RoutePeer peer) {
        return new AgentRoute("main", accountId,
                "agent:main:" + channel + ":" + peer.kind() + ":" + peer.id());
    }
}
