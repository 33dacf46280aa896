package com.openclaw.wechat.channel.inbound;

public record AgentRoute(String agentId, String accountId, String sessionKey) {
}
