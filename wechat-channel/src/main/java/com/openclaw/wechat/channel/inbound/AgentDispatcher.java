package com.openclaw.wechat.channel.inbound;

import java.util.concurrent.CompletableFuture;

/**
 * Hands an inbound message to the agent. The returned future completes when
 * the agent has finished replying; the chat stays busy until then.
 */
@FunctionalInterface
public interface AgentDispatcher {

    CompletableFuture<Void> dispatch(InboundEnvelope envelope, ReplyDeliverer deliverer);
}
