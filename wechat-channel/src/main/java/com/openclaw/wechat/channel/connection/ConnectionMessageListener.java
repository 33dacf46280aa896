package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.protocol.RawMessage;

/**
 * Receives inbound messages fanned out by the {@link ConnectionManager}.
 * Called on the backend's event thread; implementations must hand heavy work off.
 */
@FunctionalInterface
public interface ConnectionMessageListener {

    void onMessage(WeChatConnection connection, RawMessage message);
}
