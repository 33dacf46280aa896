package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.protocol.Identity;
import com.openclaw.wechat.channel.protocol.ProtocolBackend;

/**
 * Connections in a given lifecycle state, for tests outside this package.
 */
public final class TestConnections {

    private TestConnections() {
    }

    /** A connection that went through connect, login and into RUNNING. */
    public static WeChatConnection running(ResolvedAccount account, ProtocolBackend backend, Identity self) {
        WeChatConnection connection = new WeChatConnection(account, backend);
        connection.markConnecting();
        connection.markAuthenticated(self);
        connection.markRunning();
        return connection;
    }

    public static void stop(WeChatConnection connection) {
        connection.markStopped();
    }
}
