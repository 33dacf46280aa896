package com.openclaw.wechat.channel.connection;

import java.util.Optional;

/**
 * Background service started when an account logs in (contact indexing,
 * moments polling). The returned handle is closed on logout or stop.
 */
public interface SessionService {

    String name();

    Optional<AutoCloseable> onLogin(WeChatConnection connection);
}
