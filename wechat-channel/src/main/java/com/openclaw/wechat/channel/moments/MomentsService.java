package com.openclaw.wechat.channel.moments;

import com.openclaw.wechat.channel.WeChatStatePaths;
import com.openclaw.wechat.channel.connection.SessionService;
import com.openclaw.wechat.channel.connection.WeChatConnection;

import java.util.Optional;

/**
 * Starts a {@link MomentsPoller} on login for accounts with moments enabled.
 */
public class MomentsService implements SessionService {

    private final WeChatStatePaths paths;
    private final ContextSink sink;

    public MomentsService(WeChatStatePaths paths, ContextSink sink) {
        this.paths = paths;
        this.sink = sink;
    }

    @Override
    public String name() {
        return "moments-poller";
    }

    @Override
    public Optional<AutoCloseable> onLogin(WeChatConnection connection) {
        if (!connection.account().moments().enabled()) {
            return Optional.empty();
        }
        MomentsPoller poller = new MomentsPoller(connection, sink, paths.momentsStateFile(connection.accountId()));
        if (!poller.start()) {
            return Optional.empty();
        }
        return Optional.of(poller);
    }
}
