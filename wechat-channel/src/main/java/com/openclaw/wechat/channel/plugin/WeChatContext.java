package com.openclaw.wechat.channel.plugin;

import com.openclaw.wechat.channel.account.AccountRegistry;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.connection.ConnectionManager;
import com.openclaw.wechat.channel.connection.StartResult;
import com.openclaw.wechat.channel.contacts.ContactGraphIndex;
import com.openclaw.wechat.channel.contacts.WeChatDirectory;
import com.openclaw.wechat.channel.inbound.WeChatMessageDispatcher;
import com.openclaw.wechat.channel.outbound.ReplyDelivery;
import com.openclaw.wechat.channel.outbound.WeChatMessageActions;
import com.openclaw.wechat.channel.policy.PairingStore;
import com.openclaw.wechat.common.infra.KeyedSerialExecutor;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime components of the WeChat channel.
 */
@Slf4j
@Getter
public class WeChatContext implements AutoCloseable {

    private final AccountRegistry registry;
    private final ConnectionManager connectionManager;
    private final WeChatMessageDispatcher dispatcher;
    private final ReplyDelivery delivery;
    private final ContactGraphIndex contactIndex;
    private final WeChatDirectory directory;
    private final WeChatMessageActions actions;
    private final PairingStore pairingStore;
    private final KeyedSerialExecutor executor;
    @Getter(AccessLevel.NONE)
    private final AtomicBoolean closed = new AtomicBoolean(false);

    WeChatContext(AccountRegistry registry,
            ConnectionManager connectionManager,
            WeChatMessageDispatcher dispatcher,
            ReplyDelivery delivery,
            ContactGraphIndex contactIndex,
            WeChatDirectory directory,
            WeChatMessageActions actions,
            PairingStore pairingStore,
            KeyedSerialExecutor executor) {
        this.registry = registry;
        this.connectionManager = connectionManager;
        this.dispatcher = dispatcher;
        this.delivery = delivery;
        this.contactIndex = contactIndex;
        this.directory = directory;
        this.actions = actions;
        this.pairingStore = pairingStore;
        this.executor = executor;
    }

    /**
     * Start every enabled and configured account.
     */
    public List<StartResult> startAll() {
        List<StartResult> results = new ArrayList<>();
        for (ResolvedAccount account : registry.listEnabled()) {
            results.add(connectionManager.start(account.accountId()));
        }
        return results;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down WeChat channel");
        connectionManager.stopAll();
        executor.close();
    }
}
