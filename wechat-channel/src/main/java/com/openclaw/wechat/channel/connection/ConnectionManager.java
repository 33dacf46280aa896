package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.WeChatConfigException;
import com.openclaw.wechat.channel.account.AccountRegistry;
import com.openclaw.wechat.channel.account.AccountResolution;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.protocol.Identity;
import com.openclaw.wechat.channel.protocol.ProtocolBackend;
import com.openclaw.wechat.channel.protocol.ProtocolBackendFactory;
import com.openclaw.wechat.channel.protocol.ProtocolEvent;
import com.openclaw.wechat.channel.protocol.SessionCredentials;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts and stops one protocol session per account and fans backend events
 * out to the message listener and the login-time services.
 */
@Slf4j
public class ConnectionManager {

    private final AccountRegistry registry;
    private final ProtocolBackendFactory backendFactory;
    private final SessionCredentialStore credentialStore;
    private final ScanPresenter scanPresenter;
    private final ConnectionMessageListener messageListener;
    private final List<SessionService> sessionServices;

    public ConnectionManager(AccountRegistry registry,
            ProtocolBackendFactory backendFactory,
            SessionCredentialStore credentialStore,
            ScanPresenter scanPresenter,
            ConnectionMessageListener messageListener,
            List<SessionService> sessionServices) {
        this.registry = registry;
        this.backendFactory = backendFactory;
        this.credentialStore = credentialStore;
        this.scanPresenter = scanPresenter;
        this.messageListener = messageListener;
        this.sessionServices = List.copyOf(sessionServices);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Start the account's session. Idempotent: when a live connection exists it
     * is returned unchanged.
     */
    public StartResult start(String accountId) {
        AccountResolution resolution = registry.resolve(accountId);
        if (resolution instanceof AccountResolution.NotConfigured notConfigured) {
            log.warn("[{}] Not starting WeChat: {}", notConfigured.accountId(), notConfigured.reason());
            return StartResult.failed(notConfigured.accountId(), notConfigured.reason());
        }
        ResolvedAccount account = ((AccountResolution.Resolved) resolution).account();
        String id = account.accountId();

        Optional<WeChatConnection> existing = registry.connectionFor(id);
        if (existing.isPresent() && !existing.get().isStopped()) {
            return StartResult.started(existing.get(), true);
        }
        existing.ifPresent(stale -> registry.release(id, stale));

        AtomicBoolean created = new AtomicBoolean(false);
        WeChatConnection connection;
        try {
            connection = registry.claim(id, key -> {
                created.set(true);
                return new WeChatConnection(account, backendFactory.create(account));
            });
        } catch (WeChatConfigException e) {
            log.error("[{}] Cannot start WeChat: {}", id, e.getMessage());
            return StartResult.failed(id, e.getMessage());
        } catch (RuntimeException e) {
            String error = ErrorUtils.formatErrorMessage(e);
            log.error("[{}] Failed to create WeChat backend: {}", id, error, e);
            return StartResult.failed(id, error);
        }
        if (!created.get()) {
            return StartResult.started(connection, true);
        }

        connection.markConnecting();
        ProtocolBackend backend = connection.backend();
        backend.subscribe(event -> handleEvent(connection, event));

        Optional<SessionCredentials> credentials = credentialStore.load(id);
        log.info("[{}] Starting WeChat ({} puppet{})", account.displayLabel(), account.puppet().value(),
                credentials.isPresent() ? ", resuming stored session" : "");
        try {
            backend.connect(credentials);
        } catch (RuntimeException e) {
            String error = ErrorUtils.formatErrorMessage(e);
            log.error("[{}] WeChat connect failed: {}", id, error, e);
            connection.recordError(error);
            shutdown(connection);
            return StartResult.failed(id, error);
        }
        return StartResult.started(connection, false);
    }

    /**
     * Stop the account's session. Safe to call repeatedly and on sessions that
     * never authenticated.
     *
     * @return true when a live connection was stopped by this call
     */
    public boolean stop(String accountId) {
        Optional<WeChatConnection> connection = registry.connectionFor(accountId);
        if (connection.isEmpty()) {
            return false;
        }
        boolean stopped = shutdown(connection.get());
        if (stopped) {
            log.info("[{}] WeChat stopped", connection.get().accountId());
        }
        return stopped;
    }

    public void stopAll() {
        for (WeChatConnection connection : registry.connections()) {
            stop(connection.accountId());
        }
    }

    private boolean shutdown(WeChatConnection connection) {
        boolean transitioned = connection.markStopped();
        connection.cancelBackgroundServices();
        registry.release(connection.accountId(), connection);
        if (!transitioned) {
            return false;
        }
        try {
            connection.backend().disconnect();
        } catch (RuntimeException e) {
            log.warn("[{}] Error while disconnecting WeChat: {}", connection.accountId(),
                    ErrorUtils.formatErrorMessage(e));
        }
        return true;
    }

    // =========================================================================
    // Events
    // =========================================================================

    void handleEvent(WeChatConnection connection, ProtocolEvent event) {
        if (connection.isStopped()) {
            log.debug("[{}] Ignoring {} after stop", connection.accountId(), event.getClass().getSimpleName());
            return;
        }
        try {
            if (event instanceof ProtocolEvent.Scan scan) {
                scanPresenter.present(connection.accountId(), scan.payload(), scan.status());
            } else if (event instanceof ProtocolEvent.Login login) {
                onLogin(connection, login.user());
            } else if (event instanceof ProtocolEvent.Logout logout) {
                onLogout(connection, logout.user());
            } else if (event instanceof ProtocolEvent.Message message) {
                messageListener.onMessage(connection, message.message());
            } else if (event instanceof ProtocolEvent.Error error) {
                String text = ErrorUtils.formatErrorMessage(error.error());
                connection.recordError(text);
                log.error("[{}] WeChat bot error: {}", connection.accountId(), text, error.error());
            }
        } catch (RuntimeException e) {
            String text = ErrorUtils.formatErrorMessage(e);
            connection.recordError(text);
            log.error("[{}] Failed handling {}: {}", connection.accountId(),
                    event.getClass().getSimpleName(), text, e);
        }
    }

    private void onLogin(WeChatConnection connection, Identity user) {
        if (!connection.markAuthenticated(user)) {
            return;
        }
        log.info("[{}] WeChat logged in as {} ({})", connection.accountId(), user.name(), user.id());

        // a repeated login restarts the services of the previous one
        connection.cancelBackgroundServices();
        persistCredentials(connection);

        for (SessionService service : sessionServices) {
            try {
                service.onLogin(connection).ifPresent(connection::addBackgroundService);
            } catch (RuntimeException e) {
                log.error("[{}] Failed to start {}: {}", connection.accountId(), service.name(),
                        ErrorUtils.formatErrorMessage(e), e);
            }
        }
        connection.markRunning();
    }

    private void onLogout(WeChatConnection connection, Identity user) {
        log.info("[{}] WeChat logged out: {}", connection.accountId(),
                user != null ? user.name() : "unknown");
        credentialStore.clear(connection.accountId());
        shutdown(connection);
    }

    private void persistCredentials(WeChatConnection connection) {
        try {
            connection.backend().exportCredentials()
                    .ifPresent(credentials -> credentialStore.save(connection.accountId(), credentials));
        } catch (RuntimeException e) {
            log.warn("[{}] Could not export session credentials: {}", connection.accountId(),
                    ErrorUtils.formatErrorMessage(e));
        }
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Probe the account's session without side effects.
     */
    public ProbeResult probe(String accountId) {
        long startTime = System.currentTimeMillis();
        Optional<WeChatConnection> connection = registry.connectionFor(accountId);
        if (connection.isEmpty()) {
            return ProbeResult.failure("WeChat account " + accountId + " is not running",
                    System.currentTimeMillis() - startTime);
        }
        ProtocolBackend backend = connection.get().backend();
        try {
            if (!backend.isLoggedIn()) {
                return ProbeResult.failure("Not logged in", System.currentTimeMillis() - startTime);
            }
            Identity user = backend.currentUser()
                    .orElseGet(() -> connection.get().user().orElse(new Identity("unknown", "unknown")));
            return ProbeResult.success(user, backend.name(), System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            return ProbeResult.failure(ErrorUtils.formatErrorMessage(e), System.currentTimeMillis() - startTime);
        }
    }

    public AccountSnapshot snapshot(String accountId) {
        Optional<ResolvedAccount> account = registry.describe(accountId);
        Optional<WeChatConnection> connection = registry.connectionFor(accountId);

        boolean loggedIn = false;
        if (connection.isPresent() && !connection.get().isStopped()) {
            try {
                loggedIn = connection.get().backend().isLoggedIn();
            } catch (RuntimeException e) {
                log.debug("[{}] isLoggedIn failed: {}", accountId, ErrorUtils.formatErrorMessage(e));
            }
        }

        return new AccountSnapshot(
                account.map(ResolvedAccount::accountId).orElse(accountId),
                account.map(ResolvedAccount::name).orElse(null),
                account.map(ResolvedAccount::enabled).orElse(false),
                account.map(ResolvedAccount::configured).orElse(false),
                account.map(a -> a.puppet().value()).orElse(null),
                account.map(a -> a.dmPolicy().value()).orElse(null),
                account.map(a -> a.moments().enabled()).orElse(false),
                connection.map(WeChatConnection::state).orElse(ConnectionState.STOPPED),
                loggedIn,
                connection.flatMap(WeChatConnection::user).orElse(null),
                connection.flatMap(WeChatConnection::lastStartAt).orElse(null),
                connection.flatMap(WeChatConnection::lastStopAt).orElse(null),
                connection.flatMap(WeChatConnection::lastInboundAt).orElse(null),
                connection.flatMap(WeChatConnection::lastOutboundAt).orElse(null),
                connection.flatMap(WeChatConnection::lastError).orElse(null));
    }

    /**
     * Snapshots of every configured account id.
     */
    public List<AccountSnapshot> snapshots() {
        List<AccountSnapshot> result = new ArrayList<>();
        for (String id : registry.listAccountIds()) {
            result.add(snapshot(id));
        }
        return result;
    }

    public List<StatusIssue> statusIssues() {
        return WeChatStatusIssues.collect(snapshots());
    }
}
