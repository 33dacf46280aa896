package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.protocol.Identity;
import com.openclaw.wechat.channel.protocol.ProtocolBackend;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live protocol session for one account, with its lifecycle state, the
 * logged-in identity, the background services started on login and status
 * timestamps.
 * <p>
 * Owned by the {@link ConnectionManager}; other components only read it or
 * send through its backend.
 */
@Slf4j
public class WeChatConnection {

    private final ResolvedAccount account;
    private final ProtocolBackend backend;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CREATED);
    private final AtomicReference<Identity> user = new AtomicReference<>();
    private final List<AutoCloseable> backgroundServices = new CopyOnWriteArrayList<>();

    private final AtomicLong lastStartAt = new AtomicLong();
    private final AtomicLong lastStopAt = new AtomicLong();
    private final AtomicLong lastInboundAt = new AtomicLong();
    private final AtomicLong lastOutboundAt = new AtomicLong();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public WeChatConnection(ResolvedAccount account, ProtocolBackend backend) {
        this.account = account;
        this.backend = backend;
    }

    public String accountId() {
        return account.accountId();
    }

    public ResolvedAccount account() {
        return account;
    }

    public ProtocolBackend backend() {
        return backend;
    }

    public ConnectionState state() {
        return state.get();
    }

    public Optional<Identity> user() {
        return Optional.ofNullable(user.get());
    }

    public boolean isRunning() {
        return state.get() == ConnectionState.RUNNING;
    }

    public boolean isStopped() {
        return state.get() == ConnectionState.STOPPED;
    }

    // =========================================================================
    // Transitions
    // =========================================================================

    boolean markConnecting() {
        if (state.compareAndSet(ConnectionState.CREATED, ConnectionState.CONNECTING)) {
            lastStartAt.set(System.currentTimeMillis());
            return true;
        }
        return false;
    }

    /**
     * Login seen. Also accepted from RUNNING, since a backend may re-emit
     * login after a transport reconnect.
     */
    boolean markAuthenticated(Identity identity) {
        ConnectionState current = state.get();
        while (current != ConnectionState.STOPPED) {
            if (state.compareAndSet(current, ConnectionState.AUTHENTICATED)) {
                user.set(identity);
                return true;
            }
            current = state.get();
        }
        return false;
    }

    boolean markRunning() {
        return state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.RUNNING);
    }

    /**
     * @return true when this call moved the connection to STOPPED
     */
    boolean markStopped() {
        ConnectionState previous = state.getAndSet(ConnectionState.STOPPED);
        if (previous == ConnectionState.STOPPED)
            return false;
        lastStopAt.set(System.currentTimeMillis());
        return true;
    }

    // =========================================================================
    // Background services
    // =========================================================================

    /**
     * Attach a service to be closed when the session ends. Closed at once if
     * the connection already stopped.
     */
    public void addBackgroundService(AutoCloseable service) {
        backgroundServices.add(service);
        if (isStopped()) {
            cancelBackgroundServices();
        }
    }

    void cancelBackgroundServices() {
        List<AutoCloseable> services = new ArrayList<>(backgroundServices);
        backgroundServices.removeAll(services);
        for (AutoCloseable service : services) {
            try {
                service.close();
            } catch (Exception e) {
                log.warn("[{}] Failed to stop background service {}: {}", accountId(),
                        service.getClass().getSimpleName(), ErrorUtils.formatErrorMessage(e));
            }
        }
    }

    int backgroundServiceCount() {
        return backgroundServices.size();
    }

    // =========================================================================
    // Status
    // =========================================================================

    public void recordInbound() {
        lastInboundAt.set(System.currentTimeMillis());
    }

    public void recordOutbound() {
        lastOutboundAt.set(System.currentTimeMillis());
    }

    public void recordError(String error) {
        lastError.set(error);
    }

    public Optional<Instant> lastStartAt() {
        return instant(lastStartAt);
    }

    public Optional<Instant> lastStopAt() {
        return instant(lastStopAt);
    }

    public Optional<Instant> lastInboundAt() {
        return instant(lastInboundAt);
    }

    public Optional<Instant> lastOutboundAt() {
        return instant(lastOutboundAt);
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError.get());
    }

    private static Optional<Instant> instant(AtomicLong value) {
        long ms = value.get();
        return ms > 0 ? Optional.of(Instant.ofEpochMilli(ms)) : Optional.empty();
    }
}
