package com.openclaw.wechat.channel.moments;

import com.openclaw.wechat.channel.account.ResolvedAccount.MomentsSettings;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.channel.protocol.MomentEntry;
import com.openclaw.wechat.channel.protocol.MomentsFeed;
import com.openclaw.wechat.common.infra.ErrorUtils;
import com.openclaw.wechat.common.infra.JsonFile;
import com.openclaw.wechat.common.infra.RecurringTask;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Polls one account's moments feed and injects new posts as agent context.
 * <p>
 * A post is new when it was created after the last completed poll. The
 * watermark only moves forward and survives restarts through
 * {@code moments-state.json}. After {@link #close()} no further fetch starts
 * and the result of one in flight is dropped.
 */
@Slf4j
public class MomentsPoller implements AutoCloseable {

    public static final String SESSION_KEY = "wechat-moments";
    public static final String LABEL = "wechat-moments";
    static final Duration INITIAL_DELAY = Duration.ofSeconds(5);

    private final WeChatConnection connection;
    private final MomentsSettings settings;
    private final ContextSink sink;
    private final Path stateFile;
    private final LongSupplier clock;
    private final Duration initialDelay;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile long lastPollTime;
    private RecurringTask task;

    public MomentsPoller(WeChatConnection connection, ContextSink sink, Path stateFile) {
        this(connection, sink, stateFile, System::currentTimeMillis, INITIAL_DELAY);
    }

    MomentsPoller(WeChatConnection connection, ContextSink sink, Path stateFile, LongSupplier clock,
            Duration initialDelay) {
        this.connection = connection;
        this.settings = connection.account().moments();
        this.sink = sink;
        this.stateFile = stateFile;
        this.clock = clock;
        this.initialDelay = initialDelay;
        this.lastPollTime = restoreLastPollTime();
    }

    /**
     * Start polling if the backend can read moments.
     *
     * @return false when the capability is missing; nothing is scheduled then
     */
    public synchronized boolean start() {
        if (connection.backend().momentsFeed().isEmpty()) {
            log.warn("[{}] Moments polling requires a puppet with moments support ({} has none)",
                    connection.accountId(), connection.backend().name());
            return false;
        }
        if (task != null || stopped.get()) {
            return task != null;
        }
        task = new RecurringTask("wechat-moments-" + connection.accountId(), initialDelay,
                Duration.ofSeconds(settings.pollIntervalSeconds()), this::poll);
        task.start();
        log.info("[{}] Moments poller started (every {}s)", connection.accountId(), settings.pollIntervalSeconds());
        return true;
    }

    /**
     * One poll cycle.
     *
     * @return the number of posts injected
     */
    int poll() {
        if (stopped.get() || connection.isStopped()) {
            return 0;
        }
        if (!connection.backend().isLoggedIn()) {
            return 0;
        }
        Optional<MomentsFeed> feed = connection.backend().momentsFeed();
        if (feed.isEmpty()) {
            log.warn("[{}] Moments feed no longer available", connection.accountId());
            return 0;
        }

        List<MomentEntry> entries;
        try {
            entries = feed.get().fetchRecent(settings.maxPerPoll());
        } catch (RuntimeException e) {
            log.error("[{}] Moments poll error: {}", connection.accountId(), ErrorUtils.formatErrorMessage(e));
            return 0;
        }
        if (stopped.get() || connection.isStopped()) {
            log.debug("[{}] Discarding moments fetched after stop", connection.accountId());
            return 0;
        }

        // posts created while the fetch ran are covered by this cycle
        long now = clock.getAsLong();
        long watermark = lastPollTime;
        int injected = 0;
        for (MomentEntry entry : entries) {
            if (entry.createdAtEpoch() * 1000 <= watermark) {
                continue;
            }
            Optional<String> block = MomentFormatter.format(entry, now);
            if (block.isEmpty() || !settings.injectAsContext()) {
                continue;
            }
            try {
                sink.inject(SESSION_KEY, block.get(), LABEL);
                injected++;
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to inject moment: {}", connection.accountId(), ErrorUtils.formatErrorMessage(e));
            }
        }

        advance(now);
        if (injected > 0) {
            log.debug("[{}] Injected {} new moments", connection.accountId(), injected);
        }
        return injected;
    }

    long lastPollTime() {
        return lastPollTime;
    }

    public boolean isRunning() {
        return task != null && task.isRunning() && !stopped.get();
    }

    @Override
    public synchronized void close() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (task != null) {
            task.close();
        }
    }

    // --- watermark persistence ---

    private long restoreLastPollTime() {
        long now = clock.getAsLong();
        MomentsState state = JsonFile.load(stateFile, MomentsState.class);
        if (state != null && state.getLastPollTime() > 0 && state.getLastPollTime() <= now) {
            return state.getLastPollTime();
        }
        return now;
    }

    private void advance(long time) {
        if (time <= lastPollTime) {
            return;
        }
        lastPollTime = time;
        MomentsState state = new MomentsState();
        state.setLastPollTime(time);
        try {
            JsonFile.save(stateFile, state);
        } catch (IOException e) {
            log.warn("[{}] Failed to persist moments state: {}", connection.accountId(),
                    ErrorUtils.formatErrorMessage(e));
        }
    }

    @Data
    @NoArgsConstructor
    static class MomentsState {
        private long lastPollTime;
    }
}
