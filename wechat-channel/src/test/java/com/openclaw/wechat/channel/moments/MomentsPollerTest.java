package com.openclaw.wechat.channel.moments;

import com.openclaw.wechat.channel.FakeBackend;
import com.openclaw.wechat.channel.TestAccounts;
import com.openclaw.wechat.channel.connection.TestConnections;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.channel.protocol.Identity;
import com.openclaw.wechat.channel.protocol.MomentEntry;
import com.openclaw.wechat.common.infra.JsonFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MomentsPollerTest {

    private static final long START = 1_800_000_000_000L;

    @TempDir
    Path dir;

    private final AtomicLong clock = new AtomicLong(START);
    private final FakeBackend backend = new FakeBackend();
    private final List<MomentEntry> feed = new CopyOnWriteArrayList<>();
    private final List<String> injected = new CopyOnWriteArrayList<>();
    private Path stateFile;
    private final List<MomentsPoller> pollers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        stateFile = dir.resolve("moments-state.json");
        backend.loggedIn = true;
        backend.momentsFeed = count -> feed.subList(0, Math.min(count, feed.size()));
    }

    @AfterEach
    void tearDown() {
        pollers.forEach(MomentsPoller::close);
    }

    private WeChatConnection connection(Map<String, Object> moments) {
        return TestConnections.running(TestAccounts.account(Map.of("moments", moments)), backend,
                new Identity("wxid_bot", "Bot"));
    }

    private MomentsPoller poller(WeChatConnection connection) {
        MomentsPoller poller = new MomentsPoller(connection,
                (sessionKey, text, label) -> injected.add(sessionKey + "|" + label + "|" + text),
                stateFile, clock::get, Duration.ofHours(1));
        pollers.add(poller);
        return poller;
    }

    private MomentsPoller poller() {
        return poller(connection(Map.of("enabled", true)));
    }

    private static MomentEntry post(String author, long createdAtMs, String body) {
        return new MomentEntry("wxid_" + author.toLowerCase(), author, createdAtMs / 1000, body, 0, 0, List.of());
    }

    // =========================================================================
    // Poll cycle
    // =========================================================================

    @Test
    void poll_injectsOnlyPostsAfterWatermark() {
        MomentsPoller poller = poller();
        feed.add(post("Alice", START + 10_000, "new post"));
        feed.add(post("Bob", START - 10_000, "old post"));
        clock.set(START + 60_000);
        backend.momentsFeed = count -> {
            clock.addAndGet(3_000);
            return feed.subList(0, Math.min(count, feed.size()));
        };

        assertEquals(1, poller.poll());
        assertEquals(1, injected.size());
        assertTrue(injected.get(0).startsWith("wechat-moments|wechat-moments|[WeChat Moment — Alice"));
        assertEquals(START + 63_000, poller.lastPollTime());
    }

    @Test
    void poll_postCreatedDuringFetchIsNotInjectedAgain() {
        MomentsPoller poller = poller();
        clock.set(START + 60_000);
        backend.momentsFeed = count -> {
            clock.addAndGet(5_000);
            return List.of(post("Alice", START + 62_000, "posted mid-fetch"));
        };

        assertEquals(1, poller.poll());
        assertEquals(START + 65_000, poller.lastPollTime());

        clock.set(START + 120_000);
        assertEquals(0, poller.poll());
        assertEquals(1, injected.size());
    }

    @Test
    void poll_doesNotInjectSamePostTwice() {
        MomentsPoller poller = poller();
        feed.add(post("Alice", START + 10_000, "new post"));
        clock.set(START + 60_000);
        poller.poll();

        clock.set(START + 120_000);
        assertEquals(0, poller.poll());
        assertEquals(1, injected.size());
    }

    @Test
    void poll_respectsMaxPerPoll() {
        MomentsPoller poller = poller(connection(Map.of("enabled", true, "maxPerPoll", 2)));
        for (int i = 1; i <= 5; i++) {
            feed.add(post("P" + i, START + i * 1000, "post " + i));
        }
        clock.set(START + 60_000);

        assertEquals(2, poller.poll());
    }

    @Test
    void poll_fetchFailureKeepsWatermark() {
        MomentsPoller poller = poller();
        backend.momentsFeed = count -> {
            throw new IllegalStateException("timeline unavailable");
        };
        clock.set(START + 60_000);

        assertEquals(0, poller.poll());
        assertEquals(START, poller.lastPollTime());
    }

    @Test
    void poll_skippedWhenLoggedOut() {
        MomentsPoller poller = poller();
        feed.add(post("Alice", START + 10_000, "new post"));
        backend.loggedIn = false;
        clock.set(START + 60_000);

        assertEquals(0, poller.poll());
        assertEquals(START, poller.lastPollTime());
    }

    @Test
    void poll_discardsFetchCompletedAfterClose() {
        MomentsPoller poller = poller();
        feed.add(post("Alice", START + 10_000, "new post"));
        backend.momentsFeed = count -> {
            poller.close();
            return List.copyOf(feed);
        };
        clock.set(START + 60_000);

        assertEquals(0, poller.poll());
        assertTrue(injected.isEmpty());
        assertEquals(START, poller.lastPollTime());
    }

    @Test
    void poll_stoppedConnectionDoesNothing() {
        WeChatConnection connection = connection(Map.of("enabled", true));
        MomentsPoller poller = poller(connection);
        feed.add(post("Alice", START + 10_000, "new post"));
        TestConnections.stop(connection);

        assertEquals(0, poller.poll());
    }

    @Test
    void poll_withoutInjectionStillAdvances() {
        MomentsPoller poller = poller(connection(Map.of("enabled", true, "injectAsContext", false)));
        feed.add(post("Alice", START + 10_000, "new post"));
        clock.set(START + 60_000);

        assertEquals(0, poller.poll());
        assertTrue(injected.isEmpty());
        assertEquals(START + 60_000, poller.lastPollTime());
    }

    @Test
    void poll_sinkFailureIsNotCounted() {
        MomentsPoller poller = new MomentsPoller(connection(Map.of("enabled", true)),
                (sessionKey, text, label) -> {
                    throw new IllegalStateException("session busy");
                }, stateFile, clock::get, Duration.ofHours(1));
        pollers.add(poller);
        feed.add(post("Alice", START + 10_000, "new post"));
        clock.set(START + 60_000);

        assertEquals(0, poller.poll());
        assertEquals(START + 60_000, poller.lastPollTime());
    }

    // =========================================================================
    // Watermark persistence
    // =========================================================================

    @Test
    void watermark_survivesRestart() {
        MomentsPoller first = poller();
        clock.set(START + 60_000);
        first.poll();
        first.close();

        clock.set(START + 600_000);
        MomentsPoller second = poller();
        assertEquals(START + 60_000, second.lastPollTime());

        feed.add(post("Alice", START + 30_000, "seen before restart"));
        feed.add(post("Bob", START + 300_000, "posted while down"));
        assertEquals(1, second.poll());
        assertTrue(injected.get(0).contains("Bob"));
    }

    @Test
    void watermark_inFutureIsIgnored() throws Exception {
        MomentsPoller.MomentsState state = new MomentsPoller.MomentsState();
        state.setLastPollTime(START + 1_000_000);
        JsonFile.save(stateFile, state);

        assertEquals(START, poller().lastPollTime());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    @Test
    void start_requiresMomentsCapability() {
        backend.momentsFeed = null;
        MomentsPoller poller = poller();

        assertFalse(poller.start());
        assertFalse(poller.isRunning());
    }

    @Test
    void start_thenCloseIsIdempotent() {
        MomentsPoller poller = poller();

        assertTrue(poller.start());
        assertTrue(poller.start());
        assertTrue(poller.isRunning());

        poller.close();
        poller.close();
        assertFalse(poller.isRunning());
        assertEquals(0, poller.poll());
    }
}
