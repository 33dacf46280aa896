package com.openclaw.wechat.channel.moments;

import com.openclaw.wechat.channel.protocol.MomentEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MomentFormatterTest {

    private static final long NOW = 1_800_000_000_000L;
    private static final long FIVE_MINUTES_AGO = NOW / 1000 - 300;

    @Test
    void format_fullPost() {
        MomentEntry entry = new MomentEntry("wxid_alice", "Alice", FIVE_MINUTES_AGO, " Sunset at the pier ", 3, 12,
                List.of(new MomentEntry.Comment("Bob", "nice"),
                        new MomentEntry.Comment(null, "wow"),
                        new MomentEntry.Comment("Dan", "third")));

        assertEquals(Optional.of(String.join("\n",
                "[WeChat Moment — Alice, 5m ago]",
                "Sunset at the pier",
                "[3 images] [12 likes]",
                "[Comments: Bob: nice, ?: wow]")), MomentFormatter.format(entry, NOW));
    }

    @Test
    void format_minimalPost() {
        MomentEntry entry = new MomentEntry("wxid_x", " ", 0, "hello", 0, 0, null);
        assertEquals(Optional.of("[WeChat Moment — Unknown, unknown time]\nhello"), MomentFormatter.format(entry, NOW));
    }

    @Test
    void format_likesOnly() {
        MomentEntry entry = new MomentEntry("wxid_x", "X", FIVE_MINUTES_AGO, "hi", 0, 1, List.of());
        assertTrue(MomentFormatter.format(entry, NOW).orElseThrow().endsWith("\n[1 likes]"));
    }

    @Test
    void format_emptyBodyIsSkipped() {
        assertTrue(MomentFormatter.format(new MomentEntry("a", "A", 1, "  ", 2, 0, null), NOW).isEmpty());
        assertTrue(MomentFormatter.format(new MomentEntry("a", "A", 1, null, 2, 0, null), NOW).isEmpty());
    }
}
