package com.openclaw.wechat.channel.policy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeChatAllowlistTest {

    @Test
    void normalizeEntry_stripsPrefixAndLowercases() {
        assertEquals("wxid_abc", WeChatAllowlist.normalizeEntry(" WeChat:WXID_ABC "));
        assertEquals("wxid_def", WeChatAllowlist.normalizeEntry("wx:wxid_def"));
        assertEquals("wxid_ghi", WeChatAllowlist.normalizeEntry("wxid_ghi"));
        assertEquals("", WeChatAllowlist.normalizeEntry(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"wechat:wxid_A", "  WX:wxid_b ", "wxid_c", "*", "WECHAT: wxid_d"})
    void normalizeEntry_isIdempotent(String raw) {
        String once = WeChatAllowlist.normalizeEntry(raw);
        assertEquals(once, WeChatAllowlist.normalizeEntry(once));
    }

    @Test
    void match_emptyListDeniesEveryone() {
        assertFalse(WeChatAllowlist.match(List.of(), "wxid_abc").allowed());
        assertFalse(WeChatAllowlist.match(null, "wxid_abc").allowed());
    }

    @Test
    void match_wildcardAllowsAnyone() {
        var match = WeChatAllowlist.match(List.of("*"), "wxid_anyone");
        assertTrue(match.allowed());
        assertEquals("wildcard", match.matchSource());
        assertEquals("*", match.matchKey());
    }

    @Test
    void match_prefixedEntryMatchesBareSender() {
        var match = WeChatAllowlist.match(List.of("wechat:wxid_abc123"), "wxid_abc123");
        assertTrue(match.allowed());
        assertEquals("id", match.matchSource());
        assertEquals("wxid_abc123", match.matchKey());
    }

    @Test
    void match_isCaseInsensitive() {
        assertTrue(WeChatAllowlist.isAllowed(List.of("WXID_ABC"), "wx:wxid_abc"));
    }

    @Test
    void match_otherSenderDenied() {
        assertFalse(WeChatAllowlist.isAllowed(List.of("wxid_abc", "wx:wxid_def"), "wxid_xyz"));
    }

    @Test
    void match_blankSenderDenied() {
        assertFalse(WeChatAllowlist.isAllowed(List.of("wxid_abc"), "  "));
    }
}
