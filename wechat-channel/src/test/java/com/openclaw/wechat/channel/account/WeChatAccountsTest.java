package com.openclaw.wechat.channel.account;

import com.openclaw.wechat.channel.WeChatConfigException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class WeChatAccountsTest {

    private static final Function<String, String> NO_ENV = key -> null;

    // =========================================================================
    // Account ids
    // =========================================================================

    @Test
    void listAccountIds_defaultWhenNoAccounts() {
        assertEquals(List.of("default"), WeChatAccounts.listAccountIds(Map.of()));
        assertEquals(List.of("default"), WeChatAccounts.listAccountIds(null));
    }

    @Test
    void listAccountIds_sortedAndNormalized() {
        Map<String, Object> section = Map.of("accounts", Map.of(
                "Work", Map.of(), "alpha", Map.of(), " ", Map.of()));
        assertEquals(List.of("alpha", "work"), WeChatAccounts.listAccountIds(section));
    }

    @Test
    void resolveDefaultAccountId_prefersExplicitSetting() {
        Map<String, Object> section = Map.of(
                "defaultAccount", "Work",
                "accounts", Map.of("alpha", Map.of(), "work", Map.of()));
        assertEquals("work", WeChatAccounts.resolveDefaultAccountId(section));
    }

    @Test
    void resolveDefaultAccountId_fallsBackToFirstListed() {
        Map<String, Object> section = Map.of("accounts", Map.of("zeta", Map.of(), "beta", Map.of()));
        assertEquals("beta", WeChatAccounts.resolveDefaultAccountId(section));
    }

    @Test
    void normalizeAccountId_blankIsDefault() {
        assertEquals("default", WeChatAccounts.normalizeAccountId(null));
        assertEquals("default", WeChatAccounts.normalizeAccountId("  "));
        assertEquals("work", WeChatAccounts.normalizeAccountId(" WORK "));
    }

    // =========================================================================
    // Resolution
    // =========================================================================

    @Test
    void resolve_appliesDefaults() {
        ResolvedAccount account = WeChatAccounts.resolve(Map.of(), "default", NO_ENV);

        assertEquals("default", account.accountId());
        assertTrue(account.enabled());
        assertFalse(account.configured());
        assertEquals(PuppetKind.PADLOCAL, account.puppet());
        assertEquals(TokenSource.NONE, account.tokenSource());
        assertEquals(DmPolicy.PAIRING, account.dmPolicy());
        assertEquals(GroupPolicy.ALLOWLIST, account.groupPolicy());
        assertTrue(account.requireMention());
        assertEquals(500, account.minReplyDelayMs());
        assertEquals(50.0, account.mediaMaxMb());
        assertEquals(2000, account.textChunkLimit());
        assertTrue(account.voice().transcribe());
        assertEquals(VoiceProvider.SYSTEM, account.voice().provider());
        assertFalse(account.moments().enabled());
        assertEquals(300, account.moments().pollIntervalSeconds());
        assertEquals(20, account.moments().maxPerPoll());
        assertTrue(account.moments().injectAsContext());
        assertTrue(account.contacts().indexEnabled());
        assertEquals(24, account.contacts().refreshIntervalHours());
    }

    @Test
    void resolve_overlayOverridesBase() {
        Map<String, Object> section = Map.of(
                "dmPolicy", "allowlist",
                "allowFrom", List.of("wxid_base"),
                "textChunkLimit", 1500,
                "accounts", Map.of("work", Map.of(
                        "padlocalToken", "tok-work",
                        "dmPolicy", "open",
                        "name", "Work phone")));

        ResolvedAccount work = WeChatAccounts.resolve(section, "work", NO_ENV);

        assertEquals(DmPolicy.OPEN, work.dmPolicy());
        assertEquals(List.of("wxid_base"), work.allowFrom());
        assertEquals(1500, work.textChunkLimit());
        assertEquals("Work phone", work.name());
        assertEquals("Work phone (work)", work.displayLabel());
    }

    @Test
    void resolve_nestedOptionsMergeDeeply() {
        Map<String, Object> section = Map.of(
                "voice", Map.of("provider", "openai", "openaiApiKey", "sk-base"),
                "accounts", Map.of("work", Map.of("voice", Map.of("transcribe", false))));

        ResolvedAccount work = WeChatAccounts.resolve(section, "work", NO_ENV);

        assertFalse(work.voice().transcribe());
        assertEquals(VoiceProvider.OPENAI, work.voice().provider());
        assertEquals("sk-base", work.voice().openaiApiKey());
    }

    @Test
    void resolve_isDeterministic() {
        Map<String, Object> section = Map.of("padlocalToken", "tok", "allowFrom", List.of("a", "b"));
        assertEquals(WeChatAccounts.resolve(section, "default", NO_ENV),
                WeChatAccounts.resolve(section, "default", NO_ENV));
    }

    @Test
    void resolve_invalidPuppetThrows() {
        Map<String, Object> section = Map.of("puppet", "web");
        assertThrows(WeChatConfigException.class, () -> WeChatAccounts.resolve(section, "default", NO_ENV));
    }

    @Test
    void resolve_baseDisabledDisablesAllAccounts() {
        Map<String, Object> section = Map.of("enabled", false,
                "accounts", Map.of("work", Map.of("enabled", true)));
        assertFalse(WeChatAccounts.resolve(section, "work", NO_ENV).enabled());
    }

    @Test
    void resolve_wechat4uIsConfiguredWithoutToken() {
        ResolvedAccount account = WeChatAccounts.resolve(Map.of("puppet", "wechat4u"), "default", NO_ENV);
        assertTrue(account.configured());
        assertEquals(PuppetKind.WECHAT4U, account.puppet());
    }

    @Test
    void toString_redactsSecrets() {
        ResolvedAccount account = WeChatAccounts.resolve(Map.of("padlocalToken", "secret-token",
                "voice", Map.of("openaiApiKey", "sk-secret")), "default", NO_ENV);
        assertFalse(account.toString().contains("secret-token"));
        assertFalse(account.voice().toString().contains("sk-secret"));
    }

    // =========================================================================
    // Token resolution
    // =========================================================================

    @Test
    void resolveToken_defaultAccountUsesEnvFallback() {
        var token = WeChatAccounts.resolveToken(Map.of(), "default",
                key -> WeChatAccounts.TOKEN_ENV_VAR.equals(key) ? "env-token" : null);
        assertEquals("env-token", token.token());
        assertEquals(TokenSource.ENV, token.source());
    }

    @Test
    void resolveToken_configBeatsEnv() {
        var token = WeChatAccounts.resolveToken(Map.of("padlocalToken", " cfg-token "), "default",
                key -> "env-token");
        assertEquals("cfg-token", token.token());
        assertEquals(TokenSource.CONFIG, token.source());
    }

    @Test
    void resolveToken_namedAccountIgnoresBaseAndEnv() {
        Map<String, Object> section = Map.of("padlocalToken", "base-token",
                "accounts", Map.of("work", Map.of()));
        var token = WeChatAccounts.resolveToken(section, "work", key -> "env-token");
        assertEquals("", token.token());
        assertEquals(TokenSource.NONE, token.source());
    }

    @Test
    void listEnabled_skipsDisabledUnconfiguredAndInvalid() {
        Map<String, Object> section = Map.of("accounts", Map.of(
                "good", Map.of("padlocalToken", "tok"),
                "off", Map.of("padlocalToken", "tok", "enabled", false),
                "bare", Map.of(),
                "broken", Map.of("padlocalToken", "tok", "dmPolicy", "sometimes")));

        List<ResolvedAccount> enabled = WeChatAccounts.listEnabled(section, NO_ENV);

        assertEquals(List.of("good"), enabled.stream().map(ResolvedAccount::accountId).toList());
    }
}
