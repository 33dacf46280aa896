package com.openclaw.wechat.channel.account;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openclaw.wechat.channel.WeChatChannel;
import com.openclaw.wechat.channel.WeChatConfigException;
import com.openclaw.wechat.common.config.ConfigMerge;
import com.openclaw.wechat.common.config.ConfigService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * WeChat account resolution and enumeration over the raw
 * {@code channels.wechat} section.
 * <p>
 * Precedence is per-account overlay, then base section, then defaults.
 */
@Slf4j
public final class WeChatAccounts {

    private WeChatAccounts() {
    }

    public static final String DEFAULT_ACCOUNT_ID = WeChatChannel.DEFAULT_ACCOUNT_ID;
    public static final String TOKEN_ENV_VAR = "WECHAT_PADLOCAL_TOKEN";

    static final long DEFAULT_MIN_REPLY_DELAY_MS = 500;
    static final double DEFAULT_MEDIA_MAX_MB = 50;
    static final int DEFAULT_TEXT_CHUNK_LIMIT = 2000;
    static final int DEFAULT_MOMENTS_INTERVAL_SECONDS = 300;
    static final int DEFAULT_MOMENTS_MAX_PER_POLL = 20;
    static final int DEFAULT_CONTACTS_REFRESH_HOURS = 24;

    private static final List<String> SECTION_ONLY_KEYS = List.of("accounts", "defaultAccount");
    private static final ObjectMapper MAPPER = ConfigService.createObjectMapper();

    /**
     * Normalize an account id: trimmed, lower-cased, blank means default.
     */
    public static String normalizeAccountId(String accountId) {
        if (accountId == null || accountId.isBlank())
            return DEFAULT_ACCOUNT_ID;
        return accountId.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * List all configured account ids, sorted; {@code [default]} when none.
     */
    public static List<String> listAccountIds(Map<String, Object> section) {
        Map<String, Object> accounts = accountsOf(section);
        if (accounts.isEmpty())
            return List.of(DEFAULT_ACCOUNT_ID);

        Set<String> ids = new LinkedHashSet<>();
        for (String key : accounts.keySet()) {
            if (key != null && !key.isBlank()) {
                ids.add(normalizeAccountId(key));
            }
        }
        List<String> sorted = new ArrayList<>(ids);
        Collections.sort(sorted);
        return sorted.isEmpty() ? List.of(DEFAULT_ACCOUNT_ID) : sorted;
    }

    /**
     * Resolve the default account id: {@code defaultAccount} when set, else
     * {@code default} when listed, else the first listed id.
     */
    public static String resolveDefaultAccountId(Map<String, Object> section) {
        if (section != null && section.get("defaultAccount") instanceof String s && !s.isBlank()) {
            return normalizeAccountId(s);
        }
        List<String> ids = listAccountIds(section);
        if (ids.contains(DEFAULT_ACCOUNT_ID))
            return DEFAULT_ACCOUNT_ID;
        return ids.get(0);
    }

    /**
     * Merge the base section (minus {@code accounts}/{@code defaultAccount})
     * with the account overlay.
     */
    public static Map<String, Object> mergeAccountConfig(Map<String, Object> section, String accountId) {
        Map<String, Object> base = ConfigMerge.without(section, SECTION_ONLY_KEYS);
        return ConfigMerge.mergeSection(base, findAccountConfig(accountsOf(section), accountId));
    }

    public static ResolvedAccount resolve(Map<String, Object> section, String accountId) {
        return resolve(section, accountId, System::getenv);
    }

    /**
     * Resolve one account into an immutable value.
     *
     * @throws WeChatConfigException when an option has an unrecognized value
     */
    public static ResolvedAccount resolve(Map<String, Object> section, String accountId,
            Function<String, String> env) {
        String effectiveId = normalizeAccountId(accountId);
        Map<String, Object> merged = mergeAccountConfig(section, effectiveId);

        WeChatAccountOptions options;
        try {
            options = MAPPER.convertValue(merged, WeChatAccountOptions.class);
        } catch (IllegalArgumentException e) {
            throw new WeChatConfigException(
                    "Invalid WeChat config for account " + effectiveId + ": " + e.getMessage(), e);
        }

        boolean baseEnabled = section == null || !Boolean.FALSE.equals(section.get("enabled"));
        boolean enabled = baseEnabled && !Boolean.FALSE.equals(options.getEnabled());

        PuppetKind puppet = PuppetKind.parse(options.getPuppet());
        TokenResolution token = resolveToken(section, effectiveId, env);
        boolean configured = puppet == PuppetKind.WECHAT4U || !token.token().isEmpty();

        String name = options.getName() != null && !options.getName().isBlank()
                ? options.getName().trim()
                : null;

        var voice = options.getVoice() != null ? options.getVoice() : new WeChatAccountOptions.VoiceOptions();
        var moments = options.getMoments() != null ? options.getMoments() : new WeChatAccountOptions.MomentsOptions();
        var contacts = options.getContacts() != null ? options.getContacts()
                : new WeChatAccountOptions.ContactsOptions();

        return new ResolvedAccount(
                effectiveId,
                name,
                enabled,
                configured,
                puppet,
                token.token(),
                token.source(),
                DmPolicy.parse(options.getDmPolicy()),
                cleanAllowFrom(options.getAllowFrom()),
                GroupPolicy.parse(options.getGroupPolicy()),
                !Boolean.FALSE.equals(options.getRequireMention()),
                nonNegative(options.getMinReplyDelayMs(), DEFAULT_MIN_REPLY_DELAY_MS),
                options.getMediaMaxMb() != null && options.getMediaMaxMb() > 0
                        ? options.getMediaMaxMb()
                        : DEFAULT_MEDIA_MAX_MB,
                positive(options.getTextChunkLimit(), DEFAULT_TEXT_CHUNK_LIMIT),
                options.getResponsePrefix() != null && !options.getResponsePrefix().isEmpty()
                        ? options.getResponsePrefix()
                        : null,
                new ResolvedAccount.VoiceSettings(
                        !Boolean.FALSE.equals(voice.getTranscribe()),
                        VoiceProvider.parse(voice.getProvider()),
                        blankToNull(voice.getOpenaiApiKey())),
                new ResolvedAccount.MomentsSettings(
                        Boolean.TRUE.equals(moments.getEnabled()),
                        positive(moments.getPollIntervalSeconds(), DEFAULT_MOMENTS_INTERVAL_SECONDS),
                        !Boolean.FALSE.equals(moments.getInjectAsContext()),
                        positive(moments.getMaxPerPoll(), DEFAULT_MOMENTS_MAX_PER_POLL)),
                new ResolvedAccount.ContactsSettings(
                        !Boolean.FALSE.equals(contacts.getIndexEnabled()),
                        positive(contacts.getRefreshIntervalHours(), DEFAULT_CONTACTS_REFRESH_HOURS)));
    }

    /**
     * List accounts that are both enabled and configured. Accounts whose
     * options fail to resolve are left out.
     */
    public static List<ResolvedAccount> listEnabled(Map<String, Object> section, Function<String, String> env) {
        List<ResolvedAccount> result = new ArrayList<>();
        for (String id : listAccountIds(section)) {
            try {
                ResolvedAccount account = resolve(section, id, env);
                if (account.enabled() && account.configured()) {
                    result.add(account);
                }
            } catch (WeChatConfigException e) {
                log.warn("[{}] Skipping account: {}", id, e.getMessage());
            }
        }
        return result;
    }

    // =========================================================================
    // Token resolution
    // =========================================================================

    public record TokenResolution(String token, TokenSource source) {
    }

    /**
     * Padlocal token for an account. A named account only uses its own
     * overlay; the default account uses the base section, then the
     * {@code WECHAT_PADLOCAL_TOKEN} environment variable.
     */
    public static TokenResolution resolveToken(Map<String, Object> section, String accountId,
            Function<String, String> env) {
        String effectiveId = normalizeAccountId(accountId);
        boolean isDefault = DEFAULT_ACCOUNT_ID.equals(effectiveId);

        if (!isDefault) {
            Map<String, Object> overlay = findAccountConfig(accountsOf(section), effectiveId);
            String token = trimmedString(overlay.get("padlocalToken"));
            if (token != null)
                return new TokenResolution(token, TokenSource.CONFIG);
            return new TokenResolution("", TokenSource.NONE);
        }

        String token = section != null ? trimmedString(section.get("padlocalToken")) : null;
        if (token != null)
            return new TokenResolution(token, TokenSource.CONFIG);

        String envToken = trimmedString(env.apply(TOKEN_ENV_VAR));
        if (envToken != null)
            return new TokenResolution(envToken, TokenSource.ENV);

        return new TokenResolution("", TokenSource.NONE);
    }

    // =========================================================================
    // Internal
    // =========================================================================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> accountsOf(Map<String, Object> section) {
        if (section != null && section.get("accounts") instanceof Map<?, ?> accounts) {
            return (Map<String, Object>) accounts;
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> findAccountConfig(Map<String, Object> accounts, String accountId) {
        Object direct = accounts.get(accountId);
        if (direct instanceof Map)
            return (Map<String, Object>) direct;

        for (Map.Entry<String, Object> entry : accounts.entrySet()) {
            if (normalizeAccountId(entry.getKey()).equals(accountId)
                    && entry.getValue() instanceof Map) {
                return (Map<String, Object>) entry.getValue();
            }
        }
        return Map.of();
    }

    private static List<String> cleanAllowFrom(List<String> raw) {
        if (raw == null)
            return List.of();
        return raw.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
    }

    private static String trimmedString(Object value) {
        if (value instanceof String s && !s.isBlank())
            return s.trim();
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static int positive(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static long nonNegative(Long value, long fallback) {
        return value != null && value >= 0 ? value : fallback;
    }
}
