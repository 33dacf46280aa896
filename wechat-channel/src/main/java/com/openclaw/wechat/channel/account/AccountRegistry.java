package com.openclaw.wechat.channel.account;

import com.openclaw.wechat.channel.WeChatConfigException;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves accounts from the current configuration and owns the
 * account id → live connection slots. At most one connection is held per
 * account id at any time.
 */
@Slf4j
public class AccountRegistry {

    private final Supplier<Map<String, Object>> sectionSupplier;
    private final Function<String, String> env;
    private final ConcurrentHashMap<String, WeChatConnection> connections = new ConcurrentHashMap<>();

    /**
     * @param sectionSupplier supplies the current raw {@code channels.wechat} section
     * @param env             environment lookup (token fallback)
     */
    public AccountRegistry(Supplier<Map<String, Object>> sectionSupplier, Function<String, String> env) {
        this.sectionSupplier = sectionSupplier;
        this.env = env;
    }

    public List<String> listAccountIds() {
        return WeChatAccounts.listAccountIds(section());
    }

    public String defaultAccountId() {
        return WeChatAccounts.resolveDefaultAccountId(section());
    }

    /**
     * Resolve an account. Unknown, disabled, unconfigured or invalid accounts
     * come back as {@link AccountResolution.NotConfigured}.
     */
    public AccountResolution resolve(String accountId) {
        Map<String, Object> section = section();
        String id = WeChatAccounts.normalizeAccountId(accountId);
        if (!WeChatAccounts.listAccountIds(section).contains(id)) {
            return AccountResolution.notConfigured(id, "Unknown WeChat account: " + id);
        }

        ResolvedAccount account;
        try {
            account = WeChatAccounts.resolve(section, id, env);
        } catch (WeChatConfigException e) {
            return AccountResolution.notConfigured(id, e.getMessage());
        }

        if (!account.enabled()) {
            return AccountResolution.notConfigured(id, "WeChat account " + id + " is disabled");
        }
        if (!account.configured()) {
            return AccountResolution.notConfigured(id, "WeChat account " + id
                    + " uses the padlocal puppet but has no padlocalToken (set it in config or "
                    + WeChatAccounts.TOKEN_ENV_VAR + ")");
        }
        return AccountResolution.resolved(account);
    }

    /**
     * Resolve without the enabled/configured checks, for status reporting.
     */
    public Optional<ResolvedAccount> describe(String accountId) {
        try {
            return Optional.of(WeChatAccounts.resolve(section(), accountId, env));
        } catch (WeChatConfigException e) {
            log.debug("[{}] Account not describable: {}", accountId, e.getMessage());
            return Optional.empty();
        }
    }

    public List<ResolvedAccount> listEnabled() {
        return WeChatAccounts.listEnabled(section(), env);
    }

    // =========================================================================
    // Connection slots
    // =========================================================================

    public Optional<WeChatConnection> connectionFor(String accountId) {
        return Optional.ofNullable(connections.get(WeChatAccounts.normalizeAccountId(accountId)));
    }

    /**
     * Return the connection held for the account, creating it with
     * {@code factory} when the slot is empty. The factory runs at most once per
     * empty slot even under concurrent calls; if it throws, the slot stays empty.
     */
    public WeChatConnection claim(String accountId, Function<String, WeChatConnection> factory) {
        return connections.computeIfAbsent(WeChatAccounts.normalizeAccountId(accountId), factory);
    }

    /**
     * Free the slot if it still holds {@code connection}.
     *
     * @return true when the slot was released
     */
    public boolean release(String accountId, WeChatConnection connection) {
        return connections.remove(WeChatAccounts.normalizeAccountId(accountId), connection);
    }

    public Collection<WeChatConnection> connections() {
        return List.copyOf(connections.values());
    }

    private Map<String, Object> section() {
        Map<String, Object> section = sectionSupplier.get();
        return section != null ? section : Map.of();
    }
}
