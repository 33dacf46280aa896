package com.openclaw.wechat.channel.account;

/**
 * Outcome of resolving an account through the {@link AccountRegistry}.
 */
public sealed interface AccountResolution permits AccountResolution.Resolved, AccountResolution.NotConfigured {

    String accountId();

    /** Account is known, enabled and configured. */
    record Resolved(ResolvedAccount account) implements AccountResolution {
        @Override
        public String accountId() {
            return account.accountId();
        }
    }

    /** Account is unknown, disabled, incomplete or invalid. */
    record NotConfigured(String accountId, String reason) implements AccountResolution {
    }

    static AccountResolution resolved(ResolvedAccount account) {
        return new Resolved(account);
    }

    static AccountResolution notConfigured(String accountId, String reason) {
        return new NotConfigured(accountId, reason);
    }
}
