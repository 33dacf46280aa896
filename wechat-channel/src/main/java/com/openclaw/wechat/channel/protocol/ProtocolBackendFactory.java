package com.openclaw.wechat.channel.protocol;

import com.openclaw.wechat.channel.WeChatConfigException;
import com.openclaw.wechat.channel.account.PuppetKind;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Selects the backend implementation for an account by its puppet kind.
 */
@Slf4j
public class ProtocolBackendFactory {

    private final Map<PuppetKind, ProtocolBackendProvider> providers = new EnumMap<>(PuppetKind.class);

    public ProtocolBackendFactory(Collection<? extends ProtocolBackendProvider> providers) {
        for (ProtocolBackendProvider provider : providers) {
            ProtocolBackendProvider previous = this.providers.put(provider.kind(), provider);
            if (previous != null) {
                log.warn("Replacing {} backend provider {} with {}", provider.kind().value(),
                        previous.getClass().getSimpleName(), provider.getClass().getSimpleName());
            }
        }
    }

    public Set<PuppetKind> supportedKinds() {
        return Set.copyOf(providers.keySet());
    }

    /**
     * Create the backend for an account.
     *
     * @throws WeChatConfigException when no provider handles the account's
     *                               puppet, or a padlocal account has no token
     */
    public ProtocolBackend create(ResolvedAccount account) {
        if (account.puppet() == PuppetKind.PADLOCAL && account.padlocalToken().isEmpty()) {
            throw new WeChatConfigException("WeChat account " + account.accountId()
                    + " uses the padlocal puppet but has no padlocalToken");
        }
        ProtocolBackendProvider provider = providers.get(account.puppet());
        if (provider == null) {
            throw new WeChatConfigException("No protocol backend available for puppet "
                    + account.puppet().value() + " (account " + account.accountId() + ")");
        }
        return provider.create(account);
    }
}
