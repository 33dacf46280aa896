package com.openclaw.wechat.channel.protocol;

import com.openclaw.wechat.channel.account.PuppetKind;
import com.openclaw.wechat.channel.account.ResolvedAccount;

/**
 * Creates backends for one puppet kind. Hosts register one provider per
 * supported puppet with the {@link ProtocolBackendFactory}.
 */
public interface ProtocolBackendProvider {

    PuppetKind kind();

    ProtocolBackend create(ResolvedAccount account);
}
