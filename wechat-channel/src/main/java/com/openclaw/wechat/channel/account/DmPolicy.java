package com.openclaw.wechat.channel.account;

import com.openclaw.wechat.channel.WeChatConfigException;

import java.util.Locale;

/**
 * Admission rule for direct messages.
 */
public enum DmPolicy {
    PAIRING("pairing"),
    ALLOWLIST("allowlist"),
    OPEN("open"),
    DISABLED("disabled");

    private final String value;

    DmPolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DmPolicy parse(String raw) {
        if (raw == null || raw.isBlank())
            return PAIRING;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DmPolicy policy : values()) {
            if (policy.value.equals(normalized))
                return policy;
        }
        throw new WeChatConfigException("Unknown WeChat dmPolicy \"" + raw.trim() + "\"");
    }
}
