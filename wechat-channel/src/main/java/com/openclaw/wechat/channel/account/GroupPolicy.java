package com.openclaw.wechat.channel.account;

import com.openclaw.wechat.channel.WeChatConfigException;

import java.util.Locale;

/**
 * Admission rule for group (room) messages.
 */
public enum GroupPolicy {
    ALLOWLIST("allowlist"),
    OPEN("open"),
    DISABLED("disabled");

    private final String value;

    GroupPolicy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static GroupPolicy parse(String raw) {
        if (raw == null || raw.isBlank())
            return ALLOWLIST;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (GroupPolicy policy : values()) {
            if (policy.value.equals(normalized))
                return policy;
        }
        throw new WeChatConfigException("Unknown WeChat groupPolicy \"" + raw.trim() + "\"");
    }
}
