package com.openclaw.wechat.channel.account;

import com.openclaw.wechat.channel.WeChatConfigException;

import java.util.Locale;

/**
 * Protocol backend ("puppet") an account connects through.
 */
public enum PuppetKind {
    PADLOCAL("padlocal"),
    WECHAT4U("wechat4u");

    private final String value;

    PuppetKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parse a config value; blank means {@link #PADLOCAL}.
     *
     * @throws WeChatConfigException for an unknown puppet
     */
    public static PuppetKind parse(String raw) {
        if (raw == null || raw.isBlank())
            return PADLOCAL;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PuppetKind kind : values()) {
            if (kind.value.equals(normalized))
                return kind;
        }
        throw new WeChatConfigException(
                "Unknown WeChat puppet \"" + raw.trim() + "\" (expected padlocal or wechat4u)");
    }
}
