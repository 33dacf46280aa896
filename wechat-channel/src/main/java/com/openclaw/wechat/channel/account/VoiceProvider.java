package com.openclaw.wechat.channel.account;

import com.openclaw.wechat.channel.WeChatConfigException;

import java.util.Locale;

public enum VoiceProvider {
    SYSTEM("system"),
    OPENAI("openai");

    private final String value;

    VoiceProvider(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static VoiceProvider parse(String raw) {
        if (raw == null || raw.isBlank())
            return SYSTEM;
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (VoiceProvider provider : values()) {
            if (provider.value.equals(normalized))
                return provider;
        }
        throw new WeChatConfigException("Unknown WeChat voice provider \"" + raw.trim() + "\"");
    }
}
