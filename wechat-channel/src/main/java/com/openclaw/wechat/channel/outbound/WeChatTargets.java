package com.openclaw.wechat.channel.outbound;

import java.util.regex.Pattern;

/**
 * Outbound target ids: {@code wxid_...} for people, {@code ...@chatroom} for
 * groups, optionally prefixed with {@code wechat:} or {@code wx:}.
 */
public final class WeChatTargets {

    private WeChatTargets() {
    }

    private static final Pattern PREFIX = Pattern.compile("^(wechat|wx):", Pattern.CASE_INSENSITIVE);

    public static String normalize(String raw) {
        if (raw == null)
            return "";
        return PREFIX.matcher(raw.trim()).replaceFirst("").trim();
    }

    public static boolean looksLikeId(String raw) {
        String id = normalize(raw);
        return id.startsWith("wxid_") || id.contains("@chatroom");
    }

    public static boolean isGroupTarget(String raw) {
        String id = normalize(raw);
        return id.contains("@chatroom") || id.startsWith("@@");
    }
}
