package com.openclaw.wechat.channel.policy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Sender id normalization and allow-list matching.
 * <p>
 * Ids may carry an optional, case-insensitive {@code wechat:} or {@code wx:}
 * prefix. Every comparison strips it and lower-cases the rest.
 */
public final class WeChatAllowlist {

    private WeChatAllowlist() {
    }

    public static final String WILDCARD = "*";

    private static final Pattern PREFIX = Pattern.compile("^(wechat|wx):", Pattern.CASE_INSENSITIVE);

    /**
     * Allow-list match result.
     */
    public record AllowMatch(boolean allowed, String matchKey, String matchSource) {

        public static AllowMatch denied() {
            return new AllowMatch(false, null, null);
        }

        public static AllowMatch allowed(String matchKey, String source) {
            return new AllowMatch(true, matchKey, source);
        }
    }

    /**
     * Normalize one id or allow-list entry. Idempotent.
     */
    public static String normalizeEntry(String raw) {
        if (raw == null)
            return "";
        String trimmed = raw.trim();
        String stripped = PREFIX.matcher(trimmed).replaceFirst("");
        return stripped.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Normalize a whole list, dropping blanks.
     */
    public static List<String> normalizeAll(Collection<String> entries) {
        List<String> result = new ArrayList<>();
        if (entries == null)
            return result;
        for (String entry : entries) {
            String normalized = normalizeEntry(entry);
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        return result;
    }

    /**
     * Match a sender against an allow list. An empty list allows nobody; a
     * wildcard entry allows everybody.
     */
    public static AllowMatch match(Collection<String> allowFrom, String senderId) {
        List<String> entries = normalizeAll(allowFrom);
        if (entries.isEmpty()) {
            return AllowMatch.denied();
        }
        if (entries.contains(WILDCARD)) {
            return AllowMatch.allowed(WILDCARD, "wildcard");
        }
        String sender = normalizeEntry(senderId);
        if (!sender.isEmpty() && entries.contains(sender)) {
            return AllowMatch.allowed(sender, "id");
        }
        return AllowMatch.denied();
    }

    public static boolean isAllowed(Collection<String> allowFrom, String senderId) {
        return match(allowFrom, senderId).allowed();
    }
}
