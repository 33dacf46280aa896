package com.openclaw.wechat.common.infra;

/**
 * Format ages and elapsed spans into short human-readable strings.
 */
public final class FormatAge {

    private FormatAge() {
    }

    /**
     * Format an age in milliseconds, truncating each unit.
     * Examples: "just now", "5m ago", "3h ago", "2d ago"
     */
    public static String formatAge(long ms) {
        if (ms < 0)
            return "just now";

        long minutes = ms / 60_000;
        if (minutes < 1)
            return "just now";
        if (minutes < 60)
            return minutes + "m ago";

        long hours = minutes / 60;
        if (hours < 24)
            return hours + "h ago";

        return (hours / 24) + "d ago";
    }

    /**
     * Compact elapsed span between two timestamps, e.g. "45s", "5m", "3h", "2d".
     *
     * @return null when {@code previousMs} is after {@code currentMs}
     */
    public static String formatElapsed(long currentMs, long previousMs) {
        long elapsedMs = currentMs - previousMs;
        if (elapsedMs < 0)
            return null;
        long seconds = elapsedMs / 1000;
        if (seconds < 60)
            return seconds + "s";
        long minutes = seconds / 60;
        if (minutes < 60)
            return minutes + "m";
        long hours = minutes / 60;
        if (hours < 24)
            return hours + "h";
        return (hours / 24) + "d";
    }
}
