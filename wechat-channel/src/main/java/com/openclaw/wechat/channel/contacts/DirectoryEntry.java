package com.openclaw.wechat.channel.contacts;

/**
 * @param kind {@code user} or {@code group}
 */
public record DirectoryEntry(String kind, String id, String name) {

    public static DirectoryEntry user(String id, String name) {
        return new DirectoryEntry("user", id, name);
    }

    public static DirectoryEntry group(String id, String name) {
        return new DirectoryEntry("group", id, name);
    }
}
