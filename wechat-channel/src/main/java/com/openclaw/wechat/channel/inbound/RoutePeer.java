package com.openclaw.wechat.channel.inbound;

/**
 * The conversation a message belongs to, for routing.
 *
 * @param kind {@code group} or {@code direct}
 */
public record RoutePeer(String kind, String id) {

    public static RoutePeer group(String id) {
        return new RoutePeer("group", id);
    }

    public static RoutePeer direct(String id) {
        return new RoutePeer("direct", id);
    }

    public boolean isGroup() {
        return "group".equals(kind);
    }
}
