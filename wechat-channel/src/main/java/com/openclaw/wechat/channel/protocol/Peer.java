package com.openclaw.wechat.channel.protocol;

/**
 * A contact as seen by the protocol client.
 *
 * @param alias remark the logged-in user set for this contact, may be null
 * @param self  true for the logged-in user's own contact
 */
public record Peer(String id, String name, String alias, boolean self) {

    public static Peer of(String id, String name) {
        return new Peer(id, name, null, false);
    }
}
