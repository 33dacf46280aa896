package com.openclaw.wechat.channel.protocol;

import java.time.Instant;
import java.util.Optional;

/**
 * One inbound message as delivered by the protocol client.
 * <p>
 * Accessors for payloads that need a round trip to the client
 * ({@link #mentionsSelf()}, {@link #downloadMedia()}, {@link #contactCard()},
 * {@link #urlLink()}) may throw {@link ProtocolException}.
 */
public interface RawMessage {

    String id();

    /** Sent by the logged-in account itself. */
    boolean self();

    /** Seconds since the message was sent. */
    long ageSeconds();

    MessageKind kind();

    /** Text body or caption; may be null. */
    String text();

    /** The room for group messages, empty for direct messages. */
    Optional<Room> room();

    /** The sender. */
    Peer talker();

    /** Send time, when the client reports one. */
    Optional<Instant> timestamp();

    /** Whether the logged-in user is @-mentioned. */
    boolean mentionsSelf();

    /** Raw bytes of an attached image, video or voice clip. */
    byte[] downloadMedia();

    Optional<Peer> contactCard();

    Optional<UrlLink> urlLink();
}
