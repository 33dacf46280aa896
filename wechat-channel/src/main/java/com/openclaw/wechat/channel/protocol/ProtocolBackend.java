package com.openclaw.wechat.channel.protocol;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Boundary to a concrete WeChat protocol client (one per account).
 * <p>
 * Events are delivered one at a time to the listener registered with
 * {@link #subscribe}. Blocking calls report failures as {@link ProtocolException}.
 */
public interface ProtocolBackend {

    /** Puppet name, e.g. {@code padlocal}. */
    String name();

    /**
     * Register the single event listener. Called once, before {@link #connect}.
     */
    void subscribe(ProtocolEventListener listener);

    /**
     * Open the session, resuming from stored credentials when given.
     * Returns once the client is started; login completes via events.
     */
    void connect(Optional<SessionCredentials> credentials);

    void disconnect();

    boolean isLoggedIn();

    Optional<Identity> currentUser();

    /** Credentials to persist after login, if the backend supports resumption. */
    Optional<SessionCredentials> exportCredentials();

    void sendText(String target, String text);

    void sendMedia(String target, Path file);

    Optional<Peer> lookupPeer(String id);

    Optional<Room> lookupRoom(String id);

    List<Peer> listPeers();

    List<Room> listRooms();

    List<Peer> roomMembers(String roomId);

    /**
     * Moments feed capability; empty when this backend cannot read moments.
     */
    Optional<MomentsFeed> momentsFeed();
}
