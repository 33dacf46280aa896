package com.openclaw.wechat.channel.protocol;

/**
 * Typed event emitted by a protocol backend.
 */
public sealed interface ProtocolEvent
        permits ProtocolEvent.Scan, ProtocolEvent.Login, ProtocolEvent.Logout,
        ProtocolEvent.Message, ProtocolEvent.Error {

    /** A login QR code must be scanned. {@code payload} is the QR content. */
    record Scan(String payload, int status) implements ProtocolEvent {
    }

    record Login(Identity user) implements ProtocolEvent {
    }

    record Logout(Identity user) implements ProtocolEvent {
    }

    record Message(RawMessage message) implements ProtocolEvent {
    }

    record Error(Throwable error) implements ProtocolEvent {
    }
}
