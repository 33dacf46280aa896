package com.openclaw.wechat.channel.protocol;

/**
 * Failure reported by a protocol backend.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
