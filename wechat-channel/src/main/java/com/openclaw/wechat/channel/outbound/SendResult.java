package com.openclaw.wechat.channel.outbound;

/**
 * Outcome of a direct send.
 */
public record SendResult(boolean ok, String to, String error) {

    public static SendResult ok(String to) {
        return new SendResult(true, to, null);
    }

    public static SendResult error(String error) {
        return new SendResult(false, null, error);
    }
}
