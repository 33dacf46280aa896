package com.openclaw.wechat.channel.policy;

/**
 * Text sent to an unknown sender when a pairing request is opened.
 */
public final class PairingReplies {

    private PairingReplies() {
    }

    public static String build(String channel, String idLine, String code) {
        return "OpenClaw: access not configured.\n\n"
                + idLine + "\n\n"
                + "Pairing code: " + code + "\n\n"
                + "Ask the bot owner to approve with:\n"
                + "openclaw pairing approve " + channel + " " + code;
    }
}
