package com.openclaw.wechat.channel.moments;

/**
 * Receives background context for the agent; the text is informational and
 * never answered.
 */
@FunctionalInterface
public interface ContextSink {

    void inject(String sessionKey, String text, String label);
}
