package com.openclaw.wechat.channel.protocol;

@FunctionalInterface
public interface ProtocolEventListener {

    void onEvent(ProtocolEvent event);
}
