package com.openclaw.wechat.channel;

/**
 * Channel-wide identifiers shared by every WeChat component.
 */
public final class WeChatChannel {

    private WeChatChannel() {
    }

    public static final String CHANNEL_ID = "wechat";
    public static final String DISPLAY_NAME = "WeChat";
    public static final String DEFAULT_ACCOUNT_ID = "default";
}
