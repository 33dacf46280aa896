package com.openclaw.wechat.channel;

/**
 * Invalid or incomplete WeChat account configuration: an unknown puppet, a
 * padlocal account without a token, an unrecognized policy value.
 * <p>
 * Raised while resolving or starting an account, never while handling messages.
 */
public class WeChatConfigException extends RuntimeException {

    public WeChatConfigException(String message) {
        super(message);
    }

    public WeChatConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
