package com.openclaw.wechat.channel.protocol;

/**
 * Logged-in WeChat user.
 */
public record Identity(String id, String name) {
}
