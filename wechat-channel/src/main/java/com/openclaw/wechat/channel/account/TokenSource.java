package com.openclaw.wechat.channel.account;

/**
 * Where an account's padlocal token came from.
 */
public enum TokenSource {
    CONFIG,
    ENV,
    NONE
}
