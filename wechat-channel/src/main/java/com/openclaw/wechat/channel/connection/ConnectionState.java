package com.openclaw.wechat.channel.connection;

/**
 * Lifecycle of one protocol session. Transitions only move forward;
 * a stopped connection is never restarted (a new one is created instead).
 */
public enum ConnectionState {
    CREATED,
    CONNECTING,
    AUTHENTICATED,
    RUNNING,
    STOPPED
}
