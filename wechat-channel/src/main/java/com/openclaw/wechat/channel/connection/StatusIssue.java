package com.openclaw.wechat.channel.connection;

public record StatusIssue(String channel, String accountId, String kind, String message, String fix) {
}
