package com.openclaw.wechat.channel.protocol;

public record UrlLink(String title, String url) {
}
