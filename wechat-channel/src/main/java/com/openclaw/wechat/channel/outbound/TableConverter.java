package com.openclaw.wechat.channel.outbound;

/**
 * Rewrites markdown tables before text is sent, since WeChat renders plain
 * text only.
 */
@FunctionalInterface
public interface TableConverter {

    TableConverter IDENTITY = text -> text;

    String convert(String markdown);
}
