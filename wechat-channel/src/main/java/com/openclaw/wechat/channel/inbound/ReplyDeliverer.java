package com.openclaw.wechat.channel.inbound;

import com.openclaw.wechat.channel.outbound.ReplyPayload;

/**
 * Reply path of one inbound message. May be called several times for
 * streamed replies.
 */
@FunctionalInterface
public interface ReplyDeliverer {

    void deliver(ReplyPayload payload);
}
