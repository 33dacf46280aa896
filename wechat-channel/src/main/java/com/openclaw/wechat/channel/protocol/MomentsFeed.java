package com.openclaw.wechat.channel.protocol;

import java.util.List;

/**
 * Moments capability of a backend. Only some puppets provide it.
 */
@FunctionalInterface
public interface MomentsFeed {

    /**
     * Fetch up to {@code count} most recent posts, newest first.
     */
    List<MomentEntry> fetchRecent(int count);
}
