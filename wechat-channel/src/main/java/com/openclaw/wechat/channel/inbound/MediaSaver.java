package com.openclaw.wechat.channel.inbound;

import java.io.IOException;

/**
 * Stores inbound media where the agent can read it.
 */
@FunctionalInterface
public interface MediaSaver {

    /**
     * @throws IOException when the data exceeds {@code maxBytes} or cannot be written
     */
    SavedMedia save(byte[] data, String contentType, long maxBytes) throws IOException;
}
