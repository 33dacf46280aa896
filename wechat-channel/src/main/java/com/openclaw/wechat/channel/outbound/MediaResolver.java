package com.openclaw.wechat.channel.outbound;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns an outbound media reference into a local file the protocol client
 * can upload.
 */
@FunctionalInterface
public interface MediaResolver {

    Path resolve(String mediaRef) throws IOException;
}
