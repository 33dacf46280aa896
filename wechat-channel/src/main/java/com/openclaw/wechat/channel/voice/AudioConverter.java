package com.openclaw.wechat.channel.voice;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts an audio file into the format implied by the output file name.
 */
@FunctionalInterface
public interface AudioConverter {

    void convert(Path input, Path output) throws IOException;
}
