package com.openclaw.wechat.channel.inbound;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;

/**
 * {@link MediaSaver} writing into a directory, one random file name per item.
 */
@Slf4j
public class LocalMediaSaver implements MediaSaver {

    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/png", ".png",
            "video/mp4", ".mp4",
            "audio/silk", ".silk");

    private final Path directory;

    public LocalMediaSaver(Path directory) {
        this.directory = directory;
    }

    @Override
    public SavedMedia save(byte[] data, String contentType, long maxBytes) throws IOException {
        if (data == null || data.length == 0) {
            throw new IOException("No media data");
        }
        if (maxBytes > 0 && data.length > maxBytes) {
            throw new IOException("Media exceeds " + maxBytes + " bytes (" + data.length + ")");
        }
        Files.createDirectories(directory);
        Path target = directory.resolve(UUID.randomUUID() + EXTENSIONS.getOrDefault(contentType, ".bin"));
        Files.write(target, data);
        log.debug("Saved inbound media {} ({} bytes)", target, data.length);
        return new SavedMedia(target, contentType);
    }
}
