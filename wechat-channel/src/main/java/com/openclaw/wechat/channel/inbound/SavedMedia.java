package com.openclaw.wechat.channel.inbound;

import java.nio.file.Path;

public record SavedMedia(Path path, String contentType) {
}
