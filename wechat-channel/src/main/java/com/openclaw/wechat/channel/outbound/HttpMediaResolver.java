package com.openclaw.wechat.channel.outbound;

import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * {@link MediaResolver} for local paths, {@code file:} URIs and http(s) URLs.
 * Remote media is downloaded into a temp directory, capped at
 * {@code maxBytes}.
 */
@Slf4j
public class HttpMediaResolver implements MediaResolver {

    private final OkHttpClient httpClient;
    private final Path downloadDir;
    private final long maxBytes;

    public HttpMediaResolver(Path downloadDir, long maxBytes) {
        this(new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .build(), downloadDir, maxBytes);
    }

    HttpMediaResolver(OkHttpClient httpClient, Path downloadDir, long maxBytes) {
        this.httpClient = httpClient;
        this.downloadDir = downloadDir;
        this.maxBytes = maxBytes;
    }

    @Override
    public Path resolve(String mediaRef) throws IOException {
        if (mediaRef == null || mediaRef.isBlank()) {
            throw new IOException("Empty media reference");
        }
        String ref = mediaRef.trim();
        if (ref.startsWith("http://") || ref.startsWith("https://")) {
            return download(ref);
        }
        Path path = ref.startsWith("file:") ? Path.of(URI.create(ref)) : Path.of(ref);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Media file not found: " + path);
        }
        return path;
    }

    private Path download(String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("Media download failed: HTTP " + response.code() + " for " + url);
            }
            if (body.contentLength() > maxBytes) {
                throw new IOException("Media exceeds " + maxBytes + " bytes: " + url);
            }

            Files.createDirectories(downloadDir);
            Path target = downloadDir.resolve(fileName(request.url()));
            long copied = 0;
            try (InputStream in = body.byteStream(); OutputStream out = Files.newOutputStream(target)) {
                byte[] buffer = new byte[8192];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    copied += read;
                    if (copied > maxBytes) {
                        throw new IOException("Media exceeds " + maxBytes + " bytes: " + url);
                    }
                    out.write(buffer, 0, read);
                }
            } catch (IOException e) {
                Files.deleteIfExists(target);
                throw e;
            }
            log.debug("Downloaded {} ({} bytes) to {}", url, copied, target);
            return target;
        }
    }

    private static String fileName(HttpUrl url) {
        String last = url.pathSegments().isEmpty() ? "" : url.pathSegments().get(url.pathSegments().size() - 1);
        String safe = last.replaceAll("[^a-zA-Z0-9._-]+", "_");
        String prefix = Long.toHexString(System.nanoTime());
        return safe.isEmpty() || safe.startsWith(".") ? prefix + ".bin" : prefix + "-" + safe;
    }
}
