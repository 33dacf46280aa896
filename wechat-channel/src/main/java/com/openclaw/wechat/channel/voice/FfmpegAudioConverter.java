package com.openclaw.wechat.channel.voice;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link AudioConverter} backed by an {@code ffmpeg} subprocess.
 */
@Slf4j
public class FfmpegAudioConverter implements AudioConverter {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String executable;
    private final Duration timeout;

    public FfmpegAudioConverter() {
        this("ffmpeg", DEFAULT_TIMEOUT);
    }

    public FfmpegAudioConverter(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    List<String> command(Path input, Path output) {
        return List.of(executable, "-i", input.toString(), "-y", output.toString());
    }

    @Override
    public void convert(Path input, Path output) throws IOException {
        Process process = new ProcessBuilder(command(input, output))
                .redirectErrorStream(true)
                .start();
        try {
            // ffmpeg writes progress to stderr; read it so the pipe never fills
            String processOutput;
            try (InputStream in = process.getInputStream()) {
                processOutput = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("ffmpeg timed out after " + timeout.toSeconds() + "s");
            }
            if (process.exitValue() != 0) {
                log.debug("ffmpeg output: {}", processOutput);
                throw new IOException("ffmpeg exited with code " + process.exitValue());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("ffmpeg interrupted", e);
        }
    }
}
