package com.openclaw.wechat.channel.voice;

import com.openclaw.wechat.channel.account.ResolvedAccount.VoiceSettings;
import com.openclaw.wechat.channel.account.VoiceProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Picks the configured provider and manages the scratch files of one
 * transcription.
 */
@Slf4j
public class VoiceTranscription {

    private final VoiceTranscriber openAi;
    private final VoiceTranscriber system;

    public VoiceTranscription(VoiceTranscriber openAi, VoiceTranscriber system) {
        this.openAi = openAi;
        this.system = system;
    }

    /**
     * @return the transcript; empty when transcription is disabled or the
     *         provider produced nothing
     * @throws IOException when the provider failed
     */
    public Optional<String> transcribe(byte[] silkAudio, VoiceSettings settings) throws IOException {
        if (settings == null || !settings.transcribe()) {
            return Optional.empty();
        }
        VoiceTranscriber transcriber = settings.provider() == VoiceProvider.OPENAI ? openAi : system;

        Path workDir = Files.createTempDirectory("wechat-voice-");
        try {
            Path silk = workDir.resolve("voice.silk");
            Files.write(silk, silkAudio);
            return transcriber.transcribe(silk, workDir, settings);
        } finally {
            deleteRecursively(workDir);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
