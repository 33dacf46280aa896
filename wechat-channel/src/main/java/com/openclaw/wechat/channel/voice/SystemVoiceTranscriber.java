package com.openclaw.wechat.channel.voice;

import com.openclaw.wechat.channel.account.ResolvedAccount.VoiceSettings;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * On-device speech recognition. Only macOS offers one, and no bridge to it
 * exists yet, so every call yields no transcript.
 */
@Slf4j
public class SystemVoiceTranscriber implements VoiceTranscriber {

    private final String osName;

    public SystemVoiceTranscriber() {
        this(System.getProperty("os.name", ""));
    }

    SystemVoiceTranscriber(String osName) {
        this.osName = osName;
    }

    @Override
    public Optional<String> transcribe(Path silkFile, Path workDir, VoiceSettings settings) {
        if (!osName.toLowerCase(Locale.ROOT).contains("mac")) {
            log.warn("System voice transcription is only available on macOS; set voice.provider to openai");
            return Optional.empty();
        }
        log.debug("macOS speech recognition bridge not available, skipping transcription");
        return Optional.empty();
    }
}
