package com.openclaw.wechat.channel.voice;

import com.openclaw.wechat.channel.account.ResolvedAccount.VoiceSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Speech-to-text for one voice clip.
 */
public interface VoiceTranscriber {

    /**
     * @param silkFile the clip as delivered by WeChat (SILK encoded)
     * @param workDir  scratch directory for intermediate files, deleted by the caller
     * @return the transcript, empty when this provider cannot produce one
     * @throws IOException when transcription was attempted and failed
     */
    Optional<String> transcribe(Path silkFile, Path workDir, VoiceSettings settings) throws IOException;
}
