package com.openclaw.wechat.channel.inbound;

import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.protocol.Peer;
import com.openclaw.wechat.channel.protocol.RawMessage;
import com.openclaw.wechat.channel.protocol.UrlLink;
import com.openclaw.wechat.channel.voice.VoiceTranscription;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Turns a raw message of any kind into agent-readable text, saving media on
 * the way. Collaborator failures degrade to placeholders; only kinds the
 * agent cannot use are dropped.
 */
@Slf4j
public class InboundNormalizer {

    static final String VOICE_PLACEHOLDER = "[Voice message]";
    static final String VOICE_UNAVAILABLE = "[Voice message — transcription unavailable]";
    static final String VOICE_FAILED = "[Voice message — transcription failed]";
    static final String MEDIA_PLACEHOLDER = "<media>";
    static final String CONTACT_UNKNOWN = "<contact: unknown>";
    static final String LINK_UNKNOWN = "<link: unknown>";

    private final VoiceTranscription voiceTranscription;
    private final MediaSaver mediaSaver;

    public InboundNormalizer(VoiceTranscription voiceTranscription, MediaSaver mediaSaver) {
        this.voiceTranscription = voiceTranscription;
        this.mediaSaver = mediaSaver;
    }

    /**
     * @return the normalized content, empty when the message should be dropped
     */
    public Optional<NormalizedInbound> normalize(ResolvedAccount account, RawMessage message) {
        switch (message.kind()) {
            case TEXT:
                return nonBlank(message.text()).map(NormalizedInbound::text);
            case AUDIO:
                return Optional.of(NormalizedInbound.text(voice(account, message)));
            case IMAGE:
                return media(account, message, "image/jpeg");
            case VIDEO:
                return media(account, message, "video/mp4");
            case CONTACT_CARD:
                return Optional.of(NormalizedInbound.text(contact(account, message)));
            case URL:
                return Optional.of(NormalizedInbound.text(link(account, message)));
            default:
                log.debug("[{}] Ignoring {} message {}", account.accountId(), message.kind(), message.id());
                return Optional.empty();
        }
    }

    private String voice(ResolvedAccount account, RawMessage message) {
        if (!account.voice().transcribe()) {
            return VOICE_PLACEHOLDER;
        }
        try {
            byte[] audio = message.downloadMedia();
            Optional<String> transcript = voiceTranscription.transcribe(audio, account.voice());
            return transcript.map(text -> "[Voice: " + text + "]").orElse(VOICE_UNAVAILABLE);
        } catch (Exception e) {
            log.warn("[{}] Voice transcription failed: {}", account.accountId(), ErrorUtils.formatErrorMessage(e));
            return VOICE_FAILED;
        }
    }

    private Optional<NormalizedInbound> media(ResolvedAccount account, RawMessage message, String contentType) {
        SavedMedia saved = null;
        try {
            byte[] data = message.downloadMedia();
            saved = mediaSaver.save(data, contentType, account.mediaMaxBytes());
        } catch (Exception e) {
            log.warn("[{}] Failed to save {} media: {}", account.accountId(), contentType,
                    ErrorUtils.formatErrorMessage(e));
        }

        Optional<String> caption = nonBlank(message.text());
        if (caption.isPresent()) {
            return Optional.of(new NormalizedInbound(caption.get(), saved));
        }
        if (saved != null) {
            return Optional.of(new NormalizedInbound(MEDIA_PLACEHOLDER, saved));
        }
        return Optional.empty();
    }

    private String contact(ResolvedAccount account, RawMessage message) {
        try {
            Optional<Peer> card = message.contactCard();
            if (card.isPresent()) {
                Peer peer = card.get();
                return "<contact: " + peer.name() + " (" + peer.id() + ")>";
            }
        } catch (RuntimeException e) {
            log.debug("[{}] Contact card unreadable: {}", account.accountId(), ErrorUtils.formatErrorMessage(e));
        }
        return CONTACT_UNKNOWN;
    }

    private String link(ResolvedAccount account, RawMessage message) {
        try {
            Optional<UrlLink> link = message.urlLink();
            if (link.isPresent()) {
                return "<link: " + link.get().title() + " — " + link.get().url() + ">";
            }
        } catch (RuntimeException e) {
            log.debug("[{}] Link unreadable: {}", account.accountId(), ErrorUtils.formatErrorMessage(e));
        }
        return LINK_UNKNOWN;
    }

    private static Optional<String> nonBlank(String text) {
        if (text == null)
            return Optional.empty();
        String trimmed = text.trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }
}
