package com.openclaw.wechat.channel.plugin;

import com.openclaw.wechat.channel.connection.ScanPresenter;
import com.openclaw.wechat.channel.inbound.AgentDispatcher;
import com.openclaw.wechat.channel.inbound.AgentRouter;
import com.openclaw.wechat.channel.inbound.MediaSaver;
import com.openclaw.wechat.channel.inbound.SessionRecorder;
import com.openclaw.wechat.channel.moments.ContextSink;
import com.openclaw.wechat.channel.outbound.MediaResolver;
import com.openclaw.wechat.channel.outbound.TableConverter;
import com.openclaw.wechat.channel.policy.PairingStore;
import com.openclaw.wechat.channel.protocol.ProtocolBackendProvider;
import com.openclaw.wechat.channel.voice.VoiceTranscription;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.ZoneId;
import java.util.List;
import java.util.function.Function;

/**
 * Host-provided collaborators of the WeChat channel. Only
 * {@code backendProviders}, {@code agentDispatcher} and
 * {@code sessionRecorder} are required; the rest fall back to local defaults.
 */
@Getter
@Builder
public class WeChatCollaborators {

    @Singular
    private final List<ProtocolBackendProvider> backendProviders;
    private final AgentDispatcher agentDispatcher;
    private final SessionRecorder sessionRecorder;

    private final AgentRouter agentRouter;
    private final ContextSink contextSink;
    private final MediaSaver mediaSaver;
    private final MediaResolver mediaResolver;
    private final PairingStore pairingStore;
    private final ScanPresenter scanPresenter;
    private final TableConverter tableConverter;
    private final VoiceTranscription voiceTranscription;
    private final ZoneId envelopeZone;
    private final Function<String, String> env;

    @Builder.Default
    private final int dispatchThreads = 4;
}
