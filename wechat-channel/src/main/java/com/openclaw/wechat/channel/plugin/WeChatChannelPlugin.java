package com.openclaw.wechat.channel.plugin;

import com.openclaw.wechat.channel.WeChatChannel;
import com.openclaw.wechat.channel.WeChatStatePaths;
import com.openclaw.wechat.channel.account.AccountRegistry;
import com.openclaw.wechat.channel.connection.ConnectionManager;
import com.openclaw.wechat.channel.connection.LoggingScanPresenter;
import com.openclaw.wechat.channel.connection.SessionCredentialStore;
import com.openclaw.wechat.channel.contacts.ContactGraphIndex;
import com.openclaw.wechat.channel.contacts.WeChatDirectory;
import com.openclaw.wechat.channel.inbound.EnvelopeFormatter;
import com.openclaw.wechat.channel.inbound.InboundNormalizer;
import com.openclaw.wechat.channel.inbound.LocalMediaSaver;
import com.openclaw.wechat.channel.inbound.MediaSaver;
import com.openclaw.wechat.channel.inbound.WeChatMessageDispatcher;
import com.openclaw.wechat.channel.moments.ContextSink;
import com.openclaw.wechat.channel.moments.MomentsService;
import com.openclaw.wechat.channel.outbound.HttpMediaResolver;
import com.openclaw.wechat.channel.outbound.MediaResolver;
import com.openclaw.wechat.channel.outbound.ReplyDelivery;
import com.openclaw.wechat.channel.outbound.WeChatMessageActions;
import com.openclaw.wechat.channel.policy.AccessPolicyEngine;
import com.openclaw.wechat.channel.policy.JsonPairingStore;
import com.openclaw.wechat.channel.policy.PairingStore;
import com.openclaw.wechat.channel.protocol.ProtocolBackendFactory;
import com.openclaw.wechat.channel.voice.OpenAiWhisperTranscriber;
import com.openclaw.wechat.channel.voice.SystemVoiceTranscriber;
import com.openclaw.wechat.channel.voice.VoiceTranscription;
import com.openclaw.wechat.common.config.BridgeConfig;
import com.openclaw.wechat.common.config.ConfigService;
import com.openclaw.wechat.common.infra.KeyedSerialExecutor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point of the WeChat channel: wires accounts, connections, the
 * inbound pipeline, delivery and background services into a
 * {@link WeChatContext}.
 */
@Slf4j
public final class WeChatChannelPlugin {

    private WeChatChannelPlugin() {
    }

    static final long REMOTE_MEDIA_MAX_BYTES = 50L * 1024 * 1024;

    /**
     * Initialize from a config service; account settings are re-read from it
     * on every resolution.
     */
    public static WeChatContext initialize(ConfigService configService, WeChatCollaborators collaborators) {
        BridgeConfig initial = configService.loadConfig();
        return initialize(ConfigService.resolveStateDir(initial),
                () -> configService.loadConfig().channelSection(WeChatChannel.CHANNEL_ID), collaborators);
    }

    /**
     * Initialize from a fixed configuration.
     */
    public static WeChatContext initialize(BridgeConfig config, WeChatCollaborators collaborators) {
        return initialize(ConfigService.resolveStateDir(config),
                () -> config.channelSection(WeChatChannel.CHANNEL_ID), collaborators);
    }

    static WeChatContext initialize(Path stateDir, Supplier<Map<String, Object>> section,
            WeChatCollaborators collaborators) {
        Objects.requireNonNull(collaborators.getAgentDispatcher(), "agentDispatcher is required");
        Objects.requireNonNull(collaborators.getSessionRecorder(), "sessionRecorder is required");
        log.info("Initializing WeChat channel plugin (state dir: {})", stateDir);

        Function<String, String> env = collaborators.getEnv() != null ? collaborators.getEnv() : System::getenv;
        WeChatStatePaths paths = new WeChatStatePaths(stateDir);
        AccountRegistry registry = new AccountRegistry(section, env);

        PairingStore pairingStore = collaborators.getPairingStore() != null
                ? collaborators.getPairingStore()
                : new JsonPairingStore(paths.pairingFile());
        MediaSaver mediaSaver = collaborators.getMediaSaver() != null
                ? collaborators.getMediaSaver()
                : new LocalMediaSaver(stateDir.resolve("media").resolve("inbound"));
        MediaResolver mediaResolver = collaborators.getMediaResolver() != null
                ? collaborators.getMediaResolver()
                : new HttpMediaResolver(stateDir.resolve("media").resolve("outbound"), REMOTE_MEDIA_MAX_BYTES);
        VoiceTranscription voice = collaborators.getVoiceTranscription() != null
                ? collaborators.getVoiceTranscription()
                : new VoiceTranscription(new OpenAiWhisperTranscriber(), new SystemVoiceTranscriber());
        ContextSink contextSink = collaborators.getContextSink() != null
                ? collaborators.getContextSink()
                : (sessionKey, text, label) -> log.debug("No context sink configured, dropping {} context", label);
        ZoneId zone = collaborators.getEnvelopeZone() != null ? collaborators.getEnvelopeZone() : ZoneId.systemDefault();

        ReplyDelivery delivery = new ReplyDelivery(collaborators.getTableConverter(), mediaResolver);
        KeyedSerialExecutor executor = new KeyedSerialExecutor("wechat-dispatch", collaborators.getDispatchThreads());
        WeChatMessageDispatcher dispatcher = new WeChatMessageDispatcher(
                new InboundNormalizer(voice, mediaSaver),
                new AccessPolicyEngine(pairingStore),
                collaborators.getAgentRouter(),
                collaborators.getSessionRecorder(),
                collaborators.getAgentDispatcher(),
                delivery,
                new EnvelopeFormatter(zone),
                executor);

        ContactGraphIndex contactIndex = new ContactGraphIndex(paths);
        ConnectionManager connectionManager = new ConnectionManager(
                registry,
                new ProtocolBackendFactory(collaborators.getBackendProviders()),
                new SessionCredentialStore(paths),
                collaborators.getScanPresenter() != null ? collaborators.getScanPresenter() : new LoggingScanPresenter(),
                dispatcher,
                List.of(contactIndex, new MomentsService(paths, contextSink)));

        WeChatDirectory directory = new WeChatDirectory(registry, contactIndex);
        WeChatMessageActions actions = new WeChatMessageActions(registry, mediaResolver);

        log.info("WeChat channel plugin initialized ({} account(s) configured)", registry.listAccountIds().size());
        return new WeChatContext(registry, connectionManager, dispatcher, delivery, contactIndex, directory,
                actions, pairingStore, executor);
    }
}
