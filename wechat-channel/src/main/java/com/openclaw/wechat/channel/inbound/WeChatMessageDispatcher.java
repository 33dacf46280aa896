package com.openclaw.wechat.channel.inbound;

import com.openclaw.wechat.channel.WeChatChannel;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.connection.ConnectionMessageListener;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.channel.outbound.ReplyDelivery;
import com.openclaw.wechat.channel.policy.AccessDecision;
import com.openclaw.wechat.channel.policy.AccessPolicyEngine;
import com.openclaw.wechat.channel.policy.AccessRequest;
import com.openclaw.wechat.channel.protocol.Peer;
import com.openclaw.wechat.channel.protocol.ProtocolException;
import com.openclaw.wechat.channel.protocol.RawMessage;
import com.openclaw.wechat.channel.protocol.Room;
import com.openclaw.wechat.common.infra.ErrorUtils;
import com.openclaw.wechat.common.infra.KeyedSerialExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Inbound pipeline: filter, normalize, admit, route, record and dispatch.
 * <p>
 * Self-sent and stale messages are dropped on the backend's event thread.
 * Everything else runs on a {@link KeyedSerialExecutor}, one pipeline at a
 * time per chat, so the event thread never waits on transcription, media or
 * the agent.
 */
@Slf4j
public class WeChatMessageDispatcher implements ConnectionMessageListener {

    static final long MAX_MESSAGE_AGE_SECONDS = 60;

    private final InboundNormalizer normalizer;
    private final AccessPolicyEngine policyEngine;
    private final AgentRouter router;
    private final SessionRecorder sessionRecorder;
    private final AgentDispatcher agentDispatcher;
    private final ReplyDelivery delivery;
    private final EnvelopeFormatter envelopeFormatter;
    private final KeyedSerialExecutor executor;

    public WeChatMessageDispatcher(InboundNormalizer normalizer,
            AccessPolicyEngine policyEngine,
            AgentRouter router,
            SessionRecorder sessionRecorder,
            AgentDispatcher agentDispatcher,
            ReplyDelivery delivery,
            EnvelopeFormatter envelopeFormatter,
            KeyedSerialExecutor executor) {
        this.normalizer = normalizer;
        this.policyEngine = policyEngine;
        this.router = router;
        this.sessionRecorder = sessionRecorder;
        this.agentDispatcher = agentDispatcher;
        this.delivery = delivery;
        this.envelopeFormatter = envelopeFormatter;
        this.executor = executor;
    }

    @Override
    public void onMessage(WeChatConnection connection, RawMessage message) {
        if (message.self()) {
            return;
        }
        if (message.ageSeconds() > MAX_MESSAGE_AGE_SECONDS) {
            log.debug("[{}] Skipping stale message {} ({}s old)", connection.accountId(), message.id(),
                    message.ageSeconds());
            return;
        }
        connection.recordInbound();

        String chatId = chatId(message);
        executor.submit(connection.accountId() + ":" + chatId, () -> process(connection, message, chatId));
    }

    /**
     * Full pipeline for one message. Completes when the agent is done with it;
     * never completes exceptionally.
     */
    CompletableFuture<Void> process(WeChatConnection connection, RawMessage message, String chatId) {
        String accountId = connection.accountId();
        if (connection.isStopped()) {
            log.debug("[{}] Dropping message {} after stop", accountId, message.id());
            return CompletableFuture.completedFuture(null);
        }
        try {
            return handle(connection, message, chatId);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to handle WeChat message {}: {}", accountId, message.id(),
                    ErrorUtils.formatErrorMessage(e), e);
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> handle(WeChatConnection connection, RawMessage message, String chatId) {
        ResolvedAccount account = connection.account();
        String accountId = account.accountId();

        Optional<NormalizedInbound> normalized = normalizer.normalize(account, message);
        if (normalized.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        Optional<Room> room = message.room();
        boolean group = room.isPresent();
        Peer talker = message.talker();
        String senderId = talker.id();
        String senderName = talker.name();

        MentionMemo mention = new MentionMemo(message::mentionsSelf);
        AccessRequest request = group
                ? AccessRequest.group(senderId, senderName, mention)
                : AccessRequest.direct(senderId, senderName, (id, text) -> sendPairingReply(connection, id, text));
        AccessDecision decision = policyEngine.evaluate(account, request);
        if (!decision.admitted()) {
            return CompletableFuture.completedFuture(null);
        }

        RoutePeer peer = group ? RoutePeer.group(chatId) : RoutePeer.direct(chatId);
        AgentRoute route = resolveRoute(accountId, peer);
        Long previousTimestamp = readPreviousTimestamp(accountId, route.sessionKey());

        long timestamp = message.timestamp().map(Instant::toEpochMilli).orElseGet(System::currentTimeMillis);
        String topic = room.map(Room::topic).orElse(null);
        String fromLabel = EnvelopeFormatter.fromLabel(group, topic, chatId, senderName, senderId);
        String envelopeFrom = group
                ? (senderName != null && !senderName.isBlank() ? senderName : senderId) + " in " + fromLabel
                : fromLabel;
        String rawBody = normalized.get().text();
        String body = envelopeFormatter.format(WeChatChannel.DISPLAY_NAME, envelopeFrom, timestamp,
                previousTimestamp, rawBody);

        SavedMedia media = normalized.get().media();
        InboundEnvelope envelope = new InboundEnvelope(
                WeChatChannel.CHANNEL_ID,
                accountId,
                route.agentId(),
                route.sessionKey(),
                body,
                rawBody,
                group ? WeChatChannel.CHANNEL_ID + ":group:" + chatId : WeChatChannel.CHANNEL_ID + ":" + senderId,
                WeChatChannel.CHANNEL_ID + ":" + chatId,
                chatId,
                peer.kind(),
                senderId,
                senderName,
                group ? room.get().topicOrId() : null,
                message.id(),
                timestamp,
                group && mention.valueOrFalse(),
                media != null ? media.path() : null,
                media != null ? media.contentType() : null);

        try {
            sessionRecorder.recordInbound(envelope);
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to record inbound session {}: {}", accountId, route.sessionKey(),
                    ErrorUtils.formatErrorMessage(e));
        }

        ReplyDeliverer deliverer = payload -> delivery.deliver(connection, chatId, payload);
        CompletableFuture<Void> dispatched;
        try {
            dispatched = agentDispatcher.dispatch(envelope, deliverer);
        } catch (RuntimeException e) {
            dispatched = CompletableFuture.failedFuture(e);
        }
        if (dispatched == null) {
            return CompletableFuture.completedFuture(null);
        }
        return dispatched.exceptionally(error -> {
            log.error("[{}] WeChat reply failed: {}", accountId, ErrorUtils.formatErrorMessage(error));
            return null;
        });
    }

    private AgentRoute resolveRoute(String accountId, RoutePeer peer) {
        if (router != null) {
            try {
                AgentRoute route = router.resolveRoute(WeChatChannel.CHANNEL_ID, accountId, peer);
                if (route != null) {
                    return route;
                }
            } catch (RuntimeException e) {
                log.warn("[{}] Route resolution failed, using default route: {}", accountId,
                        ErrorUtils.formatErrorMessage(e));
            }
        }
        return AgentRouter.fallbackRoute(WeChatChannel.CHANNEL_ID, accountId, peer);
    }

    private Long readPreviousTimestamp(String accountId, String sessionKey) {
        try {
            return sessionRecorder.readUpdatedAt(sessionKey).orElse(null);
        } catch (RuntimeException e) {
            log.debug("[{}] Could not read session {}: {}", accountId, sessionKey, ErrorUtils.formatErrorMessage(e));
            return null;
        }
    }

    private void sendPairingReply(WeChatConnection connection, String senderId, String text) {
        Peer peer = connection.backend().lookupPeer(senderId)
                .orElseThrow(() -> new ProtocolException("Contact not found: " + senderId));
        connection.backend().sendText(peer.id(), text);
        connection.recordOutbound();
    }

    static String chatId(RawMessage message) {
        return message.room().map(Room::id).orElseGet(() -> message.talker().id());
    }

    /**
     * Evaluates the mention check at most once; the policy engine and the
     * envelope both need it.
     */
    private static final class MentionMemo implements BooleanSupplier {
        private final BooleanSupplier delegate;
        private Boolean value;

        MentionMemo(BooleanSupplier delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean getAsBoolean() {
            if (value == null) {
                value = delegate.getAsBoolean();
            }
            return value;
        }

        boolean valueOrFalse() {
            try {
                return getAsBoolean();
            } catch (RuntimeException e) {
                log.debug("Mention check failed: {}", ErrorUtils.formatErrorMessage(e));
                return false;
            }
        }
    }
}
