package com.openclaw.wechat.channel.policy;

import com.openclaw.wechat.channel.WeChatChannel;
import com.openclaw.wechat.channel.account.DmPolicy;
import com.openclaw.wechat.channel.account.GroupPolicy;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether an inbound message reaches the agent.
 * <p>
 * Groups: {@code disabled} blocks; otherwise the mention gate applies when
 * {@code requireMention} is set, and a failing mention check blocks.
 * Direct messages: {@code disabled} blocks, {@code open} admits, everything
 * else admits senders on the configured or paired allow list. Unknown
 * senders under {@code pairing} get a pairing request, and exactly one reply
 * per created request.
 */
@Slf4j
public class AccessPolicyEngine {

    private final PairingStore pairingStore;

    public AccessPolicyEngine(PairingStore pairingStore) {
        this.pairingStore = pairingStore;
    }

    public AccessDecision evaluate(ResolvedAccount account, AccessRequest request) {
        if (request.group()) {
            return evaluateGroup(account, request);
        }
        return evaluateDirect(account, request);
    }

    // =========================================================================
    // Groups
    // =========================================================================

    private AccessDecision evaluateGroup(ResolvedAccount account, AccessRequest request) {
        if (account.groupPolicy() == GroupPolicy.DISABLED) {
            log.debug("[{}] Group messages disabled, dropping message from {}", account.accountId(),
                    request.senderId());
            return AccessDecision.BLOCKED;
        }
        if (!account.requireMention()) {
            return AccessDecision.ALLOWED;
        }
        boolean mentioned;
        try {
            mentioned = request.mentionCheck().getAsBoolean();
        } catch (RuntimeException e) {
            log.debug("[{}] Mention check failed, dropping group message: {}", account.accountId(),
                    ErrorUtils.formatErrorMessage(e));
            return AccessDecision.BLOCKED;
        }
        if (!mentioned) {
            log.debug("[{}] Group message without mention skipped", account.accountId());
            return AccessDecision.BLOCKED;
        }
        return AccessDecision.ALLOWED;
    }

    // =========================================================================
    // Direct messages
    // =========================================================================

    private AccessDecision evaluateDirect(ResolvedAccount account, AccessRequest request) {
        DmPolicy policy = account.dmPolicy();
        if (policy == DmPolicy.DISABLED) {
            log.debug("[{}] Blocked WeChat DM from {} (dmPolicy=disabled)", account.accountId(),
                    request.senderId());
            return AccessDecision.BLOCKED;
        }
        if (policy == DmPolicy.OPEN) {
            return AccessDecision.ALLOWED;
        }

        List<String> effective = effectiveAllowFrom(account);
        WeChatAllowlist.AllowMatch match = WeChatAllowlist.match(effective, request.senderId());
        if (match.allowed()) {
            return AccessDecision.ALLOWED;
        }

        if (policy != DmPolicy.PAIRING) {
            log.debug("[{}] Blocked unauthorized WeChat sender {} (dmPolicy={})", account.accountId(),
                    request.senderId(), policy.value());
            return AccessDecision.BLOCKED;
        }
        return openPairing(account, request);
    }

    private List<String> effectiveAllowFrom(ResolvedAccount account) {
        List<String> merged = new ArrayList<>(account.allowFrom());
        try {
            merged.addAll(pairingStore.readAllowFrom(WeChatChannel.CHANNEL_ID));
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to read pairing allow list: {}", account.accountId(),
                    ErrorUtils.formatErrorMessage(e));
        }
        return merged;
    }

    private AccessDecision openPairing(ResolvedAccount account, AccessRequest request) {
        Map<String, String> meta = new LinkedHashMap<>();
        if (request.senderName() != null) {
            meta.put("name", request.senderName());
        }

        PairingStore.UpsertResult result;
        try {
            result = pairingStore.upsertRequest(WeChatChannel.CHANNEL_ID, request.senderId(), meta);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to create pairing request for {}: {}", account.accountId(),
                    request.senderId(), ErrorUtils.formatErrorMessage(e), e);
            return AccessDecision.PAIRING_PENDING;
        }

        if (result.created()) {
            log.info("[{}] WeChat pairing request from {} ({})", account.accountId(), request.senderId(),
                    request.senderName());
            String text = PairingReplies.build(WeChatChannel.CHANNEL_ID,
                    "Your WeChat id: " + request.senderId(), result.code());
            try {
                request.replySender().send(request.senderId(), text);
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to send pairing reply to {}: {}", account.accountId(),
                        request.senderId(), ErrorUtils.formatErrorMessage(e));
            }
        } else {
            log.debug("[{}] Pairing already pending for {}", account.accountId(), request.senderId());
        }
        return AccessDecision.PAIRING_PENDING;
    }
}
