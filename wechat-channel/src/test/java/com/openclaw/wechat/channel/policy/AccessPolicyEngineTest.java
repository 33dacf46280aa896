package com.openclaw.wechat.channel.policy;

import com.openclaw.wechat.channel.TestAccounts;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyEngineTest {

    private final InMemoryPairingStore store = new InMemoryPairingStore();
    private final AccessPolicyEngine engine = new AccessPolicyEngine(store);
    private final List<String> replies = new ArrayList<>();

    private AccessRequest dm(String senderId) {
        return AccessRequest.direct(senderId, "Alice", (id, text) -> replies.add(id + "|" + text));
    }

    // =========================================================================
    // Direct messages
    // =========================================================================

    @Test
    void disabledDm_blocksEvenAllowListedSender() {
        ResolvedAccount account = TestAccounts.account(Map.of("dmPolicy", "disabled", "allowFrom", List.of("*")));
        assertEquals(AccessDecision.BLOCKED, engine.evaluate(account, dm("wxid_abc")));
        assertTrue(replies.isEmpty());
    }

    @Test
    void openDm_allowsAnyone() {
        ResolvedAccount account = TestAccounts.account(Map.of("dmPolicy", "open"));
        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account, dm("wxid_stranger")));
    }

    @Test
    void allowlistDm_matchesPrefixedEntry() {
        ResolvedAccount account = TestAccounts.account(Map.of("dmPolicy", "allowlist",
                "allowFrom", List.of("wechat:wxid_abc123")));
        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account, dm("wxid_abc123")));
        assertEquals(AccessDecision.BLOCKED, engine.evaluate(account, dm("wxid_other")));
        assertTrue(replies.isEmpty());
    }

    @Test
    void wildcard_allowsUnderPairing() {
        ResolvedAccount account = TestAccounts.account(Map.of("allowFrom", List.of("*")));
        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account, dm("wxid_anyone")));
    }

    @Test
    void pairing_repliesOncePerRequest() {
        ResolvedAccount account = TestAccounts.account();

        assertEquals(AccessDecision.PAIRING_PENDING, engine.evaluate(account, dm("wxid_new")));
        assertEquals(AccessDecision.PAIRING_PENDING, engine.evaluate(account, dm("wxid_new")));

        assertEquals(1, replies.size());
        assertTrue(replies.get(0).startsWith("wxid_new|"));
        assertTrue(replies.get(0).contains("Your WeChat id: wxid_new"));
        assertTrue(replies.get(0).contains("Pairing code: CODE0001"));
        assertEquals("Alice", store.pending.get("wxid_new").meta().get("name"));
    }

    @Test
    void pairedSender_isAllowedAfterApproval() {
        ResolvedAccount account = TestAccounts.account();
        engine.evaluate(account, dm("wxid_new"));
        store.approve("wechat", "CODE0001");

        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account, dm("wxid_new")));
    }

    @Test
    void storeReadFailure_fallsBackToConfigAllowList() {
        store.failReads = true;
        ResolvedAccount account = TestAccounts.account(Map.of("allowFrom", List.of("wxid_cfg")));

        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account, dm("wxid_cfg")));
        assertEquals(AccessDecision.PAIRING_PENDING, engine.evaluate(account, dm("wxid_new")));
    }

    @Test
    void replyFailure_stillPending() {
        ResolvedAccount account = TestAccounts.account();
        AccessRequest request = AccessRequest.direct("wxid_new", "Alice", (id, text) -> {
            throw new IllegalStateException("contact not found");
        });

        assertEquals(AccessDecision.PAIRING_PENDING, engine.evaluate(account, request));
        assertEquals(1, store.pending.size());
    }

    // =========================================================================
    // Groups
    // =========================================================================

    @Test
    void group_disabledBlocks() {
        ResolvedAccount account = TestAccounts.account(Map.of("groupPolicy", "disabled"));
        assertEquals(AccessDecision.BLOCKED, engine.evaluate(account,
                AccessRequest.group("wxid_abc", "Alice", () -> true)));
    }

    @Test
    void group_requiresMentionByDefault() {
        ResolvedAccount account = TestAccounts.account();
        assertEquals(AccessDecision.BLOCKED, engine.evaluate(account,
                AccessRequest.group("wxid_abc", "Alice", () -> false)));
        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account,
                AccessRequest.group("wxid_abc", "Alice", () -> true)));
    }

    @Test
    void group_mentionCheckFailureBlocks() {
        ResolvedAccount account = TestAccounts.account();
        assertEquals(AccessDecision.BLOCKED, engine.evaluate(account,
                AccessRequest.group("wxid_abc", "Alice", () -> {
                    throw new IllegalStateException("boom");
                })));
    }

    @Test
    void group_withoutMentionRequirementAllows() {
        ResolvedAccount account = TestAccounts.account(Map.of("requireMention", false));
        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account,
                AccessRequest.group("wxid_abc", "Alice", () -> false)));
    }

    @Test
    void group_ignoresDmAllowList() {
        ResolvedAccount account = TestAccounts.account(Map.of("dmPolicy", "disabled"));
        assertEquals(AccessDecision.ALLOWED, engine.evaluate(account,
                AccessRequest.group("wxid_stranger", "Eve", () -> true)));
        assertTrue(store.pending.isEmpty());
    }
}
