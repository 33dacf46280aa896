package com.openclaw.wechat.channel.contacts;

import com.openclaw.wechat.channel.account.AccountRegistry;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.channel.protocol.Identity;
import com.openclaw.wechat.channel.protocol.ProtocolBackend;
import com.openclaw.wechat.channel.protocol.Room;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Directory lookups for agents and tools: the logged-in user, known contacts
 * (from the contact index) and groups (live from the backend).
 */
@Slf4j
public class WeChatDirectory {

    static final int MAX_GROUPS = 100;

    private final AccountRegistry registry;
    private final ContactGraphIndex contactIndex;

    public WeChatDirectory(AccountRegistry registry, ContactGraphIndex contactIndex) {
        this.registry = registry;
        this.contactIndex = contactIndex;
    }

    public Optional<DirectoryEntry> self(String accountId) {
        Optional<ProtocolBackend> backend = loggedInBackend(resolveAccountId(accountId));
        if (backend.isEmpty()) {
            return Optional.empty();
        }
        Optional<Identity> user = backend.get().currentUser();
        return user.map(u -> DirectoryEntry.user(u.id(), u.name()));
    }

    /**
     * Contacts matching {@code query}; works from the persisted index even
     * when the account is not running.
     *
     * @param limit maximum entries, non-positive for all
     */
    public List<DirectoryEntry> listPeers(String accountId, String query, int limit) {
        List<ContactNode> contacts = contactIndex.search(query != null ? query : "", resolveAccountId(accountId));
        List<DirectoryEntry> result = new ArrayList<>();
        for (ContactNode node : contacts) {
            if (limit > 0 && result.size() >= limit)
                break;
            result.add(DirectoryEntry.user(node.wxid(), peerName(node)));
        }
        return result;
    }

    public List<DirectoryEntry> listGroups(String accountId) {
        String id = resolveAccountId(accountId);
        Optional<ProtocolBackend> backend = loggedInBackend(id);
        if (backend.isEmpty()) {
            return List.of();
        }
        try {
            List<DirectoryEntry> groups = new ArrayList<>();
            for (Room room : backend.get().listRooms()) {
                if (groups.size() >= MAX_GROUPS)
                    break;
                groups.add(DirectoryEntry.group(room.id(), room.topicOrId()));
            }
            return groups;
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to list WeChat groups: {}", id, ErrorUtils.formatErrorMessage(e));
            return List.of();
        }
    }

    private static String peerName(ContactNode node) {
        if (!node.displayName().isEmpty())
            return node.displayName();
        if (!node.remark().isEmpty())
            return node.remark();
        return node.wxid();
    }

    private String resolveAccountId(String accountId) {
        return accountId != null && !accountId.isBlank() ? accountId : registry.defaultAccountId();
    }

    private Optional<ProtocolBackend> loggedInBackend(String accountId) {
        return registry.connectionFor(accountId)
                .filter(connection -> !connection.isStopped())
                .map(WeChatConnection::backend)
                .filter(ProtocolBackend::isLoggedIn);
    }
}
