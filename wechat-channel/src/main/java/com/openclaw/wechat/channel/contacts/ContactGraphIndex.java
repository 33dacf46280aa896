package com.openclaw.wechat.channel.contacts;

import com.fasterxml.jackson.core.type.TypeReference;
import com.openclaw.wechat.channel.WeChatStatePaths;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.connection.SessionService;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.channel.protocol.Peer;
import com.openclaw.wechat.channel.protocol.ProtocolBackend;
import com.openclaw.wechat.channel.protocol.Room;
import com.openclaw.wechat.common.infra.ErrorUtils;
import com.openclaw.wechat.common.infra.JsonFile;
import com.openclaw.wechat.common.infra.RecurringTask;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-account index of contacts and shared groups.
 * <p>
 * Built on login and refreshed on an interval. A rebuild replaces the whole
 * index at once, so readers see either the old or the new snapshot. The
 * index is persisted to {@code contacts.json} and loaded lazily on first
 * search after a restart.
 */
@Slf4j
public class ContactGraphIndex implements SessionService {

    private static final TypeReference<List<ContactNode>> NODE_LIST = new TypeReference<>() {
    };

    private final WeChatStatePaths paths;
    private final ConcurrentHashMap<String, List<ContactNode>> indexes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RecurringTask> refreshTasks = new ConcurrentHashMap<>();

    public ContactGraphIndex(WeChatStatePaths paths) {
        this.paths = paths;
    }

    // =========================================================================
    // Build
    // =========================================================================

    /**
     * Enumerate rooms and contacts and replace the account's index.
     * A room whose member list cannot be read is skipped; the own contact is
     * never indexed.
     *
     * @return the new index
     */
    public List<ContactNode> rebuild(String accountId, ProtocolBackend backend) {
        List<ContactNode> snapshot = build(accountId, backend);
        publish(accountId, snapshot);
        return snapshot;
    }

    private List<ContactNode> build(String accountId, ProtocolBackend backend) {
        Map<String, List<Room>> membership = new HashMap<>();
        for (Room room : backend.listRooms()) {
            List<Peer> members;
            try {
                members = backend.roomMembers(room.id());
            } catch (RuntimeException e) {
                log.debug("[{}] Skipping room {}: {}", accountId, room.id(), ErrorUtils.formatErrorMessage(e));
                continue;
            }
            for (Peer member : members) {
                membership.computeIfAbsent(member.id(), id -> new ArrayList<>()).add(room);
            }
        }

        List<ContactNode> nodes = new ArrayList<>();
        for (Peer peer : backend.listPeers()) {
            if (peer.self()) {
                continue;
            }
            List<Room> rooms = membership.getOrDefault(peer.id(), List.of());
            nodes.add(new ContactNode(
                    peer.id(),
                    peer.name(),
                    peer.alias(),
                    List.of(),
                    rooms.stream().map(Room::id).toList(),
                    rooms.stream().map(Room::topicOrId).toList(),
                    null));
        }

        log.info("[{}] Contact index built: {} contacts, {} rooms with members", accountId, nodes.size(),
                membership.values().stream().flatMap(List::stream).map(Room::id).distinct().count());
        return List.copyOf(nodes);
    }

    private void publish(String accountId, List<ContactNode> snapshot) {
        indexes.put(accountId, snapshot);
        persist(accountId, snapshot);
    }

    private void persist(String accountId, List<ContactNode> nodes) {
        Path file = paths.contactsFile(accountId);
        try {
            JsonFile.save(file, nodes);
        } catch (IOException e) {
            log.error("[{}] Failed to persist contact index: {}", accountId, ErrorUtils.formatErrorMessage(e));
        }
    }

    // =========================================================================
    // Search
    // =========================================================================

    /**
     * Contacts matching {@code query}; all contacts for a blank query. An
     * account without an index, in memory or on disk, yields an empty list.
     */
    public List<ContactNode> search(String query, String accountId) {
        List<ContactNode> nodes = indexes.get(accountId);
        if (nodes == null) {
            nodes = loadPersisted(accountId);
            if (nodes == null) {
                return List.of();
            }
        }
        if (query == null || query.isBlank()) {
            return nodes;
        }
        String lower = query.trim().toLowerCase(Locale.ROOT);
        return nodes.stream().filter(node -> node.matches(lower)).toList();
    }

    private List<ContactNode> loadPersisted(String accountId) {
        List<ContactNode> loaded = JsonFile.load(paths.contactsFile(accountId), NODE_LIST);
        if (loaded == null) {
            return null;
        }
        List<ContactNode> snapshot = List.copyOf(loaded);
        List<ContactNode> existing = indexes.putIfAbsent(accountId, snapshot);
        return existing != null ? existing : snapshot;
    }

    // =========================================================================
    // Refresh scheduling
    // =========================================================================

    @Override
    public String name() {
        return "contact-graph";
    }

    /**
     * Builds the index right away on a background thread and again every
     * {@code contacts.refreshIntervalHours}.
     */
    @Override
    public Optional<AutoCloseable> onLogin(WeChatConnection connection) {
        ResolvedAccount account = connection.account();
        if (!account.contacts().indexEnabled()) {
            return Optional.empty();
        }
        return Optional.of(scheduleRefresh(connection, Duration.ZERO,
                Duration.ofHours(account.contacts().refreshIntervalHours())));
    }

    RecurringTask scheduleRefresh(WeChatConnection connection, Duration initialDelay, Duration interval) {
        String accountId = connection.accountId();
        RecurringTask task = new RecurringTask("wechat-contacts-" + accountId, initialDelay, interval,
                () -> refresh(connection)) {
            @Override
            public void stop() {
                super.stop();
                refreshTasks.remove(accountId, this);
            }
        };
        RecurringTask previous = refreshTasks.put(accountId, task);
        if (previous != null) {
            previous.stop();
        }
        task.start();
        return task;
    }

    /**
     * Run a refresh now for an account with a scheduled refresh.
     *
     * @return false when no refresh is scheduled for the account
     */
    public boolean refreshNow(String accountId) {
        RecurringTask task = refreshTasks.get(accountId);
        if (task == null) {
            return false;
        }
        task.triggerNow();
        return true;
    }

    void refresh(WeChatConnection connection) {
        if (connection.isStopped()) {
            return;
        }
        try {
            List<ContactNode> snapshot = build(connection.accountId(), connection.backend());
            if (connection.isStopped()) {
                log.debug("[{}] Discarding contact index built after stop", connection.accountId());
                return;
            }
            publish(connection.accountId(), snapshot);
        } catch (RuntimeException e) {
            log.warn("[{}] Contact index refresh failed: {}", connection.accountId(),
                    ErrorUtils.formatErrorMessage(e));
        }
    }
}
