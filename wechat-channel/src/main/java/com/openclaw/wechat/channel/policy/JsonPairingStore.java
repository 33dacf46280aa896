package com.openclaw.wechat.channel.policy;

import com.openclaw.wechat.common.infra.ErrorUtils;
import com.openclaw.wechat.common.infra.JsonFile;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * File-backed {@link PairingStore}.
 * <p>
 * State is loaded once and kept in memory; every mutation is written back
 * atomically. A failed write is logged and the in-memory state stays
 * authoritative. Pending requests expire after one hour.
 */
@Slf4j
public class JsonPairingStore implements PairingStore {

    static final long PENDING_TTL_MS = 60 * 60 * 1000;
    static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 8;

    private final Path stateFile;
    private final LongSupplier clock;
    private final SecureRandom random = new SecureRandom();
    private final ReentrantLock lock = new ReentrantLock();
    private StateFile state;

    public JsonPairingStore(Path stateFile) {
        this(stateFile, System::currentTimeMillis);
    }

    public JsonPairingStore(Path stateFile, LongSupplier clock) {
        this.stateFile = stateFile;
        this.clock = clock;
    }

    // --- Public API ---

    @Override
    public List<String> readAllowFrom(String channel) {
        lock.lock();
        try {
            List<String> ids = state().allowFrom.get(channelKey(channel));
            return ids == null ? List.of() : List.copyOf(ids);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public UpsertResult upsertRequest(String channel, String senderId, Map<String, String> meta) {
        String key = channelKey(channel);
        String id = WeChatAllowlist.normalizeEntry(senderId);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("senderId is required");
        }
        lock.lock();
        try {
            StateFile current = state();
            boolean pruned = pruneExpired(current);
            for (PendingEntry entry : current.pending) {
                if (entry.channel.equals(key) && entry.senderId.equals(id)) {
                    if (pruned)
                        persist(current);
                    return new UpsertResult(entry.code, false);
                }
            }

            PendingEntry entry = new PendingEntry();
            entry.channel = key;
            entry.senderId = id;
            entry.code = generateCode(current);
            entry.createdAt = clock.getAsLong();
            entry.meta = meta == null ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
            current.pending.add(entry);
            persist(current);
            log.debug("Pairing request opened for {}:{}", key, id);
            return new UpsertResult(entry.code, true);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PairingRequest> approve(String channel, String code) {
        if (code == null || code.isBlank())
            return Optional.empty();
        String key = channelKey(channel);
        String wanted = code.trim().toUpperCase(Locale.ROOT);
        lock.lock();
        try {
            StateFile current = state();
            pruneExpired(current);
            PendingEntry match = null;
            for (PendingEntry entry : current.pending) {
                if (entry.channel.equals(key) && entry.code.equals(wanted)) {
                    match = entry;
                    break;
                }
            }
            if (match == null)
                return Optional.empty();

            current.pending.remove(match);
            Set<String> ids = new LinkedHashSet<>(current.allowFrom.getOrDefault(key, List.of()));
            ids.add(match.senderId);
            current.allowFrom.put(key, new ArrayList<>(ids));
            persist(current);
            log.info("Pairing approved for {}:{}", key, match.senderId);
            return Optional.of(match.toRequest());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PairingRequest> listPending(String channel) {
        String key = channelKey(channel);
        lock.lock();
        try {
            StateFile current = state();
            if (pruneExpired(current))
                persist(current);
            return current.pending.stream()
                    .filter(entry -> entry.channel.equals(key))
                    .map(PendingEntry::toRequest)
                    .toList();
        } finally {
            lock.unlock();
        }
    }

    // --- State file I/O ---

    private StateFile state() {
        if (state == null) {
            StateFile loaded = JsonFile.load(stateFile, StateFile.class);
            state = loaded != null ? loaded.sanitized() : new StateFile();
        }
        return state;
    }

    private void persist(StateFile current) {
        try {
            JsonFile.save(stateFile, current);
        } catch (IOException e) {
            log.error("Failed to persist pairing state to {}: {}", stateFile, ErrorUtils.formatErrorMessage(e));
        }
    }

    private boolean pruneExpired(StateFile current) {
        long now = clock.getAsLong();
        return current.pending.removeIf(entry -> now - entry.createdAt > PENDING_TTL_MS);
    }

    private String generateCode(StateFile current) {
        while (true) {
            StringBuilder sb = new StringBuilder(CODE_LENGTH);
            for (int i = 0; i < CODE_LENGTH; i++) {
                sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
            }
            String code = sb.toString();
            boolean taken = current.pending.stream().anyMatch(entry -> entry.code.equals(code));
            if (!taken)
                return code;
        }
    }

    private static String channelKey(String channel) {
        return channel == null ? "" : channel.trim().toLowerCase(Locale.ROOT);
    }

    // --- Persisted model ---

    @Data
    @NoArgsConstructor
    static class StateFile {
        private int version = 1;
        private List<PendingEntry> pending = new ArrayList<>();
        private Map<String, List<String>> allowFrom = new LinkedHashMap<>();

        StateFile sanitized() {
            if (pending == null)
                pending = new ArrayList<>();
            pending.removeIf(entry -> entry == null || entry.channel == null
                    || entry.senderId == null || entry.code == null);
            if (allowFrom == null)
                allowFrom = new LinkedHashMap<>();
            return this;
        }
    }

    @Data
    @NoArgsConstructor
    static class PendingEntry {
        private String channel;
        private String senderId;
        private String code;
        private long createdAt;
        private Map<String, String> meta = new LinkedHashMap<>();

        PairingRequest toRequest() {
            return new PairingRequest(channel, senderId, code, createdAt, meta);
        }
    }
}
