package com.openclaw.wechat.channel.policy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class JsonPairingStoreTest {

    @TempDir
    Path dir;

    private final AtomicLong now = new AtomicLong(1_700_000_000_000L);
    private Path file;
    private JsonPairingStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("credentials").resolve("wechat-pairing.json");
        store = new JsonPairingStore(file, now::get);
    }

    @Test
    void upsert_createsOnceThenReturnsSameCode() {
        var first = store.upsertRequest("wechat", "wxid_new", Map.of("name", "Newbie"));
        var second = store.upsertRequest("wechat", "WECHAT:wxid_new", Map.of());

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.code(), second.code());
        assertEquals(1, store.listPending("wechat").size());
        assertEquals("Newbie", store.listPending("wechat").get(0).meta().get("name"));
    }

    @Test
    void code_usesUnambiguousAlphabet() {
        String code = store.upsertRequest("wechat", "wxid_a", Map.of()).code();
        assertEquals(JsonPairingStore.CODE_LENGTH, code.length());
        for (char c : code.toCharArray()) {
            assertTrue(JsonPairingStore.CODE_ALPHABET.indexOf(c) >= 0, "unexpected char " + c);
        }
    }

    @Test
    void approve_movesSenderToAllowList() {
        String code = store.upsertRequest("wechat", "wxid_new", Map.of()).code();

        Optional<PairingRequest> approved = store.approve("wechat", code.toLowerCase());

        assertTrue(approved.isPresent());
        assertEquals("wxid_new", approved.get().senderId());
        assertEquals(List.of("wxid_new"), store.readAllowFrom("wechat"));
        assertTrue(store.listPending("wechat").isEmpty());
        assertTrue(store.approve("wechat", code).isEmpty());
    }

    @Test
    void expiredRequest_allowsNewOne() {
        var first = store.upsertRequest("wechat", "wxid_new", Map.of());
        now.addAndGet(JsonPairingStore.PENDING_TTL_MS + 1);

        assertTrue(store.listPending("wechat").isEmpty());
        assertTrue(store.approve("wechat", first.code()).isEmpty());
        assertTrue(store.upsertRequest("wechat", "wxid_new", Map.of()).created());
    }

    @Test
    void state_survivesReload() {
        String code = store.upsertRequest("wechat", "wxid_new", Map.of()).code();
        store.approve("wechat", code);
        store.upsertRequest("wechat", "wxid_other", Map.of());

        JsonPairingStore reloaded = new JsonPairingStore(file, now::get);

        assertTrue(Files.exists(file));
        assertEquals(List.of("wxid_new"), reloaded.readAllowFrom("wechat"));
        assertEquals(1, reloaded.listPending("wechat").size());
        assertFalse(reloaded.upsertRequest("wechat", "wxid_other", Map.of()).created());
    }

    @Test
    void channels_areIsolated() {
        store.upsertRequest("wechat", "wxid_new", Map.of());
        assertTrue(store.listPending("telegram").isEmpty());
        assertTrue(store.readAllowFrom("telegram").isEmpty());
    }

    @Test
    void corruptFile_startsEmpty() throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        JsonPairingStore corrupt = new JsonPairingStore(file, now::get);

        assertTrue(corrupt.readAllowFrom("wechat").isEmpty());
        assertTrue(corrupt.upsertRequest("wechat", "wxid_new", Map.of()).created());
    }
}
