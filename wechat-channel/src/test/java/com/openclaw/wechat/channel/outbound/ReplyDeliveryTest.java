package com.openclaw.wechat.channel.outbound;

import com.openclaw.wechat.channel.FakeBackend;
import com.openclaw.wechat.channel.TestAccounts;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplyDeliveryTest {

    private static final String CHAT = "wxid_bob";

    private final FakeBackend backend = new FakeBackend();
    private final List<Long> sleeps = new ArrayList<>();

    private final MediaResolver resolver = ref -> {
        if (ref.contains("missing"))
            throw new IOException("Media file not found: " + ref);
        return Path.of(ref);
    };

    private ReplyDelivery delivery(TableConverter converter) {
        return new ReplyDelivery(converter, resolver, sleeps::add);
    }

    private WeChatConnection connection(Map<String, Object> options) {
        return new WeChatConnection(TestAccounts.account(options), backend);
    }

    @Test
    void deliver_waitsMinimumDelayOnce() {
        WeChatConnection connection = connection(Map.of("minReplyDelayMs", 1500L, "textChunkLimit", 5));
        delivery(null).deliver(connection, CHAT, ReplyPayload.text("aaaa bbbb cccc"));

        assertEquals(List.of(1500L), sleeps);
        assertEquals(List.of("aaaa", "bbbb", "cccc"), backend.textsTo(CHAT));
    }

    @Test
    void deliver_zeroDelaySkipsSleep() {
        delivery(null).deliver(connection(Map.of()), CHAT, ReplyPayload.text("hi"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void deliver_sendsMediaBeforeTextAndRecordsOutbound() {
        WeChatConnection connection = connection(Map.of());
        ReplyPayload payload = new ReplyPayload("look", null, List.of("/tmp/a.png", "/tmp/b.png"));

        delivery(null).deliver(connection, CHAT, payload);

        assertEquals(3, backend.sent.size());
        assertEquals(Path.of("/tmp/a.png"), backend.sent.get(0).media());
        assertEquals(Path.of("/tmp/b.png"), backend.sent.get(1).media());
        assertEquals("look", backend.sent.get(2).text());
        assertTrue(connection.lastOutboundAt().isPresent());
    }

    @Test
    void deliver_singleMediaUrlWithoutText() {
        delivery(null).deliver(connection(Map.of()), CHAT, new ReplyPayload(null, "/tmp/c.png", null));
        assertEquals(1, backend.sent.size());
        assertEquals(Path.of("/tmp/c.png"), backend.sent.get(0).media());
    }

    @Test
    void deliver_mediaFailureDoesNotAbortRest() {
        ReplyPayload payload = new ReplyPayload("still here", null, List.of("/tmp/missing.png", "/tmp/ok.png"));
        delivery(null).deliver(connection(Map.of()), CHAT, payload);

        assertEquals(2, backend.sent.size());
        assertEquals(Path.of("/tmp/ok.png"), backend.sent.get(0).media());
        assertEquals("still here", backend.sent.get(1).text());
    }

    @Test
    void deliver_uploadFailureStillSendsText() {
        backend.failMedia = true;
        delivery(null).deliver(connection(Map.of()), CHAT,
                new ReplyPayload("text", "/tmp/a.png", null));
        assertEquals(List.of("text"), backend.textsTo(CHAT));
    }

    @Test
    void deliver_failedChunkDoesNotStopLaterChunks() {
        backend.failingTexts.add("bbbb");
        delivery(null).deliver(connection(Map.of("textChunkLimit", 5)), CHAT,
                ReplyPayload.text("aaaa bbbb cccc"));
        assertEquals(List.of("aaaa", "cccc"), backend.textsTo(CHAT));
    }

    @Test
    void deliver_prefixesResponseBeforeChunking() {
        delivery(null).deliver(connection(Map.of("responsePrefix", "[bot] ")), CHAT,
                ReplyPayload.text("hello"));
        assertEquals(List.of("[bot] hello"), backend.textsTo(CHAT));
    }

    @Test
    void deliver_appliesTableConverter() {
        delivery(text -> text.toUpperCase()).deliver(connection(Map.of()), CHAT, ReplyPayload.text("table"));
        assertEquals(List.of("TABLE"), backend.textsTo(CHAT));
    }

    @Test
    void deliver_converterFailureSendsOriginalText() {
        TableConverter broken = text -> {
            throw new IllegalStateException("parse error");
        };
        delivery(broken).deliver(connection(Map.of()), CHAT, ReplyPayload.text("raw"));
        assertEquals(List.of("raw"), backend.textsTo(CHAT));
    }

    @Test
    void deliver_blankTextSendsNothing() {
        delivery(null).deliver(connection(Map.of()), CHAT, ReplyPayload.text("   "));
        assertTrue(backend.sent.isEmpty());
    }
}
