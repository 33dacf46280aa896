package com.openclaw.wechat.channel.outbound;

import com.openclaw.wechat.channel.FakeBackend;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeChatSendTest {

    private final FakeBackend backend = new FakeBackend()
            .withPeer("wxid_bob", "Bob")
            .withRoom("5551@chatroom", "Team");

    @Test
    void send_withoutBackendFails() {
        SendResult result = WeChatSend.send(null, "wxid_bob", "hi", null);
        assertFalse(result.ok());
        assertEquals("No WeChat bot instance available", result.error());
    }

    @Test
    void send_blankTargetFails() {
        SendResult result = WeChatSend.send(backend, "wechat: ", "hi", null);
        assertEquals("No recipient provided", result.error());
    }

    @Test
    void send_unknownContactFails() {
        SendResult result = WeChatSend.send(backend, "wxid_nobody", "hi", null);
        assertEquals("Contact not found: wxid_nobody", result.error());
        assertTrue(backend.sent.isEmpty());
    }

    @Test
    void send_unknownRoomFails() {
        SendResult result = WeChatSend.send(backend, "9999@chatroom", "hi", null);
        assertEquals("Room not found: 9999@chatroom", result.error());
    }

    @Test
    void send_toContactNormalizesTarget() {
        SendResult result = WeChatSend.send(backend, "wechat:wxid_bob", "hello", null);
        assertTrue(result.ok());
        assertEquals("wxid_bob", result.to());
        assertEquals(List.of("hello"), backend.textsTo("wxid_bob"));
    }

    @Test
    void send_mediaGoesBeforeText() {
        Path file = Path.of("/tmp/photo.jpg");
        SendResult result = WeChatSend.send(backend, "5551@chatroom", "caption", file);

        assertTrue(result.ok());
        assertEquals(2, backend.sent.size());
        assertEquals(file, backend.sent.get(0).media());
        assertEquals("caption", backend.sent.get(1).text());
    }

    @Test
    void send_longTextIsChunked() {
        WeChatSend.send(backend, "wxid_bob", "b".repeat(4500), null);
        assertEquals(3, backend.textsTo("wxid_bob").size());
    }

    @Test
    void send_backendFailureBecomesErrorResult() {
        backend.failingTexts.add("boom");
        SendResult result = WeChatSend.send(backend, "wxid_bob", "boom", null);
        assertFalse(result.ok());
        assertTrue(result.error().contains("send failed"));
    }
}
