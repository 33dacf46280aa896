package com.openclaw.wechat.channel.plugin;

import com.openclaw.wechat.channel.FakeBackend;
import com.openclaw.wechat.channel.account.PuppetKind;
import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.connection.StartResult;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.channel.inbound.InboundEnvelope;
import com.openclaw.wechat.channel.inbound.SessionRecorder;
import com.openclaw.wechat.channel.protocol.ProtocolBackend;
import com.openclaw.wechat.channel.protocol.ProtocolBackendProvider;
import com.openclaw.wechat.common.config.ConfigService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class WeChatBeanConfigTest {

    @TempDir
    Path dir;

    @Test
    void contextBean_isCreatedAndClosedWithSpring() throws Exception {
        Path configPath = dir.resolve("openclaw.json");
        Files.writeString(configPath, "{\"stateDir\": \"" + dir.resolve("state").toString().replace("\\", "\\\\")
                + "\", \"channels\": {\"wechat\": {\"padlocalToken\": \"tok\"}}}");

        FakeBackend backend = new FakeBackend();
        WeChatCollaborators collaborators = WeChatCollaborators.builder()
                .backendProvider(new ProtocolBackendProvider() {
                    @Override
                    public PuppetKind kind() {
                        return PuppetKind.PADLOCAL;
                    }

                    @Override
                    public ProtocolBackend create(ResolvedAccount account) {
                        return backend;
                    }
                })
                .sessionRecorder(new SessionRecorder() {
                    @Override
                    public Optional<Long> readUpdatedAt(String sessionKey) {
                        return Optional.empty();
                    }

                    @Override
                    public void recordInbound(InboundEnvelope envelope) {
                        // not needed without traffic
                    }
                })
                .agentDispatcher((envelope, deliverer) -> CompletableFuture.completedFuture(null))
                .build();

        WeChatConnection connection;
        try (AnnotationConfigApplicationContext spring = new AnnotationConfigApplicationContext()) {
            spring.registerBean(ConfigService.class, () -> new ConfigService(configPath));
            spring.registerBean(WeChatCollaborators.class, () -> collaborators);
            spring.register(WeChatBeanConfig.class);
            spring.refresh();

            WeChatContext wechat = spring.getBean(WeChatContext.class);
            assertSame(wechat, spring.getBean(WeChatBeanConfig.class).wechatContext());
            assertEquals(List.of("default"), wechat.getRegistry().listAccountIds());

            List<StartResult> started = wechat.startAll();
            connection = assertInstanceOf(StartResult.Started.class, started.get(0)).connection();
            assertFalse(connection.isStopped());
        }
        assertTrue(connection.isStopped());
        assertEquals(1, backend.disconnectCount.get());
    }
}
