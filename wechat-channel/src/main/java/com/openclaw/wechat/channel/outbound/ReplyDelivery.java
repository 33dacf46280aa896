package com.openclaw.wechat.channel.outbound;

import com.openclaw.wechat.channel.account.ResolvedAccount;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;

/**
 * Sends agent replies into a chat.
 * <p>
 * Each {@link #deliver} call waits the account's minimum reply delay once,
 * sends media items one by one, then the text in chunks. Failures are logged
 * per item and never abort the remaining sends or reach the caller.
 */
@Slf4j
public class ReplyDelivery {

    /** Pause before sending, replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final TableConverter tableConverter;
    private final MediaResolver mediaResolver;
    private final Sleeper sleeper;

    public ReplyDelivery(TableConverter tableConverter, MediaResolver mediaResolver) {
        this(tableConverter, mediaResolver, Thread::sleep);
    }

    public ReplyDelivery(TableConverter tableConverter, MediaResolver mediaResolver, Sleeper sleeper) {
        this.tableConverter = tableConverter != null ? tableConverter : TableConverter.IDENTITY;
        this.mediaResolver = mediaResolver;
        this.sleeper = sleeper;
    }

    public void deliver(WeChatConnection connection, String chatId, ReplyPayload payload) {
        ResolvedAccount account = connection.account();
        String accountId = connection.accountId();

        pause(account.minReplyDelayMs(), accountId);

        for (String mediaRef : payload.mediaList()) {
            try {
                Path file = mediaResolver.resolve(mediaRef);
                connection.backend().sendMedia(chatId, file);
                connection.recordOutbound();
            } catch (Exception e) {
                log.error("[{}] Failed to send media {} to {}: {}", accountId, mediaRef, chatId,
                        ErrorUtils.formatErrorMessage(e));
            }
        }

        if (!payload.hasText()) {
            return;
        }
        String text = convert(payload.text(), accountId);
        if (account.responsePrefix() != null && !account.responsePrefix().isEmpty()) {
            text = account.responsePrefix() + text;
        }

        List<String> chunks = WeChatTextChunker.chunk(text, account.textChunkLimit());
        for (String chunk : chunks) {
            try {
                connection.backend().sendText(chatId, chunk);
                connection.recordOutbound();
            } catch (RuntimeException e) {
                log.error("[{}] Failed to send text chunk to {}: {}", accountId, chatId,
                        ErrorUtils.formatErrorMessage(e));
            }
        }
    }

    private String convert(String text, String accountId) {
        try {
            return tableConverter.convert(text);
        } catch (RuntimeException e) {
            log.warn("[{}] Table conversion failed, sending text as is: {}", accountId,
                    ErrorUtils.formatErrorMessage(e));
            return text;
        }
    }

    private void pause(long millis, String accountId) {
        if (millis <= 0)
            return;
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[{}] Reply delay interrupted", accountId);
        }
    }
}
