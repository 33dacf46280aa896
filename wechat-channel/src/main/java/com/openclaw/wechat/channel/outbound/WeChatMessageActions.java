package com.openclaw.wechat.channel.outbound;

import com.openclaw.wechat.channel.WeChatChannel;
import com.openclaw.wechat.channel.account.AccountRegistry;
import com.openclaw.wechat.channel.connection.WeChatConnection;
import com.openclaw.wechat.common.infra.ErrorUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Message actions agents may invoke on the WeChat channel. Only
 * {@code send} is supported.
 */
@Slf4j
public class WeChatMessageActions {

    public static final String ACTION_SEND = "send";

    private final AccountRegistry registry;
    private final MediaResolver mediaResolver;

    public WeChatMessageActions(AccountRegistry registry, MediaResolver mediaResolver) {
        this.registry = registry;
        this.mediaResolver = mediaResolver;
    }

    public List<String> listActions() {
        return List.of(ACTION_SEND);
    }

    /**
     * Run an action.
     *
     * @return {@code {ok: true, to}} or {@code {ok: false, error}}
     * @throws IllegalArgumentException for unsupported actions or missing parameters
     */
    public Map<String, Object> handleAction(String action, Map<String, Object> params) {
        if (!ACTION_SEND.equals(action)) {
            throw new IllegalArgumentException(
                    "Action " + action + " is not supported for provider " + WeChatChannel.CHANNEL_ID + ".");
        }
        return handleSend(params);
    }

    public Map<String, Object> handleSend(Map<String, Object> params) {
        String to = requireString(params, "to", false);
        String message = requireString(params, "message", true);
        String media = optionalString(params, "media");
        String accountId = optionalString(params, "accountId");
        if (accountId == null) {
            accountId = registry.defaultAccountId();
        }

        Optional<WeChatConnection> connection = registry.connectionFor(accountId)
                .filter(c -> !c.isStopped());
        SendResult result;
        if (connection.isEmpty()) {
            result = WeChatSend.send(null, to, message, null);
        } else {
            Path mediaPath = null;
            if (media != null) {
                try {
                    mediaPath = mediaResolver.resolve(media);
                } catch (Exception e) {
                    return errorResult("Failed to load media: " + ErrorUtils.formatErrorMessage(e));
                }
            }
            result = WeChatSend.send(connection.get().backend(), to, message, mediaPath);
            if (result.ok()) {
                connection.get().recordOutbound();
            }
        }

        if (!result.ok()) {
            log.warn("[{}] WeChat send action failed: {}", accountId, result.error());
            return errorResult(result.error());
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.put("to", result.to());
        return out;
    }

    private static Map<String, Object> errorResult(String error) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("error", error);
        return out;
    }

    private static String requireString(Map<String, Object> params, String key, boolean allowEmpty) {
        Object value = params != null ? params.get(key) : null;
        if (!(value instanceof String str)) {
            throw new IllegalArgumentException(key + " required");
        }
        if (!allowEmpty && str.isBlank()) {
            throw new IllegalArgumentException(key + " required");
        }
        return str;
    }

    private static String optionalString(Map<String, Object> params, String key) {
        Object value = params != null ? params.get(key) : null;
        if (value instanceof String str && !str.isBlank()) {
            return str.trim();
        }
        return null;
    }
}
