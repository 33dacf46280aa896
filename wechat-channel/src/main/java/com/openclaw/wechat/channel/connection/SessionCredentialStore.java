package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.WeChatStatePaths;
import com.openclaw.wechat.channel.protocol.SessionCredentials;
import com.openclaw.wechat.common.infra.ErrorUtils;
import com.openclaw.wechat.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists backend session credentials per account
 * ({@code credentials/wechat/<accountId>/session.json}).
 */
@Slf4j
public class SessionCredentialStore {

    private final WeChatStatePaths paths;

    public SessionCredentialStore(WeChatStatePaths paths) {
        this.paths = paths;
    }

    /**
     * Stored credentials for the account; empty when none or unreadable.
     */
    public Optional<SessionCredentials> load(String accountId) {
        return Optional.ofNullable(JsonFile.load(paths.sessionFile(accountId), SessionCredentials.class));
    }

    /**
     * @return false when the write failed (logged)
     */
    public boolean save(String accountId, SessionCredentials credentials) {
        Path file = paths.sessionFile(accountId);
        try {
            JsonFile.save(file, credentials);
            return true;
        } catch (IOException e) {
            log.warn("[{}] Failed to persist session credentials to {}: {}", accountId, file,
                    ErrorUtils.formatErrorMessage(e));
            return false;
        }
    }

    public void clear(String accountId) {
        try {
            if (JsonFile.delete(paths.sessionFile(accountId))) {
                log.info("[{}] Cleared stored WeChat session", accountId);
            }
        } catch (IOException e) {
            log.warn("[{}] Failed to clear session credentials: {}", accountId, ErrorUtils.formatErrorMessage(e));
        }
    }
}
