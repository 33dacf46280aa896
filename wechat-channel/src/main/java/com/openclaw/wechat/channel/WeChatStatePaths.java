package com.openclaw.wechat.channel;

import java.nio.file.Path;

/**
 * On-disk layout of WeChat state under the bridge state directory:
 * <pre>
 * &lt;stateDir&gt;/credentials/wechat-pairing.json
 * &lt;stateDir&gt;/credentials/wechat/&lt;accountId&gt;/contacts.json
 * &lt;stateDir&gt;/credentials/wechat/&lt;accountId&gt;/session.json
 * &lt;stateDir&gt;/credentials/wechat/&lt;accountId&gt;/moments-state.json
 * </pre>
 */
public class WeChatStatePaths {

    private final Path stateDir;

    public WeChatStatePaths(Path stateDir) {
        this.stateDir = stateDir;
    }

    public Path stateDir() {
        return stateDir;
    }

    public Path pairingFile() {
        return stateDir.resolve("credentials").resolve("wechat-pairing.json");
    }

    public Path accountDir(String accountId) {
        return stateDir.resolve("credentials").resolve(WeChatChannel.CHANNEL_ID)
                .resolve(safeSegment(accountId));
    }

    public Path contactsFile(String accountId) {
        return accountDir(accountId).resolve("contacts.json");
    }

    public Path sessionFile(String accountId) {
        return accountDir(accountId).resolve("session.json");
    }

    public Path momentsStateFile(String accountId) {
        return accountDir(accountId).resolve("moments-state.json");
    }

    /**
     * Account ids become directory names; anything outside {@code [a-zA-Z0-9._-]} is replaced.
     */
    static String safeSegment(String accountId) {
        String trimmed = accountId != null ? accountId.trim() : "";
        if (trimmed.isEmpty())
            return WeChatChannel.DEFAULT_ACCOUNT_ID;
        String safe = trimmed.replaceAll("[^a-zA-Z0-9._-]+", "_");
        return safe.replace("..", "_");
    }
}
