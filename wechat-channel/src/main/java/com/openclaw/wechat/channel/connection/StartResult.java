package com.openclaw.wechat.channel.connection;

/**
 * Outcome of {@link ConnectionManager#start}.
 */
public sealed interface StartResult permits StartResult.Started, StartResult.Failed {

    String accountId();

    default boolean ok() {
        return this instanceof Started;
    }

    /**
     * @param alreadyRunning true when the account already had a live connection
     */
    record Started(WeChatConnection connection, boolean alreadyRunning) implements StartResult {
        @Override
        public String accountId() {
            return connection.accountId();
        }
    }

    record Failed(String accountId, String error) implements StartResult {
    }

    static StartResult started(WeChatConnection connection, boolean alreadyRunning) {
        return new Started(connection, alreadyRunning);
    }

    static StartResult failed(String accountId, String error) {
        return new Failed(accountId, error);
    }
}
