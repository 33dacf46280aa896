package com.openclaw.wechat.channel.connection;

/**
 * Shows a login QR code to the operator.
 */
@FunctionalInterface
public interface ScanPresenter {

    void present(String accountId, String payload, int status);
}
