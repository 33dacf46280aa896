package com.openclaw.wechat.channel.connection;

import lombok.extern.slf4j.Slf4j;

/**
 * Default presenter: logs a link that renders the QR code in a browser.
 */
@Slf4j
public class LoggingScanPresenter implements ScanPresenter {

    static final String QR_RENDER_URL = "https://wechaty.js.org/qrcode/";

    @Override
    public void present(String accountId, String payload, int status) {
        log.info("[{}] WeChat QR scan needed (status={})", accountId, status);
        log.info("[{}] QR code URL: {}", accountId, qrUrl(payload));
    }

    static String qrUrl(String payload) {
        return QR_RENDER_URL + (payload != null ? payload.trim() : "");
    }
}
