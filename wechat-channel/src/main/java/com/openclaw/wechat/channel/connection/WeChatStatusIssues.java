package com.openclaw.wechat.channel.connection;

import com.openclaw.wechat.channel.WeChatChannel;
import com.openclaw.wechat.channel.account.DmPolicy;
import com.openclaw.wechat.channel.account.PuppetKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration warnings for enabled, configured accounts.
 */
public final class WeChatStatusIssues {

    private WeChatStatusIssues() {
    }

    public static List<StatusIssue> collect(List<AccountSnapshot> accounts) {
        List<StatusIssue> issues = new ArrayList<>();
        for (AccountSnapshot account : accounts) {
            if (account == null || !account.enabled() || !account.configured())
                continue;

            String accountId = account.accountId() != null ? account.accountId() : WeChatChannel.DEFAULT_ACCOUNT_ID;

            if (DmPolicy.OPEN.value().equals(account.dmPolicy())) {
                issues.add(new StatusIssue(WeChatChannel.CHANNEL_ID, accountId, "config",
                        "WeChat dmPolicy is \"open\", allowing any user to message the bot without pairing.",
                        "Set channels.wechat.dmPolicy to \"pairing\" or \"allowlist\" to restrict access."));
            }

            if (account.momentsEnabled() && !PuppetKind.PADLOCAL.value().equals(account.puppet())) {
                issues.add(new StatusIssue(WeChatChannel.CHANNEL_ID, accountId, "config",
                        "Moments polling is enabled but puppet is not padlocal. Moments require padlocal.",
                        "Set channels.wechat.puppet to \"padlocal\" or disable moments."));
            }
        }
        return issues;
    }
}
