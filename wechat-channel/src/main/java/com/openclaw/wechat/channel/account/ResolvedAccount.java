package com.openclaw.wechat.channel.account;

import java.util.List;

/**
 * Fully resolved, immutable account: base section, per-account overlay and
 * defaults merged into one value. Two resolutions of the same configuration
 * are equal.
 */
public record ResolvedAccount(
        String accountId,
        String name,
        boolean enabled,
        boolean configured,
        PuppetKind puppet,
        String padlocalToken,
        TokenSource tokenSource,
        DmPolicy dmPolicy,
        List<String> allowFrom,
        GroupPolicy groupPolicy,
        boolean requireMention,
        long minReplyDelayMs,
        double mediaMaxMb,
        int textChunkLimit,
        String responsePrefix,
        VoiceSettings voice,
        MomentsSettings moments,
        ContactsSettings contacts) {

    public ResolvedAccount {
        allowFrom = allowFrom == null ? List.of() : List.copyOf(allowFrom);
    }

    public record VoiceSettings(boolean transcribe, VoiceProvider provider, String openaiApiKey) {
        @Override
        public String toString() {
            return "VoiceSettings[transcribe=" + transcribe + ", provider=" + provider
                    + ", openaiApiKey=" + (openaiApiKey != null ? "***" : null) + "]";
        }
    }

    public record MomentsSettings(boolean enabled, int pollIntervalSeconds, boolean injectAsContext,
            int maxPerPoll) {
    }

    public record ContactsSettings(boolean indexEnabled, int refreshIntervalHours) {
    }

    /**
     * Inbound media size cap in bytes.
     */
    public long mediaMaxBytes() {
        return (long) (mediaMaxMb * 1024 * 1024);
    }

    /**
     * Label for logs: the configured name when present, else the id.
     */
    public String displayLabel() {
        return name != null ? name + " (" + accountId + ")" : accountId;
    }

    @Override
    public String toString() {
        return "ResolvedAccount[accountId=" + accountId + ", enabled=" + enabled
                + ", configured=" + configured + ", puppet=" + puppet
                + ", tokenSource=" + tokenSource + ", dmPolicy=" + dmPolicy
                + ", groupPolicy=" + groupPolicy + "]";
    }
}
