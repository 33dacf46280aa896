package com.openclaw.wechat.channel.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw per-account options as they appear in {@code channels.wechat} (and in
 * each {@code channels.wechat.accounts.<id>} overlay). Every field is optional;
 * defaults are applied by {@link WeChatAccounts#resolve}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WeChatAccountOptions {

    private String name;
    private Boolean enabled;
    private String puppet;
    private String padlocalToken;
    private String dmPolicy;
    private List<String> allowFrom;
    private String groupPolicy;
    private Boolean requireMention;
    private Long minReplyDelayMs;
    private Double mediaMaxMb;
    private Integer textChunkLimit;
    private String responsePrefix;
    private VoiceOptions voice;
    private MomentsOptions moments;
    private ContactsOptions contacts;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VoiceOptions {
        private Boolean transcribe;
        private String provider;
        private String openaiApiKey;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MomentsOptions {
        private Boolean enabled;
        private Integer pollIntervalSeconds;
        private Boolean injectAsContext;
        private Integer maxPerPoll;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContactsOptions {
        private Boolean indexEnabled;
        private Integer refreshIntervalHours;
    }
}
