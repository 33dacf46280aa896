package com.openclaw.wechat.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the bridge configuration file.
 * <p>
 * Channel sections stay untyped here; each channel module binds its own
 * section.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeConfig {

    /** Directory for credentials and per-account state. Defaults to {@code ~/.openclaw}. */
    private String stateDir;

    private Map<String, Map<String, Object>> channels = new LinkedHashMap<>();

    /**
     * Raw section for one channel id, or an empty map when absent.
     */
    public Map<String, Object> channelSection(String channelId) {
        if (channels == null)
            return Map.of();
        Map<String, Object> section = channels.get(channelId);
        return section != null ? section : Map.of();
    }
}
