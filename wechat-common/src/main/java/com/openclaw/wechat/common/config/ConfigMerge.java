package com.openclaw.wechat.common.config;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Config merge utilities for layered channel sections.
 */
public final class ConfigMerge {

    private ConfigMerge() {
    }

    /**
     * Merge a patch into a base configuration section.
     * <ul>
     * <li>null values in the patch are ignored (the base value survives)</li>
     * <li>nested objects are merged recursively</li>
     * <li>any other value replaces the base value, lists included</li>
     * </ul>
     * Neither argument is modified.
     *
     * @param base  base config section (may be null)
     * @param patch values layered on top (may be null)
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> mergeSection(
            Map<String, Object> base, Map<String, Object> patch) {

        Map<String, Object> next = new LinkedHashMap<>();
        if (base != null)
            next.putAll(base);
        if (patch == null)
            return next;

        for (var entry : patch.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            Object baseValue = next.get(entry.getKey());
            if (value instanceof Map && baseValue instanceof Map) {
                next.put(entry.getKey(), mergeSection(
                        (Map<String, Object>) baseValue, (Map<String, Object>) value));
                continue;
            }
            next.put(entry.getKey(), value);
        }
        return next;
    }

    /**
     * Copy of {@code section} without the given top-level keys.
     */
    public static Map<String, Object> without(Map<String, Object> section, Collection<String> keys) {
        Map<String, Object> next = new LinkedHashMap<>();
        if (section == null)
            return next;
        next.putAll(section);
        keys.forEach(next::remove);
        return next;
    }
}
