package com.openclaw.wechat.channel.contacts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Locale;

/**
 * One contact in the graph, with the groups it shares with the logged-in user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContactNode(
        String wxid,
        String displayName,
        String remark,
        List<String> tags,
        List<String> sharedGroupIds,
        List<String> sharedGroupNames,
        Long lastMessageAt) {

    public ContactNode {
        displayName = displayName != null ? displayName : "";
        remark = remark != null ? remark : "";
        tags = tags == null ? List.of() : List.copyOf(tags);
        sharedGroupIds = sharedGroupIds == null ? List.of() : List.copyOf(sharedGroupIds);
        sharedGroupNames = sharedGroupNames == null ? List.of() : List.copyOf(sharedGroupNames);
    }

    /**
     * Case-insensitive substring match on name, remark, id and group names.
     * {@code lowerQuery} must already be lower-cased.
     */
    boolean matches(String lowerQuery) {
        if (contains(displayName, lowerQuery) || contains(remark, lowerQuery) || contains(wxid, lowerQuery)) {
            return true;
        }
        for (String group : sharedGroupNames) {
            if (contains(group, lowerQuery))
                return true;
        }
        return false;
    }

    private static boolean contains(String value, String lowerQuery) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }
}
