package com.openclaw.wechat.channel.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Opaque session state exported by a backend after login and handed back on
 * the next connect, so a restart does not need a new QR scan.
 *
 * @param backend puppet name the credentials belong to
 * @param data    backend-specific key/value pairs
 */
public record SessionCredentials(String backend, Map<String, String> data) {

    @JsonCreator
    public SessionCredentials(@JsonProperty("backend") String backend,
            @JsonProperty("data") Map<String, String> data) {
        this.backend = backend;
        this.data = data == null ? Map.of() : Map.copyOf(data);
    }

    @Override
    public String toString() {
        return "SessionCredentials[backend=" + backend + ", keys=" + data.keySet() + "]";
    }
}
