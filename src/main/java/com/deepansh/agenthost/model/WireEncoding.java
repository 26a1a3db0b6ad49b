package com.deepansh.agenthost.model;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * How payload bytes travel inside the JSON envelope.
 * Plain-text clients (curl) get UTF-8; everyone else gets base64.
 * A request and its response always use the same encoding.
 */
public enum WireEncoding {
    BASE64,
    UTF8;

    public static WireEncoding forUserAgent(String userAgent) {
        return userAgent != null && userAgent.contains("curl") ? UTF8 : BASE64;
    }

    public String encode(byte[] bytes) {
        return this == BASE64
                ? Base64.getEncoder().encodeToString(bytes)
                : new String(bytes, StandardCharsets.UTF_8);
    }

    public byte[] decode(String payload) {
        if (payload == null || payload.isEmpty()) {
            return new byte[0];
        }
        return this == BASE64
                ? Base64.getDecoder().decode(payload)
                : payload.getBytes(StandardCharsets.UTF_8);
    }
}
