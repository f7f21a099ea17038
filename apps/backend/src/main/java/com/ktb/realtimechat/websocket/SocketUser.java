package com.ktb.realtimechat.websocket;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Socket User Record
 *
 * @param id          user id
 * @param name        username
 * @param displayName user display name (nullable)
 */
public record SocketUser(String id, String name, String displayName) {

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("username", name);
        payload.put("display_name", displayName);
        return payload;
    }
}
