package com.ktb.realtimechat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record PresenceResponse(
        @JsonProperty("user_id") String userId,
        boolean online,
        @JsonProperty("last_seen") Instant lastSeen,
        @JsonProperty("connection_count") int connectionCount
) {
}
