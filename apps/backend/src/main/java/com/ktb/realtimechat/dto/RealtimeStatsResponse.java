package com.ktb.realtimechat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RealtimeStatsResponse(
        @JsonProperty("total_connections") int totalConnections,
        @JsonProperty("online_users") int onlineUsers,
        @JsonProperty("active_chatrooms") int activeChatrooms,
        @JsonProperty("total_subscriptions") int totalSubscriptions,
        @JsonProperty("user_presence_tracked") int userPresenceTracked
) {
}
