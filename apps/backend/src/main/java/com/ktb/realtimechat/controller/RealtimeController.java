package com.ktb.realtimechat.controller;

import com.ktb.realtimechat.dto.PresenceResponse;
import com.ktb.realtimechat.dto.RealtimeStatsResponse;
import com.ktb.realtimechat.service.ServerInstance;
import com.ktb.realtimechat.websocket.ConnectionRegistry;
import com.ktb.realtimechat.websocket.PresenceTracker;
import com.ktb.realtimechat.websocket.SubscriptionIndex;
import com.ktb.realtimechat.websocket.UserPresence;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 실시간 코어 운영 API. 이 프로세스 기준 수치만 반환한다.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RealtimeController {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionIndex subscriptionIndex;
    private final PresenceTracker presenceTracker;
    private final ServerInstance serverInstance;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("serverId", serverInstance.getId());
        return body;
    }

    @GetMapping("/realtime/stats")
    public RealtimeStatsResponse stats() {
        return new RealtimeStatsResponse(
                connectionRegistry.totalConnections(),
                connectionRegistry.onlineUsers().size(),
                subscriptionIndex.activeChatrooms(),
                subscriptionIndex.totalSubscriptions(),
                presenceTracker.trackedUsers()
        );
    }

    @GetMapping("/realtime/presence/{userId}")
    public PresenceResponse presence(@PathVariable String userId) {
        UserPresence presence = presenceTracker.presenceOf(userId);
        return new PresenceResponse(
                presence.userId(),
                presence.online(),
                presence.lastSeen(),
                connectionRegistry.connectionCount(userId)
        );
    }
}
