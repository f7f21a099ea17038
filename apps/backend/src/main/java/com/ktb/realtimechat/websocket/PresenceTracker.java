package com.ktb.realtimechat.websocket;

import com.ktb.realtimechat.websocket.broadcast.BroadcastService;
import com.ktb.realtimechat.websocket.event.UserOfflineEvent;
import com.ktb.realtimechat.websocket.event.UserOnlineEvent;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 사용자 접속 상태 추적.
 *
 * [원칙]
 * - online 여부는 ConnectionRegistry 에서만 계산한다. 여기서는 읽기만 한다
 * - 상태 전이는 Registry 가 발행하는 이벤트로만 들어온다
 *
 * [알림 대상]
 * - online: 현재 구독 중인 채팅방 멤버 합집합 (본인 제외)
 * - offline: 구독 정리 직전 채팅방들의 현재 멤버 합집합 (본인 제외)
 * 여러 방을 공유해도 수신자당 한 번만 전달된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceTracker {

    private static final String STATUS_ONLINE = "online";
    private static final String STATUS_OFFLINE = "offline";

    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionIndex subscriptionIndex;
    private final BroadcastService broadcastService;

    @EventListener
    public void onUserOnline(UserOnlineEvent event) {
        SocketUser user = event.user();
        lastSeen.put(user.id(), event.occurredAt());

        Set<String> chatroomIds = subscriptionIndex.roomsOf(user.id());
        log.info("[ONLINE] userId={} chatrooms={}", user.id(), chatroomIds.size());
        if (chatroomIds.isEmpty()) {
            return;
        }
        broadcastService.broadcastPresence(chatroomIds, user.id(),
                presenceEnvelope(ChatEvents.USER_ONLINE, user, STATUS_ONLINE));
    }

    @EventListener
    public void onUserOffline(UserOfflineEvent event) {
        SocketUser user = event.user();
        lastSeen.put(user.id(), event.occurredAt());

        Set<String> chatroomIds = event.formerChatroomIds();
        log.info("[OFFLINE] userId={} chatrooms={}", user.id(), chatroomIds.size());
        if (chatroomIds.isEmpty()) {
            return;
        }
        broadcastService.broadcastPresence(chatroomIds, user.id(),
                presenceEnvelope(ChatEvents.USER_OFFLINE, user, STATUS_OFFLINE));
    }

    public UserPresence presenceOf(String userId) {
        return new UserPresence(userId, connectionRegistry.isOnline(userId), lastSeen.get(userId));
    }

    public int trackedUsers() {
        return lastSeen.size();
    }

    private Envelope presenceEnvelope(String event, SocketUser user, String status) {
        return Envelope.builder(event)
                .put("user_id", user.id())
                .put("username", user.name())
                .put("display_name", user.displayName())
                .put("status", status)
                .withTimestamp()
                .build();
    }
}
