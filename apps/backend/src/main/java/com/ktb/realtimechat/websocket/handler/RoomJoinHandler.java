package com.ktb.realtimechat.websocket.handler;

import com.ktb.realtimechat.service.ChatroomAccessService;
import com.ktb.realtimechat.websocket.ChatConnection;
import com.ktb.realtimechat.websocket.ConnectionRegistry;
import com.ktb.realtimechat.websocket.SocketUser;
import com.ktb.realtimechat.websocket.SubscriptionIndex;
import com.ktb.realtimechat.websocket.broadcast.BroadcastService;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.ktb.realtimechat.websocket.ChatEvents.*;

/**
 * 채팅방 입장 처리 핸들러
 * 권한 확인 후 구독을 추가하고, 처음 입장한 경우에만 다른 멤버에게 알린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomJoinHandler implements EnvelopeHandler {

    private final SubscriptionIndex subscriptionIndex;
    private final ConnectionRegistry connectionRegistry;
    private final ChatroomAccessService chatroomAccessService;
    private final BroadcastService broadcastService;

    @Override
    public Set<String> events() {
        return Set.of(JOIN_CHATROOM);
    }

    @Override
    public void handle(ChatConnection connection, Envelope envelope) {
        SocketUser user = connection.getUser();
        String chatroomId = envelope.requireString(CHATROOM_ID);

        chatroomAccessService.checkAccess(user.id(), chatroomId);

        boolean firstJoin = subscriptionIndex.join(user.id(), chatroomId);

        // 권한 확인 중 마지막 연결이 끊겼다면 구독 정리가 이미 끝난 상태
        if (!connectionRegistry.isOnline(user.id())) {
            subscriptionIndex.leave(user.id(), chatroomId);
            return;
        }

        log.info("[JOIN] userId={} chatroomId={} firstJoin={}", user.id(), chatroomId, firstJoin);

        if (firstJoin) {
            broadcastService.broadcastToRoom(chatroomId,
                    Envelope.builder(USER_JOINED)
                            .put("user", user.toPayload())
                            .put(CHATROOM_ID, chatroomId)
                            .withTimestamp()
                            .build(),
                    user.id());
        }
    }
}
