package com.ktb.realtimechat.websocket.handler;

import com.ktb.realtimechat.websocket.ChatConnection;
import com.ktb.realtimechat.websocket.SubscriptionIndex;
import com.ktb.realtimechat.websocket.broadcast.BroadcastService;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.ktb.realtimechat.websocket.ChatEvents.*;

/**
 * 채팅방 퇴장 처리 핸들러
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomLeaveHandler implements EnvelopeHandler {

    private final SubscriptionIndex subscriptionIndex;
    private final BroadcastService broadcastService;

    @Override
    public Set<String> events() {
        return Set.of(LEAVE_CHATROOM);
    }

    @Override
    public void handle(ChatConnection connection, Envelope envelope) {
        String userId = connection.getUserId();
        String chatroomId = envelope.requireString(CHATROOM_ID);

        if (!subscriptionIndex.leave(userId, chatroomId)) {
            return;
        }

        log.info("[LEAVE] userId={} chatroomId={}", userId, chatroomId);

        broadcastService.broadcastToRoom(chatroomId,
                Envelope.builder(USER_LEFT)
                        .put("user_id", userId)
                        .put(CHATROOM_ID, chatroomId)
                        .withTimestamp()
                        .build(),
                userId);
    }
}
