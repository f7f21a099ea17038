package com.ktb.realtimechat.websocket.handler;

import com.ktb.realtimechat.websocket.ChatConnection;
import com.ktb.realtimechat.websocket.SocketUser;
import com.ktb.realtimechat.websocket.SubscriptionIndex;
import com.ktb.realtimechat.websocket.broadcast.BroadcastService;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.ktb.realtimechat.websocket.ChatEvents.*;

@Slf4j
@Component
@RequiredArgsConstructor
public class TypingHandler implements EnvelopeHandler {

    private final SubscriptionIndex subscriptionIndex;
    private final BroadcastService broadcastService;

    @Override
    public Set<String> events() {
        return Set.of(TYPING_START, TYPING_STOP);
    }

    @Override
    public void handle(ChatConnection connection, Envelope envelope) {
        SocketUser user = connection.getUser();
        String chatroomId = envelope.requireString(CHATROOM_ID);

        // 비구독 채팅방의 타이핑은 조용히 무시
        if (!subscriptionIndex.isMember(user.id(), chatroomId)) {
            log.debug("Typing ignored - userId: {}, chatroomId: {}", user.id(), chatroomId);
            return;
        }

        broadcastService.broadcastToRoom(chatroomId,
                Envelope.builder(TYPING_INDICATOR)
                        .put("user_id", user.id())
                        .put("username", user.name())
                        .put(CHATROOM_ID, chatroomId)
                        .put("is_typing", TYPING_START.equals(envelope.event()))
                        .withTimestamp()
                        .build(),
                user.id());
    }
}
