package com.ktb.realtimechat.websocket.broadcast;

import com.ktb.realtimechat.config.RedisPubSubConfig;
import com.ktb.realtimechat.service.ServerInstance;
import com.ktb.realtimechat.websocket.Dispatcher;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import com.ktb.realtimechat.websocket.pubsub.ChatBroadcastEvent;
import com.ktb.realtimechat.websocket.pubsub.RedisMessagePublisher;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Redis Pub/Sub 기반 브로드캐스트 서비스.
 *
 * 1. 이 서버의 연결에는 Dispatcher 로 바로 전달
 * 2. 같은 이벤트를 Redis 에 PUBLISH 하면 다른 서버의 Subscriber 가 각자의 연결에 전달
 *
 * 발행 이벤트에는 originId 가 실리며, 자기 자신이 보낸 이벤트는 Subscriber 가 무시한다.
 * 발행 실패는 로그만 남긴다 (at-most-once).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "chat.broadcast.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisBroadcastService implements BroadcastService {

    private final Dispatcher dispatcher;
    private final RedisMessagePublisher redisMessagePublisher;
    private final ServerInstance serverInstance;

    @Override
    public void broadcastToRoom(String chatroomId, Envelope envelope, String excludeUserId) {
        dispatcher.toChatroom(chatroomId, envelope, excludeUserId);

        ChatBroadcastEvent event = baseEvent(ChatBroadcastEvent.TYPE_CHATROOM, envelope)
                .targetId(chatroomId)
                .excludeUserId(excludeUserId)
                .build();
        redisMessagePublisher.publish(RedisPubSubConfig.CHATROOM_CHANNEL_PREFIX + chatroomId, event);

        log.debug("Broadcast to chatroom via Redis - chatroomId: {}, event: {}", chatroomId, envelope.event());
    }

    @Override
    public void broadcastToUser(String userId, Envelope envelope) {
        dispatcher.toUser(userId, envelope);

        ChatBroadcastEvent event = baseEvent(ChatBroadcastEvent.TYPE_USER, envelope)
                .targetId(userId)
                .build();
        redisMessagePublisher.publish(RedisPubSubConfig.USER_CHANNEL_PREFIX + userId, event);
    }

    @Override
    public void broadcastToAll(Envelope envelope, String excludeUserId) {
        dispatcher.toAll(envelope, excludeUserId);

        ChatBroadcastEvent event = baseEvent(ChatBroadcastEvent.TYPE_ALL, envelope)
                .excludeUserId(excludeUserId)
                .build();
        redisMessagePublisher.publish(RedisPubSubConfig.BROADCAST_ALL_CHANNEL, event);
    }

    @Override
    public void broadcastPresence(Set<String> chatroomIds, String subjectUserId, Envelope envelope) {
        dispatcher.toMembersOf(chatroomIds, envelope, subjectUserId);

        ChatBroadcastEvent event = baseEvent(ChatBroadcastEvent.TYPE_PRESENCE, envelope)
                .targetId(subjectUserId)
                .chatroomIds(Set.copyOf(chatroomIds))
                .excludeUserId(subjectUserId)
                .build();
        redisMessagePublisher.publish(RedisPubSubConfig.PRESENCE_CHANNEL, event);

        log.debug("Presence broadcast via Redis - userId: {}, event: {}, chatrooms: {}",
                subjectUserId, envelope.event(), chatroomIds.size());
    }

    private ChatBroadcastEvent.ChatBroadcastEventBuilder baseEvent(String targetType, Envelope envelope) {
        return ChatBroadcastEvent.builder()
                .originId(serverInstance.getId())
                .targetType(targetType)
                .event(envelope.event())
                .data(envelope.data());
    }
}
