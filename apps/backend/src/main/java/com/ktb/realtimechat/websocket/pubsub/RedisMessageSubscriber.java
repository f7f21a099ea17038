package com.ktb.realtimechat.websocket.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.realtimechat.service.ServerInstance;
import com.ktb.realtimechat.websocket.ConnectionRegistry;
import com.ktb.realtimechat.websocket.Dispatcher;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Redis Pub/Sub 메시지 수신자.
 *
 *   Redis (Pub/Sub)  →  RedisMessageSubscriber  →  Dispatcher (이 서버의 연결)
 *
 * - 각 서버는 자신에게 연결된 사용자에게만 전달한다
 * - 자기 자신이 발행한 이벤트는 이미 로컬 전달이 끝났으므로 무시한다
 * - presence 는 대상 사용자가 이 서버에 연결되어 있으면 무시한다.
 *   이 서버의 멤버에게는 로컬 연결 기준 online 상태가 이미 알려져 있다
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.broadcast.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisMessageSubscriber {

    private final Dispatcher dispatcher;
    private final ConnectionRegistry connectionRegistry;
    private final ServerInstance serverInstance;
    private final ObjectMapper objectMapper;

    /**
     * RedisMessageListenerContainer 가 호출.
     *
     * @param message Redis 에서 수신한 JSON 문자열
     */
    public void onMessage(String message) {
        ChatBroadcastEvent event;
        try {
            event = objectMapper.readValue(message, ChatBroadcastEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Redis 메시지 역직렬화 실패 - reason: {}", e.getOriginalMessage());
            return;
        }

        if (serverInstance.getId().equals(event.getOriginId())) {
            return;
        }

        log.debug("Redis 메시지 수신 - origin: {}, type: {}, target: {}, event: {}",
                event.getOriginId(), event.getTargetType(), event.getTargetId(), event.getEvent());

        try {
            dispatch(event);
        } catch (RuntimeException e) {
            log.error("Redis 메시지 처리 실패 - type: {}, event: {}", event.getTargetType(), event.getEvent(), e);
        }
    }

    private void dispatch(ChatBroadcastEvent event) {
        if (event.getTargetType() == null || event.getEvent() == null) {
            log.warn("Redis 메시지 무시 - 대상 또는 이벤트 누락: {}", event);
            return;
        }
        Envelope envelope = new Envelope(event.getEvent(), event.getData(), null);

        switch (event.getTargetType()) {
            case ChatBroadcastEvent.TYPE_CHATROOM ->
                    dispatcher.toChatroom(event.getTargetId(), envelope, event.getExcludeUserId());
            case ChatBroadcastEvent.TYPE_USER -> dispatcher.toUser(event.getTargetId(), envelope);
            case ChatBroadcastEvent.TYPE_ALL -> dispatcher.toAll(envelope, event.getExcludeUserId());
            case ChatBroadcastEvent.TYPE_PRESENCE -> {
                if (event.getTargetId() != null && connectionRegistry.isOnline(event.getTargetId())) {
                    log.debug("Remote presence ignored - userId: {} is connected here, event: {}",
                            event.getTargetId(), event.getEvent());
                    return;
                }
                if (event.getChatroomIds() != null) {
                    dispatcher.toMembersOf(event.getChatroomIds(), envelope, event.getExcludeUserId());
                }
            }
            default -> log.warn("Redis 메시지 무시 - 알 수 없는 타입: {}", event.getTargetType());
        }
    }
}
