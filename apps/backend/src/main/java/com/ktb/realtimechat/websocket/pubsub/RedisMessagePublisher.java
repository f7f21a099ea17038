package com.ktb.realtimechat.websocket.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis Pub/Sub 메시지 발행자.
 *
 * [흐름]
 * RedisBroadcastService → RedisMessagePublisher.publish() → Redis → 다른 서버의 Subscriber
 *
 * 재시도하지 않는다. 직렬화/발행 실패는 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.broadcast.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisMessagePublisher {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String channel, ChatBroadcastEvent event) {
        try {
            String message = objectMapper.writeValueAsString(event);
            redisTemplate.convertAndSend(channel, message);

            log.debug("Redis Pub/Sub 메시지 발행 - channel: {}, type: {}, event: {}",
                    channel, event.getTargetType(), event.getEvent());
        } catch (JsonProcessingException e) {
            log.error("Redis 메시지 직렬화 실패 - channel: {}, event: {}", channel, event.getEvent(), e);
        } catch (DataAccessException e) {
            log.warn("Redis 메시지 발행 실패 - channel: {}, event: {}, reason: {}",
                    channel, event.getEvent(), e.getMessage());
        }
    }
}
