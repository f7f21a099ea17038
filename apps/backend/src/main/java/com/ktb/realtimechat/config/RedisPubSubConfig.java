package com.ktb.realtimechat.config;

import com.ktb.realtimechat.websocket.pubsub.RedisMessageSubscriber;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * Redis Pub/Sub 설정.
 *
 * [채널]
 * - chatroom:{chatroomId}  채팅방 이벤트 (메시지, 입장/퇴장, 타이핑)
 * - user:{userId}          특정 사용자 대상 이벤트
 * - broadcast:all          전체 접속자 대상 이벤트
 * - presence               online/offline 알림
 *
 * 모든 서버가 위 채널을 구독하고, 수신한 이벤트를 자기 연결에만 전달한다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.broadcast.type", havingValue = "redis", matchIfMissing = true)
public class RedisPubSubConfig {

    public static final String CHATROOM_CHANNEL_PREFIX = "chatroom:";
    public static final String USER_CHANNEL_PREFIX = "user:";
    public static final String BROADCAST_ALL_CHANNEL = "broadcast:all";
    public static final String PRESENCE_CHANNEL = "presence";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter listenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);

        List<Topic> topics = List.of(
                new PatternTopic(CHATROOM_CHANNEL_PREFIX + "*"),
                new PatternTopic(USER_CHANNEL_PREFIX + "*"),
                new ChannelTopic(BROADCAST_ALL_CHANNEL),
                new ChannelTopic(PRESENCE_CHANNEL)
        );
        container.addMessageListener(listenerAdapter, topics);

        log.info("Redis Pub/Sub 리스너 등록 완료 - 채널: {}", topics);
        return container;
    }

    @Bean
    public MessageListenerAdapter listenerAdapter(RedisMessageSubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "onMessage");
    }
}
