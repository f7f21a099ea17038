package com.ktb.realtimechat.websocket.pubsub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;

class RedisMessagePublisherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    @SuppressWarnings("unchecked")
    private final RedisTemplate<String, String> redisTemplate = mock(RedisTemplate.class);
    private final RedisMessagePublisher publisher = new RedisMessagePublisher(redisTemplate, objectMapper);

    private final ChatBroadcastEvent event = ChatBroadcastEvent.builder()
            .originId("server-a")
            .targetType(ChatBroadcastEvent.TYPE_CHATROOM)
            .targetId("r1")
            .event("message_received")
            .data(Map.of("content", "hi"))
            .build();

    @Test
    void publishesJsonToChannel() throws Exception {
        publisher.publish("chatroom:r1", event);

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("chatroom:r1"), message.capture());
        assertThat(objectMapper.readValue(message.getValue(), ChatBroadcastEvent.class)).isEqualTo(event);
    }

    @Test
    void publishFailureIsNotPropagated() {
        when(redisTemplate.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("redis down"));

        assertThatCode(() -> publisher.publish("chatroom:r1", event)).doesNotThrowAnyException();
    }
}
