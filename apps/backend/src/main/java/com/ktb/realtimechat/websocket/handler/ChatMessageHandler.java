package com.ktb.realtimechat.websocket.handler;

import com.ktb.realtimechat.exception.AuthorizationDeniedException;
import com.ktb.realtimechat.exception.MalformedEnvelopeException;
import com.ktb.realtimechat.model.Message;
import com.ktb.realtimechat.model.MessageType;
import com.ktb.realtimechat.service.ChatroomAccessService;
import com.ktb.realtimechat.service.MessagePersistenceService;
import com.ktb.realtimechat.websocket.ChatConnection;
import com.ktb.realtimechat.websocket.SocketUser;
import com.ktb.realtimechat.websocket.SubscriptionIndex;
import com.ktb.realtimechat.websocket.broadcast.BroadcastService;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import static com.ktb.realtimechat.websocket.ChatEvents.*;

/**
 * 채팅 메시지 전송 처리 핸들러
 *
 * [처리 순서]
 * 1. 구독 여부 / 권한 확인
 * 2. 메시지 생성 (id, timestamp 부여)
 * 3. 비동기 저장 요청
 * 4. 보낸 사람을 포함한 채팅방 전체에 브로드캐스트
 *
 * 저장 결과와 무관하게 브로드캐스트한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatMessageHandler implements EnvelopeHandler {

    static final int MAX_CONTENT_LENGTH = 4000;

    private final SubscriptionIndex subscriptionIndex;
    private final ChatroomAccessService chatroomAccessService;
    private final MessagePersistenceService messagePersistenceService;
    private final BroadcastService broadcastService;

    @Override
    public Set<String> events() {
        return Set.of(SEND_MESSAGE);
    }

    @Override
    public void handle(ChatConnection connection, Envelope envelope) {
        SocketUser user = connection.getUser();
        String chatroomId = envelope.requireString(CHATROOM_ID);
        String content = envelope.requireString("content");
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new MalformedEnvelopeException("Message content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }
        MessageType messageType = resolveType(envelope.optionalString("message_type"));

        if (!subscriptionIndex.isMember(user.id(), chatroomId)) {
            throw new AuthorizationDeniedException(user.id(), chatroomId, "Not subscribed to chatroom");
        }
        chatroomAccessService.checkAccess(user.id(), chatroomId);

        Message message = Message.builder()
                .id(new ObjectId().toHexString())
                .chatroomId(chatroomId)
                .userId(user.id())
                .username(user.name())
                .displayName(user.displayName())
                .content(content)
                .messageType(messageType)
                .clientId(envelope.optionalString("client_id"))
                .timestamp(Instant.now())
                .edited(false)
                .build();

        messagePersistenceService.saveAsync(message);

        log.debug("Message accepted - id: {}, userId: {}, chatroomId: {}", message.getId(), user.id(), chatroomId);

        broadcastService.broadcastToRoom(chatroomId,
                Envelope.builder(MESSAGE_RECEIVED)
                        .put("message", toPayload(message))
                        .build());
    }

    private MessageType resolveType(String value) {
        if (value == null) {
            return MessageType.text;
        }
        MessageType type = MessageType.from(value);
        if (type == null || type == MessageType.system) {
            throw new MalformedEnvelopeException("Unsupported message_type: " + value);
        }
        return type;
    }

    private Map<String, Object> toPayload(Message message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", message.getId());
        payload.put(CHATROOM_ID, message.getChatroomId());
        payload.put("user_id", message.getUserId());
        payload.put("username", message.getUsername());
        payload.put("display_name", message.getDisplayName());
        payload.put("content", message.getContent());
        payload.put("message_type", message.getMessageType().name());
        payload.put("timestamp", message.getTimestamp().toString());
        payload.put("client_id", message.getClientId());
        payload.put("edited", message.isEdited());
        payload.put("reactions", List.of());
        return payload;
    }
}
