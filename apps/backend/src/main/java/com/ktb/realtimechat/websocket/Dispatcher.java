package com.ktb.realtimechat.websocket;

import com.ktb.realtimechat.websocket.protocol.Envelope;
import com.ktb.realtimechat.websocket.protocol.EnvelopeCodec;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

/**
 * 이 프로세스에 연결된 사용자에게 Envelope 을 전달한다.
 *
 * [전송 방식]
 * - Envelope 은 한 번만 직렬화하고 같은 프레임을 수신자별 큐에 넣는다
 * - 실제 쓰기는 각 연결의 drain 작업이 하므로 느린 수신자가 다른 수신자를 막지 않는다
 * - 한 수신자의 실패는 로그만 남기고 나머지 전달을 계속한다
 *
 * 반환값은 프레임을 받은 연결 수.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Dispatcher {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionIndex subscriptionIndex;
    private final EnvelopeCodec envelopeCodec;

    public int toUser(String userId, Envelope envelope) {
        return fanOut(Set.of(userId), envelope, null);
    }

    public int toChatroom(String chatroomId, Envelope envelope) {
        return toChatroom(chatroomId, envelope, null);
    }

    public int toChatroom(String chatroomId, Envelope envelope, String excludeUserId) {
        Set<String> members = subscriptionIndex.members(chatroomId);
        int delivered = fanOut(members, envelope, excludeUserId);
        log.debug("Dispatch to chatroom - chatroomId: {}, event: {}, members: {}, delivered: {}",
                chatroomId, envelope.event(), members.size(), delivered);
        return delivered;
    }

    public int toAll(Envelope envelope, String excludeUserId) {
        return fanOut(connectionRegistry.onlineUsers(), envelope, excludeUserId);
    }

    public int toUsers(Collection<String> userIds, Envelope envelope) {
        return fanOut(userIds, envelope, null);
    }

    /**
     * 여러 채팅방 멤버의 합집합에 전달한다. 여러 방에 속한 사용자도 한 번만 받는다.
     */
    public int toMembersOf(Collection<String> chatroomIds, Envelope envelope, String excludeUserId) {
        Set<String> recipients = new LinkedHashSet<>();
        for (String chatroomId : chatroomIds) {
            recipients.addAll(subscriptionIndex.members(chatroomId));
        }
        return fanOut(recipients, envelope, excludeUserId);
    }

    private int fanOut(Collection<String> userIds, Envelope envelope, String excludeUserId) {
        if (userIds.isEmpty()) {
            return 0;
        }

        TextMessage frame = envelopeCodec.toTextMessage(envelope);
        int delivered = 0;
        for (String userId : userIds) {
            if (userId.equals(excludeUserId)) {
                continue;
            }
            try {
                delivered += connectionRegistry.deliver(userId, frame);
            } catch (RuntimeException e) {
                log.error("Dispatch failed - userId: {}, event: {}", userId, envelope.event(), e);
            }
        }
        return delivered;
    }
}
