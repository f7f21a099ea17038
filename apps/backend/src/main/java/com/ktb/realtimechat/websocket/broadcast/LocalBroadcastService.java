package com.ktb.realtimechat.websocket.broadcast;

import com.ktb.realtimechat.websocket.Dispatcher;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 로컬 브로드캐스트 서비스 (단일 서버용).
 *
 * 개발/테스트 환경 또는 단일 인스턴스 배포 시 사용.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "chat.broadcast.type", havingValue = "local")
@RequiredArgsConstructor
public class LocalBroadcastService implements BroadcastService {

    private final Dispatcher dispatcher;

    @Override
    public void broadcastToRoom(String chatroomId, Envelope envelope, String excludeUserId) {
        int delivered = dispatcher.toChatroom(chatroomId, envelope, excludeUserId);
        log.debug("Broadcast to chatroom (local) - chatroomId: {}, event: {}, delivered: {}",
                chatroomId, envelope.event(), delivered);
    }

    @Override
    public void broadcastToUser(String userId, Envelope envelope) {
        dispatcher.toUser(userId, envelope);
    }

    @Override
    public void broadcastToAll(Envelope envelope, String excludeUserId) {
        dispatcher.toAll(envelope, excludeUserId);
    }

    @Override
    public void broadcastPresence(Set<String> chatroomIds, String subjectUserId, Envelope envelope) {
        int delivered = dispatcher.toMembersOf(chatroomIds, envelope, subjectUserId);
        log.debug("Presence broadcast (local) - userId: {}, event: {}, delivered: {}",
                subjectUserId, envelope.event(), delivered);
    }
}
