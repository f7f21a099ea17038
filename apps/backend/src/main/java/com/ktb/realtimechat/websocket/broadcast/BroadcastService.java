package com.ktb.realtimechat.websocket.broadcast;

import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.Set;

/**
 * 채팅 이벤트 브로드캐스트 서비스 인터페이스.
 *
 * 모든 구현은 이 프로세스의 연결에 먼저 직접 전달한다.
 * 멀티 서버 환경에서는 Redis Pub/Sub 로 다른 서버에도 전파한다.
 */
public interface BroadcastService {

    /**
     * 채팅방 멤버에게 브로드캐스트
     *
     * @param chatroomId    대상 채팅방 ID
     * @param envelope      전송할 이벤트
     * @param excludeUserId 제외할 사용자 (nullable)
     */
    void broadcastToRoom(String chatroomId, Envelope envelope, String excludeUserId);

    default void broadcastToRoom(String chatroomId, Envelope envelope) {
        broadcastToRoom(chatroomId, envelope, null);
    }

    /**
     * 특정 사용자의 모든 연결에 전송
     */
    void broadcastToUser(String userId, Envelope envelope);

    /**
     * 접속 중인 모든 사용자에게 전송
     */
    void broadcastToAll(Envelope envelope, String excludeUserId);

    /**
     * 접속 상태 변경 알림.
     * 각 서버는 chatroomIds 의 로컬 멤버 합집합(subjectUserId 제외)에 한 번씩 전달한다.
     */
    void broadcastPresence(Set<String> chatroomIds, String subjectUserId, Envelope envelope);
}
