package com.ktb.realtimechat.websocket.pubsub;

import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Redis Pub/Sub 를 통해 서버 간 전달되는 브로드캐스트 이벤트.
 *
 * [흐름]
 * 1. 서버1에서 유저A가 메시지 전송
 * 2. 서버1이 자기 연결에 직접 전달하고 ChatBroadcastEvent 를 Redis 에 PUBLISH
 * 3. 서버2~N 이 이벤트를 수신해 각자의 로컬 멤버에게 전달
 * 4. 서버1은 originId 가 자기 자신이므로 무시
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatBroadcastEvent {

    public static final String TYPE_CHATROOM = "CHATROOM";
    public static final String TYPE_USER = "USER";
    public static final String TYPE_ALL = "ALL";
    public static final String TYPE_PRESENCE = "PRESENCE";

    /** 발행 서버의 ServerInstance id */
    private String originId;

    /** TYPE_* 중 하나 */
    private String targetType;

    /**
     * CHATROOM: 채팅방 ID, USER: 사용자 ID, PRESENCE: 상태가 바뀐 사용자 ID
     */
    private String targetId;

    /** PRESENCE 전용. 알림 대상 채팅방 */
    private Set<String> chatroomIds;

    private String excludeUserId;

    /** Envelope event 이름 */
    private String event;

    /** Envelope data. 클라이언트에게 그대로 전달됨 */
    private Map<String, Object> data;
}
