package com.ktb.realtimechat.websocket.event;

import com.ktb.realtimechat.websocket.SocketUser;
import java.time.Instant;
import java.util.Set;

/**
 * 사용자의 마지막 연결이 제거되고 구독 정리가 끝난 뒤 ConnectionRegistry 가 발행.
 *
 * @param formerChatroomIds 정리 직전까지 구독 중이던 채팅방
 */
public record UserOfflineEvent(SocketUser user, Set<String> formerChatroomIds, Instant occurredAt) {
}
