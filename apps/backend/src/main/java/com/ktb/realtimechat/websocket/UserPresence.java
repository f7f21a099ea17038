package com.ktb.realtimechat.websocket;

import java.time.Instant;

/**
 * 사용자 접속 상태 조회 결과.
 *
 * @param online   연결이 하나 이상 등록되어 있으면 true
 * @param lastSeen 마지막 online/offline 전이 시각. 한 번도 접속하지 않았으면 null
 */
public record UserPresence(String userId, boolean online, Instant lastSeen) {
}
