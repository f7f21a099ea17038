package com.ktb.realtimechat.websocket.event;

import com.ktb.realtimechat.websocket.SocketUser;
import java.time.Instant;

/**
 * 사용자의 첫 연결이 등록되었을 때 ConnectionRegistry 가 발행.
 */
public record UserOnlineEvent(SocketUser user, Instant occurredAt) {
}
