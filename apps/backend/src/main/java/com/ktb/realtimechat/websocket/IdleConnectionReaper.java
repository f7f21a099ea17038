package com.ktb.realtimechat.websocket;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 일정 시간 동안 인바운드 프레임이 없는 연결을 4001 로 닫는다.
 */
@Slf4j
@Component
public class IdleConnectionReaper {

    private final ConnectionRegistry connectionRegistry;
    private final ChatWebSocketHandler chatWebSocketHandler;
    private final Duration idleTimeout;
    private final Clock clock;

    public IdleConnectionReaper(ConnectionRegistry connectionRegistry,
                                ChatWebSocketHandler chatWebSocketHandler,
                                @Value("${chat.websocket.idle-timeout:30m}") Duration idleTimeout,
                                Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.chatWebSocketHandler = chatWebSocketHandler;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${chat.websocket.reaper-interval:60000}")
    public void reap() {
        Instant threshold = clock.instant().minus(idleTimeout);
        int reaped = 0;
        for (ChatConnection connection : connectionRegistry.connections()) {
            if (connection.getLastActivity().isBefore(threshold)) {
                log.info("[IDLE] userId={} connectionId={} lastActivity={}",
                        connection.getUserId(), connection.getConnectionId(), connection.getLastActivity());
                chatWebSocketHandler.terminate(connection, ChatCloseStatus.IDLE_TIMEOUT);
                reaped++;
            }
        }
        if (reaped > 0) {
            log.info("Idle connections closed: {}", reaped);
        }
    }
}
