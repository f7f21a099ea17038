package com.ktb.realtimechat.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 쓰기 도중 멈춘 연결 감시.
 *
 * 더 보낼 프레임이 없는 연결은 enqueue 경로의 검사를 다시 거치지 않으므로 주기적으로 직접 확인한다.
 * 멈춘 연결은 실패 처리되어 drain 스레드를 반납하고, 실패 리스너를 통해 Registry 에서 빠진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StalledSendWatchdog {

    private final ConnectionRegistry connectionRegistry;

    @Scheduled(fixedDelayString = "${chat.websocket.stall-check-interval:1000}")
    public void sweep() {
        int failed = 0;
        for (ChatConnection connection : connectionRegistry.connections()) {
            if (connection.failIfSendStalled()) {
                log.warn("[STALLED] userId={} connectionId={}", connection.getUserId(), connection.getConnectionId());
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Stalled connections closed: {}", failed);
        }
    }
}
