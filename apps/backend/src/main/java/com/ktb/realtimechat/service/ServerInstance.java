package com.ktb.realtimechat.service;

import jakarta.annotation.PostConstruct;
import java.util.UUID;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import static java.net.InetAddress.getLocalHost;

/**
 * 현재 프로세스 식별자.
 *
 * Redis 로 발행한 이벤트에 originId 로 실려, 자기 자신이 보낸 이벤트를 다시 전달하지 않도록 한다.
 * 같은 호스트에서 여러 프로세스가 떠도 겹치지 않도록 난수 접미사를 붙인다.
 */
@Slf4j
@Component
public class ServerInstance {

    @Value("${HOSTNAME:}")
    private String hostName;

    @Getter
    private String id;

    @PostConstruct
    public void init() {
        if (hostName == null || hostName.isBlank()) {
            hostName = generateHostname();
        }
        id = hostName + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Server instance id: {}", id);
    }

    private String generateHostname() {
        try {
            return getLocalHost().getHostName();
        } catch (Exception e) {
            return "unknown";
        }
    }
}
