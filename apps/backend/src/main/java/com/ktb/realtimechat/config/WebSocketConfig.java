package com.ktb.realtimechat.config;

import com.ktb.realtimechat.websocket.ChatWebSocketHandler;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * 순수 WebSocket 엔드포인트 등록.
 *
 * 클라이언트는 {@code ws://host/ws?token=<access token>} 으로 접속하고
 * {"event": ..., "data": {...}} 형식의 텍스트 프레임을 주고받는다.
 */
@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;

    @Value("${chat.websocket.path:/ws}")
    private String path;

    @Value("${chat.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, path)
                .setAllowedOriginPatterns(allowedOrigins);
        log.info("WebSocket 엔드포인트 등록 - path: {}", path);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(
            @Value("${chat.websocket.max-text-message-size:1048576}") int maxTextMessageSize) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        return container;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
