package com.ktb.realtimechat.websocket;

import org.springframework.web.socket.CloseStatus;

/**
 * 애플리케이션 정의 WebSocket close code (4000-4999).
 */
public final class ChatCloseStatus {

    public static final CloseStatus SERVER_ERROR = new CloseStatus(4000, "Server error");
    public static final CloseStatus IDLE_TIMEOUT = new CloseStatus(4001, "Connection timeout");
    public static final CloseStatus AUTHENTICATION_FAILED = new CloseStatus(4401, "Authentication failed");
    public static final CloseStatus TOO_MANY_CONNECTIONS = new CloseStatus(4429, "Too many connections");

    private ChatCloseStatus() {
    }
}
