package com.ktb.realtimechat.websocket;

/**
 * 연결별 프로토콜 상태. CLOSED 는 종료 상태.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    ACTIVE,
    CLOSED
}
