package com.ktb.realtimechat.websocket.handler;

import com.ktb.realtimechat.websocket.ChatConnection;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.Set;

/**
 * 인바운드 이벤트 처리기. ChatWebSocketHandler 가 event 이름으로 라우팅한다.
 *
 * 구현체는 ACTIVE 상태 연결에서만 호출된다.
 * 예외는 해당 이벤트 범위에서 처리되며 연결을 닫지 않는다.
 */
public interface EnvelopeHandler {

    /** 처리하는 event 이름 */
    Set<String> events();

    void handle(ChatConnection connection, Envelope envelope);
}
