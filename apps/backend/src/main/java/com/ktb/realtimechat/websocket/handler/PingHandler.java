package com.ktb.realtimechat.websocket.handler;

import com.ktb.realtimechat.websocket.ChatConnection;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import com.ktb.realtimechat.websocket.protocol.EnvelopeCodec;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.ktb.realtimechat.websocket.ChatEvents.*;

/**
 * ping 을 보낸 연결에만 pong 으로 응답한다.
 */
@Component
@RequiredArgsConstructor
public class PingHandler implements EnvelopeHandler {

    private final EnvelopeCodec envelopeCodec;

    @Override
    public Set<String> events() {
        return Set.of(PING);
    }

    @Override
    public void handle(ChatConnection connection, Envelope envelope) {
        connection.enqueue(envelopeCodec.toTextMessage(
                Envelope.builder(PONG).withTimestamp().build()));
    }
}
