package com.ktb.realtimechat.websocket.broadcast;

import static org.assertj.core.api.Assertions.assertThat;

import com.ktb.realtimechat.websocket.FakeWebSocketSession;
import com.ktb.realtimechat.websocket.RealtimeTestFixture;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import org.junit.jupiter.api.Test;

class LocalBroadcastServiceTest {

    private final RealtimeTestFixture fixture = new RealtimeTestFixture();

    @Test
    void deliversToLocalConnectionsOnly() {
        FakeWebSocketSession a = fixture.connect("a");
        FakeWebSocketSession b = fixture.connect("b");
        fixture.index.join("a", "r1");

        fixture.broadcastService.broadcastToRoom("r1", Envelope.builder("custom").build());
        fixture.broadcastService.broadcastToUser("b", Envelope.builder("direct").build());
        fixture.broadcastService.broadcastToAll(Envelope.builder("notice").build(), "a");

        assertThat(a.events()).containsExactly("connected", "custom");
        assertThat(b.events()).containsExactly("connected", "direct", "notice");
    }
}
