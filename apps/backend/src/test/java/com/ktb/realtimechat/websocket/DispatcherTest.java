package com.ktb.realtimechat.websocket;

import static org.assertj.core.api.Assertions.assertThat;

import com.ktb.realtimechat.websocket.protocol.Envelope;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DispatcherTest {

    private final RealtimeTestFixture fixture = new RealtimeTestFixture();
    private final Dispatcher dispatcher = fixture.dispatcher;

    private Envelope envelope(String event, int seq) {
        return Envelope.builder(event).put("seq", seq).build();
    }

    @Test
    void toChatroomSkipsExcludedUserAndNonMembers() {
        FakeWebSocketSession a = fixture.connect("a");
        FakeWebSocketSession b = fixture.connect("b");
        FakeWebSocketSession c = fixture.connect("c");
        fixture.index.join("a", "r1");
        fixture.index.join("b", "r1");

        int delivered = dispatcher.toChatroom("r1", envelope("custom", 1), "a");

        assertThat(delivered).isEqualTo(1);
        assertThat(b.dataOf("custom")).hasSize(1);
        assertThat(a.dataOf("custom")).isEmpty();
        assertThat(c.dataOf("custom")).isEmpty();
    }

    @Test
    void toChatroomCountsEveryConnectionOfEachMember() {
        FakeWebSocketSession b1 = fixture.connect("b");
        FakeWebSocketSession b2 = fixture.connect("b");
        fixture.index.join("b", "r1");

        assertThat(dispatcher.toChatroom("r1", envelope("custom", 1))).isEqualTo(2);
        assertThat(b1.dataOf("custom")).hasSize(1);
        assertThat(b2.dataOf("custom")).hasSize(1);
    }

    @Test
    void toChatroomWithoutMembersDeliversNothing() {
        assertThat(dispatcher.toChatroom("empty", envelope("custom", 1), null)).isZero();
    }

    @Test
    void toAllReachesEveryOnlineUserExceptExcluded() {
        FakeWebSocketSession a = fixture.connect("a");
        FakeWebSocketSession b = fixture.connect("b");

        assertThat(dispatcher.toAll(envelope("announce", 1), "a")).isEqualTo(1);
        assertThat(a.dataOf("announce")).isEmpty();
        assertThat(b.dataOf("announce")).hasSize(1);
    }

    @Test
    void toMembersOfDeliversOncePerSharedUser() {
        fixture.connect("a");
        FakeWebSocketSession b = fixture.connect("b");
        fixture.index.join("a", "r1");
        fixture.index.join("a", "r2");
        fixture.index.join("b", "r1");
        fixture.index.join("b", "r2");

        dispatcher.toMembersOf(List.of("r1", "r2"), envelope("custom", 1), "a");

        assertThat(b.dataOf("custom")).hasSize(1);
    }

    @Test
    void preservesOrderFromOneOriginToOneRecipient() {
        FakeWebSocketSession b = fixture.connect("b");
        fixture.index.join("b", "r1");

        for (int i = 1; i <= 5; i++) {
            dispatcher.toChatroom("r1", envelope("custom", i), "a");
        }

        assertThat(b.dataOf("custom")).extracting(data -> data.get("seq")).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    void failingRecipientDoesNotAffectOthers() {
        FakeWebSocketSession broken = fixture.connect("broken");
        FakeWebSocketSession healthy = fixture.connect("healthy");
        fixture.index.join("broken", "r1");
        fixture.index.join("healthy", "r1");
        broken.failOnSend();

        dispatcher.toChatroom("r1", envelope("custom", 1), null);

        assertThat(healthy.dataOf("custom")).hasSize(1);
        assertThat(fixture.registry.isOnline("broken")).isFalse();
        assertThat(fixture.index.isMember("broken", "r1")).isFalse();
        assertThat(healthy.dataOf("user_offline"))
                .extracting(data -> data.get("user_id"))
                .containsExactly("broken");
    }

    @Test
    void toUserReachesAllConnectionsOfTheUser() {
        FakeWebSocketSession a1 = fixture.connect("a");
        FakeWebSocketSession a2 = fixture.connect("a");

        assertThat(dispatcher.toUser("a", envelope("direct", 1))).isEqualTo(2);
        assertThat(a1.dataOf("direct")).containsExactly(Map.of("seq", 1));
        assertThat(a2.dataOf("direct")).containsExactly(Map.of("seq", 1));
    }
}
