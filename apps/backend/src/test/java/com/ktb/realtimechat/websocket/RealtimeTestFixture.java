package com.ktb.realtimechat.websocket;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.realtimechat.service.ChatroomAccessService;
import com.ktb.realtimechat.service.MessagePersistenceService;
import com.ktb.realtimechat.websocket.broadcast.LocalBroadcastService;
import com.ktb.realtimechat.websocket.event.UserOfflineEvent;
import com.ktb.realtimechat.websocket.event.UserOnlineEvent;
import com.ktb.realtimechat.websocket.handler.ChatMessageHandler;
import com.ktb.realtimechat.websocket.handler.PingHandler;
import com.ktb.realtimechat.websocket.handler.RoomJoinHandler;
import com.ktb.realtimechat.websocket.handler.RoomLeaveHandler;
import com.ktb.realtimechat.websocket.handler.TypingHandler;
import com.ktb.realtimechat.websocket.protocol.EnvelopeCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

/**
 * 실제 코어 컴포넌트를 동기 전송 executor 로 묶은 단일 서버 구성.
 * 인증/권한/저장만 mock 이다.
 */
public class RealtimeTestFixture {

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final EnvelopeCodec codec = new EnvelopeCodec(objectMapper);
    public final SubscriptionIndex index = new SubscriptionIndex();
    public final ConnectionRegistry registry;
    public final Dispatcher dispatcher;
    public final LocalBroadcastService broadcastService;
    public final PresenceTracker presenceTracker;

    public final SocketAuthenticator authenticator = mock(SocketAuthenticator.class);
    public final ChatroomAccessService accessService = mock(ChatroomAccessService.class);
    public final MessagePersistenceService persistenceService = mock(MessagePersistenceService.class);

    public final ChatWebSocketHandler handler;

    private final AtomicInteger sessionSeq = new AtomicInteger();

    public RealtimeTestFixture() {
        this(5);
    }

    public RealtimeTestFixture(int maxConnectionsPerUser) {
        ApplicationEventPublisher publisher = event -> {
            if (event instanceof UserOnlineEvent online) {
                presenceTracker().onUserOnline(online);
            } else if (event instanceof UserOfflineEvent offline) {
                presenceTracker().onUserOffline(offline);
            }
        };
        registry = new ConnectionRegistry(index, codec, publisher);
        dispatcher = new Dispatcher(registry, index, codec);
        broadcastService = new LocalBroadcastService(dispatcher);
        presenceTracker = new PresenceTracker(registry, index, broadcastService);

        handler = new ChatWebSocketHandler(
                authenticator,
                registry,
                codec,
                List.of(
                        new RoomJoinHandler(index, registry, accessService, broadcastService),
                        new RoomLeaveHandler(index, broadcastService),
                        new ChatMessageHandler(index, accessService, persistenceService, broadcastService),
                        new TypingHandler(index, broadcastService),
                        new PingHandler(codec)
                ),
                Runnable::run,
                new SimpleMeterRegistry(),
                maxConnectionsPerUser,
                1000,
                Duration.ofSeconds(10));
    }

    private PresenceTracker presenceTracker() {
        return presenceTracker;
    }

    public static SocketUser user(String userId) {
        return new SocketUser(userId, userId + "-name", userId.toUpperCase());
    }

    /** 인증에 성공하는 새 연결 */
    public FakeWebSocketSession connect(String userId) {
        String token = "token-" + userId;
        when(authenticator.authenticate(token)).thenReturn(user(userId));
        FakeWebSocketSession session =
                FakeWebSocketSession.withToken(userId + "-s" + sessionSeq.incrementAndGet(), token);
        handler.afterConnectionEstablished(session);
        return session;
    }

    public void send(FakeWebSocketSession session, String json) {
        try {
            handler.handleMessage(session, new TextMessage(json));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public void join(FakeWebSocketSession session, String chatroomId) {
        send(session, "{\"event\":\"join_chatroom\",\"data\":{\"chatroom_id\":\"" + chatroomId + "\"}}");
    }

    /** 클라이언트 측 종료 */
    public void close(FakeWebSocketSession session) {
        session.close(CloseStatus.NORMAL);
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
    }
}
