package com.ktb.realtimechat.websocket;

import com.ktb.realtimechat.exception.AuthenticationFailureException;
import com.ktb.realtimechat.exception.AuthorizationDeniedException;
import com.ktb.realtimechat.exception.MalformedEnvelopeException;
import com.ktb.realtimechat.websocket.handler.EnvelopeHandler;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import com.ktb.realtimechat.websocket.protocol.EnvelopeCodec;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import static com.ktb.realtimechat.websocket.ChatEvents.*;

/**
 * WebSocket 연결 생명주기와 인바운드 이벤트 라우팅.
 *
 * [상태]
 * CONNECTING → AUTHENTICATED → ACTIVE → CLOSED
 * - 인증 실패: 4401 로 닫고 바로 CLOSED (Registry 에 등록되지 않음)
 * - 사용자당 연결 수 초과: 4429 로 닫음
 * - 등록 후 connected 이벤트가 이 연결의 첫 프레임
 *
 * [오류 처리]
 * 이벤트 하나의 실패(잘못된 JSON, 필드 누락, 권한 없음)는 연결을 닫지 않는다.
 * 권한 없음만 보낸 연결에 error 이벤트로 알린다.
 *
 * [종료]
 * 어느 쪽에서 닫히든(클라이언트, 트랜스포트 오류, 전송 실패, idle 정리) Registry.remove 로 모인다.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTR = "chatConnection";

    private final SocketAuthenticator socketAuthenticator;
    private final ConnectionRegistry connectionRegistry;
    private final EnvelopeCodec envelopeCodec;
    private final Map<String, EnvelopeHandler> handlers = new HashMap<>();
    private final Executor deliveryExecutor;
    private final int maxConnectionsPerUser;
    private final int outboundQueueLimit;
    private final Duration sendTimeLimit;

    public ChatWebSocketHandler(
            SocketAuthenticator socketAuthenticator,
            ConnectionRegistry connectionRegistry,
            EnvelopeCodec envelopeCodec,
            List<EnvelopeHandler> envelopeHandlers,
            @Qualifier("deliveryExecutor") Executor deliveryExecutor,
            MeterRegistry meterRegistry,
            @Value("${chat.websocket.max-connections-per-user:5}") int maxConnectionsPerUser,
            @Value("${chat.websocket.outbound-queue-limit:1000}") int outboundQueueLimit,
            @Value("${chat.websocket.send-time-limit:10s}") Duration sendTimeLimit
    ) {
        this.socketAuthenticator = socketAuthenticator;
        this.connectionRegistry = connectionRegistry;
        this.envelopeCodec = envelopeCodec;
        this.deliveryExecutor = deliveryExecutor;
        this.maxConnectionsPerUser = maxConnectionsPerUser;
        this.outboundQueueLimit = outboundQueueLimit;
        this.sendTimeLimit = sendTimeLimit;

        for (EnvelopeHandler handler : envelopeHandlers) {
            for (String event : handler.events()) {
                EnvelopeHandler previous = handlers.putIfAbsent(event, handler);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate handler for event '" + event + "': "
                            + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
                }
            }
        }

        Gauge.builder("chat.websocket.connections", connectionRegistry::totalConnections)
                .description("Current number of registered WebSocket connections")
                .register(meterRegistry);
        Gauge.builder("chat.websocket.online.users", () -> connectionRegistry.onlineUsers().size())
                .description("Current number of users with at least one connection")
                .register(meterRegistry);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ChatConnection connection = new ChatConnection(session, deliveryExecutor, outboundQueueLimit, sendTimeLimit);
        session.getAttributes().put(CONNECTION_ATTR, connection);

        SocketUser user;
        try {
            user = socketAuthenticator.authenticate(SocketAuthenticator.extractToken(session.getUri()));
        } catch (AuthenticationFailureException e) {
            log.info("[AUTH_FAILED] connectionId={} reason={}", session.getId(), e.getMessage());
            reject(connection, ChatCloseStatus.AUTHENTICATION_FAILED);
            return;
        } catch (RuntimeException e) {
            log.error("Authentication error - connectionId: {}", session.getId(), e);
            reject(connection, ChatCloseStatus.SERVER_ERROR);
            return;
        }

        if (!connection.authenticate(user)) {
            return;
        }

        // 동시 접속 시 한도를 약간 넘을 수 있다
        if (connectionRegistry.connectionCount(user.id()) >= maxConnectionsPerUser) {
            log.warn("Connection limit exceeded - userId: {}, limit: {}", user.id(), maxConnectionsPerUser);
            reject(connection, ChatCloseStatus.TOO_MANY_CONNECTIONS);
            return;
        }

        connection.onFailure((failed, failure) -> disconnect(failed, CloseStatus.SESSION_NOT_RELIABLE));

        connection.enqueue(envelopeCodec.toTextMessage(Envelope.builder(CONNECTED)
                .put("user_id", user.id())
                .put("username", user.name())
                .put("connection_id", connection.getConnectionId())
                .withTimestamp()
                .build()));

        connectionRegistry.add(user.id(), connection);

        // 등록 직전에 실패한 연결
        if (!connection.activate()) {
            connectionRegistry.remove(connection.getConnectionId());
            return;
        }

        log.info("[CONNECT] userId={} connectionId={} connections={}",
                user.id(), connection.getConnectionId(), connectionRegistry.connectionCount(user.id()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ChatConnection connection = connectionOf(session);
        if (connection == null || connection.getState() != ConnectionState.ACTIVE) {
            return;
        }
        connection.touch();

        Envelope envelope;
        try {
            envelope = envelopeCodec.decode(message.getPayload());
        } catch (MalformedEnvelopeException e) {
            log.warn("Malformed envelope ignored - userId: {}, reason: {}", connection.getUserId(), e.getMessage());
            return;
        }

        EnvelopeHandler handler = handlers.get(envelope.event());
        if (handler == null) {
            log.warn("Unknown event ignored - userId: {}, event: {}", connection.getUserId(), envelope.event());
            return;
        }

        try {
            handler.handle(connection, envelope);
        } catch (AuthorizationDeniedException e) {
            log.warn("Access denied - userId: {}, chatroomId: {}, event: {}",
                    e.getUserId(), e.getChatroomId(), envelope.event());
            sendError(connection, envelope, e);
        } catch (MalformedEnvelopeException e) {
            log.warn("Malformed envelope ignored - userId: {}, event: {}, reason: {}",
                    connection.getUserId(), envelope.event(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error handling event - userId: {}, event: {}", connection.getUserId(), envelope.event(), e);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ChatConnection connection = connectionOf(session);
        log.warn("Transport error - connectionId: {}, reason: {}", session.getId(), exception.getMessage());
        if (connection != null) {
            connection.close(CloseStatus.SERVER_ERROR);
            disconnect(connection, CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ChatConnection connection = connectionOf(session);
        if (connection != null) {
            disconnect(connection, status);
        }
    }

    /**
     * 서버 측 종료. 트랜스포트를 닫고 정상 종료 경로를 탄다.
     */
    public void terminate(ChatConnection connection, CloseStatus status) {
        connection.markClosed();
        connection.close(status);
        disconnect(connection, status);
    }

    private void disconnect(ChatConnection connection, CloseStatus status) {
        connection.markClosed();
        if (connectionRegistry.remove(connection.getConnectionId())) {
            log.info("[DISCONNECT] userId={} connectionId={} code={}",
                    connection.getUserId(), connection.getConnectionId(), status.getCode());
        }
    }

    private void reject(ChatConnection connection, CloseStatus status) {
        connection.markClosed();
        connection.close(status);
    }

    private void sendError(ChatConnection connection, Envelope request, AuthorizationDeniedException e) {
        connection.enqueue(envelopeCodec.toTextMessage(Envelope.builder(ERROR)
                .put("code", e.getCode())
                .put("message", e.getMessage())
                .put("event", request.event())
                .put(CHATROOM_ID, e.getChatroomId())
                .withTimestamp()
                .build()));
    }

    private ChatConnection connectionOf(WebSocketSession session) {
        return (ChatConnection) session.getAttributes().get(CONNECTION_ATTR);
    }
}
