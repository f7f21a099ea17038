package com.ktb.realtimechat.websocket;

import com.ktb.realtimechat.websocket.event.UserOfflineEvent;
import com.ktb.realtimechat.websocket.event.UserOnlineEvent;
import com.ktb.realtimechat.websocket.protocol.Envelope;
import com.ktb.realtimechat.websocket.protocol.EnvelopeCodec;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

/**
 * 사용자별 활성 연결 레지스트리.
 *
 * [구조]
 * - userId -> 연결 집합 (한 사용자가 여러 연결을 가질 수 있음)
 * - connectionId -> 연결
 *
 * [동기화]
 * - 사용자 키 단위 compute 로만 연결 집합을 바꾼다 (전역 락 없음)
 * - online 여부는 연결 집합 크기에서 계산하며 별도로 저장하지 않는다
 * - 마지막 연결 제거 시 같은 compute 안에서 구독을 정리하므로,
 *   같은 사용자의 재접속은 정리가 끝난 뒤에야 등록된다
 *
 * [이벤트]
 * - 첫 연결 등록: UserOnlineEvent
 * - 마지막 연결 제거: 구독 정리 후 UserOfflineEvent
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Map<String, Set<ChatConnection>> connectionsByUser = new ConcurrentHashMap<>();
    private final Map<String, ChatConnection> connectionsById = new ConcurrentHashMap<>();

    private final SubscriptionIndex subscriptionIndex;
    private final EnvelopeCodec envelopeCodec;
    private final ApplicationEventPublisher eventPublisher;

    public void add(String userId, ChatConnection connection) {
        if (!userId.equals(connection.getUserId())) {
            throw new IllegalArgumentException(
                    "Connection " + connection.getConnectionId() + " does not belong to user " + userId);
        }

        AtomicBoolean firstConnection = new AtomicBoolean();
        connectionsByUser.compute(userId, (id, current) -> {
            Set<ChatConnection> next = current != null ? current : ConcurrentHashMap.newKeySet();
            firstConnection.set(next.isEmpty());
            next.add(connection);
            connectionsById.put(connection.getConnectionId(), connection);
            return next;
        });

        log.debug("Connection registered - userId: {}, connectionId: {}, firstConnection: {}",
                userId, connection.getConnectionId(), firstConnection.get());

        if (firstConnection.get()) {
            eventPublisher.publishEvent(new UserOnlineEvent(connection.getUser(), Instant.now()));
        }
    }

    /**
     * 연결 제거. 여러 경로(트랜스포트 종료, 전송 실패, idle 정리)에서 동시에 호출될 수 있으며
     * 실제로 제거한 단 한 번의 호출만 true 를 받는다.
     */
    public boolean remove(String connectionId) {
        ChatConnection connection = connectionsById.remove(connectionId);
        if (connection == null) {
            return false;
        }

        String userId = connection.getUserId();
        AtomicReference<Set<String>> formerRooms = new AtomicReference<>();
        connectionsByUser.computeIfPresent(userId, (id, current) -> {
            current.remove(connection);
            if (!current.isEmpty()) {
                return current;
            }
            formerRooms.set(subscriptionIndex.purgeUser(userId));
            return null;
        });

        log.debug("Connection removed - userId: {}, connectionId: {}, lastConnection: {}",
                userId, connectionId, formerRooms.get() != null);

        if (formerRooms.get() != null) {
            eventPublisher.publishEvent(new UserOfflineEvent(connection.getUser(), formerRooms.get(), Instant.now()));
        }
        return true;
    }

    public int deliver(String userId, Envelope envelope) {
        return deliver(userId, envelopeCodec.toTextMessage(envelope));
    }

    /**
     * 사용자의 모든 연결에 프레임을 전달한다.
     * 전달을 거부한 연결은 제거되며 나머지 연결 전송에는 영향이 없다.
     *
     * @return 프레임을 받은 연결 수
     */
    public int deliver(String userId, TextMessage frame) {
        Set<ChatConnection> connections = connectionsByUser.get(userId);
        if (connections == null) {
            return 0;
        }

        int delivered = 0;
        for (ChatConnection connection : List.copyOf(connections)) {
            if (connection.enqueue(frame)) {
                delivered++;
            } else {
                remove(connection.getConnectionId());
            }
        }
        return delivered;
    }

    public Optional<ChatConnection> get(String connectionId) {
        return Optional.ofNullable(connectionsById.get(connectionId));
    }

    public int connectionCount(String userId) {
        Set<ChatConnection> connections = connectionsByUser.get(userId);
        return connections != null ? connections.size() : 0;
    }

    public boolean isOnline(String userId) {
        return connectionCount(userId) > 0;
    }

    public Set<String> onlineUsers() {
        return Set.copyOf(connectionsByUser.keySet());
    }

    public Collection<ChatConnection> connections() {
        return List.copyOf(connectionsById.values());
    }

    public int totalConnections() {
        return connectionsById.size();
    }
}
