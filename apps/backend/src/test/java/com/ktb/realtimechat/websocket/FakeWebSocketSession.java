package com.ktb.realtimechat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.security.Principal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketExtension;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * 전송된 텍스트 프레임을 기록하는 in-memory 세션.
 */
public class FakeWebSocketSession implements WebSocketSession {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final URI uri;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();

    private volatile boolean open = true;
    private volatile CloseStatus closeStatus;
    private volatile boolean failOnSend;
    private volatile CountDownLatch sendGate;

    public FakeWebSocketSession(String id, URI uri) {
        this.id = id;
        this.uri = uri;
    }

    public static FakeWebSocketSession withToken(String id, String token) {
        return new FakeWebSocketSession(id, URI.create("ws://localhost/ws?token=" + token));
    }

    public static FakeWebSocketSession anonymous(String id) {
        return new FakeWebSocketSession(id, URI.create("ws://localhost/ws"));
    }

    public void failOnSend() {
        this.failOnSend = true;
    }

    /** 이후 sendMessage 는 release() 까지 블록된다 */
    public void blockSends() {
        this.sendGate = new CountDownLatch(1);
    }

    public void release() {
        CountDownLatch gate = sendGate;
        if (gate != null) {
            gate.countDown();
        }
    }

    public List<String> sentPayloads() {
        return List.copyOf(sent);
    }

    public List<Map<String, Object>> frames() {
        return sent.stream().map(FakeWebSocketSession::parse).toList();
    }

    public List<String> events() {
        return frames().stream().map(frame -> (String) frame.get("event")).toList();
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> dataOf(String event) {
        return frames().stream()
                .filter(frame -> event.equals(frame.get("event")))
                .map(frame -> (Map<String, Object>) frame.get("data"))
                .toList();
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public URI getUri() {
        return uri;
    }

    @Override
    public HttpHeaders getHandshakeHeaders() {
        return new HttpHeaders();
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public Principal getPrincipal() {
        return null;
    }

    @Override
    public InetSocketAddress getLocalAddress() {
        return null;
    }

    @Override
    public InetSocketAddress getRemoteAddress() {
        return null;
    }

    @Override
    public String getAcceptedProtocol() {
        return null;
    }

    @Override
    public void setTextMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getTextMessageSizeLimit() {
        return 0;
    }

    @Override
    public void setBinaryMessageSizeLimit(int messageSizeLimit) {
    }

    @Override
    public int getBinaryMessageSizeLimit() {
        return 0;
    }

    @Override
    public List<WebSocketExtension> getExtensions() {
        return List.of();
    }

    @Override
    public void sendMessage(WebSocketMessage<?> message) throws IOException {
        CountDownLatch gate = sendGate;
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        if (!open) {
            throw new IOException("Session closed");
        }
        if (failOnSend) {
            throw new IOException("Broken pipe");
        }
        sent.add(((TextMessage) message).getPayload());
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    @Override
    public void close(CloseStatus status) {
        if (!open) {
            return;
        }
        open = false;
        closeStatus = status;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(String payload) {
        try {
            return MAPPER.readValue(payload, Map.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
