package com.ktb.realtimechat.websocket;

import com.ktb.realtimechat.exception.DeliveryFailureException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * 인증된 단일 WebSocket 연결.
 *
 * [전송 모델]
 * - enqueue() 는 연결별 FIFO 큐에 프레임을 넣고 즉시 반환한다 (네트워크 쓰기 없음)
 * - 큐는 공유 deliveryExecutor 위의 drain 작업 하나가 순서대로 비운다
 * - 느린 연결은 자기 큐만 막히고, 다른 연결/사용자 전송에는 영향이 없다
 * - 버퍼 초과 또는 쓰기 시간 초과 시 연결을 실패 처리하고 failureListener 에 알린다
 * - 쓰기 시간 초과는 다음 enqueue 와 StalledSendWatchdog 양쪽에서 검사한다.
 *   실패 처리 시 쓰기 중인 drain 스레드를 interrupt 해서 공유 executor 슬롯을 돌려받는다
 *
 * 트랜스포트 소유권은 ChatWebSocketHandler 에 있다. Registry 는 이 객체를 참조만 한다.
 */
@Slf4j
public class ChatConnection {

    private final WebSocketSession session;
    private final Executor deliveryExecutor;
    private final int outboundQueueLimit;
    private final long sendTimeLimitNanos;

    @Getter
    private final Instant connectedAt;
    @Getter
    private volatile Instant lastActivity;
    @Getter
    private volatile SocketUser user;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Queue<TextMessage> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile long sendStartedAt;
    private final Object writerLock = new Object();
    private Thread writer;
    private boolean writerInterrupted;
    private volatile BiConsumer<ChatConnection, DeliveryFailureException> failureListener = (c, e) -> { };

    public ChatConnection(WebSocketSession session,
                          Executor deliveryExecutor,
                          int outboundQueueLimit,
                          Duration sendTimeLimit) {
        this.session = session;
        this.deliveryExecutor = deliveryExecutor;
        this.outboundQueueLimit = outboundQueueLimit;
        this.sendTimeLimitNanos = sendTimeLimit.toNanos();
        this.connectedAt = Instant.now();
        this.lastActivity = connectedAt;
    }

    public String getConnectionId() {
        return session.getId();
    }

    public String getUserId() {
        SocketUser current = user;
        return current != null ? current.id() : null;
    }

    public ConnectionState getState() {
        return state.get();
    }

    /** CONNECTING -> AUTHENTICATED */
    public boolean authenticate(SocketUser socketUser) {
        if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED)) {
            return false;
        }
        this.user = socketUser;
        return true;
    }

    /** AUTHENTICATED -> ACTIVE */
    public boolean activate() {
        return state.compareAndSet(ConnectionState.AUTHENTICATED, ConnectionState.ACTIVE);
    }

    /**
     * 종료 상태로 전이. 최초 호출만 true.
     */
    public boolean markClosed() {
        return state.getAndSet(ConnectionState.CLOSED) != ConnectionState.CLOSED;
    }

    public boolean isOpen() {
        return state.get() != ConnectionState.CLOSED && session.isOpen();
    }

    public void touch() {
        lastActivity = Instant.now();
    }

    public void onFailure(BiConsumer<ChatConnection, DeliveryFailureException> listener) {
        this.failureListener = listener;
    }

    /**
     * 프레임을 전송 큐에 넣는다.
     *
     * @return 큐에 들어갔으면 true. 닫혔거나 한도를 넘긴 연결이면 false
     */
    public boolean enqueue(TextMessage frame) {
        if (!isOpen()) {
            return false;
        }
        if (isSendStalled()) {
            fail(new DeliveryFailureException(getConnectionId(), "Send time limit exceeded"));
            return false;
        }
        if (pending.incrementAndGet() > outboundQueueLimit) {
            pending.decrementAndGet();
            fail(new DeliveryFailureException(getConnectionId(),
                    "Outbound buffer limit exceeded (" + outboundQueueLimit + ")"));
            return false;
        }
        outbound.offer(frame);
        scheduleDrain();
        return true;
    }

    public int pendingFrames() {
        return pending.get();
    }

    /**
     * 트랜스포트를 닫는다. 이미 닫혀 있으면 아무것도 하지 않는다.
     */
    public void close(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Close failed - connectionId: {}, status: {}, reason: {}",
                    getConnectionId(), status, e.getMessage());
        }
    }

    /**
     * 쓰기가 send-time-limit 을 넘겨 멈춰 있으면 연결을 실패 처리한다.
     *
     * @return 이번 호출로 실패 처리되었으면 true
     */
    public boolean failIfSendStalled() {
        if (!isSendStalled() || failed.get()) {
            return false;
        }
        fail(new DeliveryFailureException(getConnectionId(), "Send time limit exceeded"));
        return true;
    }

    boolean isSendStalled() {
        long startedAt = sendStartedAt;
        return startedAt != 0L && System.nanoTime() - startedAt > sendTimeLimitNanos;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail(new DeliveryFailureException(getConnectionId(), "Delivery executor rejected drain", e));
        }
    }

    private void drain() {
        try {
            TextMessage next;
            while (isOpen() && (next = outbound.poll()) != null) {
                pending.decrementAndGet();
                write(next);
            }
        } finally {
            draining.set(false);
        }
        // drain 종료 직후 들어온 프레임
        if (isOpen() && !outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    private void write(TextMessage frame) {
        synchronized (writerLock) {
            writer = Thread.currentThread();
        }
        sendStartedAt = System.nanoTime();
        try {
            session.sendMessage(frame);
        } catch (IOException | RuntimeException e) {
            fail(new DeliveryFailureException(getConnectionId(), "Write failed", e));
        } finally {
            sendStartedAt = 0L;
            synchronized (writerLock) {
                writer = null;
                // 이 연결 때문에 건 interrupt 가 다음 작업으로 새지 않게 지운다
                if (writerInterrupted) {
                    writerInterrupted = false;
                    Thread.interrupted();
                }
            }
        }
    }

    private void interruptWriter() {
        synchronized (writerLock) {
            if (writer != null && writer != Thread.currentThread()) {
                writerInterrupted = true;
                writer.interrupt();
            }
        }
    }

    // 연결당 한 번만 처리
    private void fail(DeliveryFailureException failure) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        log.warn("Delivery failure - connectionId: {}, userId: {}, reason: {}",
                getConnectionId(), getUserId(), failure.getMessage());
        outbound.clear();
        pending.set(0);
        interruptWriter();
        close(CloseStatus.SESSION_NOT_RELIABLE);
        failureListener.accept(this, failure);
    }

    @Override
    public String toString() {
        return "ChatConnection{id=" + getConnectionId() + ", userId=" + getUserId() + ", state=" + state.get() + "}";
    }
}
