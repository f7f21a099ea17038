package com.ktb.realtimechat.websocket;

/**
 * WebSocket 이벤트 이름 상수.
 */
public final class ChatEvents {

    // Client -> Server
    public static final String JOIN_CHATROOM = "join_chatroom";
    public static final String LEAVE_CHATROOM = "leave_chatroom";
    public static final String SEND_MESSAGE = "send_message";
    public static final String TYPING_START = "typing_start";
    public static final String TYPING_STOP = "typing_stop";
    public static final String PING = "ping";

    // Server -> Client
    public static final String CONNECTED = "connected";
    public static final String USER_JOINED = "user_joined";
    public static final String USER_LEFT = "user_left";
    public static final String MESSAGE_RECEIVED = "message_received";
    public static final String TYPING_INDICATOR = "typing_indicator";
    public static final String USER_ONLINE = "user_online";
    public static final String USER_OFFLINE = "user_offline";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    // data 필드
    public static final String CHATROOM_ID = "chatroom_id";

    private ChatEvents() {
    }
}
