package com.ktb.realtimechat.exception;

import lombok.Getter;

/**
 * 채팅방 입장/전송 권한이 없을 때 발생. 해당 동작만 무시되고 연결은 유지된다.
 */
@Getter
public class AuthorizationDeniedException extends RealtimeException {

    public static final String CODE = "ACCESS_DENIED";

    private final String userId;
    private final String chatroomId;

    public AuthorizationDeniedException(String userId, String chatroomId, String message) {
        super(CODE, message);
        this.userId = userId;
        this.chatroomId = chatroomId;
    }
}
