package com.ktb.realtimechat.exception;

/**
 * 연결 시 제시된 토큰이 유효하지 않을 때 발생. 연결을 종료시킨다.
 */
public class AuthenticationFailureException extends RealtimeException {

    public static final String CODE = "AUTH_FAILED";

    public AuthenticationFailureException(String message) {
        super(CODE, message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
