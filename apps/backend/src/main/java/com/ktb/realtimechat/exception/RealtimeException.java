package com.ktb.realtimechat.exception;

import lombok.Getter;

/**
 * 실시간 채팅 코어의 기본 예외.
 *
 * 모든 실패는 해당 연결 또는 전송 시도 범위에서만 처리되며 프로세스를 중단시키지 않는다.
 */
@Getter
public class RealtimeException extends RuntimeException {

    private final String code;

    public RealtimeException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RealtimeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
