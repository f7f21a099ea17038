package com.ktb.realtimechat.exception;

import lombok.Getter;

/**
 * 단일 연결로의 전송 실패. 해당 연결만 제거되며 발신자나 다른 수신자에게 전파되지 않는다.
 */
@Getter
public class DeliveryFailureException extends RealtimeException {

    public static final String CODE = "DELIVERY_FAILED";

    private final String connectionId;

    public DeliveryFailureException(String connectionId, String message) {
        super(CODE, message);
        this.connectionId = connectionId;
    }

    public DeliveryFailureException(String connectionId, String message, Throwable cause) {
        super(CODE, message, cause);
        this.connectionId = connectionId;
    }
}
