package com.ktb.realtimechat.exception;

public class MalformedEnvelopeException extends RealtimeException {

    public static final String CODE = "MALFORMED_ENVELOPE";

    public MalformedEnvelopeException(String message) {
        super(CODE, message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
