package com.ktb.realtimechat.model;

public enum MessageType {
    text,
    image,
    file,
    // 서버 생성 전용
    system;

    /**
     * @return 일치하는 타입. 알 수 없는 값이면 null
     */
    public static MessageType from(String value) {
        for (MessageType type : values()) {
            if (type.name().equals(value)) {
                return type;
            }
        }
        return null;
    }
}
