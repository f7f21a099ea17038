package com.ktb.realtimechat.websocket.protocol;

import com.ktb.realtimechat.exception.MalformedEnvelopeException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 와이어 단위 메시지. {@code {"event": ..., "data": {...}}}
 *
 * 생성 이후 변경 불가. timestamp 는 생성 시각이며 와이어에는 data 안의 ISO-8601 문자열로만 실린다.
 */
public record Envelope(String event, Map<String, Object> data, Instant timestamp) {

    public Envelope {
        Objects.requireNonNull(event, "event");
        data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Builder builder(String event) {
        return new Builder(event);
    }

    /**
     * data 의 문자열 필드 조회. 없거나 공백이면 예외.
     */
    public String requireString(String key) {
        String value = optionalString(key);
        if (value == null || value.isBlank()) {
            throw new MalformedEnvelopeException("Missing field '" + key + "' in event " + event);
        }
        return value;
    }

    public String optionalString(String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new MalformedEnvelopeException("Field '" + key + "' must be a string in event " + event);
        }
        return text;
    }

    public static final class Builder {

        private final String event;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private final Instant timestamp = Instant.now();

        private Builder(String event) {
            this.event = event;
        }

        public Builder put(String key, Object value) {
            data.put(key, value);
            return this;
        }

        /** data 에 "timestamp" 를 ISO-8601 로 추가 */
        public Builder withTimestamp() {
            data.put("timestamp", timestamp.toString());
            return this;
        }

        public Envelope build() {
            return new Envelope(event, data, timestamp);
        }
    }
}
