package com.ktb.realtimechat.websocket.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.realtimechat.exception.MalformedEnvelopeException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

/**
 * Envelope JSON 인코더/디코더.
 *
 * 인바운드: {"event": string, "data": object}, data 는 생략 가능.
 * 아웃바운드: event, data 두 필드만 직렬화한다.
 */
@Component
@RequiredArgsConstructor
public class EnvelopeCodec {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Envelope decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Invalid JSON payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Envelope must be a JSON object");
        }

        JsonNode event = root.get("event");
        if (event == null || !event.isTextual() || event.asText().isBlank()) {
            throw new MalformedEnvelopeException("Envelope has no event name");
        }

        JsonNode data = root.get("data");
        Map<String, Object> values;
        if (data == null || data.isNull()) {
            values = Map.of();
        } else if (data.isObject()) {
            values = objectMapper.convertValue(data, DATA_TYPE);
        } else {
            throw new MalformedEnvelopeException("Envelope data must be an object");
        }
        return new Envelope(event.asText(), values, Instant.now());
    }

    public String encode(Envelope envelope) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("event", envelope.event());
        wire.put("data", envelope.data());
        try {
            return objectMapper.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Envelope serialization failed - event: " + envelope.event(), e);
        }
    }

    public TextMessage toTextMessage(Envelope envelope) {
        return new TextMessage(encode(envelope));
    }
}
