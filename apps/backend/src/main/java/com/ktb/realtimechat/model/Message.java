package com.ktb.realtimechat.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "messages")
@CompoundIndex(name = "chatroom_timestamp_idx", def = "{'chatroom_id': 1, 'timestamp': -1}")
public class Message {

    @Id
    private String id;

    @Field("chatroom_id")
    private String chatroomId;

    @Field("user_id")
    private String userId;

    private String username;

    @Field("display_name")
    private String displayName;

    private String content;

    @Field("message_type")
    private MessageType messageType;

    // 클라이언트 낙관적 렌더링용 식별자
    @Field("client_id")
    private String clientId;

    private Instant timestamp;

    private boolean edited;
}
