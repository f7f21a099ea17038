package com.ktb.realtimechat.model;

import java.util.HashSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 채팅방. 생성/수정은 외부 API 책임이며 여기서는 참가자 확인에만 쓴다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "rooms")
public class Room {

    @Id
    private String id;

    private String name;

    @Builder.Default
    private Set<String> participantIds = new HashSet<>();
}
