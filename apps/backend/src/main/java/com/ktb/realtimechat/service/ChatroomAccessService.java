package com.ktb.realtimechat.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ktb.realtimechat.exception.AuthorizationDeniedException;
import com.ktb.realtimechat.repository.RoomRepository;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 채팅방 접근 권한 확인.
 *
 * 참가자 목록(rooms.participantIds)에 포함된 사용자만 입장/전송할 수 있다.
 * 결과는 짧게 캐시한다. 저장소 오류는 거부로 처리하고 캐시하지 않는다.
 */
@Slf4j
@Service
public class ChatroomAccessService {

    private final RoomRepository roomRepository;
    private final Cache<String, Boolean> accessCache;

    public ChatroomAccessService(RoomRepository roomRepository,
                                 @Value("${chat.access.cache-ttl:30s}") Duration cacheTtl) {
        this.roomRepository = roomRepository;
        this.accessCache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(cacheTtl)
                .build();
    }

    public boolean canAccess(String userId, String chatroomId) {
        String key = chatroomId + ":" + userId;
        Boolean cached = accessCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        boolean allowed;
        try {
            allowed = roomRepository.existsByIdAndParticipant(chatroomId, userId);
        } catch (DataAccessException e) {
            log.warn("Chatroom access check failed - userId: {}, chatroomId: {}, reason: {}",
                    userId, chatroomId, e.getMessage());
            return false;
        }
        accessCache.put(key, allowed);
        return allowed;
    }

    /**
     * @throws AuthorizationDeniedException 접근 권한이 없으면
     */
    public void checkAccess(String userId, String chatroomId) {
        if (!canAccess(userId, chatroomId)) {
            throw new AuthorizationDeniedException(userId, chatroomId, "Access denied to chatroom");
        }
    }

    public void evict(String userId, String chatroomId) {
        accessCache.invalidate(chatroomId + ":" + userId);
    }
}
