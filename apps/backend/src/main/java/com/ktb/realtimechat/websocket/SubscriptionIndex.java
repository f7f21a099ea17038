package com.ktb.realtimechat.websocket;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 채팅방별 구독 사용자 인덱스.
 *
 * chatroomId -> userIds, userId -> chatroomIds 두 맵을 키 단위 compute 로 함께 갱신한다.
 * 락 순서는 항상 room 맵 -> user 맵. 빈 채팅방 엔트리는 즉시 제거한다.
 */
@Slf4j
@Component
public class SubscriptionIndex {

    private final Map<String, Set<String>> membersByRoom = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roomsByUser = new ConcurrentHashMap<>();

    /**
     * @return 새로 구독되었으면 true, 이미 구독 중이면 false
     */
    public boolean join(String userId, String chatroomId) {
        AtomicBoolean added = new AtomicBoolean();
        membersByRoom.compute(chatroomId, (id, members) -> {
            Set<String> next = members != null ? members : ConcurrentHashMap.newKeySet();
            if (next.add(userId)) {
                added.set(true);
                roomsByUser.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(chatroomId);
            }
            return next;
        });
        if (added.get()) {
            log.debug("Subscription added - userId: {}, chatroomId: {}", userId, chatroomId);
        }
        return added.get();
    }

    /**
     * @return 구독 중이었으면 true, 비구독자면 false (no-op)
     */
    public boolean leave(String userId, String chatroomId) {
        AtomicBoolean removed = new AtomicBoolean();
        membersByRoom.computeIfPresent(chatroomId, (id, members) -> {
            if (members.remove(userId)) {
                removed.set(true);
                detachRoom(userId, chatroomId);
            }
            return members.isEmpty() ? null : members;
        });
        return removed.get();
    }

    /**
     * 사용자를 모든 채팅방에서 제거한다.
     *
     * @return 제거 직전까지 구독 중이던 채팅방
     */
    public Set<String> purgeUser(String userId) {
        Set<String> rooms = roomsByUser.remove(userId);
        if (rooms == null) {
            return Set.of();
        }
        for (String chatroomId : rooms) {
            membersByRoom.computeIfPresent(chatroomId, (id, members) -> {
                members.remove(userId);
                return members.isEmpty() ? null : members;
            });
        }
        log.debug("Subscriptions purged - userId: {}, chatrooms: {}", userId, rooms.size());
        return Set.copyOf(rooms);
    }

    public Set<String> members(String chatroomId) {
        Set<String> members = membersByRoom.get(chatroomId);
        return members != null ? Set.copyOf(members) : Set.of();
    }

    public boolean isMember(String userId, String chatroomId) {
        Set<String> members = membersByRoom.get(chatroomId);
        return members != null && members.contains(userId);
    }

    public Set<String> roomsOf(String userId) {
        Set<String> rooms = roomsByUser.get(userId);
        return rooms != null ? Set.copyOf(rooms) : Set.of();
    }

    public int activeChatrooms() {
        return membersByRoom.size();
    }

    public int totalSubscriptions() {
        return membersByRoom.values().stream().mapToInt(Set::size).sum();
    }

    private void detachRoom(String userId, String chatroomId) {
        roomsByUser.computeIfPresent(userId, (id, rooms) -> {
            rooms.remove(chatroomId);
            return rooms.isEmpty() ? null : rooms;
        });
    }
}
