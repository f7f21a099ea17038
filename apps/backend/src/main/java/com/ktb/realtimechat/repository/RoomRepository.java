package com.ktb.realtimechat.repository;

import com.ktb.realtimechat.model.Room;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface RoomRepository extends MongoRepository<Room, String> {

    // 참가자 여부만 확인 (문서 본문 로드 X)
    @Query(value = "{ '_id': ?0, 'participantIds': ?1 }", exists = true)
    boolean existsByIdAndParticipant(String roomId, String userId);
}
