package com.ktb.realtimechat.service;

import com.ktb.realtimechat.model.Message;
import com.ktb.realtimechat.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * 메시지 비동기 저장.
 *
 * 브로드캐스트와 독립적으로 동작한다. 저장 실패는 로그만 남기고 재시도하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessagePersistenceService {

    private final MessageRepository messageRepository;

    @Async("messageExecutor")
    public void saveAsync(Message message) {
        try {
            messageRepository.save(message);
            log.debug("Message saved - id: {}, chatroomId: {}", message.getId(), message.getChatroomId());
        } catch (DataAccessException e) {
            log.error("Message save failed - id: {}, chatroomId: {}", message.getId(), message.getChatroomId(), e);
        }
    }
}
