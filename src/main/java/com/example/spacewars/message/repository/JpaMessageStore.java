package com.example.spacewars.message.repository;

import com.example.spacewars.global.persistence.EntityKind;
import com.example.spacewars.message.domain.Inbox;
import com.example.spacewars.message.domain.Message;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class JpaMessageStore implements MessageStore {

    private final MessageRepository messageRepository;

    @Override
    public EntityKind kind() {
        return EntityKind.MESSAGE;
    }

    /**
     * 메시지가 없는 유저도 빈 인박스로 반환한다.
     */
    @Override
    public Optional<Inbox> loadById(Long userId) {
        List<Message> messages = messageRepository.findByRecipientIdOrderByCreatedAtAscIdAsc(userId);
        return Optional.of(new Inbox(userId, messages));
    }

    @Override
    @Transactional
    public void upsert(Inbox inbox) {
        Set<Long> removals = inbox.pendingRemovals();
        if (!removals.isEmpty()) {
            messageRepository.deleteAllById(removals);
        }
        messageRepository.saveAll(inbox.getMessages());
        inbox.acknowledgeRemovals(removals);
    }

    @Override
    @Transactional
    public void delete(Long userId) {
        messageRepository.deleteAll(messageRepository.findByRecipientIdOrderByCreatedAtAscIdAsc(userId));
    }
}
