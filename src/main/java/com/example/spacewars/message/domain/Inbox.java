package com.example.spacewars.message.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 유저 한 명의 메시지 목록 (생성 순)
 * 삭제된 메시지 ID는 다음 플러시에서 저장소에서도 지워지도록 보관한다.
 */
public class Inbox {

    @Getter
    private final Long userId;
    private final List<Message> messages;
    private final Set<Long> removedIds = new LinkedHashSet<>();

    public Inbox(Long userId, List<Message> messages) {
        this.userId = userId;
        this.messages = new ArrayList<>(messages);
    }

    public static Inbox empty(Long userId) {
        return new Inbox(userId, List.of());
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public List<Message> unread() {
        return messages.stream().filter(message -> !message.isRead()).toList();
    }

    public int unreadCount() {
        return (int) messages.stream().filter(message -> !message.isRead()).count();
    }

    public void add(Message message) {
        messages.add(message);
    }

    public int markAllRead() {
        int marked = 0;
        for (Message message : messages) {
            if (!message.isRead()) {
                message.markRead();
                marked++;
            }
        }
        return marked;
    }

    /**
     * cutoff 이전에 생성된 읽은 메시지 제거
     */
    public int removeReadOlderThan(long cutoffMs) {
        int before = messages.size();
        messages.removeIf(message -> {
            boolean expired = message.isRead() && message.getCreatedAt() < cutoffMs;
            if (expired && message.getId() != null) {
                removedIds.add(message.getId());
            }
            return expired;
        });
        return before - messages.size();
    }

    public Set<Long> pendingRemovals() {
        return Set.copyOf(removedIds);
    }

    public void acknowledgeRemovals(Set<Long> ids) {
        removedIds.removeAll(ids);
    }
}
