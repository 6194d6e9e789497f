package com.example.spacewars.message.service;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.message.cache.MessageCache;
import com.example.spacewars.message.dto.response.MessageResponse;
import com.example.spacewars.user.cache.UserCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    static final Duration READ_MESSAGE_RETENTION = Duration.ofDays(30);

    private final LockManager lockManager;
    private final UserCache userCache;
    private final MessageCache messageCache;
    private final Clock clock;

    /**
     * 존재하는 유저에게만 보낼 수 있다 (USER -> MESSAGE 순서)
     */
    public MessageResponse sendMessage(LockContext ctx, Long recipientId, String content) {
        return lockManager.withRead(ctx, LockLevel.USER, userCtx -> {
            userCache.requireUnsafe(userCtx, recipientId);
            return MessageResponse.from(messageCache.sendMessage(userCtx, recipientId, content, clock.millis()));
        });
    }

    public List<MessageResponse> getMessages(LockContext ctx, Long userId) {
        return messageCache.getMessages(ctx, userId).stream().map(MessageResponse::from).toList();
    }

    public List<MessageResponse> getUnreadMessages(LockContext ctx, Long userId) {
        return messageCache.getUnreadMessages(ctx, userId).stream().map(MessageResponse::from).toList();
    }

    public int getUnreadCount(LockContext ctx, Long userId) {
        return messageCache.getUnreadCount(ctx, userId);
    }

    public int markAllAsRead(LockContext ctx, Long userId) {
        return messageCache.markAllAsRead(ctx, userId);
    }

    public int deleteOldReadMessages(LockContext ctx, long cutoffMs) {
        return messageCache.deleteOldReadMessages(ctx, cutoffMs);
    }

    // 매일 새벽 4시, 30일 지난 읽은 메시지 정리
    @Scheduled(cron = "0 0 4 * * *")
    public void cleanupReadMessages() {
        long cutoffMs = clock.millis() - READ_MESSAGE_RETENTION.toMillis();
        try {
            int removed = deleteOldReadMessages(LockContext.empty(), cutoffMs);
            log.info("읽은 메시지 정리 완료: {}건", removed);
        } catch (Exception e) {
            log.error("읽은 메시지 정리 중 오류 발생", e);
        }
    }
}
