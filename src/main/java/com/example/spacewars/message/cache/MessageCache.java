package com.example.spacewars.message.cache;

import com.example.spacewars.global.cache.FlushResult;
import com.example.spacewars.global.cache.WriteBehindCache;
import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockManager;
import com.example.spacewars.global.error.CommonException;
import com.example.spacewars.global.error.ErrorCode;
import com.example.spacewars.message.domain.Inbox;
import com.example.spacewars.message.domain.Message;
import com.example.spacewars.message.repository.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * 유저별 메시지 캐시
 *
 * 두 단계 락을 사용한다.
 * - MESSAGE_READ: 인박스 맵 (조회/미스 로드는 READ, 비우기는 WRITE)
 * - MESSAGE_WRITE: 인박스 내용 (조회는 READ, 변경은 WRITE)
 *
 * 다른 캐시와 달리 공개 연산이 필요한 락을 스스로 획득한다.
 * 호출자가 더 높은 레벨(DATABASE)을 들고 있으면 순서 위반이다.
 */
@Slf4j
@Component
public class MessageCache extends WriteBehindCache<Long, Inbox> {

    public MessageCache(LockManager lockManager, MessageStore messageStore, RetryTemplate persistenceRetryTemplate) {
        super(lockManager, messageStore, persistenceRetryTemplate);
    }

    @Override
    protected Long idOf(Inbox inbox) {
        return inbox.getUserId();
    }

    @Override
    protected CommonException notFound(Long userId) {
        return ErrorCode.USER_NOT_FOUND.commonException("inbox userId=" + userId);
    }

    public Message sendMessage(LockContext ctx, Long recipientId, String content, long nowMs) {
        Message message = writeInbox(ctx, recipientId, inbox -> {
            Message created = Message.builder()
                    .recipientId(recipientId)
                    .content(content)
                    .createdAt(nowMs)
                    .build();
            inbox.add(created);
            markDirty(recipientId);
            return created;
        });
        log.debug("메시지 생성: recipientId={}", recipientId);
        return message;
    }

    public List<Message> getMessages(LockContext ctx, Long userId) {
        return readInbox(ctx, userId, inbox -> List.copyOf(inbox.getMessages()));
    }

    public List<Message> getUnreadMessages(LockContext ctx, Long userId) {
        return readInbox(ctx, userId, Inbox::unread);
    }

    public int getUnreadCount(LockContext ctx, Long userId) {
        return readInbox(ctx, userId, Inbox::unreadCount);
    }

    /**
     * @return 새로 읽음 처리된 메시지 수
     */
    public int markAllAsRead(LockContext ctx, Long userId) {
        return writeInbox(ctx, userId, inbox -> {
            int marked = inbox.markAllRead();
            if (marked > 0) {
                markDirty(userId);
            }
            return marked;
        });
    }

    /**
     * 캐시에 올라와 있는 인박스에서 cutoff 이전의 읽은 메시지를 제거
     *
     * @return 제거된 메시지 수
     */
    public int deleteOldReadMessages(LockContext ctx, long cutoffMs) {
        return lockManager.withRead(ctx, LockLevel.MESSAGE_READ,
                readCtx -> lockManager.withWrite(readCtx, LockLevel.MESSAGE_WRITE, writeCtx -> {
                    int removed = 0;
                    for (Inbox inbox : entries.values()) {
                        int count = inbox.removeReadOlderThan(cutoffMs);
                        if (count > 0) {
                            markDirty(inbox.getUserId());
                            removed += count;
                        }
                    }
                    return removed;
                }));
    }

    @Override
    public FlushResult flush(LockContext ctx) {
        return lockManager.withRead(ctx, LockLevel.MESSAGE_READ,
                readCtx -> lockManager.withWrite(readCtx, LockLevel.MESSAGE_WRITE,
                        writeCtx -> lockManager.withWrite(writeCtx, LockLevel.DATABASE, this::flushDirty)));
    }

    private <T> T readInbox(LockContext ctx, Long userId, Function<Inbox, T> reader) {
        return lockManager.withRead(ctx, LockLevel.MESSAGE_READ, readCtx -> {
            Inbox inbox = requireUnsafe(readCtx, userId);
            return lockManager.withRead(readCtx, LockLevel.MESSAGE_WRITE, contentCtx -> reader.apply(inbox));
        });
    }

    private <T> T writeInbox(LockContext ctx, Long userId, Function<Inbox, T> writer) {
        return lockManager.withRead(ctx, LockLevel.MESSAGE_READ, readCtx -> {
            Inbox inbox = requireUnsafe(readCtx, userId);
            return lockManager.withWrite(readCtx, LockLevel.MESSAGE_WRITE, contentCtx -> writer.apply(inbox));
        });
    }
}
