package com.example.spacewars.global.concurrency;

import com.example.spacewars.global.concurrency.strategy.MutexResourceLock;
import com.example.spacewars.global.concurrency.strategy.ReadWriteResourceLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 레벨별 락 보관소이자 유일한 락 획득 지점
 *
 * 모든 획득은 {@link LockContext} 검증을 거친 뒤 실제 락을 잡고,
 * 정상/예외 종료와 무관하게 finally에서 해제한다.
 */
@Slf4j
@Component
public class LockManager {

    private final Map<LockLevel, ResourceLock> locks = new EnumMap<>(LockLevel.class);
    private final Map<LockLevel, LongAdder> acquisitions = new EnumMap<>(LockLevel.class);

    public LockManager() {
        for (LockLevel level : LockLevel.values()) {
            ResourceLock lock = level.isSharedReadable()
                    ? new ReadWriteResourceLock(level)
                    : new MutexResourceLock(level);
            locks.put(level, lock);
            acquisitions.put(level, new LongAdder());
        }
    }

    /**
     * 레벨에 해당하는 락 반환
     *
     * @throws IllegalArgumentException 등록되지 않은 레벨인 경우
     */
    public ResourceLock getLock(LockLevel level) {
        ResourceLock lock = locks.get(level);
        if (lock == null) {
            throw new IllegalArgumentException("지원하지 않는 락 레벨: " + level);
        }
        return lock;
    }

    /**
     * level을 mode로 획득한 컨텍스트에서 action 실행 후 반환
     * 이미 보유 중인 레벨이면 락을 다시 잡지 않고 현재 컨텍스트를 그대로 넘긴다.
     */
    public <T> T withLock(LockContext ctx, LockLevel level, LockMode mode, Function<LockContext, T> action) {
        try (LockScope scope = acquire(ctx, level, mode)) {
            return action.apply(scope.getContext());
        }
    }

    public void runWithLock(LockContext ctx, LockLevel level, LockMode mode, Consumer<LockContext> action) {
        withLock(ctx, level, mode, inner -> {
            action.accept(inner);
            return null;
        });
    }

    public <T> T withRead(LockContext ctx, LockLevel level, Function<LockContext, T> action) {
        return withLock(ctx, level, LockMode.READ, action);
    }

    public <T> T withWrite(LockContext ctx, LockLevel level, Function<LockContext, T> action) {
        return withLock(ctx, level, LockMode.WRITE, action);
    }

    /**
     * 획득 후 {@link LockScope} 반환. 반드시 try-with-resources로 닫아야 한다.
     */
    public LockScope acquire(LockContext ctx, LockLevel level, LockMode mode) {
        LockMode effective = level.isSharedReadable() ? mode : LockMode.WRITE;
        LockContext next = ctx.acquire(level, effective);
        if (next == ctx) {
            return new LockScope(ctx, level, effective, null);
        }
        ResourceLock lock = getLock(level);
        lock.lock(effective);
        acquisitions.get(level).increment();
        if (log.isDebugEnabled()) {
            log.debug("락 획득: level={}, mode={}, held={}", level, effective, next.getHeld());
        }
        return new LockScope(next, level, effective, lock);
    }

    public List<LockStats> getStats() {
        List<LockStats> stats = new ArrayList<>();
        for (LockLevel level : LockLevel.values()) {
            ResourceLock lock = locks.get(level);
            stats.add(new LockStats(
                    level,
                    lock.getStrategyName(),
                    acquisitions.get(level).sum(),
                    lock.getQueueLength(),
                    lock.getActiveHolders()));
        }
        return stats;
    }
}
