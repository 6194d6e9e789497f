package com.example.spacewars.global.concurrency;

import lombok.Getter;

/**
 * try-with-resources용 락 범위
 *
 * <pre>{@code
 * try (LockScope scope = lockManager.acquire(ctx, LockLevel.USER, LockMode.WRITE)) {
 *     userCache.mutateUnsafe(scope.getContext(), userId, ...);
 * }
 * }</pre>
 */
public class LockScope implements AutoCloseable {

    @Getter
    private final LockContext context;
    private final LockLevel level;
    private final LockMode mode;
    private final ResourceLock lock; // 재사용(이미 보유)인 경우 null
    private boolean closed;

    LockScope(LockContext context, LockLevel level, LockMode mode, ResourceLock lock) {
        this.context = context;
        this.level = level;
        this.mode = mode;
        this.lock = lock;
    }

    public boolean isReused() {
        return lock == null;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (lock == null) {
            return;
        }
        try {
            context.release(level);
        } finally {
            lock.unlock(mode);
        }
    }
}
