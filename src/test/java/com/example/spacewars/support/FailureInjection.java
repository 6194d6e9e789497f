package com.example.spacewars.support;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 저장소 쓰기 실패 주입
 */
public class FailureInjection {

    private final AtomicInteger remainingFailures = new AtomicInteger();
    private volatile boolean alwaysFail;
    private final AtomicInteger attempts = new AtomicInteger();

    public void failNext(int count) {
        remainingFailures.set(count);
    }

    public void failAlways(boolean alwaysFail) {
        this.alwaysFail = alwaysFail;
    }

    public int attempts() {
        return attempts.get();
    }

    void beforeWrite() {
        attempts.incrementAndGet();
        if (alwaysFail) {
            throw new IllegalStateException("주입된 저장소 장애");
        }
        if (remainingFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new IllegalStateException("주입된 일시 장애");
        }
    }
}
