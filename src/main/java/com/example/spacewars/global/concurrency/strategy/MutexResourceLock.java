package com.example.spacewars.global.concurrency.strategy;

import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockMode;
import com.example.spacewars.global.concurrency.ResourceLock;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 공정(fair) ReentrantLock 기반 상호 배제 락
 * 읽기/쓰기 구분이 없는 BATTLE, USER 레벨에 사용. 모드는 무시되고 항상 배타적으로 동작한다.
 */
public class MutexResourceLock implements ResourceLock {

    private final LockLevel level;
    private final ReentrantLock lock = new ReentrantLock(true);

    public MutexResourceLock(LockLevel level) {
        this.level = level;
    }

    @Override
    public LockLevel getLevel() {
        return level;
    }

    @Override
    public void lock(LockMode mode) {
        lock.lock();
    }

    @Override
    public void unlock(LockMode mode) {
        lock.unlock();
    }

    @Override
    public int getQueueLength() {
        return lock.getQueueLength();
    }

    @Override
    public int getActiveHolders() {
        return lock.isLocked() ? 1 : 0;
    }

    @Override
    public String getStrategyName() {
        return "MUTEX";
    }
}
