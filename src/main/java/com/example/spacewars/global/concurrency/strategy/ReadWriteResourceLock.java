package com.example.spacewars.global.concurrency.strategy;

import com.example.spacewars.global.concurrency.LockLevel;
import com.example.spacewars.global.concurrency.LockMode;
import com.example.spacewars.global.concurrency.ResourceLock;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 공정 모드 ReentrantReadWriteLock 기반 읽기/쓰기 락
 *
 * - 쓰기 보유/대기가 없으면 읽기는 무제한 동시 허용
 * - 쓰기는 모두를 배제
 * - 대기 중인 쓰기가 있으면 새로 도착한 읽기는 그 뒤에 줄을 선다 (쓰기 기아 방지)
 */
public class ReadWriteResourceLock implements ResourceLock {

    private final LockLevel level;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public ReadWriteResourceLock(LockLevel level) {
        this.level = level;
    }

    @Override
    public LockLevel getLevel() {
        return level;
    }

    @Override
    public void lock(LockMode mode) {
        delegate(mode).lock();
    }

    @Override
    public void unlock(LockMode mode) {
        delegate(mode).unlock();
    }

    private Lock delegate(LockMode mode) {
        return mode == LockMode.WRITE ? lock.writeLock() : lock.readLock();
    }

    @Override
    public int getQueueLength() {
        return lock.getQueueLength();
    }

    @Override
    public int getActiveHolders() {
        return lock.isWriteLocked() ? 1 : lock.getReadLockCount();
    }

    @Override
    public String getStrategyName() {
        return "READ_WRITE";
    }
}
