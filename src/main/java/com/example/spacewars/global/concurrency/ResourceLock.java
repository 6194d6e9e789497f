package com.example.spacewars.global.concurrency;

/**
 * 락 레벨 하나에 대응하는 동기화 수단
 * 단일 쓰기 카테고리는 뮤텍스, 동시 읽기가 의미 있는 카테고리는 읽기/쓰기 락을 사용한다.
 */
public interface ResourceLock {

    LockLevel getLevel();

    void lock(LockMode mode);

    void unlock(LockMode mode);

    /**
     * 락 대기 중인 스레드 수 (추정치)
     */
    int getQueueLength();

    /**
     * 현재 락을 보유 중인 주체 수 (읽기 락은 여러 명일 수 있음)
     */
    int getActiveHolders();

    /**
     * 전략 이름 반환 (로깅/통계용)
     */
    String getStrategyName();
}
