package com.example.spacewars.global.cache;

import com.example.spacewars.global.concurrency.LockContext;
import com.example.spacewars.global.persistence.EntityKind;

/**
 * PersistenceCoordinator가 주기적으로 플러시하는 캐시
 */
public interface FlushableCache {

    EntityKind kind();

    /**
     * dirty 엔티티를 저장소에 기록. 자신의 레벨과 DATABASE 레벨을 스스로 획득한다.
     */
    FlushResult flush(LockContext ctx);

    int dirtyCount();

    /**
     * 메모리 맵 비우기 (종료 시 모든 플러시가 성공한 뒤에만 호출)
     */
    void clear(LockContext ctx);

    CacheStats getStats();
}
