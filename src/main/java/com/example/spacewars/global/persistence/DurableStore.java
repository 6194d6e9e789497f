package com.example.spacewars.global.persistence;

import java.util.Optional;

/**
 * 엔티티 종류별 영속 저장소 계약
 * 호출자는 DATABASE 레벨 락을 보유한 상태에서 호출한다.
 *
 * @param <K> 식별자 타입
 * @param <V> 엔티티 타입
 */
public interface DurableStore<K, V> {

    EntityKind kind();

    Optional<V> loadById(K id);

    void upsert(V entity);

    void delete(K id);
}
