package com.example.spacewars.global.persistence;

import com.example.spacewars.global.concurrency.LockLevel;
import lombok.Getter;

/**
 * 캐시되는 엔티티 종류 (닫힌 집합)
 * 선언 순서 == 플러시 순서 == 가드 레벨의 오름차순
 */
@Getter
public enum EntityKind {
    BATTLE(LockLevel.BATTLE),
    USER(LockLevel.USER),
    WORLD(LockLevel.WORLD),
    MESSAGE(LockLevel.MESSAGE_READ);

    private final LockLevel guardLevel;

    EntityKind(LockLevel guardLevel) {
        this.guardLevel = guardLevel;
    }
}
