package com.example.spacewars.global.concurrency;

import lombok.Getter;

/**
 * 공유 자원 카테고리의 전역 획득 순서
 * 선언 순서 == 획득 순서. 한 호출 경로는 항상 오름차순으로만 락을 잡는다.
 */
@Getter
public enum LockLevel {
    BATTLE(10, false), // 배틀 캐시
    USER(20, false), // 유저 캐시
    WORLD(30, true), // 월드 싱글톤
    MESSAGE_READ(34, true), // 메시지 인박스 인덱스
    MESSAGE_WRITE(35, true), // 메시지 내용
    DATABASE(40, true); // 영속 저장소 접근

    private final int rank;
    private final boolean sharedReadable;

    LockLevel(int rank, boolean sharedReadable) {
        this.rank = rank;
        this.sharedReadable = sharedReadable;
    }

    public boolean isAbove(LockLevel other) {
        return this.rank > other.rank;
    }
}
