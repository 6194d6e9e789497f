package com.example.spacewars.global.concurrency;

/**
 * 락 획득/해제 순서 위반. 프로그래밍 오류이므로 사용자 응답용 ErrorCode로 변환하지 않는다.
 */
public class LockOrderViolationException extends IllegalStateException {

    public LockOrderViolationException(String message) {
        super(message);
    }
}
