package com.example.spacewars.global.concurrency;

public enum LockMode {
    READ,
    WRITE;

    /**
     * 이미 이 모드로 잡고 있을 때 requested 모드의 요청을 재사용으로 처리할 수 있는지
     */
    public boolean covers(LockMode requested) {
        return this == WRITE || requested == READ;
    }
}
