package com.example.spacewars.global.concurrency;

public record HeldLock(LockLevel level, LockMode mode) {

    @Override
    public String toString() {
        return level + "(" + mode + ")";
    }
}
