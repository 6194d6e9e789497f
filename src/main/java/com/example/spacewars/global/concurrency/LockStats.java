package com.example.spacewars.global.concurrency;

public record LockStats(
        LockLevel level,
        String strategy,
        long acquisitions,
        int queueLength,
        int activeHolders
) {
}
