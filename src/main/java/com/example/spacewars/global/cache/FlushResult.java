package com.example.spacewars.global.cache;

import com.example.spacewars.global.persistence.EntityKind;

public record FlushResult(
        EntityKind kind,
        int persisted,
        int failed
) {
    public static FlushResult failedAll(EntityKind kind, int pending) {
        return new FlushResult(kind, 0, pending);
    }

    public boolean isComplete() {
        return failed == 0;
    }
}
