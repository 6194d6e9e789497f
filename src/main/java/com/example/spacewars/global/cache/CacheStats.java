package com.example.spacewars.global.cache;

import com.example.spacewars.global.persistence.EntityKind;

public record CacheStats(
        EntityKind kind,
        int size,
        int dirty,
        long hits,
        long misses
) {
    public double hitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
