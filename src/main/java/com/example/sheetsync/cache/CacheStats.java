package com.example.sheetsync.cache;

import lombok.Value;

@Value
public class CacheStats {
    long hits;
    long misses;
    long evictions;
    long size;

    public double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0d : (double) hits / total;
    }
}
