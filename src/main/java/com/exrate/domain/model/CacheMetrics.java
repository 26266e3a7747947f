package com.exrate.domain.model;

/**
 * Exchange rate cache statistics for the lifetime of the process (or since the last clear)
 */
public record CacheMetrics(
        int totalEntries,
        long hitCount,
        long missCount,
        double hitRate,
        long apiCallsSaved,
        double averageAccessCount,
        long oldestEntryAgeMs,
        long newestEntryAgeMs
) {
}
