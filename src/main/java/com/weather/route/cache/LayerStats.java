package com.weather.route.cache;

/**
 * Counters for one cache layer as seen by the {@link TieredCache}.
 *
 * @param layer          layer name
 * @param hitCount       lookups answered by the layer
 * @param missCount      lookups the layer could not answer
 * @param errorCount     operations that failed because the layer was unreachable
 * @param writeCount     successful writes
 * @param backfillCount  writes that re-warmed the layer from a lower tier
 * @param staleHitCount  expired entries served from the grace window
 * @param size           entries currently stored, -1 if unknown
 */
public record LayerStats(String layer, long hitCount, long missCount, long errorCount,
                         long writeCount, long backfillCount, long staleHitCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static LayerStats empty(String layer) {
        return new LayerStats(layer, 0, 0, 0, 0, 0, 0, 0);
    }
}
