package fun.fengwk.readex.core.cache;

/**
 * Point-in-time cache counters.
 *
 * @author fengwk
 */
public record CacheStats(long size, long hits, long misses, double hitRatio) {

    public static CacheStats of(long size, long hits, long misses) {
        long total = hits + misses;
        return new CacheStats(size, hits, misses, total == 0 ? 0.0 : (double) hits / total);
    }

}
