package fun.fengwk.readex.core.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class LruTtlCacheTest {

    private static final Duration TTL = Duration.ofMillis(100);

    private final AtomicLong now = new AtomicLong(1_000);

    private LruTtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        cache = new LruTtlCache<>("test", 2, Duration.ZERO, now::get);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    public void shouldReturnValueWithinTtl() {
        cache.set("a", "1", TTL);
        now.addAndGet(99);

        assertThat(cache.get("a")).contains("1");
    }

    @Test
    public void shouldHideValueOnceExpired() {
        cache.set("a", "1", TTL);
        now.addAndGet(100);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldEvictLeastRecentlyUsed() {
        cache.set("a", "1", TTL);
        cache.set("b", "2", TTL);
        assertThat(cache.get("a")).contains("1");

        cache.set("c", "3", TTL);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1");
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    public void shouldEvictOldestWithoutReads() {
        cache.set("a", "1", TTL);
        cache.set("b", "2", TTL);
        cache.set("c", "3", TTL);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    public void shouldRefreshExistingKeyWithoutEviction() {
        cache.set("a", "1", TTL);
        cache.set("b", "2", TTL);
        cache.set("a", "10", TTL);
        cache.set("c", "3", TTL);

        assertThat(cache.get("a")).contains("10");
        assertThat(cache.get("b")).isEmpty();
    }

    @Test
    public void shouldSweepExpiredEntries() {
        cache.set("a", "1", TTL);
        cache.set("b", "2", Duration.ofMillis(500));
        now.addAndGet(200);

        assertThat(cache.sweep()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("b")).contains("2");
    }

    @Test
    public void shouldTrackHitsAndMisses() {
        cache.set("a", "1", TTL);
        cache.get("a");
        cache.get("a");
        cache.get("missing");
        cache.get("other");

        CacheStats stats = cache.stats();

        assertThat(stats.size()).isEqualTo(1);
        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(2);
        assertThat(stats.hitRatio()).isEqualTo(0.5);
    }

    @Test
    public void shouldRemoveAndClear() {
        cache.set("a", "1", TTL);
        cache.set("b", "2", TTL);

        cache.remove("a");
        assertThat(cache.get("a")).isEmpty();

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldRejectNonPositiveSize() {
        assertThatThrownBy(() -> new LruTtlCache<String, String>("bad", 0, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

}
