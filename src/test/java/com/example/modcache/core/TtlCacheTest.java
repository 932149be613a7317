package com.example.modcache.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.example.modcache.eviction.FifoEvictionStrategy;
import com.example.modcache.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
    }

    private TtlCache<String, String> cache(int capacity, long ttlSeconds) {
        return new TtlCache<>("test", capacity, Duration.ofSeconds(ttlSeconds), clock);
    }

    @Nested
    class Expiry {

        @Test
        @DisplayName("an entry is served until its lifetime ends and missed from then on")
        void entryExpiresAtTtl() {
            // given
            TtlCache<String, String> cache = cache(10, 300);
            cache.set("k", "v");

            // when / then
            clock.advance(Duration.ofSeconds(300).minusMillis(1));
            assertThat(cache.get("k")).contains("v");

            clock.advance(Duration.ofMillis(1));
            assertThat(cache.get("k")).isEmpty();
            assertThat(cache.size()).isZero();
        }

        @Test
        @DisplayName("a hit does not extend the lifetime")
        void hitDoesNotExtendTtl() {
            TtlCache<String, String> cache = cache(10, 10);
            cache.set("k", "v");

            clock.advanceSeconds(9);
            assertThat(cache.get("k")).contains("v");

            clock.advanceSeconds(1);
            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("overwriting an entry restarts its lifetime")
        void overwriteRestartsTtl() {
            TtlCache<String, String> cache = cache(10, 10);
            cache.set("k", "v1");
            clock.advanceSeconds(8);
            cache.set("k", "v2");
            clock.advanceSeconds(8);

            assertThat(cache.get("k")).contains("v2");
        }

        @Test
        void ttlOverrideAppliesToOneEntry() {
            TtlCache<String, String> cache = cache(10, 300);
            cache.set("short", "v", Duration.ofSeconds(5));
            cache.set("long", "v");

            clock.advanceSeconds(5);

            assertThat(cache.get("short")).isEmpty();
            assertThat(cache.get("long")).contains("v");
        }

        @Test
        @DisplayName("sweep removes every expired entry and only those")
        void sweepRemovesExpired() {
            TtlCache<String, String> cache = cache(10, 10);
            cache.set("a", "1");
            cache.set("b", "2");
            clock.advanceSeconds(5);
            cache.set("c", "3");
            clock.advanceSeconds(5);

            int removed = cache.sweep();

            assertThat(removed).isEqualTo(2);
            assertThat(cache.size()).isEqualTo(1);
            assertThat(cache.get("c")).contains("3");
            assertThat(cache.stats().expirations()).isEqualTo(2);
        }

        @Test
        void containsKeySkipsExpiredEntries() {
            TtlCache<String, String> cache = cache(10, 10);
            cache.set("k", "v");
            assertThat(cache.containsKey("k")).isTrue();

            clock.advanceSeconds(10);
            assertThat(cache.containsKey("k")).isFalse();
        }
    }

    @Nested
    class Eviction {

        @Test
        @DisplayName("capacity 2: after reading A, inserting C evicts B")
        void readProtectsEntryFromEviction() {
            // given
            TtlCache<String, String> cache = cache(2, 100);
            cache.set("A", "a");
            cache.set("B", "b");

            // when
            assertThat(cache.get("A")).contains("a");
            cache.set("C", "c");

            // then
            assertThat(cache.get("B")).isEmpty();
            assertThat(cache.get("A")).contains("a");
            assertThat(cache.get("C")).contains("c");
            assertThat(cache.stats().evictions()).isEqualTo(1);

            cache.invalidate("A");
            assertThat(cache.get("A")).isEmpty();
            assertThat(cache.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("without reads the oldest insert is evicted first")
        void insertionOrderTieBreak() {
            TtlCache<String, String> cache = cache(3, 300);
            cache.set("a", "1");
            cache.set("b", "2");
            cache.set("c", "3");
            cache.set("d", "4");

            assertThat(cache.containsKey("a")).isFalse();
            assertThat(cache.containsKey("b")).isTrue();
            assertThat(cache.containsKey("c")).isTrue();
            assertThat(cache.containsKey("d")).isTrue();
        }

        @Test
        @DisplayName("containsKey does not count as a use")
        void containsKeyLeavesRecency() {
            TtlCache<String, String> cache = cache(2, 300);
            cache.set("A", "a");
            cache.set("B", "b");

            cache.containsKey("A");
            cache.set("C", "c");

            assertThat(cache.containsKey("A")).isFalse();
            assertThat(cache.containsKey("B")).isTrue();
        }

        @Test
        @DisplayName("with first-in-first-out eviction a read does not protect the oldest entry")
        void fifoIgnoresReads() {
            TtlCache<String, String> cache = new TtlCache<>(
                "fifo", 2, Duration.ofSeconds(100), clock, new FifoEvictionStrategy<>());
            cache.set("A", "a");
            cache.set("B", "b");

            assertThat(cache.get("A")).contains("a");
            cache.set("C", "c");

            assertThat(cache.containsKey("A")).isFalse();
            assertThat(cache.get("B")).contains("b");
            assertThat(cache.get("C")).contains("c");
            assertThat(cache.stats().evictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("size never exceeds capacity under a random workload")
        void sizeStaysBounded() {
            TtlCache<Integer, Integer> cache = new TtlCache<>("bounded", 50, Duration.ofSeconds(30), clock);
            Random random = new Random(42);

            for (int i = 0; i < 5_000; i++) {
                int key = random.nextInt(500);
                int op = random.nextInt(4);
                if (op == 0) {
                    cache.get(key);
                } else if (op == 1) {
                    cache.invalidate(key);
                } else if (op == 2) {
                    clock.advance(Duration.ofMillis(random.nextInt(200)));
                } else {
                    cache.set(key, i);
                }
                assertThat(cache.size()).isLessThanOrEqualTo(50);
            }
        }

        @Test
        @DisplayName("the evicted entry is always the least recently used one")
        void victimMatchesReferenceModel() {
            TtlCache<Integer, Integer> cache = new TtlCache<>("model", 4, Duration.ofHours(1), clock);
            List<Integer> recency = new ArrayList<>();
            Random random = new Random(7);

            for (int i = 0; i < 2_000; i++) {
                int key = random.nextInt(10);
                if (random.nextBoolean()) {
                    boolean hit = cache.get(key).isPresent();
                    assertThat(hit).isEqualTo(recency.contains(key));
                    if (hit) {
                        recency.remove(Integer.valueOf(key));
                        recency.add(key);
                    }
                } else {
                    cache.set(key, i);
                    recency.remove(Integer.valueOf(key));
                    recency.add(key);
                    if (recency.size() > 4) {
                        Integer expectedVictim = recency.remove(0);
                        assertThat(cache.containsKey(expectedVictim)).isFalse();
                    }
                }
            }
        }
    }

    @Nested
    class Invalidation {

        @Test
        void invalidateReportsRemoval() {
            TtlCache<String, String> cache = cache(10, 300);
            cache.set("k", "v");

            assertThat(cache.invalidate("k")).isTrue();
            assertThat(cache.invalidate("k")).isFalse();
            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        void invalidateIfRemovesMatchingKeys() {
            TtlCache<String, String> cache = cache(10, 300);
            cache.set("1:mod", "a");
            cache.set("1:audit", "b");
            cache.set("2:mod", "c");

            int removed = cache.invalidateIf(key -> key.startsWith("1:"));

            assertThat(removed).isEqualTo(2);
            assertThat(cache.get("2:mod")).contains("c");
        }

        @Test
        @DisplayName("a load stamped before an invalidation is not stored")
        void staleStampIsRejected() {
            TtlCache<String, String> cache = cache(10, 300);
            long stamp = cache.invalidationStamp();

            cache.invalidate("k");

            assertThat(cache.setIfNotInvalidatedSince("k", "old", stamp)).isFalse();
            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("a load with a current stamp is stored")
        void currentStampIsAccepted() {
            TtlCache<String, String> cache = cache(10, 300);
            cache.invalidate("other");
            long stamp = cache.invalidationStamp();

            assertThat(cache.setIfNotInvalidatedSince("k", "v", stamp)).isTrue();
            assertThat(cache.get("k")).contains("v");
        }

        @Test
        void everyInvalidationKindMovesTheStamp() {
            TtlCache<String, String> cache = cache(10, 300);
            long initial = cache.invalidationStamp();

            cache.invalidateIf(key -> false);
            long afterFilter = cache.invalidationStamp();
            cache.clear();
            long afterClear = cache.invalidationStamp();
            cache.set("k", "v");
            clock.advanceSeconds(300);
            cache.sweep();

            assertThat(afterFilter).isGreaterThan(initial);
            assertThat(afterClear).isGreaterThan(afterFilter);
            assertThat(cache.invalidationStamp()).isEqualTo(afterClear);
        }

        @Test
        void clearDropsEntriesAndResetsCounters() {
            TtlCache<String, String> cache = cache(10, 300);
            cache.set("a", "1");
            cache.get("a");
            cache.get("missing");

            assertThat(cache.clear()).isEqualTo(1);

            CacheStats stats = cache.stats();
            assertThat(stats.size()).isZero();
            assertThat(stats.hits()).isZero();
            assertThat(stats.misses()).isZero();
        }
    }

    @Test
    void statsTrackHitsAndMisses() {
        TtlCache<String, String> cache = cache(10, 300);
        cache.set("a", "1");
        cache.get("a");
        cache.get("a");
        cache.get("b");

        CacheStats stats = cache.stats();

        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isCloseTo(2.0 / 3.0, offset(1e-9));
        assertThat(stats.capacity()).isEqualTo(10);
        assertThat(stats.ttl()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> cache(0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TtlCache<String, String>("x", 1, Duration.ZERO, clock))
            .isInstanceOf(IllegalArgumentException.class);

        TtlCache<String, String> cache = cache(1, 10);
        assertThatThrownBy(() -> cache.set(null, "v")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cache.set("k", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> cache.set("k", "v", Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent writers never push the size over capacity")
    void concurrentWritesStayBounded() throws Exception {
        TtlCache<Integer, Integer> cache = new TtlCache<>("concurrent", 100, Duration.ofMinutes(1), clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int offset = t * 10_000;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        cache.set(offset + i, i);
                        cache.get(offset + i / 2);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(cache.size()).isEqualTo(100);
        assertThat(cache.stats().evictions()).isEqualTo(8 * 2_000 - 100);
    }
}
