package com.axonops.flint.cache;

import com.axonops.flint.api.Match;
import com.axonops.flint.api.StringComparison;
import com.axonops.flint.api.TextMatcher;
import com.axonops.flint.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Thread safety verification tests.
 */
class ThreadSafetyTest {

    private MatcherCache originalCache;

    @BeforeEach
    void setUp() {
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
    }

    @AfterEach
    void tearDown() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentCacheMapAccess_100Threads() throws InterruptedException {
        int threadCount = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        // Pre-populate "existing"
        TextMatcher.compile(List.of("existing"));

        for (int i = 0; i < threadCount; i++) {
            int threadId = i;
            new Thread(() -> {
                try {
                    start.await();

                    int op = threadId % 10;
                    if (op < 3) {
                        // 30%: Insert new
                        TextMatcher.compile(List.of("new" + threadId));
                    } else if (op < 7) {
                        // 40%: Cache hit
                        TextMatcher.compile(List.of("existing"));
                    } else {
                        // 30%: Statistics
                        TextMatcher.getCacheStatistics();
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);

        CacheStatistics stats = TextMatcher.getCacheStatistics();
        assertThat(stats.currentSize()).isEqualTo(31);
        assertThat(stats.hits()).isEqualTo(40);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentMetricsUpdates_100Threads() throws InterruptedException {
        int threadCount = 100;
        int opsPerThread = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < opsPerThread; j++) {
                        TextMatcher.compile(List.of("pattern" + (j % 10)));
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);

        // No lost increments
        CacheStatistics stats = TextMatcher.getCacheStatistics();
        assertThat(stats.totalRequests()).isEqualTo(threadCount * opsPerThread);
        assertThat(stats.currentSize()).isEqualTo(10);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentMissesShareOneMatcher() throws InterruptedException {
        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        Set<TextMatcher> seen = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    seen.add(TextMatcher.compile(List.of("he", "she", "his", "hers"), StringComparison.ORDINAL));
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(seen).hasSize(1);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testSharedMatcherAcrossThreads() throws InterruptedException {
        TextMatcher matcher = TextMatcher.compile(List.of("he", "she", "his", "hers"), StringComparison.ORDINAL);
        List<Match> expected = matcher.find("ushers said his hershey").toList();

        int threadCount = 50;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger errors = new AtomicInteger(0);
        AtomicInteger mismatches = new AtomicInteger(0);

        for (int i = 0; i < threadCount; i++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < 200; j++) {
                        if (!matcher.find("ushers said his hershey").toList().equals(expected)) {
                            mismatches.incrementAndGet();
                        }
                        matcher.replace("ushers said his hershey", "*");
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        done.await();

        assertThat(errors.get()).isEqualTo(0);
        assertThat(mismatches.get()).isEqualTo(0);
    }
}
