package com.axonops.flint.api;

import com.axonops.flint.cache.MatcherCache;
import com.axonops.flint.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Large pattern sets and many threads against a brute-force reference.
 */
class ConcurrentMatchingIT {

    private static final String ALPHABET = "abcd ";

    private MatcherCache originalCache;

    @BeforeEach
    void setup() {
        originalCache = TestUtils.replaceGlobalCache(TestUtils.testConfigBuilder().build());
    }

    @AfterEach
    void cleanup() {
        TestUtils.restoreGlobalCache(originalCache);
    }

    private static String randomString(Random random, int minLength, int maxLength) {
        int length = minLength + random.nextInt(maxLength - minLength + 1);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /** Every occurrence, ordered by end index, then longest first, then by pattern id. */
    private static List<Match> bruteForce(List<String> patterns, String text) {
        List<Match> matches = new ArrayList<>();
        for (int end = 0; end < text.length(); end++) {
            List<String> endingHere = new ArrayList<>();
            for (String pattern : patterns) {
                int start = end - pattern.length() + 1;
                if (start >= 0 && text.startsWith(pattern, start)) {
                    endingHere.add(pattern);
                }
            }
            endingHere.sort((a, b) -> Integer.compare(b.length(), a.length()));
            for (String pattern : endingHere) {
                matches.add(new Match(end - pattern.length() + 1, end, pattern));
            }
        }
        return matches;
    }

    @Test
    @Timeout(value = 120, unit = TimeUnit.SECONDS)
    void testLargePatternSetMatchesBruteForce() {
        Random random = new Random(7);
        List<String> patterns = new ArrayList<>();
        for (int i = 0; i < 2000; i++) {
            patterns.add(randomString(random, 1, 8));
        }
        TextMatcher matcher = TextMatcher.compile(patterns, StringComparison.ORDINAL);

        for (int i = 0; i < 50; i++) {
            String text = randomString(random, 0, 400);
            assertThat(matcher.find(text).toList())
                .as("text %s", text)
                .isEqualTo(bruteForce(patterns, text));
        }
    }

    @Test
    @Timeout(value = 120, unit = TimeUnit.SECONDS)
    void testManyThreadsShareMatchers() throws Exception {
        Random random = new Random(11);
        List<List<String>> patternSets = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            List<String> set = new ArrayList<>();
            for (int j = 0; j < 50; j++) {
                set.add(randomString(random, 1, 5));
            }
            patternSets.add(set);
        }
        List<String> texts = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            texts.add(randomString(random, 50, 200));
        }

        int threadCount = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger mismatches = new AtomicInteger(0);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int t = 0; t < threadCount; t++) {
                int seed = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    Random local = new Random(seed);
                    for (int op = 0; op < 500; op++) {
                        List<String> patterns = patternSets.get(local.nextInt(patternSets.size()));
                        String text = texts.get(local.nextInt(texts.size()));
                        TextMatcher matcher = TextMatcher.compile(patterns, StringComparison.ORDINAL);
                        if (!matcher.find(text).toList().equals(bruteForce(patterns, text))) {
                            mismatches.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(mismatches.get()).isEqualTo(0);
        assertThat(TextMatcher.getCacheStatistics().currentSize()).isEqualTo(patternSets.size());
        assertThat(TextMatcher.getCacheStatistics().totalRequests()).isEqualTo(threadCount * 500L);
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testConcurrentReplaceIsDeterministic() throws Exception {
        TextMatcher matcher = TextMatcher.compile(List.of("a", "ab", "bc", "abc"), StringComparison.ORDINAL);
        String text = "abcabcab abc";
        String expected = matcher.replace(text, m -> "<" + m.value() + ">");

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> matcher.replace(text, m -> "<" + m.value() + ">")));
            }
            for (Future<String> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
