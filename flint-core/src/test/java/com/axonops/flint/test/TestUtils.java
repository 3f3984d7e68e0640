/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.axonops.flint.test;

import com.axonops.flint.api.TextMatcher;
import com.axonops.flint.cache.FlintConfig;
import com.axonops.flint.cache.MatcherCache;
import com.axonops.flint.metrics.DropwizardMetricsAdapter;
import com.axonops.flint.metrics.NoOpMetricsRegistry;
import com.codahale.metrics.MetricRegistry;

/**
 * Test helpers for swapping the global matcher cache.
 *
 * <pre>{@code
 * private MatcherCache originalCache;
 *
 * @BeforeEach
 * void setup() {
 *     originalCache = TestUtils.replaceGlobalCacheWithMetrics(registry, "test.prefix");
 * }
 *
 * @AfterEach
 * void cleanup() {
 *     TestUtils.restoreGlobalCache(originalCache);
 * }
 * }</pre>
 */
public final class TestUtils {
    private TestUtils() {
        // Utility class
    }

    /**
     * Smaller cache and shorter timeouts than {@link FlintConfig#DEFAULT}, metrics disabled.
     *
     * @return builder with test defaults
     */
    public static FlintConfig.Builder testConfigBuilder() {
        return FlintConfig.builder()
            .maxCacheSize(5000)
            .idleTimeoutSeconds(60)
            .evictionScanIntervalSeconds(15)
            .metricsRegistry(NoOpMetricsRegistry.INSTANCE);
    }

    public static FlintConfig.Builder testConfigWithMetrics(MetricRegistry registry, String prefix) {
        return testConfigBuilder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, prefix));
    }

    /**
     * Installs a new global cache.
     *
     * @param config configuration for the new cache
     * @return the previous cache, for {@link #restoreGlobalCache(MatcherCache)}
     */
    public static MatcherCache replaceGlobalCache(FlintConfig config) {
        MatcherCache original = TextMatcher.getGlobalCache();
        TextMatcher.setGlobalCache(new MatcherCache(config));
        return original;
    }

    public static MatcherCache replaceGlobalCacheWithMetrics(MetricRegistry registry, String prefix) {
        return replaceGlobalCache(testConfigWithMetrics(registry, prefix).build());
    }

    /**
     * Shuts down the current global cache and puts the original back.
     *
     * @param originalCache cache returned by {@link #replaceGlobalCache(FlintConfig)}
     */
    public static void restoreGlobalCache(MatcherCache originalCache) {
        if (originalCache != null) {
            MatcherCache current = TextMatcher.getGlobalCache();
            TextMatcher.setGlobalCache(originalCache);
            if (current != originalCache) {
                current.shutdown();
            }
        }
    }
}
