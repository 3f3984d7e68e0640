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


package com.axonops.flint.cache;

import com.axonops.flint.metrics.FlintMetricsRegistry;
import com.axonops.flint.metrics.NoOpMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for Flint: matcher caching, safety limits and metrics.
 *
 * <p>Immutable. Compiling a pattern set builds a full automaton, so {@link
 * com.axonops.flint.api.TextMatcher#compile(Iterable)} keeps compiled matchers in a cache with
 * two eviction strategies:
 *
 * <ol>
 *   <li><b>LRU Eviction</b> - once the cache holds more than {@code maxCacheSize} matchers, the
 *       least recently used are evicted asynchronously (soft limit)
 *   <li><b>Idle Eviction</b> - a background thread evicts matchers unused for {@code
 *       idleTimeoutSeconds}
 * </ol>
 *
 * <p>Matchers compiled or used within {@code evictionProtectionMs} are never chosen by LRU
 * eviction.
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 10K matchers, 5 minute idle timeout, metrics disabled
 * TextMatcher.configureCache(FlintConfig.DEFAULT);
 *
 * // Small cache with metrics
 * FlintConfig config = FlintConfig.builder()
 *     .maxCacheSize(500)
 *     .idleTimeoutSeconds(60)
 *     .evictionScanIntervalSeconds(15)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.flint"))
 *     .build();
 * }</pre>
 *
 * @param cacheEnabled cache compiled matchers (if false every compile builds a new matcher)
 * @param maxCacheSize matchers kept before LRU eviction (must be > 0 if cache enabled)
 * @param idleTimeoutSeconds evict matchers unused for this long (must be > 0 if cache enabled)
 * @param evictionScanIntervalSeconds how often the idle eviction thread runs (must be > 0 if
 *     cache enabled)
 * @param evictionProtectionMs recently used matchers are exempt from LRU eviction for this long
 * @param maxPatternsPerMatcher largest pattern set a single matcher may be built from
 * @param metricsRegistry metrics sink (use {@link NoOpMetricsRegistry#INSTANCE} to disable)
 * @since 1.0.0
 * @see com.axonops.flint.cache.MatcherCache
 * @see com.axonops.flint.metrics.MetricNames
 */
public record FlintConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    long evictionProtectionMs,
    int maxPatternsPerMatcher,
    FlintMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(FlintConfig.class);

  /**
   * Production defaults: cache of 10,000 matchers, 5 minute idle timeout scanned every minute, 1
   * second eviction protection, at most 1,000,000 patterns per matcher, metrics disabled.
   */
  public static final FlintConfig DEFAULT =
      new FlintConfig(
          true, // Cache enabled
          10000, // Max 10K cached matchers
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          1000, // 1 second eviction protection
          1_000_000, // Max 1M patterns per matcher
          NoOpMetricsRegistry.INSTANCE);

  /** Caching disabled. Every compile builds a fresh matcher. */
  public static final FlintConfig NO_CACHE =
      new FlintConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          1_000_000, // Still enforce pattern limit
          NoOpMetricsRegistry.INSTANCE);

  public FlintConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (maxPatternsPerMatcher <= 0) {
      throw new IllegalArgumentException("maxPatternsPerMatcher must be positive");
    }

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException(
            "idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }

      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        logger.warn(
            "Flint: evictionScanIntervalSeconds ({}s) exceeds idleTimeoutSeconds ({}s) - idle matchers may not be evicted promptly",
            evictionScanIntervalSeconds,
            idleTimeoutSeconds);
      }
    }
  }

  /**
   * Builder starting from {@link #DEFAULT}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link FlintConfig}. Unset fields keep the {@link #DEFAULT} values. */
  public static class Builder {
    private boolean cacheEnabled = DEFAULT.cacheEnabled();
    private int maxCacheSize = DEFAULT.maxCacheSize();
    private long idleTimeoutSeconds = DEFAULT.idleTimeoutSeconds();
    private long evictionScanIntervalSeconds = DEFAULT.evictionScanIntervalSeconds();
    private long evictionProtectionMs = DEFAULT.evictionProtectionMs();
    private int maxPatternsPerMatcher = DEFAULT.maxPatternsPerMatcher();
    private FlintMetricsRegistry metricsRegistry = DEFAULT.metricsRegistry();

    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Maximum cached matchers before LRU eviction kicks in.
     *
     * <p>Monitor {@code cache.matchers.current.count} and the hit rate to tune.
     *
     * @param size maximum cached matchers (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    public Builder evictionProtectionMs(long ms) {
      this.evictionProtectionMs = ms;
      return this;
    }

    /**
     * Safety limit on pattern set size. Compiling a larger set throws {@link
     * IllegalArgumentException}.
     *
     * @param max maximum patterns per matcher (must be > 0)
     * @return this builder
     */
    public Builder maxPatternsPerMatcher(int max) {
      this.maxPatternsPerMatcher = max;
      return this;
    }

    public Builder metricsRegistry(FlintMetricsRegistry metricsRegistry) {
      this.metricsRegistry = metricsRegistry;
      return this;
    }

    public FlintConfig build() {
      return new FlintConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          evictionProtectionMs,
          maxPatternsPerMatcher,
          metricsRegistry);
    }
  }
}
