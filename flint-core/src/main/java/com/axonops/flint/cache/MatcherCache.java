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

import com.axonops.flint.api.MatchMode;
import com.axonops.flint.api.StringComparison;
import com.axonops.flint.api.TextMatcher;
import com.axonops.flint.metrics.FlintMetricsRegistry;
import com.axonops.flint.metrics.MetricNames;
import com.axonops.flint.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe cache of compiled {@link TextMatcher}s with dual eviction.
 *
 * <p>Eviction strategies: 1. LRU (soft limit): when the cache exceeds max size, the least recently
 * used matchers are evicted asynchronously 2. Idle time: a background thread evicts matchers idle
 * beyond the timeout
 *
 * <p>Matchers are immutable and hold no native resources, so an evicted matcher stays fully usable
 * by callers that still reference it; eviction only drops the cache's reference.
 *
 * <p>Performance characteristics: lock-free reads (ConcurrentHashMap), lock-free timestamp updates
 * (AtomicLong), one compilation per key under concurrent misses (computeIfAbsent).
 *
 * @since 1.0.0
 */
public final class MatcherCache {
  private static final Logger logger = LoggerFactory.getLogger(MatcherCache.class);

  private volatile FlintConfig config;

  private volatile ConcurrentHashMap<CacheKey, CachedMatcher> cache;
  private IdleEvictionTask evictionTask;
  private ExecutorService lruEvictionExecutor;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicLong evictionsIdle = new AtomicLong(0);

  // Automaton nodes held by cached matchers
  private final AtomicLong totalNodes = new AtomicLong(0);
  private final AtomicLong peakNodes = new AtomicLong(0);

  /**
   * Creates a new matcher cache.
   *
   * @param config the cache configuration
   */
  public MatcherCache(FlintConfig config) {
    this.config = config;
    start(config);
    registerCacheMetrics();
  }

  public FlintConfig getConfig() {
    return config;
  }

  private void start(FlintConfig cfg) {
    if (cfg.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>();
      this.lruEvictionExecutor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "Flint-LRU-Eviction");
                t.setDaemon(true);
                t.setPriority(Thread.MIN_PRIORITY);
                return t;
              });
      this.evictionTask = new IdleEvictionTask(this, cfg);
      this.evictionTask.start();

      logger.debug(
          "Flint: Matcher cache initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s",
          cfg.maxCacheSize(),
          cfg.idleTimeoutSeconds(),
          cfg.evictionScanIntervalSeconds());
    } else {
      this.cache = null;
      this.evictionTask = null;
      this.lruEvictionExecutor = null;
      logger.info("Flint: Matcher caching disabled");
    }
  }

  private void stop() {
    if (evictionTask != null) {
      evictionTask.stop();
    }
    if (lruEvictionExecutor != null) {
      lruEvictionExecutor.shutdown();
    }
  }

  /**
   * Gets or compiles a matcher.
   *
   * <p>Lock-free for cache hits. Concurrent misses on the same key compile once.
   *
   * @param patterns pattern set (already copied, not mutated afterwards)
   * @param comparison comparison mode
   * @param matchMode match mode
   * @param compiler builds the matcher on a miss
   * @return cached or newly compiled matcher
   */
  public TextMatcher getOrCompile(
      List<String> patterns,
      StringComparison comparison,
      MatchMode matchMode,
      Supplier<TextMatcher> compiler) {
    FlintMetricsRegistry metrics = config.metricsRegistry();
    ConcurrentHashMap<CacheKey, CachedMatcher> map = cache;

    if (map == null) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.MATCHERS_CACHE_MISSES);
      return compiler.get();
    }

    CacheKey key = new CacheKey(patterns, comparison, comparison.locale(), matchMode);

    CachedMatcher cached = map.get(key);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.MATCHERS_CACHE_HITS);
      logger.trace("Flint: Cache hit - {}", key);
      return cached.matcher();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.MATCHERS_CACHE_MISSES);
    logger.trace("Flint: Cache miss - {}, compiling", key);

    final long[] addedNodes = {0};
    CachedMatcher result =
        map.computeIfAbsent(
            key,
            k -> {
              CachedMatcher created = new CachedMatcher(compiler.get());
              addedNodes[0] = created.nodeCount();
              return created;
            });

    if (addedNodes[0] > 0) {
      updatePeakNodes(totalNodes.addAndGet(addedNodes[0]));
    }

    int currentSize = map.size();
    if (currentSize > config.maxCacheSize()) {
      triggerAsyncLRUEviction(currentSize - config.maxCacheSize());
    }

    return result.matcher();
  }

  private void triggerAsyncLRUEviction(int toEvict) {
    ExecutorService executor = lruEvictionExecutor;
    if (toEvict <= 0 || executor == null || executor.isShutdown()) {
      return;
    }
    executor.submit(
        () -> {
          try {
            evictLRUBatch(toEvict);
          } catch (RuntimeException e) {
            logger.warn("Flint: Error during async LRU eviction", e);
          }
        });
  }

  /**
   * Evicts least-recently-used matchers.
   *
   * <p>Sample-based: looks at up to 500 entries and evicts the oldest. Matchers used within
   * evictionProtectionMs are skipped.
   *
   * @param toEvict number of matchers requested for eviction
   * @return number of matchers evicted
   */
  int evictLRUBatch(int toEvict) {
    ConcurrentHashMap<CacheKey, CachedMatcher> map = cache;
    if (map == null) {
      return 0;
    }
    int actualToEvict = Math.min(toEvict, map.size() - config.maxCacheSize());
    if (actualToEvict <= 0) {
      return 0;
    }

    int sampleSize = Math.min(500, map.size());
    long cutoffTime = System.nanoTime() - config.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<CacheKey, CachedMatcher>> candidates =
        map.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() < cutoffTime)
            .limit(sampleSize)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(actualToEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<CacheKey, CachedMatcher> entry : candidates) {
      if (map.remove(entry.getKey(), entry.getValue())) {
        totalNodes.addAndGet(-entry.getValue().nodeCount());
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("Flint: LRU evicting matcher: {}", entry.getKey());
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "Flint: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          map.size(),
          config.maxCacheSize());
    }
    return evicted;
  }

  /**
   * Evicts matchers unused for longer than idleTimeoutSeconds. Called by the background thread.
   *
   * @return number of matchers evicted
   */
  int evictIdleMatchers() {
    ConcurrentHashMap<CacheKey, CachedMatcher> map = cache;
    if (map == null) {
      return 0;
    }

    long cutoffNanos = System.nanoTime() - config.idleTimeoutSeconds() * 1_000_000_000L;
    AtomicLong evictedCount = new AtomicLong(0);

    map.entrySet()
        .removeIf(
            entry -> {
              CachedMatcher cached = entry.getValue();
              if (cached.lastAccessTimeNanos() < cutoffNanos) {
                totalNodes.addAndGet(-cached.nodeCount());
                evictionsIdle.incrementAndGet();
                config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE);
                logger.trace("Flint: Idle evicting matcher: {}", entry.getKey());
                evictedCount.incrementAndGet();
                return true;
              }
              return false;
            });

    int evicted = (int) evictedCount.get();
    if (evicted > 0) {
      logger.debug(
          "Flint: Idle eviction completed - evicted: {}, cacheSize: {}", evicted, map.size());
    }
    return evicted;
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    ConcurrentHashMap<CacheKey, CachedMatcher> map = cache;
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        evictionsIdle.get(),
        map != null ? map.size() : 0,
        config.maxCacheSize(),
        totalNodes.get(),
        peakNodes.get());
  }

  /** Number of cached matchers. */
  public int size() {
    ConcurrentHashMap<CacheKey, CachedMatcher> map = cache;
    return map != null ? map.size() : 0;
  }

  /**
   * Removes every cached matcher. Matchers already handed out stay usable.
   */
  public void clear() {
    ConcurrentHashMap<CacheKey, CachedMatcher> map = cache;
    if (map == null) {
      return;
    }
    logger.debug("Flint: Clearing cache - {} cached matchers", map.size());
    map.clear();
    totalNodes.set(0);
  }

  /** Resets hit, miss and eviction counters. */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    evictionsIdle.set(0);
    peakNodes.set(totalNodes.get());
    logger.trace("Flint: Cache statistics reset");
  }

  /** Clears the cache and resets statistics. */
  public void reset() {
    clear();
    resetStatistics();
  }

  /**
   * Replaces the configuration. Clears the cache and restarts the background tasks with the new
   * settings.
   *
   * @param newConfig the new configuration
   */
  public synchronized void reconfigure(FlintConfig newConfig) {
    logger.info("Flint: Reconfiguring cache with new settings");

    stop();
    clear();
    resetStatistics();

    FlintMetricsRegistry previous = config.metricsRegistry();
    this.config = newConfig;
    start(newConfig);

    if (previous != newConfig.metricsRegistry()) {
      removeCacheMetrics(previous);
      registerCacheMetrics();
    }

    logger.info(
        "Flint: Cache reconfigured - enabled: {}, maxSize: {}, idleTimeout: {}s",
        newConfig.cacheEnabled(),
        newConfig.maxCacheSize(),
        newConfig.idleTimeoutSeconds());
  }

  /** Stops the background tasks and clears the cache. */
  public synchronized void shutdown() {
    logger.info("Flint: Shutting down cache");
    stop();
    clear();
  }

  private void registerCacheMetrics() {
    FlintMetricsRegistry metrics = config.metricsRegistry();
    metrics.registerGauge(MetricNames.CACHE_MATCHERS_COUNT, this::size);
    metrics.registerGauge(MetricNames.CACHE_NODES_COUNT, totalNodes::get);
    metrics.registerGauge(MetricNames.CACHE_NODES_PEAK, peakNodes::get);
    logger.debug("Flint: Cache gauges registered");
  }

  private static void removeCacheMetrics(FlintMetricsRegistry metrics) {
    metrics.removeGauge(MetricNames.CACHE_MATCHERS_COUNT);
    metrics.removeGauge(MetricNames.CACHE_NODES_COUNT);
    metrics.removeGauge(MetricNames.CACHE_NODES_PEAK);
  }

  private void updatePeakNodes(long current) {
    long peak;
    do {
      peak = peakNodes.get();
    } while (current > peak && !peakNodes.compareAndSet(peak, current));
  }

  /**
   * Cache key: pattern set, comparison and mode. Culture-sensitive comparisons also key on the
   * locale in effect, so changing the default locale yields a new matcher.
   */
  private record CacheKey(
      List<String> patterns, StringComparison comparison, Locale locale, MatchMode matchMode) {
    @Override
    public String toString() {
      return PatternHasher.hash(patterns) + " (" + comparison + ", " + matchMode + ")";
    }
  }

  /** Cached matcher with atomic access time tracking. */
  private static final class CachedMatcher {
    private final TextMatcher matcher;
    private final AtomicLong lastAccessTimeNanos;

    CachedMatcher(TextMatcher matcher) {
      this.matcher = matcher;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    TextMatcher matcher() {
      return matcher;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    long nodeCount() {
      return matcher.nodeCount();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
