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


package com.axonops.flint.metrics;

/**
 * Metric name constants.
 *
 * <h2>Metric Categories</h2>
 *
 * <ul>
 *   <li><b>Compilation</b> - matcher builds and cache efficiency
 *   <li><b>Cache State</b> - cached matchers and automaton nodes held
 *   <li><b>Cache Evictions</b> - LRU and idle evictions
 *   <li><b>Find</b> - search operations, latency, surviving and rejected matches
 *   <li><b>Replace</b> - replace operations, latency, applied and skipped matches
 *   <li><b>Errors</b> - rejected compilations
 * </ul>
 *
 * <h2>Naming</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - suffix {@code .total.count}
 *   <li><b>Timer</b> - suffix {@code .latency}, nanoseconds
 *   <li><b>Gauge</b> - suffix {@code .current.count} or {@code .peak.count}
 * </ul>
 *
 * <p>Cache hit rate is {@code MATCHERS_CACHE_HITS / (MATCHERS_CACHE_HITS + MATCHERS_CACHE_MISSES)}.
 *
 * @since 1.0.0
 * @see com.axonops.flint.cache.MatcherCache
 * @see com.axonops.flint.api.TextMatcher
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Compilation
  // ========================================

  /**
   * Matchers built (automaton construction actually ran).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHERS_COMPILED = "matchers.compiled.total.count";

  /**
   * Compile requests served from the cache.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHERS_CACHE_HITS = "matchers.cache.hits.total.count";

  /**
   * Compile requests that had to build a matcher.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String MATCHERS_CACHE_MISSES = "matchers.cache.misses.total.count";

  /**
   * Time spent normalizing patterns and building the automaton.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String MATCHERS_COMPILATION_LATENCY = "matchers.compilation.latency";

  // ========================================
  // Cache State
  // ========================================

  /**
   * Matchers currently cached.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_MATCHERS_COUNT = "cache.matchers.current.count";

  /**
   * Automaton nodes held by cached matchers. Proxy for heap retained by the cache.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_NODES_COUNT = "cache.nodes.current.count";

  /**
   * High water mark of {@link #CACHE_NODES_COUNT}.
   *
   * <p><b>Type:</b> Gauge (count)
   */
  public static final String CACHE_NODES_PEAK = "cache.nodes.peak.count";

  // ========================================
  // Cache Evictions
  // ========================================

  /**
   * Matchers evicted because the cache exceeded maxCacheSize.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> high values mean the working set exceeds the cache size
   */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /**
   * Matchers evicted after idleTimeoutSeconds without use.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========================================
  // Find
  // ========================================

  /**
   * Find operations started (lazy, callback and containsAny forms).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String FIND_OPERATIONS = "find.operations.total.count";

  /**
   * Duration of eager find operations (callback form and containsAny). The lazy form is not
   * timed because its cost is paid by the consumer.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String FIND_LATENCY = "find.latency";

  /**
   * Matches delivered to callers.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Incremented:</b> when a scan completes; a lazy sequence abandoned before exhaustion is
   * not counted
   */
  public static final String FIND_MATCHES = "find.matches.total.count";

  /**
   * Candidates dropped by the exact-match filter.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String FIND_REJECTED = "find.rejected.total.count";

  /**
   * findAll calls.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String FIND_BULK_OPERATIONS = "find.bulk.operations.total.count";

  /**
   * Texts submitted across all findAll calls.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String FIND_BULK_ITEMS = "find.bulk.items.total.count";

  // ========================================
  // Replace
  // ========================================

  /**
   * Replace operations (all three substitution sources).
   *
   * <p><b>Type:</b> Counter
   */
  public static final String REPLACE_OPERATIONS = "replace.operations.total.count";

  /**
   * Replace duration, including time spent in a caller-supplied provider.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String REPLACE_LATENCY = "replace.latency";

  /**
   * Matches substituted.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String REPLACE_APPLIED = "replace.applied.total.count";

  /**
   * Matches skipped because they overlapped an earlier substituted match.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String REPLACE_SKIPPED = "replace.skipped.total.count";

  // ========================================
  // Errors
  // ========================================

  /**
   * Compilations rejected because the pattern set exceeded maxPatternsPerMatcher.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String ERRORS_PATTERN_LIMIT_EXCEEDED =
      "errors.pattern.limit.exceeded.total.count";
}
