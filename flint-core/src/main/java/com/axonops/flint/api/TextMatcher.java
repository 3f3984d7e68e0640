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


package com.axonops.flint.api;

import com.axonops.flint.automaton.Automaton;
import com.axonops.flint.automaton.AutomatonBuilder;
import com.axonops.flint.automaton.Hit;
import com.axonops.flint.automaton.ScanCursor;
import com.axonops.flint.cache.CacheStatistics;
import com.axonops.flint.cache.FlintConfig;
import com.axonops.flint.cache.MatcherCache;
import com.axonops.flint.metrics.FlintMetricsRegistry;
import com.axonops.flint.metrics.MetricNames;
import com.axonops.flint.text.ExactMatchFilter;
import com.axonops.flint.text.Normalizer;
import com.axonops.flint.text.ReplaceEngine;
import com.axonops.flint.text.Substitution;
import com.axonops.flint.util.PatternHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A compiled set of literal patterns that finds all their occurrences in a single pass.
 *
 * <p>Built on an Aho-Corasick automaton: scanning a text costs time linear in the text length
 * plus the number of matches, however many patterns there are.
 *
 * <pre>{@code
 * TextMatcher matcher = TextMatcher.compile(List.of("jedi", "sith"), StringComparison.ORDINAL_IGNORE_CASE);
 *
 * for (Match m : matcher.find("Jedi versus Sith")) {
 *     System.out.println(m.startIndex() + ": " + m.value());
 * }
 *
 * String masked = matcher.replace("Jedi versus Sith", "****");   // "**** versus ****"
 * }</pre>
 *
 * <p>Defaults: {@link StringComparison#CURRENT_CULTURE} and {@link MatchMode#FUZZY}.
 *
 * <p>Thread-safe: instances are immutable and can be shared freely. Each operation allocates its
 * own scan state.
 *
 * <p>Caching: {@link #compile(Iterable)} keeps compiled matchers in a global {@link MatcherCache},
 * so compiling an equal pattern set again is cheap. {@link #compileWithoutCache(Iterable)} always
 * builds a new matcher.
 *
 * @since 1.0.0
 */
public final class TextMatcher {
    private static final Logger logger = LoggerFactory.getLogger(TextMatcher.class);

    /** Default comparison when none is given. */
    public static final StringComparison DEFAULT_COMPARISON = StringComparison.CURRENT_CULTURE;

    /** Default mode when none is given. */
    public static final MatchMode DEFAULT_MATCH_MODE = MatchMode.FUZZY;

    // Global matcher cache (replaceable for testing)
    private static volatile MatcherCache cache = new MatcherCache(FlintConfig.DEFAULT);

    private final List<String> patterns;
    private final StringComparison comparison;
    private final MatchMode matchMode;
    private final Normalizer normalizer;
    private final Automaton automaton;

    TextMatcher(List<String> patterns, StringComparison comparison, MatchMode matchMode,
                Normalizer normalizer, Automaton automaton) {
        this.patterns = patterns;
        this.comparison = comparison;
        this.matchMode = matchMode;
        this.normalizer = normalizer;
        this.automaton = automaton;
    }

    public static TextMatcher compile(Iterable<String> patterns) {
        return compile(patterns, DEFAULT_COMPARISON, DEFAULT_MATCH_MODE);
    }

    public static TextMatcher compile(Iterable<String> patterns, StringComparison comparison) {
        return compile(patterns, comparison, DEFAULT_MATCH_MODE);
    }

    /**
     * Compiles a pattern set, reusing a cached matcher when an equal set was compiled before with
     * the same comparison and mode.
     *
     * @param patterns   literal patterns; pattern ids follow iteration order
     * @param comparison how patterns are compared with texts
     * @param matchMode  which occurrences are reported
     * @return compiled matcher
     * @throws NullPointerException     if any argument or pattern is null
     * @throws IllegalArgumentException if the set exceeds {@link FlintConfig#maxPatternsPerMatcher()}
     */
    public static TextMatcher compile(Iterable<String> patterns, StringComparison comparison, MatchMode matchMode) {
        Objects.requireNonNull(patterns, "patterns cannot be null");
        Objects.requireNonNull(comparison, "comparison cannot be null");
        Objects.requireNonNull(matchMode, "matchMode cannot be null");

        List<String> copy = copyPatterns(patterns);
        return cache.getOrCompile(copy, comparison, matchMode, () -> doCompile(copy, comparison, matchMode));
    }

    public static TextMatcher compileWithoutCache(Iterable<String> patterns) {
        return compileWithoutCache(patterns, DEFAULT_COMPARISON, DEFAULT_MATCH_MODE);
    }

    public static TextMatcher compileWithoutCache(Iterable<String> patterns, StringComparison comparison) {
        return compileWithoutCache(patterns, comparison, DEFAULT_MATCH_MODE);
    }

    /**
     * Compiles a pattern set, bypassing the cache.
     *
     * @param patterns   literal patterns; pattern ids follow iteration order
     * @param comparison how patterns are compared with texts
     * @param matchMode  which occurrences are reported
     * @return new matcher
     */
    public static TextMatcher compileWithoutCache(Iterable<String> patterns, StringComparison comparison, MatchMode matchMode) {
        Objects.requireNonNull(patterns, "patterns cannot be null");
        Objects.requireNonNull(comparison, "comparison cannot be null");
        Objects.requireNonNull(matchMode, "matchMode cannot be null");

        return doCompile(copyPatterns(patterns), comparison, matchMode);
    }

    private static List<String> copyPatterns(Iterable<String> patterns) {
        List<String> copy = new ArrayList<>();
        for (String pattern : patterns) {
            if (pattern == null) {
                throw new NullPointerException("patterns[" + copy.size() + "] cannot be null");
            }
            copy.add(pattern);
        }
        return Collections.unmodifiableList(copy);
    }

    private static TextMatcher doCompile(List<String> patterns, StringComparison comparison, MatchMode matchMode) {
        FlintConfig config = cache.getConfig();
        FlintMetricsRegistry metrics = config.metricsRegistry();
        String hash = PatternHasher.hash(patterns);

        if (patterns.size() > config.maxPatternsPerMatcher()) {
            metrics.incrementCounter(MetricNames.ERRORS_PATTERN_LIMIT_EXCEEDED);
            logger.debug("Flint: Pattern limit exceeded - hash: {}, limit: {}", hash, config.maxPatternsPerMatcher());
            throw new IllegalArgumentException("Pattern set of size " + patterns.size()
                + " exceeds maxPatternsPerMatcher (" + config.maxPatternsPerMatcher() + ")");
        }

        long startNanos = System.nanoTime();

        Normalizer normalizer = comparison.normalizer();
        Automaton automaton = AutomatonBuilder.build(normalizer.normalizeAll(patterns));

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.MATCHERS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.MATCHERS_COMPILED);

        logger.trace("Flint: Matcher compiled - hash: {}, comparison: {}, mode: {}, nodes: {}, timeNs: {}",
            hash, comparison, matchMode, automaton.nodeCount(), durationNanos);

        return new TextMatcher(patterns, comparison, matchMode, normalizer, automaton);
    }

    /**
     * Finds all matches in a text, lazily.
     *
     * <p>The returned sequence scans on iteration and can be iterated repeatedly.
     *
     * @param text text to search
     * @return matches in order of end index
     * @throws NullPointerException if text is null
     */
    public MatchSequence find(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        metrics().incrementCounter(MetricNames.FIND_OPERATIONS);
        return new MatchSequence(this, text);
    }

    /**
     * Finds all matches in a text, passing each one to a callback as it is found.
     *
     * @param text    text to search
     * @param onMatch called once per match, in order of end index
     * @throws NullPointerException if text or onMatch is null
     */
    public void find(String text, Consumer<Match> onMatch) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(onMatch, "onMatch cannot be null");

        FlintMetricsRegistry metrics = metrics();
        long startNanos = System.nanoTime();
        long delivered = 0;
        long rejected = 0;

        ScanCursor scan = cursor(text);
        while (scan.next()) {
            int start = scan.startIndex();
            int end = scan.endIndex();
            if (!accepts(text, start, end, scan.patternId())) {
                rejected++;
                continue;
            }
            onMatch.accept(new Match(start, end, text.substring(start, end + 1)));
            delivered++;
        }

        long durationNanos = System.nanoTime() - startNanos;
        metrics.incrementCounter(MetricNames.FIND_OPERATIONS);
        metrics.recordTimer(MetricNames.FIND_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.FIND_MATCHES, delivered);
        if (rejected > 0) {
            metrics.incrementCounter(MetricNames.FIND_REJECTED, rejected);
        }
    }

    /**
     * Finds matches in several texts.
     *
     * <p>Each value is the same lazy sequence {@link #find(String)} returns for its key. Keys keep
     * the iteration order of {@code texts}; a text given more than once appears once.
     *
     * @param texts texts to search
     * @return text to matches
     * @throws NullPointerException if texts or any element is null
     */
    public Map<String, MatchSequence> findAll(Iterable<String> texts) {
        Objects.requireNonNull(texts, "texts cannot be null");

        Map<String, MatchSequence> results = new LinkedHashMap<>();
        long items = 0;
        for (String text : texts) {
            results.put(text, find(text));
            items++;
        }

        FlintMetricsRegistry metrics = metrics();
        metrics.incrementCounter(MetricNames.FIND_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.FIND_BULK_ITEMS, items);
        return results;
    }

    /**
     * Checks whether a text contains at least one match. Stops scanning at the first one.
     *
     * @param text text to search
     * @return true if {@link #find(String)} would yield a match
     */
    public boolean containsAny(String text) {
        Objects.requireNonNull(text, "text cannot be null");

        long startNanos = System.nanoTime();
        boolean found = false;
        ScanCursor scan = cursor(text);
        while (scan.next()) {
            if (accepts(text, scan.startIndex(), scan.endIndex(), scan.patternId())) {
                found = true;
                break;
            }
        }

        long durationNanos = System.nanoTime() - startNanos;
        FlintMetricsRegistry metrics = metrics();
        metrics.incrementCounter(MetricNames.FIND_OPERATIONS);
        metrics.recordTimer(MetricNames.FIND_LATENCY, durationNanos);
        return found;
    }

    /**
     * Replaces matches with a fixed string.
     *
     * <p>Matches are applied leftmost first; of two matches with the same start the one found first
     * (the shorter) wins. A match that overlaps one already replaced is skipped, so with patterns
     * {@code "a"} and {@code "aa"} the text {@code "aa"} becomes two replacements.
     *
     * @param text        text to rewrite
     * @param replacement substituted for every applied match
     * @return rewritten text, or {@code text} itself if nothing was replaced
     * @throws NullPointerException if text or replacement is null
     */
    public String replace(String text, String replacement) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(replacement, "replacement cannot be null");

        return applyReplace(text, collectHits(text, true), hit -> replacement);
    }

    /**
     * Replaces matches with text computed per match.
     *
     * <p>The provider is called once per applied match, in text order. A null result removes the
     * match.
     *
     * @param text     text to rewrite
     * @param provider computes the replacement of a match
     * @return rewritten text, or {@code text} itself if nothing was replaced
     * @throws NullPointerException if text or provider is null
     */
    public String replace(String text, Function<Match, String> provider) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(provider, "provider cannot be null");

        return applyReplace(text, collectHits(text, true),
            hit -> provider.apply(new Match(hit.startIndex(), hit.endIndex(),
                text.substring(hit.startIndex(), hit.endIndex() + 1))));
    }

    /**
     * Replaces each pattern with its positional counterpart: an occurrence of pattern {@code i}
     * becomes {@code replacements.get(i)}.
     *
     * <p>Works on every occurrence the automaton reports, regardless of {@link MatchMode}.
     *
     * @param text         text to rewrite
     * @param replacements one replacement per pattern, in pattern order
     * @return rewritten text, or {@code text} itself if nothing was replaced
     * @throws NullPointerException     if text, replacements or any replacement is null
     * @throws IllegalArgumentException if replacements and patterns differ in size
     */
    public String replace(String text, List<String> replacements) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(replacements, "replacements cannot be null");
        if (replacements.size() != patterns.size()) {
            throw new IllegalArgumentException("replacements size (" + replacements.size()
                + ") must equal patterns size (" + patterns.size() + ")");
        }

        String[] byPattern = new String[replacements.size()];
        for (int i = 0; i < byPattern.length; i++) {
            String replacement = replacements.get(i);
            if (replacement == null) {
                throw new NullPointerException("replacements[" + i + "] cannot be null");
            }
            byPattern[i] = replacement;
        }

        return applyReplace(text, collectHits(text, false), hit -> byPattern[hit.patternId()]);
    }

    private String applyReplace(String text, List<Hit> hits, Substitution substitution) {
        if (patterns.isEmpty()) {
            return text;
        }

        long startNanos = System.nanoTime();
        ReplaceEngine.Result result = ReplaceEngine.replace(text, hits, substitution);
        long durationNanos = System.nanoTime() - startNanos;

        FlintMetricsRegistry metrics = metrics();
        metrics.incrementCounter(MetricNames.REPLACE_OPERATIONS);
        metrics.recordTimer(MetricNames.REPLACE_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.REPLACE_APPLIED, result.applied());
        metrics.incrementCounter(MetricNames.REPLACE_SKIPPED, result.skipped());

        return result.applied() == 0 ? text : result.text();
    }

    private List<Hit> collectHits(String text, boolean filtered) {
        List<Hit> hits = new ArrayList<>();
        ScanCursor scan = cursor(text);
        while (scan.next()) {
            int start = scan.startIndex();
            int end = scan.endIndex();
            if (filtered && !accepts(text, start, end, scan.patternId())) {
                continue;
            }
            hits.add(new Hit(start, end, scan.patternId()));
        }
        return hits;
    }

    ScanCursor cursor(String text) {
        return new ScanCursor(automaton, normalizer.normalize(text));
    }

    boolean accepts(String text, int startIndex, int endIndex, int patternId) {
        return matchMode == MatchMode.FUZZY
            || ExactMatchFilter.accept(text, startIndex, endIndex, patterns.get(patternId));
    }

    static FlintMetricsRegistry metrics() {
        return cache.getConfig().metricsRegistry();
    }

    /** The patterns, in id order (unmodifiable). */
    public List<String> patterns() {
        return patterns;
    }

    public int patternCount() {
        return patterns.size();
    }

    public StringComparison comparison() {
        return comparison;
    }

    public MatchMode matchMode() {
        return matchMode;
    }

    /** Number of automaton states, root included. */
    public int nodeCount() {
        return automaton.nodeCount();
    }

    @Override
    public String toString() {
        return "TextMatcher{patterns=" + PatternHasher.hash(patterns) + ", comparison=" + comparison
            + ", matchMode=" + matchMode + ", nodes=" + automaton.nodeCount() + "}";
    }

    /**
     * Gets the global matcher cache.
     */
    public static MatcherCache getGlobalCache() {
        return cache;
    }

    /**
     * Replaces the global cache. Primarily for tests that need a cache with its own metrics.
     *
     * @param newCache the cache to use
     */
    public static void setGlobalCache(MatcherCache newCache) {
        cache = Objects.requireNonNull(newCache, "newCache cannot be null");
    }

    /**
     * Reconfigures the global cache. Cached matchers are dropped.
     *
     * @param config the new configuration
     */
    public static void configureCache(FlintConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        cache.reconfigure(config);
    }

    public static FlintConfig getCacheConfig() {
        return cache.getConfig();
    }

    public static CacheStatistics getCacheStatistics() {
        return cache.getStatistics();
    }

    /** Drops every cached matcher. */
    public static void clearCache() {
        cache.clear();
    }

    /** Drops every cached matcher and resets cache statistics. */
    public static void resetCache() {
        cache.reset();
    }
}
