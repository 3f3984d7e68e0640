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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

/**
 * Core find, findAll and replace behaviour.
 */
class TextMatcherTest {

    private static final String LOREM = "Lorem ipsum dolor sit amet, consectetur adipiscing elit. Sed do eiusmod tempor incididunt ut labore et dolore magna aliqua. ";
    private static final String LOREM_WITH_JEDI = "Lorem ipsum dolor sit amet, consectetur adipiscing elit. Sed do eiusmod tempor incididunt ut labore et dolore magna Jedi.";
    private static final String DARTH = "I thought not. It's not a story the Jedi would tell you. It's a Sith legend. Darth Plagueis was a Dark Lord of the Sith, so powerful and so wise he could use the Force to influence the midichlorians to create life. He had such a knowledge of the dark side that he could even keep the ones he cared about from dying.";

    @Test
    void testNullPatterns_ThrowsException() {
        assertThatThrownBy(() -> TextMatcher.compile(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("patterns");
    }

    @Test
    void testNullPatternElement_ThrowsExceptionNamingIndex() {
        assertThatThrownBy(() -> TextMatcher.compile(Arrays.asList("a", "b", null)))
            .isInstanceOf(NullPointerException.class)
            .hasMessage("patterns[2] cannot be null");
    }

    @Test
    void testNullComparisonOrMode_ThrowsException() {
        assertThatThrownBy(() -> TextMatcher.compile(List.of("a"), null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("comparison");
        assertThatThrownBy(() -> TextMatcher.compile(List.of("a"), StringComparison.ORDINAL, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("matchMode");
    }

    @Test
    void testFindWithNullText_ThrowsException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThatThrownBy(() -> matcher.find(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("text");
    }

    @Test
    void testDefaults() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThat(matcher.comparison()).isEqualTo(StringComparison.CURRENT_CULTURE);
        assertThat(matcher.matchMode()).isEqualTo(MatchMode.FUZZY);
    }

    @Test
    void testEmptyPatterns_FindReturnsEmpty() {
        TextMatcher matcher = TextMatcher.compile(List.of());

        MatchSequence results = matcher.find("any text");

        assertThat(results).isNotNull();
        assertThat(results.isEmpty()).isTrue();
        assertThat(matcher.nodeCount()).isEqualTo(1);
    }

    @Test
    void testNoOccurrences_FindReturnsEmpty() {
        TextMatcher matcher = TextMatcher.compile(List.of("x"));

        assertThat(matcher.find("abc")).isEmpty();
    }

    @Test
    void testOverlappingPatterns_AllReported_InOrder() {
        TextMatcher matcher = TextMatcher.compile(List.of("a", "aa"));

        List<Match> matches = matcher.find("aa").toList();

        assertThat(matches).containsExactly(
            new Match(0, 0, "a"),
            new Match(0, 1, "aa"),
            new Match(1, 1, "a"));
    }

    @Test
    void testPatternsIterableConsumedOnce() {
        List<String> source = new ArrayList<>(List.of("a", "aa"));
        int[] iterations = {0};
        Iterable<String> once = () -> {
            iterations[0]++;
            return source.iterator();
        };

        TextMatcher matcher = TextMatcher.compileWithoutCache(once);
        matcher.find("aa").toList();
        matcher.find("aa").toList();

        assertThat(iterations[0]).isEqualTo(1);
    }

    @Test
    void testLaterMutationOfPatternsNotObserved() {
        List<String> patterns = new ArrayList<>(List.of("jedi"));
        TextMatcher matcher = TextMatcher.compileWithoutCache(patterns, StringComparison.ORDINAL);

        patterns.set(0, "sith");
        patterns.add("darth");

        assertThat(matcher.patterns()).containsExactly("jedi");
        assertThat(matcher.find("jedi and sith").toList()).containsExactly(new Match(0, 3, "jedi"));
        assertThatThrownBy(() -> matcher.patterns().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testFindAll_MapsEachText() {
        List<String> patterns = List.of("Lorem", "elit", "magna");
        TextMatcher matcher = TextMatcher.compile(patterns);

        Map<String, MatchSequence> map = matcher.findAll(List.of(LOREM, DARTH));

        assertThat(map).containsOnlyKeys(LOREM, DARTH);

        List<Match> loremMatches = map.get(LOREM).toList();
        for (String pattern : patterns) {
            int expectedIndex = LOREM.indexOf(pattern);
            assertThat(loremMatches).contains(new Match(expectedIndex, expectedIndex + pattern.length() - 1, pattern));
        }
        assertThat(map.get(DARTH).toList()).isEmpty();
    }

    @Test
    void testFindAll_EachTextHasItsOwnMatches() {
        TextMatcher matcher = TextMatcher.compile(List.of("Jedi"));
        List<String> texts = List.of(LOREM_WITH_JEDI, DARTH);

        Map<String, MatchSequence> map = matcher.findAll(texts);

        for (String text : texts) {
            int expectedIndex = text.indexOf("Jedi");
            assertThat(expectedIndex).isGreaterThanOrEqualTo(0);
            assertThat(map.get(text).toList())
                .contains(new Match(expectedIndex, expectedIndex + 3, "Jedi"))
                .isEqualTo(matcher.find(text).toList());
        }
    }

    @Test
    void testFindAll_KeepsOrder_CollapsesDuplicates() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        Map<String, MatchSequence> map = matcher.findAll(List.of("b", "a", "b", "ca"));

        assertThat(map.keySet()).containsExactly("b", "a", "ca");
    }

    @Test
    void testFindAll_NullArguments_ThrowException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThatThrownBy(() -> matcher.findAll(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("texts");
        assertThatThrownBy(() -> matcher.findAll(Arrays.asList("a", null)))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("text");
    }

    @Test
    void testFindWithCallback_SameAsLazyFind() {
        TextMatcher matcher = TextMatcher.compile(List.of("he", "she", "his", "hers"));
        List<Match> collected = new ArrayList<>();

        matcher.find("ushers and his hers", collected::add);

        assertThat(collected).isEqualTo(matcher.find("ushers and his hers").toList());
        assertThat(collected).hasSize(6);
    }

    @Test
    void testFindWithCallback_NullArguments_ThrowException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThatThrownBy(() -> matcher.find(null, m -> { }))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("text");
        assertThatThrownBy(() -> matcher.find("a", null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("onMatch");
    }

    @Test
    void testCaseSensitiveByDefault() {
        TextMatcher matcher = TextMatcher.compile(List.of("jedi"));

        assertThat(matcher.find(LOREM_WITH_JEDI).toList()).isEmpty();
    }

    @Test
    void testOrdinalIgnoreCase_MatchesIrrespectiveOfCase() {
        TextMatcher matcher = TextMatcher.compile(List.of("jedi"), StringComparison.ORDINAL_IGNORE_CASE);

        List<Match> matches = matcher.find(LOREM_WITH_JEDI).toList();

        assertThat(matches).hasSize(1);
        // Value is the original text, not the folded pattern
        assertThat(matches.get(0).value()).isEqualTo("Jedi");
    }

    @Test
    void testContainsAny() {
        TextMatcher matcher = TextMatcher.compile(List.of("Sith", "Jedi"));

        assertThat(matcher.containsAny(DARTH)).isTrue();
        assertThat(matcher.containsAny(LOREM)).isFalse();
        assertThat(matcher.containsAny("")).isFalse();
        assertThatThrownBy(() -> matcher.containsAny(null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void testEmptyText() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThat(matcher.find("")).isEmpty();
        assertThat(matcher.replace("", "x")).isEmpty();
    }

    @Test
    void testDuplicatePatternsReportedTwice() {
        TextMatcher matcher = TextMatcher.compile(List.of("ab", "ab"));

        assertThat(matcher.find("xab").toList()).containsExactly(
            new Match(1, 2, "ab"),
            new Match(1, 2, "ab"));
    }

    @Test
    void testEveryMatchSpanEqualsItsValue() {
        List<String> patterns = List.of("an", "ana", "nan", "banana", "s");
        TextMatcher matcher = TextMatcher.compile(patterns);
        String text = "bananas and ananas";

        for (Match match : matcher.find(text)) {
            assertThat(text.substring(match.startIndex(), match.endIndex() + 1)).isEqualTo(match.value());
            assertThat(patterns).contains(match.value());
        }
    }

    @Test
    void testAgreesWithNaiveSearch_RandomInputs() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            List<String> patterns = new ArrayList<>();
            int patternCount = 1 + random.nextInt(8);
            for (int i = 0; i < patternCount; i++) {
                patterns.add(randomString(random, 1 + random.nextInt(4)));
            }
            String text = randomString(random, random.nextInt(60));

            TextMatcher matcher = TextMatcher.compileWithoutCache(patterns, StringComparison.ORDINAL);
            List<Match> actual = matcher.find(text).toList();

            assertThat(actual)
                .as("patterns %s in %s", patterns, text)
                .containsExactlyInAnyOrderElementsOf(naiveFind(patterns, text));
            assertThat(actual)
                .isSortedAccordingTo(Comparator.comparingInt(Match::endIndex));
        }
    }

    @Test
    void testFindIsPure() {
        TextMatcher matcher = TextMatcher.compile(List.of("dark", "side", "he"));

        assertThat(matcher.find(DARTH).toList()).isEqualTo(matcher.find(DARTH).toList());
    }

    @Test
    void testCompile_ReturnsCachedInstance() {
        List<String> patterns = List.of("cached", "instance");

        TextMatcher first = TextMatcher.compile(patterns);
        TextMatcher second = TextMatcher.compile(new ArrayList<>(patterns));

        assertThat(second).isSameAs(first);
        assertThat(TextMatcher.compileWithoutCache(patterns)).isNotSameAs(first);
    }

    @Test
    void testToStringDoesNotLeakPatterns() {
        TextMatcher matcher = TextMatcher.compile(List.of("secret-term"));

        assertThat(matcher.toString()).doesNotContain("secret-term").contains("n=1");
    }

    // --- replace ---

    @Test
    void testReplaceWithNullText_ThrowsException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThatThrownBy(() -> matcher.replace(null, "x"))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("text");
    }

    @Test
    void testReplaceWithNullReplacement_ThrowsException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThatThrownBy(() -> matcher.replace("abc", (String) null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("replacement");
    }

    @Test
    void testReplaceWithNullProvider_ThrowsException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThatThrownBy(() -> matcher.replace("abc", (Function<Match, String>) null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("provider");
    }

    @Test
    void testReplaceSimple() {
        TextMatcher matcher = TextMatcher.compile(List.of("a"));

        assertThat(matcher.replace("banana", "x")).isEqualTo("bxnxnx");
    }

    @Test
    void testReplaceWithProvider() {
        TextMatcher matcher = TextMatcher.compile(List.of("Jedi"));

        String result = matcher.replace(LOREM_WITH_JEDI, m -> "[" + m.value() + "]");

        assertThat(result).contains("[Jedi]").endsWith("magna [Jedi].");
    }

    @Test
    void testReplaceOverlapping_SkipsOverlaps() {
        TextMatcher matcher = TextMatcher.compile(List.of("a", "aa"));

        assertThat(matcher.replace("aa", "-")).isEqualTo("--");
    }

    @Test
    void testReplaceWithReplacements_SizeMismatch_ThrowsException() {
        TextMatcher matcher = TextMatcher.compile(List.of("a", "b"));

        assertThatThrownBy(() -> matcher.replace("ab", List.of("x")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("1")
            .hasMessageContaining("2");
    }

    @Test
    void testReplaceWithReplacements_MapsByIndex() {
        TextMatcher matcher = TextMatcher.compile(List.of("Lorem", "elit", "magna"));

        String result = matcher.replace(LOREM, List.of("EPIC", "TRUE", "REPLACEMENT"));

        assertThat(result)
            .contains("EPIC", "TRUE", "REPLACEMENT")
            .doesNotContain("Lorem", "elit", "magna");
    }

    @Test
    void testReplaceWithReplacements_FirstFoundWinsAtPosition() {
        TextMatcher matcher = TextMatcher.compile(List.of("a", "aa"));

        assertThat(matcher.replace("aa", List.of("-", "="))).isEqualTo("--");
    }

    @Test
    void testIgnoreCaseReplace() {
        TextMatcher matcher = TextMatcher.compile(List.of("jedi"), StringComparison.CURRENT_CULTURE_IGNORE_CASE);

        String replaced = matcher.replace(LOREM_WITH_JEDI, "[X]");

        assertThat(replaced).contains("[X]").doesNotContain("Jedi");
    }

    @Test
    void testEmptyPatterns_ReplaceReturnsSameInstance() {
        TextMatcher matcher = TextMatcher.compile(List.of());
        String text = "unchanged";

        assertThat(matcher.replace(text, "x")).isSameAs(text);
        assertThat(matcher.replace(text, m -> "x")).isSameAs(text);
        assertThat(matcher.replace(text, List.of())).isSameAs(text);
    }

    private static String randomString(Random random, int length) {
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) ('a' + random.nextInt(3));
        }
        return new String(chars);
    }

    private static Collection<Match> naiveFind(List<String> patterns, String text) {
        List<Match> expected = new ArrayList<>();
        for (String pattern : patterns) {
            int from = 0;
            int index;
            while ((index = text.indexOf(pattern, from)) >= 0) {
                expected.add(new Match(index, index + pattern.length() - 1, pattern));
                from = index + 1;
            }
        }
        return expected;
    }
}
