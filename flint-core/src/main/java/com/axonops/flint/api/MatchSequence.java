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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy sequence of the matches of a {@link TextMatcher} in one text.
 *
 * <p>Nothing is scanned until the sequence is iterated. Every iteration starts a fresh scan, so a
 * sequence can be consumed any number of times and always yields the same matches, ordered by
 * end index (longer matches first on ties).
 *
 * <pre>{@code
 * TextMatcher matcher = TextMatcher.compile(List.of("a", "aa"));
 * for (Match m : matcher.find("aa")) {
 *     // (0,0,"a"), (0,1,"aa"), (1,1,"a")
 * }
 * List<Match> all = matcher.find("aa").toList();
 * }</pre>
 *
 * <p>Thread-safe: each iterator carries its own scan state.
 *
 * @since 1.0.0
 */
public final class MatchSequence implements Iterable<Match> {

    private final TextMatcher matcher;
    private final String text;

    MatchSequence(TextMatcher matcher, String text) {
        this.matcher = matcher;
        this.text = text;
    }

    /** The text being searched. */
    public String text() {
        return text;
    }

    @Override
    public Iterator<Match> iterator() {
        return new MatchIterator(matcher, text);
    }

    @Override
    public Spliterator<Match> spliterator() {
        return Spliterators.spliteratorUnknownSize(
            iterator(), Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE);
    }

    public Stream<Match> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * Scans the whole text.
     *
     * @return unmodifiable list of all matches
     */
    public List<Match> toList() {
        List<Match> matches = new ArrayList<>();
        for (Match match : this) {
            matches.add(match);
        }
        return Collections.unmodifiableList(matches);
    }

    /** True if the text has no match. Stops at the first match. */
    public boolean isEmpty() {
        return !iterator().hasNext();
    }

    public long count() {
        long count = 0;
        Iterator<Match> it = iterator();
        while (it.hasNext()) {
            it.next();
            count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return "MatchSequence{textLength=" + text.length() + ", patterns=" + matcher.patternCount() + "}";
    }
}
