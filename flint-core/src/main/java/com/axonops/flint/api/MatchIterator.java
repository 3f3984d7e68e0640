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

import com.axonops.flint.automaton.ScanCursor;
import com.axonops.flint.metrics.FlintMetricsRegistry;
import com.axonops.flint.metrics.MetricNames;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pulls matches from a {@link ScanCursor}, dropping the hits the matcher's mode rejects.
 * Match counters are published once the scan is exhausted.
 */
final class MatchIterator implements Iterator<Match> {

    private final TextMatcher matcher;
    private final String text;
    private final ScanCursor cursor;

    private Match next;
    private boolean exhausted;
    private long delivered;
    private long rejected;

    MatchIterator(TextMatcher matcher, String text) {
        this.matcher = matcher;
        this.text = text;
        this.cursor = matcher.cursor(text);
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public Match next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Match match = next;
        next = null;
        return match;
    }

    private Match advance() {
        while (cursor.next()) {
            int start = cursor.startIndex();
            int end = cursor.endIndex();
            if (!matcher.accepts(text, start, end, cursor.patternId())) {
                rejected++;
                continue;
            }
            delivered++;
            return new Match(start, end, text.substring(start, end + 1));
        }
        exhausted = true;

        FlintMetricsRegistry metrics = TextMatcher.metrics();
        metrics.incrementCounter(MetricNames.FIND_MATCHES, delivered);
        if (rejected > 0) {
            metrics.incrementCounter(MetricNames.FIND_REJECTED, rejected);
        }
        return null;
    }
}
