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


package com.axonops.flint.automaton;

import java.util.Objects;

/**
 * Pull-based traversal of an {@link Automaton} over one text.
 *
 * <p>Each call to {@link #next()} advances to the next (position, pattern) hit. Hits are produced
 * in non-decreasing end index; hits sharing an end index come out most specific (longest) first.
 * Overlapping hits are all reported.
 *
 * <p>Not thread-safe. A cursor holds only per-scan state, so create one per scan; the underlying
 * automaton can be shared.
 *
 * <pre>{@code
 * ScanCursor cursor = new ScanCursor(automaton, text);
 * while (cursor.next()) {
 *     handle(cursor.startIndex(), cursor.endIndex(), cursor.patternId());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ScanCursor {

    private static final int[] NONE = new int[0];

    private final Automaton automaton;
    private final CharSequence text;

    private int position = -1;
    private int node = Automaton.ROOT;
    private int[] pending = NONE;
    private int pendingIndex;
    private int patternId = -1;

    public ScanCursor(Automaton automaton, CharSequence text) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        this.text = Objects.requireNonNull(text, "text cannot be null");
    }

    /**
     * Advances to the next hit.
     *
     * @return true if a hit is available, false once the text is exhausted
     */
    public boolean next() {
        while (pendingIndex >= pending.length) {
            if (position + 1 >= text.length()) {
                patternId = -1;
                return false;
            }
            position++;
            node = automaton.step(node, text.charAt(position));
            pending = automaton.outputsOf(node);
            pendingIndex = 0;
        }
        patternId = pending[pendingIndex++];
        return true;
    }

    public int endIndex() {
        return position;
    }

    public int startIndex() {
        return position - automaton.patternLength(patternId) + 1;
    }

    public int patternId() {
        return patternId;
    }

    public Hit hit() {
        return new Hit(startIndex(), endIndex(), patternId);
    }

    /**
     * Scans a whole text, pushing every hit to a listener.
     *
     * @param automaton compiled automaton
     * @param text      normalized text
     * @param listener  receives each hit
     */
    public static void scan(Automaton automaton, CharSequence text, HitListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        ScanCursor cursor = new ScanCursor(automaton, text);
        while (cursor.next()) {
            listener.onHit(cursor.startIndex(), cursor.endIndex(), cursor.patternId());
        }
    }
}
