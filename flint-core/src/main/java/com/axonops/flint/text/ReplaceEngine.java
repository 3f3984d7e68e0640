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


package com.axonops.flint.text;

import com.axonops.flint.automaton.Hit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Leftmost-wins, non-overlapping substitution over a set of hits.
 *
 * <p>Hits are ordered by start index; equal starts keep the order in which the scan produced
 * them, so of two hits starting together the one ending first wins. A hit starting before the end
 * of the previously applied hit is skipped. Text between applied hits is copied unchanged.
 *
 * @since 1.0.0
 */
public final class ReplaceEngine {

    private static final Comparator<Hit> BY_START = Comparator.comparingInt(Hit::startIndex);

    private ReplaceEngine() {
        // Utility class
    }

    /**
     * Outcome of one replace pass.
     *
     * @param text    resulting text (the input instance if nothing was applied)
     * @param applied number of substituted hits
     * @param skipped number of hits dropped because they overlapped an applied one
     */
    public record Result(String text, int applied, int skipped) {
    }

    /**
     * Applies substitutions.
     *
     * @param text         original text
     * @param hits         hits in scan order
     * @param substitution replacement source, called once per applied hit
     * @return the rewritten text and counts
     */
    public static Result replace(String text, List<Hit> hits, Substitution substitution) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(hits, "hits cannot be null");
        Objects.requireNonNull(substitution, "substitution cannot be null");

        if (hits.isEmpty()) {
            return new Result(text, 0, 0);
        }

        // List.sort is stable
        List<Hit> ordered = new ArrayList<>(hits);
        ordered.sort(BY_START);

        StringBuilder out = new StringBuilder(text.length());
        int cursor = 0;
        int applied = 0;
        int skipped = 0;

        for (Hit hit : ordered) {
            if (hit.startIndex() < cursor) {
                skipped++;
                continue;
            }
            out.append(text, cursor, hit.startIndex());
            String replacement = substitution.substitute(hit);
            if (replacement != null) {
                out.append(replacement);
            }
            cursor = hit.endIndex() + 1;
            applied++;
        }
        out.append(text, cursor, text.length());

        return new Result(out.toString(), applied, skipped);
    }
}
