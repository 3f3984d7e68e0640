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

import java.util.Arrays;

/**
 * Compiled, immutable Aho-Corasick automaton.
 *
 * <p>State is kept in flat arrays indexed by node id. Node {@link #ROOT} is the root; its failure
 * link points to itself. Every node's output list is already failure-closed: it holds every
 * pattern id that ends at that node, deepest (most specific) pattern first.
 *
 * <p>Thread-safe: instances are never mutated after construction and may be scanned concurrently
 * by any number of threads.
 *
 * @since 1.0.0
 */
public final class Automaton {

    /** Node id of the root. */
    public static final int ROOT = 0;

    /** Returned by {@link #child(int, char)} when no goto transition exists. */
    public static final int NO_CHILD = -1;

    private final char[][] childKeys;
    private final int[][] childTargets;
    private final int[] failure;
    private final int[][] outputs;
    private final int[] patternLengths;

    Automaton(char[][] childKeys, int[][] childTargets, int[] failure, int[][] outputs, int[] patternLengths) {
        this.childKeys = childKeys;
        this.childTargets = childTargets;
        this.failure = failure;
        this.outputs = outputs;
        this.patternLengths = patternLengths;
    }

    public int nodeCount() {
        return failure.length;
    }

    public int patternCount() {
        return patternLengths.length;
    }

    /**
     * Length (in code units) of the pattern with the given id.
     *
     * @param patternId pattern id (0-based insertion index)
     * @return pattern length
     */
    public int patternLength(int patternId) {
        return patternLengths[patternId];
    }

    /**
     * Failure target of a node.
     *
     * @param node node id
     * @return node id of the longest proper suffix that is also a trie path
     */
    public int failure(int node) {
        return failure[node];
    }

    /**
     * Goto transition.
     *
     * @param node node id
     * @param c    next (normalized) character
     * @return child node id, or {@link #NO_CHILD}
     */
    public int child(int node, char c) {
        char[] keys = childKeys[node];
        if (keys.length == 0) {
            return NO_CHILD;
        }
        int slot = Arrays.binarySearch(keys, c);
        return slot >= 0 ? childTargets[node][slot] : NO_CHILD;
    }

    /**
     * Advances the automaton by one character: follows failure links until a node with a
     * {@code c}-child is found (or the root is reached), then takes the goto transition.
     *
     * @param node current node id
     * @param c    next (normalized) character
     * @return the new current node id
     */
    public int step(int node, char c) {
        int current = node;
        int next = child(current, c);
        while (next == NO_CHILD && current != ROOT) {
            current = failure[current];
            next = child(current, c);
        }
        return next == NO_CHILD ? ROOT : next;
    }

    /**
     * Pattern ids ending at a node (copy).
     *
     * @param node node id
     * @return failure-closed output list, most specific first
     */
    public int[] outputs(int node) {
        return outputs[node].clone();
    }

    // Shared, not copied: callers must treat the array as read-only
    int[] outputsOf(int node) {
        return outputs[node];
    }

    @Override
    public String toString() {
        return "Automaton{nodes=" + nodeCount() + ", patterns=" + patternCount() + "}";
    }
}
