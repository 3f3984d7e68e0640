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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable trie node used only while an {@link Automaton} is being built.
 *
 * <p>Nodes live in an arena (a list indexed by {@link #index}). Children and the failure link are
 * stored as arena indices, so the tree edges and the failure cross-edges never own each other.
 *
 * @since 1.0.0
 */
final class TrieNode {

    static final int UNSET = -1;

    final int index;
    final int depth;

    // char -> arena index, in creation order
    final Map<Character, Integer> children = new LinkedHashMap<>();

    int failure = UNSET;

    // Own terminals first, then those inherited from the failure target
    final List<Integer> outputs = new ArrayList<>();

    TrieNode(int index, int depth) {
        this.index = index;
        this.depth = depth;
    }

    Integer child(char c) {
        return children.get(c);
    }

    @Override
    public String toString() {
        return "TrieNode{index=" + index + ", depth=" + depth + ", children=" + children.size()
            + ", failure=" + failure + ", outputs=" + outputs + "}";
    }
}
