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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds an {@link Automaton} from an ordered list of (already normalized) patterns.
 *
 * <p>Construction runs in two phases:
 * <ol>
 *   <li>trie insertion: each pattern becomes a root-to-node path and its terminal node records
 *       the pattern id (empty patterns terminate at the root, duplicates share a node)</li>
 *   <li>failure-link compilation: breadth-first from the root, each node's failure link is set
 *       to the longest proper suffix of its path that is also a trie path, and the failure
 *       target's output list is appended to the node's own</li>
 * </ol>
 * The result is frozen into flat arrays.
 *
 * @since 1.0.0
 */
public final class AutomatonBuilder {

    private AutomatonBuilder() {
        // Utility class
    }

    /**
     * Builds an automaton.
     *
     * @param patterns normalized patterns, pattern id = list index
     * @return compiled automaton (matches nothing if {@code patterns} is empty)
     * @throws NullPointerException if {@code patterns} or any element is null
     */
    public static Automaton build(List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns cannot be null");

        List<TrieNode> nodes = insertAll(patterns);
        compileFailureLinks(nodes);
        return freeze(nodes, patterns);
    }

    static List<TrieNode> insertAll(List<String> patterns) {
        List<TrieNode> nodes = new ArrayList<>();
        nodes.add(new TrieNode(Automaton.ROOT, 0));

        for (int id = 0; id < patterns.size(); id++) {
            String pattern = patterns.get(id);
            if (pattern == null) {
                throw new NullPointerException("patterns[" + id + "] cannot be null");
            }

            TrieNode node = nodes.get(Automaton.ROOT);
            for (int i = 0; i < pattern.length(); i++) {
                char c = pattern.charAt(i);
                Integer next = node.child(c);
                if (next == null) {
                    TrieNode created = new TrieNode(nodes.size(), node.depth + 1);
                    nodes.add(created);
                    node.children.put(c, created.index);
                    node = created;
                } else {
                    node = nodes.get(next);
                }
            }
            node.outputs.add(id);
        }
        return nodes;
    }

    static void compileFailureLinks(List<TrieNode> nodes) {
        TrieNode root = nodes.get(Automaton.ROOT);
        root.failure = Automaton.ROOT;

        Deque<TrieNode> queue = new ArrayDeque<>();
        for (int childIndex : root.children.values()) {
            TrieNode child = nodes.get(childIndex);
            child.failure = Automaton.ROOT;
            child.outputs.addAll(root.outputs);
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            TrieNode node = queue.poll();
            for (Map.Entry<Character, Integer> edge : node.children.entrySet()) {
                char c = edge.getKey();
                TrieNode child = nodes.get(edge.getValue());

                TrieNode fallback = nodes.get(node.failure);
                Integer target = fallback.child(c);
                while (target == null && fallback.index != Automaton.ROOT) {
                    fallback = nodes.get(fallback.failure);
                    target = fallback.child(c);
                }
                child.failure = target == null ? Automaton.ROOT : target;

                // BFS order guarantees the failure target is already closed
                child.outputs.addAll(nodes.get(child.failure).outputs);
                queue.add(child);
            }
        }
    }

    static Automaton freeze(List<TrieNode> nodes, List<String> patterns) {
        int count = nodes.size();
        char[][] childKeys = new char[count][];
        int[][] childTargets = new int[count][];
        int[] failure = new int[count];
        int[][] outputs = new int[count][];

        for (TrieNode node : nodes) {
            int n = node.children.size();
            char[] keys = new char[n];
            int slot = 0;
            for (char c : node.children.keySet()) {
                keys[slot++] = c;
            }
            Arrays.sort(keys);

            int[] targets = new int[n];
            for (int i = 0; i < n; i++) {
                targets[i] = node.children.get(keys[i]);
            }

            childKeys[node.index] = keys;
            childTargets[node.index] = targets;
            failure[node.index] = node.failure;
            outputs[node.index] = node.outputs.stream().mapToInt(Integer::intValue).toArray();
        }

        int[] lengths = new int[patterns.size()];
        for (int id = 0; id < lengths.length; id++) {
            lengths[id] = patterns.get(id).length();
        }

        return new Automaton(childKeys, childTargets, failure, outputs, lengths);
    }
}
