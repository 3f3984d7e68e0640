package com.axonops.flint.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PatternHasherTest {

    @Test
    void testSinglePatternIsHexHash() {
        assertThat(PatternHasher.hash("jedi")).isEqualTo(Integer.toHexString("jedi".hashCode()));
        assertThat(PatternHasher.hash("jedi")).doesNotContain("jedi");
    }

    @Test
    void testSetHashCarriesSizeNotContent() {
        String hash = PatternHasher.hash(List.of("jedi", "sith"));

        assertThat(hash).endsWith("[n=2]");
        assertThat(hash).doesNotContain("jedi").doesNotContain("sith");
    }

    @Test
    void testSetHashIsStableAndOrderSensitive() {
        assertThat(PatternHasher.hash(List.of("a", "b")))
            .isEqualTo(PatternHasher.hash(new ArrayList<>(List.of("a", "b"))))
            .isNotEqualTo(PatternHasher.hash(List.of("b", "a")));
    }

    @Test
    void testEmptySet() {
        assertThat(PatternHasher.hash(List.of())).endsWith("[n=0]");
    }

    @Test
    void testNulls() {
        assertThat(PatternHasher.hash((String) null)).isEqualTo("null");
        assertThat(PatternHasher.hash((List<String>) null)).isEqualTo("null");
    }
}
