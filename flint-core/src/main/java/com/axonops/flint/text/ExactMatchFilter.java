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

/**
 * Candidate filter for whole-word matching.
 *
 * <p>A candidate survives when it is word-isolated (the characters immediately before and after
 * it, where present, are not word characters) and its original text is exactly the original
 * pattern, case included.
 *
 * @since 1.0.0
 */
public final class ExactMatchFilter {

    private ExactMatchFilter() {
        // Utility class
    }

    /**
     * @param text       original (non-normalized) text
     * @param startIndex inclusive start of the candidate
     * @param endIndex   inclusive end of the candidate
     * @param pattern    original (non-normalized) pattern
     * @return true if the candidate is an exact whole-word match
     */
    public static boolean accept(String text, int startIndex, int endIndex, String pattern) {
        return isWordIsolated(text, startIndex, endIndex)
            && endIndex - startIndex + 1 == pattern.length()
            && text.regionMatches(startIndex, pattern, 0, pattern.length());
    }

    public static boolean isWordIsolated(String text, int startIndex, int endIndex) {
        if (startIndex > 0 && isWordChar(text.charAt(startIndex - 1))) {
            return false;
        }
        return endIndex + 1 >= text.length() || !isWordChar(text.charAt(endIndex + 1));
    }

    /** Letter, digit or underscore. */
    public static boolean isWordChar(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
