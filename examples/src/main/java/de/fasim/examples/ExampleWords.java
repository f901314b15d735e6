/* Copyright (C) 2024 The FASim Authors
 * This file is part of FASim.
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
package de.fasim.examples;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Enumerates input words for exhaustive comparisons of automata.
 */
public final class ExampleWords {

    private ExampleWords() {
        // prevent instantiation
    }

    /**
     * Returns all words over the given symbols with at most {@code maxLength} symbols, shortest first.
     *
     * @param symbols
     *         the symbols, each contributing one character
     * @param maxLength
     *         the maximum word length
     *
     * @return the words, starting with the empty word
     */
    public static List<String> upTo(List<String> symbols, int maxLength) {
        final List<String> result = new ArrayList<>();
        List<String> layer = Collections.singletonList("");
        result.addAll(layer);

        for (int len = 1; len <= maxLength; len++) {
            final List<String> next = new ArrayList<>(layer.size() * symbols.size());
            for (String prefix : layer) {
                for (String sym : symbols) {
                    next.add(prefix + sym);
                }
            }
            result.addAll(next);
            layer = next;
        }
        return result;
    }
}
