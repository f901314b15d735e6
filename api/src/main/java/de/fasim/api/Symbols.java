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
package de.fasim.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Constants and helpers for input symbols.
 * <p>
 * Symbols are plain strings. The empty string denotes the epsilon (lambda) symbol, which is consumed without reading
 * input and therefore never part of an alphabet.
 */
public final class Symbols {

    /**
     * The epsilon symbol.
     */
    public static final String EPSILON = "";

    /**
     * Display form of {@link #EPSILON}.
     */
    public static final String EPSILON_DISPLAY = "ε";

    private Symbols() {
        // prevent instantiation
    }

    public static boolean isEpsilon(@Nullable String symbol) {
        return symbol == null || symbol.isEmpty();
    }

    /**
     * Returns the symbols of the given alphabet in their natural order. This is the order in which algorithms iterate
     * over an alphabet whenever the result depends on it.
     *
     * @param alphabet
     *         the alphabet
     *
     * @return a sorted, unmodifiable copy of the alphabet
     */
    public static List<String> sorted(Collection<String> alphabet) {
        final List<String> result = new ArrayList<>(alphabet);
        Collections.sort(result);
        return Collections.unmodifiableList(result);
    }

    /**
     * Splits an input string into the symbols it is read as. Each Unicode code point is one symbol, so characters
     * outside the Basic Multilingual Plane are not torn apart.
     *
     * @param input
     *         the input string
     *
     * @return the symbols of {@code input}, in reading order
     */
    public static List<String> split(String input) {
        final List<String> result = new ArrayList<>(input.length());
        int offset = 0;
        while (offset < input.length()) {
            final int end = offset + Character.charCount(input.codePointAt(offset));
            result.add(input.substring(offset, end));
            offset = end;
        }
        return result;
    }
}
