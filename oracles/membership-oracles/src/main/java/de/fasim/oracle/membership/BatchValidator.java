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
package de.fasim.oracle.membership;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Splitter;
import de.fasim.api.FiniteAutomaton;

/**
 * Validates many input strings against one automaton.
 */
public class BatchValidator {

    public static final String ACCEPTED = "Accepted";
    public static final String REJECTED = "Rejected";

    private static final Splitter LINES = Splitter.onPattern("\r\n|\r|\n");

    private final FiniteAutomaton<?> automaton;

    public BatchValidator(FiniteAutomaton<?> automaton) {
        this.automaton = Objects.requireNonNull(automaton);
    }

    /**
     * Validates the given inputs.
     *
     * @param inputs
     *         the inputs
     *
     * @return a map from each distinct input to its acceptance, iterating in the order of first occurrence
     */
    public Map<String, Boolean> validateAll(List<String> inputs) {
        final Map<String, Boolean> result = new LinkedHashMap<>();
        for (String input : inputs) {
            if (!result.containsKey(input)) {
                result.put(input, automaton.accepts(input));
            }
        }
        return result;
    }

    /**
     * Validates the given inputs and returns one line per input, in input order, of the form {@code "<input>:
     * Accepted"} or {@code "<input>: Rejected"}.
     *
     * @param inputs
     *         the inputs
     *
     * @return the report lines
     */
    public List<String> report(List<String> inputs) {
        final Map<String, Boolean> results = validateAll(inputs);
        final List<String> lines = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            lines.add(reportLine(input, results.get(input)));
        }
        return lines;
    }

    /**
     * Variant of {@link #report(List)} that takes one input per line of the given text. A trailing line break does not
     * start another input.
     *
     * @param text
     *         the inputs, separated by line breaks
     *
     * @return the report lines
     */
    public List<String> report(String text) {
        return report(splitLines(text));
    }

    public static String reportLine(String input, boolean accepted) {
        return input + ": " + (accepted ? ACCEPTED : REJECTED);
    }

    static List<String> splitLines(String text) {
        final List<String> lines = new ArrayList<>(LINES.splitToList(text));
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
