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
package de.fasim.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import de.fasim.api.State;
import de.fasim.api.Step;
import de.fasim.api.ValidationResult;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renders simulation traces for step-by-step display.
 */
public final class TraceRenderer {

    /**
     * Label of the configuration of a step in which the automaton got stuck.
     */
    public static final String STUCK = "Error";

    /**
     * Label of an empty set of active states.
     */
    public static final String EMPTY_SET = "∅";

    static final String CURRENT_MARKER = "→ ";

    private TraceRenderer() {
        // prevent instantiation
    }

    /**
     * Describes the steps of a trace up to and including {@code currentStep}, one line per step, e.g. {@code "Step 1:
     * → State: q1"}. The current step is marked with an arrow.
     *
     * @param result
     *         the validation result whose trace is described
     * @param currentStep
     *         the index of the step currently displayed
     *
     * @return one line per step
     *
     * @throws IndexOutOfBoundsException
     *         if {@code currentStep} does not denote a step of the trace
     */
    public static List<String> describeSteps(ValidationResult<?> result, int currentStep) {
        final List<? extends Step<?>> trace = result.getTrace();
        if (currentStep < 0 || currentStep >= trace.size()) {
            throw new IndexOutOfBoundsException("Step " + currentStep + " of a trace with " + trace.size() + " steps");
        }

        final List<String> lines = new ArrayList<>(currentStep + 1);
        for (int i = 0; i <= currentStep; i++) {
            final String marker = i == currentStep ? CURRENT_MARKER : "";
            lines.add("Step " + i + ": " + marker + "State: " + describeConfiguration(trace.get(i).getConfiguration()));
        }
        return lines;
    }

    public static List<String> describeSteps(ValidationResult<?> result) {
        return result.getTrace().isEmpty() ? new ArrayList<>() :
                describeSteps(result, result.getTrace().size() - 1);
    }

    /**
     * Describes a configuration: the name of a state, the names of a set of states in braces, or {@link #STUCK}.
     *
     * @param configuration
     *         the configuration of a step
     *
     * @return the description
     */
    public static String describeConfiguration(@Nullable Object configuration) {
        if (configuration == null) {
            return STUCK;
        }
        if (configuration instanceof State) {
            return ((State) configuration).getName();
        }
        if (configuration instanceof Collection) {
            final Collection<?> states = (Collection<?>) configuration;
            if (states.isEmpty()) {
                return EMPTY_SET;
            }
            return states.stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}"));
        }
        return configuration.toString();
    }

    /**
     * Highlights the symbol that is read next at the given step by enclosing it in brackets, e.g. {@code "ab[c]d"}.
     * Nothing is highlighted at the last step of the trace.
     *
     * @param input
     *         the validated input
     * @param result
     *         the validation result for {@code input}
     * @param stepIndex
     *         index of the displayed step
     *
     * @return the highlighted input
     */
    public static String highlight(String input, ValidationResult<?> result, int stepIndex) {
        final List<? extends Step<?>> trace = result.getTrace();
        if (stepIndex >= trace.size() - 1) {
            return input;
        }

        final String remaining = trace.get(stepIndex).getRemaining();
        if (remaining.isEmpty()) {
            return input;
        }
        final int offset = input.length() - remaining.length();
        final int end = offset + Character.charCount(remaining.codePointAt(0));
        return input.substring(0, offset) + '[' + input.substring(offset, end) + ']' + input.substring(end);
    }
}
