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
package de.fasim.datastructure.automaton;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import de.fasim.api.State;
import de.fasim.api.Step;
import de.fasim.api.Symbols;
import de.fasim.api.ValidationResult;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable deterministic finite automaton with a partial transition function.
 * <p>
 * Instances are created by {@link DFABuilder#build()}. Transitions are keyed by the arena index of the source state
 * and the input symbol.
 */
public final class DFA extends AbstractFiniteAutomaton<State> {

    private final List<Map<String, Integer>> successors;

    DFA(List<State> states,
        Collection<String> alphabet,
        @Nullable State initialState,
        BitSet finalIndices,
        List<Map<String, Integer>> successors) {
        super(states, alphabet, initialState, finalIndices);
        this.successors = ImmutableList.copyOf(successors);
    }

    /**
     * Returns an automaton without states. It rejects every input, including the empty string.
     *
     * @return the empty automaton
     */
    public static DFA empty() {
        return new DFABuilder().build();
    }

    public @Nullable State getSuccessor(State state, String symbol) {
        final Integer succ = successors.get(indexOf(state)).get(symbol);
        return succ == null ? null : states.get(succ);
    }

    /**
     * Returns the outgoing transitions of a state, in the order they were registered.
     *
     * @param state
     *         the source state
     *
     * @return a map from input symbol to successor state
     */
    public Map<String, State> getTransitions(State state) {
        final Map<String, Integer> row = successors.get(indexOf(state));
        final Map<String, State> result = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : row.entrySet()) {
            result.put(e.getKey(), states.get(e.getValue()));
        }
        return result;
    }

    public int getTransitionCount() {
        int count = 0;
        for (Map<String, Integer> row : successors) {
            count += row.size();
        }
        return count;
    }

    /**
     * Simulates the automaton on the given input.
     * <p>
     * The trace starts with the initial state at position 0 and records one step per consumed symbol. If there is no
     * transition for the current state and symbol, a final step without state is recorded and the input is rejected
     * right away, regardless of how much of it was consumed. Otherwise the input is accepted iff the state reached
     * after the last symbol is final.
     */
    @Override
    public ValidationResult<State> validate(String input) {
        if (initialState == null) {
            return ValidationResult.rejectedWithoutTrace();
        }

        final List<String> symbols = Symbols.split(input);
        final List<Step<State>> trace = new ArrayList<>(symbols.size() + 1);
        State current = initialState;
        trace.add(new Step<>(current, 0, input));

        int offset = 0;
        for (int i = 0; i < symbols.size(); i++) {
            final String symbol = symbols.get(i);
            offset += symbol.length();
            final State next = getSuccessor(current, symbol);
            final String rest = input.substring(offset);
            if (next == null) {
                trace.add(new Step<>(null, i + 1, rest));
                return new ValidationResult<>(false, trace);
            }
            current = next;
            trace.add(new Step<>(current, i + 1, rest));
        }

        return new ValidationResult<>(isFinal(current), trace);
    }
}
