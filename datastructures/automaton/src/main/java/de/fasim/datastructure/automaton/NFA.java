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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableSet;
import de.fasim.api.State;
import de.fasim.api.Step;
import de.fasim.api.Symbols;
import de.fasim.api.ValidationResult;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An immutable non-deterministic finite automaton with epsilon transitions.
 * <p>
 * Sets of states are handled as {@link BitSet}s of arena indices internally; the {@link State}-based methods are
 * convenience views on top. BitSets passed to or returned from this class are never retained or shared.
 */
public final class NFA extends AbstractFiniteAutomaton<Set<State>> {

    private static final BitSet NO_SUCCESSORS = new BitSet();

    // never mutated after construction
    private final List<Map<String, BitSet>> successors;

    NFA(List<State> states,
        Collection<String> alphabet,
        @Nullable State initialState,
        BitSet finalIndices,
        List<Map<String, BitSet>> successors) {
        super(states, alphabet, initialState, finalIndices);
        this.successors = Collections.unmodifiableList(new ArrayList<>(successors));
    }

    public boolean hasEpsilonTransitions() {
        for (Map<String, BitSet> row : successors) {
            if (row.containsKey(Symbols.EPSILON)) {
                return true;
            }
        }
        return false;
    }

    public Set<State> getSuccessors(State state, String symbol) {
        return toStates(successorsOf(indexOf(state), symbol));
    }

    /**
     * Returns the outgoing transitions of a state, in the order the symbols were first used. Epsilon transitions are
     * listed under {@link Symbols#EPSILON}.
     *
     * @param state
     *         the source state
     *
     * @return a map from input symbol to the set of successor states
     */
    public Map<String, Set<State>> getTransitions(State state) {
        final Map<String, Set<State>> result = new LinkedHashMap<>();
        for (Map.Entry<String, BitSet> e : successors.get(indexOf(state)).entrySet()) {
            result.put(e.getKey(), toStates(e.getValue()));
        }
        return result;
    }

    /**
     * Computes the set of states reachable from the given states using epsilon transitions only. The result always
     * contains the given states, and computing the closure of a closed set yields the same set.
     *
     * @param stateIndices
     *         indices of the start states
     *
     * @return a fresh set containing the indices of the closure
     */
    public BitSet lambdaClosure(BitSet stateIndices) {
        final BitSet closure = (BitSet) stateIndices.clone();
        final Deque<Integer> pending = new ArrayDeque<>();
        for (int i = closure.nextSetBit(0); i >= 0; i = closure.nextSetBit(i + 1)) {
            pending.push(i);
        }

        while (!pending.isEmpty()) {
            final BitSet eps = successorsOf(pending.pop(), Symbols.EPSILON);
            for (int next = eps.nextSetBit(0); next >= 0; next = eps.nextSetBit(next + 1)) {
                if (!closure.get(next)) {
                    closure.set(next);
                    pending.push(next);
                }
            }
        }

        return closure;
    }

    public Set<State> lambdaClosure(Collection<State> states) {
        return toStates(lambdaClosure(toIndices(states)));
    }

    /**
     * Computes the union of the {@code symbol}-successors of the given states, without taking epsilon transitions
     * into account.
     *
     * @param stateIndices
     *         indices of the source states
     * @param symbol
     *         the input symbol
     *
     * @return a fresh set containing the indices of the successors
     */
    public BitSet successors(BitSet stateIndices, String symbol) {
        final BitSet result = new BitSet(states.size());
        for (int i = stateIndices.nextSetBit(0); i >= 0; i = stateIndices.nextSetBit(i + 1)) {
            result.or(successorsOf(i, symbol));
        }
        return result;
    }

    /**
     * Returns the epsilon closure of the initial state, or an empty set if there is no initial state.
     *
     * @return the indices of the initially active states
     */
    public BitSet initialClosure() {
        final BitSet start = new BitSet(states.size());
        if (initialState != null) {
            start.set(initialState.getId());
        }
        return lambdaClosure(start);
    }

    /**
     * Simulates the automaton on the given input by tracking the set of active states.
     * <p>
     * The active set starts as the epsilon closure of the initial state; after each symbol it becomes the closure of
     * the symbol-successors of the active states, and a step recording it is appended to the trace. The input is
     * accepted iff the last active set contains a final state. Without an initial state every input is rejected with
     * an empty trace.
     */
    @Override
    public ValidationResult<Set<State>> validate(String input) {
        if (initialState == null) {
            return ValidationResult.rejectedWithoutTrace();
        }

        final List<String> symbols = Symbols.split(input);
        final List<Step<Set<State>>> trace = new ArrayList<>(symbols.size() + 1);
        BitSet active = initialClosure();
        trace.add(new Step<>(toStates(active), 0, input));

        int offset = 0;
        for (int i = 0; i < symbols.size(); i++) {
            final String symbol = symbols.get(i);
            offset += symbol.length();
            active = lambdaClosure(successors(active, symbol));
            trace.add(new Step<>(toStates(active), i + 1, input.substring(offset)));
        }

        return new ValidationResult<>(containsFinal(active), trace);
    }

    /**
     * Converts a set of indices to the corresponding states, in arena order.
     */
    public Set<State> toStates(BitSet stateIndices) {
        final ImmutableSet.Builder<State> result = ImmutableSet.builder();
        for (int i = stateIndices.nextSetBit(0); i >= 0; i = stateIndices.nextSetBit(i + 1)) {
            result.add(states.get(i));
        }
        return result.build();
    }

    public BitSet toIndices(Collection<State> states) {
        final BitSet result = new BitSet(this.states.size());
        for (State s : states) {
            result.set(indexOf(s));
        }
        return result;
    }

    private BitSet successorsOf(int state, String symbol) {
        final BitSet succs = successors.get(state).get(symbol);
        return succs == null ? NO_SUCCESSORS : succs;
    }
}
