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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import de.fasim.api.State;
import de.fasim.api.Symbols;

/**
 * Incrementally assembles an {@link NFA}. Transitions accumulate: each {@code (state, symbol)} pair maps to a set of
 * successors, and the symbol may be {@link Symbols#EPSILON}.
 */
public class NFABuilder extends AbstractAutomatonBuilder<NFA> {

    private final List<Map<String, BitSet>> successors = new ArrayList<>();

    @Override
    protected void onStateAdded(State state) {
        successors.add(new LinkedHashMap<>());
    }

    /**
     * Adds {@code to} to the successors of {@code from} under {@code symbol}.
     *
     * @param from
     *         the source state
     * @param symbol
     *         the input symbol, or {@link Symbols#EPSILON} for an epsilon transition
     * @param to
     *         the target state
     */
    public void addTransition(State from, String symbol, State to) {
        Objects.requireNonNull(symbol, "symbol");
        final int src = indexOf(from);
        final int tgt = indexOf(to);

        registerSymbol(symbol);
        successors.get(src).computeIfAbsent(symbol, k -> new BitSet()).set(tgt);
    }

    public void addTransition(String from, String symbol, String to) {
        addTransition(requireState(from), symbol, requireState(to));
    }

    public void addEpsilonTransition(State from, State to) {
        addTransition(from, Symbols.EPSILON, to);
    }

    @Override
    public NFA build() {
        final List<Map<String, BitSet>> frozen = new ArrayList<>(successors.size());
        for (Map<String, BitSet> row : successors) {
            final Map<String, BitSet> copy = new LinkedHashMap<>();
            for (Map.Entry<String, BitSet> e : row.entrySet()) {
                copy.put(e.getKey(), (BitSet) e.getValue().clone());
            }
            frozen.add(copy);
        }
        return new NFA(states, alphabet, initialState, finalIndices, frozen);
    }
}
