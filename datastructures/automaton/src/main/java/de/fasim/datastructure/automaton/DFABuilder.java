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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import de.fasim.api.State;
import de.fasim.api.Symbols;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incrementally assembles a {@link DFA}.
 * <p>
 * The transition function is partial: a {@code (state, symbol)} pair without a transition makes the automaton reject
 * every input that reaches it. Registering a second transition for the same pair replaces the first one; use {@link
 * #hasTransition(State, String)} to detect such conflicts beforehand.
 */
public class DFABuilder extends AbstractAutomatonBuilder<DFA> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DFABuilder.class);

    // successors.get(i) maps a symbol to the index of the successor of state i
    private final List<Map<String, Integer>> successors = new ArrayList<>();

    /**
     * Creates a builder pre-populated with the states and transitions of the given automaton, e.g. to continue
     * editing an automaton that was loaded or converted.
     *
     * @param dfa
     *         the automaton to copy
     *
     * @return a new builder
     */
    public static DFABuilder copyOf(DFA dfa) {
        final DFABuilder builder = new DFABuilder();
        final State initial = dfa.getInitialState();
        for (State s : dfa.getStates()) {
            builder.addState(s.getName(), initial != null && s.getId() == initial.getId(), dfa.isFinal(s));
        }
        for (State s : dfa.getStates()) {
            for (Map.Entry<String, State> e : dfa.getTransitions(s).entrySet()) {
                builder.addTransition(builder.getState(s.getId()), e.getKey(), builder.getState(e.getValue().getId()));
            }
        }
        return builder;
    }

    @Override
    protected void onStateAdded(State state) {
        successors.add(new LinkedHashMap<>());
    }

    /**
     * Registers the transition {@code from -symbol-> to}, replacing an existing transition for {@code (from,
     * symbol)}.
     *
     * @param from
     *         the source state
     * @param symbol
     *         the input symbol, must not be {@link Symbols#EPSILON}
     * @param to
     *         the target state
     *
     * @throws IllegalArgumentException
     *         if {@code symbol} is the epsilon symbol, or a state was not created by this builder
     */
    public void addTransition(State from, String symbol, State to) {
        Preconditions.checkArgument(!Symbols.isEpsilon(symbol),
                                    "Deterministic automata cannot have epsilon transitions (from '%s')",
                                    from);
        final int src = indexOf(from);
        final int tgt = indexOf(to);

        registerSymbol(symbol);
        final Integer old = successors.get(src).put(symbol, tgt);
        if (old != null && old != tgt) {
            LOGGER.debug("Overwriting transition ({}, {}) -> {} with -> {}", from, symbol, states.get(old), to);
        }
    }

    /**
     * Name-based variant of {@link #addTransition(State, String, State)}.
     *
     * @throws IllegalArgumentException
     *         if one of the names does not denote a state of this builder
     */
    public void addTransition(String from, String symbol, String to) {
        addTransition(requireState(from), symbol, requireState(to));
    }

    public boolean hasTransition(State from, String symbol) {
        return successors.get(indexOf(from)).containsKey(symbol);
    }

    public @Nullable State getSuccessor(State from, String symbol) {
        final Integer succ = successors.get(indexOf(from)).get(symbol);
        return succ == null ? null : states.get(succ);
    }

    State getState(int id) {
        return states.get(id);
    }

    @Override
    public DFA build() {
        final List<Map<String, Integer>> frozen = new ArrayList<>(successors.size());
        for (Map<String, Integer> m : successors) {
            frozen.add(ImmutableMap.copyOf(m));
        }
        return new DFA(states, alphabet, initialState, finalIndices, frozen);
    }
}
