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
package de.fasim.datastructure.transitiontable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import de.fasim.api.FiniteAutomaton;
import de.fasim.api.State;
import de.fasim.api.Symbols;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.NFA;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factory methods for {@link TransitionTable}s.
 */
public final class TransitionTables {

    private TransitionTables() {
        // prevent instantiation
    }

    /**
     * Tabulates a deterministic automaton. Each cell holds the name of the successor state.
     *
     * @param dfa
     *         the automaton
     *
     * @return the transition table
     */
    public static TransitionTable of(DFA dfa) {
        final List<String> symbols = dfa.getSortedAlphabet();
        final List<RowImpl> rows = new ArrayList<>(dfa.size());

        for (State s : dfa.getStates()) {
            final List<String> cells = new ArrayList<>(symbols.size());
            for (String sym : symbols) {
                final State succ = dfa.getSuccessor(s, sym);
                cells.add(succ == null ? TransitionTable.NO_TRANSITION : succ.getName());
            }
            rows.add(new RowImpl(s, isInitial(dfa, s), dfa.isFinal(s), cells));
        }

        return new GenericTransitionTable(symbols, rows);
    }

    /**
     * Tabulates a non-deterministic automaton. Each cell holds the set of successor states, e.g. {@code {q1, q2}}. If
     * the automaton has epsilon transitions, they are listed in a trailing {@link Symbols#EPSILON_DISPLAY} column. Should
     * the alphabet itself contain that label, the epsilon column label is bracketed until it is unique.
     *
     * @param nfa
     *         the automaton
     *
     * @return the transition table
     */
    public static TransitionTable of(NFA nfa) {
        final List<String> symbols = new ArrayList<>(nfa.getSortedAlphabet());
        final boolean epsilonColumn = nfa.hasEpsilonTransitions();
        final List<RowImpl> rows = new ArrayList<>(nfa.size());

        for (State s : nfa.getStates()) {
            final List<String> cells = new ArrayList<>(symbols.size() + 1);
            for (String sym : symbols) {
                cells.add(formatSet(nfa.getSuccessors(s, sym)));
            }
            if (epsilonColumn) {
                cells.add(formatSet(nfa.getSuccessors(s, Symbols.EPSILON)));
            }
            rows.add(new RowImpl(s, isInitial(nfa, s), nfa.isFinal(s), cells));
        }

        if (epsilonColumn) {
            symbols.add(epsilonLabel(symbols));
        }
        return new GenericTransitionTable(symbols, rows);
    }

    private static String epsilonLabel(List<String> symbols) {
        String label = Symbols.EPSILON_DISPLAY;
        while (symbols.contains(label)) {
            label = '[' + label + ']';
        }
        return label;
    }

    private static boolean isInitial(FiniteAutomaton<?> automaton, State state) {
        final @Nullable State initial = automaton.getInitialState();
        return initial != null && initial.getId() == state.getId();
    }

    private static String formatSet(Set<State> states) {
        if (states.isEmpty()) {
            return TransitionTable.NO_TRANSITION;
        }
        return states.stream().map(State::getName).collect(Collectors.joining(", ", "{", "}"));
    }
}
