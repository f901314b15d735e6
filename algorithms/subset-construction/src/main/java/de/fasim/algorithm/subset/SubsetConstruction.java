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
package de.fasim.algorithm.subset;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import de.fasim.api.State;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.datastructure.automaton.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The powerset construction, which converts an {@link NFA} with epsilon transitions into a {@link DFA} accepting the
 * same language.
 * <p>
 * Only subsets reachable from the epsilon closure of the initial state are constructed. The traversal is
 * breadth-first and visits the input symbols in their natural order, so the discovered states are named {@code q0},
 * {@code q1}, ... in the same way on every run. A subset whose successor under a symbol is empty gets no transition
 * for that symbol; the resulting DFA is therefore partial.
 */
public final class SubsetConstruction {

    /**
     * Prefix of the names of the constructed states.
     */
    public static final String STATE_PREFIX = "q";

    private static final Logger LOGGER = LoggerFactory.getLogger(SubsetConstruction.class);

    private SubsetConstruction() {
        // prevent instantiation
    }

    /**
     * Determinizes the given automaton.
     *
     * @param nfa
     *         the automaton to determinize
     *
     * @return a DFA accepting the same language, or an empty DFA if {@code nfa} has no initial state
     */
    public static DFA determinize(NFA nfa) {
        return determinizeWithSubsets(nfa).getDFA();
    }

    /**
     * Determinizes the given automaton and additionally reports which set of NFA states each DFA state stands for.
     *
     * @param nfa
     *         the automaton to determinize
     *
     * @return the constructed DFA together with the subset of every state
     */
    public static SubsetConstructionResult determinizeWithSubsets(NFA nfa) {
        final DFABuilder builder = new DFABuilder();

        if (nfa.getInitialState() == null) {
            LOGGER.debug("NFA has no initial state, returning the empty DFA");
            return new SubsetConstructionResult(builder.build(), new LinkedHashMap<>());
        }

        final List<String> symbols = nfa.getSortedAlphabet();
        // keyed by content; keys are never modified after insertion
        final Map<BitSet, State> dfaStates = new HashMap<>();
        final Map<State, Set<State>> subsets = new LinkedHashMap<>();
        final Deque<BitSet> pending = new ArrayDeque<>();

        final BitSet initialClosure = nfa.initialClosure();
        final State init = builder.addState(STATE_PREFIX + 0, true, nfa.containsFinal(initialClosure));
        dfaStates.put(initialClosure, init);
        subsets.put(init, nfa.toStates(initialClosure));
        pending.add(initialClosure);

        while (!pending.isEmpty()) {
            final BitSet current = pending.poll();
            final State source = dfaStates.get(current);

            for (String sym : symbols) {
                final BitSet closed = nfa.lambdaClosure(nfa.successors(current, sym));
                if (closed.isEmpty()) {
                    continue;
                }

                State target = dfaStates.get(closed);
                if (target == null) {
                    target = builder.addState(STATE_PREFIX + dfaStates.size(), false, nfa.containsFinal(closed));
                    dfaStates.put(closed, target);
                    subsets.put(target, nfa.toStates(closed));
                    pending.add(closed);
                    LOGGER.debug("Discovered {} = {}", target, subsets.get(target));
                }

                builder.addTransition(source, sym, target);
            }
        }

        final DFA dfa = builder.build();
        LOGGER.debug("Determinized NFA with {} states into DFA with {} states", nfa.size(), dfa.size());
        return new SubsetConstructionResult(dfa, subsets);
    }
}
