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

import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import de.fasim.api.State;
import de.fasim.datastructure.automaton.DFA;

/**
 * The outcome of {@link SubsetConstruction#determinizeWithSubsets(de.fasim.datastructure.automaton.NFA)}.
 */
public final class SubsetConstructionResult {

    private final DFA dfa;
    private final Map<State, Set<State>> subsets;

    SubsetConstructionResult(DFA dfa, Map<State, Set<State>> subsets) {
        this.dfa = dfa;
        this.subsets = ImmutableMap.copyOf(subsets);
    }

    public DFA getDFA() {
        return dfa;
    }

    /**
     * Returns the set of NFA states represented by a state of the constructed DFA.
     *
     * @param dfaState
     *         a state of {@link #getDFA()}
     *
     * @return the NFA states, in arena order
     */
    public Set<State> getSubset(State dfaState) {
        final Set<State> subset = subsets.get(dfaState);
        Preconditions.checkArgument(subset != null, "Not a state of the constructed DFA: %s", dfaState);
        return subset;
    }

    public Map<State, Set<State>> getSubsets() {
        return subsets;
    }
}
