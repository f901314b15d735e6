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
package de.fasim.serialization.jff;

import de.fasim.algorithm.subset.SubsetConstructionResult;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.NFA;

/**
 * An automaton read from a JFF document together with its determinization.
 */
public final class JFFImport {

    private final NFA nfa;
    private final SubsetConstructionResult determinization;

    JFFImport(NFA nfa, SubsetConstructionResult determinization) {
        this.nfa = nfa;
        this.determinization = determinization;
    }

    public NFA getNFA() {
        return nfa;
    }

    public DFA getDFA() {
        return determinization.getDFA();
    }

    /**
     * Returns the subset construction result, which also maps every state of {@link #getDFA()} to the set of
     * {@link #getNFA() NFA} states it stands for.
     *
     * @return the determinization
     */
    public SubsetConstructionResult getDeterminization() {
        return determinization;
    }
}
