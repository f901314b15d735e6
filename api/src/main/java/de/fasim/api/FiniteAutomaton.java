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
package de.fasim.api;

import java.util.List;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Read-only view of a finite automaton over string symbols.
 * <p>
 * Implementations are immutable and may therefore be simulated from several threads at once.
 *
 * @param <C>
 *         the configuration type reported in simulation traces
 */
public interface FiniteAutomaton<C> {

    /**
     * Retrieves the states of this automaton, in insertion order. The position of a state in this list equals its
     * {@link State#getId() id}.
     *
     * @return the states
     */
    List<State> getStates();

    /**
     * Retrieves the input alphabet in insertion order. The alphabet never contains {@link Symbols#EPSILON}.
     *
     * @return the alphabet
     */
    Set<String> getAlphabet();

    default List<String> getSortedAlphabet() {
        return Symbols.sorted(getAlphabet());
    }

    @Nullable State getInitialState();

    Set<State> getFinalStates();

    /**
     * Looks up a state by its name. If several states share the name, the first one is returned.
     *
     * @param name
     *         the state name
     *
     * @return the state, or {@code null} if no state has this name
     */
    default @Nullable State getStateByName(String name) {
        for (State s : getStates()) {
            if (s.getName().equals(name)) {
                return s;
            }
        }
        return null;
    }

    default int size() {
        return getStates().size();
    }

    /**
     * Simulates this automaton on the given input.
     *
     * @param input
     *         the input string, one symbol per character
     *
     * @return whether the input is accepted, and the simulation trace
     */
    ValidationResult<C> validate(String input);

    default boolean accepts(String input) {
        return validate(input).isAccepted();
    }
}
