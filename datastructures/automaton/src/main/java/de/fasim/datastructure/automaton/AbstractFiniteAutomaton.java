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

import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import de.fasim.api.FiniteAutomaton;
import de.fasim.api.State;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Base class for the immutable automata. Holds the state arena, the alphabet and the initial/final marking; subclasses
 * add their transition structure.
 *
 * @param <C>
 *         the configuration type reported in simulation traces
 */
public abstract class AbstractFiniteAutomaton<C> implements FiniteAutomaton<C> {

    protected final List<State> states;
    protected final Set<String> alphabet;
    protected final @Nullable State initialState;
    protected final Set<State> finalStates;
    private final BitSet finalIndices;

    protected AbstractFiniteAutomaton(List<State> states,
                                      Collection<String> alphabet,
                                      @Nullable State initialState,
                                      BitSet finalIndices) {
        this.states = ImmutableList.copyOf(states);
        this.alphabet = ImmutableSet.copyOf(alphabet);
        this.initialState = initialState;
        this.finalIndices = (BitSet) finalIndices.clone();

        final ImmutableSet.Builder<State> finals = ImmutableSet.builder();
        for (int i = finalIndices.nextSetBit(0); i >= 0; i = finalIndices.nextSetBit(i + 1)) {
            finals.add(this.states.get(i));
        }
        this.finalStates = finals.build();
    }

    @Override
    public List<State> getStates() {
        return states;
    }

    @Override
    public Set<String> getAlphabet() {
        return alphabet;
    }

    @Override
    public @Nullable State getInitialState() {
        return initialState;
    }

    /**
     * Returns the final states in arena order. Since states are equal by name, final states sharing a name appear
     * once; use {@link #isFinal(State)} to query the marking of an individual state.
     */
    @Override
    public Set<State> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(State state) {
        return finalIndices.get(indexOf(state));
    }

    /**
     * Returns {@code true} iff at least one of the states indexed by the given set is final.
     *
     * @param stateIndices
     *         the indices of the states to check
     *
     * @return whether the set contains a final state
     */
    public boolean containsFinal(BitSet stateIndices) {
        return stateIndices.intersects(finalIndices);
    }

    public State getState(int id) {
        return states.get(id);
    }

    /**
     * Returns the arena index of the given state after checking that the state belongs to this automaton.
     *
     * @throws IllegalArgumentException
     *         if the state is not a state of this automaton
     */
    protected int indexOf(State state) {
        final int id = state.getId();
        Preconditions.checkArgument(id >= 0 && id < states.size() && states.get(id).equals(state),
                                    "State '%s' does not belong to this automaton",
                                    state);
        return id;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{states=" + states + ", alphabet=" + alphabet + ", initial=" +
               initialState + ", final=" + finalStates + '}';
    }
}
