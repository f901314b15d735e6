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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import de.fasim.api.State;
import de.fasim.api.Symbols;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Shared state handling of the mutable automaton builders.
 * <p>
 * Builders are not thread-safe. An automaton is assembled by exactly one owner through {@link #addState(String,
 * boolean, boolean)} and the transition methods of the subclass, and then frozen by {@link #build()}.
 *
 * @param <A>
 *         the automaton type built
 */
public abstract class AbstractAutomatonBuilder<A> {

    protected final List<State> states = new ArrayList<>();
    protected final Set<String> alphabet = new LinkedHashSet<>();
    // indexed by arena id, so that states sharing a name are still marked individually
    protected final BitSet finalIndices = new BitSet();
    protected @Nullable State initialState;

    /**
     * Creates and appends a new state. A new initial state replaces the previous one; the previous state keeps its
     * name and final flag, but is no longer marked initial.
     * <p>
     * Duplicate names are not rejected here. Callers that need unique names check {@link #getStateByName(String)}
     * first.
     *
     * @param name
     *         the name of the state
     * @param initial
     *         whether the new state becomes the initial state
     * @param accepting
     *         whether the new state is final
     *
     * @return the created state
     */
    public State addState(String name, boolean initial, boolean accepting) {
        Objects.requireNonNull(name, "name");
        final State state = new State(states.size(), name, initial, accepting);
        states.add(state);
        onStateAdded(state);

        if (initial) {
            final State previous = initialState;
            if (previous != null) {
                final State demoted =
                        new State(previous.getId(), previous.getName(), false, previous.isFinal());
                states.set(previous.getId(), demoted);
            }
            initialState = state;
        }
        if (accepting) {
            finalIndices.set(state.getId());
        }
        return state;
    }

    public State addState(String name) {
        return addState(name, false, false);
    }

    /**
     * Looks up a state by its name. If several states share the name, the first one is returned.
     */
    public @Nullable State getStateByName(String name) {
        for (State s : states) {
            if (s.getName().equals(name)) {
                return s;
            }
        }
        return null;
    }

    /**
     * Adds a symbol to the alphabet without adding a transition. The epsilon symbol is ignored.
     *
     * @param symbol
     *         the symbol to add
     */
    public void addSymbol(String symbol) {
        registerSymbol(Objects.requireNonNull(symbol, "symbol"));
    }

    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    public Set<String> getAlphabet() {
        return Collections.unmodifiableSet(alphabet);
    }

    public @Nullable State getInitialState() {
        return initialState;
    }

    public abstract A build();

    /**
     * Hook for subclasses to allocate the transition storage of a new state.
     */
    protected abstract void onStateAdded(State state);

    protected void registerSymbol(String symbol) {
        if (!Symbols.isEpsilon(symbol)) {
            alphabet.add(symbol);
        }
    }

    protected int indexOf(State state) {
        final int id = state.getId();
        Preconditions.checkArgument(id >= 0 && id < states.size() && states.get(id).equals(state),
                                    "State '%s' was not created by this builder",
                                    state);
        return id;
    }

    protected State requireState(String name) {
        final State state = getStateByName(name);
        Preconditions.checkArgument(state != null, "Unknown state '%s'", name);
        return state;
    }
}
