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

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A named state of a finite automaton.
 * <p>
 * States are values: they are never mutated after construction and two states are equal iff their names are equal.
 * The {@link #getId() id} is the index of the state in the state arena of the automaton that created it. It is used
 * to key transitions and to represent sets of states compactly, but it does not take part in equality.
 */
public final class State {

    private final int id;
    private final String name;
    private final boolean initial;
    private final boolean accepting;

    /**
     * Constructor.
     *
     * @param id
     *         the arena index of the state
     * @param name
     *         the name of the state, unique within one automaton
     * @param initial
     *         whether the state is the initial state
     * @param accepting
     *         whether the state is a final (accepting) state
     */
    public State(int id, String name, boolean initial, boolean accepting) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name");
        this.initial = initial;
        this.accepting = accepting;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isInitial() {
        return initial;
    }

    public boolean isFinal() {
        return accepting;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof State)) {
            return false;
        }
        return name.equals(((State) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
