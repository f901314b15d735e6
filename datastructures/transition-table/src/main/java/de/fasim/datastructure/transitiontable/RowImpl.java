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

import java.util.List;

import com.google.common.collect.ImmutableList;
import de.fasim.api.State;

final class RowImpl implements Row {

    private final State state;
    private final String label;
    private final List<String> cells;

    /**
     * Constructor.
     *
     * @param state
     *         the state described by this row
     * @param initial
     *         whether the state is the initial state of its automaton
     * @param accepting
     *         whether the state is final in its automaton
     * @param cells
     *         the cell contents, one per column
     */
    RowImpl(State state, boolean initial, boolean accepting, List<String> cells) {
        this.state = state;
        this.label = state.getName() + (initial ? " (I)" : "") + (accepting ? " (F)" : "");
        this.cells = ImmutableList.copyOf(cells);
    }

    @Override
    public State getState() {
        return state;
    }

    @Override
    public String getLabel() {
        return label;
    }

    @Override
    public List<String> getCells() {
        return cells;
    }

    @Override
    public String toString() {
        return label + cells;
    }
}
