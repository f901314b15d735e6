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

import de.fasim.api.State;

/**
 * A row of a {@link TransitionTable}, i.e. the outgoing transitions of a single state.
 */
public interface Row {

    State getState();

    /**
     * Retrieves the label of this row: the state name, followed by {@code (I)} for the initial state and {@code (F)}
     * for final states.
     *
     * @return the row label
     */
    String getLabel();

    /**
     * Retrieves the cell contents of this row, aligned with {@link TransitionTable#getColumnSymbols()}.
     *
     * @return the cell contents
     */
    List<String> getCells();

    default String getCell(int columnIdx) {
        return getCells().get(columnIdx);
    }

    default boolean hasTransition(int columnIdx) {
        return !TransitionTable.NO_TRANSITION.equals(getCell(columnIdx));
    }
}
