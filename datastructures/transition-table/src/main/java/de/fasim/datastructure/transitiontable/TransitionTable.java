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

/**
 * A tabular view of the transition function of an automaton.
 * <p>
 * Basically, a transition table is a two-dimensional table whose rows are indexed by the states of the automaton (in
 * insertion order) and whose columns are indexed by input symbols (in their natural order). Each cell describes the
 * successor(s) of the row's state under the column's symbol, or {@link #NO_TRANSITION} if there is none.
 * <p>
 * Tables are snapshots: they do not change when the automaton they were created from is replaced.
 */
public interface TransitionTable {

    /**
     * Heading of the column holding the state labels.
     */
    String STATE_HEADING = "State";

    /**
     * Cell content for a missing transition.
     */
    String NO_TRANSITION = "-";

    /**
     * Retrieves the symbols labelling the transition columns, in column order.
     *
     * @return the column symbols
     */
    List<String> getColumnSymbols();

    List<Row> getRows();

    /**
     * Returns the specified row of the table.
     *
     * @param idx
     *         the index of the row, which equals the id of its state
     *
     * @return the row
     *
     * @throws IndexOutOfBoundsException
     *         if {@code idx} is less than 0 or greater than {@code number of rows - 1}.
     */
    default Row getRow(int idx) {
        return getRows().get(idx);
    }

    default int numberOfRows() {
        return getRows().size();
    }

    default int numberOfColumns() {
        return getColumnSymbols().size();
    }

    /**
     * Renders the table as plain text with aligned columns, one line per row, preceded by a header line.
     *
     * @return the rendered table
     *
     * @see TransitionTableASCIIWriter
     */
    default String render() {
        return TransitionTableASCIIWriter.render(this);
    }
}
