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

final class GenericTransitionTable implements TransitionTable {

    private final List<String> columnSymbols;
    private final List<Row> rows;

    GenericTransitionTable(List<String> columnSymbols, List<? extends Row> rows) {
        this.columnSymbols = ImmutableList.copyOf(columnSymbols);
        this.rows = ImmutableList.copyOf(rows);
    }

    @Override
    public List<String> getColumnSymbols() {
        return columnSymbols;
    }

    @Override
    public List<Row> getRows() {
        return rows;
    }

    @Override
    public String toString() {
        return render();
    }
}
