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

import java.util.Arrays;

import de.fasim.api.State;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.datastructure.automaton.NFA;
import de.fasim.datastructure.automaton.NFABuilder;
import de.fasim.examples.ExampleAutomata;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TransitionTablesTest {

    @Test
    public void testDFATable() {
        final DFA dfa = ExampleAutomata.endsWithA();
        final TransitionTable table = TransitionTables.of(dfa);

        Assert.assertEquals(table.getColumnSymbols(), Arrays.asList("a", "b"));
        Assert.assertEquals(table.numberOfRows(), 2);
        Assert.assertEquals(table.getRow(0).getLabel(), "q0 (I)");
        Assert.assertEquals(table.getRow(0).getCells(), Arrays.asList("q1", "q0"));
        Assert.assertEquals(table.getRow(1).getLabel(), "q1 (F)");
        Assert.assertSame(table.getRow(1).getState(), dfa.getStates().get(1));
    }

    @Test
    public void testMissingTransitionsAreDashed() {
        final TransitionTable table = TransitionTables.of(ExampleAutomata.aFollowedByBs());

        Assert.assertEquals(table.getRow(0).getCells(), Arrays.asList("q1", TransitionTable.NO_TRANSITION));
        Assert.assertFalse(table.getRow(0).hasTransition(1));
        Assert.assertEquals(table.getRow(1).getCells(), Arrays.asList(TransitionTable.NO_TRANSITION, "q1"));
    }

    @Test
    public void testNFATableHasEpsilonColumn() {
        final NFA nfa = ExampleAutomata.epsilonIntoLoop();
        final TransitionTable table = TransitionTables.of(nfa);

        Assert.assertEquals(table.getColumnSymbols(), Arrays.asList("a", "ε"));
        Assert.assertEquals(table.getRow(0).getCells(), Arrays.asList("-", "{q1}"));
        Assert.assertEquals(table.getRow(1).getCells(), Arrays.asList("{q1}", "-"));
    }

    @Test
    public void testEpsilonColumnDoesNotCollideWithSymbol() {
        final NFABuilder builder = new NFABuilder();
        final State p = builder.addState("p", true, false);
        final State r = builder.addState("r", false, true);
        builder.addTransition(p, "ε", r);
        builder.addTransition(r, "[ε]", r);
        builder.addEpsilonTransition(p, r);
        final TransitionTable table = TransitionTables.of(builder.build());

        Assert.assertEquals(table.getColumnSymbols(), Arrays.asList("[ε]", "ε", "[[ε]]"));
        Assert.assertEquals(table.getRow(0).getCells(), Arrays.asList("-", "{r}", "{r}"));
        Assert.assertEquals(table.getRow(1).getCells(), Arrays.asList("{r}", "-", "-"));
    }

    @Test
    public void testNFATableWithoutEpsilon() {
        final TransitionTable table = TransitionTables.of(ExampleAutomata.endsWithAbb());

        Assert.assertEquals(table.getColumnSymbols(), Arrays.asList("a", "b"));
        Assert.assertEquals(table.getRow(0).getCells(), Arrays.asList("{q0, q1}", "{q0}"));
        Assert.assertEquals(table.getRow(3).getLabel(), "q3 (F)");
    }

    @Test
    public void testInitialAndFinalLabel() {
        final DFABuilder builder = new DFABuilder();
        builder.addState("s", true, true);

        Assert.assertEquals(TransitionTables.of(builder.build()).getRow(0).getLabel(), "s (I) (F)");
    }

    @Test
    public void testRender() {
        final String[] lines = TransitionTables.of(ExampleAutomata.endsWithA()).render().split("\\R");

        Assert.assertEquals(lines.length, 3);
        Assert.assertEquals(lines[0], "State  | a  | b");
        Assert.assertEquals(lines[1], "q0 (I) | q1 | q0");
        Assert.assertEquals(lines[2], "q1 (F) | q1 | q0");
    }
}
