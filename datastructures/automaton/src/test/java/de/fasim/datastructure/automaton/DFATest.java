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

import java.util.List;

import de.fasim.api.State;
import de.fasim.api.Step;
import de.fasim.api.ValidationResult;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DFATest {

    private static DFA endsWithA() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);
        builder.addTransition(q0, "a", q1);
        builder.addTransition(q1, "a", q1);
        builder.addTransition(q0, "b", q0);
        builder.addTransition(q1, "b", q0);
        return builder.build();
    }

    @Test
    public void testRejectsWordNotEndingWithA() {
        final DFA dfa = endsWithA();
        final ValidationResult<State> result = dfa.validate("aab");

        Assert.assertFalse(result.isAccepted());
        final List<Step<State>> trace = result.getTrace();
        Assert.assertEquals(trace.size(), 4);
        Assert.assertEquals(trace.get(0), new Step<>(dfa.getStateByName("q0"), 0, "aab"));
        Assert.assertEquals(trace.get(1), new Step<>(dfa.getStateByName("q1"), 1, "ab"));
        Assert.assertEquals(trace.get(2), new Step<>(dfa.getStateByName("q1"), 2, "b"));
        Assert.assertEquals(trace.get(3), new Step<>(dfa.getStateByName("q0"), 3, ""));
    }

    @Test
    public void testSupplementaryCharacterIsOneSymbol() {
        final String italicA = "\uD835\uDC4E";
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);
        builder.addTransition(q0, italicA, q1);
        builder.addTransition(q1, "b", q0);
        final DFA dfa = builder.build();

        Assert.assertTrue(dfa.accepts(italicA));
        final ValidationResult<State> result = dfa.validate(italicA + "b" + italicA);
        Assert.assertTrue(result.isAccepted());
        Assert.assertEquals(result.getTrace().size(), 4);
        Assert.assertEquals(result.getTrace().get(1), new Step<>(q1, 1, "b" + italicA));
        Assert.assertEquals(result.getTrace().get(2), new Step<>(q0, 2, italicA));
        Assert.assertEquals(result.getTrace().get(3), new Step<>(q1, 3, ""));
    }

    @Test
    public void testAcceptsWordEndingWithA() {
        final DFA dfa = endsWithA();
        final ValidationResult<State> result = dfa.validate("ba");

        Assert.assertTrue(result.isAccepted());
        Assert.assertEquals(result.getLastStep().getConfiguration().getName(), "q1");
    }

    @Test
    public void testEmptyWordDependsOnInitialState() {
        Assert.assertFalse(endsWithA().accepts(""));

        final DFABuilder builder = new DFABuilder();
        builder.addState("only", true, true);
        final ValidationResult<State> result = builder.build().validate("");
        Assert.assertTrue(result.isAccepted());
        Assert.assertEquals(result.getTrace().size(), 1);
    }

    @Test
    public void testStuckAutomatonRejectsImmediately() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, true);
        builder.addTransition(q0, "a", q0);
        final DFA dfa = builder.build();

        final ValidationResult<State> result = dfa.validate("aaca");

        Assert.assertFalse(result.isAccepted());
        Assert.assertEquals(result.getTrace().size(), 4);
        final Step<State> last = result.getLastStep();
        Assert.assertTrue(last.isStuck());
        Assert.assertNull(last.getConfiguration());
        Assert.assertEquals(last.getPosition(), 3);
        Assert.assertEquals(last.getRemaining(), "a");
    }

    @Test
    public void testNoInitialStateRejectsEverything() {
        final DFABuilder builder = new DFABuilder();
        final State q = builder.addState("q", false, true);
        builder.addTransition(q, "a", q);
        final DFA dfa = builder.build();

        for (String input : new String[] {"", "a", "aa"}) {
            final ValidationResult<State> result = dfa.validate(input);
            Assert.assertFalse(result.isAccepted(), input);
            Assert.assertTrue(result.getTrace().isEmpty(), input);
        }
        Assert.assertFalse(DFA.empty().accepts(""));
    }

    @Test
    public void testTransitionsKeepRegistrationOrder() {
        final DFA dfa = endsWithA();
        final State q0 = dfa.getStateByName("q0");

        Assert.assertEquals(dfa.getTransitions(q0).keySet().toString(), "[a, b]");
        Assert.assertEquals(dfa.getSuccessor(q0, "b"), q0);
        Assert.assertNull(dfa.getSuccessor(q0, "c"));
        Assert.assertEquals(dfa.getTransitionCount(), 4);
        Assert.assertEquals(dfa.getSortedAlphabet().toString(), "[a, b]");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testForeignStateIsRejected() {
        final DFA dfa = endsWithA();
        dfa.getSuccessor(new State(7, "q7", false, false), "a");
    }
}
