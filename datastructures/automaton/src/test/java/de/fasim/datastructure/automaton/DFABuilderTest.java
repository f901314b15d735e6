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

import de.fasim.api.State;
import org.testng.Assert;
import org.testng.annotations.Test;

public class DFABuilderTest {

    @Test
    public void testSecondTransitionOverwritesFirst() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);
        final State q2 = builder.addState("q2", false, false);

        builder.addTransition(q0, "a", q1);
        Assert.assertTrue(builder.hasTransition(q0, "a"));
        builder.addTransition(q0, "a", q2);

        final DFA dfa = builder.build();
        Assert.assertEquals(dfa.getSuccessor(q0, "a"), q2);
        Assert.assertEquals(dfa.getTransitionCount(), 1);
        Assert.assertFalse(dfa.accepts("a"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEpsilonIsRejected() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        builder.addTransition(q0, "", q0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownStateNameIsRejected() {
        final DFABuilder builder = new DFABuilder();
        builder.addState("q0", true, false);
        builder.addTransition("q0", "a", "q9");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testStateOfOtherBuilderIsRejected() {
        final DFABuilder other = new DFABuilder();
        other.addState("x");
        final State foreign = other.addState("y");

        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        builder.addTransition(q0, "a", foreign);
    }

    @Test
    public void testNewInitialStateReplacesOldOne() {
        final DFABuilder builder = new DFABuilder();
        builder.addState("q0", true, true);
        final State q1 = builder.addState("q1", true, false);

        final DFA dfa = builder.build();
        Assert.assertEquals(dfa.getInitialState(), q1);
        final State q0 = dfa.getStateByName("q0");
        Assert.assertFalse(q0.isInitial());
        Assert.assertTrue(q0.isFinal());
        Assert.assertTrue(dfa.isFinal(q0));
        Assert.assertFalse(dfa.accepts(""));
    }

    @Test
    public void testDuplicateNamesAreLeftToTheCaller() {
        final DFABuilder builder = new DFABuilder();
        final State first = builder.addState("q", true, false);
        Assert.assertNotNull(builder.getStateByName("q"));
        builder.addState("q", false, true);

        Assert.assertEquals(builder.getStates().size(), 2);
        Assert.assertSame(builder.getStateByName("q"), first);
    }

    @Test
    public void testFinalMarkingOfStatesSharingAName() {
        final DFABuilder builder = new DFABuilder();
        final State first = builder.addState("q", true, true);
        final State second = builder.addState("q", false, true);
        final State sink = builder.addState("s", false, false);
        builder.addTransition(first, "a", second);
        builder.addTransition(second, "a", sink);
        final DFA dfa = builder.build();

        Assert.assertTrue(dfa.isFinal(dfa.getState(0)));
        Assert.assertTrue(dfa.isFinal(dfa.getState(1)));
        Assert.assertFalse(dfa.isFinal(dfa.getState(2)));
        Assert.assertTrue(dfa.accepts(""));
        Assert.assertTrue(dfa.accepts("a"));
        Assert.assertFalse(dfa.accepts("aa"));
        Assert.assertEquals(dfa.getFinalStates().size(), 1);
    }

    @Test
    public void testAlphabetExcludesNothingButEpsilon() {
        final DFABuilder builder = new DFABuilder();
        builder.addState("q0", true, false);
        builder.addState("q1", false, true);
        builder.addTransition("q0", "b", "q1");
        builder.addTransition("q1", "a", "q0");
        builder.addTransition("q1", "b", "q1");

        Assert.assertEquals(builder.getAlphabet().toString(), "[b, a]");
        Assert.assertEquals(builder.build().getSortedAlphabet().toString(), "[a, b]");
    }

    @Test
    public void testBuiltAutomatonIsIsolatedFromBuilder() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, true);
        final DFA before = builder.build();

        builder.addTransition(q0, "a", q0);
        builder.addState("q1");

        Assert.assertEquals(before.size(), 1);
        Assert.assertFalse(before.accepts("a"));
        Assert.assertTrue(builder.build().accepts("a"));
    }

    @Test
    public void testCopyOfContinuesEditing() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);
        builder.addTransition(q0, "a", q1);
        final DFA original = builder.build();

        final DFABuilder copy = DFABuilder.copyOf(original);
        copy.addTransition("q1", "a", "q1");
        final DFA extended = copy.build();

        Assert.assertEquals(extended.getInitialState().getName(), "q0");
        Assert.assertTrue(extended.accepts("aaa"));
        Assert.assertFalse(original.accepts("aaa"));
    }
}
