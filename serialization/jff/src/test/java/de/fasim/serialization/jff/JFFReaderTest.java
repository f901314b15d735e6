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
package de.fasim.serialization.jff;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import de.fasim.api.State;
import de.fasim.api.UnresolvedReferencePolicy;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.NFA;
import de.fasim.examples.ExampleAutomata;
import de.fasim.examples.ExampleWords;
import de.fasim.exception.AutomatonFormatException;
import de.fasim.exception.UnresolvedStateException;
import org.testng.Assert;
import org.testng.annotations.Test;

public class JFFReaderTest {

    private static final String EPSILON_INTO_LOOP = "<structure><type>fa</type><automaton>" +
                                                    "<state id=\"0\" name=\"q0\"><initial/></state>" +
                                                    "<state id=\"1\" name=\"q1\"><final/></state>" +
                                                    "<transition><from>0</from><to>1</to><read/></transition>" +
                                                    "<transition><from>1</from><to>1</to><read>a</read></transition>" +
                                                    "</automaton></structure>";

    private static final String ENDS_WITH_A = "<structure><automaton>" +
                                              "<state id=\"0\" name=\"q0\"><initial/></state>" +
                                              "<state id=\"1\" name=\"q1\"><final/></state>" +
                                              "<transition><from>0</from><to>1</to><read>a</read></transition>" +
                                              "<transition><from>0</from><to>0</to><read>b</read></transition>" +
                                              "<transition><from>1</from><to>1</to><read>a</read></transition>" +
                                              "<transition><from>1</from><to>0</to><read>b</read></transition>" +
                                              "</automaton></structure>";

    private final JFFReader reader = new JFFReader();

    @Test
    public void testReadNFAFromResource() throws IOException {
        final NFA nfa;
        try (InputStream is = JFFReaderTest.class.getResourceAsStream("/ends-with-abb.jff")) {
            nfa = reader.readNFA(is);
        }
        final NFA expected = ExampleAutomata.endsWithAbb();

        Assert.assertEquals(nfa.size(), 4);
        Assert.assertEquals(nfa.getInitialState().getName(), "q0");
        Assert.assertEquals(nfa.getFinalStates(), Collections.singleton(nfa.getStateByName("q3")));
        Assert.assertEquals(nfa.getSortedAlphabet(), Arrays.asList("a", "b"));

        for (String w : ExampleWords.upTo(Arrays.asList("a", "b"), 6)) {
            Assert.assertEquals(nfa.accepts(w), expected.accepts(w), w);
        }
    }

    @Test
    public void testNameDefaultsToId() {
        final NFA nfa = reader.readNFA("<structure><state id=\"7\"><initial/><final/></state></structure>");

        Assert.assertEquals(nfa.size(), 1);
        final State state = nfa.getInitialState();
        Assert.assertNotNull(state);
        Assert.assertEquals(state.getName(), "7");
        Assert.assertTrue(state.isFinal());
        Assert.assertTrue(nfa.validate("").isAccepted());
    }

    @Test
    public void testEpsilonTransitions() {
        final NFA nfa = reader.readNFA(EPSILON_INTO_LOOP);

        Assert.assertTrue(nfa.hasEpsilonTransitions());
        Assert.assertEquals(nfa.getSortedAlphabet(), Collections.singletonList("a"));
        Assert.assertTrue(nfa.validate("").isAccepted());
        Assert.assertTrue(nfa.validate("aaa").isAccepted());

        final NFA withoutRead = reader.readNFA(EPSILON_INTO_LOOP.replace("<read/>", ""));
        Assert.assertTrue(withoutRead.hasEpsilonTransitions());
    }

    @Test
    public void testReadDFA() {
        final DFA dfa = reader.readDFA(ENDS_WITH_A, DeterminismPolicy.REJECT_NONDETERMINISM);

        Assert.assertEquals(dfa.getTransitionCount(), 4);
        Assert.assertFalse(dfa.validate("aab").isAccepted());
        Assert.assertEquals(dfa.validate("aab").getLastStep().getConfiguration().getName(), "q0");
        Assert.assertTrue(dfa.validate("ba").isAccepted());
    }

    @Test
    public void testRepeatedTransitionIsDeterministic() {
        final String doc = ENDS_WITH_A.replace("</automaton>",
                                               "<transition><from>0</from><to>1</to><read>a</read></transition>" +
                                               "</automaton>");
        final DFA dfa = reader.readDFA(doc, DeterminismPolicy.REJECT_NONDETERMINISM);

        Assert.assertEquals(dfa.getTransitionCount(), 4);
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testRejectCompetingDestinations() {
        final String doc = ENDS_WITH_A.replace("</automaton>",
                                               "<transition><from>0</from><to>0</to><read>a</read></transition>" +
                                               "</automaton>");
        reader.readDFA(doc, DeterminismPolicy.REJECT_NONDETERMINISM);
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testRejectEpsilon() {
        reader.readDFA(EPSILON_INTO_LOOP, DeterminismPolicy.REJECT_NONDETERMINISM);
    }

    @Test
    public void testLastTransitionWins() {
        final String doc = ENDS_WITH_A.replace("</automaton>",
                                               "<transition><from>0</from><to>0</to><read>a</read></transition>" +
                                               "</automaton>");
        final DFA dfa = reader.readDFA(doc, DeterminismPolicy.LAST_TRANSITION_WINS);

        final State q0 = dfa.getStateByName("q0");
        Assert.assertEquals(dfa.getSuccessor(q0, "a"), q0);
        Assert.assertFalse(dfa.accepts("a"));

        final DFA forced = reader.readDFA(EPSILON_INTO_LOOP, DeterminismPolicy.LAST_TRANSITION_WINS);
        Assert.assertEquals(forced.getTransitionCount(), 1);
        Assert.assertFalse(forced.accepts(""));
        Assert.assertFalse(forced.accepts("a"));
    }

    @Test
    public void testReadAndDeterminize() {
        final JFFImport result = reader.readAndDeterminize(EPSILON_INTO_LOOP);

        Assert.assertEquals(result.getNFA().size(), 2);
        final DFA dfa = result.getDFA();
        Assert.assertTrue(dfa.getInitialState().isFinal());
        Assert.assertTrue(dfa.validate("").isAccepted());
        Assert.assertEquals(result.getDeterminization().getSubset(dfa.getInitialState()),
                            new HashSet<>(result.getNFA().getStates()));

        for (String w : ExampleWords.upTo(Arrays.asList("a", "b"), 5)) {
            Assert.assertEquals(dfa.accepts(w), result.getNFA().accepts(w), w);
        }
    }

    @Test
    public void testUnknownStateIsSkipped() {
        final NFA nfa = reader.readNFA(EPSILON_INTO_LOOP.replace("<to>1</to><read>a</read>", "<to>5</to><read>a</read>"));

        Assert.assertEquals(nfa.size(), 2);
        Assert.assertFalse(nfa.accepts("a"));
        Assert.assertTrue(nfa.accepts(""));
    }

    @Test
    public void testUnknownStateFailsFast() {
        final JFFReader strict = new JFFReader(UnresolvedReferencePolicy.FAIL_FAST);
        try {
            strict.readNFA(EPSILON_INTO_LOOP.replace("<from>1</from>", "<from>9</from>"));
            Assert.fail("unresolved reference accepted");
        } catch (UnresolvedStateException e) {
            Assert.assertEquals(e.getReference(), "9");
        }
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testStateWithoutId() {
        reader.readNFA("<structure><state name=\"q0\"><initial/></state></structure>");
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testDuplicateId() {
        reader.readNFA("<structure><state id=\"0\"/><state id=\"0\"/></structure>");
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testTransitionWithoutTarget() {
        reader.readNFA(EPSILON_INTO_LOOP.replace("<to>1</to><read/>", "<read/>"));
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testMalformedMarkup() {
        reader.readNFA("<structure><state id=\"0\">");
    }

    @Test(expectedExceptions = AutomatonFormatException.class)
    public void testDoctypeIsRefused() {
        reader.readNFA("<?xml version=\"1.0\"?>" +
                       "<!DOCTYPE structure [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>" +
                       "<structure><state id=\"&xxe;\"/></structure>");
    }
}
