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
package de.fasim.examples;

import de.fasim.api.State;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.datastructure.automaton.NFA;
import de.fasim.datastructure.automaton.NFABuilder;

/**
 * Small hand-written automata over the alphabet {a, b}.
 */
public final class ExampleAutomata {

    private ExampleAutomata() {
        // prevent instantiation
    }

    /**
     * A complete DFA accepting exactly the words that end with {@code a}.
     *
     * @return the automaton
     */
    public static DFA endsWithA() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);

        builder.addTransition(q0, "a", q1);
        builder.addTransition(q1, "a", q1);
        builder.addTransition(q0, "b", q0);
        builder.addTransition(q1, "b", q0);

        return builder.build();
    }

    /**
     * A partial DFA accepting {@code ab*}. Any {@code a} after the first symbol, and any word starting with {@code b},
     * leads into a dead end.
     *
     * @return the automaton
     */
    public static DFA aFollowedByBs() {
        final DFABuilder builder = new DFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);

        builder.addTransition(q0, "a", q1);
        builder.addTransition(q1, "b", q1);

        return builder.build();
    }

    /**
     * An NFA with an epsilon transition from the initial state into a final state that loops on {@code a}. It accepts
     * {@code a*}.
     *
     * @return the automaton
     */
    public static NFA epsilonIntoLoop() {
        final NFABuilder builder = new NFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1", false, true);

        builder.addEpsilonTransition(q0, q1);
        builder.addTransition(q1, "a", q1);

        return builder.build();
    }

    /**
     * The textbook NFA accepting {@code (a|b)*abb}, without epsilon transitions.
     *
     * @return the automaton
     */
    public static NFA endsWithAbb() {
        final NFABuilder builder = new NFABuilder();
        final State q0 = builder.addState("q0", true, false);
        final State q1 = builder.addState("q1");
        final State q2 = builder.addState("q2");
        final State q3 = builder.addState("q3", false, true);

        builder.addTransition(q0, "a", q0);
        builder.addTransition(q0, "b", q0);
        builder.addTransition(q0, "a", q1);
        builder.addTransition(q1, "b", q2);
        builder.addTransition(q2, "b", q3);

        return builder.build();
    }

    /**
     * Thompson-style NFA for {@code (a|b)*abb}, using epsilon transitions to glue the sub-automata together.
     *
     * @return the automaton
     */
    public static NFA thompsonEndsWithAbb() {
        final NFABuilder builder = new NFABuilder();
        final State[] s = new State[11];
        for (int i = 0; i < s.length; i++) {
            s[i] = builder.addState(String.valueOf(i), i == 0, i == 10);
        }

        builder.addEpsilonTransition(s[0], s[1]);
        builder.addEpsilonTransition(s[0], s[7]);
        builder.addEpsilonTransition(s[1], s[2]);
        builder.addEpsilonTransition(s[1], s[4]);
        builder.addTransition(s[2], "a", s[3]);
        builder.addTransition(s[4], "b", s[5]);
        builder.addEpsilonTransition(s[3], s[6]);
        builder.addEpsilonTransition(s[5], s[6]);
        builder.addEpsilonTransition(s[6], s[1]);
        builder.addEpsilonTransition(s[6], s[7]);
        builder.addTransition(s[7], "a", s[8]);
        builder.addTransition(s[8], "b", s[9]);
        builder.addTransition(s[9], "b", s[10]);

        return builder.build();
    }
}
