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
package de.fasim.util.automata;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import de.fasim.api.FiniteAutomaton;
import de.fasim.api.State;
import de.fasim.api.Symbols;
import de.fasim.datastructure.automaton.AbstractFiniteAutomaton;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.datastructure.automaton.NFA;
import net.automatalib.automata.fsa.MutableFSA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.words.Alphabet;
import net.automatalib.words.Word;
import net.automatalib.words.impl.Alphabets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conversions between FASim automata and AutomataLib's compact automata, e.g. to apply AutomataLib's algorithms
 * (minimization, equivalence checks, visualization) to an automaton built here.
 * <p>
 * The input alphabet of the converted automata consists of the symbols of the source automaton in their natural
 * order. State ids are preserved: the state with id {@code i} becomes the {@code i}-th state of the compact automaton.
 */
public final class AutomataLibConversions {

    private AutomataLibConversions() {
        // prevent instantiation
    }

    public static Alphabet<String> alphabetOf(FiniteAutomaton<?> automaton) {
        return Alphabets.fromCollection(automaton.getSortedAlphabet());
    }

    public static CompactDFA<String> toCompactDFA(DFA dfa) {
        final CompactDFA<String> result = new CompactDFA<>(alphabetOf(dfa));
        final List<State> states = dfa.getStates();
        final Integer[] ids = addStates(dfa, result);

        for (State s : states) {
            for (Map.Entry<String, State> e : dfa.getTransitions(s).entrySet()) {
                final Integer src = ids[s.getId()];
                final Integer tgt = ids[e.getValue().getId()];
                result.setTransition(src, e.getKey(), tgt);
            }
        }
        return result;
    }

    /**
     * Converts an NFA without epsilon transitions.
     *
     * @throws IllegalArgumentException
     *         if {@code nfa} has epsilon transitions, which AutomataLib's NFAs do not support
     */
    public static CompactNFA<String> toCompactNFA(NFA nfa) {
        Preconditions.checkArgument(!nfa.hasEpsilonTransitions(),
                                    "Cannot convert an NFA with epsilon transitions, determinize it first");

        final CompactNFA<String> result = new CompactNFA<>(alphabetOf(nfa));
        final List<State> states = nfa.getStates();
        final Integer[] ids = addStates(nfa, result);

        for (State s : states) {
            for (Map.Entry<String, Set<State>> e : nfa.getTransitions(s).entrySet()) {
                for (State succ : e.getValue()) {
                    final Integer src = ids[s.getId()];
                    final Integer tgt = ids[succ.getId()];
                    result.addTransition(src, e.getKey(), tgt);
                }
            }
        }
        return result;
    }

    /**
     * Converts an AutomataLib DFA. States are named {@code s0}, {@code s1}, ... in the iteration order of {@link
     * net.automatalib.automata.fsa.DFA#getStates()}.
     *
     * @param dfa
     *         the automaton to convert
     * @param inputs
     *         the input symbols whose transitions should be copied; must not contain {@link Symbols#EPSILON}
     * @param <S>
     *         state type of the source automaton
     *
     * @return the converted automaton
     */
    public static <S> DFA fromDFA(net.automatalib.automata.fsa.DFA<S, String> dfa, Collection<String> inputs) {
        final DFABuilder builder = new DFABuilder();
        final Map<S, State> mapping = new HashMap<>();
        final @Nullable S init = dfa.getInitialState();

        for (S s : dfa.getStates()) {
            mapping.put(s, builder.addState("s" + mapping.size(), s.equals(init), dfa.isAccepting(s)));
        }

        for (S s : dfa.getStates()) {
            for (String in : inputs) {
                final @Nullable S succ = dfa.getSuccessor(s, in);
                if (succ != null) {
                    builder.addTransition(mapping.get(s), in, mapping.get(succ));
                }
            }
        }
        return builder.build();
    }

    /**
     * Splits an input string into a word with one symbol per code point.
     *
     * @param input
     *         the input string
     *
     * @return the corresponding word
     */
    public static Word<String> toWord(String input) {
        return Word.fromList(Symbols.split(input));
    }

    /**
     * Concatenates the symbols of a word into an input string.
     *
     * @param word
     *         the word
     *
     * @return the corresponding input string
     */
    public static String toInput(Word<String> word) {
        return String.join("", word.asList());
    }

    private static Integer[] addStates(AbstractFiniteAutomaton<?> automaton, MutableFSA<Integer, String> target) {
        final State initial = automaton.getInitialState();
        final Integer[] ids = new Integer[automaton.size()];
        for (State s : automaton.getStates()) {
            final boolean accepting = automaton.isFinal(s);
            if (initial != null && initial.getId() == s.getId()) {
                ids[s.getId()] = target.addInitialState(accepting);
            } else {
                ids[s.getId()] = target.addState(accepting);
            }
        }
        return ids;
    }
}
