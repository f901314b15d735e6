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
package de.fasim.oracle.membership;

import java.util.Objects;

import de.fasim.api.FiniteAutomaton;
import de.fasim.util.automata.AutomataLibConversions;
import de.learnlib.api.oracle.SingleQueryOracle.SingleQueryOracleDFA;
import net.automatalib.words.Word;

/**
 * A membership oracle that answers queries by simulating a {@link FiniteAutomaton}. A query word is concatenated into
 * one input string, so every symbol of the word is expected to be a single character.
 * <p>
 * The oracle counts the queries it answered. Apart from the counter it is stateless, and it is thread-safe as long as
 * the counter is not relied upon.
 */
public class FiniteAutomatonOracle implements SingleQueryOracleDFA<String> {

    private final FiniteAutomaton<?> automaton;
    private long queryCount;

    public FiniteAutomatonOracle(FiniteAutomaton<?> automaton) {
        this.automaton = Objects.requireNonNull(automaton);
    }

    @Override
    public Boolean answerQuery(Word<String> prefix, Word<String> suffix) {
        queryCount++;
        return automaton.accepts(AutomataLibConversions.toInput(prefix.concat(suffix)));
    }

    public FiniteAutomaton<?> getAutomaton() {
        return automaton;
    }

    public long getQueryCount() {
        return queryCount;
    }
}
