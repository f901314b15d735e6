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
package de.fasim.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import de.fasim.api.State;
import de.fasim.api.ValidationResult;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.datastructure.automaton.NFA;
import de.fasim.examples.ExampleAutomata;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TraceRendererTest {

    @Test
    public void testDescribeDFASteps() {
        final DFA dfa = ExampleAutomata.endsWithA();
        final ValidationResult<State> result = dfa.validate("ab");

        Assert.assertEquals(TraceRenderer.describeSteps(result, 1),
                            Arrays.asList("Step 0: State: q0", "Step 1: → State: q1"));
        Assert.assertEquals(TraceRenderer.describeSteps(result).size(), 3);
    }

    @Test
    public void testStuckStepIsDescribedAsError() {
        final ValidationResult<State> result = ExampleAutomata.aFollowedByBs().validate("aa");

        Assert.assertEquals(TraceRenderer.describeSteps(result).get(2), "Step 2: → State: Error");
    }

    @Test
    public void testDescribeNFASteps() {
        final NFA nfa = ExampleAutomata.endsWithAbb();
        final ValidationResult<Set<State>> result = nfa.validate("ac");

        Assert.assertEquals(TraceRenderer.describeSteps(result),
                            Arrays.asList("Step 0: State: {q0}", "Step 1: State: {q0, q1}", "Step 2: → State: ∅"));
    }

    @Test
    public void testEmptyTrace() {
        Assert.assertTrue(TraceRenderer.describeSteps(ValidationResult.rejectedWithoutTrace()).isEmpty());
        Assert.assertEquals(TraceRenderer.describeConfiguration(Collections.emptySet()), TraceRenderer.EMPTY_SET);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testStepOutOfRange() {
        TraceRenderer.describeSteps(ExampleAutomata.endsWithA().validate("a"), 2);
    }

    @Test
    public void testHighlight() {
        final String input = "abab";
        final ValidationResult<State> result = ExampleAutomata.endsWithA().validate(input);

        Assert.assertEquals(TraceRenderer.highlight(input, result, 0), "[a]bab");
        Assert.assertEquals(TraceRenderer.highlight(input, result, 2), "ab[a]b");
        Assert.assertEquals(TraceRenderer.highlight(input, result, 4), "abab");
    }

    @Test
    public void testHighlightSupplementaryCharacter() {
        final String italicA = "\uD835\uDC4E";
        final DFABuilder builder = new DFABuilder();
        builder.addState("q0", true, true);
        builder.addTransition("q0", italicA, "q0");
        builder.addTransition("q0", "b", "q0");
        final String input = "b" + italicA + "b";
        final ValidationResult<State> result = builder.build().validate(input);

        Assert.assertEquals(TraceRenderer.highlight(input, result, 1), "b[" + italicA + "]b");
        Assert.assertEquals(TraceRenderer.highlight(input, result, 2), "b" + italicA + "[b]");
    }
}
