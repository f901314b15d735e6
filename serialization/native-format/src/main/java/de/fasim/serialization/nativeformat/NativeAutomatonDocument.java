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
package de.fasim.serialization.nativeformat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The native exchange document of a deterministic automaton:
 * <pre>
 * {
 *   "alphabet": ["a", "b"],
 *   "states": ["q0", "q1"],
 *   "initial_state": "q0",
 *   "final_states": ["q1"],
 *   "transitions": {"q0,a": "q1", "q1,b": "q0"}
 * }
 * </pre>
 * Transition keys join the source state name and the symbol with a comma. An automaton without initial state has an
 * empty {@code initial_state}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"alphabet", "states", "initial_state", "final_states", "transitions"})
public class NativeAutomatonDocument {

    @JsonProperty("alphabet")
    private @Nullable List<String> alphabet = new ArrayList<>();

    @JsonProperty("states")
    private @Nullable List<String> states;

    @JsonProperty("initial_state")
    private @Nullable String initialState = "";

    @JsonProperty("final_states")
    private @Nullable List<String> finalStates = new ArrayList<>();

    @JsonProperty("transitions")
    private @Nullable Map<String, String> transitions = new LinkedHashMap<>();

    public NativeAutomatonDocument() {}

    public NativeAutomatonDocument(List<String> alphabet,
                                   List<String> states,
                                   String initialState,
                                   List<String> finalStates,
                                   Map<String, String> transitions) {
        this.alphabet = alphabet;
        this.states = states;
        this.initialState = initialState;
        this.finalStates = finalStates;
        this.transitions = transitions;
    }

    public @Nullable List<String> getAlphabet() {
        return alphabet;
    }

    public void setAlphabet(@Nullable List<String> alphabet) {
        this.alphabet = alphabet;
    }

    public @Nullable List<String> getStates() {
        return states;
    }

    public void setStates(@Nullable List<String> states) {
        this.states = states;
    }

    public @Nullable String getInitialState() {
        return initialState;
    }

    public void setInitialState(@Nullable String initialState) {
        this.initialState = initialState;
    }

    public @Nullable List<String> getFinalStates() {
        return finalStates;
    }

    public void setFinalStates(@Nullable List<String> finalStates) {
        this.finalStates = finalStates;
    }

    public @Nullable Map<String, String> getTransitions() {
        return transitions;
    }

    public void setTransitions(@Nullable Map<String, String> transitions) {
        this.transitions = transitions;
    }
}
