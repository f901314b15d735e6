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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.fasim.api.State;
import de.fasim.api.Symbols;
import de.fasim.api.UnresolvedReferencePolicy;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.exception.AutomatonFormatException;
import de.fasim.exception.UnresolvedStateException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts deterministic automata to and from the {@link NativeAutomatonDocument native exchange document}, either as
 * a document object or as JSON text.
 * <p>
 * Loading reconstructs the states first, in document order, marking them initial and final by name, and then the
 * transitions. A transition key is split at its <i>first</i> comma, so symbols may contain commas but state names may
 * not. Transitions whose source or target is not a listed state are handled according to the configured {@link
 * UnresolvedReferencePolicy}.
 * <p>
 * Instances are immutable and thread-safe.
 */
public final class NativeFormat {

    public static final char KEY_SEPARATOR = ',';

    private static final Logger LOGGER = LoggerFactory.getLogger(NativeFormat.class);

    private final UnresolvedReferencePolicy unresolvedReferencePolicy;
    private final ObjectMapper mapper;

    public NativeFormat() {
        this(UnresolvedReferencePolicy.SKIP_AND_WARN);
    }

    public NativeFormat(UnresolvedReferencePolicy unresolvedReferencePolicy) {
        this.unresolvedReferencePolicy = Objects.requireNonNull(unresolvedReferencePolicy);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static String transitionKey(String from, String symbol) {
        return from + KEY_SEPARATOR + symbol;
    }

    /**
     * Writes an automaton as a document.
     *
     * @param dfa
     *         the automaton
     *
     * @return the document
     *
     * @throws AutomatonFormatException
     *         if a state name cannot be represented: names must not contain {@link #KEY_SEPARATOR}, and an automaton
     *         without initial state must not have a state with an empty name
     */
    public NativeAutomatonDocument toDocument(DFA dfa) {
        final State initial = dfa.getInitialState();
        final List<String> states = new ArrayList<>(dfa.size());
        final Map<String, String> transitions = new LinkedHashMap<>();

        for (State s : dfa.getStates()) {
            checkEncodable(s.getName(), initial == null);
            states.add(s.getName());
            for (Map.Entry<String, State> e : dfa.getTransitions(s).entrySet()) {
                transitions.put(transitionKey(s.getName(), e.getKey()), e.getValue().getName());
            }
        }

        final List<String> finalStates = new ArrayList<>(dfa.getFinalStates().size());
        for (State s : dfa.getFinalStates()) {
            finalStates.add(s.getName());
        }

        return new NativeAutomatonDocument(new ArrayList<>(dfa.getAlphabet()),
                                           states,
                                           initial == null ? "" : initial.getName(),
                                           finalStates,
                                           transitions);
    }

    /**
     * Reconstructs an automaton from a document.
     *
     * @param document
     *         the document
     *
     * @return the automaton
     *
     * @throws AutomatonFormatException
     *         if the document has no state list, contains a malformed transition key or an epsilon transition
     * @throws UnresolvedStateException
     *         if a transition refers to an unknown state and the policy is {@link UnresolvedReferencePolicy#FAIL_FAST}
     */
    public DFA fromDocument(NativeAutomatonDocument document) {
        return fromDocument(document, unresolvedReferencePolicy);
    }

    /**
     * Reconstructs an automaton from a document, overriding the configured {@link UnresolvedReferencePolicy}.
     *
     * @param document
     *         the document
     * @param policy
     *         how transitions with unknown endpoints are treated
     *
     * @return the automaton
     */
    public DFA fromDocument(NativeAutomatonDocument document, UnresolvedReferencePolicy policy) {
        final List<String> stateNames = document.getStates();
        if (stateNames == null) {
            throw new AutomatonFormatException("Document does not list any states");
        }
        final String initialName = document.getInitialState();
        final Set<String> finalNames = new HashSet<>(nonNull(document.getFinalStates()));

        final DFABuilder builder = new DFABuilder();
        for (String name : stateNames) {
            if (name == null) {
                throw new AutomatonFormatException("State list contains null");
            }
            builder.addState(name, name.equals(initialName), finalNames.contains(name));
        }
        for (String symbol : nonNull(document.getAlphabet())) {
            if (symbol == null) {
                throw new AutomatonFormatException("Alphabet contains null");
            }
            builder.addSymbol(symbol);
        }

        final Map<String, String> transitions = document.getTransitions();
        if (transitions != null) {
            for (Map.Entry<String, String> e : transitions.entrySet()) {
                addTransition(builder, e.getKey(), e.getValue(), policy);
            }
        }

        return builder.build();
    }

    public String toJson(DFA dfa) {
        try {
            return mapper.writeValueAsString(toDocument(dfa));
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Could not serialize automaton", e);
        }
    }

    /**
     * Parses a JSON document and reconstructs the automaton it describes.
     *
     * @param json
     *         the JSON text
     *
     * @return the automaton
     *
     * @throws AutomatonFormatException
     *         if the text is not a well-formed document, see also {@link #fromDocument(NativeAutomatonDocument)}
     */
    public DFA fromJson(String json) {
        final NativeAutomatonDocument document;
        try {
            document = mapper.readValue(json, NativeAutomatonDocument.class);
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Malformed automaton document: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new AutomatonFormatException("Empty automaton document");
        }
        return fromDocument(document);
    }

    private static void addTransition(DFABuilder builder,
                                      String key,
                                      @Nullable String toName,
                                      UnresolvedReferencePolicy policy) {
        final int sep = key.indexOf(KEY_SEPARATOR);
        if (sep < 0) {
            throw new AutomatonFormatException("Malformed transition key '" + key + "', expected 'state,symbol'");
        }
        if (toName == null) {
            throw new AutomatonFormatException("Transition '" + key + "' has no target state");
        }

        final String fromName = key.substring(0, sep);
        final String symbol = key.substring(sep + 1);
        if (Symbols.isEpsilon(symbol)) {
            throw new AutomatonFormatException("Transition '" + key + "' has no symbol");
        }

        final State from = resolve(builder, fromName, key, policy);
        final State to = resolve(builder, toName, key, policy);
        if (from != null && to != null) {
            builder.addTransition(from, symbol, to);
        }
    }

    private static void checkEncodable(String name, boolean withoutInitialState) {
        if (name.indexOf(KEY_SEPARATOR) >= 0) {
            throw new AutomatonFormatException("State name '" + name + "' contains the key separator '" +
                                               KEY_SEPARATOR + '\'');
        }
        if (withoutInitialState && name.isEmpty()) {
            throw new AutomatonFormatException("A state with an empty name cannot be written for an automaton " +
                                               "without initial state");
        }
    }

    private static @Nullable State resolve(DFABuilder builder,
                                          String name,
                                          String key,
                                          UnresolvedReferencePolicy policy) {
        final State state = builder.getStateByName(name);
        if (state == null) {
            if (policy == UnresolvedReferencePolicy.FAIL_FAST) {
                throw new UnresolvedStateException(name, "Transition '" + key + "' refers to unknown state '" +
                                                         name + "'");
            }
            LOGGER.warn("Skipping transition '{}': unknown state '{}'", key, name);
        }
        return state;
    }

    private static List<String> nonNull(@Nullable List<String> list) {
        return list == null ? Collections.emptyList() : list;
    }
}
