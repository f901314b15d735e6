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
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import de.fasim.algorithm.subset.SubsetConstruction;
import de.fasim.api.State;
import de.fasim.api.Symbols;
import de.fasim.api.UnresolvedReferencePolicy;
import de.fasim.datastructure.automaton.AbstractAutomatonBuilder;
import de.fasim.datastructure.automaton.DFA;
import de.fasim.datastructure.automaton.DFABuilder;
import de.fasim.datastructure.automaton.NFA;
import de.fasim.datastructure.automaton.NFABuilder;
import de.fasim.exception.AutomatonFormatException;
import de.fasim.exception.UnresolvedStateException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Reads automata from JFF documents as written by JFLAP.
 * <p>
 * A document lists {@code state} elements, each with an {@code id} attribute, an optional {@code name} attribute
 * (defaulting to the id) and optional {@code initial} and {@code final} marker elements, and {@code transition}
 * elements with {@code from}, {@code to} and an optional {@code read} child. An absent or empty {@code read} denotes
 * an epsilon transition. Both element kinds are found at any depth of the document. Transitions refer to states by id;
 * references to unknown ids are handled according to the configured {@link UnresolvedReferencePolicy}.
 * <p>
 * Document type declarations are refused, so no external entity is ever resolved.
 */
public final class JFFReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(JFFReader.class);

    private static final String STATE = "state";
    private static final String TRANSITION = "transition";
    private static final String ID = "id";
    private static final String NAME = "name";
    private static final String INITIAL = "initial";
    private static final String FINAL = "final";
    private static final String FROM = "from";
    private static final String TO = "to";
    private static final String READ = "read";

    private final UnresolvedReferencePolicy unresolvedReferencePolicy;

    public JFFReader() {
        this(UnresolvedReferencePolicy.SKIP_AND_WARN);
    }

    public JFFReader(UnresolvedReferencePolicy unresolvedReferencePolicy) {
        this.unresolvedReferencePolicy = Objects.requireNonNull(unresolvedReferencePolicy);
    }

    public NFA readNFA(String document) {
        return readNFA(parse(new InputSource(new StringReader(document))));
    }

    public NFA readNFA(InputStream document) {
        return readNFA(parse(new InputSource(document)));
    }

    /**
     * Reads a deterministic automaton.
     *
     * @param document
     *         the JFF document
     * @param policy
     *         how epsilon transitions and competing destinations are treated
     *
     * @return the automaton
     *
     * @throws AutomatonFormatException
     *         if the document is malformed, or is nondeterministic under {@link DeterminismPolicy#REJECT_NONDETERMINISM}
     */
    public DFA readDFA(String document, DeterminismPolicy policy) {
        return readDFA(parse(new InputSource(new StringReader(document))), policy);
    }

    public DFA readDFA(InputStream document, DeterminismPolicy policy) {
        return readDFA(parse(new InputSource(document)), policy);
    }

    /**
     * Reads the document as a nondeterministic automaton and determinizes it.
     *
     * @param document
     *         the JFF document
     *
     * @return the automaton as read and its determinization
     */
    public JFFImport readAndDeterminize(String document) {
        final NFA nfa = readNFA(document);
        return new JFFImport(nfa, SubsetConstruction.determinizeWithSubsets(nfa));
    }

    private NFA readNFA(Document document) {
        final NFABuilder builder = new NFABuilder();
        final Map<String, State> states = readStates(document, builder);

        for (TransitionElement t : readTransitions(document)) {
            final State from = resolve(states, t.from);
            final State to = resolve(states, t.to);
            if (from != null && to != null) {
                builder.addTransition(from, t.symbol, to);
            }
        }

        return builder.build();
    }

    private DFA readDFA(Document document, DeterminismPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        final DFABuilder builder = new DFABuilder();
        final Map<String, State> states = readStates(document, builder);

        for (TransitionElement t : readTransitions(document)) {
            final State from = resolve(states, t.from);
            final State to = resolve(states, t.to);
            if (from == null || to == null) {
                continue;
            }

            if (Symbols.isEpsilon(t.symbol)) {
                if (policy == DeterminismPolicy.REJECT_NONDETERMINISM) {
                    throw new AutomatonFormatException("Epsilon transition " + t + " in a deterministic automaton");
                }
                LOGGER.warn("Dropping epsilon transition {}", t);
                continue;
            }

            final State previous = builder.getSuccessor(from, t.symbol);
            if (previous != null && previous.getId() != to.getId()) {
                if (policy == DeterminismPolicy.REJECT_NONDETERMINISM) {
                    throw new AutomatonFormatException(
                            "State '" + from + "' has several successors for symbol '" + t.symbol + '\'');
                }
                LOGGER.warn("Transition {} replaces {} -{}-> {}", t, from, t.symbol, previous);
            }
            builder.addTransition(from, t.symbol, to);
        }

        return builder.build();
    }

    private static Map<String, State> readStates(Document document, AbstractAutomatonBuilder<?> builder) {
        final NodeList elements = document.getElementsByTagName(STATE);
        final Map<String, State> result = new HashMap<>();

        for (int i = 0; i < elements.getLength(); i++) {
            final Element element = (Element) elements.item(i);
            if (!element.hasAttribute(ID)) {
                throw new AutomatonFormatException("State element without '" + ID + "' attribute");
            }
            final String id = element.getAttribute(ID);
            final String name = element.hasAttribute(NAME) ? element.getAttribute(NAME) : id;

            final State state = builder.addState(name,
                                                 firstChild(element, INITIAL) != null,
                                                 firstChild(element, FINAL) != null);
            if (result.put(id, state) != null) {
                throw new AutomatonFormatException("Duplicate state id '" + id + '\'');
            }
        }

        return result;
    }

    private static List<TransitionElement> readTransitions(Document document) {
        final NodeList elements = document.getElementsByTagName(TRANSITION);
        final List<TransitionElement> result = new ArrayList<>(elements.getLength());

        for (int i = 0; i < elements.getLength(); i++) {
            final Element element = (Element) elements.item(i);
            final Element from = firstChild(element, FROM);
            final Element to = firstChild(element, TO);
            if (from == null || to == null) {
                throw new AutomatonFormatException("Transition element without '" + FROM + "' or '" + TO + '\'');
            }
            final Element read = firstChild(element, READ);
            final String symbol = read == null ? Symbols.EPSILON : read.getTextContent();

            result.add(new TransitionElement(from.getTextContent().trim(), to.getTextContent().trim(), symbol));
        }

        return result;
    }

    private @Nullable State resolve(Map<String, State> states, String id) {
        final State state = states.get(id);
        if (state == null) {
            if (unresolvedReferencePolicy == UnresolvedReferencePolicy.FAIL_FAST) {
                throw new UnresolvedStateException(id, "Transition refers to unknown state id '" + id + '\'');
            }
            LOGGER.warn("Skipping transition: unknown state id '{}'", id);
        }
        return state;
    }

    private static @Nullable Element firstChild(Element parent, String tagName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && tagName.equals(n.getNodeName())) {
                return (Element) n;
            }
        }
        return null;
    }

    private static Document parse(InputSource source) {
        try {
            return newDocumentBuilder().parse(source);
        } catch (SAXException | IOException e) {
            throw new AutomatonFormatException("Malformed JFF document: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);

            final DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {

                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.debug("JFF parser warning", exception);
                }

                @Override
                public void error(SAXParseException exception) throws SAXException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXException {
                    throw exception;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static final class TransitionElement {

        private final String from;
        private final String to;
        private final String symbol;

        TransitionElement(String from, String to, String symbol) {
            this.from = from;
            this.to = to;
            this.symbol = symbol;
        }

        @Override
        public String toString() {
            return from + " -" + (Symbols.isEpsilon(symbol) ? Symbols.EPSILON_DISPLAY : symbol) + "-> " + to;
        }
    }
}
