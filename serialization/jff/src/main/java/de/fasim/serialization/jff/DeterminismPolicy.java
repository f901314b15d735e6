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

/**
 * Controls how {@link JFFReader#readDFA(String, DeterminismPolicy)} treats documents that do not describe a
 * deterministic automaton.
 */
public enum DeterminismPolicy {

    /**
     * Epsilon transitions and a second destination for the same state and symbol are format errors.
     */
    REJECT_NONDETERMINISM,

    /**
     * Forces the document into a deterministic automaton. Epsilon transitions are dropped and a later transition for
     * the same state and symbol replaces the earlier one. Every lost transition is logged.
     */
    LAST_TRANSITION_WINS
}
