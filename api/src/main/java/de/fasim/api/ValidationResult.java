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
package de.fasim.api;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The outcome of validating an input string: whether it was accepted, and the trace of the simulation.
 * <p>
 * A rejected string is a regular result, never an error. The trace is empty iff the automaton has no initial state.
 *
 * @param <C>
 *         configuration type of the trace steps
 */
public final class ValidationResult<C> {

    private final boolean accepted;
    private final List<Step<C>> trace;

    public ValidationResult(boolean accepted, List<Step<C>> trace) {
        this.accepted = accepted;
        this.trace = ImmutableList.copyOf(trace);
    }

    public static <C> ValidationResult<C> rejectedWithoutTrace() {
        return new ValidationResult<>(false, ImmutableList.of());
    }

    public boolean isAccepted() {
        return accepted;
    }

    public List<Step<C>> getTrace() {
        return trace;
    }

    public @Nullable Step<C> getLastStep() {
        return trace.isEmpty() ? null : trace.get(trace.size() - 1);
    }

    @Override
    public String toString() {
        return (accepted ? "accepted " : "rejected ") + trace;
    }
}
