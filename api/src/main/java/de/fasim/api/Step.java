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

import java.util.Objects;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A single step of a simulation trace.
 * <p>
 * A step records the configuration of the automaton after {@link #getPosition() position} symbols have been read,
 * together with the part of the input that is still to be read. For deterministic automata the configuration is the
 * current {@link State}, or {@code null} if the automaton got stuck on the last symbol. For non-deterministic automata
 * it is the set of active states.
 *
 * @param <C>
 *         configuration type
 */
public final class Step<C> {

    private final @Nullable C configuration;
    private final int position;
    private final String remaining;

    public Step(@Nullable C configuration, int position, String remaining) {
        this.configuration = configuration;
        this.position = position;
        this.remaining = Objects.requireNonNull(remaining, "remaining");
    }

    public @Nullable C getConfiguration() {
        return configuration;
    }

    /**
     * Returns the number of input symbols read when this step was recorded.
     *
     * @return the number of consumed symbols
     */
    public int getPosition() {
        return position;
    }

    /**
     * Returns the suffix of the input that has not been read yet.
     *
     * @return the remaining input
     */
    public String getRemaining() {
        return remaining;
    }

    /**
     * Whether this step marks a dead end, i.e. the automaton had no transition for the last symbol read.
     *
     * @return {@code true} iff the step has no configuration
     */
    public boolean isStuck() {
        return configuration == null;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Step<?> that = (Step<?>) o;
        return position == that.position && Objects.equals(configuration, that.configuration) &&
               remaining.equals(that.remaining);
    }

    @Override
    public int hashCode() {
        return Objects.hash(configuration, position, remaining);
    }

    @Override
    public String toString() {
        return "(" + configuration + ", " + position + ", '" + remaining + "')";
    }
}
