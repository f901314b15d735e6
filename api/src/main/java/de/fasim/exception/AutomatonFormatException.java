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
package de.fasim.exception;

// Thrown when a serialized automaton cannot be turned into an automaton. No partial automaton is ever returned.
public class AutomatonFormatException extends RuntimeException {

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String, Throwable)
     */
    public AutomatonFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructor.
     *
     * @see RuntimeException#RuntimeException(String)
     */
    public AutomatonFormatException(String message) {
        super(message);
    }

}
