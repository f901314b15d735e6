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

/**
 * What to do when a serialized transition refers to a state that the document does not define.
 */
public enum UnresolvedReferencePolicy {

    /**
     * Drop the transition and log a warning.
     */
    SKIP_AND_WARN,

    /**
     * Abort loading with an {@link de.fasim.exception.UnresolvedStateException}.
     */
    FAIL_FAST
}
