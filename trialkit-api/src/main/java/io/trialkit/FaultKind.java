/*
 * Copyright 2015-2025 Endre Stølsvik
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

package io.trialkit;

/**
 * The modelled failure modes of a test unit. Every fault is caught at the unit boundary, none of these terminates the
 * run.
 */
public enum FaultKind {
    /**
     * An expected condition did not hold.
     */
    ASSERTION_FAILED,

    /**
     * A strict mock received an invocation no expectation matched. Surfaced like an assertion failure.
     */
    UNCONFIGURED_INVOCATION,

    /**
     * A set-up or tear-down raised.
     */
    FIXTURE_FAULT,

    /**
     * The unit exceeded its timeout, or the run's global deadline.
     */
    TIMEOUT,

    /**
     * Any other fault propagating out of the test body.
     */
    UNCAUGHT_FAULT
}
