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
 * Lifecycle status of a {@link TestUnit}: {@code PENDING -> RUNNING -> {PASSED, FAILED, INCONCLUSIVE}}.
 */
public enum TestStatus {
    PENDING,

    RUNNING,

    PASSED,

    FAILED,

    /**
     * The unit completed without failing, but also without executing a single assertion - it proves nothing.
     */
    INCONCLUSIVE;

    /**
     * @return whether this is one of the three terminal states.
     */
    public boolean isTerminal() {
        return this == PASSED || this == FAILED || this == INCONCLUSIVE;
    }
}
