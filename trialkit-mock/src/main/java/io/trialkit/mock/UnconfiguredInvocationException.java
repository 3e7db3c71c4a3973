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

package io.trialkit.mock;

import io.trialkit.AssertionFailure;
import io.trialkit.FaultKind;
import io.trialkit.assertion.AssertionFailedError;

/**
 * Raised by a {@link MockMode#STRICT STRICT} {@link Mock} when an invocation matches no {@link Expectation}. Surfaces
 * exactly like an assertion failure: it is signalled to the bound execution context before being thrown, so the test
 * case fails even if the code under test catches it.
 */
public class UnconfiguredInvocationException extends AssertionFailedError {
    private final transient Invocation _invocation;

    UnconfiguredInvocationException(AssertionFailure failure, Invocation invocation) {
        super(failure);
        if (failure.getKind() != FaultKind.UNCONFIGURED_INVOCATION) {
            throw new IllegalArgumentException("Failure must be of kind UNCONFIGURED_INVOCATION, was ["
                    + failure.getKind() + "].");
        }
        _invocation = invocation;
    }

    /**
     * @return the logged, unmatched invocation.
     */
    public Invocation getInvocation() {
        return _invocation;
    }
}
