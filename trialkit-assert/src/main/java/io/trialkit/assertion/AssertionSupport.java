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

package io.trialkit.assertion;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.AssertionFailure;
import io.trialkit.ExecutionContext;
import io.trialkit.FaultKind;

/**
 * Entry point for engines building on the Assertion Engine (e.g. mock verification): counts assertions and creates
 * signalled failures, with the source location resolved to the first frame outside the given engine classes.
 * Test code should use {@link Assertions}.
 */
public final class AssertionSupport {
    private static final Logger log = LoggerFactory.getLogger(AssertionSupport.class);

    private AssertionSupport() {
    }

    /**
     * Counts one executed assertion on the current thread's {@link ExecutionContext}, if bound.
     */
    public static void countAssertion() {
        ExecutionContext.current().ifPresent(ExecutionContext::countAssertion);
    }

    /**
     * Creates the structured failure, locating the caller outside the given engine classes (and outside the
     * Assertion Engine itself).
     */
    public static AssertionFailure describe(FaultKind kind, String message, Object expected, Object actual,
            Class<?>... engineClasses) {
        Class<?>[] skip = Arrays.copyOf(engineClasses, engineClasses.length + 3);
        skip[engineClasses.length] = AssertionSupport.class;
        skip[engineClasses.length + 1] = Assertions.class;
        skip[engineClasses.length + 2] = StructuralEquality.class;
        return new AssertionFailure(kind, message, expected, actual, SourceLocation.callerOf(skip));
    }

    /**
     * Creates an {@link FaultKind#ASSERTION_FAILED} failure, signals it to the current context, and returns the
     * error for the caller to throw.
     */
    public static AssertionFailedError failure(String message, Object expected, Object actual, Throwable cause,
            Class<?>... engineClasses) {
        AssertionFailure failure = describe(FaultKind.ASSERTION_FAILED, message, expected, actual, engineClasses);
        if (log.isDebugEnabled()) log.debug("Assertion failed: " + failure);
        AssertionFailedError error = cause == null
                ? new AssertionFailedError(failure)
                : new AssertionFailedError(failure, cause);
        return error.signal();
    }
}
