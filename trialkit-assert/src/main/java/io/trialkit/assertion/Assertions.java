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

import io.trialkit.AssertionFailure;
import io.trialkit.ExecutionContext;
import io.trialkit.assertion.StructuralEquality.Comparison;
import io.trialkit.assertion.StructuralEquality.Outcome;

/**
 * The Assertion Engine: comparison predicates that either return normally (the assertion held), or create an
 * {@link AssertionFailure}, signal it to the current thread's {@link ExecutionContext}, and throw it as an
 * {@link AssertionFailedError}. The throw makes the first failing assertion halt the rest of the test body
 * (fail-fast); the runner catches it at the unit boundary and goes on with the next unit.
 * <p>
 * Every invocation counts as one executed assertion on the bound context, whatever its outcome - a unit that completes
 * without any is reported as inconclusive.
 * <p>
 * Equality is {@link StructuralEquality structural}: field by field for composites, by value for primitives, and
 * never by implicit coercion across incompatible kinds - <code>assertEqual(1, 1L)</code> fails, it neither passes nor
 * throws something unrelated.
 * <p>
 * Thread-safety: stateless, and never blocks.
 */
public final class Assertions {
    private Assertions() {
    }

    public static void assertEqual(Object expected, Object actual) {
        assertEqual(expected, actual, null);
    }

    public static void assertEqual(Object expected, Object actual, String message) {
        countAssertion();
        Comparison comparison = StructuralEquality.compare(expected, actual);
        if (!comparison.isEqual()) {
            throw failure(message, comparison.describe(), expected, actual, null);
        }
    }

    public static void assertNotEqual(Object unexpected, Object actual) {
        assertNotEqual(unexpected, actual, null);
    }

    public static void assertNotEqual(Object unexpected, Object actual, String message) {
        countAssertion();
        Comparison comparison = StructuralEquality.compare(unexpected, actual);
        if (comparison.isEqual()) {
            throw failure(message, "expected values to differ, but both were <"
                    + StructuralEquality.render(actual) + ">", unexpected, actual, null);
        }
        if (comparison.getOutcome() == Outcome.INCOMPATIBLE) {
            throw failure(message, "cannot compare, " + comparison.describe(), unexpected, actual, null);
        }
    }

    public static void assertTrue(boolean condition) {
        assertTrue(condition, null);
    }

    public static void assertTrue(boolean condition, String message) {
        countAssertion();
        if (!condition) {
            throw failure(message, "expected condition to be true", true, false, null);
        }
    }

    public static void assertFalse(boolean condition) {
        assertFalse(condition, null);
    }

    public static void assertFalse(boolean condition, String message) {
        countAssertion();
        if (condition) {
            throw failure(message, "expected condition to be false", false, true, null);
        }
    }

    public static void assertNull(Object actual) {
        assertNull(actual, null);
    }

    public static void assertNull(Object actual, String message) {
        countAssertion();
        if (actual != null) {
            throw failure(message, "expected <null> but was <" + StructuralEquality.render(actual) + ">", null,
                    actual, null);
        }
    }

    public static void assertNotNull(Object actual) {
        assertNotNull(actual, null);
    }

    public static void assertNotNull(Object actual, String message) {
        countAssertion();
        if (actual == null) {
            throw failure(message, "expected a non-null value", "<non-null>", null, null);
        }
    }

    public static <T extends Throwable> T assertThrows(Class<T> expectedFaultKind, ThrowingCallable callable) {
        return assertThrows(expectedFaultKind, callable, null);
    }

    /**
     * Holds only if the callable raises a fault of <i>exactly</i> the expected class - a subclass does not count.
     * Any other fault, or no fault at all, fails with "expected fault X, got fault Y" respectively
     * "expected fault X, no fault raised".
     * <p>
     * If the raised fault was a failure signalled inside the callable (e.g. when asserting that some assertion fails),
     * and it is the expected one, the signal is withdrawn: it has been consumed here.
     *
     * @return the raised fault, for further assertions.
     */
    public static <T extends Throwable> T assertThrows(Class<T> expectedFaultKind, ThrowingCallable callable,
            String message) {
        countAssertion();
        try {
            callable.call();
        }
        catch (Throwable t) {
            // ?: Is it exactly the expected kind?
            if (t.getClass() == expectedFaultKind) {
                // -> Yes, so the assertion holds. If this was a signalled failure, it is consumed now.
                ExecutionContext.current().ifPresent(ctx -> ctx.withdraw(t));
                return expectedFaultKind.cast(t);
            }
            // E-> No, some other fault.
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw failure(message, "expected fault " + expectedFaultKind.getName() + ", got fault "
                    + t.getClass().getName(), expectedFaultKind, t, t);
        }
        throw failure(message, "expected fault " + expectedFaultKind.getName() + ", no fault raised",
                expectedFaultKind, null, null);
    }

    /**
     * Fails unconditionally.
     */
    public static AssertionFailedError fail(String message) {
        countAssertion();
        throw failure(null, message, null, null, null);
    }

    private static void countAssertion() {
        AssertionSupport.countAssertion();
    }

    private static AssertionFailedError failure(String message, String detail, Object expected, Object actual,
            Throwable cause) {
        String fullMessage = message == null ? detail : message + " - " + detail;
        return AssertionSupport.failure(fullMessage, expected, actual, cause);
    }
}
