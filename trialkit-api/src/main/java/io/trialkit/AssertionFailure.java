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

import java.util.Objects;

/**
 * Immutable description of an expected condition that did not hold: human-readable message, the expected and the
 * actual value, and the source location of the failing assertion (the first stack frame outside of trialkit itself).
 */
public final class AssertionFailure {
    private final FaultKind _kind;
    private final String _message;
    private final Object _expected;
    private final Object _actual;
    private final StackTraceElement _location;

    public AssertionFailure(FaultKind kind, String message, Object expected, Object actual,
            StackTraceElement location) {
        if (kind != FaultKind.ASSERTION_FAILED && kind != FaultKind.UNCONFIGURED_INVOCATION) {
            throw new IllegalArgumentException("An AssertionFailure is either " + FaultKind.ASSERTION_FAILED
                    + " or " + FaultKind.UNCONFIGURED_INVOCATION + ", not [" + kind + "].");
        }
        _kind = kind;
        _message = Objects.requireNonNull(message, "message");
        _expected = expected;
        _actual = actual;
        _location = location;
    }

    /**
     * @return {@link FaultKind#ASSERTION_FAILED} or {@link FaultKind#UNCONFIGURED_INVOCATION}.
     */
    public FaultKind getKind() {
        return _kind;
    }

    public String getMessage() {
        return _message;
    }

    public Object getExpected() {
        return _expected;
    }

    public Object getActual() {
        return _actual;
    }

    /**
     * @return the source location of the failing assertion, or <code>null</code> if it could not be determined.
     */
    public StackTraceElement getLocation() {
        return _location;
    }

    @Override
    public String toString() {
        return _message + (_location != null ? " (at " + _location + ")" : "");
    }
}
