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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one execution of a {@link TestUnit}. Created once per execution by the runner, never mutated afterwards.
 * <p>
 * Assertion failures (including unconfigured mock invocations) are kept in signalling order. Other faults are kept in
 * the {@link #getFaults() fault list}, whose first element is the primary fault - e.g. if both body and tear-down
 * raised, the body fault comes first and the tear-down fault is appended.
 */
public final class TestResult {
    private final TestUnit _unit;
    private final TestStatus _status;
    private final Duration _elapsed;
    private final List<AssertionFailure> _assertionFailures;
    private final List<FaultRecord> _faults;
    private final int _assertionCount;

    public TestResult(TestUnit unit, TestStatus status, Duration elapsed, List<AssertionFailure> assertionFailures,
            List<FaultRecord> faults, int assertionCount) {
        _unit = Objects.requireNonNull(unit, "unit");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("A TestResult must have a terminal status, not [" + status + "].");
        }
        _status = status;
        _elapsed = Objects.requireNonNull(elapsed, "elapsed");
        _assertionFailures = Collections.unmodifiableList(new ArrayList<>(assertionFailures));
        _faults = Collections.unmodifiableList(new ArrayList<>(faults));
        _assertionCount = assertionCount;
    }

    public TestUnit getUnit() {
        return _unit;
    }

    public String getFullyQualifiedName() {
        return _unit.getFullyQualifiedName();
    }

    public TestStatus getStatus() {
        return _status;
    }

    public Duration getElapsed() {
        return _elapsed;
    }

    public List<AssertionFailure> getAssertionFailures() {
        return _assertionFailures;
    }

    public List<FaultRecord> getFaults() {
        return _faults;
    }

    /**
     * @return the primary (first) non-assertion fault, i.e. the uncaught-fault record, if any.
     */
    public Optional<FaultRecord> getPrimaryFault() {
        return _faults.isEmpty() ? Optional.empty() : Optional.of(_faults.get(0));
    }

    /**
     * @return the first fault of the given kind, if any.
     */
    public Optional<FaultRecord> getFault(FaultKind kind) {
        return _faults.stream().filter(f -> f.getKind() == kind).findFirst();
    }

    public int getAssertionCount() {
        return _assertionCount;
    }

    /**
     * @return a one-line description of why this result failed, or <code>null</code> if it did not fail.
     */
    public String describeFailure() {
        if (_status != TestStatus.FAILED) {
            return null;
        }
        StringBuilder buf = new StringBuilder();
        if (!_faults.isEmpty()) {
            buf.append(_faults.get(0));
        }
        if (!_assertionFailures.isEmpty()) {
            if (buf.length() > 0) {
                buf.append("; ");
            }
            buf.append(_assertionFailures.get(0).getKind()).append(": ").append(_assertionFailures.get(0));
        }
        int shown = (_faults.isEmpty() ? 0 : 1) + (_assertionFailures.isEmpty() ? 0 : 1);
        int total = _faults.size() + _assertionFailures.size();
        if (total > shown) {
            buf.append(" (+").append(total - shown).append(" more)");
        }
        return buf.toString();
    }

    @Override
    public String toString() {
        return "TestResult[" + getFullyQualifiedName() + ", " + _status + ", " + _elapsed.toMillis() + " ms, "
                + _assertionCount + " assertions, " + _assertionFailures.size() + " assertion failures, "
                + _faults.size() + " faults]";
    }
}
