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
import java.util.concurrent.atomic.AtomicReference;

/**
 * One discoverable, independently executable test case. The identity (group name, case name, and the resulting
 * fully-qualified name) and the bindings are immutable after creation; the {@link TestStatus status} is mutated only
 * by the runner, following the state machine {@code PENDING -> RUNNING -> {PASSED, FAILED, INCONCLUSIVE}}.
 */
public final class TestUnit {
    private final TestCandidate _definition;
    private final AtomicReference<TestStatus> _status = new AtomicReference<>(TestStatus.PENDING);

    private TestUnit(TestCandidate definition) {
        _definition = definition;
    }

    /**
     * Creates a unit in status {@link TestStatus#PENDING PENDING} from a resolved candidate.
     */
    public static TestUnit of(TestCandidate candidate) {
        if (candidate == null) {
            throw new NullPointerException("candidate");
        }
        return new TestUnit(candidate);
    }

    /**
     * Convenience for the common case of just a body.
     */
    public static TestUnit of(String groupName, String caseName, TestBody body) {
        return new TestUnit(TestCandidate.builder(groupName, caseName).body(body).build());
    }

    public String getGroupName() {
        return _definition.getGroupName();
    }

    public String getCaseName() {
        return _definition.getCaseName();
    }

    public String getFullyQualifiedName() {
        return _definition.getFullyQualifiedName();
    }

    public TestBody getBody() {
        return _definition.getBody();
    }

    /**
     * @return the per-unit set-up, or <code>null</code>.
     */
    public FixtureCallback getSetUp() {
        return _definition.getSetUp();
    }

    /**
     * @return the per-unit tear-down, or <code>null</code>.
     */
    public FixtureCallback getTearDown() {
        return _definition.getTearDown();
    }

    /**
     * @return the group-shared fixture, or <code>null</code>.
     */
    public Fixture getSharedFixture() {
        return _definition.getSharedFixture();
    }

    /**
     * @return the per-unit timeout override, or <code>null</code> to use the runner's default.
     */
    public Duration getTimeout() {
        return _definition.getTimeout();
    }

    /**
     * @return the fault kind the body is declared to raise, or <code>null</code>.
     */
    public Class<? extends Throwable> getExpectedFault() {
        return _definition.getExpectedFault();
    }

    public TestStatus getStatus() {
        return _status.get();
    }

    /**
     * Runner use: {@code PENDING -> RUNNING}.
     *
     * @throws IllegalStateException
     *             if the unit is not {@link TestStatus#PENDING PENDING}.
     */
    public void markRunning() {
        if (!_status.compareAndSet(TestStatus.PENDING, TestStatus.RUNNING)) {
            throw new IllegalStateException("TestUnit [" + getFullyQualifiedName() + "] cannot go to RUNNING from ["
                    + _status.get() + "].");
        }
    }

    /**
     * Runner use: {@code RUNNING -> terminal}.
     *
     * @throws IllegalStateException
     *             if the unit is not {@link TestStatus#RUNNING RUNNING}, or the target is not terminal.
     */
    public void markCompleted(TestStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalStateException("Status [" + terminal + "] is not terminal.");
        }
        if (!_status.compareAndSet(TestStatus.RUNNING, terminal)) {
            throw new IllegalStateException("TestUnit [" + getFullyQualifiedName() + "] cannot go to [" + terminal
                    + "] from [" + _status.get() + "].");
        }
    }

    @Override
    public String toString() {
        return "TestUnit[" + getFullyQualifiedName() + ", " + _status.get() + "]";
    }
}
