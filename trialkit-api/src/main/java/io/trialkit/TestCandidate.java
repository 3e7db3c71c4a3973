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
import java.util.Objects;

/**
 * An already-resolved test candidate as supplied by a {@link DiscoverySource}: group name and case name, the callable
 * body, and optional set-up/tear-down bindings. The runner turns candidates into {@link TestUnit}s, it never parses
 * source.
 */
public final class TestCandidate {
    private final String _groupName;
    private final String _caseName;
    private final TestBody _body;
    private final FixtureCallback _setUp;
    private final FixtureCallback _tearDown;
    private final Fixture _sharedFixture;
    private final Duration _timeout;
    private final Class<? extends Throwable> _expectedFault;

    private TestCandidate(Builder builder) {
        _groupName = builder._groupName;
        _caseName = builder._caseName;
        _body = builder._body;
        _setUp = builder._setUp;
        _tearDown = builder._tearDown;
        _sharedFixture = builder._sharedFixture;
        _timeout = builder._timeout;
        _expectedFault = builder._expectedFault;
    }

    public static Builder builder(String groupName, String caseName) {
        return new Builder(groupName, caseName);
    }

    public String getGroupName() {
        return _groupName;
    }

    public String getCaseName() {
        return _caseName;
    }

    /**
     * @return <code>groupName + "." + caseName</code>.
     */
    public String getFullyQualifiedName() {
        return _groupName + "." + _caseName;
    }

    public TestBody getBody() {
        return _body;
    }

    public FixtureCallback getSetUp() {
        return _setUp;
    }

    public FixtureCallback getTearDown() {
        return _tearDown;
    }

    public Fixture getSharedFixture() {
        return _sharedFixture;
    }

    public Duration getTimeout() {
        return _timeout;
    }

    public Class<? extends Throwable> getExpectedFault() {
        return _expectedFault;
    }

    public static final class Builder {
        private final String _groupName;
        private final String _caseName;
        private TestBody _body;
        private FixtureCallback _setUp;
        private FixtureCallback _tearDown;
        private Fixture _sharedFixture;
        private Duration _timeout;
        private Class<? extends Throwable> _expectedFault;

        private Builder(String groupName, String caseName) {
            _groupName = requireName(groupName, "groupName");
            _caseName = requireName(caseName, "caseName");
        }

        public Builder body(TestBody body) {
            _body = Objects.requireNonNull(body, "body");
            return this;
        }

        public Builder setUp(FixtureCallback setUp) {
            _setUp = setUp;
            return this;
        }

        public Builder tearDown(FixtureCallback tearDown) {
            _tearDown = tearDown;
            return this;
        }

        /**
         * Binds a fixture: a {@link Fixture#isShared() shared} one becomes the group-shared fixture of this
         * candidate, a per-unit one supplies the set-up and tear-down.
         */
        public Builder fixture(Fixture fixture) {
            Objects.requireNonNull(fixture, "fixture");
            if (fixture.isShared()) {
                _sharedFixture = fixture;
            }
            else {
                _setUp = fixture.getSetUp();
                _tearDown = fixture.getTearDown();
            }
            return this;
        }

        /**
         * Overrides the runner's default per-unit timeout for this candidate.
         */
        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive, was [" + timeout + "].");
            }
            _timeout = timeout;
            return this;
        }

        /**
         * Declares that the body is expected to raise exactly this fault kind: if it does, that counts as one held
         * assertion, if it does not, the unit fails.
         */
        public Builder expectedFault(Class<? extends Throwable> expectedFault) {
            _expectedFault = expectedFault;
            return this;
        }

        public TestCandidate build() {
            if (_body == null) {
                throw new IllegalStateException("Candidate [" + _groupName + "." + _caseName + "] has no body.");
            }
            return new TestCandidate(this);
        }

        private static String requireName(String name, String what) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException(what + " must be non-empty.");
            }
            return name;
        }
    }

    @Override
    public String toString() {
        return "TestCandidate[" + getFullyQualifiedName() + "]";
    }
}
