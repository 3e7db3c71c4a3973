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
 * A paired set-up and tear-down. A fixture is either scoped per {@link TestUnit} (the default), or - only if explicitly
 * created with {@link #shared(FixtureCallback, FixtureCallback)} - shared across all units of a group referencing the
 * same instance, in which case set-up runs once before the first such unit and tear-down once after the last.
 * <p>
 * Sharing reintroduces coupling between the units of a group, which is why it is opt-in only.
 */
public final class Fixture {
    private final String _name;
    private final FixtureCallback _setUp;
    private final FixtureCallback _tearDown;
    private final boolean _shared;

    private Fixture(String name, FixtureCallback setUp, FixtureCallback tearDown, boolean shared) {
        _name = name;
        _setUp = setUp;
        _tearDown = tearDown;
        _shared = shared;
    }

    /**
     * Creates a per-unit fixture. Either callback may be <code>null</code>.
     */
    public static Fixture perUnit(FixtureCallback setUp, FixtureCallback tearDown) {
        return new Fixture("perUnit", setUp, tearDown, false);
    }

    /**
     * Creates a group-shared fixture. Either callback may be <code>null</code>.
     */
    public static Fixture shared(FixtureCallback setUp, FixtureCallback tearDown) {
        return shared("shared", setUp, tearDown);
    }

    /**
     * Creates a named group-shared fixture, the name only being used for logging and fault messages.
     */
    public static Fixture shared(String name, FixtureCallback setUp, FixtureCallback tearDown) {
        return new Fixture(Objects.requireNonNull(name, "name"), setUp, tearDown, true);
    }

    public String getName() {
        return _name;
    }

    /**
     * @return the set-up callback, or <code>null</code> if none.
     */
    public FixtureCallback getSetUp() {
        return _setUp;
    }

    /**
     * @return the tear-down callback, or <code>null</code> if none.
     */
    public FixtureCallback getTearDown() {
        return _tearDown;
    }

    public boolean isShared() {
        return _shared;
    }

    @Override
    public String toString() {
        return "Fixture[" + _name + (_shared ? ", shared" : "") + "]@"
                + Integer.toHexString(System.identityHashCode(this));
    }
}
