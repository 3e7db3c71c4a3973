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

package io.trialkit.fixture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.trialkit.FaultRecord.Phase;

/**
 * What happened in one {@link FixtureManager#runWithFixture(io.trialkit.FixtureCallback, io.trialkit.FixtureCallback,
 * io.trialkit.TestBody) runWithFixture(..)}: the fault of each phase, if any, and which phases ran. Immutable.
 * <p>
 * Faults are kept raw: deciding whether a body fault is an assertion failure, the declared expected fault, or an
 * uncaught fault is up to the caller.
 */
public final class FixtureOutcome {
    private final Throwable _setUpFault;
    private final boolean _bodyRan;
    private final Throwable _bodyFault;
    private final boolean _tearDownRan;
    private final Throwable _tearDownFault;

    FixtureOutcome(Throwable setUpFault, boolean bodyRan, Throwable bodyFault, boolean tearDownRan,
            Throwable tearDownFault) {
        _setUpFault = setUpFault;
        _bodyRan = bodyRan;
        _bodyFault = bodyFault;
        _tearDownRan = tearDownRan;
        _tearDownFault = tearDownFault;
    }

    public Throwable getSetUpFault() {
        return _setUpFault;
    }

    /**
     * @return whether the body was invoked, i.e. set-up completed normally.
     */
    public boolean isBodyRan() {
        return _bodyRan;
    }

    public Throwable getBodyFault() {
        return _bodyFault;
    }

    /**
     * @return whether this lifecycle ran the tear-down itself, <code>false</code> if it had already been claimed by
     *         someone else through the {@link TearDownGuard}.
     */
    public boolean isTearDownRan() {
        return _tearDownRan;
    }

    public Throwable getTearDownFault() {
        return _tearDownFault;
    }

    /**
     * @return whether no phase raised a fault.
     */
    public boolean isClean() {
        return _setUpFault == null && _bodyFault == null && _tearDownFault == null;
    }

    /**
     * @return the primary fault: the set-up fault, else the body fault, else the tear-down fault, or
     *         <code>null</code>.
     */
    public Throwable getPrimaryFault() {
        if (_setUpFault != null) {
            return _setUpFault;
        }
        return _bodyFault != null ? _bodyFault : _tearDownFault;
    }

    /**
     * @return the phases that raised a fault, in lifecycle order.
     */
    public List<Phase> getFaultedPhases() {
        List<Phase> phases = new ArrayList<>(3);
        if (_setUpFault != null) {
            phases.add(Phase.SET_UP);
        }
        if (_bodyFault != null) {
            phases.add(Phase.BODY);
        }
        if (_tearDownFault != null) {
            phases.add(Phase.TEAR_DOWN);
        }
        return Collections.unmodifiableList(phases);
    }

    @Override
    public String toString() {
        return "FixtureOutcome[" + (isClean() ? "clean" : "faulted=" + getFaultedPhases())
                + (_bodyRan ? "" : ", body skipped") + "]";
    }
}
