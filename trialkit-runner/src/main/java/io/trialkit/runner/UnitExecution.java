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

package io.trialkit.runner;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.trialkit.ExecutionContext;
import io.trialkit.FaultRecord.Phase;
import io.trialkit.FixtureCallback;
import io.trialkit.TestUnit;
import io.trialkit.fixture.FixtureManager;
import io.trialkit.fixture.FixtureOutcome;
import io.trialkit.fixture.SharedFixtureScope;
import io.trialkit.fixture.TearDownGuard;

/**
 * The lifecycle of one {@link TestUnit}, run on its own unit thread so that the supervising thread can enforce the
 * timeout: bind the {@link ExecutionContext}, enter the shared fixture scope if any, then set-up, body and tear-down
 * through the {@link FixtureManager}. Everything the supervisor needs to build the result is published through
 * volatile fields and the completion latch.
 */
class UnitExecution implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(UnitExecution.class);

    private final TestUnit _unit;
    private final SharedFixtureScope _sharedScope;
    private final ExecutionContext _context;
    private final TearDownGuard _tearDownGuard = new TearDownGuard();
    private final CountDownLatch _completed = new CountDownLatch(1);

    private volatile Phase _phase = Phase.SET_UP;
    private volatile boolean _abandoned;
    private volatile Throwable _sharedSetUpFault;
    private volatile boolean _fixtureStarted;
    private volatile FixtureOutcome _outcome;

    UnitExecution(TestUnit unit, SharedFixtureScope sharedScope) {
        _unit = unit;
        _sharedScope = sharedScope;
        _context = new ExecutionContext(unit.getFullyQualifiedName());
    }

    @Override
    public void run() {
        MDC.put(StandardTestRunner.MDC_UNIT, _unit.getFullyQualifiedName());
        _context.bind();
        try {
            // :: Shared fixture of the group, if any.
            if (_sharedScope != null) {
                Throwable sharedSetUpFault;
                try {
                    sharedSetUpFault = _sharedScope.enter();
                }
                catch (InterruptedException e) {
                    // Timed out while waiting for another unit's shared set-up, the supervisor records it.
                    log.info(StandardTestRunner.LOG_PREFIX + "Interrupted while waiting for shared set-up.");
                    Thread.currentThread().interrupt();
                    return;
                }
                if (sharedSetUpFault != null) {
                    _sharedSetUpFault = sharedSetUpFault;
                    return;
                }
                // ?: Did the shared set-up outlast our timeout?
                if (_abandoned) {
                    // -> Yes, the unit is already failed and has left the scope, so the body must not run.
                    log.info(StandardTestRunner.LOG_PREFIX + "Shared set-up returned after the unit was abandoned,"
                            + " not running it.");
                    return;
                }
            }

            // :: The unit's own fixture and body.
            _fixtureStarted = true;
            FixtureCallback setUp = _unit.getSetUp();
            FixtureCallback tearDown = _unit.getTearDown();
            _outcome = FixtureManager.runWithFixture(
                    setUp == null ? null : () -> {
                        _phase = Phase.SET_UP;
                        setUp.run();
                    },
                    () -> {
                        _phase = Phase.TEAR_DOWN;
                        if (tearDown != null) {
                            tearDown.run();
                        }
                    },
                    () -> {
                        _phase = Phase.BODY;
                        if (log.isDebugEnabled()) log.debug(StandardTestRunner.LOG_PREFIX + "Running body.");
                        _unit.getBody().run();
                    },
                    _tearDownGuard);
        }
        finally {
            ExecutionContext.unbind();
            MDC.remove(StandardTestRunner.MDC_UNIT);
            _completed.countDown();
        }
    }

    TestUnit getUnit() {
        return _unit;
    }

    ExecutionContext getContext() {
        return _context;
    }

    TearDownGuard getTearDownGuard() {
        return _tearDownGuard;
    }

    SharedFixtureScope getSharedScope() {
        return _sharedScope;
    }

    /**
     * @return the phase the lifecycle is in, or was in when it ended.
     */
    Phase getPhase() {
        return _phase;
    }

    /**
     * Marks the unit as timed out, so that a lifecycle still waiting on the shared set-up does not go on to the body.
     */
    void abandon() {
        _abandoned = true;
    }

    Throwable getSharedSetUpFault() {
        return _sharedSetUpFault;
    }

    /**
     * @return whether the unit's own set-up was started, i.e. whether its tear-down is owed.
     */
    boolean isFixtureStarted() {
        return _fixtureStarted;
    }

    /**
     * @return the outcome, or <code>null</code> if the lifecycle did not get through the fixture (yet).
     */
    FixtureOutcome getOutcome() {
        return _outcome;
    }

    boolean isCompleted() {
        return _completed.getCount() == 0;
    }

    boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return _completed.await(timeout, unit);
    }

    @Override
    public String toString() {
        return "UnitExecution[" + _unit.getFullyQualifiedName() + ", phase=" + _phase
                + (isCompleted() ? ", completed" : "") + "]";
    }
}
