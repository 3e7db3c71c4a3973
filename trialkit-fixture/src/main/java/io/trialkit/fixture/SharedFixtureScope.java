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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.Fixture;

/**
 * The lifetime of one {@link Fixture#isShared() shared} fixture within one group: set-up runs once, before the first
 * unit of the group that uses it, and tear-down once, after the last one. Thread-safe: units entering concurrently
 * wait for the one running the set-up.
 * <p>
 * Each of the <code>unitCount</code> units must {@link #leave()} exactly once, whether it {@link #enter() entered} or
 * never started. Neither set-up nor tear-down runs under the lock, so {@link #leave()} only blocks for as long as the
 * tear-down it may run itself takes. The tear-down runs on the thread making the last leave, and only if set-up was
 * attempted - unless set-up is still running then, in which case the thread running the set-up runs the tear-down
 * when set-up returns.
 * <p>
 * A unit abandoned after its timeout leaves on behalf of its still running unit thread, so the fixture can be torn
 * down while that thread still uses it.
 */
public final class SharedFixtureScope {
    private static final Logger log = LoggerFactory.getLogger(SharedFixtureScope.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    private enum SetUpState {
        NOT_STARTED, RUNNING, DONE
    }

    private final String _groupName;
    private final Fixture _fixture;
    private final ReentrantLock _lock = new ReentrantLock();
    private final Condition _setUpDone = _lock.newCondition();

    // :: Guarded by _lock
    private int _remaining;
    private SetUpState _setUpState = SetUpState.NOT_STARTED;
    private Throwable _setUpFault;
    private boolean _tearDownDeferred;
    private boolean _tornDown;

    public SharedFixtureScope(String groupName, Fixture fixture, int unitCount) {
        if (!fixture.isShared()) {
            throw new IllegalArgumentException("Fixture [" + fixture + "] is not shared.");
        }
        if (unitCount < 1) {
            throw new IllegalArgumentException("unitCount must be >= 1, was [" + unitCount + "].");
        }
        _groupName = groupName;
        _fixture = fixture;
        _remaining = unitCount;
    }

    /**
     * Enters the scope, running the set-up if this is the first unit to enter.
     *
     * @return the set-up fault, or <code>null</code> if set-up completed normally - the same fault is returned to
     *         every unit entering.
     * @throws InterruptedException
     *             if interrupted while waiting for another unit running the set-up.
     */
    public Throwable enter() throws InterruptedException {
        _lock.lockInterruptibly();
        try {
            if (_tornDown) {
                throw new IllegalStateException("Shared fixture [" + _fixture.getName() + "] of group ["
                        + _groupName + "] is already torn down.");
            }
            // ?: Has set-up been started by another unit?
            if (_setUpState != SetUpState.NOT_STARTED) {
                // -> Yes, so wait for it to be done. Bounded by the supervisor interrupting us on timeout.
                while (_setUpState == SetUpState.RUNNING) {
                    _setUpDone.await();
                }
                return _setUpFault;
            }
            // E-> We run the set-up.
            _setUpState = SetUpState.RUNNING;
        }
        finally {
            _lock.unlock();
        }

        Throwable setUpFault = runSetUp();

        boolean tearDownNow;
        _lock.lock();
        try {
            _setUpFault = setUpFault;
            _setUpState = SetUpState.DONE;
            _setUpDone.signalAll();
            tearDownNow = _tearDownDeferred;
        }
        finally {
            _lock.unlock();
        }
        // ?: Did every unit leave while we were setting up?
        if (tearDownNow) {
            // -> Yes, so the tear-down was left to us. Nobody is left to report a fault to.
            log.info(LOG_PREFIX + "Every unit of group [" + _groupName + "] left while shared fixture ["
                    + _fixture.getName() + "] was being set up, running the deferred tear-down.");
            runTearDown();
        }
        return setUpFault;
    }

    /**
     * Leaves the scope, running the tear-down if this is the last unit to leave and set-up has completed.
     *
     * @return the tear-down fault if this call ran the tear-down and it raised, otherwise <code>null</code>.
     */
    public Throwable leave() {
        _lock.lock();
        try {
            if (_remaining == 0) {
                throw new IllegalStateException("More units left shared fixture [" + _fixture.getName()
                        + "] of group [" + _groupName + "] than it was created for.");
            }
            _remaining--;
            if (_remaining > 0 || _setUpState == SetUpState.NOT_STARTED) {
                return null;
            }
            _tornDown = true;
            // ?: Is the set-up still running, i.e. the unit running it was abandoned?
            if (_setUpState == SetUpState.RUNNING) {
                // -> Yes, so the thread running it must run the tear-down when, and if, it returns.
                log.warn(LOG_PREFIX + "Last unit of group [" + _groupName + "] left while shared fixture ["
                        + _fixture.getName() + "] is still being set up, deferring its tear-down.");
                _tearDownDeferred = true;
                return null;
            }
        }
        finally {
            _lock.unlock();
        }
        return runTearDown();
    }

    private Throwable runSetUp() {
        log.info(LOG_PREFIX + "Setting up shared fixture [" + _fixture.getName() + "] for group ["
                + _groupName + "].");
        if (_fixture.getSetUp() == null) {
            return null;
        }
        try {
            _fixture.getSetUp().run();
            return null;
        }
        catch (Throwable t) {
            log.warn(LOG_PREFIX + "Set-up of shared fixture [" + _fixture.getName() + "] for group ["
                    + _groupName + "] raised [" + t.getClass().getSimpleName()
                    + "], every unit of the group will fail.", t);
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return t;
        }
    }

    private Throwable runTearDown() {
        log.info(LOG_PREFIX + "Tearing down shared fixture [" + _fixture.getName() + "] for group ["
                + _groupName + "].");
        if (_fixture.getTearDown() == null) {
            return null;
        }
        boolean interrupted = Thread.interrupted();
        try {
            _fixture.getTearDown().run();
            return null;
        }
        catch (Throwable t) {
            log.warn(LOG_PREFIX + "Tear-down of shared fixture [" + _fixture.getName() + "] for group ["
                    + _groupName + "] raised [" + t.getClass().getSimpleName() + "].", t);
            if (t instanceof InterruptedException) {
                interrupted = true;
            }
            return t;
        }
        finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public String getGroupName() {
        return _groupName;
    }

    public Fixture getFixture() {
        return _fixture;
    }

    /**
     * @return whether the tear-down has been started or handed to the thread still running the set-up (or skipped
     *         for lack of a tear-down callback).
     */
    public boolean isTornDown() {
        _lock.lock();
        try {
            return _tornDown;
        }
        finally {
            _lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SharedFixtureScope[" + _groupName + ", " + _fixture + "]";
    }
}
