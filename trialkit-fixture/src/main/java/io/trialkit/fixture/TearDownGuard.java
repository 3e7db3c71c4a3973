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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.FixtureCallback;

/**
 * Makes sure a tear-down runs exactly once, even when two parties race to run it: the thread running the unit's
 * lifecycle (in its <code>finally</code>), and the runner's timeout handling (if that thread does not get there within
 * the grace period). Whoever claims the guard first runs the tear-down, the other one can await its completion.
 */
public final class TearDownGuard {
    private static final Logger log = LoggerFactory.getLogger(TearDownGuard.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    private final AtomicBoolean _claimed = new AtomicBoolean();
    private final CountDownLatch _completed = new CountDownLatch(1);
    private volatile Throwable _fault;
    private volatile String _claimedBy;

    /**
     * Runs the tear-down if no one has claimed this guard yet. The current thread's interrupt flag is cleared while
     * the tear-down runs (it is typically set by a timeout), and restored afterwards.
     *
     * @param tearDown
     *            the tear-down, may be <code>null</code> in which case the guard is just claimed and completed.
     * @return <code>true</code> if this invocation claimed the guard and ran the tear-down, <code>false</code> if
     *         someone else had already claimed it.
     */
    public boolean runOnce(FixtureCallback tearDown) {
        if (!_claimed.compareAndSet(false, true)) {
            return false;
        }
        _claimedBy = Thread.currentThread().getName();
        boolean interrupted = Thread.interrupted();
        try {
            if (tearDown != null) {
                tearDown.run();
            }
        }
        catch (Throwable t) {
            if (t instanceof InterruptedException) {
                interrupted = true;
            }
            log.warn(LOG_PREFIX + "Tear-down raised [" + t.getClass().getSimpleName() + "].", t);
            _fault = t;
        }
        finally {
            _completed.countDown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        return true;
    }

    public boolean isClaimed() {
        return _claimed.get();
    }

    /**
     * @return whether the tear-down has run to completion (with or without fault).
     */
    public boolean isCompleted() {
        return _completed.getCount() == 0;
    }

    /**
     * Waits for the claimed tear-down to complete.
     *
     * @return whether it completed within the timeout.
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return _completed.await(timeout, unit);
    }

    /**
     * @return the fault the tear-down raised, or <code>null</code> if it has not completed, or completed normally.
     */
    public Throwable getFault() {
        return _fault;
    }

    /**
     * @return the name of the thread that claimed the guard, or <code>null</code> if unclaimed.
     */
    public String getClaimedBy() {
        return _claimedBy;
    }

    @Override
    public String toString() {
        return "TearDownGuard[" + (isCompleted() ? "completed" : isClaimed() ? "running" : "unclaimed")
                + (_claimedBy != null ? ", by=" + _claimedBy : "") + "]";
    }
}
