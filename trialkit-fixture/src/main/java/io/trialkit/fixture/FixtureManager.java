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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.FixtureCallback;
import io.trialkit.TestBody;

/**
 * Runs a body inside its fixture: set-up completes before the body starts, and tear-down runs exactly once on every
 * exit path. A set-up fault skips the body, but still runs the paired tear-down, as set-up may have acquired part of
 * its resources. A body fault and a tear-down fault are both kept.
 * <p>
 * No fault escapes: every {@link Throwable} raised by a phase ends up in the {@link FixtureOutcome}. If a phase raises
 * {@link InterruptedException}, the thread's interrupt flag is restored.
 */
public final class FixtureManager {
    private static final Logger log = LoggerFactory.getLogger(FixtureManager.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    private FixtureManager() {
    }

    /**
     * Runs the body with the fixture, on the current thread.
     *
     * @param setUp
     *            may be <code>null</code>.
     * @param tearDown
     *            may be <code>null</code>.
     */
    public static FixtureOutcome runWithFixture(FixtureCallback setUp, FixtureCallback tearDown, TestBody body) {
        return runWithFixture(setUp, tearDown, body, new TearDownGuard());
    }

    /**
     * Runs the body with the fixture, on the current thread, with the tear-down claimed through the given guard - so
     * that another party (the runner's timeout handling) can run it instead if this thread does not get to it in
     * time.
     */
    public static FixtureOutcome runWithFixture(FixtureCallback setUp, FixtureCallback tearDown, TestBody body,
            TearDownGuard guard) {
        if (body == null) {
            throw new NullPointerException("body");
        }
        if (guard == null) {
            throw new NullPointerException("guard");
        }
        Throwable setUpFault = null;
        Throwable bodyFault = null;
        boolean bodyRan = false;
        boolean tearDownRan = false;
        try {
            // :: Set-up
            if (setUp != null) {
                if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Running set-up.");
                setUpFault = runPhase(setUp::run);
            }
            // :: Body, only if set-up went fine.
            if (setUpFault == null) {
                bodyRan = true;
                bodyFault = runPhase(body::run);
            }
            else {
                log.info(LOG_PREFIX + "Set-up raised [" + setUpFault.getClass().getSimpleName()
                        + "], skipping body.");
            }
        }
        finally {
            // :: Tear-down, exactly once, whatever happened above.
            tearDownRan = guard.runOnce(tearDown);
            if (!tearDownRan && log.isDebugEnabled()) log.debug(LOG_PREFIX + "Tear-down already claimed by ["
                    + guard.getClaimedBy() + "], not running it here.");
        }
        return new FixtureOutcome(setUpFault, bodyRan, bodyFault, tearDownRan,
                tearDownRan ? guard.getFault() : null);
    }

    @FunctionalInterface
    private interface Phase {
        void run() throws Throwable;
    }

    private static Throwable runPhase(Phase phase) {
        try {
            phase.run();
            return null;
        }
        catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return t;
        }
    }
}
