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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.trialkit.AssertionFailure;
import io.trialkit.DiscoverySource;
import io.trialkit.ExecutionContext;
import io.trialkit.FaultKind;
import io.trialkit.FaultRecord;
import io.trialkit.FaultRecord.Phase;
import io.trialkit.Fixture;
import io.trialkit.ResultReporter;
import io.trialkit.RunSummary;
import io.trialkit.TestCandidate;
import io.trialkit.TestResult;
import io.trialkit.TestRunner;
import io.trialkit.TestStatus;
import io.trialkit.TestTimeoutException;
import io.trialkit.TestUnit;
import io.trialkit.fixture.FixtureOutcome;
import io.trialkit.fixture.SharedFixtureScope;
import io.trialkit.fixture.TearDownGuard;

/**
 * The standard {@link TestRunner}: a pool of <code>concurrencyLimit</code> supervisor threads takes the units in input
 * order, and each supervisor runs one unit at a time on a separate unit thread, waiting for it at most the unit's
 * timeout. A unit exceeding it is failed with a {@link FaultKind#TIMEOUT TIMEOUT} fault, its thread is interrupted,
 * and its tear-down is given a grace period to run - by the unit thread if it gets there, otherwise by the runner -
 * exactly once either way.
 * <p>
 * Results are placed by input index, so <code>results.get(i)</code> is always the result of <code>units.get(i)</code>.
 * <p>
 * Unit threads are daemon threads: a unit ignoring interruption cannot stop the JVM from exiting, but does keep
 * running in the background until it returns.
 */
public class StandardTestRunner implements TestRunner {
    private static final Logger log = LoggerFactory.getLogger(StandardTestRunner.class);
    static final String LOG_PREFIX = "#TRIALKIT# ";

    /**
     * MDC key holding the fully-qualified name of the unit, set on the unit thread and the supervising thread while
     * the unit executes.
     */
    public static final String MDC_UNIT = "trialkit.unit";

    private static final AtomicInteger __runNumber = new AtomicInteger();

    private final RunnerConfig _config;

    protected StandardTestRunner(RunnerConfig config) {
        _config = config;
    }

    /**
     * @return a runner configured from System Properties, see {@link RunnerConfig}.
     */
    public static StandardTestRunner create() {
        return new StandardTestRunner(RunnerConfig.create());
    }

    public static StandardTestRunner create(RunnerConfig config) {
        if (config == null) {
            throw new NullPointerException("config");
        }
        return new StandardTestRunner(config);
    }

    public RunnerConfig getConfig() {
        return _config;
    }

    @Override
    public List<TestUnit> discover(DiscoverySource source) {
        List<TestCandidate> candidates = source.candidates();
        List<TestUnit> units = new ArrayList<>(candidates.size());
        for (TestCandidate candidate : candidates) {
            units.add(TestUnit.of(candidate));
        }
        checkUniqueNames(units);
        log.info(LOG_PREFIX + "Discovered [" + units.size() + "] test units.");
        return units;
    }

    @Override
    public List<TestResult> run(List<TestUnit> units) {
        return run(units, _config.getConcurrencyLimit());
    }

    @Override
    public List<TestResult> run(List<TestUnit> units, int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, was [" + concurrencyLimit + "].");
        }
        checkUniqueNames(units);
        for (TestUnit unit : units) {
            if (unit.getStatus() != TestStatus.PENDING) {
                throw new IllegalArgumentException("TestUnit [" + unit.getFullyQualifiedName()
                        + "] is not PENDING, but [" + unit.getStatus() + "] - units can only be run once.");
            }
        }
        if (units.isEmpty()) {
            return Collections.emptyList();
        }

        int runNumber = __runNumber.incrementAndGet();
        long runStartNanos = System.nanoTime();
        Long deadlineNanos = _config.getGlobalDeadline() == null
                ? null
                : runStartNanos + _config.getGlobalDeadline().toNanos();
        int workers = Math.min(concurrencyLimit, units.size());
        log.info(LOG_PREFIX + "Run #" + runNumber + ": executing [" + units.size() + "] units on [" + workers
                + "] workers, " + _config + ".");

        Map<TestUnit, SharedFixtureScope> sharedScopes = createSharedScopes(units);
        TestResult[] results = new TestResult[units.size()];
        AtomicInteger nextIndex = new AtomicInteger();

        ExecutorService supervisors = Executors.newFixedThreadPool(workers,
                threadFactory("trialkit-run" + runNumber + "-supervisor-", false));
        ExecutorService unitThreads = Executors.newCachedThreadPool(
                threadFactory("trialkit-run" + runNumber + "-unit-", true));
        try {
            for (int w = 0; w < workers; w++) {
                supervisors.execute(() -> {
                    int index;
                    while ((index = nextIndex.getAndIncrement()) < units.size()) {
                        TestUnit unit = units.get(index);
                        results[index] = supervise(unit, sharedScopes.get(unit), unitThreads, deadlineNanos);
                    }
                });
            }
            supervisors.shutdown();
            awaitTerminationUninterruptibly(supervisors);
        }
        finally {
            supervisors.shutdownNow();
            // Interrupts any unit thread still ignoring its timeout.
            unitThreads.shutdownNow();
        }

        List<TestResult> resultList = Collections.unmodifiableList(Arrays.asList(results));
        if (resultList.contains(null)) {
            // Only if a supervisor died, which supervise(..) is written not to let happen.
            throw new IllegalStateException("Run #" + runNumber + " lost results: " + resultList);
        }
        log.info(LOG_PREFIX + "Run #" + runNumber + " completed in ["
                + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - runStartNanos) + "] ms.");
        return resultList;
    }

    @Override
    public RunSummary runAndReport(List<TestUnit> units, ResultReporter reporter) {
        if (reporter == null) {
            throw new NullPointerException("reporter");
        }
        long startNanos = System.nanoTime();
        List<TestResult> results = run(units);
        RunSummary summary = summarize(results, Duration.ofNanos(System.nanoTime() - startNanos));
        reporter.report(results, summary);
        return summary;
    }

    /**
     * Computes the aggregate summary of the results, see {@link RunSummary#of(List, Duration)}.
     */
    public RunSummary summarize(List<TestResult> results, Duration elapsed) {
        return RunSummary.of(results, elapsed);
    }

    // ===== Supervision of one unit

    /**
     * Executes one unit on a unit thread, enforcing its timeout, and builds its result. Never throws.
     */
    private TestResult supervise(TestUnit unit, SharedFixtureScope sharedScope, ExecutorService unitThreads,
            Long deadlineNanos) {
        MDC.put(MDC_UNIT, unit.getFullyQualifiedName());
        long startNanos = System.nanoTime();
        try {
            Duration timeout = unit.getTimeout() != null ? unit.getTimeout() : _config.getDefaultTimeout();
            boolean deadlineBound = false;
            // ?: Is there a global deadline?
            if (deadlineNanos != null) {
                // -> Yes, so the unit gets at most what remains of it.
                long remainingNanos = deadlineNanos - startNanos;
                // ?: Already passed?
                if (remainingNanos <= 0) {
                    // -> Yes, so the unit is not started at all.
                    return notStartedBeforeDeadline(unit, sharedScope, unitThreads, startNanos);
                }
                if (remainingNanos < timeout.toNanos()) {
                    timeout = Duration.ofNanos(remainingNanos);
                    deadlineBound = true;
                }
            }

            unit.markRunning();
            if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Starting unit [" + unit.getFullyQualifiedName()
                    + "] with timeout [" + timeout.toMillis() + " ms].");
            UnitExecution execution = new UnitExecution(unit, sharedScope);
            Future<?> future = unitThreads.submit(execution);
            TestTimeoutException timeoutFault = null;
            Phase timedOutPhase = null;
            Throwable supervisionFault = null;
            try {
                future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
            catch (TimeoutException e) {
                // Read before interrupting, which moves the lifecycle on to tear-down.
                timedOutPhase = execution.getPhase();
                String message = "Unit [" + unit.getFullyQualifiedName() + "] exceeded "
                        + (deadlineBound ? "the global deadline of the run" : "its timeout of ["
                                + timeout.toMillis() + " ms]")
                        + " in phase [" + timedOutPhase + "].";
                log.warn(LOG_PREFIX + message);
                timeoutFault = new TestTimeoutException(message, timeout);
                execution.abandon();
                future.cancel(true);
            }
            catch (ExecutionException e) {
                // The lifecycle catches everything, so this is an error in the runner itself.
                log.error(LOG_PREFIX + "Unit [" + unit.getFullyQualifiedName() + "] lifecycle escaped a fault.",
                        e.getCause());
                supervisionFault = e.getCause();
            }
            catch (InterruptedException e) {
                log.warn(LOG_PREFIX + "Supervisor interrupted while waiting for unit ["
                        + unit.getFullyQualifiedName() + "], cancelling it.");
                execution.abandon();
                future.cancel(true);
                supervisionFault = e;
                Thread.currentThread().interrupt();
            }

            List<FaultRecord> faults = new ArrayList<>();
            if (timeoutFault != null || supervisionFault != null) {
                faults.addAll(handleAbandonedLifecycle(execution, timeoutFault, timedOutPhase, supervisionFault,
                        unitThreads));
            }
            return completeResult(execution, faults, timeoutFault != null, unitThreads, startNanos);
        }
        catch (Throwable t) {
            // Last resort: whatever happened, the unit gets a result and the run goes on.
            log.error(LOG_PREFIX + "Unexpected fault supervising unit [" + unit.getFullyQualifiedName() + "].", t);
            if (unit.getStatus() == TestStatus.PENDING) {
                unit.markRunning();
            }
            if (unit.getStatus() == TestStatus.RUNNING) {
                unit.markCompleted(TestStatus.FAILED);
            }
            return new TestResult(unit, TestStatus.FAILED, Duration.ofNanos(System.nanoTime() - startNanos),
                    Collections.emptyList(), Collections.singletonList(FaultRecord.uncaught(t)), 0);
        }
        finally {
            MDC.remove(MDC_UNIT);
        }
    }

    /**
     * The unit thread did not finish in time: make sure the owed tear-down runs exactly once, within the grace
     * period.
     *
     * @return the fault records, primary first.
     */
    private List<FaultRecord> handleAbandonedLifecycle(UnitExecution execution, TestTimeoutException timeoutFault,
            Phase timedOutPhase, Throwable supervisionFault, ExecutorService unitThreads) {
        List<FaultRecord> faults = new ArrayList<>();
        faults.add(timeoutFault != null
                ? FaultRecord.timeout(timedOutPhase, timeoutFault)
                : FaultRecord.uncaught(supervisionFault));

        long graceNanos = _config.getTearDownGrace().toNanos();
        boolean interrupted = Thread.interrupted();
        try {
            // :: Give the unit thread the grace period to get through its own finally, running the tear-down.
            if (execution.awaitCompletion(graceNanos, TimeUnit.NANOSECONDS)) {
                return faults;
            }
            // E-> The unit thread is stuck. ?: Is a tear-down owed at all?
            if (!execution.isFixtureStarted()) {
                // -> No, the unit's own set-up never started.
                return faults;
            }
            TestUnit unit = execution.getUnit();
            TearDownGuard guard = execution.getTearDownGuard();
            // ?: Has the unit thread already claimed the tear-down (and is stuck in it)?
            if (!guard.isClaimed()) {
                // -> No, so we run it, on another thread since it too could hang.
                log.warn(LOG_PREFIX + "Unit [" + unit.getFullyQualifiedName() + "] did not get to its tear-down"
                        + " within the grace period, running it from the runner.");
                unitThreads.execute(() -> {
                    MDC.put(MDC_UNIT, unit.getFullyQualifiedName());
                    try {
                        guard.runOnce(unit.getTearDown());
                    }
                    finally {
                        MDC.remove(MDC_UNIT);
                    }
                });
            }
            if (!guard.awaitCompletion(graceNanos, TimeUnit.NANOSECONDS)) {
                String message = "Tear-down of unit [" + unit.getFullyQualifiedName()
                        + "] did not complete within the grace period of [" + _config.getTearDownGrace().toMillis()
                        + " ms].";
                log.error(LOG_PREFIX + message);
                faults.add(new FaultRecord(FaultKind.FIXTURE_FAULT, Phase.TEAR_DOWN, message,
                        new TestTimeoutException(message, _config.getTearDownGrace())));
            }
            else if (guard.getFault() != null) {
                faults.add(FaultRecord.fixtureFault(Phase.TEAR_DOWN, guard.getFault()));
            }
            return faults;
        }
        catch (InterruptedException e) {
            interrupted = true;
            log.warn(LOG_PREFIX + "Supervisor interrupted while waiting for tear-down of unit ["
                    + execution.getUnit().getFullyQualifiedName() + "].");
            return faults;
        }
        finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Classifies everything the lifecycle produced, leaves the shared fixture scope, and completes the unit.
     */
    private TestResult completeResult(UnitExecution execution, List<FaultRecord> faults, boolean timedOut,
            ExecutorService unitThreads, long startNanos) {
        TestUnit unit = execution.getUnit();
        ExecutionContext context = execution.getContext();
        List<AssertionFailure> extraFailures = new ArrayList<>();
        int extraAssertions = 0;

        // :: Shared set-up fault, reported on every unit of the group.
        if (execution.getSharedSetUpFault() != null) {
            Throwable t = execution.getSharedSetUpFault();
            faults.add(new FaultRecord(FaultKind.FIXTURE_FAULT, Phase.SET_UP, "shared fixture ["
                    + execution.getSharedScope().getFixture().getName() + "] setUp raised "
                    + describe(t), t));
        }

        // :: The unit's own fixture and body - the outcome is there if the lifecycle got through, also when late.
        FixtureOutcome outcome = execution.getOutcome();
        if (outcome != null) {
            Throwable setUpFault = outcome.getSetUpFault();
            if (setUpFault != null && !(timedOut && setUpFault instanceof InterruptedException)) {
                faults.add(FaultRecord.fixtureFault(Phase.SET_UP, setUpFault));
            }
            Throwable bodyFault = outcome.getBodyFault();
            Class<? extends Throwable> expectedFault = unit.getExpectedFault();
            // ?: Was a fault expected, and did the body run?
            if (expectedFault != null && outcome.isBodyRan() && !timedOut) {
                // -> Yes, so that is one assertion.
                extraAssertions++;
                if (bodyFault != null && bodyFault.getClass() == expectedFault) {
                    // Held: it may have been a signalled failure, which is now consumed.
                    context.withdraw(bodyFault);
                }
                else {
                    String message = bodyFault == null
                            ? "expected fault " + expectedFault.getName() + ", no fault raised"
                            : "expected fault " + expectedFault.getName() + ", got fault "
                                    + bodyFault.getClass().getName();
                    extraFailures.add(new AssertionFailure(FaultKind.ASSERTION_FAILED, message,
                            expectedFault.getName(), bodyFault == null ? null : bodyFault.getClass().getName(),
                            firstFrame(bodyFault)));
                    if (bodyFault != null && !context.isSignalled(bodyFault)) {
                        faults.add(FaultRecord.uncaught(bodyFault));
                    }
                }
            }
            else if (bodyFault != null && !(timedOut && bodyFault instanceof InterruptedException)) {
                // ?: Is it a signalled failure from the assertion or mock engine?
                if (context.isSignalled(bodyFault)) {
                    // -> Yes, already among the signalled failures.
                    if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Body raised signalled failure ["
                            + bodyFault.getClass().getSimpleName() + "].");
                }
                // E-> ?: Is it some other AssertionError, e.g. from JUnit's Assert or the 'assert' keyword?
                else if (bodyFault instanceof AssertionError) {
                    // -> Yes, so it counts as a failed assertion.
                    extraAssertions++;
                    extraFailures.add(new AssertionFailure(FaultKind.ASSERTION_FAILED,
                            bodyFault.getMessage() != null ? bodyFault.getMessage() : bodyFault.getClass().getName(),
                            null, null, firstFrame(bodyFault)));
                }
                else {
                    // -> No, it is an uncaught fault.
                    faults.add(FaultRecord.uncaught(bodyFault));
                }
            }
            if (outcome.getTearDownFault() != null) {
                faults.add(FaultRecord.fixtureFault(Phase.TEAR_DOWN, outcome.getTearDownFault()));
            }
        }

        // :: Leave the shared scope; the last unit of the group runs the shared tear-down.
        if (execution.getSharedScope() != null) {
            leaveSharedScope(execution.getSharedScope(), unit, faults, unitThreads);
        }

        List<AssertionFailure> assertionFailures = new ArrayList<>(context.getSignalledFailures());
        assertionFailures.addAll(extraFailures);
        int assertionCount = context.getAssertionCount() + extraAssertions;
        TestStatus status = classify(faults, assertionFailures, assertionCount);
        unit.markCompleted(status);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        TestResult result = new TestResult(unit, status, elapsed, assertionFailures, faults, assertionCount);
        if (status == TestStatus.FAILED) {
            log.info(LOG_PREFIX + "Unit [" + unit.getFullyQualifiedName() + "] FAILED in [" + elapsed.toMillis()
                    + " ms]: " + result.describeFailure());
        }
        else {
            log.info(LOG_PREFIX + "Unit [" + unit.getFullyQualifiedName() + "] " + status + " in ["
                    + elapsed.toMillis() + " ms], [" + assertionCount + "] assertions.");
        }
        return result;
    }

    /**
     * {@link TestStatus#FAILED FAILED} on any fault or failure, else {@link TestStatus#INCONCLUSIVE INCONCLUSIVE} if
     * nothing was asserted, else {@link TestStatus#PASSED PASSED}.
     */
    static TestStatus classify(List<FaultRecord> faults, List<AssertionFailure> assertionFailures,
            int assertionCount) {
        if (!faults.isEmpty() || !assertionFailures.isEmpty()) {
            return TestStatus.FAILED;
        }
        return assertionCount == 0 ? TestStatus.INCONCLUSIVE : TestStatus.PASSED;
    }

    private TestResult notStartedBeforeDeadline(TestUnit unit, SharedFixtureScope sharedScope,
            ExecutorService unitThreads, long startNanos) {
        String message = "Unit [" + unit.getFullyQualifiedName() + "] was not started before the global deadline"
                + " of the run [" + _config.getGlobalDeadline().toMillis() + " ms].";
        log.warn(LOG_PREFIX + message);
        List<FaultRecord> faults = new ArrayList<>();
        faults.add(FaultRecord.timeout(Phase.SET_UP,
                new TestTimeoutException(message, _config.getGlobalDeadline())));
        if (sharedScope != null) {
            // Never entered, but the group's count must still reach zero for the shared tear-down.
            leaveSharedScope(sharedScope, unit, faults, unitThreads);
        }
        unit.markRunning();
        unit.markCompleted(TestStatus.FAILED);
        return new TestResult(unit, TestStatus.FAILED, Duration.ofNanos(System.nanoTime() - startNanos),
                Collections.emptyList(), faults, 0);
    }

    /**
     * Leaves the shared scope on a unit thread, waiting at most the grace period: if this is the last unit of the
     * group, the shared tear-down runs in there, and it could hang.
     */
    private void leaveSharedScope(SharedFixtureScope sharedScope, TestUnit unit, List<FaultRecord> faults,
            ExecutorService unitThreads) {
        String fixtureName = sharedScope.getFixture().getName();
        Future<Throwable> leave = unitThreads.submit(() -> {
            MDC.put(MDC_UNIT, unit.getFullyQualifiedName());
            try {
                return sharedScope.leave();
            }
            finally {
                MDC.remove(MDC_UNIT);
            }
        });
        Throwable sharedTearDownFault;
        try {
            sharedTearDownFault = leave.get(_config.getTearDownGrace().toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            String message = "Tear-down of shared fixture [" + fixtureName + "] did not complete within the grace"
                    + " period of [" + _config.getTearDownGrace().toMillis() + " ms].";
            log.error(LOG_PREFIX + message);
            faults.add(new FaultRecord(FaultKind.FIXTURE_FAULT, Phase.TEAR_DOWN, message,
                    new TestTimeoutException(message, _config.getTearDownGrace())));
            return;
        }
        catch (ExecutionException e) {
            // leave() catches the tear-down's faults, so this is misuse of the scope.
            log.error(LOG_PREFIX + "Leaving shared fixture [" + fixtureName + "] raised.", e.getCause());
            faults.add(FaultRecord.uncaught(e.getCause()));
            return;
        }
        catch (InterruptedException e) {
            log.warn(LOG_PREFIX + "Supervisor interrupted while leaving shared fixture [" + fixtureName + "].");
            Thread.currentThread().interrupt();
            faults.add(FaultRecord.uncaught(e));
            return;
        }
        if (sharedTearDownFault != null) {
            faults.add(new FaultRecord(FaultKind.FIXTURE_FAULT, Phase.TEAR_DOWN, "shared fixture [" + fixtureName
                    + "] tearDown raised " + describe(sharedTearDownFault), sharedTearDownFault));
        }
    }

    // ===== Helpers

    private static Map<TestUnit, SharedFixtureScope> createSharedScopes(List<TestUnit> units) {
        // :: Count units per (group, shared fixture instance).
        Map<String, Map<Fixture, List<TestUnit>>> byGroup = new LinkedHashMap<>();
        for (TestUnit unit : units) {
            if (unit.getSharedFixture() != null) {
                byGroup.computeIfAbsent(unit.getGroupName(), g -> new IdentityHashMap<>())
                        .computeIfAbsent(unit.getSharedFixture(), f -> new ArrayList<>())
                        .add(unit);
            }
        }
        Map<TestUnit, SharedFixtureScope> scopes = new IdentityHashMap<>();
        for (Map.Entry<String, Map<Fixture, List<TestUnit>>> group : byGroup.entrySet()) {
            for (Map.Entry<Fixture, List<TestUnit>> fixtureUnits : group.getValue().entrySet()) {
                SharedFixtureScope scope = new SharedFixtureScope(group.getKey(), fixtureUnits.getKey(),
                        fixtureUnits.getValue().size());
                for (TestUnit unit : fixtureUnits.getValue()) {
                    scopes.put(unit, scope);
                }
            }
        }
        return scopes;
    }

    private static void checkUniqueNames(List<TestUnit> units) {
        Set<String> names = new HashSet<>();
        for (TestUnit unit : units) {
            if (!names.add(unit.getFullyQualifiedName())) {
                throw new IllegalArgumentException("Duplicate fully-qualified test unit name ["
                        + unit.getFullyQualifiedName() + "].");
            }
        }
    }

    private static void awaitTerminationUninterruptibly(ExecutorService executor) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    if (executor.awaitTermination(1, TimeUnit.SECONDS)) {
                        return;
                    }
                }
                catch (InterruptedException e) {
                    // Every unit is bounded by its timeout and grace, so the run ends; keep waiting.
                    interrupted = true;
                }
            }
        }
        finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory threadFactory(String prefix, boolean daemon) {
        AtomicInteger threadNumber = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + threadNumber.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }

    private static StackTraceElement firstFrame(Throwable t) {
        if (t == null || t.getStackTrace().length == 0) {
            return null;
        }
        return t.getStackTrace()[0];
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getName() : t.getClass().getName() + ": " + t.getMessage();
    }

    @Override
    public String toString() {
        return "StandardTestRunner[" + _config + "]";
    }
}
