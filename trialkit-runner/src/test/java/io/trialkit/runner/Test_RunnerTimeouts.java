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

import static io.trialkit.assertion.Assertions.assertTrue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import io.trialkit.FaultKind;
import io.trialkit.FaultRecord;
import io.trialkit.FaultRecord.Phase;
import io.trialkit.Fixture;
import io.trialkit.TestCandidate;
import io.trialkit.TestResult;
import io.trialkit.TestStatus;
import io.trialkit.TestUnit;

/**
 * Timeouts, the global deadline, and that tear-down runs exactly once when a unit is abandoned.
 */
public class Test_RunnerTimeouts {
    private static RunnerConfig config() {
        return RunnerConfig.create()
                .concurrencyLimit(2)
                .defaultTimeout(Duration.ofMillis(200))
                .tearDownGrace(Duration.ofMillis(500));
    }

    @Test
    public void interruptibleBody_timesOut_tearDownByUnitThread() {
        AtomicInteger tearDowns = new AtomicInteger();
        List<String> tearDownThreads = new CopyOnWriteArrayList<>();
        List<String> bodyThreads = new CopyOnWriteArrayList<>();
        TestUnit unit = TestUnit.of(TestCandidate.builder("Timeout", "sleeping")
                .body(() -> {
                    bodyThreads.add(Thread.currentThread().getName());
                    Thread.sleep(10_000);
                })
                .tearDown(() -> {
                    tearDownThreads.add(Thread.currentThread().getName());
                    tearDowns.incrementAndGet();
                })
                .build());

        TestResult result = StandardTestRunner.create(config()).run(Collections.singletonList(unit)).get(0);

        Assert.assertEquals(TestStatus.FAILED, result.getStatus());
        Assert.assertEquals(1, result.getFaults().size());
        FaultRecord timeout = result.getPrimaryFault().get();
        Assert.assertEquals(FaultKind.TIMEOUT, timeout.getKind());
        Assert.assertEquals(Phase.BODY, timeout.getPhase());
        Assert.assertTrue(timeout.getMessage(), timeout.getMessage().contains("its timeout of [200 ms]"));
        Assert.assertEquals(1, tearDowns.get());
        Assert.assertEquals(bodyThreads, tearDownThreads);
        Assert.assertTrue(result.getElapsed().toMillis() < 5_000);
    }

    @Test
    public void bodyIgnoringInterrupts_tearDownByRunner_exactlyOnce() throws InterruptedException {
        AtomicInteger tearDowns = new AtomicInteger();
        CountDownLatch bodyEnded = new CountDownLatch(1);
        TestUnit unit = TestUnit.of(TestCandidate.builder("Timeout", "stubborn")
                .body(() -> {
                    try {
                        long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(1500);
                        while (System.nanoTime() < end) {
                            try {
                                Thread.sleep(20);
                            }
                            catch (InterruptedException e) {
                                // Ignoring it, like badly behaved code under test does.
                            }
                        }
                    }
                    finally {
                        bodyEnded.countDown();
                    }
                })
                .tearDown(tearDowns::incrementAndGet)
                .build());

        TestResult result = StandardTestRunner.create(config()).run(Collections.singletonList(unit)).get(0);

        Assert.assertEquals(TestStatus.FAILED, result.getStatus());
        Assert.assertEquals(FaultKind.TIMEOUT, result.getPrimaryFault().get().getKind());
        Assert.assertEquals(1, result.getFaults().size());
        Assert.assertEquals(1, tearDowns.get());

        // When the body finally returns, the unit thread must not run the tear-down again.
        Assert.assertTrue(bodyEnded.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        Assert.assertEquals(1, tearDowns.get());
    }

    @Test
    public void hangingTearDown_isReportedAfterGrace() {
        TestUnit unit = TestUnit.of(TestCandidate.builder("Timeout", "hangingTearDown")
                .body(() -> Thread.sleep(10_000))
                .tearDown(() -> {
                    long end = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
                    while (System.nanoTime() < end) {
                        try {
                            Thread.sleep(20);
                        }
                        catch (InterruptedException e) {
                            // Keep hanging.
                        }
                    }
                })
                .build());

        TestResult result = StandardTestRunner.create(config()).run(Collections.singletonList(unit)).get(0);

        Assert.assertEquals(TestStatus.FAILED, result.getStatus());
        Assert.assertEquals(2, result.getFaults().size());
        Assert.assertEquals(FaultKind.TIMEOUT, result.getFaults().get(0).getKind());
        FaultRecord tearDown = result.getFaults().get(1);
        Assert.assertEquals(FaultKind.FIXTURE_FAULT, tearDown.getKind());
        Assert.assertEquals(Phase.TEAR_DOWN, tearDown.getPhase());
        Assert.assertTrue(tearDown.getMessage(), tearDown.getMessage().contains("grace period"));
    }

    @Test
    public void setUpTimingOut_isReportedInSetUpPhase() {
        AtomicInteger bodies = new AtomicInteger();
        AtomicInteger tearDowns = new AtomicInteger();
        TestUnit unit = TestUnit.of(TestCandidate.builder("Timeout", "slowSetUp")
                .setUp(() -> Thread.sleep(10_000))
                .body(bodies::incrementAndGet)
                .tearDown(tearDowns::incrementAndGet)
                .build());

        TestResult result = StandardTestRunner.create(config()).run(Collections.singletonList(unit)).get(0);

        Assert.assertEquals(1, result.getFaults().size());
        Assert.assertEquals(FaultKind.TIMEOUT, result.getPrimaryFault().get().getKind());
        Assert.assertEquals(Phase.SET_UP, result.getPrimaryFault().get().getPhase());
        Assert.assertEquals(0, bodies.get());
        Assert.assertEquals(1, tearDowns.get());
    }

    @Test
    public void perUnitTimeoutOverridesDefault() {
        RunnerConfig config = config().defaultTimeout(Duration.ofSeconds(10));
        List<TestUnit> units = Arrays.asList(
                TestUnit.of(TestCandidate.builder("Override", "short")
                        .timeout(Duration.ofMillis(100))
                        .body(() -> Thread.sleep(5_000)).build()),
                TestUnit.of(TestCandidate.builder("Override", "default")
                        .body(() -> {
                            Thread.sleep(300);
                            assertTrue(true);
                        }).build()));

        List<TestResult> results = StandardTestRunner.create(config).run(units);

        Assert.assertEquals(FaultKind.TIMEOUT, results.get(0).getPrimaryFault().get().getKind());
        Assert.assertEquals(TestStatus.PASSED, results.get(1).getStatus());
    }

    @Test
    public void globalDeadline_boundsRunningUnit_andFailsUnitsNotStarted() {
        AtomicInteger secondSetUps = new AtomicInteger();
        AtomicInteger secondTearDowns = new AtomicInteger();
        RunnerConfig config = config()
                .concurrencyLimit(1)
                .defaultTimeout(Duration.ofSeconds(10))
                .globalDeadline(Duration.ofMillis(300));
        List<TestUnit> units = Arrays.asList(
                TestUnit.of("Deadline", "long", () -> Thread.sleep(5_000)),
                TestUnit.of(TestCandidate.builder("Deadline", "neverStarted")
                        .setUp(secondSetUps::incrementAndGet)
                        .body(() -> assertTrue(true))
                        .tearDown(secondTearDowns::incrementAndGet)
                        .build()));

        List<TestResult> results = StandardTestRunner.create(config).run(units);

        FaultRecord first = results.get(0).getPrimaryFault().get();
        Assert.assertEquals(FaultKind.TIMEOUT, first.getKind());
        Assert.assertTrue(first.getMessage(), first.getMessage().contains("global deadline"));

        Assert.assertEquals(TestStatus.FAILED, results.get(1).getStatus());
        FaultRecord second = results.get(1).getPrimaryFault().get();
        Assert.assertEquals(FaultKind.TIMEOUT, second.getKind());
        Assert.assertEquals(Phase.SET_UP, second.getPhase());
        Assert.assertTrue(second.getMessage(), second.getMessage().contains("not started"));
        Assert.assertEquals(0, secondSetUps.get());
        Assert.assertEquals(0, secondTearDowns.get());
        Assert.assertEquals(TestStatus.FAILED, units.get(1).getStatus());
    }

    @Test
    public void timedOutUnitDoesNotHoldUpTheOthers() {
        List<TestUnit> units = Arrays.asList(
                TestUnit.of("Mixed", "hanging", () -> Thread.sleep(10_000)),
                TestUnit.of("Mixed", "quick1", () -> assertTrue(true)),
                TestUnit.of("Mixed", "quick2", () -> assertTrue(true)));

        List<TestResult> results = StandardTestRunner.create(config().concurrencyLimit(1)).run(units);

        Assert.assertEquals(TestStatus.FAILED, results.get(0).getStatus());
        Assert.assertEquals(TestStatus.PASSED, results.get(1).getStatus());
        Assert.assertEquals(TestStatus.PASSED, results.get(2).getStatus());
    }

    @Test
    public void sharedSetUpIgnoringInterrupts_doesNotHoldUpTheRun() throws InterruptedException {
        CountDownLatch releaseSetUp = new CountDownLatch(1);
        CountDownLatch tornDown = new CountDownLatch(1);
        AtomicInteger bodies = new AtomicInteger();
        AtomicInteger tearDowns = new AtomicInteger();
        Fixture shared = Fixture.shared("stuckDb", () -> {
            long end = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (releaseSetUp.getCount() > 0 && System.nanoTime() < end) {
                try {
                    releaseSetUp.await(20, TimeUnit.MILLISECONDS);
                }
                catch (InterruptedException e) {
                    // Ignoring it, like a badly behaved shared set-up does.
                }
            }
        }, () -> {
            tearDowns.incrementAndGet();
            tornDown.countDown();
        });
        List<TestUnit> units = Arrays.asList(
                TestUnit.of(TestCandidate.builder("Stuck", "a").fixture(shared)
                        .body(bodies::incrementAndGet).build()),
                TestUnit.of(TestCandidate.builder("Stuck", "b").fixture(shared)
                        .body(bodies::incrementAndGet).build()));

        long startNanos = System.nanoTime();
        List<TestResult> results = StandardTestRunner.create(config()).run(units);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        // Timeout and grace periods, not the set-up, bound the run.
        Assert.assertTrue("Run took [" + elapsedMillis + "] ms.", elapsedMillis < 3_000);
        for (TestResult result : results) {
            Assert.assertEquals(TestStatus.FAILED, result.getStatus());
            FaultRecord primary = result.getPrimaryFault().get();
            Assert.assertEquals(FaultKind.TIMEOUT, primary.getKind());
            Assert.assertEquals(Phase.SET_UP, primary.getPhase());
        }
        Assert.assertEquals(0, tearDowns.get());

        // When the set-up finally returns, its thread runs the deferred tear-down, and no body runs.
        releaseSetUp.countDown();
        Assert.assertTrue(tornDown.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        Assert.assertEquals(1, tearDowns.get());
        Assert.assertEquals(0, bodies.get());
    }

    @Test
    public void hangingSharedTearDown_isReportedAfterGrace() {
        Fixture shared = Fixture.shared("stuckClose", null, () -> {
            long end = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
            while (System.nanoTime() < end) {
                try {
                    Thread.sleep(20);
                }
                catch (InterruptedException e) {
                    // Keep hanging.
                }
            }
        });
        TestUnit unit = TestUnit.of(TestCandidate.builder("Stuck", "close").fixture(shared)
                .body(() -> assertTrue(true)).build());

        long startNanos = System.nanoTime();
        TestResult result = StandardTestRunner.create(config()).run(Collections.singletonList(unit)).get(0);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        Assert.assertTrue("Run took [" + elapsedMillis + "] ms.", elapsedMillis < 2_500);
        Assert.assertEquals(TestStatus.FAILED, result.getStatus());
        Assert.assertEquals(1, result.getFaults().size());
        FaultRecord tearDown = result.getFaults().get(0);
        Assert.assertEquals(FaultKind.FIXTURE_FAULT, tearDown.getKind());
        Assert.assertEquals(Phase.TEAR_DOWN, tearDown.getPhase());
        Assert.assertTrue(tearDown.getMessage(), tearDown.getMessage().contains("stuckClose"));
        Assert.assertTrue(tearDown.getMessage(), tearDown.getMessage().contains("grace period"));
    }
}
