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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import io.trialkit.FaultRecord.Phase;

/**
 * {@link TestResult} fault ordering and failure description, and the {@link RunSummary} computed over results.
 */
public class Test_TestResult {
    private static TestUnit completed(String name, TestStatus status) {
        TestUnit unit = TestUnit.of("Result", name, () -> {
        });
        unit.markRunning();
        unit.markCompleted(status);
        return unit;
    }

    private static TestResult result(String name, TestStatus status, List<AssertionFailure> failures,
            List<FaultRecord> faults) {
        return new TestResult(completed(name, status), status, Duration.ofMillis(10), failures, faults, 1);
    }

    @Test
    public void primaryFaultIsFirst() {
        FaultRecord body = FaultRecord.uncaught(new IllegalStateException("body"));
        FaultRecord tearDown = FaultRecord.fixtureFault(Phase.TEAR_DOWN, new IllegalArgumentException("tearDown"));
        TestResult result = result("faults", TestStatus.FAILED, Collections.emptyList(),
                Arrays.asList(body, tearDown));

        Assert.assertSame(body, result.getPrimaryFault().get());
        Assert.assertSame(tearDown, result.getFault(FaultKind.FIXTURE_FAULT).get());
        Assert.assertFalse(result.getFault(FaultKind.TIMEOUT).isPresent());
        Assert.assertEquals("UNCAUGHT_FAULT@BODY: body raised java.lang.IllegalStateException: body (+1 more)",
                result.describeFailure());
    }

    @Test
    public void describeFailureWithAssertionFailure() {
        AssertionFailure failure = new AssertionFailure(FaultKind.ASSERTION_FAILED, "expected <1> but was <2>", 1,
                2, null);
        TestResult result = result("assertion", TestStatus.FAILED, Collections.singletonList(failure),
                Collections.emptyList());

        Assert.assertEquals("ASSERTION_FAILED: expected <1> but was <2>", result.describeFailure());
    }

    @Test
    public void noDescriptionUnlessFailed() {
        Assert.assertNull(result("passed", TestStatus.PASSED, Collections.emptyList(), Collections.emptyList())
                .describeFailure());
    }

    @Test(expected = IllegalArgumentException.class)
    public void statusMustBeTerminal() {
        new TestResult(TestUnit.of("Result", "pending", () -> {
        }), TestStatus.RUNNING, Duration.ZERO, Collections.emptyList(), Collections.emptyList(), 0);
    }

    @Test
    public void summary() {
        FaultRecord timeout = FaultRecord.timeout(Phase.BODY, new TestTimeoutException("too slow",
                Duration.ofMillis(5)));
        List<TestResult> results = Arrays.asList(
                result("a", TestStatus.PASSED, Collections.emptyList(), Collections.emptyList()),
                result("b", TestStatus.FAILED, Collections.emptyList(), Collections.singletonList(timeout)),
                result("c", TestStatus.INCONCLUSIVE, Collections.emptyList(), Collections.emptyList()),
                result("d", TestStatus.PASSED, Collections.emptyList(), Collections.emptyList()));

        RunSummary summary = RunSummary.of(results, Duration.ofSeconds(1));

        Assert.assertEquals(2, summary.getPassed());
        Assert.assertEquals(1, summary.getFailed());
        Assert.assertEquals(1, summary.getInconclusive());
        Assert.assertEquals(4, summary.getTotal());
        Assert.assertFalse(summary.isSuccessful());
        Assert.assertEquals(Collections.singletonList("Result.b: TIMEOUT@BODY: too slow"),
                summary.getFailureDetails());
    }

    @Test
    public void inconclusiveDoesNotFailTheRun() {
        RunSummary summary = RunSummary.of(Collections.singletonList(
                result("c", TestStatus.INCONCLUSIVE, Collections.emptyList(), Collections.emptyList())),
                Duration.ZERO);
        Assert.assertTrue(summary.isSuccessful());
    }
}
