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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate over a run: counts per terminal status, total elapsed wall-clock time, and the failure details. Computed
 * from the results by {@link #of(List, Duration)}, nothing here is stored redundantly on the units.
 */
public final class RunSummary {
    private final int _passed;
    private final int _failed;
    private final int _inconclusive;
    private final Duration _elapsed;
    private final List<TestResult> _failures;

    private RunSummary(int passed, int failed, int inconclusive, Duration elapsed, List<TestResult> failures) {
        _passed = passed;
        _failed = failed;
        _inconclusive = inconclusive;
        _elapsed = elapsed;
        _failures = Collections.unmodifiableList(failures);
    }

    /**
     * Computes the summary over the given results.
     *
     * @param results
     *            the results of a run, in report order.
     * @param elapsed
     *            the wall-clock time of the whole run (which with parallel execution is less than the sum of the
     *            per-unit elapsed times).
     */
    public static RunSummary of(List<TestResult> results, Duration elapsed) {
        int passed = 0;
        int failed = 0;
        int inconclusive = 0;
        List<TestResult> failures = new ArrayList<>();
        for (TestResult result : results) {
            switch (result.getStatus()) {
                case PASSED:
                    passed++;
                    break;
                case FAILED:
                    failed++;
                    failures.add(result);
                    break;
                case INCONCLUSIVE:
                    inconclusive++;
                    break;
                default:
                    throw new IllegalArgumentException("Result for [" + result.getFullyQualifiedName()
                            + "] has non-terminal status [" + result.getStatus() + "].");
            }
        }
        return new RunSummary(passed, failed, inconclusive, elapsed, failures);
    }

    public int getPassed() {
        return _passed;
    }

    public int getFailed() {
        return _failed;
    }

    public int getInconclusive() {
        return _inconclusive;
    }

    public int getTotal() {
        return _passed + _failed + _inconclusive;
    }

    public Duration getElapsed() {
        return _elapsed;
    }

    /**
     * @return whether nothing failed. Inconclusive units do not fail a run, but are reported.
     */
    public boolean isSuccessful() {
        return _failed == 0;
    }

    /**
     * @return the failed results, in report order.
     */
    public List<TestResult> getFailures() {
        return _failures;
    }

    /**
     * @return one line per failed result: <code>"fullyQualifiedName: description"</code>.
     */
    public List<String> getFailureDetails() {
        List<String> details = new ArrayList<>(_failures.size());
        for (TestResult failure : _failures) {
            details.add(failure.getFullyQualifiedName() + ": " + failure.describeFailure());
        }
        return details;
    }

    @Override
    public String toString() {
        return "RunSummary[total=" + getTotal() + ", passed=" + _passed + ", failed=" + _failed + ", inconclusive="
                + _inconclusive + ", elapsed=" + _elapsed.toMillis() + " ms]";
    }
}
