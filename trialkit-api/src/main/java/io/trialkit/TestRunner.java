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

import java.util.List;

/**
 * Discovers test units and executes them, with fixture lifecycle handling, per-unit timeouts and bounded parallelism.
 * <p>
 * Contract:
 * <ul>
 * <li>{@code run(units).size() == units.size()}, and the result at index <i>i</i> is for the unit at index <i>i</i>,
 * regardless of the concurrency limit.</li>
 * <li>Every fault is caught at the unit boundary: a failing unit never aborts the run, and a failing run still
 * produces a result for every unit.</li>
 * <li>Units are executed in unspecified order - they must be independent.</li>
 * </ul>
 */
public interface TestRunner {
    /**
     * Creates {@link TestStatus#PENDING PENDING} units from the candidates of the source.
     *
     * @throws IllegalArgumentException
     *             if two candidates have the same fully-qualified name.
     */
    List<TestUnit> discover(DiscoverySource source);

    /**
     * Runs the units using the configured default concurrency limit.
     */
    List<TestResult> run(List<TestUnit> units);

    /**
     * Runs the units on at most <code>concurrencyLimit</code> parallel workers - 1 means fully sequential.
     *
     * @throws IllegalArgumentException
     *             if the limit is &lt; 1, if fully-qualified names are not unique, or if a unit is not
     *             {@link TestStatus#PENDING PENDING}.
     */
    List<TestResult> run(List<TestUnit> units, int concurrencyLimit);

    /**
     * Runs the units with the default concurrency limit, and hands the results and the summary to the reporter.
     *
     * @return the summary.
     */
    RunSummary runAndReport(List<TestUnit> units, ResultReporter reporter);
}
