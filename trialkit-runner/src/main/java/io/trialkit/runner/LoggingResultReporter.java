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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.AssertionFailure;
import io.trialkit.FaultRecord;
import io.trialkit.ResultReporter;
import io.trialkit.RunSummary;
import io.trialkit.TestResult;
import io.trialkit.TestStatus;

/**
 * {@link ResultReporter} logging one line per unit, the details of each failure, and the summary, through SLF4J.
 * Failed units log at WARN, inconclusive ones at INFO with a hint, the rest at INFO.
 */
public class LoggingResultReporter implements ResultReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingResultReporter.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    @Override
    public void report(List<TestResult> results, RunSummary summary) {
        for (TestResult result : results) {
            String line = LOG_PREFIX + String.format("%-12s", result.getStatus()) + " "
                    + result.getFullyQualifiedName() + " (" + result.getElapsed().toMillis() + " ms, "
                    + result.getAssertionCount() + " assertions)";
            if (result.getStatus() == TestStatus.FAILED) {
                log.warn(line);
                for (AssertionFailure failure : result.getAssertionFailures()) {
                    log.warn(LOG_PREFIX + "    " + failure.getKind() + ": " + failure);
                }
                for (FaultRecord fault : result.getFaults()) {
                    log.warn(LOG_PREFIX + "    " + fault, fault.getThrowable());
                }
            }
            else if (result.getStatus() == TestStatus.INCONCLUSIVE) {
                log.info(line + " - completed without executing any assertion.");
            }
            else {
                log.info(line);
            }
        }
        String summaryLine = LOG_PREFIX + "Summary: " + summary.getTotal() + " units, " + summary.getPassed()
                + " passed, " + summary.getFailed() + " failed, " + summary.getInconclusive() + " inconclusive, in "
                + summary.getElapsed().toMillis() + " ms.";
        if (summary.isSuccessful()) {
            log.info(summaryLine);
        }
        else {
            log.warn(summaryLine);
        }
    }
}
