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

package io.trialkit.mock.abstractunit;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.AssertionFailure;
import io.trialkit.ExecutionContext;
import io.trialkit.mock.CapabilitySpec;
import io.trialkit.mock.Mock;
import io.trialkit.mock.MockConfig;
import io.trialkit.mock.MockEngine;
import io.trialkit.mock.MockMode;

/**
 * Base class containing common code for Rule_TrialMocks and Extension_TrialMocks located in the following modules:
 * <ul>
 * <li>trialkit-test-junit</li>
 * <li>trialkit-test-jupiter</li>
 * </ul>
 * It gives a plain JUnit test what the trialkit runner gives a test unit: an {@link ExecutionContext} bound to the
 * test thread, and a {@link MockEngine} whose mocks are owned by the running test.
 * <p>
 * The {@link #beforeEach(String)} and {@link #afterEach(Throwable)} methods should be called through JUnit's and
 * Jupiter's life cycle methods.
 */
public abstract class AbstractTrialMocks {
    private static final Logger log = LoggerFactory.getLogger(AbstractTrialMocks.class);
    protected static final String LOG_PREFIX = "#TRIALKIT# ";

    protected final MockEngine _mockEngine;

    // :: Per test
    protected volatile ExecutionContext _executionContext;

    protected AbstractTrialMocks() {
        this(MockConfig.create());
    }

    protected AbstractTrialMocks(MockConfig mockConfig) {
        _mockEngine = MockEngine.create(mockConfig);
    }

    /**
     * Binds a fresh {@link ExecutionContext} to the current thread.
     * <p>
     * This method should be called as a result of the following life cycle events for either JUnit or Jupiter:
     * <ul>
     * <li>Before - JUnit - Rule</li>
     * <li>BeforeEachCallback - Jupiter</li>
     * </ul>
     */
    public void beforeEach(String testName) {
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "beforeEach: binding ExecutionContext for [" + testName
                + "].");
        ExecutionContext executionContext = new ExecutionContext(testName);
        executionContext.bind();
        _executionContext = executionContext;
    }

    /**
     * Discards all mocks created during the test, unbinds the {@link ExecutionContext}, and fails the test if a
     * signalled failure was swallowed by the code under test, e.g. an unconfigured invocation on a strict mock that a
     * service caught and logged.
     * <p>
     * This method should be called as a result of the following life cycle events for either JUnit or Jupiter:
     * <ul>
     * <li>After - JUnit - Rule</li>
     * <li>AfterEachCallback - Jupiter</li>
     * </ul>
     *
     * @param testFault
     *            what the test itself raised, or <code>null</code> if it completed normally. A swallowed failure is
     *            then added to it as suppressed, instead of being raised.
     */
    public void afterEach(Throwable testFault) {
        ExecutionContext executionContext = _executionContext;
        _executionContext = null;
        _mockEngine.discardAll();
        ExecutionContext.unbind();
        if (executionContext == null) {
            log.warn(LOG_PREFIX + "afterEach invoked without beforeEach, ignoring.");
            return;
        }
        Optional<Throwable> firstSignalled = executionContext.getFirstSignalledCarrier();
        // ?: Was any failure signalled and not withdrawn?
        if (!firstSignalled.isPresent()) {
            // -> No, so nothing more to do.
            return;
        }
        Throwable swallowed = firstSignalled.get();
        // ?: Did the test itself raise exactly this?
        if (swallowed == testFault) {
            // -> Yes, so it was not swallowed, JUnit reports it.
            return;
        }
        // ?: Did the test raise something else?
        if (testFault != null) {
            // -> Yes, so attach ours to it.
            testFault.addSuppressed(swallowed);
            return;
        }
        // E-> The test completed normally, but a failure was signalled and swallowed: fail the test.
        AssertionFailure failure = executionContext.getSignalledFailures().get(0);
        log.warn(LOG_PREFIX + "Test [" + executionContext.getName() + "] completed, but a failure was signalled"
                + " and swallowed by the code under test: " + failure.getMessage());
        if (swallowed instanceof Error) {
            throw (Error) swallowed;
        }
        throw new AssertionError("Swallowed failure: " + failure.getMessage(), swallowed);
    }

    public MockEngine getMockEngine() {
        return _mockEngine;
    }

    /**
     * @return the {@link ExecutionContext} of the running test.
     * @throws IllegalStateException
     *             if no test is running.
     */
    public ExecutionContext getExecutionContext() {
        ExecutionContext executionContext = _executionContext;
        if (executionContext == null) {
            throw new IllegalStateException("No test is running - " + getClass().getSimpleName()
                    + " must be registered as a JUnit Rule or Jupiter Extension.");
        }
        return executionContext;
    }

    /**
     * Creates a mock of the interface in the engine's default mode, owned by the running test.
     */
    public Mock createMock(Class<?> capabilityInterface) {
        return _mockEngine.createMock(CapabilitySpec.of(capabilityInterface));
    }

    public Mock createMock(Class<?> capabilityInterface, MockMode mode) {
        return _mockEngine.createMock(CapabilitySpec.of(capabilityInterface), mode);
    }

    public Mock createMock(CapabilitySpec spec) {
        return _mockEngine.createMock(spec);
    }
}
