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

package io.trialkit.test.junit;

import org.junit.ClassRule;
import org.junit.Rule;
import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.mock.MockConfig;
import io.trialkit.mock.MockEngine;
import io.trialkit.mock.abstractunit.AbstractTrialMocks;

/**
 * {@link Rule} which gives each JUnit 4 test method an {@link io.trialkit.ExecutionContext ExecutionContext} and a
 * {@link MockEngine} whose mocks live for the duration of the test. Assertions from
 * <code>io.trialkit.assertion.Assertions</code> and mock verifications are counted on that context, and a failure
 * signalled inside the test but swallowed by the code under test still fails the test.
 * <p>
 * {@link Rule_TrialMocks} is a per-test {@link Rule}, not a {@link ClassRule}, so the field shall be an instance field:
 *
 * <pre>
 *     public class YourTestClass {
 *         &#64;Rule
 *         public final Rule_TrialMocks MOCKS = Rule_TrialMocks.create();
 *
 *         &#64;Test
 *         public void someTest() {
 *             Mock inventory = MOCKS.createMock(Inventory.class, MockMode.STRICT);
 *             MOCKS.getMockEngine().setup(inventory, member("stockOf", eq("sku-1"))).returns(5);
 *             ...
 *         }
 *     }
 * </pre>
 */
public class Rule_TrialMocks extends AbstractTrialMocks implements TestRule {
    private static final Logger log = LoggerFactory.getLogger(Rule_TrialMocks.class);

    protected Rule_TrialMocks(MockConfig mockConfig) {
        super(mockConfig);
    }

    /**
     * Creates a {@link Rule_TrialMocks} with the {@link MockConfig#create() default mock configuration}.
     */
    public static Rule_TrialMocks create() {
        return new Rule_TrialMocks(MockConfig.create());
    }

    public static Rule_TrialMocks create(MockConfig mockConfig) {
        return new Rule_TrialMocks(mockConfig);
    }

    // ================== Junit LifeCycle =============================================================================

    @Override
    public Statement apply(Statement base, Description description) {
        if (!description.isTest()) {
            throw new IllegalStateException("The Rule_TrialMocks should be applied as a @Rule, NOT as a @ClassRule");
        }
        String testName = description.getTestClass() != null
                ? description.getTestClass().getSimpleName() + "." + description.getMethodName()
                : description.getDisplayName();
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Apply Rule_TrialMocks to test [" + testName + "].");
        return new Statement() {
            public void evaluate() throws Throwable {
                beforeEach(testName);
                Throwable testFault = null;
                try {
                    base.evaluate();
                }
                catch (Throwable t) {
                    testFault = t;
                    throw t;
                }
                finally {
                    afterEach(testFault);
                }
            }
        };
    }
}
