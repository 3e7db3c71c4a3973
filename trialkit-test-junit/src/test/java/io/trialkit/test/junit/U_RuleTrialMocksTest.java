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

import static io.trialkit.mock.ArgMatcher.any;
import static io.trialkit.mock.ArgMatcher.eq;
import static io.trialkit.mock.MemberMatcher.member;

import java.util.Collections;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;

import io.trialkit.assertion.Assertions;
import io.trialkit.mock.Mock;
import io.trialkit.mock.MockEngine;
import io.trialkit.mock.MockMode;
import io.trialkit.mock.UnconfiguredInvocationException;

/**
 * Plain JUnit 4 tests using {@link Rule_TrialMocks} for their mocks.
 */
public class U_RuleTrialMocksTest {

    @Rule
    public final Rule_TrialMocks MOCKS = Rule_TrialMocks.create();

    @Test
    public void strictMockAnswersConfiguredInvocations() {
        Mock mock = MOCKS.createMock(Greeter.class, MockMode.STRICT);
        MockEngine engine = MOCKS.getMockEngine();
        engine.setup(mock, member("greet", eq("World"))).returns("Hello World!");
        engine.setup(mock, member("greet", any())).returns("Hello, stranger.");

        Greeter greeter = mock.as(Greeter.class);

        Assert.assertEquals("Hello World!", greeter.greet("World"));
        Assert.assertEquals("Hello, stranger.", greeter.greet("Bob"));
        engine.verify(mock, member("greet", any()), 2);
        engine.verify(mock, member("forget", any()), 0);
        Assert.assertEquals(2, MOCKS.getExecutionContext().getAssertionCount());
    }

    @Test
    public void lenientMockReturnsDefaults() {
        Greeter greeter = MOCKS.createMock(Greeter.class, MockMode.LENIENT).as(Greeter.class);

        Assert.assertEquals("", greeter.greet("World"));
        Assert.assertEquals(Collections.emptyList(), greeter.greeted());
        greeter.forget("World");
    }

    @Test
    public void trialkitAssertionsAreCountedOnTheRulesContext() {
        Assertions.assertEqual("a", "a");
        Assertions.assertTrue(true);
        Assert.assertEquals(2, MOCKS.getExecutionContext().getAssertionCount());
    }

    @Test
    public void thrownUnconfiguredInvocationIsReportedByJUnit() {
        Greeter greeter = MOCKS.createMock(Greeter.class, MockMode.STRICT).as(Greeter.class);
        try {
            greeter.greet("World");
            Assert.fail("Strict mock should have thrown");
        }
        catch (UnconfiguredInvocationException e) {
            // Consumed here, so the test must not fail on it afterwards.
            MOCKS.getExecutionContext().withdraw(e);
        }
    }
}
