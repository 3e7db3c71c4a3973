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

package io.trialkit.test.jupiter;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;

import io.trialkit.ExecutionContext;
import io.trialkit.mock.MockMode;
import io.trialkit.mock.UnconfiguredInvocationException;

/**
 * Drives the {@link Extension_TrialMocks} callbacks directly, with a mocked {@link ExtensionContext}.
 */
public class J_ExtensionTrialMocksLifecycleTest {

    private final Extension_TrialMocks _extension = Extension_TrialMocks.create();

    @AfterEach
    public void unbind() {
        ExecutionContext.unbind();
    }

    private ExtensionContext extensionContext(Throwable executionException) {
        ExtensionContext context = mock(ExtensionContext.class);
        when(context.getTestClass()).thenReturn(Optional.of(J_ExtensionTrialMocksLifecycleTest.class));
        when(context.getDisplayName()).thenReturn("someTest()");
        when(context.getExecutionException()).thenReturn(Optional.ofNullable(executionException));
        return context;
    }

    private void swallowUnconfiguredInvocation() {
        Greeter greeter = _extension.createMock(Greeter.class, MockMode.STRICT).as(Greeter.class);
        try {
            greeter.greet("World");
        }
        catch (Throwable t) {
            // Swallowed by the code under test.
        }
    }

    @Test
    public void bindsNamedContext() {
        _extension.beforeEach(extensionContext(null));

        Assertions.assertEquals("J_ExtensionTrialMocksLifecycleTest.someTest()",
                _extension.getExecutionContext().getName());
        Assertions.assertSame(_extension.getExecutionContext(), ExecutionContext.current().get());

        _extension.afterEach(extensionContext(null));

        Assertions.assertFalse(ExecutionContext.current().isPresent());
        Assertions.assertThrows(IllegalStateException.class, _extension::getExecutionContext);
    }

    @Test
    public void swallowedFailureFailsAfterEach() {
        _extension.beforeEach(extensionContext(null));
        swallowUnconfiguredInvocation();

        Assertions.assertThrows(UnconfiguredInvocationException.class,
                () -> _extension.afterEach(extensionContext(null)));
        Assertions.assertTrue(_extension.getMockEngine().getMocks().isEmpty());
    }

    @Test
    public void swallowedFailureIsSuppressedOnTestFault() {
        IllegalStateException testFault = new IllegalStateException("test fault");
        _extension.beforeEach(extensionContext(null));
        swallowUnconfiguredInvocation();

        _extension.afterEach(extensionContext(testFault));

        Assertions.assertEquals(1, testFault.getSuppressed().length);
        Assertions.assertEquals(UnconfiguredInvocationException.class, testFault.getSuppressed()[0].getClass());
    }
}
