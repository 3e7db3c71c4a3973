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

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class Test_ExecutionContext {
    @After
    public void unbind() {
        ExecutionContext.unbind();
    }

    private static AssertionFailure failure(String message) {
        return new AssertionFailure(FaultKind.ASSERTION_FAILED, message, 1, 2, null);
    }

    @Test
    public void bindAndUnbind() {
        Assert.assertFalse(ExecutionContext.current().isPresent());
        ExecutionContext context = new ExecutionContext("unit");
        context.bind();
        Assert.assertSame(context, ExecutionContext.current().get());
        // Rebinding the same context is fine.
        context.bind();
        ExecutionContext.unbind();
        Assert.assertFalse(ExecutionContext.current().isPresent());
    }

    @Test(expected = IllegalStateException.class)
    public void cannotBindOverAnother() {
        new ExecutionContext("first").bind();
        new ExecutionContext("second").bind();
    }

    @Test
    public void contextIsPerThread() throws InterruptedException {
        new ExecutionContext("main").bind();
        boolean[] presentOnOtherThread = new boolean[1];
        Thread thread = new Thread(() -> presentOnOtherThread[0] = ExecutionContext.current().isPresent());
        thread.start();
        thread.join();
        Assert.assertFalse(presentOnOtherThread[0]);
    }

    @Test
    public void signalWithdrawByIdentity() {
        ExecutionContext context = new ExecutionContext("unit");
        AssertionError first = new AssertionError("first");
        AssertionError second = new AssertionError("first");

        context.signal(first, failure("first"));
        context.signal(first, failure("first again"));
        context.signal(second, failure("second"));

        Assert.assertEquals(2, context.getSignalledFailures().size());
        Assert.assertEquals("first", context.getSignalledFailures().get(0).getMessage());
        Assert.assertSame(first, context.getFirstSignalledCarrier().get());
        Assert.assertTrue(context.isSignalled(second));

        Assert.assertTrue(context.withdraw(first));
        Assert.assertFalse(context.withdraw(first));
        Assert.assertFalse(context.isSignalled(first));
        Assert.assertSame(second, context.getFirstSignalledCarrier().get());
    }

    @Test
    public void countsAssertions() {
        ExecutionContext context = new ExecutionContext("unit");
        for (int i = 0; i < 5; i++) {
            context.countAssertion();
        }
        Assert.assertEquals(5, context.getAssertionCount());
    }
}
