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

package io.trialkit.mock;

import static io.trialkit.mock.ArgMatcher.any;
import static io.trialkit.mock.ArgMatcher.eq;
import static io.trialkit.mock.ArgMatcher.matching;
import static io.trialkit.mock.MemberMatcher.anyArgs;
import static io.trialkit.mock.MemberMatcher.member;

import java.io.IOException;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Optional;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import io.trialkit.ExecutionContext;
import io.trialkit.FaultKind;

/**
 * Resolution of invocations against expectations: registration order, strict vs. lenient handling of unmatched
 * invocations, configured faults, and the typed proxy.
 */
public class Test_MockResolution {
    private final MockEngine _engine = MockEngine.create(MockConfig.create().defaultMode(MockMode.STRICT));

    @After
    public void unbindContext() {
        ExecutionContext.unbind();
    }

    @Test
    public void firstRegisteredExpectationWins() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        Expectation broad = _engine.setup(mock, member("stockOf", any())).returns(1);
        Expectation exact = _engine.setup(mock, member("stockOf", eq("sku-1"))).returns(2);

        Assert.assertEquals(1, mock.invoke("stockOf", "sku-1"));

        Assert.assertEquals(1, broad.getInvocationCount());
        Assert.assertEquals(0, exact.getInvocationCount());
        Assert.assertSame(broad, mock.getInvocationLog().getInvocations().get(0).getResolvedBy());
    }

    @Test
    public void specificBeforeBroad() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("stockOf", eq("sku-1"))).returns(2);
        _engine.setup(mock, member("stockOf", any())).returns(1);

        Inventory inventory = mock.as(Inventory.class);
        Assert.assertEquals(2, inventory.stockOf("sku-1"));
        Assert.assertEquals(1, inventory.stockOf("sku-2"));
        Assert.assertEquals(1, inventory.stockOf(null));
    }

    @Test
    public void allPositionsMustMatch() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class), MockMode.LENIENT);
        _engine.setup(mock, member("reserve", eq("sku-1"), matching(q -> ((Integer) q) <= 10, "<= 10")))
                .returns(true);

        Inventory inventory = mock.as(Inventory.class);
        Assert.assertTrue(inventory.reserve("sku-1", 10));
        Assert.assertFalse(inventory.reserve("sku-1", 11));
        Assert.assertFalse(inventory.reserve("sku-2", 1));
        Assert.assertEquals(2, mock.getInvocationLog().getUnmatchedInvocations().size());
    }

    @Test
    public void eqIsStructuralWithoutCoercion() {
        Mock mock = _engine.createMock(CapabilitySpec.named("Calculator")
                .member("square", 1, ReturnKind.NUMBER)
                .build(), MockMode.LENIENT);
        _engine.setup(mock, member("square", eq(3))).returns(9);

        Assert.assertEquals(9, mock.invoke("square", 3));
        // A long is another kind than an int: no match, so the lenient default.
        Assert.assertEquals(0, mock.invoke("square", 3L));
    }

    @Test
    public void strictMockRaisesUnconfiguredInvocation_andSignalsIt() {
        ExecutionContext context = new ExecutionContext("strict");
        context.bind();
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("stockOf", any())).returns(3);

        Inventory inventory = mock.as(Inventory.class);
        Assert.assertEquals(3, inventory.stockOf("sku-1"));
        try {
            inventory.reserve("sku-1", 1);
            Assert.fail("Should have raised UnconfiguredInvocationException");
        }
        catch (UnconfiguredInvocationException e) {
            Assert.assertEquals("reserve/2", e.getInvocation().getMemberId());
            Assert.assertEquals(FaultKind.UNCONFIGURED_INVOCATION, e.getFailure().getKind());
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("reserve(\"sku-1\", 1)"));
            Assert.assertTrue(context.isSignalled(e));
        }
        // The unmatched invocation is logged too.
        Assert.assertEquals(2, mock.getInvocationLog().size());
        Assert.assertEquals(1, context.getSignalledFailures().size());
        // .. but it is not an assertion.
        Assert.assertEquals(0, context.getAssertionCount());
    }

    @Test
    public void lenientMockReturnsDefaults_withoutFailure() throws IOException {
        ExecutionContext context = new ExecutionContext("lenient");
        context.bind();
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class), MockMode.LENIENT);
        Inventory inventory = mock.as(Inventory.class);

        Assert.assertEquals(0, inventory.stockOf("sku-1"));
        Assert.assertFalse(inventory.reserve("sku-1", 1));
        Assert.assertEquals(Collections.emptyList(), inventory.skus());
        Assert.assertEquals(Optional.empty(), inventory.describe("sku-1"));
        Assert.assertEquals("", inventory.name());
        inventory.restock("sku-1", 1);

        Assert.assertEquals(6, mock.getInvocationLog().getUnmatchedInvocations().size());
        Assert.assertTrue(context.getSignalledFailures().isEmpty());
    }

    @Test
    public void abstractCapabilityDefaults() {
        Mock mock = _engine.createMock(CapabilitySpec.named("Ledger")
                .member("balance", 1, ReturnKind.NUMBER)
                .member("isOpen", 0, ReturnKind.BOOLEAN)
                .member("owner", 0, ReturnKind.TEXT)
                .member("entries", 1, ReturnKind.COLLECTION)
                .member("lookup", 1, ReturnKind.OPTIONAL)
                .member("close", 0, ReturnKind.VOID)
                .member("raw", 0, ReturnKind.OBJECT)
                .build(), MockMode.LENIENT);

        Assert.assertEquals(0, mock.invoke("balance", "acc-1"));
        Assert.assertEquals(false, mock.invoke("isOpen"));
        Assert.assertEquals("", mock.invoke("owner"));
        Assert.assertEquals(Collections.emptyList(), mock.invoke("entries", "acc-1"));
        Assert.assertEquals(Optional.empty(), mock.invoke("lookup", "acc-1"));
        Assert.assertNull(mock.invoke("close"));
        Assert.assertNull(mock.invoke("raw"));
    }

    @Test
    public void raisesNewFaultEachTime() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("stockOf", eq("gone"))).raises(IllegalStateException.class);

        Inventory inventory = mock.as(Inventory.class);
        IllegalStateException first = null;
        for (int i = 0; i < 2; i++) {
            try {
                inventory.stockOf("gone");
                Assert.fail("Should have raised");
            }
            catch (IllegalStateException e) {
                Assert.assertNotSame(first, e);
                first = e;
            }
        }
    }

    @Test
    public void raisesDeclaredCheckedFaultThroughProxy() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        IOException fault = new IOException("disk full");
        _engine.setup(mock, anyArgs("restock")).raises(fault);

        try {
            mock.as(Inventory.class).restock("sku-1", 5);
            Assert.fail("Should have raised IOException");
        }
        catch (IOException e) {
            Assert.assertSame(fault, e);
        }
    }

    @Test
    public void raisesCheckedFaultThroughInvoke() {
        Mock mock = _engine.createMock(CapabilitySpec.named("Store")
                .member("load", 1, ReturnKind.OBJECT)
                .build());
        _engine.setup(mock, member("load", any())).raises(SQLException.class);

        try {
            mock.invoke("load", "key");
            Assert.fail("Should have raised SQLException");
        }
        catch (Exception e) {
            Assert.assertEquals(SQLException.class, e.getClass());
            Assert.assertTrue(e.getMessage().contains("load/1"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void undeclaredCheckedFaultIsRejected() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("stockOf", any())).raises(SQLException.class);
    }

    @Test(expected = IllegalArgumentException.class)
    public void returnValueOfWrongTypeIsRejected() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("stockOf", any())).returns("many");
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullForPrimitiveIsRejected() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("reserve", any(), any())).returns(null);
    }

    @Test
    public void matcherArityMustFitMember() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        try {
            _engine.setup(mock, member("reserve", any()));
            Assert.fail("Should have rejected arity 1 for reserve");
        }
        catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("taking 1 arguments"));
        }
        try {
            _engine.setup(mock, member("delete", any()));
            Assert.fail("Should have rejected unknown member");
        }
        catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("no member named [delete]"));
        }
    }

    @Test
    public void overloadsOfDifferentArityAreSeparateMembers() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        _engine.setup(mock, member("stockOf", any())).returns(1);
        _engine.setup(mock, member("stockOf", any(), eq("north"))).returns(2);

        Inventory inventory = mock.as(Inventory.class);
        Assert.assertEquals(1, inventory.stockOf("sku-1"));
        Assert.assertEquals(2, inventory.stockOf("sku-1", "north"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invokingUnknownMemberIsRejected() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class), MockMode.LENIENT);
        mock.invoke("stockOf", "a", "b", "c");
    }

    @Test
    public void proxyAnswersObjectMethodsLocally() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class));
        Inventory inventory = mock.as(Inventory.class);

        Assert.assertEquals(inventory, inventory);
        Assert.assertEquals(System.identityHashCode(inventory), inventory.hashCode());
        Assert.assertTrue(inventory.toString().contains(mock.getName()));
        Assert.assertEquals(0, mock.getInvocationLog().size());
        Assert.assertSame(inventory, mock.as(Inventory.class));
    }

    @Test
    public void resetForgetsExpectationsAndLog() {
        Mock mock = _engine.createMock(CapabilitySpec.of(Inventory.class), MockMode.LENIENT);
        _engine.setup(mock, member("stockOf", any())).returns(7);
        Assert.assertEquals(7, mock.as(Inventory.class).stockOf("x"));

        mock.reset();

        Assert.assertTrue(mock.getExpectations().isEmpty());
        Assert.assertEquals(0, mock.getInvocationLog().size());
        Assert.assertEquals(0, mock.as(Inventory.class).stockOf("x"));
    }
}
