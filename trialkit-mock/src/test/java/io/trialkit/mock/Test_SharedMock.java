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
import static io.trialkit.mock.MemberMatcher.member;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A shared mock logs concurrent invocations without losing any, with unique sequence numbers in append order.
 */
public class Test_SharedMock {
    private static final Logger log = LoggerFactory.getLogger(Test_SharedMock.class);

    private static final int THREADS = 8;
    private static final int INVOCATIONS_PER_THREAD = 500;

    @Test
    public void sharedMockLogsAllConcurrentInvocations() throws InterruptedException {
        runConcurrently(MockEngine.create().createSharedMock(CapabilitySpec.of(Inventory.class), MockMode.LENIENT));
    }

    @Test
    public void engineWideSynchronizedLogging() throws InterruptedException {
        MockEngine engine = MockEngine.create(MockConfig.create()
                .defaultMode(MockMode.LENIENT)
                .synchronizedLogging(true));
        Mock mock = engine.createMock(CapabilitySpec.of(Inventory.class));
        Assert.assertTrue(mock.getInvocationLog().isSynchronized());
        runConcurrently(mock);
    }

    @Test
    public void unsharedMockHasUnsynchronizedLog() {
        Mock mock = MockEngine.create().createMock(CapabilitySpec.of(Inventory.class));
        Assert.assertFalse(mock.getInvocationLog().isSynchronized());
    }

    private void runConcurrently(Mock mock) throws InterruptedException {
        MockEngine engine = MockEngine.create();
        engine.setup(mock, member("stockOf", any())).returns(1);
        Inventory inventory = mock.as(Inventory.class);

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < THREADS; t++) {
            int thread = t;
            executor.execute(() -> {
                try {
                    start.await();
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < INVOCATIONS_PER_THREAD; i++) {
                    inventory.stockOf("t" + thread + "-" + i);
                }
            });
        }
        start.countDown();
        executor.shutdown();
        Assert.assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        List<Invocation> invocations = mock.getInvocationLog().getInvocations();
        log.info("Logged [" + invocations.size() + "] invocations from [" + THREADS + "] threads.");
        Assert.assertEquals(THREADS * INVOCATIONS_PER_THREAD, invocations.size());
        Set<String> distinctArguments = new HashSet<>();
        for (int i = 0; i < invocations.size(); i++) {
            Assert.assertEquals(i, invocations.get(i).getSequence());
            distinctArguments.add((String) invocations.get(i).getArguments().get(0));
        }
        Assert.assertEquals(THREADS * INVOCATIONS_PER_THREAD, distinctArguments.size());
        engine.verify(mock, member("stockOf", any()), THREADS * INVOCATIONS_PER_THREAD);
    }
}
