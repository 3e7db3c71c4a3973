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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The execution context of one running {@link TestUnit}, bound to the thread executing its lifecycle. The Assertion
 * Engine and the Mock Engine report to the context bound to the calling thread: every assertion is counted, and every
 * failure is <i>signalled</i> before it is thrown. The signalling is what makes a failure stick even if code under
 * test catches and swallows the thrown error (typical for an unconfigured mock invocation deep inside a service).
 * <p>
 * A signalled failure may be withdrawn again by the one that legitimately consumed it, i.e. an {@code assertThrows}
 * expecting exactly that fault. Signals are keyed on the identity of the thrown carrier.
 * <p>
 * Thread-safety: The context is bound to one thread, but is read by the runner's supervising thread, so all access is
 * synchronized.
 */
public final class ExecutionContext {
    private static final ThreadLocal<ExecutionContext> __current = new ThreadLocal<>();

    private final String _name;
    private int _assertionCount;
    private final List<Signal> _signals = new ArrayList<>();

    public ExecutionContext(String name) {
        _name = name;
    }

    /**
     * @return the context bound to the current thread, if any.
     */
    public static Optional<ExecutionContext> current() {
        return Optional.ofNullable(__current.get());
    }

    /**
     * Binds this context to the current thread.
     *
     * @throws IllegalStateException
     *             if another context is already bound to the current thread.
     */
    public void bind() {
        ExecutionContext existing = __current.get();
        // ?: Is there already a context bound to this thread?
        if (existing != null && existing != this) {
            // -> Yes, and it isn't us: Nested units on the same thread is a usage error.
            throw new IllegalStateException("Thread [" + Thread.currentThread().getName()
                    + "] already has ExecutionContext [" + existing._name + "] bound, cannot bind [" + _name + "].");
        }
        __current.set(this);
    }

    /**
     * Unbinds whatever context is bound to the current thread.
     */
    public static void unbind() {
        __current.remove();
    }

    public String getName() {
        return _name;
    }

    /**
     * Counts one executed assertion, regardless of its outcome.
     */
    public synchronized void countAssertion() {
        _assertionCount++;
    }

    /**
     * @return the number of assertions executed within this context so far.
     */
    public synchronized int getAssertionCount() {
        return _assertionCount;
    }

    /**
     * Signals a failure, before the carrier is thrown. Signalling the same carrier twice has no effect.
     *
     * @param carrier
     *            the throwable that will be thrown to carry the failure.
     * @param failure
     *            the failure description.
     */
    public synchronized void signal(Throwable carrier, AssertionFailure failure) {
        for (Signal signal : _signals) {
            if (signal._carrier == carrier) {
                return;
            }
        }
        _signals.add(new Signal(carrier, failure));
    }

    /**
     * Withdraws a previously signalled failure, identified by its carrier.
     *
     * @return whether there was such a signalled failure.
     */
    public synchronized boolean withdraw(Throwable carrier) {
        return _signals.removeIf(signal -> signal._carrier == carrier);
    }

    /**
     * @return whether the given throwable is the carrier of a signalled failure.
     */
    public synchronized boolean isSignalled(Throwable carrier) {
        for (Signal signal : _signals) {
            if (signal._carrier == carrier) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return a snapshot of the signalled failures, in signalling order.
     */
    public synchronized List<AssertionFailure> getSignalledFailures() {
        List<AssertionFailure> failures = new ArrayList<>(_signals.size());
        for (Signal signal : _signals) {
            failures.add(signal._failure);
        }
        return Collections.unmodifiableList(failures);
    }

    /**
     * @return the carrier of the first signalled failure, if any.
     */
    public synchronized Optional<Throwable> getFirstSignalledCarrier() {
        return _signals.isEmpty() ? Optional.empty() : Optional.of(_signals.get(0)._carrier);
    }

    private static final class Signal {
        private final Throwable _carrier;
        private final AssertionFailure _failure;

        private Signal(Throwable carrier, AssertionFailure failure) {
            _carrier = carrier;
            _failure = failure;
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext[" + _name + "]";
    }
}
