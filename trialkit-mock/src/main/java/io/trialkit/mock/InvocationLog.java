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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import io.trialkit.mock.CapabilitySpec.Member;

/**
 * The ordered log of all invocations of one {@link Mock}: the single source of truth for invocation counts.
 * <p>
 * Unsynchronized by default, mocks being owned by one test case. The synchronized variant appends under a single
 * writer lock, so that sequence numbers follow append order, and reads take a snapshot under the same lock.
 */
public final class InvocationLog {
    private final ReentrantLock _lock;
    private final List<Invocation> _invocations = new ArrayList<>();

    private InvocationLog(ReentrantLock lock) {
        _lock = lock;
    }

    static InvocationLog unsynchronized() {
        return new InvocationLog(null);
    }

    static InvocationLog synchronizedLog() {
        return new InvocationLog(new ReentrantLock());
    }

    public boolean isSynchronized() {
        return _lock != null;
    }

    /**
     * Appends an invocation, assigning timestamp and sequence number. The arguments must be an unmodifiable copy.
     */
    Invocation record(Member member, List<Object> arguments, Expectation resolvedBy) {
        lock();
        try {
            Invocation invocation = new Invocation(member, arguments, Instant.now(), _invocations.size(),
                    resolvedBy);
            _invocations.add(invocation);
            return invocation;
        }
        finally {
            unlock();
        }
    }

    /**
     * @return a snapshot of all invocations, in sequence order.
     */
    public List<Invocation> getInvocations() {
        lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(_invocations));
        }
        finally {
            unlock();
        }
    }

    /**
     * @return a snapshot of the invocations selected by the matcher, in sequence order.
     */
    public List<Invocation> getInvocations(MemberMatcher matcher) {
        List<Invocation> selected = new ArrayList<>();
        for (Invocation invocation : getInvocations()) {
            if (matcher.matches(invocation)) {
                selected.add(invocation);
            }
        }
        return selected;
    }

    /**
     * @return a snapshot of the invocations no expectation matched.
     */
    public List<Invocation> getUnmatchedInvocations() {
        List<Invocation> unmatched = new ArrayList<>();
        for (Invocation invocation : getInvocations()) {
            if (!invocation.isMatched()) {
                unmatched.add(invocation);
            }
        }
        return unmatched;
    }

    public int size() {
        lock();
        try {
            return _invocations.size();
        }
        finally {
            unlock();
        }
    }

    void clear() {
        lock();
        try {
            _invocations.clear();
        }
        finally {
            unlock();
        }
    }

    private void lock() {
        if (_lock != null) {
            _lock.lock();
        }
    }

    private void unlock() {
        if (_lock != null) {
            _lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "InvocationLog[size=" + size() + (isSynchronized() ? ", synchronized" : "") + "]";
    }
}
