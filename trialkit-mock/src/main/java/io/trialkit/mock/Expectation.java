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

import java.util.List;

import io.trialkit.mock.CapabilitySpec.Member;

/**
 * A configured response rule on a {@link Mock}: the {@link MemberMatcher} selecting invocations, and the return value
 * or fault to raise. Owned by its mock, and discarded with it.
 * <p>
 * The invocation count is not kept as a counter: {@link #getInvocationCount()} derives it from the owning mock's
 * {@link InvocationLog} every time, so it can never drift from what was actually logged.
 */
public final class Expectation {
    private final Mock _mock;
    private final MemberMatcher _matcher;
    private final int _registrationIndex;
    private final Answer _answer;

    Expectation(Mock mock, MemberMatcher matcher, int registrationIndex, Answer answer) {
        _mock = mock;
        _matcher = matcher;
        _registrationIndex = registrationIndex;
        _answer = answer;
    }

    /**
     * What the expectation does when it resolves an invocation.
     */
    @FunctionalInterface
    interface Answer {
        Object answer(Member member, List<Object> arguments) throws Throwable;
    }

    public MemberMatcher getMatcher() {
        return _matcher;
    }

    /**
     * @return 0-based position in the owning mock's resolution order.
     */
    public int getRegistrationIndex() {
        return _registrationIndex;
    }

    /**
     * @return the number of logged invocations this expectation resolved, recomputed from the log.
     */
    public int getInvocationCount() {
        int count = 0;
        for (Invocation invocation : _mock.getInvocationLog().getInvocations()) {
            if (invocation.getResolvedBy() == this) {
                count++;
            }
        }
        return count;
    }

    boolean appliesTo(Member member, List<Object> arguments) {
        return _matcher.matches(member, arguments);
    }

    Object answer(Member member, List<Object> arguments) throws Throwable {
        return _answer.answer(member, arguments);
    }

    @Override
    public String toString() {
        return "Expectation[#" + _registrationIndex + " " + _matcher.describe() + " on " + _mock.getName() + "]";
    }
}
