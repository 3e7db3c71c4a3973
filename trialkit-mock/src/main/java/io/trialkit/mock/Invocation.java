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
import java.util.List;

import io.trialkit.assertion.StructuralEquality;
import io.trialkit.mock.CapabilitySpec.Member;

/**
 * One logged invocation of a {@link Mock}: the member, a copy of the arguments, when it happened, its sequence number
 * within the mock's log, and the {@link Expectation} that resolved it (absent if unmatched). Immutable.
 */
public final class Invocation {
    private final Member _member;
    private final List<Object> _arguments;
    private final Instant _timestamp;
    private final long _sequence;
    private final Expectation _resolvedBy;

    Invocation(Member member, List<Object> arguments, Instant timestamp, long sequence, Expectation resolvedBy) {
        _member = member;
        _arguments = arguments;
        _timestamp = timestamp;
        _sequence = sequence;
        _resolvedBy = resolvedBy;
    }

    public Member getMember() {
        return _member;
    }

    /**
     * @return the member identifier, <code>"name/arity"</code>.
     */
    public String getMemberId() {
        return _member.getId();
    }

    /**
     * @return unmodifiable copy of the arguments as given (elements may be <code>null</code>).
     */
    public List<Object> getArguments() {
        return _arguments;
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    /**
     * @return 0-based position within the owning mock's log.
     */
    public long getSequence() {
        return _sequence;
    }

    /**
     * @return the expectation that resolved this invocation, or <code>null</code> if none matched.
     */
    public Expectation getResolvedBy() {
        return _resolvedBy;
    }

    public boolean isMatched() {
        return _resolvedBy != null;
    }

    /**
     * @return e.g. <code>#3 reserve("sku-1", 2)</code>.
     */
    public String describe() {
        StringBuilder buf = new StringBuilder("#").append(_sequence).append(' ')
                .append(_member.getName()).append('(');
        for (int i = 0; i < _arguments.size(); i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(StructuralEquality.render(_arguments.get(i)));
        }
        buf.append(')');
        if (_resolvedBy == null) {
            buf.append(" [unmatched]");
        }
        return buf.toString();
    }

    @Override
    public String toString() {
        return "Invocation[" + describe() + " @" + _timestamp + "]";
    }
}
