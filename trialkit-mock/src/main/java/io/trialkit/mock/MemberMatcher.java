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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import io.trialkit.mock.CapabilitySpec.Member;

/**
 * Selects invocations of one capability member by name and per-position {@link ArgMatcher}s, evaluated left to right;
 * all positions must match. The number of argument matchers is the member's arity, and must fit the capability.
 * {@link #anyArgs(String)} selects every invocation of the named member(s), regardless of arity.
 */
public final class MemberMatcher {
    private final String _memberName;
    private final List<ArgMatcher> _argMatchers;

    private MemberMatcher(String memberName, List<ArgMatcher> argMatchers) {
        _memberName = memberName;
        _argMatchers = argMatchers;
    }

    /**
     * @param memberName
     *            the member's name.
     * @param argMatchers
     *            one matcher per argument position, as many as the member's arity.
     */
    public static MemberMatcher member(String memberName, ArgMatcher... argMatchers) {
        Objects.requireNonNull(memberName, "memberName");
        for (ArgMatcher argMatcher : argMatchers) {
            Objects.requireNonNull(argMatcher, "argMatcher");
        }
        return new MemberMatcher(memberName, Arrays.asList(argMatchers.clone()));
    }

    /**
     * Selects all invocations of members with this name.
     */
    public static MemberMatcher anyArgs(String memberName) {
        Objects.requireNonNull(memberName, "memberName");
        return new MemberMatcher(memberName, null);
    }

    public String getMemberName() {
        return _memberName;
    }

    /**
     * @return the arity this matcher targets, or -1 for {@link #anyArgs(String)}.
     */
    public int getArity() {
        return _argMatchers == null ? -1 : _argMatchers.size();
    }

    /**
     * @throws IllegalArgumentException
     *             if the capability has no member this matcher can ever select.
     */
    void validateAgainst(CapabilitySpec spec) {
        // ?: Any arity?
        if (_argMatchers == null) {
            // -> Yes, so just the name must exist.
            if (!spec.hasMemberNamed(_memberName)) {
                throw new IllegalArgumentException("Capability [" + spec.getName() + "] has no member named ["
                        + _memberName + "].");
            }
            return;
        }
        if (spec.findMember(_memberName, _argMatchers.size()) == null) {
            String problem = spec.hasMemberNamed(_memberName)
                    ? "has no member [" + _memberName + "] taking " + _argMatchers.size() + " arguments"
                    : "has no member named [" + _memberName + "]";
            throw new IllegalArgumentException("MemberMatcher " + describe() + " does not fit: capability ["
                    + spec.getName() + "] " + problem + ", members are " + describeMembers(spec) + ".");
        }
    }

    /**
     * @return whether the invocation of the member with the given arguments is selected by this matcher.
     */
    boolean matches(Member member, List<Object> args) {
        if (!member.getName().equals(_memberName)) {
            return false;
        }
        if (_argMatchers == null) {
            return true;
        }
        if (args.size() != _argMatchers.size()) {
            return false;
        }
        for (int i = 0; i < _argMatchers.size(); i++) {
            if (!_argMatchers.get(i).matches(args.get(i))) {
                return false;
            }
        }
        return true;
    }

    boolean matches(Invocation invocation) {
        return matches(invocation.getMember(), invocation.getArguments());
    }

    /**
     * @return e.g. <code>reserve(eq("sku-1"), any())</code>.
     */
    public String describe() {
        if (_argMatchers == null) {
            return _memberName + "(..)";
        }
        StringBuilder buf = new StringBuilder(_memberName).append('(');
        for (int i = 0; i < _argMatchers.size(); i++) {
            if (i > 0) {
                buf.append(", ");
            }
            buf.append(_argMatchers.get(i).describe());
        }
        return buf.append(')').toString();
    }

    private static String describeMembers(CapabilitySpec spec) {
        StringBuilder buf = new StringBuilder("[");
        for (Member member : spec.getMembers()) {
            if (buf.length() > 1) {
                buf.append(", ");
            }
            buf.append(member.getId());
        }
        return buf.append(']').toString();
    }

    @Override
    public String toString() {
        return "MemberMatcher[" + describe() + "]";
    }
}
