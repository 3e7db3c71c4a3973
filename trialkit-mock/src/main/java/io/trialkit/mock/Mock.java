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

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.AssertionFailure;
import io.trialkit.FaultKind;
import io.trialkit.assertion.AssertionSupport;
import io.trialkit.mock.CapabilitySpec.Member;

/**
 * A substitute implementation of a capability. Every invocation is resolved against the {@link Expectation}s in
 * registration order, the first one whose {@link MemberMatcher} selects the invocation wins. If none does, a
 * {@link MockMode#STRICT STRICT} mock raises {@link UnconfiguredInvocationException}, while a
 * {@link MockMode#LENIENT LENIENT} mock returns the member's default value. Either way the invocation is logged. A
 * mock never forwards to a real implementation.
 * <p>
 * Invoke members either by name through {@link #invoke(String, Object...)}, or, for capabilities derived from an
 * interface, through the typed proxy from {@link #as(Class)}.
 * <p>
 * Created by {@link MockEngine}.
 */
public final class Mock {
    private static final Logger log = LoggerFactory.getLogger(Mock.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    private final String _name;
    private final CapabilitySpec _spec;
    private final MockMode _mode;
    private final InvocationLog _invocationLog;
    private final List<Expectation> _expectations = new CopyOnWriteArrayList<>();

    private volatile Object _proxy;

    Mock(String name, CapabilitySpec spec, MockMode mode, InvocationLog invocationLog) {
        _name = name;
        _spec = spec;
        _mode = mode;
        _invocationLog = invocationLog;
    }

    public String getName() {
        return _name;
    }

    public CapabilitySpec getCapabilitySpec() {
        return _spec;
    }

    public MockMode getMode() {
        return _mode;
    }

    public InvocationLog getInvocationLog() {
        return _invocationLog;
    }

    /**
     * @return the expectations, in registration (= resolution) order.
     */
    public List<Expectation> getExpectations() {
        return Collections.unmodifiableList(_expectations);
    }

    /**
     * Invokes the member with the given name and arity (the number of arguments). A fault configured with
     * {@link MockEngine.Stubbing#raises(Class) raises(..)} is thrown as is, also when it is a checked exception.
     *
     * @return the configured value, or the default value if unmatched on a lenient mock.
     * @throws IllegalArgumentException
     *             if the capability has no such member - nothing is logged then.
     * @throws UnconfiguredInvocationException
     *             if unmatched on a strict mock.
     */
    public Object invoke(String memberName, Object... arguments) {
        Object[] args = arguments == null ? new Object[] { null } : arguments;
        Member member = _spec.getMember(memberName, args.length);
        return dispatch(member, args);
    }

    /**
     * @return the typed proxy of this mock, for capabilities derived with {@link CapabilitySpec#of(Class)}. The
     *         methods of {@link Object} are answered by the proxy itself, and are not logged.
     * @throws IllegalArgumentException
     *             if the capability was not derived from the given interface.
     */
    @SuppressWarnings("unchecked")
    public <T> T as(Class<T> interfaceType) {
        if (_spec.getInterfaceType() != interfaceType) {
            throw new IllegalArgumentException("Mock [" + _name + "] of " + _spec + " was not derived from interface ["
                    + interfaceType.getName() + "].");
        }
        // Benign race: two proxies may be created, both are equivalent.
        if (_proxy == null) {
            _proxy = Proxy.newProxyInstance(interfaceType.getClassLoader(), new Class<?>[] { interfaceType },
                    new MockInvocationHandler());
        }
        return (T) _proxy;
    }

    /**
     * Removes all expectations and clears the invocation log.
     */
    public void reset() {
        _expectations.clear();
        _invocationLog.clear();
    }

    Expectation addExpectation(MemberMatcher matcher, Expectation.Answer answer) {
        matcher.validateAgainst(_spec);
        // Registration order is the order of completed stubbings, thus synchronized on the list's own monitor.
        synchronized (_expectations) {
            Expectation expectation = new Expectation(this, matcher, _expectations.size(), answer);
            _expectations.add(expectation);
            return expectation;
        }
    }

    private Object dispatch(Member member, Object[] args) {
        List<Object> arguments = Collections.unmodifiableList(Arrays.asList(args.clone()));
        Expectation resolvedBy = null;
        for (Expectation expectation : _expectations) {
            if (expectation.appliesTo(member, arguments)) {
                resolvedBy = expectation;
                break;
            }
        }
        Invocation invocation = _invocationLog.record(member, arguments, resolvedBy);
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Mock [" + _name + "] invoked: " + invocation.describe()
                + (resolvedBy != null ? " resolved by #" + resolvedBy.getRegistrationIndex() : ""));

        // ?: Did an expectation match?
        if (resolvedBy != null) {
            // -> Yes, so it answers.
            try {
                return resolvedBy.answer(member, arguments);
            }
            catch (Throwable t) {
                throw Mock.<RuntimeException> sneakyThrow(t);
            }
        }
        // E-> No match. ?: Lenient?
        if (_mode == MockMode.LENIENT) {
            // -> Yes, so default value.
            return DefaultValues.forMember(member);
        }
        // E-> Strict: this is a failure, surfaced as an assertion failure.
        AssertionFailure failure = AssertionSupport.describe(FaultKind.UNCONFIGURED_INVOCATION,
                "Unconfigured invocation on strict mock [" + _name + "]: " + invocation.describe()
                        + " - configured: " + describeExpectations(member),
                null, invocation.describe(), Mock.class, MockInvocationHandler.class, MockEngine.class);
        log.warn(LOG_PREFIX + failure.getMessage());
        UnconfiguredInvocationException exception = new UnconfiguredInvocationException(failure, invocation);
        exception.signal();
        throw exception;
    }

    private String describeExpectations(Member member) {
        StringBuilder buf = new StringBuilder("[");
        for (Expectation expectation : _expectations) {
            if (expectation.getMatcher().getMemberName().equals(member.getName())) {
                if (buf.length() > 1) {
                    buf.append(", ");
                }
                buf.append(expectation.getMatcher().describe());
            }
        }
        return buf.append(']').toString();
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }

    /**
     * Answers the typed proxy.
     */
    private class MockInvocationHandler implements InvocationHandler {
        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            // :: First handle the methods of Object, answered by the proxy itself.
            if (method.getDeclaringClass() == Object.class) {
                switch (method.getName()) {
                    case "equals":
                        return proxy == args[0];
                    case "hashCode":
                        return System.identityHashCode(proxy);
                    case "toString":
                        return "MockProxy[" + _name + "]";
                    default:
                        throw new IllegalStateException("Unexpected Object method [" + method + "].");
                }
            }
            // E-> Capability member. Note: no-args methods get null, not zero-length array.
            Object[] actualArgs = args == null ? new Object[0] : args;
            Member member = _spec.getMember(method.getName(), actualArgs.length);
            return dispatch(member, actualArgs);
        }
    }

    @Override
    public String toString() {
        return "Mock[" + _name + ", " + _mode + ", expectations=" + _expectations.size() + ", invocations="
                + _invocationLog.size() + "]";
    }
}
