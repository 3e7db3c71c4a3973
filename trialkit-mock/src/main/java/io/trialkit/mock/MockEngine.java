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

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.assertion.AssertionFailedError;
import io.trialkit.assertion.AssertionSupport;
import io.trialkit.mock.CapabilitySpec.Member;

/**
 * Creates {@link Mock}s, configures their {@link Expectation}s, and verifies their invocations.
 *
 * <pre>
 * MockEngine engine = MockEngine.create();
 * Mock inventory = engine.createMock(CapabilitySpec.of(Inventory.class));
 * engine.setup(inventory, member("stockOf", eq("sku-1"))).returns(5);
 * engine.setup(inventory, member("stockOf", any())).returns(0);
 *
 * service.placeOrder(inventory.as(Inventory.class), "sku-1");
 *
 * engine.verify(inventory, member("stockOf", any()), 1);
 * </pre>
 *
 * Expectations are resolved in registration order, so register the specific ones before the broad ones.
 * Verification goes through the Assertion Engine: it counts as an assertion, and a mismatch fails like one.
 * <p>
 * The engine itself is thread-safe. Mocks are owned by one test case, and are not safe for concurrent invocation
 * unless created with {@link #createSharedMock(CapabilitySpec)} or from an engine configured with
 * {@link MockConfig#synchronizedLogging(boolean) synchronized logging}.
 */
public class MockEngine {
    private static final Logger log = LoggerFactory.getLogger(MockEngine.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    private final MockConfig _config;
    private final AtomicInteger _mockNumber = new AtomicInteger();
    private final List<Mock> _mocks = new CopyOnWriteArrayList<>();

    protected MockEngine(MockConfig config) {
        _config = config;
    }

    /**
     * @return an engine with the default {@link MockConfig}, i.e. mode from System Property
     *         {@link MockConfig#SYSPROP_MOCK_MODE}, default strict.
     */
    public static MockEngine create() {
        return new MockEngine(MockConfig.create());
    }

    public static MockEngine create(MockConfig config) {
        if (config == null) {
            throw new NullPointerException("config");
        }
        return new MockEngine(config);
    }

    public MockConfig getConfig() {
        return _config;
    }

    /**
     * Creates a mock in the engine's default mode.
     */
    public Mock createMock(CapabilitySpec spec) {
        return createMock(spec, _config.getDefaultMode());
    }

    public Mock createMock(CapabilitySpec spec, MockMode mode) {
        return register(spec, mode, _config.isSynchronizedLogging());
    }

    /**
     * Creates a mock in the engine's default mode that may be invoked concurrently, e.g. one held by a shared
     * fixture: its log is appended under a single writer lock.
     */
    public Mock createSharedMock(CapabilitySpec spec) {
        return createSharedMock(spec, _config.getDefaultMode());
    }

    public Mock createSharedMock(CapabilitySpec spec, MockMode mode) {
        return register(spec, mode, true);
    }

    private Mock register(CapabilitySpec spec, MockMode mode, boolean synchronizedLogging) {
        if (spec == null) {
            throw new NullPointerException("spec");
        }
        if (mode == null) {
            throw new NullPointerException("mode");
        }
        String name = spec.getName() + "#" + _mockNumber.incrementAndGet();
        Mock mock = new Mock(name, spec, mode,
                synchronizedLogging ? InvocationLog.synchronizedLog() : InvocationLog.unsynchronized());
        _mocks.add(mock);
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Created " + mock + " for " + spec);
        return mock;
    }

    /**
     * @return the mocks created by this engine and not yet discarded.
     */
    public List<Mock> getMocks() {
        return new ArrayList<>(_mocks);
    }

    /**
     * Resets and forgets all mocks created by this engine - their expectations die with them.
     */
    public void discardAll() {
        for (Mock mock : _mocks) {
            mock.reset();
        }
        _mocks.clear();
    }

    /**
     * Starts configuring an expectation; it is registered, and takes part in resolution, once completed with
     * {@link Stubbing#returns(Object) returns(..)} or {@link Stubbing#raises(Class) raises(..)}.
     *
     * @throws IllegalArgumentException
     *             if the matcher fits no member of the mock's capability (unknown name, or wrong number of argument
     *             matchers).
     */
    public Stubbing setup(Mock mock, MemberMatcher matcher) {
        if (mock == null) {
            throw new NullPointerException("mock");
        }
        if (matcher == null) {
            throw new NullPointerException("matcher");
        }
        matcher.validateAgainst(mock.getCapabilitySpec());
        return new Stubbing(mock, matcher);
    }

    /**
     * Asserts that exactly <code>expectedCount</code> logged invocations of the mock are selected by the matcher. The
     * count is recomputed from the {@link InvocationLog}, including invocations that no expectation resolved.
     *
     * @throws AssertionFailedError
     *             if the count differs, with the matcher, both counts and the member's logged invocations in the
     *             message.
     */
    public void verify(Mock mock, MemberMatcher matcher, int expectedCount) {
        if (mock == null) {
            throw new NullPointerException("mock");
        }
        if (expectedCount < 0) {
            throw new IllegalArgumentException("expectedCount must be >= 0, was [" + expectedCount + "].");
        }
        matcher.validateAgainst(mock.getCapabilitySpec());
        AssertionSupport.countAssertion();
        List<Invocation> invocations = mock.getInvocationLog().getInvocations();
        int actualCount = 0;
        for (Invocation invocation : invocations) {
            if (matcher.matches(invocation)) {
                actualCount++;
            }
        }
        if (actualCount == expectedCount) {
            return;
        }
        StringBuilder logged = new StringBuilder();
        for (Invocation invocation : invocations) {
            if (invocation.getMember().getName().equals(matcher.getMemberName())) {
                logged.append("\n    ").append(invocation.describe());
            }
        }
        String message = "Verification failed for mock [" + mock.getName() + "]: " + matcher.describe()
                + " expected <" + expectedCount + "> invocations but was <" + actualCount + ">. Logged invocations of ["
                + matcher.getMemberName() + "]:" + (logged.length() == 0 ? " none" : logged.toString());
        throw AssertionSupport.failure(message, expectedCount, actualCount, null, MockEngine.class);
    }

    /**
     * Asserts that no logged invocation of the mock went unmatched - relevant for lenient mocks, where unmatched
     * invocations silently return defaults.
     */
    public void verifyNoUnmatchedInvocations(Mock mock) {
        if (mock == null) {
            throw new NullPointerException("mock");
        }
        AssertionSupport.countAssertion();
        List<Invocation> unmatched = mock.getInvocationLog().getUnmatchedInvocations();
        if (unmatched.isEmpty()) {
            return;
        }
        StringBuilder buf = new StringBuilder();
        for (Invocation invocation : unmatched) {
            buf.append("\n    ").append(invocation.describe());
        }
        throw AssertionSupport.failure("Mock [" + mock.getName() + "] has " + unmatched.size()
                + " unmatched invocation(s):" + buf, 0, unmatched.size(), null, MockEngine.class);
    }

    /**
     * Completes an expectation started by {@link MockEngine#setup(Mock, MemberMatcher)}.
     */
    public static final class Stubbing {
        private final Mock _mock;
        private final MemberMatcher _matcher;

        private Stubbing(Mock mock, MemberMatcher matcher) {
            _mock = mock;
            _matcher = matcher;
        }

        /**
         * The selected invocations return the value.
         *
         * @throws IllegalArgumentException
         *             if the value does not fit the return type of a selected member.
         */
        public Expectation returns(Object value) {
            for (Member member : selectedMembers()) {
                if (!member.accepts(value)) {
                    throw new IllegalArgumentException("Value [" + value + "]"
                            + (value != null ? " of type [" + value.getClass().getName() + "]" : "")
                            + " does not fit member [" + member + "] of mock [" + _mock.getName() + "].");
                }
            }
            return _mock.addExpectation(_matcher, (member, arguments) -> value);
        }

        /**
         * The selected invocations return the member's default value, as a lenient mock would for an unmatched
         * invocation - but counted as matched.
         */
        public Expectation returnsDefault() {
            return _mock.addExpectation(_matcher, (member, arguments) -> DefaultValues.forMember(member));
        }

        /**
         * The selected invocations raise a new instance of the fault kind each time, created through its
         * <code>(String message)</code> constructor, or else its no-args constructor.
         *
         * @throws IllegalArgumentException
         *             if the fault kind cannot be instantiated, or is a checked exception not declared by a selected
         *             member.
         */
        public Expectation raises(Class<? extends Throwable> faultKind) {
            if (faultKind == null) {
                throw new NullPointerException("faultKind");
            }
            checkMayRaise(faultKind);
            Constructor<? extends Throwable> constructor = faultConstructor(faultKind);
            return _mock.addExpectation(_matcher, (member, arguments) -> {
                throw constructor.getParameterCount() == 1
                        ? constructor.newInstance("Raised by mock [" + _mock.getName() + "] on [" + member.getId()
                                + "]")
                        : constructor.newInstance();
            });
        }

        /**
         * The selected invocations raise the given fault instance.
         */
        public Expectation raises(Throwable fault) {
            if (fault == null) {
                throw new NullPointerException("fault");
            }
            checkMayRaise(fault.getClass());
            return _mock.addExpectation(_matcher, (member, arguments) -> {
                throw fault;
            });
        }

        private void checkMayRaise(Class<? extends Throwable> faultKind) {
            for (Member member : selectedMembers()) {
                if (!member.mayRaise(faultKind)) {
                    throw new IllegalArgumentException("Member [" + member + "] of mock [" + _mock.getName()
                            + "] does not declare checked fault [" + faultKind.getName() + "].");
                }
            }
        }

        private List<Member> selectedMembers() {
            List<Member> selected = new ArrayList<>();
            for (Member member : _mock.getCapabilitySpec().getMembers()) {
                if (member.getName().equals(_matcher.getMemberName())
                        && (_matcher.getArity() < 0 || member.getArity() == _matcher.getArity())) {
                    selected.add(member);
                }
            }
            return selected;
        }

        private static Constructor<? extends Throwable> faultConstructor(Class<? extends Throwable> faultKind) {
            if (Modifier.isAbstract(faultKind.getModifiers())) {
                throw new IllegalArgumentException("Fault kind [" + faultKind.getName() + "] is abstract.");
            }
            try {
                return accessible(faultKind.getConstructor(String.class));
            }
            catch (NoSuchMethodException e) {
                try {
                    return accessible(faultKind.getConstructor());
                }
                catch (NoSuchMethodException e2) {
                    throw new IllegalArgumentException("Fault kind [" + faultKind.getName() + "] has neither a"
                            + " public (String) nor a public no-args constructor - use raises(Throwable).", e2);
                }
            }
        }

        private static <T> Constructor<T> accessible(Constructor<T> constructor) {
            if (!Modifier.isPublic(constructor.getDeclaringClass().getModifiers())) {
                constructor.setAccessible(true);
            }
            return constructor;
        }
    }

    @Override
    public String toString() {
        return "MockEngine[" + _config + ", mocks=" + _mocks.size() + "]";
    }
}
