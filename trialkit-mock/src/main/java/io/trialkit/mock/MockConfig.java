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

/**
 * Configuration of a {@link MockEngine}.
 * <p>
 * The default {@link MockMode} is {@link MockMode#STRICT STRICT}, unless the System Property
 * {@link #SYSPROP_MOCK_MODE "trialkit.mock.mode"} is set to <code>"lenient"</code>.
 */
public final class MockConfig {
    /**
     * System property ("-D" jvm argument) overriding the default mode, value <code>"strict"</code> or
     * <code>"lenient"</code>.
     * <p>
     * Value is {@code "trialkit.mock.mode"}
     */
    public static final String SYSPROP_MOCK_MODE = "trialkit.mock.mode";

    private MockMode _defaultMode;
    private boolean _synchronizedLogging;

    private MockConfig(MockMode defaultMode) {
        _defaultMode = defaultMode;
    }

    /**
     * @return a config with the default mode resolved from {@link #SYSPROP_MOCK_MODE}, and unsynchronized logging.
     */
    public static MockConfig create() {
        String sysprop = System.getProperty(SYSPROP_MOCK_MODE);
        // ?: Was it set?
        if (sysprop == null) {
            // -> No, so default strict.
            return new MockConfig(MockMode.STRICT);
        }
        // E-> Set, so it must be one of the modes.
        for (MockMode mode : MockMode.values()) {
            if (mode.name().equalsIgnoreCase(sysprop.trim())) {
                return new MockConfig(mode);
            }
        }
        throw new IllegalArgumentException("System Property [" + SYSPROP_MOCK_MODE + "] must be 'strict' or"
                + " 'lenient', was [" + sysprop + "].");
    }

    public MockMode getDefaultMode() {
        return _defaultMode;
    }

    public MockConfig defaultMode(MockMode defaultMode) {
        if (defaultMode == null) {
            throw new NullPointerException("defaultMode");
        }
        _defaultMode = defaultMode;
        return this;
    }

    /**
     * @return whether all mocks of the engine log invocations under a single-writer lock.
     */
    public boolean isSynchronizedLogging() {
        return _synchronizedLogging;
    }

    /**
     * Makes every mock created by the engine safe for concurrent invocation, at the cost of a lock per invocation.
     * Without this, concurrent invocation of one mock from several threads is undefined - use
     * {@link MockEngine#createSharedMock(CapabilitySpec)} for single mocks that must be shared.
     */
    public MockConfig synchronizedLogging(boolean synchronizedLogging) {
        _synchronizedLogging = synchronizedLogging;
        return this;
    }

    @Override
    public String toString() {
        return "MockConfig[defaultMode=" + _defaultMode + ", synchronizedLogging=" + _synchronizedLogging + "]";
    }
}
