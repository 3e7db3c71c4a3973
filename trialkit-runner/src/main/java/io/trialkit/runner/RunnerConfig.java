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

package io.trialkit.runner;

import java.time.Duration;

/**
 * Configuration of a {@link StandardTestRunner}. Defaults come from System Properties ("-D" jvm arguments), so that a
 * build can tune a run without code changes:
 * <ul>
 * <li>{@link #SYSPROP_CONCURRENCY "trialkit.concurrency"}: default concurrency limit, default
 * <code>min(4, availableProcessors)</code>.</li>
 * <li>{@link #SYSPROP_TIMEOUT_MILLIS "trialkit.timeoutMillis"}: default per-unit timeout, default 30 000.</li>
 * <li>{@link #SYSPROP_DEADLINE_MILLIS "trialkit.deadlineMillis"}: global deadline of a run, default none.</li>
 * <li>{@link #SYSPROP_TEAR_DOWN_GRACE_MILLIS "trialkit.tearDownGraceMillis"}: how long tear-down of a timed out unit
 * may take, default 2 000.</li>
 * </ul>
 */
public final class RunnerConfig {
    public static final String SYSPROP_CONCURRENCY = "trialkit.concurrency";
    public static final String SYSPROP_TIMEOUT_MILLIS = "trialkit.timeoutMillis";
    public static final String SYSPROP_DEADLINE_MILLIS = "trialkit.deadlineMillis";
    public static final String SYSPROP_TEAR_DOWN_GRACE_MILLIS = "trialkit.tearDownGraceMillis";

    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000;
    public static final long DEFAULT_TEAR_DOWN_GRACE_MILLIS = 2_000;

    private int _concurrencyLimit;
    private Duration _defaultTimeout;
    private Duration _globalDeadline;
    private Duration _tearDownGrace;

    private RunnerConfig() {
    }

    /**
     * @return a config with defaults from the System Properties.
     * @throws IllegalArgumentException
     *             if a System Property is set to an invalid value.
     */
    public static RunnerConfig create() {
        RunnerConfig config = new RunnerConfig();
        config.concurrencyLimit((int) longProperty(SYSPROP_CONCURRENCY,
                Math.min(4, Runtime.getRuntime().availableProcessors())));
        config.defaultTimeout(Duration.ofMillis(longProperty(SYSPROP_TIMEOUT_MILLIS, DEFAULT_TIMEOUT_MILLIS)));
        long deadline = longProperty(SYSPROP_DEADLINE_MILLIS, -1);
        config.globalDeadline(deadline == -1 ? null : Duration.ofMillis(deadline));
        config.tearDownGrace(Duration.ofMillis(longProperty(SYSPROP_TEAR_DOWN_GRACE_MILLIS,
                DEFAULT_TEAR_DOWN_GRACE_MILLIS)));
        return config;
    }

    private static long longProperty(String name, long defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("System Property [" + name + "] must be an integer, was [" + value
                    + "].", e);
        }
    }

    public int getConcurrencyLimit() {
        return _concurrencyLimit;
    }

    /**
     * Default number of units executing in parallel, 1 meaning sequential.
     */
    public RunnerConfig concurrencyLimit(int concurrencyLimit) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, was [" + concurrencyLimit + "].");
        }
        _concurrencyLimit = concurrencyLimit;
        return this;
    }

    public Duration getDefaultTimeout() {
        return _defaultTimeout;
    }

    /**
     * Timeout for units not specifying their own.
     */
    public RunnerConfig defaultTimeout(Duration defaultTimeout) {
        _defaultTimeout = requirePositive(defaultTimeout, "defaultTimeout");
        return this;
    }

    /**
     * @return the global deadline of a run, or <code>null</code> if none.
     */
    public Duration getGlobalDeadline() {
        return _globalDeadline;
    }

    /**
     * Deadline for the whole run, counted from its start: units not started before it are failed with a timeout,
     * and no unit may run past it. <code>null</code> for none.
     */
    public RunnerConfig globalDeadline(Duration globalDeadline) {
        _globalDeadline = globalDeadline == null ? null : requirePositive(globalDeadline, "globalDeadline");
        return this;
    }

    public Duration getTearDownGrace() {
        return _tearDownGrace;
    }

    /**
     * How long the runner waits for the tear-down of a timed out unit, both when the unit's own thread runs it, and
     * when the runner has to run it itself.
     */
    public RunnerConfig tearDownGrace(Duration tearDownGrace) {
        _tearDownGrace = requirePositive(tearDownGrace, "tearDownGrace");
        return this;
    }

    private static Duration requirePositive(Duration duration, String what) {
        if (duration == null) {
            throw new NullPointerException(what);
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(what + " must be positive, was [" + duration + "].");
        }
        return duration;
    }

    @Override
    public String toString() {
        return "RunnerConfig[concurrencyLimit=" + _concurrencyLimit + ", defaultTimeout=" + _defaultTimeout
                + ", globalDeadline=" + _globalDeadline + ", tearDownGrace=" + _tearDownGrace + "]";
    }
}
