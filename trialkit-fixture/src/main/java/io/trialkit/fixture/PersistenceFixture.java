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

package io.trialkit.fixture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.trialkit.Fixture;

/**
 * Adapts a {@link PersistenceProvider} into a set-up/tear-down pair: set-up opens, tear-down closes, and the test body
 * reaches the open resource through {@link #handle()}.
 * <p>
 * An instance holds one handle at a time: create one per unit and bind it with {@link #perUnit()}, or one per group
 * and bind it with {@link #shared(String)}.
 *
 * @param <H>
 *            the handle type.
 */
public final class PersistenceFixture<H> {
    private static final Logger log = LoggerFactory.getLogger(PersistenceFixture.class);
    private static final String LOG_PREFIX = "#TRIALKIT# ";

    private final PersistenceProvider<H> _provider;
    private volatile H _handle;

    private PersistenceFixture(PersistenceProvider<H> provider) {
        _provider = provider;
    }

    public static <H> PersistenceFixture<H> of(PersistenceProvider<H> provider) {
        if (provider == null) {
            throw new NullPointerException("provider");
        }
        return new PersistenceFixture<>(provider);
    }

    /**
     * @return a per-unit {@link Fixture} opening and closing this persistence resource.
     */
    public Fixture perUnit() {
        return Fixture.perUnit(this::open, this::close);
    }

    /**
     * @return a group-shared {@link Fixture} opening and closing this persistence resource.
     */
    public Fixture shared(String name) {
        return Fixture.shared(name, this::open, this::close);
    }

    /**
     * @return the open handle.
     * @throws IllegalStateException
     *             if not open, i.e. outside set-up and tear-down.
     */
    public H handle() {
        H handle = _handle;
        if (handle == null) {
            throw new IllegalStateException("PersistenceFixture of [" + _provider + "] is not open.");
        }
        return handle;
    }

    public boolean isOpen() {
        return _handle != null;
    }

    synchronized void open() throws Exception {
        if (_handle != null) {
            throw new IllegalStateException("PersistenceFixture of [" + _provider + "] is already open - use one"
                    + " instance per unit, or a shared fixture.");
        }
        _handle = _provider.open();
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Opened [" + _handle + "].");
    }

    synchronized void close() throws Exception {
        H handle = _handle;
        // ?: Did open() fail or never run?
        if (handle == null) {
            // -> Yes, so nothing to close.
            return;
        }
        _handle = null;
        _provider.close(handle);
        if (log.isDebugEnabled()) log.debug(LOG_PREFIX + "Closed [" + handle + "].");
    }
}
