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

package io.trialkit.fixture.h2;

import java.util.function.Consumer;

import io.trialkit.fixture.PersistenceProvider;

/**
 * {@link PersistenceProvider} of H2 databases: each {@link #open()} gives a fresh, clean database as a
 * {@link TestH2DataSource} (private in-memory unless the System Property
 * {@link TestH2DataSource#SYSPROP_TRIALKIT_TEST_H2 "trialkit.test.h2"} says otherwise), optionally initialized with a
 * schema; {@link #close(TestH2DataSource)} drops everything and shuts it down.
 *
 * <pre>
 * PersistenceFixture&lt;TestH2DataSource&gt; db = PersistenceFixture.of(H2PersistenceProvider.withDataTable());
 * TestCandidate.builder("Orders", "persistsOrder")
 *         .fixture(db.perUnit())
 *         .body(() -&gt; { .. db.handle().getDataFromDataTable() .. })
 *         .build();
 * </pre>
 */
public class H2PersistenceProvider implements PersistenceProvider<TestH2DataSource> {
    private final Consumer<TestH2DataSource> _schemaInitializer;

    protected H2PersistenceProvider(Consumer<TestH2DataSource> schemaInitializer) {
        _schemaInitializer = schemaInitializer;
    }

    /**
     * @return a provider of empty databases.
     */
    public static H2PersistenceProvider create() {
        return new H2PersistenceProvider(null);
    }

    /**
     * @return a provider of databases holding the "datatable", see {@link TestH2DataSource#createDataTable()}.
     */
    public static H2PersistenceProvider withDataTable() {
        return new H2PersistenceProvider(TestH2DataSource::createDataTable);
    }

    /**
     * @return a provider running the initializer on each new database, e.g. to create a schema.
     */
    public static H2PersistenceProvider withSchema(Consumer<TestH2DataSource> schemaInitializer) {
        if (schemaInitializer == null) {
            throw new NullPointerException("schemaInitializer");
        }
        return new H2PersistenceProvider(schemaInitializer);
    }

    @Override
    public TestH2DataSource open() {
        TestH2DataSource dataSource = createDataSource();
        if (_schemaInitializer != null) {
            _schemaInitializer.accept(dataSource);
        }
        return dataSource;
    }

    @Override
    public void close(TestH2DataSource handle) {
        handle.cleanDatabase();
        handle.shutdown();
    }

    /**
     * Override to use another URL than {@link TestH2DataSource#createStandard()} picks.
     */
    protected TestH2DataSource createDataSource() {
        return TestH2DataSource.createStandard();
    }

    @Override
    public String toString() {
        return "H2PersistenceProvider[" + (_schemaInitializer != null ? "with schema" : "empty") + "]";
    }
}
