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

import static io.trialkit.assertion.Assertions.assertEqual;
import static io.trialkit.assertion.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import io.trialkit.Fixture;
import io.trialkit.TestCandidate;
import io.trialkit.TestResult;
import io.trialkit.TestStatus;
import io.trialkit.TestUnit;
import io.trialkit.fixture.PersistenceFixture;
import io.trialkit.fixture.h2.H2PersistenceProvider;
import io.trialkit.fixture.h2.TestH2DataSource;

/**
 * Units using an H2 database through {@link PersistenceFixture}: per unit each gets its own database, shared the
 * group sees one.
 */
public class Test_RunnerWithH2 {
    private final StandardTestRunner _runner = StandardTestRunner.create(RunnerConfig.create().concurrencyLimit(4));

    @Test
    public void perUnitDatabasesAreIsolated() {
        List<PersistenceFixture<TestH2DataSource>> databases = new ArrayList<>();
        List<TestUnit> units = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            PersistenceFixture<TestH2DataSource> database = PersistenceFixture.of(
                    H2PersistenceProvider.withDataTable());
            databases.add(database);
            String data = "row-" + i;
            units.add(TestUnit.of(TestCandidate.builder("Orders", "insert" + i)
                    .fixture(database.perUnit())
                    .body(() -> {
                        database.handle().insertDataIntoDataTable(data);
                        assertEqual(Collections.singletonList(data), database.handle().getDataFromDataTable());
                    }).build()));
        }

        List<TestResult> results = _runner.run(units);

        for (TestResult result : results) {
            Assert.assertEquals(result.toString(), TestStatus.PASSED, result.getStatus());
        }
        for (PersistenceFixture<TestH2DataSource> database : databases) {
            Assert.assertFalse(database.isOpen());
        }
    }

    @Test
    public void sharedDatabaseForTheGroup() {
        PersistenceFixture<TestH2DataSource> database = PersistenceFixture.of(H2PersistenceProvider.withDataTable());
        // One Fixture instance: the group shares by identity.
        Fixture shared = database.shared("ordersDb");
        List<TestUnit> units = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String data = "row-" + i;
            units.add(TestUnit.of(TestCandidate.builder("SharedOrders", "insert" + i)
                    .fixture(shared)
                    .body(() -> {
                        database.handle().insertDataIntoDataTable(data);
                        assertTrue(database.handle().getDataFromDataTable().contains(data));
                    }).build()));
        }

        List<TestResult> results = _runner.run(units);

        for (TestResult result : results) {
            Assert.assertEquals(result.toString(), TestStatus.PASSED, result.getStatus());
        }
        Assert.assertFalse(database.isOpen());
    }
}
