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

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Capability used by the mock tests.
 */
public interface Inventory {
    int stockOf(String sku);

    int stockOf(String sku, String warehouse);

    boolean reserve(String sku, int quantity);

    List<String> skus();

    Optional<String> describe(String sku);

    String name();

    void restock(String sku, int quantity) throws IOException;
}
