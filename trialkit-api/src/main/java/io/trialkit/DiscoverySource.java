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

package io.trialkit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Discovery collaborator: supplies the already-resolved test candidates. How they were found (annotation scanning, a
 * hand-written list, a generated registry) is not the runner's business.
 */
@FunctionalInterface
public interface DiscoverySource {
    /**
     * @return the candidates, in discovery order - which is also the report order of the results.
     */
    List<TestCandidate> candidates();

    /**
     * @return a source over a fixed list of candidates.
     */
    static DiscoverySource of(TestCandidate... candidates) {
        List<TestCandidate> list = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(candidates)));
        return () -> list;
    }
}
