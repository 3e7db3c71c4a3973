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

/**
 * A collaborator providing an isolated persistence resource (typically an in-memory database) for integration-style
 * fixtures. The core never depends on an implementation.
 *
 * @param <H>
 *            the handle type, e.g. a DataSource.
 */
public interface PersistenceProvider<H> {
    /**
     * @return a handle to a freshly opened, isolated resource.
     */
    H open() throws Exception;

    /**
     * Closes the resource behind the handle, releasing everything it holds.
     */
    void close(H handle) throws Exception;
}
