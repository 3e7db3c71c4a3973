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

import java.time.Duration;

/**
 * Cause carried by a {@link FaultKind#TIMEOUT TIMEOUT} {@link FaultRecord}. Never thrown into user code; it is
 * created by the runner when it gives up on a unit.
 */
public class TestTimeoutException extends RuntimeException {
    private final Duration _timeout;

    public TestTimeoutException(String message, Duration timeout) {
        super(message);
        _timeout = timeout;
    }

    /**
     * @return the timeout that was exceeded.
     */
    public Duration getTimeout() {
        return _timeout;
    }
}
