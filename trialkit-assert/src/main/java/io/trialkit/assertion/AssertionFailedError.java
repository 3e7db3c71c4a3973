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

package io.trialkit.assertion;

import io.trialkit.AssertionFailure;
import io.trialkit.ExecutionContext;

/**
 * Thrown when an expected condition did not hold. Carries the structured {@link AssertionFailure}.
 * <p>
 * Before being thrown, the error is {@link #signal() signalled} to the {@link ExecutionContext} bound to the current
 * thread (if any), so that the failure is recorded even if code under test catches it.
 */
public class AssertionFailedError extends AssertionError {
    private final transient AssertionFailure _failure;

    public AssertionFailedError(AssertionFailure failure) {
        super(failure.getMessage());
        _failure = failure;
    }

    public AssertionFailedError(AssertionFailure failure, Throwable cause) {
        super(failure.getMessage(), cause);
        _failure = failure;
    }

    public AssertionFailure getFailure() {
        return _failure;
    }

    /**
     * Signals this failure to the current thread's {@link ExecutionContext}, if one is bound.
     *
     * @return <code>this</code>, for <code>throw error.signal();</code>
     */
    public AssertionFailedError signal() {
        ExecutionContext.current().ifPresent(ctx -> ctx.signal(this, _failure));
        return this;
    }
}
