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

import java.util.Objects;

/**
 * Immutable record of a non-assertion fault that happened while executing a {@link TestUnit}: which kind, in which
 * lifecycle phase, and the {@link Throwable} itself.
 */
public final class FaultRecord {
    /**
     * The lifecycle phase a fault occurred in.
     */
    public enum Phase {
        SET_UP,

        BODY,

        TEAR_DOWN
    }

    private final FaultKind _kind;
    private final Phase _phase;
    private final String _message;
    private final Throwable _throwable;

    public FaultRecord(FaultKind kind, Phase phase, String message, Throwable throwable) {
        _kind = Objects.requireNonNull(kind, "kind");
        _phase = Objects.requireNonNull(phase, "phase");
        _message = Objects.requireNonNull(message, "message");
        _throwable = throwable;
    }

    public static FaultRecord fixtureFault(Phase phase, Throwable throwable) {
        return new FaultRecord(FaultKind.FIXTURE_FAULT, phase, (phase == Phase.SET_UP ? "setUp" : "tearDown")
                + " raised " + describe(throwable), throwable);
    }

    public static FaultRecord uncaught(Throwable throwable) {
        return new FaultRecord(FaultKind.UNCAUGHT_FAULT, Phase.BODY, "body raised " + describe(throwable),
                throwable);
    }

    public static FaultRecord timeout(Phase phase, TestTimeoutException exception) {
        return new FaultRecord(FaultKind.TIMEOUT, phase, exception.getMessage(), exception);
    }

    public FaultKind getKind() {
        return _kind;
    }

    public Phase getPhase() {
        return _phase;
    }

    public String getMessage() {
        return _message;
    }

    /**
     * @return the fault itself, may be <code>null</code> only for records created without one.
     */
    public Throwable getThrowable() {
        return _throwable;
    }

    static String describe(Throwable throwable) {
        if (throwable == null) {
            return "[no throwable]";
        }
        return throwable.getMessage() == null
                ? throwable.getClass().getName()
                : throwable.getClass().getName() + ": " + throwable.getMessage();
    }

    @Override
    public String toString() {
        return _kind + "@" + _phase + ": " + _message;
    }
}
