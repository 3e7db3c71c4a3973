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

import java.util.Objects;
import java.util.function.Predicate;

import io.trialkit.assertion.StructuralEquality;

/**
 * Matches one argument position of an invocation. Use the static factories {@link #eq(Object)}, {@link #any()} and
 * {@link #matching(Predicate, String)}.
 */
public interface ArgMatcher {
    /**
     * @return whether the actual argument satisfies this matcher.
     */
    boolean matches(Object argument);

    /**
     * @return a human readable description, used in verification messages.
     */
    String describe();

    /**
     * Matches an argument that is structurally equal to the given value, by the same rules as
     * {@link io.trialkit.assertion.Assertions#assertEqual(Object, Object) assertEqual}.
     */
    static ArgMatcher eq(Object expected) {
        return new ArgMatcher() {
            @Override
            public boolean matches(Object argument) {
                return StructuralEquality.areEqual(expected, argument);
            }

            @Override
            public String describe() {
                return "eq(" + StructuralEquality.render(expected) + ")";
            }

            @Override
            public String toString() {
                return describe();
            }
        };
    }

    /**
     * Matches any argument, <code>null</code> included.
     */
    static ArgMatcher any() {
        return Any.INSTANCE;
    }

    /**
     * Matches an argument satisfying the predicate.
     */
    static ArgMatcher matching(Predicate<Object> predicate, String description) {
        Objects.requireNonNull(predicate, "predicate");
        return new ArgMatcher() {
            @Override
            public boolean matches(Object argument) {
                return predicate.test(argument);
            }

            @Override
            public String describe() {
                return "matching(" + description + ")";
            }

            @Override
            public String toString() {
                return describe();
            }
        };
    }

    /**
     * The singleton for {@link #any()}.
     */
    enum Any implements ArgMatcher {
        INSTANCE;

        @Override
        public boolean matches(Object argument) {
            return true;
        }

        @Override
        public String describe() {
            return "any()";
        }
    }
}
