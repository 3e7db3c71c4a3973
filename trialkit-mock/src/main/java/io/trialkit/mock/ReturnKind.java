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

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Coarse return type of a capability member, used for abstract {@link CapabilitySpec}s that have no Java interface
 * behind them, to decide the default value of an unmatched lenient invocation.
 */
public enum ReturnKind {
    /** Returns nothing: default <code>null</code>. */
    VOID,

    /** Default <code>false</code>. */
    BOOLEAN,

    /** Default <code>0</code>. */
    NUMBER,

    /** Default <code>""</code>. */
    TEXT,

    /** Default empty list. */
    COLLECTION,

    /** Default empty map. */
    MAP,

    /** Default {@link Optional#empty()}. */
    OPTIONAL,

    /** Default <code>null</code> (absent). */
    OBJECT;

    /**
     * @return the kind a Java return type falls into.
     */
    public static ReturnKind of(Class<?> type) {
        if (type == void.class || type == Void.class) {
            return VOID;
        }
        if (type == boolean.class || type == Boolean.class) {
            return BOOLEAN;
        }
        if ((type.isPrimitive()) || Number.class.isAssignableFrom(type) || type == Character.class) {
            return NUMBER;
        }
        if (CharSequence.class.isAssignableFrom(type)) {
            return TEXT;
        }
        if (Collection.class.isAssignableFrom(type) || Iterable.class == type) {
            return COLLECTION;
        }
        if (Map.class.isAssignableFrom(type)) {
            return MAP;
        }
        if (type == Optional.class || type == OptionalInt.class || type == OptionalLong.class
                || type == OptionalDouble.class) {
            return OPTIONAL;
        }
        return OBJECT;
    }

    /**
     * @return whether a configured return value is acceptable for a member of this kind.
     */
    boolean accepts(Object value) {
        switch (this) {
            case VOID:
                return value == null;
            case BOOLEAN:
                return value instanceof Boolean;
            case NUMBER:
                return value instanceof Number || value instanceof Character;
            case TEXT:
                return value == null || value instanceof CharSequence;
            case COLLECTION:
                return value == null || value instanceof Iterable;
            case MAP:
                return value == null || value instanceof Map;
            case OPTIONAL:
                return value instanceof Optional || value instanceof OptionalInt || value instanceof OptionalLong
                        || value instanceof OptionalDouble;
            default:
                return true;
        }
    }
}
