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

import java.lang.reflect.Array;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.stream.Stream;

import io.trialkit.mock.CapabilitySpec.Member;

/**
 * Type-appropriate defaults for unmatched invocations on lenient mocks: zero for numbers, <code>false</code>, empty
 * for strings, collections, maps, optionals, streams and arrays, and <code>null</code> (absent) for anything else.
 */
final class DefaultValues {
    private static final Map<Class<?>, Object> PRIMITIVE_DEFAULTS = new HashMap<>();
    private static final Map<Class<?>, Class<?>> WRAPPERS = new HashMap<>();
    static {
        register(boolean.class, Boolean.class, false);
        register(char.class, Character.class, '\0');
        register(byte.class, Byte.class, (byte) 0);
        register(short.class, Short.class, (short) 0);
        register(int.class, Integer.class, 0);
        register(long.class, Long.class, 0L);
        register(float.class, Float.class, 0f);
        register(double.class, Double.class, 0d);
    }

    private static void register(Class<?> primitive, Class<?> wrapper, Object zero) {
        PRIMITIVE_DEFAULTS.put(primitive, zero);
        PRIMITIVE_DEFAULTS.put(wrapper, zero);
        WRAPPERS.put(primitive, wrapper);
    }

    private DefaultValues() {
    }

    static Class<?> wrapperOf(Class<?> primitive) {
        return WRAPPERS.get(primitive);
    }

    static Object forMember(Member member) {
        return member.getReturnType() != null
                ? forType(member.getReturnType())
                : forKind(member.getReturnKind());
    }

    static Object forKind(ReturnKind kind) {
        switch (kind) {
            case BOOLEAN:
                return false;
            case NUMBER:
                return 0;
            case TEXT:
                return "";
            case COLLECTION:
                return Collections.emptyList();
            case MAP:
                return Collections.emptyMap();
            case OPTIONAL:
                return Optional.empty();
            default:
                return null;
        }
    }

    static Object forType(Class<?> type) {
        if (type == void.class || type == Void.class) {
            return null;
        }
        Object primitive = PRIMITIVE_DEFAULTS.get(type);
        if (primitive != null) {
            return primitive;
        }
        if (type.isArray()) {
            return Array.newInstance(type.getComponentType(), 0);
        }
        Object candidate = emptyOf(type);
        // Only if it actually fits, e.g. a member returning ArrayList gets null rather than an immutable empty list.
        return candidate != null && type.isInstance(candidate) ? candidate : null;
    }

    private static Object emptyOf(Class<?> type) {
        if (type == String.class || type == CharSequence.class) {
            return "";
        }
        if (type == Optional.class) {
            return Optional.empty();
        }
        if (type == OptionalInt.class) {
            return OptionalInt.empty();
        }
        if (type == OptionalLong.class) {
            return OptionalLong.empty();
        }
        if (type == OptionalDouble.class) {
            return OptionalDouble.empty();
        }
        if (type == Stream.class) {
            return Stream.empty();
        }
        if (NavigableSet.class.isAssignableFrom(type) || SortedSet.class.isAssignableFrom(type)) {
            return Collections.emptyNavigableSet();
        }
        if (Set.class.isAssignableFrom(type)) {
            return Collections.emptySet();
        }
        if (NavigableMap.class.isAssignableFrom(type) || SortedMap.class.isAssignableFrom(type)) {
            return Collections.emptyNavigableMap();
        }
        if (Map.class.isAssignableFrom(type)) {
            return Collections.emptyMap();
        }
        if (Iterable.class.isAssignableFrom(type)) {
            return Collections.emptyList();
        }
        return null;
    }
}
