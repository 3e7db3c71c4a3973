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

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;

/**
 * Structural comparison of two values, as used by {@link Assertions#assertEqual(Object, Object)}:
 * <ul>
 * <li>Value types (boxed primitives, {@link String}, enums, and other JDK types) are compared by
 * {@link Object#equals(Object) equals}, but only if they are of the same class: there is no implicit coercion, so
 * <code>1</code> vs <code>1L</code> is an {@link Outcome#INCOMPATIBLE incompatible} comparison, not an equal one.
 * Doubles and floats compare by their boxed <code>equals</code>, so <code>NaN</code> equals <code>NaN</code>.</li>
 * <li>Arrays and {@link List}s are compared element by element, {@link Map}s key by key, {@link Set}s by membership,
 * and {@link Optional}s by their content. Any other {@link Collection}, e.g. a {@link java.util.Deque Deque}, is
 * compared element by element in iteration order. Map keys and set elements missing by <code>equals</code> are looked
 * for structurally.</li>
 * <li>Any other (composite) value must be of the same class on both sides, and is compared field by field through the
 * class hierarchy, ignoring static and synthetic fields.</li>
 * </ul>
 * The comparison stops at the first mismatch, and describes it with a path from the root, e.g.
 * <code>"$.lines[1].qty: expected &lt;2&gt; but was &lt;3&gt;"</code>. Cyclic object graphs are handled.
 */
public final class StructuralEquality {
    // Keys may be null.
    private static final Object NO_KEY = new Object();

    /**
     * The outcome of a comparison.
     */
    public enum Outcome {
        EQUAL,

        DIFFERENT,

        /**
         * The first mismatch found was between values of incompatible kinds, e.g. an Integer and a Long.
         */
        INCOMPATIBLE
    }

    /**
     * Result of {@link StructuralEquality#compare(Object, Object)}.
     */
    public static final class Comparison {
        private static final Comparison EQUAL = new Comparison(Outcome.EQUAL, "$", null);

        private final Outcome _outcome;
        private final String _path;
        private final String _detail;

        private Comparison(Outcome outcome, String path, String detail) {
            _outcome = outcome;
            _path = path;
            _detail = detail;
        }

        public Outcome getOutcome() {
            return _outcome;
        }

        public boolean isEqual() {
            return _outcome == Outcome.EQUAL;
        }

        /**
         * @return path from the root to the first mismatch, <code>"$"</code> being the root.
         */
        public String getPath() {
            return _path;
        }

        /**
         * @return human-readable description of the first mismatch, or <code>null</code> if equal.
         */
        public String describe() {
            if (_outcome == Outcome.EQUAL) {
                return null;
            }
            return "$".equals(_path) ? _detail : _path + ": " + _detail;
        }

        @Override
        public String toString() {
            return _outcome == Outcome.EQUAL ? "EQUAL" : _outcome + " " + describe();
        }
    }

    private StructuralEquality() {
    }

    /**
     * @return whether the two values are structurally equal.
     */
    public static boolean areEqual(Object expected, Object actual) {
        return compare(expected, actual).isEqual();
    }

    /**
     * Compares the two values structurally.
     */
    public static Comparison compare(Object expected, Object actual) {
        return new Comparer().compare("$", expected, actual);
    }

    /**
     * @return a short rendering of a value for failure messages: strings are quoted, arrays rendered by content.
     */
    public static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        if (value instanceof Character) {
            return "'" + value + "'";
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<String> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(render(Array.get(value, i)));
            }
            return elements.toString();
        }
        return String.valueOf(value);
    }

    private static final class Comparer {
        // Identity pairs currently being compared, to cut cycles.
        private final Map<Object, List<Object>> _inProgress = new IdentityHashMap<>();

        Comparison compare(String path, Object expected, Object actual) {
            if (expected == actual) {
                return Comparison.EQUAL;
            }
            if (expected == null || actual == null) {
                return different(path, expected, actual);
            }
            // :: Collection-like kinds, compared by kind rather than by concrete class.
            if (expected.getClass().isArray() || actual.getClass().isArray()) {
                if (!(expected.getClass().isArray() && actual.getClass().isArray())) {
                    return incompatible(path, expected, actual);
                }
                return compareArrays(path, expected, actual);
            }
            if (expected instanceof List || actual instanceof List) {
                if (!(expected instanceof List && actual instanceof List)) {
                    return incompatible(path, expected, actual);
                }
                return compareSequences(path, (List<?>) expected, (List<?>) actual);
            }
            if (expected instanceof Set || actual instanceof Set) {
                if (!(expected instanceof Set && actual instanceof Set)) {
                    return incompatible(path, expected, actual);
                }
                return compareSets(path, (Set<?>) expected, (Set<?>) actual);
            }
            if (expected instanceof Map || actual instanceof Map) {
                if (!(expected instanceof Map && actual instanceof Map)) {
                    return incompatible(path, expected, actual);
                }
                return compareMaps(path, (Map<?, ?>) expected, (Map<?, ?>) actual);
            }
            if (expected instanceof Collection || actual instanceof Collection) {
                if (!(expected instanceof Collection && actual instanceof Collection)) {
                    return incompatible(path, expected, actual);
                }
                return compareSequences(path, (Collection<?>) expected, (Collection<?>) actual);
            }

            // :: From here on, both sides must be of the same class - no coercion.
            Class<?> type = expected.getClass();
            if (type != actual.getClass()) {
                // ?: Are these two enum constants of the same enum, one having a constant-specific body?
                if (expected instanceof Enum && actual instanceof Enum
                        && ((Enum<?>) expected).getDeclaringClass() == ((Enum<?>) actual).getDeclaringClass()) {
                    // -> Yes, same enum type, but different constants.
                    return different(path, expected, actual);
                }
                return incompatible(path, expected, actual);
            }
            if (expected instanceof Optional) {
                Optional<?> expectedOptional = (Optional<?>) expected;
                Optional<?> actualOptional = (Optional<?>) actual;
                if (expectedOptional.isPresent() != actualOptional.isPresent()) {
                    return different(path, expected, actual);
                }
                return expectedOptional.isPresent()
                        ? compare(path + ".value", expectedOptional.get(), actualOptional.get())
                        : Comparison.EQUAL;
            }
            if (isValueType(type)) {
                return expected.equals(actual) ? Comparison.EQUAL : different(path, expected, actual);
            }
            return compareFields(path, type, expected, actual);
        }

        private Comparison compareArrays(String path, Object expected, Object actual) {
            Class<?> expectedComponent = expected.getClass().getComponentType();
            Class<?> actualComponent = actual.getClass().getComponentType();
            // Primitive component types must match exactly, int[] vs long[] is coercion.
            if ((expectedComponent.isPrimitive() || actualComponent.isPrimitive())
                    && expectedComponent != actualComponent) {
                return incompatible(path, expected, actual);
            }
            int expectedLength = Array.getLength(expected);
            int actualLength = Array.getLength(actual);
            int common = Math.min(expectedLength, actualLength);
            for (int i = 0; i < common; i++) {
                Comparison element = compare(path + "[" + i + "]", Array.get(expected, i), Array.get(actual, i));
                if (!element.isEqual()) {
                    return element;
                }
            }
            if (expectedLength != actualLength) {
                return new Comparison(Outcome.DIFFERENT, path, "expected length " + expectedLength + " but was "
                        + actualLength);
            }
            return Comparison.EQUAL;
        }

        private Comparison compareSequences(String path, Collection<?> expected, Collection<?> actual) {
            Iterator<?> expectedIt = expected.iterator();
            Iterator<?> actualIt = actual.iterator();
            int index = 0;
            while (expectedIt.hasNext() && actualIt.hasNext()) {
                Comparison element = compare(path + "[" + index + "]", expectedIt.next(), actualIt.next());
                if (!element.isEqual()) {
                    return element;
                }
                index++;
            }
            if (expected.size() != actual.size()) {
                return new Comparison(Outcome.DIFFERENT, path, "expected size " + expected.size() + " but was "
                        + actual.size());
            }
            return Comparison.EQUAL;
        }

        private Comparison compareSets(String path, Set<?> expected, Set<?> actual) {
            if (expected.size() != actual.size()) {
                return new Comparison(Outcome.DIFFERENT, path, "expected size " + expected.size() + " but was "
                        + actual.size() + " - expected " + render(expected) + " but was " + render(actual));
            }
            for (Object expectedElement : expected) {
                if (!containsStructurally(path, actual, expectedElement)) {
                    return new Comparison(Outcome.DIFFERENT, path, "expected element <" + render(expectedElement)
                            + "> not present in " + render(actual));
                }
            }
            return Comparison.EQUAL;
        }

        private boolean containsStructurally(String path, Collection<?> collection, Object element) {
            if (collection.contains(element)) {
                return true;
            }
            for (Object candidate : collection) {
                if (compare(path, element, candidate).isEqual()) {
                    return true;
                }
            }
            return false;
        }

        private Comparison compareMaps(String path, Map<?, ?> expected, Map<?, ?> actual) {
            for (Entry<?, ?> entry : expected.entrySet()) {
                String entryPath = path + "[" + render(entry.getKey()) + "]";
                Object actualKey = findKey(path, actual, entry.getKey());
                if (actualKey == NO_KEY) {
                    return new Comparison(Outcome.DIFFERENT, entryPath, "expected key not present in actual");
                }
                Comparison value = compare(entryPath, entry.getValue(), actual.get(actualKey));
                if (!value.isEqual()) {
                    return value;
                }
            }
            for (Object key : actual.keySet()) {
                if (findKey(path, expected, key) == NO_KEY) {
                    return new Comparison(Outcome.DIFFERENT, path + "[" + render(key) + "]",
                            "unexpected key present in actual");
                }
            }
            return Comparison.EQUAL;
        }

        /**
         * @return the key of the map that is the given key, by equals or else structurally, or {@link #NO_KEY}.
         */
        private Object findKey(String path, Map<?, ?> map, Object key) {
            if (map.containsKey(key)) {
                return key;
            }
            for (Object candidate : map.keySet()) {
                if (compare(path, key, candidate).isEqual()) {
                    return candidate;
                }
            }
            return NO_KEY;
        }

        private Comparison compareFields(String path, Class<?> type, Object expected, Object actual) {
            // ?: Are we already comparing this very pair further up? (cyclic graph)
            List<Object> actualsInProgress = _inProgress.get(expected);
            if (actualsInProgress != null) {
                for (Object inProgress : actualsInProgress) {
                    if (inProgress == actual) {
                        // -> Yes, so assume equal here - any difference is found along the other branch.
                        return Comparison.EQUAL;
                    }
                }
            }
            _inProgress.computeIfAbsent(expected, k -> new ArrayList<>()).add(actual);
            try {
                for (Class<?> clazz = type; clazz != null && clazz != Object.class; clazz = clazz.getSuperclass()) {
                    for (Field field : clazz.getDeclaredFields()) {
                        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                            continue;
                        }
                        Object expectedValue;
                        Object actualValue;
                        try {
                            field.setAccessible(true);
                            expectedValue = field.get(expected);
                            actualValue = field.get(actual);
                        }
                        catch (RuntimeException | IllegalAccessException e) {
                            // Not reflectively accessible (module boundaries) - the class' own equals must do.
                            return expected.equals(actual) ? Comparison.EQUAL : different(path, expected, actual);
                        }
                        Comparison fieldComparison = compare(path + "." + field.getName(), expectedValue,
                                actualValue);
                        if (!fieldComparison.isEqual()) {
                            return fieldComparison;
                        }
                    }
                }
                return Comparison.EQUAL;
            }
            finally {
                List<Object> list = _inProgress.get(expected);
                list.remove(list.size() - 1);
                if (list.isEmpty()) {
                    _inProgress.remove(expected);
                }
            }
        }
    }

    private static boolean isValueType(Class<?> type) {
        if (type.isEnum() || (type.getSuperclass() != null && type.getSuperclass().isEnum())) {
            return true;
        }
        String name = type.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")
                || type == Class.class;
    }

    private static Comparison different(String path, Object expected, Object actual) {
        return new Comparison(Outcome.DIFFERENT, path, "expected <" + render(expected) + "> but was <"
                + render(actual) + ">");
    }

    private static Comparison incompatible(String path, Object expected, Object actual) {
        return new Comparison(Outcome.INCOMPATIBLE, path, "incompatible kinds, expected "
                + expected.getClass().getName() + " <" + render(expected) + "> but was "
                + actual.getClass().getName() + " <" + render(actual) + ">");
    }
}
