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

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract description of a capability (an interface) that a {@link Mock} can substitute for: its name, and its
 * members, each identified by name and argument arity.
 * <p>
 * Either described directly:
 *
 * <pre>
 * CapabilitySpec inventory = CapabilitySpec.named("Inventory")
 *         .member("stockOf", 1, ReturnKind.NUMBER)
 *         .member("reserve", 2, ReturnKind.BOOLEAN)
 *         .build();
 * </pre>
 *
 * .. or derived from a Java interface with {@link #of(Class)}, in which case {@link Mock#as(Class)} gives a typed
 * proxy. Overloads with the same arity cannot be told apart by member identifier, and are rejected.
 */
public final class CapabilitySpec {
    private final String _name;
    private final Class<?> _interfaceType;
    private final Map<String, Member> _members;

    private CapabilitySpec(String name, Class<?> interfaceType, Map<String, Member> members) {
        _name = name;
        _interfaceType = interfaceType;
        _members = Collections.unmodifiableMap(members);
    }

    /**
     * One member of a capability.
     */
    public static final class Member {
        private final String _name;
        private final int _arity;
        private final ReturnKind _returnKind;
        private final Class<?> _returnType;
        private final List<Class<?>> _declaredFaults;

        Member(String name, int arity, ReturnKind returnKind, Class<?> returnType, List<Class<?>> declaredFaults) {
            _name = name;
            _arity = arity;
            _returnKind = returnKind;
            _returnType = returnType;
            _declaredFaults = declaredFaults;
        }

        public String getName() {
            return _name;
        }

        public int getArity() {
            return _arity;
        }

        /**
         * @return the member identifier, <code>"name/arity"</code>.
         */
        public String getId() {
            return id(_name, _arity);
        }

        public ReturnKind getReturnKind() {
            return _returnKind;
        }

        /**
         * @return the Java return type if derived from an interface, otherwise <code>null</code>.
         */
        public Class<?> getReturnType() {
            return _returnType;
        }

        /**
         * @return whether the member may raise the given fault kind: unchecked faults always, checked faults only
         *         if declared - abstract members declare nothing, and thus accept anything.
         */
        boolean mayRaise(Class<? extends Throwable> faultKind) {
            if (_returnType == null || RuntimeException.class.isAssignableFrom(faultKind)
                    || Error.class.isAssignableFrom(faultKind)) {
                return true;
            }
            for (Class<?> declared : _declaredFaults) {
                if (declared.isAssignableFrom(faultKind)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * @return whether the value is acceptable as a configured return value of this member.
         */
        boolean accepts(Object value) {
            if (_returnType == null) {
                return _returnKind.accepts(value);
            }
            if (_returnType == void.class) {
                return value == null;
            }
            if (_returnType.isPrimitive()) {
                return value != null && DefaultValues.wrapperOf(_returnType).isInstance(value);
            }
            return value == null || _returnType.isInstance(value);
        }

        @Override
        public String toString() {
            return getId() + ":" + (_returnType != null ? _returnType.getSimpleName() : _returnKind.name());
        }
    }

    /**
     * Starts describing an abstract capability.
     */
    public static Builder named(String name) {
        return new Builder(name);
    }

    /**
     * Derives the capability from a Java interface: every non-static method is a member (default methods included,
     * a mock never forwards to an implementation), the methods of {@link Object} excluded.
     *
     * @throws IllegalArgumentException
     *             if the type is not an interface, or has overloads with the same arity.
     */
    public static CapabilitySpec of(Class<?> interfaceType) {
        if (!interfaceType.isInterface()) {
            throw new IllegalArgumentException("Can only derive a CapabilitySpec from an interface, ["
                    + interfaceType.getName() + "] is not.");
        }
        Map<String, Member> members = new LinkedHashMap<>();
        Map<String, Method> signatures = new LinkedHashMap<>();
        for (Method method : interfaceType.getMethods()) {
            if (Modifier.isStatic(method.getModifiers()) || method.isBridge() || method.isSynthetic()
                    || isObjectMethod(method)) {
                continue;
            }
            // Same signature inherited along several paths is one and the same member.
            String signature = method.getName() + Arrays.toString(method.getParameterTypes());
            if (signatures.putIfAbsent(signature, method) != null) {
                continue;
            }
            String id = id(method.getName(), method.getParameterCount());
            if (members.containsKey(id)) {
                throw new IllegalArgumentException("Interface [" + interfaceType.getName() + "] has several"
                        + " methods named [" + method.getName() + "] with " + method.getParameterCount()
                        + " parameters - overloads are only supported when their arity differs.");
            }
            members.put(id, new Member(method.getName(), method.getParameterCount(),
                    ReturnKind.of(method.getReturnType()), method.getReturnType(),
                    Collections.unmodifiableList(Arrays.asList(method.getExceptionTypes()))));
        }
        return new CapabilitySpec(interfaceType.getSimpleName(), interfaceType, members);
    }

    public String getName() {
        return _name;
    }

    /**
     * @return the interface this capability was derived from, or <code>null</code> if described abstractly.
     */
    public Class<?> getInterfaceType() {
        return _interfaceType;
    }

    /**
     * @return all members, in declaration order.
     */
    public List<Member> getMembers() {
        return new ArrayList<>(_members.values());
    }

    /**
     * @return the member with this name and arity, or <code>null</code>.
     */
    public Member findMember(String name, int arity) {
        return _members.get(id(name, arity));
    }

    /**
     * @return whether there is any member with this name, regardless of arity.
     */
    public boolean hasMemberNamed(String name) {
        for (Member member : _members.values()) {
            if (member.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the member with this name and arity.
     * @throws IllegalArgumentException
     *             if there is no such member.
     */
    public Member getMember(String name, int arity) {
        Member member = findMember(name, arity);
        if (member == null) {
            throw new IllegalArgumentException("Capability [" + _name + "] has no member [" + id(name, arity)
                    + "], members are " + _members.keySet() + ".");
        }
        return member;
    }

    static String id(String name, int arity) {
        return name + "/" + arity;
    }

    private static boolean isObjectMethod(Method method) {
        try {
            Object.class.getMethod(method.getName(), method.getParameterTypes());
            return true;
        }
        catch (NoSuchMethodException e) {
            return false;
        }
    }

    /**
     * Builder for abstract capabilities.
     */
    public static final class Builder {
        private final String _name;
        private final Map<String, Member> _members = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.trim().isEmpty()) {
                throw new IllegalArgumentException("Capability name must be non-empty.");
            }
            _name = name;
        }

        public Builder member(String name, int arity, ReturnKind returnKind) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(returnKind, "returnKind");
            if (arity < 0) {
                throw new IllegalArgumentException("arity must be >= 0, was [" + arity + "].");
            }
            String id = id(name, arity);
            if (_members.containsKey(id)) {
                throw new IllegalArgumentException("Capability [" + _name + "] already has member [" + id + "].");
            }
            _members.put(id, new Member(name, arity, returnKind, null, Collections.emptyList()));
            return this;
        }

        public CapabilitySpec build() {
            if (_members.isEmpty()) {
                throw new IllegalStateException("Capability [" + _name + "] has no members.");
            }
            return new CapabilitySpec(_name, null, new LinkedHashMap<>(_members));
        }
    }

    @Override
    public String toString() {
        return "CapabilitySpec[" + _name + ", members=" + _members.keySet() + "]";
    }
}
