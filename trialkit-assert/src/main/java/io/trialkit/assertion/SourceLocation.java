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

import java.util.Arrays;
import java.util.List;

/**
 * Finds the source location of a failing assertion: the first stack frame that is not inside one of the given engine
 * classes (or their nested classes), nor in JDK reflection or dynamic proxy machinery.
 */
public final class SourceLocation {
    private SourceLocation() {
    }

    /**
     * @param engineClasses
     *            the classes whose frames should be skipped.
     * @return the calling frame, or <code>null</code> if none qualifies.
     */
    public static StackTraceElement callerOf(Class<?>... engineClasses) {
        List<Class<?>> engine = Arrays.asList(engineClasses);
        StackTraceElement[] stackTrace = new Throwable().getStackTrace();
        for (StackTraceElement frame : stackTrace) {
            String className = frame.getClassName();
            if (className.equals(SourceLocation.class.getName()) || isMachinery(className)) {
                continue;
            }
            boolean insideEngine = false;
            for (Class<?> engineClass : engine) {
                if (className.equals(engineClass.getName()) || className.startsWith(engineClass.getName() + "$")) {
                    insideEngine = true;
                    break;
                }
            }
            if (!insideEngine) {
                return frame;
            }
        }
        return null;
    }

    private static boolean isMachinery(String className) {
        return className.startsWith("java.lang.reflect.")
                || className.startsWith("jdk.internal.reflect.")
                || className.startsWith("sun.reflect.")
                || className.startsWith("jdk.proxy")
                || className.startsWith("com.sun.proxy.")
                || className.contains("$Proxy");
    }
}
