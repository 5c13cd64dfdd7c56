/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.codebase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The macros visible at one point of a single platform walk.
 *
 * Instances are not shared between walks and are not thread-safe.
 */
public class MacroEnvironment {

    private final Map<String, Macro> macros = new LinkedHashMap<String, Macro>();

    public void define(@Nonnull Macro m) {
        macros.put(m.getName(), m);
    }

    /** Defines a macro from a NAME or NAME=VALUE string. */
    public void define(@Nonnull String definition) throws ParseException {
        define(Macro.parse(definition));
    }

    public void undefine(@Nonnull String name) {
        macros.remove(name);
    }

    public boolean isDefined(@Nonnull String name) {
        return macros.containsKey(name);
    }

    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.get(name);
    }

    @Nonnull
    public Map<String, Macro> getMacros() {
        return Collections.unmodifiableMap(macros);
    }

    @Override
    public String toString() {
        return macros.values().toString();
    }
}
