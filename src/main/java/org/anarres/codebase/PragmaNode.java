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

import javax.annotation.Nonnull;

/** A #pragma directive. Only #pragma once has any effect. */
public final class PragmaNode extends Node {

    private final String text;

    public PragmaNode(@Nonnull String text) {
        this.text = text;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.PRAGMA;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    public boolean isOnce() {
        return "once".equals(text.trim());
    }

    @Override
    /* pp */ String describe() {
        return "pragma " + text;
    }
}
