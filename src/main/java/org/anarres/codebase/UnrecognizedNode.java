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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A directive that was not understood, or that could not be parsed.
 *
 * Unrecognized nodes are inert: they never affect which lines a platform
 * reaches.
 */
public final class UnrecognizedNode extends Node {

    private final String raw;
    private final String diagnostic;

    public UnrecognizedNode(@Nonnull String raw, @CheckForNull String diagnostic) {
        this.raw = raw;
        this.diagnostic = diagnostic;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.UNRECOGNIZED;
    }

    @Nonnull
    public String getRaw() {
        return raw;
    }

    /** Returns why this directive was degraded, or null if it is simply unknown. */
    @CheckForNull
    public String getDiagnostic() {
        return diagnostic;
    }

    @Override
    /* pp */ String describe() {
        return "unrecognized " + raw.trim();
    }
}
