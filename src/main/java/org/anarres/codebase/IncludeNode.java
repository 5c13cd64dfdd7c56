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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * An #include directive.
 *
 * A computed include keeps its tokens, which are macro-expanded when the
 * directive is reached during a walk.
 */
public final class IncludeNode extends Node {

    public enum HeaderKind {
        /** #include "name" */
        QUOTED,
        /** #include &lt;name&gt; */
        ANGLED,
        /** #include MACRO */
        COMPUTED
    }

    private final HeaderKind headerKind;
    private final String name;
    private final List<Token> tokens;

    private IncludeNode(@Nonnull HeaderKind headerKind, @CheckForNull String name, @Nonnull List<Token> tokens) {
        this.headerKind = headerKind;
        this.name = name;
        this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
    }

    @Nonnull
    public static IncludeNode header(@Nonnull String name, boolean quoted) {
        return new IncludeNode(quoted ? HeaderKind.QUOTED : HeaderKind.ANGLED, name,
                Collections.<Token>emptyList());
    }

    @Nonnull
    public static IncludeNode computed(@Nonnull List<Token> tokens) {
        return new IncludeNode(HeaderKind.COMPUTED, null, tokens);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.INCLUDE;
    }

    @Nonnull
    public HeaderKind getHeaderKind() {
        return headerKind;
    }

    /** Returns the header name, or null for a computed include. */
    @CheckForNull
    public String getName() {
        return name;
    }

    /** Returns the unexpanded tokens of a computed include. */
    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    @Override
    /* pp */ String describe() {
        switch (headerKind) {
            case QUOTED:
                return "include \"" + name + "\"";
            case ANGLED:
                return "include <" + name + ">";
            default:
                return "include " + tokens;
        }
    }
}
