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
 * The directive that opens a {@link Branch}: #if, #ifdef, #ifndef, #elif or #else.
 *
 * An #else is kept as {@link Node.Kind#ELSE} rather than a literal true,
 * so that a walk selects it only when no earlier branch matched. The
 * condition of an #if or #elif is kept as raw tokens and expanded by
 * each walk against its own macro environment.
 *
 * A conditional that could not be lexed or parsed still opens or
 * continues its group, so that its #else and #endif pair correctly, but
 * it never matches. Such a node carries the error that degraded it.
 */
public final class ConditionNode extends Node {

    private final Kind kind;
    private final List<Token> tokens;
    private final String text;
    private final String error;

    private ConditionNode(@Nonnull Kind kind, @Nonnull List<Token> tokens, @Nonnull String text,
            @CheckForNull String error) {
        this.kind = kind;
        this.tokens = tokens;
        this.text = text;
        this.error = error;
    }

    /** Constructs an #if or #elif. */
    @Nonnull
    public static ConditionNode expression(@Nonnull Kind kind, @Nonnull List<Token> tokens, @Nonnull String raw) {
        if (kind != Kind.IF && kind != Kind.ELIF)
            throw new IllegalArgumentException("Not an expression condition: " + kind);
        return new ConditionNode(kind, Collections.unmodifiableList(new ArrayList<Token>(tokens)), raw, null);
    }

    /** Constructs an #ifdef or #ifndef. */
    @Nonnull
    public static ConditionNode defined(@Nonnull Kind kind, @Nonnull String name) {
        if (kind != Kind.IFDEF && kind != Kind.IFNDEF)
            throw new IllegalArgumentException("Not a definedness condition: " + kind);
        return new ConditionNode(kind, Collections.<Token>emptyList(), name, null);
    }

    @Nonnull
    public static ConditionNode otherwise() {
        return new ConditionNode(Kind.ELSE, Collections.<Token>emptyList(), "", null);
    }

    /** Constructs a malformed #if, #ifdef, #ifndef or #elif, which never matches. */
    @Nonnull
    public static ConditionNode invalid(@Nonnull Kind kind, @Nonnull String raw, @Nonnull String error) {
        if (kind != Kind.IF && kind != Kind.IFDEF && kind != Kind.IFNDEF && kind != Kind.ELIF)
            throw new IllegalArgumentException("Not a condition: " + kind);
        return new ConditionNode(kind, Collections.<Token>emptyList(), raw, error);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return kind;
    }

    /** Returns the unexpanded condition tokens of an #if or #elif. */
    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    /** Returns the raw expression text, or the macro name of an #ifdef or #ifndef. */
    @Nonnull
    public String getText() {
        return text;
    }

    /** Returns the reason this condition was degraded, or null if it is well formed. */
    @CheckForNull
    public String getError() {
        return error;
    }

    public boolean isValid() {
        return error == null;
    }

    @Override
    /* pp */ String describe() {
        if (kind == Kind.ELSE)
            return "else";
        return kind.name().toLowerCase() + " " + text;
    }
}
