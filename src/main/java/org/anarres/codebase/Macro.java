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
 * A macro definition.
 *
 * A function-like macro has a (possibly empty) parameter list; an
 * object-like macro has none. Variadic macros name their trailing
 * parameter, which defaults to __VA_ARGS__.
 */
public final class Macro {

    private final String name;
    private final List<String> params;
    private final List<Token> tokens;
    private final boolean variadic;

    public Macro(@Nonnull String name, @CheckForNull List<String> params,
            @Nonnull List<Token> tokens, boolean variadic) {
        this.name = name;
        this.params = params == null ? null : Collections.unmodifiableList(new ArrayList<String>(params));
        this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
        this.variadic = variadic;
    }

    /** Constructs an object-like macro. */
    public Macro(@Nonnull String name, @Nonnull List<Token> tokens) {
        this(name, null, tokens, false);
    }

    /**
     * Parses a command-line style definition, NAME or NAME=VALUE.
     *
     * A bare NAME is defined as 1, as with the -D option of a compiler.
     */
    @Nonnull
    public static Macro parse(@Nonnull String definition) throws ParseException {
        int idx = definition.indexOf('=');
        String head = idx == -1 ? definition : definition.substring(0, idx);
        String value = idx == -1 ? "1" : definition.substring(idx + 1);
        String line = "#define " + head + " " + value;
        try {
            Lexer lexer = new Lexer(line);
            Node node = new DirectiveParser(line, lexer.tokenize()).parse();
            if (node.getKind() != Node.Kind.DEFINE)
                throw new ParseException("Bad macro definition '" + definition + "': "
                        + ((UnrecognizedNode) node).getDiagnostic());
            return ((DefineNode) node).getMacro();
        } catch (LexerException e) {
            throw new ParseException("Bad macro definition '" + definition + "'", e);
        }
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isFunctionLike() {
        return params != null;
    }

    /** Returns the parameter names, or null for an object-like macro. */
    @CheckForNull
    public List<String> getParameters() {
        return params;
    }

    /** Returns the number of parameters, or -1 for an object-like macro. */
    public int getArgs() {
        return params == null ? -1 : params.size();
    }

    public boolean isVariadic() {
        return variadic;
    }

    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    @Nonnull
    public String getText() {
        StringBuilder buf = new StringBuilder();
        for (Token tok : tokens) {
            if (buf.length() > 0)
                buf.append(' ');
            buf.append(tok.getText());
        }
        return buf.toString();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(name);
        if (params != null) {
            buf.append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                buf.append(params.get(i));
            }
            if (variadic)
                buf.append("...");
            buf.append(')');
        }
        if (!tokens.isEmpty())
            buf.append(" => ").append(getText());
        return buf.toString();
    }
}
