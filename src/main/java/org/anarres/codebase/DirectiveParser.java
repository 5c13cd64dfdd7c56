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

import static org.anarres.codebase.Token.*;

/**
 * Parses the tokens of one directive line into a {@link Node}.
 *
 * Parsing never fails: a directive that does not match its grammar
 * degrades, as described by {@link #degrade(String, String)}, and the
 * reason is available from {@link #getError()}. Problems that do not
 * prevent parsing, such as extra tokens after #endif, are collected as
 * warnings.
 */
public class DirectiveParser {

    private final String text;
    private final List<Token> tokens;
    private final List<String> warnings = new ArrayList<String>();
    private String error;

    /**
     * @param text the logical line, used for raw and message text.
     * @param tokens the tokens of the line, as produced by {@link Lexer}.
     */
    public DirectiveParser(@Nonnull String text, @Nonnull List<Token> tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    @Nonnull
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Returns the reason the last {@link #parse()} degraded its directive, or null. */
    @CheckForNull
    public String getError() {
        return error;
    }

    @Nonnull
    public Node parse() {
        warnings.clear();
        error = null;
        try {
            return directive();
        } catch (ParseException e) {
            error = e.getMessage();
            return degrade(text, error);
        }
    }

    /**
     * Returns the node that stands in for a directive which could not be
     * lexed or parsed.
     *
     * A malformed #if, #ifdef, #ifndef or #elif keeps its place in its
     * conditional group and never matches. Anything else becomes an inert
     * {@link UnrecognizedNode}.
     */
    @Nonnull
    public static Node degrade(@Nonnull String text, @Nonnull String message) {
        String line = text.trim();
        if (line.startsWith("#")) {
            int pos = 1;
            while (pos < line.length() && Character.isWhitespace(line.charAt(pos)))
                pos++;
            int start = pos;
            while (pos < line.length() && Character.isJavaIdentifierPart(line.charAt(pos)))
                pos++;
            PreprocessorCommand cmd = PreprocessorCommand.forText(line.substring(start, pos));
            if (cmd != null) {
                String rest = line.substring(pos).trim();
                switch (cmd) {
                    case PP_IF:
                        return ConditionNode.invalid(Node.Kind.IF, rest, message);
                    case PP_IFDEF:
                        return ConditionNode.invalid(Node.Kind.IFDEF, rest, message);
                    case PP_IFNDEF:
                        return ConditionNode.invalid(Node.Kind.IFNDEF, rest, message);
                    case PP_ELIF:
                        return ConditionNode.invalid(Node.Kind.ELIF, rest, message);
                    default:
                        break;
                }
            }
        }
        return new UnrecognizedNode(line, message);
    }

    @Nonnull
    private Node directive() throws ParseException {
        if (tokens.isEmpty() || tokens.get(0).getType() != HASH)
            throw new ParseException("Not a preprocessor directive");
        /* The null directive. */
        if (tokens.size() == 1)
            return new UnrecognizedNode(text.trim(), null);

        Token kw = tokens.get(1);
        if (kw.getType() != DIRECTIVE)
            throw new ParseException("Preprocessor directive not a word " + kw.getText());
        PreprocessorCommand cmd = (PreprocessorCommand) kw.getValue();
        if (cmd == null) {
            warnings.add("Unknown preprocessor directive " + kw.getText());
            return new UnrecognizedNode(text.trim(), null);
        }

        List<Token> args = tokens.subList(2, tokens.size());
        String rest = text.substring(Math.min(kw.getEnd(), text.length())).trim();

        switch (cmd) {
            case PP_IF:
                return ConditionNode.expression(Node.Kind.IF, condition(cmd, args), rest);
            case PP_ELIF:
                return ConditionNode.expression(Node.Kind.ELIF, condition(cmd, args), rest);
            case PP_IFDEF:
                return ConditionNode.defined(Node.Kind.IFDEF, name(cmd, args));
            case PP_IFNDEF:
                return ConditionNode.defined(Node.Kind.IFNDEF, name(cmd, args));
            case PP_ELSE:
                trailing(cmd, args, 0);
                return ConditionNode.otherwise();
            case PP_ENDIF:
                trailing(cmd, args, 0);
                return new EndifNode();
            case PP_DEFINE:
                return define(args);
            case PP_UNDEF:
                if (args.isEmpty() || args.get(0).getType() != IDENTIFIER)
                    throw new ParseException("#undef needs an identifier");
                trailing(cmd, args, 1);
                return new UndefNode(args.get(0).getText());
            case PP_INCLUDE:
                return include(args);
            case PP_PRAGMA:
                if (rest.isEmpty())
                    warnings.add("Empty #pragma");
                return new PragmaNode(rest);
            case PP_ERROR:
                return new MessageNode(true, rest);
            case PP_WARNING:
                return new MessageNode(false, rest);
            case PP_LINE:
                return new UnrecognizedNode(text.trim(), null);
            default:
                throw new IllegalStateException("Unhandled directive " + cmd);
        }
    }

    private void trailing(@Nonnull PreprocessorCommand cmd, @Nonnull List<Token> args, int expected) {
        if (args.size() > expected)
            warnings.add("Unexpected " + args.get(expected).getText() + " after #" + cmd.getText());
    }

    /*
     * Conditions are expanded and parsed by each walk, so only the shape
     * that no macro environment can repair is checked here.
     */
    @Nonnull
    private static List<Token> condition(@Nonnull PreprocessorCommand cmd, @Nonnull List<Token> args)
            throws ParseException {
        if (args.isEmpty())
            throw new ParseException("#" + cmd.getText() + " with no expression");
        int depth = 0;
        for (Token tok : args) {
            if (tok.getType() == '(') {
                depth++;
            } else if (tok.getType() == ')') {
                if (--depth < 0)
                    throw new ParseException("Unbalanced ) in #" + cmd.getText() + " expression");
            }
        }
        if (depth != 0)
            throw new ParseException("Missing ) in #" + cmd.getText() + " expression");
        return args;
    }

    @Nonnull
    private String name(@Nonnull PreprocessorCommand cmd, @Nonnull List<Token> args) throws ParseException {
        if (args.isEmpty())
            throw new ParseException("#" + cmd.getText() + " needs an identifier");
        if (args.get(0).getType() != IDENTIFIER)
            throw new ParseException("#" + cmd.getText() + " needs an identifier, not " + args.get(0).getText());
        if (args.size() > 1)
            throw new ParseException("#" + cmd.getText() + " takes exactly one identifier, but got "
                    + args.get(1).getText() + " after " + args.get(0).getText());
        return args.get(0).getText();
    }

    @Nonnull
    private Node define(@Nonnull List<Token> args) throws ParseException {
        if (args.isEmpty())
            throw new ParseException("#define needs an identifier");
        Token nameTok = args.get(0);
        if (nameTok.getType() != IDENTIFIER)
            throw new ParseException("Expected identifier after #define, not " + nameTok.getText());
        String name = nameTok.getText();
        if ("defined".equals(name))
            throw new ParseException("Cannot redefine name 'defined'");

        int idx = 1;
        List<String> params = null;
        boolean variadic = false;

        /* Only a '(' immediately after the name opens a parameter list. */
        if (idx < args.size() && args.get(idx).getType() == '('
                && args.get(idx).getOffset() == nameTok.getEnd()) {
            params = new ArrayList<String>();
            idx++;
            if (idx < args.size() && args.get(idx).getType() == ')') {
                idx++;
            } else {
                for (;;) {
                    if (idx >= args.size())
                        throw new ParseException("Unterminated parameter list in definition of " + name);
                    Token tok = args.get(idx++);
                    if (tok.getType() == ELLIPSIS) {
                        params.add("__VA_ARGS__");
                        variadic = true;
                    } else if (tok.getType() == IDENTIFIER) {
                        if (params.contains(tok.getText()))
                            throw new ParseException("Duplicate macro parameter " + tok.getText()
                                    + " in definition of " + name);
                        params.add(tok.getText());
                        if (idx < args.size() && args.get(idx).getType() == ELLIPSIS) {
                            idx++;
                            variadic = true;
                        }
                    } else {
                        throw new ParseException("Bad token " + tok.getText()
                                + " in parameter list of " + name);
                    }

                    if (idx >= args.size())
                        throw new ParseException("Unterminated parameter list in definition of " + name);
                    tok = args.get(idx++);
                    if (tok.getType() == ')')
                        break;
                    if (variadic || tok.getType() != ',')
                        throw new ParseException("Expected ',' or ')' in parameter list of " + name
                                + ", not " + tok.getText());
                }
            }
        }

        List<Token> body = new ArrayList<Token>(args.subList(idx, args.size()));
        return new DefineNode(new Macro(name, params, body, variadic));
    }

    @Nonnull
    private Node include(@Nonnull List<Token> args) throws ParseException {
        if (args.isEmpty())
            throw new ParseException("#include needs a header name");
        Token tok = args.get(0);
        switch (tok.getType()) {
            case HEADER:
                trailing(PreprocessorCommand.PP_INCLUDE, args, 1);
                return IncludeNode.header((String) tok.getValue(), false);
            case STRING:
                trailing(PreprocessorCommand.PP_INCLUDE, args, 1);
                return IncludeNode.header((String) tok.getValue(), true);
            default:
                return IncludeNode.computed(args);
        }
    }
}
