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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.pcollections.HashTreePSet;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.codebase.Token.*;

/**
 * Expands macros in a token list against a {@link MacroEnvironment}.
 *
 * Every pending token carries the set of macro names it was produced by.
 * A name in that set is not expanded again, so a self-referential macro
 * expands to its own unexpanded name. Expansions are pushed back onto the
 * front of the input and rescanned together with the tokens following
 * them. Arguments of function-like macros are substituted textually;
 * stringizing and token pasting are not performed.
 */
public class MacroExpander {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);

    private static final String VA_ARGS = "__VA_ARGS__";
    private static final int MAX_EXPANSIONS = 1 << 16;

    private static class TokenS {

        final Token token;
        final PSet<String> disables;

        TokenS(@Nonnull Token token, @Nonnull PSet<String> disables) {
            this.token = token;
            this.disables = disables;
        }
    }

    private final MacroEnvironment environment;
    private final int maxDepth;

    public MacroExpander(@Nonnull MacroEnvironment environment, @Nonnegative int maxDepth) {
        this.environment = environment;
        this.maxDepth = maxDepth;
    }

    /**
     * Fully expands the given tokens.
     *
     * The operand of <code>defined</code> is never expanded.
     *
     * @throws EvaluationException if expansion nests deeper than the
     * configured limit, or a macro is invoked with the wrong number of
     * arguments.
     */
    @Nonnull
    public List<Token> expand(@Nonnull List<Token> tokens) throws EvaluationException {
        PSet<String> none = HashTreePSet.empty();
        Deque<TokenS> input = new ArrayDeque<TokenS>();
        for (Token tok : tokens)
            input.addLast(new TokenS(tok, none));

        List<Token> out = new ArrayList<Token>(tokens.size());
        int expansions = 0;
        while (!input.isEmpty()) {
            TokenS tok = input.removeFirst();
            if (tok.token.getType() != IDENTIFIER) {
                out.add(tok.token);
                continue;
            }
            String name = tok.token.getText();
            if ("defined".equals(name)) {
                out.add(tok.token);
                copyDefinedOperand(input, out);
                continue;
            }
            Macro m = environment.getMacro(name);
            if (m == null || tok.disables.contains(name)) {
                out.add(tok.token);
                continue;
            }
            if (tok.disables.size() >= maxDepth)
                throw new EvaluationException("Expansion of macro " + name
                        + " nests deeper than " + maxDepth + " levels");
            if (++expansions > MAX_EXPANSIONS)
                throw new EvaluationException("Too many macro expansions while expanding " + name);

            PSet<String> disables = tok.disables.plus(name);
            if (!m.isFunctionLike()) {
                List<TokenS> body = new ArrayList<TokenS>(m.getTokens().size());
                for (Token t : m.getTokens())
                    body.add(new TokenS(t, disables));
                pushFront(input, body);
                continue;
            }

            /* A function-like macro name without arguments is not an invocation. */
            TokenS open = input.peekFirst();
            if (open == null || open.token.getType() != '(') {
                out.add(tok.token);
                continue;
            }
            List<TokenS> consumed = new ArrayList<TokenS>();
            List<List<TokenS>> args = collectArguments(input, consumed);
            if (args == null) {
                LOG.debug("Unterminated argument list invoking macro {}", name);
                pushFront(input, consumed);
                out.add(tok.token);
                continue;
            }
            pushFront(input, substitute(m, args, disables));
        }
        return out;
    }

    private static void pushFront(@Nonnull Deque<TokenS> input, @Nonnull List<TokenS> tokens) {
        for (int i = tokens.size() - 1; i >= 0; i--)
            input.addFirst(tokens.get(i));
    }

    /* Copies "X" or "( X )" following a 'defined'. */
    private static void copyDefinedOperand(@Nonnull Deque<TokenS> input, @Nonnull List<Token> out) {
        TokenS la = input.pollFirst();
        if (la == null)
            return;
        out.add(la.token);
        if (la.token.getType() != '(')
            return;
        for (int i = 0; i < 2 && !input.isEmpty(); i++)
            out.add(input.removeFirst().token);
    }

    /**
     * Reads the parenthesized arguments at the front of the input.
     *
     * @return the arguments, or null if the closing ')' is missing.
     */
    private static List<List<TokenS>> collectArguments(@Nonnull Deque<TokenS> input, @Nonnull List<TokenS> consumed) {
        List<List<TokenS>> args = new ArrayList<List<TokenS>>();
        List<TokenS> arg = new ArrayList<TokenS>();
        int depth = 0;
        consumed.add(input.removeFirst());
        while (!input.isEmpty()) {
            TokenS tok = input.removeFirst();
            consumed.add(tok);
            switch (tok.token.getType()) {
                case '(':
                    depth++;
                    arg.add(tok);
                    break;
                case ')':
                    if (depth == 0) {
                        args.add(arg);
                        return args;
                    }
                    depth--;
                    arg.add(tok);
                    break;
                case ',':
                    if (depth == 0) {
                        args.add(arg);
                        arg = new ArrayList<TokenS>();
                    } else {
                        arg.add(tok);
                    }
                    break;
                default:
                    arg.add(tok);
                    break;
            }
        }
        return null;
    }

    /*
     * Body tokens carry the invocation's disables; argument tokens keep
     * their own, so that f(f(1)) expands the inner invocation.
     */
    @Nonnull
    private static List<TokenS> substitute(@Nonnull Macro m, @Nonnull List<List<TokenS>> args,
            @Nonnull PSet<String> disables) throws EvaluationException {
        List<String> params = m.getParameters();
        int count = params.size();

        /* f() supplies one empty argument, which is no arguments for a nullary macro. */
        if (count == 0 && args.size() == 1 && args.get(0).isEmpty())
            args.clear();

        if (m.isVariadic()) {
            if (args.size() < count - 1)
                throw new EvaluationException("Macro " + m.getName() + " requires at least "
                        + (count - 1) + " arguments, but only " + args.size() + " given");
            if (args.size() == count - 1)
                args.add(new ArrayList<TokenS>());
            while (args.size() > count) {
                List<TokenS> extra = args.remove(count);
                List<TokenS> last = args.get(count - 1);
                last.add(new TokenS(new Token(',', -1, ","), disables));
                last.addAll(extra);
            }
        } else if (args.size() != count) {
            throw new EvaluationException("Macro " + m.getName() + " requires "
                    + count + " arguments, but " + args.size() + " given");
        }

        List<TokenS> out = new ArrayList<TokenS>();
        for (Token tok : m.getTokens()) {
            int idx = tok.getType() == IDENTIFIER ? params.indexOf(tok.getText()) : -1;
            if (idx == -1 && m.isVariadic() && tok.isIdentifier(VA_ARGS))
                idx = count - 1;
            if (idx == -1)
                out.add(new TokenS(tok, disables));
            else
                out.addAll(args.get(idx));
        }
        return out;
    }
}
