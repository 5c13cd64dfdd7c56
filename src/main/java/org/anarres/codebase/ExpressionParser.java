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

import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import static org.anarres.codebase.Token.*;

/**
 * Parses the macro-expanded tokens of an #if or #elif into an {@link Expression}.
 *
 * This is a precedence-climbing parser over the C operator priorities.
 * A name followed by '(' at this point is a function-like macro that
 * could not be invoked, and is rejected.
 */
public class ExpressionParser {

    /* Operands of unary operators bind tighter than any binary operator. */
    private static final int UNARY_PRIORITY = 11;

    private final List<Token> tokens;
    private int index;

    public ExpressionParser(@Nonnull List<Token> tokens) {
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parses the whole token list as one expression.
     *
     * @throws ParseException if the tokens are empty, unbalanced or malformed.
     */
    @Nonnull
    public Expression parse() throws ParseException {
        index = 0;
        if (tokens.isEmpty())
            throw new ParseException("#if with no expression");
        Expression expr = expr(0);
        Token tok = peek();
        if (tok != null)
            throw new ParseException("Unexpected " + tok.getText() + " in expression");
        return expr;
    }

    @CheckForNull
    private Token peek() {
        return index < tokens.size() ? tokens.get(index) : null;
    }

    @Nonnull
    private Token next(@Nonnull String context) throws ParseException {
        if (index >= tokens.size())
            throw new ParseException("Unexpected end of expression, expected " + context);
        return tokens.get(index++);
    }

    private static int priority(@CheckForNull Token op) {
        if (op == null)
            return 0;
        switch (op.getType()) {
            case '/':
            case '%':
            case '*':
                return 11;
            case '+':
            case '-':
                return 10;
            case LSH:
            case RSH:
                return 9;
            case '<':
            case '>':
            case LE:
            case GE:
                return 8;
            case EQ:
            case NE:
                return 7;
            case '&':
                return 6;
            case '^':
                return 5;
            case '|':
                return 4;
            case LAND:
                return 3;
            case LOR:
                return 2;
            case '?':
                return 1;
            default:
                return 0;
        }
    }

    @Nonnull
    private Expression expr(int priority) throws ParseException {
        Token tok = next("an operand");
        Expression lhs;

        switch (tok.getType()) {
            case '(':
                lhs = expr(0);
                tok = peek();
                if (tok == null || tok.getType() != ')')
                    throw new ParseException("Missing ) in expression");
                index++;
                break;

            case '~':
            case '!':
            case '-':
            case '+':
                lhs = Expression.unary(tok.getType(), expr(UNARY_PRIORITY));
                break;

            case NUMBER: {
                Object value = tok.getValue();
                if (value == null)
                    throw new ParseException("Not an integer constant in expression: " + tok.getText());
                lhs = Expression.literal(((Long) value).longValue());
                break;
            }
            case CHARACTER:
                lhs = Expression.literal(((Long) tok.getValue()).longValue());
                break;

            case IDENTIFIER:
                if ("defined".equals(tok.getText())) {
                    lhs = defined();
                } else {
                    Token la = peek();
                    if (la != null && la.getType() == '(')
                        throw new ParseException("Cannot call " + tok.getText() + " in expression");
                    lhs = Expression.identifier(tok.getText());
                }
                break;

            default:
                throw new ParseException("Bad token in expression: " + tok.getText());
        }

        for (;;) {
            Token op = peek();
            int pri = priority(op);
            if (pri == 0 || priority >= pri)
                break;
            index++;
            if (op.getType() == '?') {
                Expression ifTrue = expr(0);
                tok = peek();
                if (tok == null || tok.getType() != ':')
                    throw new ParseException("Missing : in conditional expression");
                index++;
                Expression ifFalse = expr(0);
                lhs = Expression.ternary(lhs, ifTrue, ifFalse);
            } else {
                Expression rhs = expr(pri);
                lhs = Expression.binary(op.getType(), lhs, rhs);
            }
        }
        return lhs;
    }

    @Nonnull
    private Expression defined() throws ParseException {
        Token la = next("an identifier after defined");
        boolean paren = false;
        if (la.getType() == '(') {
            paren = true;
            la = next("an identifier after defined(");
        }
        if (la.getType() != IDENTIFIER)
            throw new ParseException("defined() needs identifier, not " + la.getText());
        if (paren) {
            Token close = peek();
            if (close == null || close.getType() != ')')
                throw new ParseException("Missing ) in defined()");
            index++;
        }
        return Expression.defined(la.getText());
    }
}
