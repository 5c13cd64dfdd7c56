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
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import static org.anarres.codebase.Token.*;

/**
 * Evaluates #if conditions against a {@link MacroEnvironment}.
 *
 * The whole token list of a condition is macro-expanded first, and the
 * expansion is then parsed and evaluated, so a macro may expand to an
 * operator or to part of a larger expression. All arithmetic is signed
 * 64-bit. A name left over after expansion evaluates to 0.
 */
public class ExpressionEvaluator {

    private final MacroEnvironment environment;
    private final MacroExpander expander;

    public ExpressionEvaluator(@Nonnull MacroEnvironment environment, @Nonnegative int maxExpansionDepth) {
        this.environment = environment;
        this.expander = new MacroExpander(environment, maxExpansionDepth);
    }

    /**
     * Expands, parses and evaluates the tokens of a condition.
     *
     * @throws EvaluationException if expansion fails, the expansion is
     * empty or does not parse, or the arithmetic is undefined.
     */
    public long evaluate(@Nonnull List<Token> tokens) throws EvaluationException {
        List<Token> expanded = expander.expand(tokens);
        if (expanded.isEmpty())
            throw new EvaluationException("Expression expands to nothing: " + text(tokens));
        Expression expr;
        try {
            expr = new ExpressionParser(expanded).parse();
        } catch (ParseException e) {
            throw new EvaluationException("Cannot evaluate " + text(tokens) + ": " + e.getMessage(), e);
        }
        return evaluate(expr);
    }

    /** Returns true iff the condition evaluates to a nonzero value. */
    public boolean isTrue(@Nonnull List<Token> tokens) throws EvaluationException {
        return evaluate(tokens) != 0;
    }

    /** Evaluates an already expanded expression. */
    public long evaluate(@Nonnull Expression expr) throws EvaluationException {
        switch (expr.getKind()) {
            case LITERAL:
                return expr.getValue();

            case DEFINED:
                return environment.isDefined(expr.getName()) ? 1 : 0;

            case IDENTIFIER:
                return 0;

            case UNARY: {
                long operand = evaluate(expr.getOperand(0));
                switch (expr.getOperator()) {
                    case '~':
                        return ~operand;
                    case '!':
                        return operand == 0 ? 1 : 0;
                    case '-':
                        return -operand;
                    case '+':
                        return operand;
                    default:
                        throw new IllegalStateException("Unexpected unary operator " + Token.getTokenName(expr.getOperator()));
                }
            }

            case BINARY:
                return binary(expr);

            case TERNARY:
                if (evaluate(expr.getOperand(0)) != 0)
                    return evaluate(expr.getOperand(1));
                return evaluate(expr.getOperand(2));

            default:
                throw new IllegalStateException("Bad expression kind " + expr.getKind());
        }
    }

    private long binary(@Nonnull Expression expr) throws EvaluationException {
        int op = expr.getOperator();
        long lhs = evaluate(expr.getOperand(0));

        /* Short-circuit, as C does. */
        if (op == LAND)
            return lhs != 0 && evaluate(expr.getOperand(1)) != 0 ? 1 : 0;
        if (op == LOR)
            return lhs != 0 || evaluate(expr.getOperand(1)) != 0 ? 1 : 0;

        long rhs = evaluate(expr.getOperand(1));
        switch (op) {
            case '/':
                if (rhs == 0)
                    throw new EvaluationException("Division by zero");
                return lhs / rhs;
            case '%':
                if (rhs == 0)
                    throw new EvaluationException("Modulus by zero");
                return lhs % rhs;
            case '*':
                return lhs * rhs;
            case '+':
                return lhs + rhs;
            case '-':
                return lhs - rhs;
            case '<':
                return lhs < rhs ? 1 : 0;
            case '>':
                return lhs > rhs ? 1 : 0;
            case '&':
                return lhs & rhs;
            case '^':
                return lhs ^ rhs;
            case '|':
                return lhs | rhs;
            case LSH:
                return lhs << rhs;
            case RSH:
                return lhs >> rhs;
            case LE:
                return lhs <= rhs ? 1 : 0;
            case GE:
                return lhs >= rhs ? 1 : 0;
            case EQ:
                return lhs == rhs ? 1 : 0;
            case NE:
                return lhs != rhs ? 1 : 0;
            default:
                throw new IllegalStateException("Unexpected operator " + Token.getTokenName(op));
        }
    }

    @Nonnull
    private static String text(@Nonnull List<Token> tokens) {
        StringBuilder buf = new StringBuilder();
        for (Token tok : tokens) {
            if (buf.length() > 0)
                buf.append(' ');
            buf.append(tok.getText());
        }
        return buf.toString();
    }
}
