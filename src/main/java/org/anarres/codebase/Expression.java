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
 * A parsed #if expression.
 *
 * Expressions are parsed from fully macro-expanded tokens, so an
 * identifier leaf is a name that did not expand and evaluates to 0.
 */
public final class Expression {

    public enum Kind {
        LITERAL,
        IDENTIFIER,
        DEFINED,
        UNARY,
        BINARY,
        TERNARY
    }

    private final Kind kind;
    private final long value;
    private final String name;
    private final int operator;
    private final List<Expression> operands;

    private Expression(@Nonnull Kind kind, long value, @CheckForNull String name, int operator,
            @Nonnull List<Expression> operands) {
        this.kind = kind;
        this.value = value;
        this.name = name;
        this.operator = operator;
        this.operands = operands;
    }

    @Nonnull
    public static Expression literal(long value) {
        return new Expression(Kind.LITERAL, value, null, 0,
                Collections.<Expression>emptyList());
    }

    @Nonnull
    public static Expression identifier(@Nonnull String name) {
        return new Expression(Kind.IDENTIFIER, 0, name, 0, Collections.<Expression>emptyList());
    }

    @Nonnull
    public static Expression defined(@Nonnull String name) {
        return new Expression(Kind.DEFINED, 0, name, 0,
                Collections.<Expression>emptyList());
    }

    @Nonnull
    public static Expression unary(int operator, @Nonnull Expression operand) {
        return new Expression(Kind.UNARY, 0, null, operator,
                Collections.singletonList(operand));
    }

    @Nonnull
    public static Expression binary(int operator, @Nonnull Expression lhs, @Nonnull Expression rhs) {
        List<Expression> operands = new ArrayList<Expression>(2);
        operands.add(lhs);
        operands.add(rhs);
        return new Expression(Kind.BINARY, 0, null, operator,
                Collections.unmodifiableList(operands));
    }

    @Nonnull
    public static Expression ternary(@Nonnull Expression condition, @Nonnull Expression ifTrue,
            @Nonnull Expression ifFalse) {
        List<Expression> operands = new ArrayList<Expression>(3);
        operands.add(condition);
        operands.add(ifTrue);
        operands.add(ifFalse);
        return new Expression(Kind.TERNARY, 0, null, '?',
                Collections.unmodifiableList(operands));
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    public long getValue() {
        return value;
    }

    @CheckForNull
    public String getName() {
        return name;
    }

    /** Returns the token type of a unary or binary operator. */
    public int getOperator() {
        return operator;
    }

    @Nonnull
    public List<Expression> getOperands() {
        return operands;
    }

    @Nonnull
    public Expression getOperand(int index) {
        return operands.get(index);
    }

    @Nonnull
    private static String operatorText(int operator) {
        switch (operator) {
            case Token.LAND:
                return "&&";
            case Token.LOR:
                return "||";
            case Token.EQ:
                return "==";
            case Token.NE:
                return "!=";
            case Token.LE:
                return "<=";
            case Token.GE:
                return ">=";
            case Token.LSH:
                return "<<";
            case Token.RSH:
                return ">>";
            default:
                return String.valueOf((char) operator);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                return String.valueOf(value);
            case IDENTIFIER:
                return name;
            case DEFINED:
                return "defined(" + name + ")";
            case UNARY:
                return operatorText(operator) + operands.get(0);
            case BINARY:
                return "(" + operands.get(0) + " " + operatorText(operator) + " " + operands.get(1) + ")";
            case TERNARY:
                return "(" + operands.get(0) + " ? " + operands.get(1) + " : " + operands.get(2) + ")";
            default:
                throw new IllegalStateException("Bad expression kind " + kind);
        }
    }
}
