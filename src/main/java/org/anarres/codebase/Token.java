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
 * A lexical token from a directive line.
 *
 * Single-character punctuators use their character code as the type.
 * Everything else uses one of the constants below.
 */
public final class Token {

    public static final int IDENTIFIER = 257;
    /** An integer pp-number. The value is a {@link Long}, or null if not an integer. */
    public static final int NUMBER = 258;
    /** A character literal. The value is a {@link Long}. */
    public static final int CHARACTER = 259;
    /** A string literal. The value is the unquoted text. */
    public static final int STRING = 260;
    /** A &lt;header&gt; name, only after #include. The value is the name. */
    public static final int HEADER = 261;
    /** The directive keyword. The value is a {@link PreprocessorCommand}, or null if unrecognized. */
    public static final int DIRECTIVE = 262;
    public static final int HASH = 263;
    public static final int LAND = 264;
    public static final int LOR = 265;
    public static final int EQ = 266;
    public static final int NE = 267;
    public static final int LE = 268;
    public static final int GE = 269;
    public static final int LSH = 270;
    public static final int RSH = 271;
    public static final int PASTE = 272;
    public static final int ELLIPSIS = 273;
    public static final int INVALID = 274;

    private final int type;
    private final int offset;
    private final String text;
    private final Object value;

    public Token(int type, int offset, @Nonnull String text, @CheckForNull Object value) {
        this.type = type;
        this.offset = offset;
        this.text = text;
        this.value = value;
    }

    public Token(int type, int offset, @Nonnull String text) {
        this(type, offset, text, null);
    }

    public int getType() {
        return type;
    }

    /** Returns the character offset of this token within its logical line. */
    public int getOffset() {
        return offset;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    @CheckForNull
    public Object getValue() {
        return value;
    }

    /** Returns the offset just past the end of this token. */
    public int getEnd() {
        return offset + text.length();
    }

    public boolean is(int type) {
        return this.type == type;
    }

    public boolean isIdentifier(@Nonnull String name) {
        return type == IDENTIFIER && text.equals(name);
    }

    @Nonnull
    public static String getTokenName(int type) {
        if (type < 0)
            return "Invalid" + type;
        if (type < 256)
            return "'" + (char) type + "'";
        switch (type) {
            case IDENTIFIER:
                return "IDENTIFIER";
            case NUMBER:
                return "NUMBER";
            case CHARACTER:
                return "CHARACTER";
            case STRING:
                return "STRING";
            case HEADER:
                return "HEADER";
            case DIRECTIVE:
                return "DIRECTIVE";
            case HASH:
                return "HASH";
            case LAND:
                return "LAND";
            case LOR:
                return "LOR";
            case EQ:
                return "EQ";
            case NE:
                return "NE";
            case LE:
                return "LE";
            case GE:
                return "GE";
            case LSH:
                return "LSH";
            case RSH:
                return "RSH";
            case PASTE:
                return "PASTE";
            case ELLIPSIS:
                return "ELLIPSIS";
            case INVALID:
                return "INVALID";
            default:
                return "Unknown" + type;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Token))
            return false;
        Token o = (Token) obj;
        return type == o.type && offset == o.offset && text.equals(o.text);
    }

    @Override
    public int hashCode() {
        return (type * 31 + offset) * 31 + text.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(getTokenName(type));
        buf.append('@').append(offset);
        buf.append(':').append('"').append(text).append('"');
        if (value != null)
            buf.append('=').append(value);
        return buf.append(']').toString();
    }
}
