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
import java.util.List;
import javax.annotation.Nonnull;

import static org.anarres.codebase.Token.*;

/**
 * Tokenizes one logical line.
 *
 * Continuation lines must already have been joined. A line that starts
 * with '#' yields a {@link Token#HASH} followed by a {@link Token#DIRECTIVE}
 * keyword. Any other text is tokenized as-is, which is how macro values
 * from the command line are lexed.
 */
public class Lexer {

    private final String text;
    private int pos;
    private boolean include;

    public Lexer(@Nonnull String text) {
        this.text = text;
        this.pos = 0;
        this.include = false;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * Returns all tokens on the line, without whitespace or comments.
     *
     * @throws LexerException on an unterminated literal or header name.
     */
    @Nonnull
    public List<Token> tokenize() throws LexerException {
        List<Token> tokens = new ArrayList<Token>();
        pos = 0;
        include = false;

        skipWhite();
        if (pos < text.length() && text.charAt(pos) == '#') {
            tokens.add(new Token(HASH, pos, "#"));
            pos++;
            skipWhite();
            if (pos < text.length() && isIdentifierStart(text.charAt(pos))) {
                int start = pos;
                String word = identifier();
                PreprocessorCommand cmd = PreprocessorCommand.forText(word);
                tokens.add(new Token(DIRECTIVE, start, word, cmd));
                include = cmd == PreprocessorCommand.PP_INCLUDE;
            }
        }

        for (;;) {
            skipWhite();
            if (pos >= text.length())
                break;
            tokens.add(token());
            include = false;
        }
        return tokens;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private void skipWhite() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '\\' && pos + 1 < text.length()
                    && (text.charAt(pos + 1) == '\n' || text.charAt(pos + 1) == '\r')) {
                pos += 2;
            } else if (c == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
                int end = text.indexOf("*/", pos + 2);
                pos = end == -1 ? text.length() : end + 2;
            } else if (c == '/' && pos + 1 < text.length() && text.charAt(pos + 1) == '/') {
                pos = text.length();
            } else {
                break;
            }
        }
    }

    @Nonnull
    private String identifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos)))
            pos++;
        return text.substring(start, pos);
    }

    @Nonnull
    private Token token() throws LexerException {
        int start = pos;
        char c = text.charAt(pos);

        if (isIdentifierStart(c))
            return new Token(IDENTIFIER, start, identifier());
        if (Character.isDigit(c)
                || (c == '.' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))))
            return number();
        if (c == '"')
            return string();
        if (c == '\'')
            return character();
        if (c == '<' && include)
            return header();

        String rest = text.substring(pos, Math.min(pos + 3, text.length()));
        if (rest.startsWith("..."))
            return op(ELLIPSIS, 3);
        if (rest.startsWith("&&"))
            return op(LAND, 2);
        if (rest.startsWith("||"))
            return op(LOR, 2);
        if (rest.startsWith("=="))
            return op(EQ, 2);
        if (rest.startsWith("!="))
            return op(NE, 2);
        if (rest.startsWith("<<"))
            return op(LSH, 2);
        if (rest.startsWith(">>"))
            return op(RSH, 2);
        if (rest.startsWith("<="))
            return op(LE, 2);
        if (rest.startsWith(">="))
            return op(GE, 2);
        if (rest.startsWith("##"))
            return op(PASTE, 2);

        pos++;
        if (c < 128 && "!#%&()*+,-./:;<=>?[]^{|}~".indexOf(c) != -1)
            return new Token(c, start, String.valueOf(c));
        return new Token(INVALID, start, String.valueOf(c));
    }

    @Nonnull
    private Token op(int type, int length) {
        int start = pos;
        pos += length;
        return new Token(type, start, text.substring(start, pos));
    }

    /* A pp-number: digits, letters, '.', and signed exponents. */
    @Nonnull
    private Token number() {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if ((c == '+' || c == '-') && pos > start) {
                char p = Character.toLowerCase(text.charAt(pos - 1));
                if (p == 'e' || p == 'p') {
                    pos++;
                    continue;
                }
                break;
            }
            if (!isIdentifierPart(c) && c != '.' && c != '\'')
                break;
            pos++;
        }
        String num = text.substring(start, pos);
        return new Token(NUMBER, start, num, parseInteger(num));
    }

    /**
     * Parses an integer pp-number, or returns null if it is not an integer.
     *
     * Values beyond {@link Long#MAX_VALUE} wrap, as unsigned arithmetic would.
     */
    /* pp */ static Long parseInteger(@Nonnull String num) {
        String digits = num.replace("'", "");
        int end = digits.length();
        while (end > 0 && "uUlLzZ".indexOf(digits.charAt(end - 1)) != -1)
            end--;
        digits = digits.substring(0, end);
        if (digits.isEmpty())
            return null;
        int radix = 10;
        if (digits.length() > 2 && (digits.startsWith("0x") || digits.startsWith("0X"))) {
            radix = 16;
            digits = digits.substring(2);
        } else if (digits.length() > 2 && (digits.startsWith("0b") || digits.startsWith("0B"))) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.charAt(0) == '0') {
            radix = 8;
            digits = digits.substring(1);
        }
        try {
            return Long.parseUnsignedLong(digits, radix);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Nonnull
    private Token string() throws LexerException {
        int start = pos;
        StringBuilder value = new StringBuilder();
        pos++;
        for (;;) {
            if (pos >= text.length())
                throw new LexerException("Unterminated string literal at offset " + start);
            char c = text.charAt(pos);
            if (c == '"')
                break;
            /* Backslashes are kept verbatim; include names must not treat them as escapes. */
            if (c == '\\' && pos + 1 < text.length()) {
                value.append(c);
                pos++;
                c = text.charAt(pos);
            }
            value.append(c);
            pos++;
        }
        pos++;
        return new Token(STRING, start, text.substring(start, pos), value.toString());
    }

    @Nonnull
    private Token character() throws LexerException {
        int start = pos;
        long value = 0;
        int count = 0;
        pos++;
        for (;;) {
            if (pos >= text.length())
                throw new LexerException("Unterminated character literal at offset " + start);
            char c = text.charAt(pos);
            if (c == '\'')
                break;
            if (c == '\\') {
                pos++;
                if (pos >= text.length())
                    throw new LexerException("Unterminated character literal at offset " + start);
                c = escape();
            } else {
                pos++;
            }
            value = (value << 8) | (c & 0xff);
            count++;
        }
        pos++;
        if (count == 0)
            throw new LexerException("Empty character literal at offset " + start);
        /* A plain char is signed, so '\xff' is -1. */
        if (count == 1)
            value = (byte) value;
        return new Token(CHARACTER, start, text.substring(start, pos), Long.valueOf(value));
    }

    /* Reads the escape after a backslash, leaving pos past it. */
    private char escape() {
        char c = text.charAt(pos++);
        switch (c) {
            case 'a':
                return 0x07;
            case 'b':
                return '\b';
            case 'f':
                return '\f';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 't':
                return '\t';
            case 'v':
                return 0x0b;
            case 'x': {
                int val = 0;
                while (pos < text.length() && Character.digit(text.charAt(pos), 16) != -1)
                    val = (val << 4) | Character.digit(text.charAt(pos++), 16);
                return (char) val;
            }
            case '0':
            case '1':
            case '2':
            case '3':
            case '4':
            case '5':
            case '6':
            case '7': {
                int val = c - '0';
                for (int i = 0; i < 2 && pos < text.length(); i++) {
                    int d = Character.digit(text.charAt(pos), 8);
                    if (d == -1)
                        break;
                    val = (val << 3) | d;
                    pos++;
                }
                return (char) val;
            }
            default:
                return c;
        }
    }

    @Nonnull
    private Token header() throws LexerException {
        int start = pos;
        int end = text.indexOf('>', pos + 1);
        if (end == -1)
            throw new LexerException("Unterminated header name at offset " + start);
        pos = end + 1;
        return new Token(HEADER, start, text.substring(start, pos), text.substring(start + 1, end));
    }
}
