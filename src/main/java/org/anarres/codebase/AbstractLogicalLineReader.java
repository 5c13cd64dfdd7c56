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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Reads physical lines and groups them into {@link LogicalLine}s.
 *
 * A line whose first character outside comments is '#' starts a
 * directive, which extends over backslash continuations and over block
 * comments left open at the end of a line. Every other physical line is a
 * code entry of its own.
 */
/* pp */ abstract class AbstractLogicalLineReader implements LogicalLineReader {

    private final BufferedReader in;
    private int lineno;
    private boolean continued;

    protected AbstractLogicalLineReader(@Nonnull Reader reader) {
        this.in = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
    }

    /**
     * Returns the line with every comment replaced by a single space.
     *
     * Implementations may keep state from one line to the next.
     */
    @Nonnull
    protected abstract String strip(@Nonnull String line);

    /** Returns true if a block comment is open at the end of the last stripped line. */
    protected boolean isInComment() {
        return false;
    }

    private static boolean isContinued(@Nonnull String line) {
        return line.endsWith("\\");
    }

    private static boolean isBlank(@Nonnull String text) {
        return text.trim().isEmpty();
    }

    @Override
    public int getPhysicalLineCount() {
        return lineno;
    }

    @CheckForNull
    @Override
    public LogicalLine next() throws IOException {
        String line = in.readLine();
        if (line == null)
            return null;
        int start = ++lineno;
        String text = strip(line);

        /* A '#' on a spliced code line is not a directive. */
        if (continued || !text.trim().startsWith("#")) {
            continued = isContinued(line);
            return new LogicalLine(start, start, isBlank(text) ? 0 : 1, line, LogicalLine.Category.CODE);
        }

        StringBuilder buf = new StringBuilder();
        int sloc = isBlank(text) ? 0 : 1;
        while (isContinued(line) || isInComment()) {
            if (text.endsWith("\\"))
                text = text.substring(0, text.length() - 1);
            buf.append(text).append(' ');
            line = in.readLine();
            if (line == null)
                break;
            lineno++;
            text = strip(line);
            if (!isBlank(text))
                sloc++;
        }
        if (line != null)
            buf.append(text);
        continued = false;
        return new LogicalLine(start, lineno, sloc, buf.toString(), LogicalLine.Category.DIRECTIVE);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
