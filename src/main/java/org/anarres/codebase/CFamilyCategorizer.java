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

import java.io.Reader;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import javax.annotation.Nonnull;

/**
 * Categorizes C, C++, CUDA and OpenCL sources.
 *
 * Understands // and block comments, string and character literals, and
 * backslash continuations.
 */
public class CFamilyCategorizer implements LineCategorizer {

    private static final Collection<String> EXTENSIONS = Collections.unmodifiableList(Arrays.asList(
            "c", "h", "cc", "cpp", "cxx", "c++", "hh", "hpp", "hxx", "h++",
            "inc", "cu", "cuh", "cl", "ipp", "tpp"));

    private static class CReader extends AbstractLogicalLineReader {

        private boolean inComment;

        CReader(@Nonnull Reader reader) {
            super(reader);
        }

        @Override
        protected boolean isInComment() {
            return inComment;
        }

        @Nonnull
        @Override
        protected String strip(@Nonnull String line) {
            StringBuilder buf = new StringBuilder(line.length());
            char quote = 0;
            int len = line.length();
            int i = 0;
            while (i < len) {
                char c = line.charAt(i);
                char d = i + 1 < len ? line.charAt(i + 1) : 0;
                if (inComment) {
                    if (c == '*' && d == '/') {
                        inComment = false;
                        i += 2;
                    } else {
                        i++;
                    }
                    continue;
                }
                if (quote != 0) {
                    buf.append(c);
                    if (c == '\\' && d != 0) {
                        buf.append(d);
                        i += 2;
                        continue;
                    }
                    if (c == quote)
                        quote = 0;
                    i++;
                    continue;
                }
                if (c == '/' && d == '*') {
                    buf.append(' ');
                    inComment = true;
                    i += 2;
                    continue;
                }
                if (c == '/' && d == '/') {
                    buf.append(' ');
                    /* A spliced line comment keeps the backslash, so the splice is seen. */
                    if (line.endsWith("\\"))
                        buf.append('\\');
                    break;
                }
                if (c == '"' || c == '\'')
                    quote = c;
                buf.append(c);
                i++;
            }
            return buf.toString();
        }
    }

    @Nonnull
    @Override
    public Collection<String> getExtensions() {
        return EXTENSIONS;
    }

    @Nonnull
    @Override
    public LogicalLineReader open(@Nonnull Reader reader) {
        return new CReader(reader);
    }

    @Override
    public String toString() {
        return "C family " + EXTENSIONS;
    }
}
