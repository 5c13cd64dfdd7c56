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
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Categorizes Fortran sources run through a C preprocessor.
 *
 * Lines starting with '#' are preprocessor directives. A '!' outside a
 * character constant starts a comment. Fixed-form sources also treat a
 * 'c', 'C' or '*' in column 1 as a comment line.
 */
public class FortranCategorizer implements LineCategorizer {

    private static final List<String> EXTENSIONS = Collections.unmodifiableList(Arrays.asList(
            "f", "for", "ftn", "fpp", "f90", "f95", "f03", "f08"));

    private static class FortranReader extends AbstractLogicalLineReader {

        private final boolean fixedForm;

        FortranReader(@Nonnull Reader reader, boolean fixedForm) {
            super(reader);
            this.fixedForm = fixedForm;
        }

        @Nonnull
        @Override
        protected String strip(@Nonnull String line) {
            if (fixedForm && !line.isEmpty()) {
                char c = line.charAt(0);
                if (c == 'c' || c == 'C' || c == '*')
                    return "";
            }
            StringBuilder buf = new StringBuilder(line.length());
            char quote = 0;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (quote != 0) {
                    /* A doubled quote is an escaped quote, which this toggles back. */
                    if (c == quote)
                        quote = 0;
                } else if (c == '\'' || c == '"') {
                    quote = c;
                } else if (c == '!') {
                    buf.append(' ');
                    break;
                }
                buf.append(c);
            }
            return buf.toString();
        }
    }

    private final boolean fixedForm;

    /**
     * @param fixedForm true to read fixed-form sources (.f, .for, .ftn, .fpp).
     */
    public FortranCategorizer(boolean fixedForm) {
        this.fixedForm = fixedForm;
    }

    /** Returns the extensions of the source form this categorizer reads. */
    @Nonnull
    @Override
    public Collection<String> getExtensions() {
        if (fixedForm)
            return EXTENSIONS.subList(0, 4);
        return EXTENSIONS.subList(4, EXTENSIONS.size());
    }

    public boolean isFixedForm() {
        return fixedForm;
    }

    @Nonnull
    @Override
    public LogicalLineReader open(@Nonnull Reader reader) {
        return new FortranReader(reader, fixedForm);
    }

    @Override
    public String toString() {
        return (fixedForm ? "Fixed-form" : "Free-form") + " Fortran " + getExtensions();
    }
}
