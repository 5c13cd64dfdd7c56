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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * One entry of a categorized file: either a directive, joined across
 * continuation lines, or a single physical line of code.
 */
public final class LogicalLine {

    public enum Category {
        CODE,
        DIRECTIVE
    }

    private final int startLine;
    private final int endLine;
    private final int sloc;
    private final String text;
    private final Category category;

    public LogicalLine(int startLine, int endLine, @Nonnegative int sloc,
            @Nonnull String text, @Nonnull Category category) {
        if (endLine < startLine)
            throw new IllegalArgumentException("Bad line range " + startLine + "-" + endLine);
        this.startLine = startLine;
        this.endLine = endLine;
        this.sloc = sloc;
        this.text = text;
        this.category = category;
    }

    /** Returns the first physical line, 1-based. */
    public int getStartLine() {
        return startLine;
    }

    /** Returns the last physical line, inclusive. */
    public int getEndLine() {
        return endLine;
    }

    /** Returns the number of physical lines in this entry that count as SLOC. */
    @Nonnegative
    public int getSloc() {
        return sloc;
    }

    /**
     * Returns the text of a directive, with continuations joined and
     * comments replaced by a space. For code, the physical line.
     */
    @Nonnull
    public String getText() {
        return text;
    }

    @Nonnull
    public Category getCategory() {
        return category;
    }

    public boolean isDirective() {
        return category == Category.DIRECTIVE;
    }

    @Override
    public String toString() {
        return category + "[" + startLine + "-" + endLine + ", sloc=" + sloc + "]: " + text;
    }
}
