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
 * A node of a {@link SourceTree}.
 *
 * The set of node kinds is closed; consumers dispatch on {@link #getKind()}
 * with a switch. Every node records the physical lines it spans and the
 * number of those lines that count as source lines of code.
 */
public abstract class Node {

    public enum Kind {
        FILE,
        CODE,
        DEFINE,
        UNDEF,
        INCLUDE,
        PRAGMA,
        ERROR,
        WARNING,
        UNRECOGNIZED,
        IF,
        IFDEF,
        IFNDEF,
        ELIF,
        ELSE,
        ENDIF,
        CONDITIONAL_GROUP;

        /** Returns true for the kinds that open a conditional group. */
        public boolean opensGroup() {
            return this == IF || this == IFDEF || this == IFNDEF;
        }

        /** Returns true for the kinds that continue an open conditional group. */
        public boolean continuesGroup() {
            return this == ELIF || this == ELSE;
        }
    }

    private int startLine = -1;
    private int endLine = -1;
    private int sloc;

    @Nonnull
    public abstract Kind getKind();

    /* pp */ void setExtent(int startLine, int endLine, @Nonnegative int sloc) {
        this.startLine = startLine;
        this.endLine = endLine;
        this.sloc = sloc;
    }

    /** Returns the first physical line of this node, 1-based. */
    public int getStartLine() {
        return startLine;
    }

    /** Returns the last physical line of this node, inclusive. */
    public int getEndLine() {
        return endLine;
    }

    @Nonnegative
    public int getSloc() {
        return sloc;
    }

    /* pp */ String describe() {
        return getKind().name().toLowerCase();
    }

    @Override
    public String toString() {
        return describe() + "[" + startLine + "-" + endLine + ", sloc=" + sloc + "]";
    }
}
