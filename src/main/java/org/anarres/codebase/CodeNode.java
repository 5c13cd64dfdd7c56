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

import java.util.Arrays;
import javax.annotation.Nonnull;

/**
 * A run of consecutive non-directive lines.
 */
public final class CodeNode extends Node {

    private final int[] slocLines;

    /**
     * @param slocLines the physical lines of this run that count as code, ascending.
     */
    public CodeNode(int startLine, int endLine, @Nonnull int[] slocLines) {
        this.slocLines = slocLines.clone();
        setExtent(startLine, endLine, slocLines.length);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.CODE;
    }

    /** Returns the lines that count as source lines of code, ascending. */
    @Nonnull
    public int[] getSlocLines() {
        return slocLines.clone();
    }

    @Override
    /* pp */ String describe() {
        return "code" + Arrays.toString(slocLines);
    }
}
