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
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * The root of a {@link SourceTree}.
 */
public final class FileNode extends Node {

    private final List<Node> children = new ArrayList<Node>();
    private int numLines;
    private int totalSloc;

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.FILE;
    }

    @Nonnull
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /* pp */ void add(@Nonnull Node node) {
        children.add(node);
    }

    /** Returns the last physical line of the file. */
    @Nonnegative
    public int getNumLines() {
        return numLines;
    }

    /**
     * Returns the SLOC of every code node in the file, as if every branch
     * were taken. This does not depend on any platform.
     */
    @Nonnegative
    public int getTotalSloc() {
        return totalSloc;
    }

    /* pp */ void finish(int numLines, int totalSloc) {
        this.numLines = numLines;
        this.totalSloc = totalSloc;
        int sloc = 0;
        for (Node child : children)
            sloc += child.getSloc();
        setExtent(1, numLines, sloc);
    }
}
