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
 * One #if ... #elif ... #else ... #endif chain.
 *
 * At most one branch is selected on any single walk.
 */
public final class ConditionalGroup extends Node {

    private final List<Branch> branches = new ArrayList<Branch>();
    private EndifNode endif;

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.CONDITIONAL_GROUP;
    }

    @Nonnull
    public List<Branch> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    /** Returns the closing #endif, or null if the group was closed at end of file. */
    @CheckForNull
    public EndifNode getEndif() {
        return endif;
    }

    /* pp */ void add(@Nonnull Branch branch) {
        branches.add(branch);
    }

    /* pp */ boolean hasElse() {
        return !branches.isEmpty() && branches.get(branches.size() - 1).getKind() == Kind.ELSE;
    }

    /* pp */ void close(@CheckForNull EndifNode endif, int lastLine) {
        this.endif = endif;
        int sloc = 0;
        for (Branch branch : branches)
            sloc += branch.getSloc();
        int end = lastLine;
        if (endif != null) {
            sloc += endif.getSloc();
            end = endif.getEndLine();
        } else if (!branches.isEmpty()) {
            end = Math.max(end, branches.get(branches.size() - 1).getEndLine());
        }
        setExtent(branches.get(0).getCondition().getStartLine(), end, sloc);
    }

    @Override
    /* pp */ String describe() {
        return "group" + branches;
    }
}
