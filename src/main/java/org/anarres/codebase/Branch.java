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
import javax.annotation.Nonnull;

/**
 * One arm of a {@link ConditionalGroup}: its opening directive and the
 * nodes it owns.
 */
public final class Branch {

    private final ConditionNode condition;
    private final List<Node> children = new ArrayList<Node>();

    public Branch(@Nonnull ConditionNode condition) {
        this.condition = condition;
    }

    @Nonnull
    public ConditionNode getCondition() {
        return condition;
    }

    @Nonnull
    public Node.Kind getKind() {
        return condition.getKind();
    }

    @Nonnull
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /* pp */ void add(@Nonnull Node node) {
        children.add(node);
    }

    /** Returns the last line owned by this branch. */
    public int getEndLine() {
        if (children.isEmpty())
            return condition.getEndLine();
        return children.get(children.size() - 1).getEndLine();
    }

    /* pp */ int getSloc() {
        int sloc = condition.getSloc();
        for (Node child : children)
            sloc += child.getSloc();
        return sloc;
    }

    @Override
    public String toString() {
        return condition + " " + children;
    }
}
