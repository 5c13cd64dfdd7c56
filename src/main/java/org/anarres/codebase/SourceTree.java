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

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * The conditional-compilation tree of one source file.
 *
 * Nodes are inserted in file order. Conditional directives open, extend
 * and close {@link ConditionalGroup}s; every other node is appended to the
 * innermost open branch. Once {@link #finish(int)} has been called the
 * tree is never modified again and may be shared between threads.
 */
public class SourceTree {

    /* One level of the insertion cursor: a branch inside a group, or the root. */
    private static class Frame {

        final ConditionalGroup group;
        Branch branch;

        Frame(@CheckForNull ConditionalGroup group, @CheckForNull Branch branch) {
            this.group = group;
            this.branch = branch;
        }
    }

    private final Path path;
    private final FileNode root = new FileNode();
    private final Deque<Frame> frames = new ArrayDeque<Frame>();
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    private boolean finished;

    public SourceTree(@Nonnull Path path) {
        this.path = path;
        frames.push(new Frame(null, null));
    }

    @Nonnull
    public Path getPath() {
        return path;
    }

    @Nonnull
    public FileNode getRoot() {
        return root;
    }

    /** Returns the diagnostics raised while building this tree. */
    @Nonnull
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /* pp */ void addDiagnostic(@Nonnull Diagnostic.Kind kind, int line, @Nonnull String message) {
        diagnostics.add(new Diagnostic(kind, path, line, message));
    }

    private void append(@Nonnull Node node) {
        Frame top = frames.peek();
        if (top.branch == null)
            root.add(node);
        else
            top.branch.add(node);
    }

    @Nonnull
    private Node unmatched(@Nonnull Node node, @Nonnull String message) {
        addDiagnostic(Diagnostic.Kind.UNMATCHED_DIRECTIVE, node.getStartLine(), message);
        UnrecognizedNode degraded = new UnrecognizedNode("#" + node.describe(), message);
        degraded.setExtent(node.getStartLine(), node.getEndLine(), node.getSloc());
        return degraded;
    }

    /**
     * Inserts the next node of the file.
     *
     * The node must already carry its line extent.
     *
     * @return the node actually inserted, which is an {@link UnrecognizedNode}
     * if a conditional directive had no group to belong to.
     */
    @Nonnull
    public Node insert(@Nonnull Node node) {
        if (finished)
            throw new IllegalStateException("Tree for " + path + " is already finished");
        Frame top = frames.peek();
        switch (node.getKind()) {
            case IF:
            case IFDEF:
            case IFNDEF: {
                ConditionalGroup group = new ConditionalGroup();
                Branch branch = new Branch((ConditionNode) node);
                group.add(branch);
                append(group);
                frames.push(new Frame(group, branch));
                return node;
            }
            case ELIF:
            case ELSE: {
                if (top.group == null) {
                    node = unmatched(node, "#" + node.getKind().name().toLowerCase() + " without #if");
                    append(node);
                    return node;
                }
                if (top.group.hasElse()) {
                    node = unmatched(node, "#" + node.getKind().name().toLowerCase() + " after #else");
                    append(node);
                    return node;
                }
                Branch branch = new Branch((ConditionNode) node);
                top.group.add(branch);
                top.branch = branch;
                return node;
            }
            case ENDIF: {
                if (top.group == null) {
                    node = unmatched(node, "#endif without #if");
                    append(node);
                    return node;
                }
                top.group.close((EndifNode) node, node.getEndLine());
                frames.pop();
                return node;
            }
            case FILE:
            case CONDITIONAL_GROUP:
                throw new IllegalStateException("Cannot insert " + node.getKind() + " into a tree");
            default:
                append(node);
                return node;
        }
    }

    /**
     * Closes any groups still open at end of file and computes the
     * whole-file statistics.
     *
     * @param lastLine the last physical line of the file.
     */
    public void finish(@Nonnegative int lastLine) {
        if (finished)
            throw new IllegalStateException("Tree for " + path + " is already finished");
        while (frames.peek().group != null) {
            Frame frame = frames.pop();
            ConditionNode open = frame.group.getBranches().get(0).getCondition();
            addDiagnostic(Diagnostic.Kind.MISSING_ENDIF, open.getStartLine(),
                    "Missing #endif for #" + open.describe());
            frame.group.close(null, lastLine);
        }
        root.finish(lastLine, totalSloc(root.getChildren()));
        finished = true;
    }

    private static int totalSloc(@Nonnull List<Node> nodes) {
        int sloc = 0;
        for (Node node : nodes) {
            switch (node.getKind()) {
                case CODE:
                    sloc += node.getSloc();
                    break;
                case CONDITIONAL_GROUP:
                    for (Branch branch : ((ConditionalGroup) node).getBranches())
                        sloc += totalSloc(branch.getChildren());
                    break;
                default:
                    break;
            }
        }
        return sloc;
    }

    public boolean isFinished() {
        return finished;
    }

    @Override
    public String toString() {
        return path + ": " + root.getChildren();
    }
}
