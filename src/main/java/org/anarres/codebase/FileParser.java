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

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link SourceTree} of a file.
 *
 * Consecutive code lines are grouped into one {@link CodeNode}; each
 * directive becomes a node of its own. A directive that cannot be lexed
 * or parsed is degraded by {@link DirectiveParser#degrade(String, String)},
 * so a file always parses completely.
 */
public class FileParser {

    private static final Logger LOG = LoggerFactory.getLogger(FileParser.class);

    /* The code lines seen since the last directive. */
    private static class LineGroup {

        int startLine = -1;
        int endLine = -1;
        final List<Integer> slocLines = new ArrayList<Integer>();

        boolean isEmpty() {
            return startLine == -1;
        }

        void add(@Nonnull LogicalLine line) {
            if (startLine == -1)
                startLine = line.getStartLine();
            endLine = line.getEndLine();
            if (line.getSloc() > 0)
                slocLines.add(line.getStartLine());
        }

        @Nonnull
        CodeNode toNode() {
            int[] lines = new int[slocLines.size()];
            for (int i = 0; i < lines.length; i++)
                lines[i] = slocLines.get(i);
            return new CodeNode(startLine, endLine, lines);
        }

        void reset() {
            startLine = -1;
            endLine = -1;
            slocLines.clear();
        }
    }

    private final CategorizerRegistry registry;
    private final DiagnosticListener listener;

    public FileParser(@Nonnull CategorizerRegistry registry, @CheckForNull DiagnosticListener listener) {
        this.registry = registry;
        this.listener = listener;
    }

    public FileParser(@Nonnull CategorizerRegistry registry) {
        this(registry, null);
    }

    @Nonnull
    public CategorizerRegistry getRegistry() {
        return registry;
    }

    /**
     * Parses a file.
     *
     * @throws UnsupportedFileTypeException if no categorizer handles the
     * file's extension. Nothing is read in that case.
     * @throws IOException if the file cannot be read.
     */
    @Nonnull
    public SourceTree parse(@Nonnull Path path) throws IOException, UnsupportedFileTypeException {
        LineCategorizer categorizer = registry.getCategorizer(path);
        if (categorizer == null)
            throw new UnsupportedFileTypeException(path);

        String content = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
        SourceTree tree = new SourceTree(path);
        LineGroup group = new LineGroup();

        LogicalLineReader reader = categorizer.open(new StringReader(content));
        try {
            for (;;) {
                LogicalLine line = reader.next();
                if (line == null)
                    break;
                if (!line.isDirective()) {
                    group.add(line);
                    continue;
                }
                if (!group.isEmpty()) {
                    tree.insert(group.toNode());
                    group.reset();
                }
                Node node = directive(tree, line);
                node.setExtent(line.getStartLine(), line.getEndLine(), line.getSloc());
                tree.insert(node);
            }

            int lastLine = reader.getPhysicalLineCount();
            if (!group.isEmpty()) {
                group.endLine = Math.max(group.endLine, lastLine);
                tree.insert(group.toNode());
            }
            tree.finish(lastLine);
        } finally {
            reader.close();
        }

        if (listener != null) {
            for (Diagnostic diagnostic : tree.getDiagnostics())
                listener.handleDiagnostic(diagnostic);
        }
        LOG.debug("Parsed {}: {} lines, {} sloc, {} diagnostics", path,
                tree.getRoot().getNumLines(), tree.getRoot().getTotalSloc(), tree.getDiagnostics().size());
        return tree;
    }

    @Nonnull
    private static Node directive(@Nonnull SourceTree tree, @Nonnull LogicalLine line) {
        String text = line.getText();
        List<Token> tokens;
        try {
            tokens = new Lexer(text).tokenize();
        } catch (LexerException e) {
            tree.addDiagnostic(Diagnostic.Kind.LEX_ERROR, line.getStartLine(), e.getMessage());
            return DirectiveParser.degrade(text, e.getMessage());
        }

        DirectiveParser parser = new DirectiveParser(text, tokens);
        Node node = parser.parse();
        if (parser.getError() != null)
            tree.addDiagnostic(Diagnostic.Kind.PARSE_ERROR, line.getStartLine(), parser.getError());
        for (String warning : parser.getWarnings())
            tree.addDiagnostic(Diagnostic.Kind.PARSE_WARNING, line.getStartLine(), warning);
        return node;
    }
}
