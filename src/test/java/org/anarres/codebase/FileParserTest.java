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

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class FileParserTest {

    @TempDir
    public Path dir;

    private Path write(String name, String content) throws Exception {
        File file = dir.resolve(name).toFile();
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file.toPath();
    }

    @Test
    public void testStructure() throws Exception {
        Path path = write("test.c", "int a;\n"
                + "\n"
                + "#ifdef X\n"
                + "int b;\n"
                + "#else\n"
                + "int c;\n"
                + "#endif\n"
                + "int d;\n"
                + "\n");
        DefaultDiagnosticListener listener = new DefaultDiagnosticListener();
        SourceTree tree = new FileParser(CategorizerRegistry.createDefault(), listener).parse(path);
        assertTrue(tree.isFinished());
        assertEquals(0, listener.getTotal(), String.valueOf(listener));

        FileNode root = tree.getRoot();
        assertEquals(9, root.getNumLines());
        assertEquals(4, root.getTotalSloc());

        List<Node> children = root.getChildren();
        assertEquals(3, children.size());
        CodeNode head = (CodeNode) children.get(0);
        assertEquals(1, head.getStartLine());
        assertEquals(2, head.getEndLine());
        assertArrayEquals(new int[]{1}, head.getSlocLines());

        ConditionalGroup group = (ConditionalGroup) children.get(1);
        assertEquals(3, group.getStartLine());
        assertEquals(7, group.getEndLine());
        assertEquals(2, group.getBranches().size());
        assertEquals(Node.Kind.IFDEF, group.getBranches().get(0).getKind());
        assertEquals(Node.Kind.ELSE, group.getBranches().get(1).getKind());
        assertNotNull(group.getEndif());

        /* The trailing run extends to the last line of the file. */
        CodeNode tail = (CodeNode) children.get(2);
        assertEquals(8, tail.getStartLine());
        assertEquals(9, tail.getEndLine());
        assertArrayEquals(new int[]{8}, tail.getSlocLines());
    }

    @Test
    public void testContinuedDirective() throws Exception {
        Path path = write("cont.h", "#if defined(A) && \\\n"
                + "    defined(B)\n"
                + "x;\n"
                + "#endif\n");
        SourceTree tree = new FileParser(CategorizerRegistry.createDefault()).parse(path);
        ConditionalGroup group = (ConditionalGroup) tree.getRoot().getChildren().get(0);
        ConditionNode condition = group.getBranches().get(0).getCondition();
        assertEquals(1, condition.getStartLine());
        assertEquals(2, condition.getEndLine());
        CodeNode code = (CodeNode) group.getBranches().get(0).getChildren().get(0);
        assertArrayEquals(new int[]{3}, code.getSlocLines());
    }

    @Test
    public void testDiagnostics() throws Exception {
        Path path = write("bad.cpp", "#include <unterminated.h\n"
                + "#if (\n"
                + "a;\n"
                + "#endif junk\n"
                + "#endif\n"
                + "#bogus\n");
        DefaultDiagnosticListener listener = new DefaultDiagnosticListener();
        SourceTree tree = new FileParser(CategorizerRegistry.createDefault(), listener).parse(path);
        assertEquals(1, listener.getCount(Diagnostic.Kind.LEX_ERROR));
        assertEquals(1, listener.getCount(Diagnostic.Kind.PARSE_ERROR));
        /* The broken #if still opens a group, so only the second #endif is unmatched. */
        assertEquals(1, listener.getCount(Diagnostic.Kind.UNMATCHED_DIRECTIVE));
        /* "junk" after #endif, and the unknown directive. */
        assertEquals(2, listener.getCount(Diagnostic.Kind.PARSE_WARNING));
        assertEquals(listener.getTotal(), tree.getDiagnostics().size());

        List<Node> children = tree.getRoot().getChildren();
        assertEquals(Node.Kind.UNRECOGNIZED, children.get(0).getKind());
        ConditionalGroup group = (ConditionalGroup) children.get(1);
        ConditionNode condition = group.getBranches().get(0).getCondition();
        assertEquals(Node.Kind.IF, condition.getKind());
        assertFalse(condition.isValid());
        assertEquals(2, group.getStartLine());
        assertEquals(4, group.getEndLine());
        assertEquals(Node.Kind.UNRECOGNIZED, children.get(2).getKind());
        assertEquals(4, children.size());
        assertEquals(6, tree.getRoot().getNumLines());
    }

    @Test
    public void testUnsupported() throws Exception {
        Path missing = dir.resolve("absent.txt");
        /* The extension is checked before the file is read. */
        UnsupportedFileTypeException e = assertThrows(UnsupportedFileTypeException.class,
                () -> new FileParser(CategorizerRegistry.createDefault()).parse(missing));
        assertEquals(missing, e.getPath());
    }

    @Test
    public void testMissingFile() throws Exception {
        Path missing = dir.resolve("absent.c");
        assertThrows(java.io.IOException.class,
                () -> new FileParser(CategorizerRegistry.createDefault()).parse(missing));
    }

    @Test
    public void testEmptyFile() throws Exception {
        Path path = write("empty.h", "");
        SourceTree tree = new FileParser(CategorizerRegistry.createDefault()).parse(path);
        assertTrue(tree.getRoot().getChildren().isEmpty());
        assertEquals(0, tree.getRoot().getNumLines());
        assertEquals(0, tree.getRoot().getTotalSloc());
    }
}
