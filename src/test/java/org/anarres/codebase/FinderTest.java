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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class FinderTest {

    @TempDir
    public Path dir;

    private DefaultDiagnosticListener listener;
    private TreeCache cache;
    private AnalysisOptions options;

    @BeforeEach
    public void setUp() {
        listener = new DefaultDiagnosticListener();
        cache = new TreeCache(new FileParser(CategorizerRegistry.createDefault(), listener));
        options = new AnalysisOptions();
    }

    private Path write(String name, String content) throws Exception {
        File file = dir.resolve(name).toFile();
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return TreeCache.key(file.toPath());
    }

    private SortedMap<Path, SortedSet<Integer>> walk(PlatformConfig config) throws Exception {
        return new Finder("test", config, cache, options, listener).walk();
    }

    private static List<Integer> lines(SortedMap<Path, SortedSet<Integer>> reached, Path file) {
        SortedSet<Integer> lines = reached.get(file);
        if (lines == null)
            return Collections.emptyList();
        return new ArrayList<Integer>(lines);
    }

    private static Map<String, List<PlatformConfig>> configuration(Object... args) {
        Map<String, List<PlatformConfig>> out = new LinkedHashMap<String, List<PlatformConfig>>();
        for (int i = 0; i < args.length; i += 2)
            out.put((String) args[i], Arrays.asList((PlatformConfig) args[i + 1]));
        return out;
    }

    @Test
    public void testGuardedLine() throws Exception {
        Path file = write("foo.cpp", "#ifdef MACRO\nvoid guarded();\n#endif\nunguarded();\n");
        assertEquals(Arrays.asList(2, 4), lines(walk(new PlatformConfig(file).addDefine("MACRO")), file));
        assertEquals(Arrays.asList(4), lines(walk(new PlatformConfig(file)), file));
        assertEquals(0, listener.getTotal(), String.valueOf(listener));
    }

    @Test
    public void testFind() throws Exception {
        Path file = write("foo.cpp", "#ifdef MACRO\nvoid guarded();\n#endif\nunguarded();\n");
        Association association = Finder.find(new Codebase(dir),
                configuration("with", new PlatformConfig(file).addDefine("MACRO"),
                        "without", new PlatformConfig(file)),
                cache, options, listener);
        assertEquals(new HashSet<String>(Arrays.asList("with")), association.get(file, 2));
        assertEquals(new HashSet<String>(Arrays.asList("with", "without")), association.get(file, 4));
        assertNull(association.get(file, 1));
        assertNull(association.get(file, 3));
        assertEquals(2, association.size());
    }

    @Test
    public void testUnreachedLines() throws Exception {
        Path file = write("foo.cpp", "#ifdef MACRO\nvoid guarded();\n#endif\nunguarded();\n");
        Path other = write("other.c", "int never_compiled;\n\n");
        write("README.txt", "not source\n");
        Association association = Finder.find(new Codebase(dir),
                configuration("without", new PlatformConfig(file)), cache, options, listener);
        assertEquals(Collections.emptySet(), association.get(file, 2));
        assertEquals(Collections.singleton("without"), association.get(file, 4));
        assertEquals(Collections.emptySet(), association.get(other, 1));
        assertEquals(2, association.getFiles().size());
        assertEquals(3, association.size());
    }

    @Test
    public void testSloc() throws Exception {
        Path file = write("sloc.c", "int a;\n"
                + "\n"
                + "// comment\n"
                + "/* block\n"
                + "   comment */\n"
                + "int b; /* trailing */\n"
                + "#define X 1\n"
                + "int c;\n");
        assertEquals(Arrays.asList(1, 6, 8), lines(walk(new PlatformConfig(file)), file));
    }

    @Test
    public void testDefineOrder() throws Exception {
        Path file = write("order.c", "#ifdef LATER\n"
                + "int before;\n"
                + "#endif\n"
                + "#define LATER\n"
                + "#ifdef LATER\n"
                + "int after;\n"
                + "#endif\n"
                + "#undef LATER\n"
                + "#ifndef LATER\n"
                + "int undefined_again;\n"
                + "#endif\n");
        assertEquals(Arrays.asList(6, 10), lines(walk(new PlatformConfig(file)), file));
    }

    @Test
    public void testFirstBranchOnly() throws Exception {
        Path file = write("elif.c", "#if X == 1\n"
                + "one;\n"
                + "#elif X == 2\n"
                + "two;\n"
                + "#elif X >= 2\n"
                + "more;\n"
                + "#else\n"
                + "other;\n"
                + "#endif\n");
        assertEquals(Arrays.asList(2), lines(walk(new PlatformConfig(file).addDefine("X=1")), file));
        assertEquals(Arrays.asList(4), lines(walk(new PlatformConfig(file).addDefine("X=2")), file));
        assertEquals(Arrays.asList(6), lines(walk(new PlatformConfig(file).addDefine("X=3")), file));
        assertEquals(Arrays.asList(8), lines(walk(new PlatformConfig(file)), file));
    }

    @Test
    public void testNestedGroups() throws Exception {
        Path file = write("nested.c", "#ifdef A\n"
                + "#ifdef B\n"
                + "ab;\n"
                + "#else\n"
                + "a_only;\n"
                + "#endif\n"
                + "a;\n"
                + "#endif\n");
        assertEquals(Arrays.asList(3, 7), lines(walk(new PlatformConfig(file).addDefine("A").addDefine("B")), file));
        assertEquals(Arrays.asList(5, 7), lines(walk(new PlatformConfig(file).addDefine("A")), file));
        assertEquals(Collections.emptyList(), lines(walk(new PlatformConfig(file).addDefine("B")), file));
    }

    @Test
    public void testEvaluationError() throws Exception {
        Path file = write("div.c", "#if 1 / 0\nbad;\n#else\ngood;\n#endif\n");
        assertEquals(Arrays.asList(4), lines(walk(new PlatformConfig(file)), file));
        assertEquals(1, listener.getCount(Diagnostic.Kind.EVALUATION_ERROR));
    }

    @Test
    public void testBadDefine() throws Exception {
        Path file = write("def.c", "#ifdef GOOD\ngood;\n#endif\n");
        PlatformConfig config = new PlatformConfig(file).addDefine("1BAD").addDefine("GOOD");
        assertEquals(Arrays.asList(2), lines(walk(config), file));
        assertEquals(1, listener.getCount(Diagnostic.Kind.BAD_DEFINE));
    }

    @Test
    public void testQuotedInclude() throws Exception {
        Path main = write("main.c", "#include \"inc/a.h\"\nint main_line;\n");
        Path a = write("inc/a.h", "#include \"b.h\"\nint a_line;\n");
        Path b = write("inc/b.h", "int b_line;\n");
        SortedMap<Path, SortedSet<Integer>> reached = walk(new PlatformConfig(main));
        assertEquals(Arrays.asList(2), lines(reached, main));
        assertEquals(Arrays.asList(2), lines(reached, a));
        assertEquals(Arrays.asList(1), lines(reached, b));
        assertEquals(0, listener.getTotal(), String.valueOf(listener));
    }

    @Test
    public void testIncludePaths() throws Exception {
        Path main = write("src/main.c", "#include <lib.h>\n#include <local.h>\nint main_line;\n");
        write("src/local.h", "int local_line;\n");
        Path first = write("first/lib.h", "int first;\n");
        Path second = write("second/lib.h", "int second;\n");
        PlatformConfig config = new PlatformConfig(main)
                .addIncludePath(dir.resolve("first"))
                .addIncludePath(dir.resolve("second"));
        SortedMap<Path, SortedSet<Integer>> reached = walk(config);
        assertEquals(Arrays.asList(1), lines(reached, first));
        assertFalse(reached.containsKey(second));
        /* Angled includes do not search the including file's directory. */
        assertFalse(reached.containsKey(dir.resolve("src/local.h")));
        assertEquals(1, listener.getCount(Diagnostic.Kind.UNRESOLVED_INCLUDE));
        assertEquals(Arrays.asList(3), lines(reached, main));
    }

    @Test
    public void testIncludeFileOverride() throws Exception {
        Path main = write("main.c", "#include \"config.h\"\n");
        Path local = write("config.h", "int local;\n");
        Path override = write("override/config.h", "int override;\n");
        SortedMap<Path, SortedSet<Integer>> reached = walk(new PlatformConfig(main).addIncludeFile(override));
        assertEquals(Arrays.asList(1), lines(reached, override));
        assertFalse(reached.containsKey(local));
    }

    @Test
    public void testIncludeFileOverrideMatchesPathComponents() throws Exception {
        Path main = write("main.c", "#include \"sub/config.h\"\n"
                + "#include \"fig.h\"\n");
        Path local = write("sub/config.h", "int local;\n");
        Path partial = write("fig.h", "int partial;\n");
        Path override = write("override/sub/config.h", "int override;\n");
        Path other = write("override/config.h", "int other;\n");
        PlatformConfig config = new PlatformConfig(main).addIncludeFile(other).addIncludeFile(override);
        SortedMap<Path, SortedSet<Integer>> reached = walk(config);
        /* "sub/config.h" is a suffix of the second override only. */
        assertEquals(Arrays.asList(1), lines(reached, override));
        assertFalse(reached.containsKey(local));
        assertFalse(reached.containsKey(other));
        /* "fig.h" is a suffix of "config.h" as text, but not as a path. */
        assertEquals(Arrays.asList(1), lines(reached, partial));
    }

    @Test
    public void testMalformedConditionalKeepsGroup() throws Exception {
        Path file = write("bad.c", "#ifdef OUTER\n"
                + "#ifdef 1\n"
                + "int bad;\n"
                + "#else\n"
                + "int fallback;\n"
                + "#endif\n"
                + "int outer;\n"
                + "#endif\n"
                + "int tail;\n");
        assertEquals(Arrays.asList(9), lines(walk(new PlatformConfig(file)), file));
        assertEquals(Arrays.asList(5, 7, 9), lines(walk(new PlatformConfig(file).addDefine("OUTER")), file));
        assertEquals(1, listener.getCount(Diagnostic.Kind.PARSE_ERROR));
        assertEquals(0, listener.getCount(Diagnostic.Kind.UNMATCHED_DIRECTIVE));
        assertEquals(0, listener.getCount(Diagnostic.Kind.EVALUATION_ERROR));
    }

    @Test
    public void testUnterminatedConditionalKeepsGroup() throws Exception {
        Path file = write("lex.c", "#if 'x\n"
                + "int bad;\n"
                + "#elif 1\n"
                + "int good;\n"
                + "#endif\n");
        assertEquals(Arrays.asList(4), lines(walk(new PlatformConfig(file)), file));
        assertEquals(1, listener.getCount(Diagnostic.Kind.LEX_ERROR));
        assertEquals(0, listener.getCount(Diagnostic.Kind.UNMATCHED_DIRECTIVE));
    }

    @Test
    public void testConditionExpandedAsAWhole() throws Exception {
        Path file = write("expand.c", "#define SUM 1 + 1\n"
                + "#if SUM * 2 == 3\n"
                + "int precedence;\n"
                + "#endif\n"
                + "#define AND &&\n"
                + "#if 1 AND 0\n"
                + "int conjunction;\n"
                + "#endif\n"
                + "#define E\n"
                + "#if E 1\n"
                + "int empty;\n"
                + "#endif\n"
                + "#ifdef NOPE\n"
                + "#if SUM\n"
                + "int nested;\n"
                + "#endif\n"
                + "#endif\n"
                + "int tail;\n");
        assertEquals(Arrays.asList(3, 11, 18), lines(walk(new PlatformConfig(file)), file));
        assertEquals(0, listener.getTotal(), String.valueOf(listener));
    }

    @Test
    public void testPragmaOnce() throws Exception {
        Path main = write("main.c", "#include \"once.h\"\n"
                + "#include \"once.h\"\n"
                + "#include \"guarded.h\"\n"
                + "#include \"guarded.h\"\n");
        String body = "#ifdef SEEN\n"
                + "int twice;\n"
                + "#endif\n"
                + "#define SEEN\n";
        Path once = write("once.h", "#pragma once\n" + body.replace("SEEN", "ONCE_SEEN"));
        Path guarded = write("guarded.h", body.replace("SEEN", "GUARD_SEEN"));
        SortedMap<Path, SortedSet<Integer>> reached = walk(new PlatformConfig(main));
        assertFalse(reached.containsKey(once));
        /* Without #pragma once, the second inclusion sees the definition. */
        assertEquals(Arrays.asList(2), lines(reached, guarded));
    }

    @Test
    public void testPragmaOncePerWalk() throws Exception {
        Path main = write("main.c", "#include \"once.h\"\n");
        Path once = write("once.h", "#pragma once\nint body;\n");
        PlatformConfig config = new PlatformConfig(main);
        assertEquals(Arrays.asList(2), lines(walk(config), once));
        assertEquals(Arrays.asList(2), lines(walk(config), once));
    }

    @Test
    public void testCircularInclude() throws Exception {
        Path main = write("main.c", "#include \"a.h\"\nint main_line;\n");
        Path a = write("a.h", "#include \"b.h\"\nint a_line;\n");
        Path b = write("b.h", "#include \"a.h\"\nint b_line;\n");
        SortedMap<Path, SortedSet<Integer>> reached = walk(new PlatformConfig(main));
        assertEquals(1, listener.getCount(Diagnostic.Kind.CIRCULAR_INCLUDE));
        assertEquals(Arrays.asList(2), lines(reached, main));
        assertEquals(Arrays.asList(2), lines(reached, a));
        assertEquals(Arrays.asList(2), lines(reached, b));
    }

    @Test
    public void testIncludeDepth() throws Exception {
        Path main = write("main.c", "#include \"a.h\"\n");
        Path a = write("a.h", "#include \"b.h\"\nint a_line;\n");
        Path b = write("b.h", "int b_line;\n");
        options.setMaxIncludeDepth(2);
        SortedMap<Path, SortedSet<Integer>> reached = walk(new PlatformConfig(main));
        assertEquals(1, listener.getCount(Diagnostic.Kind.INCLUDE_DEPTH_EXCEEDED));
        assertEquals(Arrays.asList(2), lines(reached, a));
        assertFalse(reached.containsKey(b));
    }

    @Test
    public void testComputedInclude() throws Exception {
        Path main = write("main.c", "#define QUOTED \"a.h\"\n"
                + "#define ANGLED <sys/b.h>\n"
                + "#define BROKEN 42\n"
                + "#include QUOTED\n"
                + "#include ANGLED\n"
                + "#include BROKEN\n");
        Path a = write("a.h", "int a_line;\n");
        Path b = write("include/sys/b.h", "int b_line;\n");
        SortedMap<Path, SortedSet<Integer>> reached = walk(new PlatformConfig(main).addIncludePath(dir.resolve("include")));
        assertEquals(Arrays.asList(1), lines(reached, a));
        assertEquals(Arrays.asList(1), lines(reached, b));
        assertEquals(1, listener.getCount(Diagnostic.Kind.UNRESOLVED_INCLUDE));
    }

    @Test
    public void testUnresolvedInclude() throws Exception {
        Path main = write("main.c", "#include \"missing.h\"\nint after;\n");
        assertEquals(Arrays.asList(2), lines(walk(new PlatformConfig(main)), main));
        assertEquals(1, listener.getCount(Diagnostic.Kind.UNRESOLVED_INCLUDE));
    }

    @Test
    public void testUnsupportedInclude() throws Exception {
        Path main = write("main.c", "#include \"table.txt\"\nint after;\n");
        write("table.txt", "1, 2, 3\n");
        assertEquals(Arrays.asList(2), lines(walk(new PlatformConfig(main)), main));
        assertEquals(1, listener.getCount(Diagnostic.Kind.UNSUPPORTED_FILE_TYPE));
    }

    @Test
    public void testUnsupportedEntry() throws Exception {
        Path good = write("good.c", "int good;\n");
        Path bad = write("bad.txt", "not source\n");
        Association association = Finder.find(new Codebase(dir),
                configuration("bad", new PlatformConfig(bad), "good", new PlatformConfig(good)),
                cache, options, listener);
        assertEquals(Collections.singleton("good"), association.get(good, 1));
        assertFalse(association.getFiles().contains(bad));
    }

    @Test
    public void testDeterministic() throws Exception {
        Path main = write("main.c", "#include \"common.h\"\n"
                + "#if defined(A) || defined(B)\n"
                + "int ab;\n"
                + "#endif\n"
                + "#ifdef C\n"
                + "int c;\n"
                + "#endif\n");
        write("common.h", "#pragma once\nint common;\n#ifdef A\nint common_a;\n#endif\n");
        Map<String, List<PlatformConfig>> configuration = new LinkedHashMap<String, List<PlatformConfig>>();
        configuration.put("C", Arrays.asList(new PlatformConfig(main).addDefine("C")));
        configuration.put("A", Arrays.asList(new PlatformConfig(main).addDefine("A")));
        configuration.put("B", Arrays.asList(new PlatformConfig(main).addDefine("B"),
                new PlatformConfig(main).addDefine("C")));

        options.setThreads(4);
        Association first = Finder.find(new Codebase(dir), configuration, cache, options, listener);
        Association second = Finder.find(new Codebase(dir), configuration);
        assertEquals(first, second);
        assertEquals(new HashSet<String>(Arrays.asList("A", "B")), first.get(main, 3));
        assertEquals(new HashSet<String>(Arrays.asList("B", "C")), first.get(main, 6));
    }

    @Test
    public void testExpansionDepth() throws Exception {
        Path file = write("deep.c", "#define A0 1\n"
                + "#define A1 A0\n"
                + "#define A2 A1\n"
                + "#define A3 A2\n"
                + "#if A3\n"
                + "deep;\n"
                + "#endif\n");
        assertEquals(Arrays.asList(6), lines(walk(new PlatformConfig(file)), file));
        options.setMaxExpansionDepth(2);
        assertEquals(Collections.emptyList(), lines(walk(new PlatformConfig(file)), file));
        assertEquals(1, listener.getCount(Diagnostic.Kind.EVALUATION_ERROR));
    }
}
