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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class PlatformMapperTest {

    private static final Set<String> NONE = Collections.<String>emptySet();
    private static final Set<String> BOTH = new HashSet<String>(Arrays.asList("CPU", "GPU"));

    @TempDir
    public Path dir;

    private Map<String, List<PlatformConfig>> configuration;

    private Path write(String name, String content) throws Exception {
        File file = dir.resolve(name).toFile();
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file.toPath();
    }

    @BeforeEach
    public void setUp() throws Exception {
        Path main = write("main.cpp", "#include \"first.h\"\n"
                + "#include \"first.h\"\n"
                + "#include \"second.h\"\n"
                + "int main(void)\n"
                + "{\n"
                + "  int x = 0;\n"
                + "  return x;\n"
                + "}\n"
                + "#if defined(CPU) && defined(GPU)\n"
                + "int both_defined;\n"
                + "int never;\n"
                + "#endif\n");
        write("first.h", "#pragma once\n"
                + "int a;\n"
                + "int b;\n");
        write("second.h", "#pragma once\n"
                + "#include \"first.h\"\n"
                + "#if defined(CPU) || defined(GPU)\n"
                + "int accelerated;\n"
                + "int offloaded;\n"
                + "#else\n"
                + "int host_only;\n"
                + "int fallback;\n"
                + "#endif\n"
                + "int tail;\n");
        configuration = new LinkedHashMap<String, List<PlatformConfig>>();
        configuration.put("CPU", Arrays.asList(new PlatformConfig(main).addDefine("CPU")));
        configuration.put("GPU", Arrays.asList(new PlatformConfig(main).addDefine("GPU")));
    }

    @Test
    public void testSharedAndDeadLines() throws Exception {
        Codebase codebase = new Codebase(dir);
        SetMap setmap = new PlatformMapper(codebase).walk(Finder.find(codebase, configuration));
        assertEquals(2, setmap.asMap().size(), String.valueOf(setmap));
        assertEquals(4, setmap.get(NONE));
        assertEquals(10, setmap.get(BOTH));
        assertEquals(0, setmap.get(Collections.singleton("CPU")));
        assertEquals(14, setmap.getTotal());
        assertEquals(10, setmap.getPlatformCount("CPU"));
        assertEquals(0.0, setmap.divergence(configuration.keySet()), 1e-9);
    }

    @Test
    public void testExcludePattern() throws Exception {
        Codebase codebase = new Codebase(dir).addExcludePattern("second.*");
        SetMap setmap = new PlatformMapper(codebase).walk(Finder.find(codebase, configuration));
        /* main.cpp and first.h only. */
        assertEquals(2, setmap.get(NONE));
        assertEquals(7, setmap.get(BOTH));
    }

    @Test
    public void testExcludeFile() throws Exception {
        Codebase codebase = new Codebase(dir).addExcludeFile(dir.resolve("first.h"));
        SetMap setmap = new PlatformMapper(codebase).walk(Finder.find(codebase, configuration));
        assertEquals(4, setmap.get(NONE));
        assertEquals(8, setmap.get(BOTH));
    }

    @Test
    public void testOutsideRoot() throws Exception {
        /* Only the headers lie under the root; main.cpp is walked but not counted. */
        write("include/extra.h", "int extra;\n");
        Path main = write("src/main.c", "#include \"extra.h\"\nint main_line;\n");
        Map<String, List<PlatformConfig>> configuration = Collections.singletonMap("only",
                Arrays.asList(new PlatformConfig(main).addIncludePath(dir.resolve("include"))));
        Codebase codebase = new Codebase(dir.resolve("include"));
        SetMap setmap = new PlatformMapper(codebase).walk(Finder.find(codebase, configuration));
        assertEquals(1, setmap.getTotal());
        assertEquals(1, setmap.get(Collections.singleton("only")));
    }
}
