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
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class CompilationDatabaseTest {

    @TempDir
    public Path dir;

    private Path write(String name, String content) throws Exception {
        File file = dir.resolve(name).toFile();
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file.toPath();
    }

    private static JsonObject entry(String directory, String file, String... arguments) {
        JsonObject entry = new JsonObject();
        entry.addProperty("directory", directory);
        entry.addProperty("file", file);
        JsonArray args = new JsonArray();
        for (String arg : arguments)
            args.add(new JsonPrimitive(arg));
        entry.add("arguments", args);
        return entry;
    }

    private static PlatformConfig single(JsonObject entry) {
        List<PlatformConfig> configs = CompilationDatabase.parseEntry(entry, CompilerTable.getDefault());
        assertEquals(1, configs.size(), String.valueOf(configs));
        return configs.get(0);
    }

    private Path database(String name, JsonObject... entries) throws Exception {
        JsonArray array = new JsonArray();
        for (JsonObject entry : entries)
            array.add(entry);
        return write(name, array.toString());
    }

    @Test
    public void testWorkingDirectoryIgnoredForAbsoluteFile() throws Exception {
        Path source = write("src/main.cpp", "int main() { return 0; }\n");
        String absolute = source.toAbsolutePath().toString();
        Path one = database("one.json", entry(dir.resolve("build1").toString(), absolute, "c++", "-c", absolute));
        Path two = database("two.json", entry(dir.resolve("build2").toString(), absolute, "c++", "-c", absolute));

        Map<String, List<PlatformConfig>> configuration = new LinkedHashMap<String, List<PlatformConfig>>();
        configuration.put("one", CompilationDatabase.load(one));
        configuration.put("two", CompilationDatabase.load(two));
        Codebase codebase = new Codebase(dir);
        SetMap setmap = new PlatformMapper(codebase).walk(Finder.find(codebase, configuration));
        assertEquals(1, setmap.asMap().size(), String.valueOf(setmap));
        assertEquals(1, setmap.get(new java.util.HashSet<String>(Arrays.asList("one", "two"))));
    }

    @Test
    public void testArguments() throws Exception {
        Path build = dir.resolve("build");
        PlatformConfig config = single(entry(build.toString(), "../src/a.c",
                "cc", "-DFOO", "-D", "BAR=2", "-Iinclude", "-I", "/opt/include",
                "-isystem", "sys", "-iquote", "quoted", "-include", "config.h",
                "-O2", "-Wall", "-o", "a.o", "-c", "../src/a.c"));
        assertNotNull(config);
        assertEquals(TreeCache.key(dir.resolve("src/a.c")), config.getFile());
        assertEquals(Arrays.asList("FOO", "BAR=2"), config.getDefines());
        assertEquals(Arrays.asList(build.resolve("include").toAbsolutePath().normalize(),
                build.getFileSystem().getPath("/opt/include").toAbsolutePath(),
                build.resolve("sys").toAbsolutePath().normalize(),
                build.resolve("quoted").toAbsolutePath().normalize()),
                config.getIncludePaths());
        assertEquals(Arrays.asList(build.resolve("config.h").toAbsolutePath().normalize()),
                config.getIncludeFiles());
    }

    @Test
    public void testCommand() throws Exception {
        JsonObject entry = new JsonObject();
        entry.addProperty("directory", dir.toString());
        entry.addProperty("file", "b.c");
        entry.addProperty("command", "gcc -DNAME=\"\\\"quoted value\\\"\" '-DSPACE=a b' -c b.c");
        PlatformConfig config = single(entry);
        assertNotNull(config);
        assertEquals(Arrays.asList("NAME=\"quoted value\"", "SPACE=a b"), config.getDefines());
    }

    @Test
    public void testSplit() throws Exception {
        assertEquals(Arrays.asList("cc", "-c", "a.c"), CompilationDatabase.split("  cc   -c a.c "));
        assertEquals(Arrays.asList("a b", "c"), CompilationDatabase.split("'a b' c"));
        assertEquals(Arrays.asList("a\\b"), CompilationDatabase.split("'a\\b'"));
        assertEquals(Arrays.asList("a b"), CompilationDatabase.split("a\\ b"));
        assertEquals(Arrays.asList(""), CompilationDatabase.split("\"\""));
        assertEquals(Collections.emptyList(), CompilationDatabase.split(""));
    }

    @Test
    public void testMissingFile() throws Exception {
        JsonObject noFile = new JsonObject();
        noFile.addProperty("directory", dir.toString());
        noFile.addProperty("command", "cc -c x.c");
        assertTrue(CompilationDatabase.parseEntry(noFile, CompilerTable.getDefault()).isEmpty());

        Path db = database("db.json", noFile, entry(dir.toString(), "y.c", "cc", "-c", "y.c"));
        List<PlatformConfig> configs = CompilationDatabase.load(db);
        assertEquals(1, configs.size());
        assertEquals(TreeCache.key(dir.resolve("y.c")), configs.get(0).getFile());
    }

    @Test
    public void testBadDatabase() throws Exception {
        Path notArray = write("object.json", "{\"file\": \"a.c\"}");
        assertThrows(IOException.class, () -> CompilationDatabase.load(notArray));
        Path garbage = write("garbage.json", "[{\"file\": ");
        assertThrows(IOException.class, () -> CompilationDatabase.load(garbage));
        assertThrows(IOException.class, () -> CompilationDatabase.load(dir.resolve("absent.json")));
    }

    @Test
    public void testNvccPasses() throws Exception {
        List<PlatformConfig> configs = CompilationDatabase.parseEntry(entry(dir.toString(), "k.cu",
                "/usr/local/cuda/bin/nvcc", "-fopenmp", "-gencode", "arch=compute_80,code=sm_80",
                "--gpu-architecture=sm_75", "-DUSER", "-c", "k.cu"), CompilerTable.getDefault());
        assertEquals(2, configs.size());
        assertEquals(Arrays.asList("__NVCC__", "__CUDACC__", "_OPENMP", "__CUDA_ARCH__=800", "USER"),
                configs.get(0).getDefines());
        assertEquals(Arrays.asList("__NVCC__", "__CUDACC__", "_OPENMP", "__CUDA_ARCH__=750", "USER"),
                configs.get(1).getDefines());
        assertEquals(configs.get(0).getFile(), configs.get(1).getFile());
    }

    @Test
    public void testNvccDefaultPass() throws Exception {
        PlatformConfig config = single(entry(dir.toString(), "k.cu", "nvcc", "-c", "k.cu"));
        assertEquals(Arrays.asList("__NVCC__", "__CUDACC__", "__CUDA_ARCH__=700"), config.getDefines());

        /* An architecture the table does not describe selects no pass. */
        config = single(entry(dir.toString(), "k.cu", "nvcc", "-arch=sm_86", "-c", "k.cu"));
        assertEquals(Arrays.asList("__NVCC__", "__CUDACC__"), config.getDefines());
    }

    @Test
    public void testUnknownCompiler() throws Exception {
        PlatformConfig config = single(entry(dir.toString(), "a.c", "g++", "-fopenmp", "-arch=sm_80", "-c", "a.c"));
        assertTrue(config.getDefines().isEmpty());
        List<PlatformConfig> configs = CompilationDatabase.parseEntry(entry(dir.toString(), "k.cu",
                "nvcc", "-arch=sm_80", "-arch=sm_90", "-c", "k.cu"), CompilerTable.empty());
        assertEquals(1, configs.size());
        assertTrue(configs.get(0).getDefines().isEmpty());
    }

    @Test
    public void testNvccPlatform() throws Exception {
        write("k.cu", "#ifdef __CUDA_ARCH__\n"
                + "#if __CUDA_ARCH__ >= 800\n"
                + "int ampere;\n"
                + "#else\n"
                + "int volta;\n"
                + "#endif\n"
                + "#else\n"
                + "int host;\n"
                + "#endif\n");
        Path db = database("gpu.json", entry(dir.toString(), "k.cu",
                "nvcc", "-gencode", "arch=compute_70,code=sm_70", "-gencode", "arch=compute_90,code=sm_90", "-c", "k.cu"));
        List<PlatformConfig> configs = CompilationDatabase.load(db);
        assertEquals(2, configs.size());

        Map<String, List<PlatformConfig>> configuration = new LinkedHashMap<String, List<PlatformConfig>>();
        configuration.put("gpu", configs);
        Path file = TreeCache.key(dir.resolve("k.cu"));
        Association association = Finder.find(new Codebase(dir), configuration);
        assertEquals(Collections.singleton("gpu"), association.get(file, 3));
        assertEquals(Collections.singleton("gpu"), association.get(file, 5));
        assertEquals(Collections.emptySet(), association.get(file, 8));
    }
}
