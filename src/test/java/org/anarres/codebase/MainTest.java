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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    public Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) throws Exception {
        try (PrintStream o = new PrintStream(out, true, "UTF-8");
                PrintStream e = new PrintStream(err, true, "UTF-8")) {
            return Main.run(args, o, e);
        }
    }

    private String out() throws Exception {
        return out.toString("UTF-8");
    }

    private String err() throws Exception {
        return err.toString("UTF-8");
    }

    private Path write(String name, String content) throws Exception {
        File file = dir.resolve(name).toFile();
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file.toPath();
    }

    private Path database(String name, String... defines) throws Exception {
        JsonObject entry = new JsonObject();
        entry.addProperty("directory", dir.toString());
        entry.addProperty("file", "foo.cpp");
        JsonArray args = new JsonArray();
        args.add(new JsonPrimitive("c++"));
        for (String define : defines)
            args.add(new JsonPrimitive("-D" + define));
        args.add(new JsonPrimitive("foo.cpp"));
        entry.add("arguments", args);
        JsonArray array = new JsonArray();
        array.add(entry);
        return write("build/" + name, array.toString());
    }

    private void source() throws Exception {
        write("src/foo.cpp", "int other;\n");
        write("foo.cpp", "#ifdef MACRO\nvoid guarded();\n#endif\nunguarded();\n");
    }

    @Test
    public void testHelp() throws Exception {
        assertEquals(Main.EXIT_OK, run("--help"));
        assertTrue(out().contains("compute"), out());
    }

    @Test
    public void testUsage() throws Exception {
        assertEquals(Main.EXIT_USAGE, run());
        assertEquals(Main.EXIT_USAGE, run("frobnicate"));
        assertEquals(Main.EXIT_USAGE, run("--no-such-option", "compute", "db.json"));
        assertEquals(Main.EXIT_USAGE, run("compute"));
        assertEquals(Main.EXIT_USAGE, run("compute", "a.json", "b.json"));
        assertEquals(Main.EXIT_USAGE, run("report"));
        assertEquals(Main.EXIT_USAGE, run("report", "-p", "missing-equals.json"));
        assertEquals(Main.EXIT_USAGE, run("--threads", "0", "compute", "db.json"));
        assertEquals(Main.EXIT_USAGE, run("--threads", "many", "compute", "db.json"));
        assertEquals(Main.EXIT_USAGE, run("--format", "xml", "report", "-p", "a=a.json"));
    }

    @Test
    public void testValidation() throws Exception {
        assertEquals(Main.EXIT_FAILURE, run("compute", "compile_commands.txt"));
        assertTrue(err().contains(".json"), err());
        assertEquals(Main.EXIT_FAILURE, run("compute", "bad\nname.json"));
        assertEquals(Main.EXIT_FAILURE, run("compute", "-o", "out.csv", "db.json"));
        assertEquals(Main.EXIT_FAILURE, run("report", "-p", "a=line\rbreak.json"));
    }

    @Test
    public void testMissingDatabase() throws Exception {
        assertEquals(Main.EXIT_FAILURE, run("compute", dir.resolve("absent.json").toString()));
    }

    @Test
    public void testCompute() throws Exception {
        source();
        Path db = database("compile_commands.json");
        assertEquals(Main.EXIT_OK, run("compute", "-S", dir.toString(), db.toString()), err());
        JsonArray json = JsonParser.parseString(out()).getAsJsonArray();
        assertEquals(2, json.size());
        JsonObject foo = json.get(0).getAsJsonObject();
        assertEquals("foo.cpp", foo.get("file").getAsString());
        assertEquals(1, foo.getAsJsonArray("lines").size());
        assertEquals(4, foo.getAsJsonArray("lines").get(0).getAsInt());
        JsonObject empty = json.get(1).getAsJsonObject();
        assertEquals("src/foo.cpp", empty.get("file").getAsString());
        assertEquals(0, empty.getAsJsonArray("lines").size());
    }

    @Test
    public void testComputeToFile() throws Exception {
        source();
        Path db = database("compile_commands.json", "MACRO");
        File output = dir.resolve("coverage.json").toFile();
        assertEquals(Main.EXIT_OK, run("compute", "-S", dir.toString(), "-o", output.getPath(), db.toString()), err());
        assertEquals("", out());
        JsonArray json = JsonParser.parseString(FileUtils.readFileToString(output, StandardCharsets.UTF_8)).getAsJsonArray();
        assertEquals(2, json.get(0).getAsJsonObject().getAsJsonArray("lines").size());
    }

    @Test
    public void testReportJson() throws Exception {
        source();
        Path with = database("with.json", "MACRO");
        Path without = database("without.json");
        assertEquals(Main.EXIT_OK, run("report", "-S", dir.toString(), "--format", "json",
                "-x", "src/*",
                "-p", "with=" + with, "-p", "without=" + without), err());
        JsonObject json = JsonParser.parseString(out()).getAsJsonObject();
        assertEquals(2, json.get("total").getAsInt());
        assertEquals(2, json.getAsJsonObject("platforms").get("with").getAsInt());
        assertEquals(1, json.getAsJsonObject("platforms").get("without").getAsInt());
        assertEquals(0.5, json.get("divergence").getAsDouble(), 1e-9);
        assertEquals(2, json.getAsJsonArray("setmap").size());
    }

    @Test
    public void testReportText() throws Exception {
        source();
        Path with = database("with.json", "MACRO");
        assertEquals(Main.EXIT_OK, run("report", "-S", dir.toString(), "-p", "with=" + with), err());
        assertTrue(out().contains("{with}"), out());
        assertTrue(out().contains("Divergence: 0.0000"), out());
    }
}
