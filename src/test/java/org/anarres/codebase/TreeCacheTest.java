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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class TreeCacheTest {

    /* Counts the files actually parsed. */
    private static class CountingParser extends FileParser {

        private final AtomicInteger count = new AtomicInteger();

        CountingParser() {
            super(CategorizerRegistry.createDefault());
        }

        @Override
        public SourceTree parse(@Nonnull Path path) throws IOException, UnsupportedFileTypeException {
            count.incrementAndGet();
            return super.parse(path);
        }
    }

    @TempDir
    public Path dir;

    private Path write(String name, String content) throws Exception {
        File file = dir.resolve(name).toFile();
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file.toPath();
    }

    @Test
    public void testHit() throws Exception {
        Path file = write("a.c", "#ifdef X\nint x;\n#endif\n");
        CountingParser parser = new CountingParser();
        TreeCache cache = new TreeCache(parser);
        SourceTree first = cache.get(file);
        /* A different spelling of the same file. */
        SourceTree second = cache.get(dir.resolve("sub/../a.c"));
        assertSame(first, second);
        assertEquals(1, parser.count.get());
        assertTrue(cache.contains(file));
        assertEquals(1, cache.size());
    }

    @Test
    public void testFailuresAreRemembered() throws Exception {
        CountingParser parser = new CountingParser();
        TreeCache cache = new TreeCache(parser);
        Path missing = dir.resolve("missing.c");
        assertThrows(IOException.class, () -> cache.get(missing));
        write("missing.c", "int now_present;\n");
        assertThrows(IOException.class, () -> cache.get(missing));
        assertEquals(1, parser.count.get());

        Path text = write("notes.txt", "text\n");
        assertThrows(UnsupportedFileTypeException.class, () -> cache.get(text));
        assertThrows(UnsupportedFileTypeException.class, () -> cache.get(text));
        assertEquals(2, parser.count.get());
    }

    @Test
    public void testConcurrentAccess() throws Exception {
        final List<Path> files = new ArrayList<Path>();
        for (int i = 0; i < 8; i++)
            files.add(write("f" + i + ".h", "int f" + i + ";\n"));
        CountingParser parser = new CountingParser();
        final TreeCache cache = new TreeCache(parser);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<SourceTree>>> futures = new ArrayList<Future<List<SourceTree>>>();
            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(new Callable<List<SourceTree>>() {
                    @Override
                    public List<SourceTree> call() throws Exception {
                        List<SourceTree> out = new ArrayList<SourceTree>();
                        for (Path file : files)
                            out.add(cache.get(file));
                        return out;
                    }
                }));
            }
            List<SourceTree> expected = futures.get(0).get();
            for (Future<List<SourceTree>> future : futures) {
                List<SourceTree> trees = future.get();
                for (int i = 0; i < trees.size(); i++)
                    assertSame(expected.get(i), trees.get(i));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(files.size(), parser.count.get());
        assertEquals(files.size(), cache.size());
    }
}
