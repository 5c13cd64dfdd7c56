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
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds each file's {@link SourceTree} once and shares it between walks.
 *
 * Files are keyed by their absolute, normalized path. A file that fails to
 * parse is remembered as failing, and is not read again.
 */
public class TreeCache {

    private static final Logger LOG = LoggerFactory.getLogger(TreeCache.class);

    private static class Entry {

        final SourceTree tree;
        final Exception failure;

        Entry(SourceTree tree, Exception failure) {
            this.tree = tree;
            this.failure = failure;
        }
    }

    private final FileParser parser;
    private final ConcurrentMap<Path, Entry> entries = new ConcurrentHashMap<Path, Entry>();

    public TreeCache(@Nonnull FileParser parser) {
        this.parser = parser;
    }

    @Nonnull
    public FileParser getParser() {
        return parser;
    }

    /** Returns the identity under which a file is cached, walked and reported. */
    @Nonnull
    public static Path key(@Nonnull Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * Returns the tree of a file, parsing it on first access.
     *
     * Concurrent first accesses to one file parse it once.
     */
    @Nonnull
    public SourceTree get(@Nonnull Path path) throws IOException, UnsupportedFileTypeException {
        Path key = key(path);
        Entry entry = entries.get(key);
        if (entry == null)
            entry = entries.computeIfAbsent(key, this::build);
        if (entry.failure instanceof UnsupportedFileTypeException)
            throw (UnsupportedFileTypeException) entry.failure;
        if (entry.failure instanceof IOException)
            throw (IOException) entry.failure;
        return entry.tree;
    }

    @Nonnull
    private Entry build(@Nonnull Path key) {
        try {
            return new Entry(parser.parse(key), null);
        } catch (IOException e) {
            LOG.debug("Failed to read {}: {}", key, e.getMessage());
            return new Entry(null, e);
        } catch (UnsupportedFileTypeException e) {
            LOG.debug("{}", e.getMessage());
            return new Entry(null, e);
        }
    }

    public boolean contains(@Nonnull Path path) {
        return entries.containsKey(key(path));
    }

    /** Returns the number of files parsed or attempted. */
    @Nonnegative
    public int size() {
        return entries.size();
    }
}
