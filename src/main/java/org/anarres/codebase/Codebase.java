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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The files an analysis reports on.
 *
 * A file is a member if it lies under the root directory and is neither
 * excluded by name nor matched by an exclude pattern. Exclude patterns
 * are wildcards over the path relative to the root, with '/' separators.
 */
public class Codebase {

    private static final Logger LOG = LoggerFactory.getLogger(Codebase.class);

    private final Path rootDir;
    private final Set<Path> files;
    private final Set<Path> excludeFiles = new TreeSet<Path>();
    private final List<String> excludePatterns = new ArrayList<String>();

    /**
     * @param rootDir the root of the codebase.
     * @param files the files of the codebase, or null to use every file under the root.
     */
    public Codebase(@Nonnull Path rootDir, @CheckForNull Collection<Path> files) {
        this.rootDir = TreeCache.key(rootDir);
        if (files == null) {
            this.files = null;
        } else {
            this.files = new TreeSet<Path>();
            for (Path file : files)
                this.files.add(TreeCache.key(file));
        }
    }

    public Codebase(@Nonnull Path rootDir) {
        this(rootDir, null);
    }

    @Nonnull
    public Path getRootDir() {
        return rootDir;
    }

    @Nonnull
    public Codebase addExcludeFile(@Nonnull Path file) {
        excludeFiles.add(TreeCache.key(file));
        return this;
    }

    @Nonnull
    public Codebase addExcludePattern(@Nonnull String pattern) {
        excludePatterns.add(pattern);
        return this;
    }

    @Nonnull
    public Set<Path> getExcludeFiles() {
        return Collections.unmodifiableSet(excludeFiles);
    }

    @Nonnull
    public List<String> getExcludePatterns() {
        return Collections.unmodifiableList(excludePatterns);
    }

    /**
     * Returns the member files, sorted.
     *
     * Without an explicit file list, this lists the root directory.
     */
    @Nonnull
    public SortedSet<Path> getFiles() {
        SortedSet<Path> out = new TreeSet<Path>();
        if (files != null) {
            for (Path file : files)
                if (isMember(file))
                    out.add(file);
        } else if (rootDir.toFile().isDirectory()) {
            for (File file : FileUtils.listFiles(rootDir.toFile(), null, true)) {
                Path path = TreeCache.key(file.toPath());
                if (isMember(path))
                    out.add(path);
            }
        } else {
            LOG.warn("Codebase root {} is not a directory", rootDir);
        }
        return out;
    }

    /** Returns the path of a file relative to the root, with '/' separators. */
    @Nonnull
    public String relativize(@Nonnull Path file) {
        Path relative = rootDir.relativize(TreeCache.key(file));
        return FilenameUtils.separatorsToUnix(relative.toString());
    }

    public boolean isMember(@Nonnull Path file) {
        Path path = TreeCache.key(file);
        if (!path.startsWith(rootDir))
            return false;
        if (excludeFiles.contains(path))
            return false;
        String relative = relativize(path);
        for (String pattern : excludePatterns)
            if (FilenameUtils.wildcardMatch(relative, pattern))
                return false;
        return true;
    }

    @Override
    public String toString() {
        return "Codebase(" + rootDir + ", files=" + (files == null ? "*" : files.size())
                + ", excludeFiles=" + excludeFiles + ", excludePatterns=" + excludePatterns + ")";
    }
}
