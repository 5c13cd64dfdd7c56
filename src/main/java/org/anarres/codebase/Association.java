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
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.pcollections.HashTreePSet;
import org.pcollections.PSet;

/**
 * The platforms that compile each line of each file.
 *
 * A line stored with the empty set is present in a file but reached by
 * no platform. A line not stored at all is not a source line of code.
 */
public class Association {

    private final SortedMap<Path, SortedMap<Integer, PSet<String>>> files = new TreeMap<Path, SortedMap<Integer, PSet<String>>>();

    @Nonnull
    private SortedMap<Integer, PSet<String>> lines(@Nonnull Path file) {
        SortedMap<Integer, PSet<String>> lines = files.get(file);
        if (lines == null) {
            lines = new TreeMap<Integer, PSet<String>>();
            files.put(file, lines);
        }
        return lines;
    }

    /** Records that the platform reaches the given line. */
    public void add(@Nonnull Path file, int line, @Nonnull String platform) {
        SortedMap<Integer, PSet<String>> lines = lines(file);
        PSet<String> platforms = lines.get(line);
        if (platforms == null)
            platforms = HashTreePSet.empty();
        lines.put(line, platforms.plus(platform));
    }

    public void addAll(@Nonnull Path file, @Nonnull Collection<Integer> lines, @Nonnull String platform) {
        for (Integer line : lines)
            add(file, line, platform);
    }

    /** Records a line as present, without adding any platform to it. */
    /* pp */ void addStructural(@Nonnull Path file, int line) {
        SortedMap<Integer, PSet<String>> lines = lines(file);
        if (!lines.containsKey(line))
            lines.put(line, HashTreePSet.<String>empty());
    }

    /** Returns the platforms reaching a line, or null if the line was never recorded. */
    @CheckForNull
    public PSet<String> get(@Nonnull Path file, int line) {
        SortedMap<Integer, PSet<String>> lines = files.get(file);
        if (lines == null)
            return null;
        return lines.get(line);
    }

    @Nonnull
    public Set<Path> getFiles() {
        return Collections.unmodifiableSet(files.keySet());
    }

    @Nonnull
    public SortedMap<Integer, PSet<String>> getLines(@Nonnull Path file) {
        SortedMap<Integer, PSet<String>> lines = files.get(file);
        if (lines == null)
            return Collections.emptySortedMap();
        return Collections.unmodifiableSortedMap(lines);
    }

    /** Returns the total number of recorded lines. */
    @Nonnegative
    public int size() {
        int size = 0;
        for (Map<Integer, PSet<String>> lines : files.values())
            size += lines.size();
        return size;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Association))
            return false;
        return files.equals(((Association) obj).files);
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return "Association(" + files + ")";
    }
}
