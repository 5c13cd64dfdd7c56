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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

import com.google.common.hash.Hashing;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import org.apache.commons.io.FileUtils;
import org.pcollections.PSet;

/**
 * Computes the lines of each file compiled by at least one platform, for
 * export to coverage tools.
 */
public class Coverage {

    private Coverage() {
    }

    /**
     * Returns one record per member file of the association, sorted by
     * relative path.
     *
     * @throws IOException if a file cannot be read for hashing.
     */
    @Nonnull
    public static List<FileCoverage> compute(@Nonnull Codebase codebase, @Nonnull Association association) throws IOException {
        List<FileCoverage> out = new ArrayList<FileCoverage>();
        for (Path file : association.getFiles()) {
            if (!codebase.isMember(file))
                continue;
            List<Integer> lines = new ArrayList<Integer>();
            for (Map.Entry<Integer, PSet<String>> e : association.getLines(file).entrySet())
                if (!e.getValue().isEmpty())
                    lines.add(e.getKey());
            out.add(new FileCoverage(codebase.relativize(file), hash(file), lines));
        }
        Collections.sort(out, new Comparator<FileCoverage>() {
            @Override
            public int compare(FileCoverage a, FileCoverage b) {
                return a.getFile().compareTo(b.getFile());
            }
        });
        return out;
    }

    @Nonnull
    public static String hash(@Nonnull Path file) throws IOException {
        byte[] content = FileUtils.readFileToByteArray(file.toFile());
        return Hashing.sha512().hashBytes(content).toString();
    }

    @Nonnull
    public static JsonArray toJsonTree(@Nonnull List<FileCoverage> coverage) {
        JsonArray out = new JsonArray();
        for (FileCoverage file : coverage)
            out.add(file.toJson());
        return out;
    }

    @Nonnull
    public static String toJson(@Nonnull List<FileCoverage> coverage) {
        return new GsonBuilder().setPrettyPrinting().create().toJson(toJsonTree(coverage));
    }
}
