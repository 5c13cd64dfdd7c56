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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/** The lines of one file compiled by at least one platform. */
public final class FileCoverage {

    private final String file;
    private final String id;
    private final List<Integer> lines;

    public FileCoverage(@Nonnull String file, @Nonnull String id, @Nonnull List<Integer> lines) {
        this.file = file;
        this.id = id;
        this.lines = Collections.unmodifiableList(new ArrayList<Integer>(lines));
    }

    /** Returns the path relative to the codebase root, with '/' separators. */
    @Nonnull
    public String getFile() {
        return file;
    }

    /** Returns the hex SHA-512 of the file's contents. */
    @Nonnull
    public String getId() {
        return id;
    }

    @Nonnull
    public List<Integer> getLines() {
        return lines;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject out = new JsonObject();
        out.addProperty("file", file);
        out.addProperty("id", id);
        JsonArray array = new JsonArray();
        for (Integer line : lines)
            array.add(new JsonPrimitive(line));
        out.add("lines", array);
        return out;
    }

    @Override
    public String toString() {
        return file + " " + lines;
    }
}
