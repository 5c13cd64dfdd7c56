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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * How one translation unit is compiled for one platform.
 *
 * Defines are written NAME or NAME=VALUE, as on a compiler command line.
 */
public class PlatformConfig {

    private final Path file;
    private final List<String> defines = new ArrayList<String>();
    private final List<Path> includePaths = new ArrayList<Path>();
    private final List<Path> includeFiles = new ArrayList<Path>();

    public PlatformConfig(@Nonnull Path file) {
        this.file = file;
    }

    /** Returns the entry file of the translation unit. */
    @Nonnull
    public Path getFile() {
        return file;
    }

    @Nonnull
    public PlatformConfig addDefine(@Nonnull String define) {
        defines.add(define);
        return this;
    }

    @Nonnull
    public PlatformConfig addIncludePath(@Nonnull Path path) {
        includePaths.add(path);
        return this;
    }

    /** Adds an explicit file which an #include naming it resolves to. */
    @Nonnull
    public PlatformConfig addIncludeFile(@Nonnull Path path) {
        includeFiles.add(path);
        return this;
    }

    @Nonnull
    public List<String> getDefines() {
        return Collections.unmodifiableList(defines);
    }

    @Nonnull
    public List<Path> getIncludePaths() {
        return Collections.unmodifiableList(includePaths);
    }

    @Nonnull
    public List<Path> getIncludeFiles() {
        return Collections.unmodifiableList(includeFiles);
    }

    @Override
    public String toString() {
        return "PlatformConfig(" + file + ", defines=" + defines
                + ", includePaths=" + includePaths + ", includeFiles=" + includeFiles + ")";
    }
}
