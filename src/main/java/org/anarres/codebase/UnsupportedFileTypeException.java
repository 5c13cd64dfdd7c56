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
import javax.annotation.Nonnull;

/**
 * Thrown when no {@link LineCategorizer} is registered for a file's extension.
 */
public class UnsupportedFileTypeException extends Exception {

    private final Path path;

    public UnsupportedFileTypeException(@Nonnull Path path) {
        super("No line categorizer for " + path);
        this.path = path;
    }

    @Nonnull
    public Path getPath() {
        return path;
    }
}
