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

import java.io.Reader;
import java.util.Collection;
import javax.annotation.Nonnull;

/**
 * Splits a source file into directive and code entries, and decides which
 * physical lines count as source lines of code.
 *
 * A categorizer is registered for a set of file extensions in a
 * {@link CategorizerRegistry}.
 */
public interface LineCategorizer {

    /** Returns the lower-case extensions, without the dot, this categorizer handles. */
    @Nonnull
    public Collection<String> getExtensions();

    @Nonnull
    public LogicalLineReader open(@Nonnull Reader reader);
}
