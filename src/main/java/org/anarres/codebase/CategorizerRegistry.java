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
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps file extensions to {@link LineCategorizer}s.
 *
 * Extensions are matched case-insensitively. A registry is populated once,
 * before it is handed to a {@link FileParser}, and only read afterwards.
 */
public class CategorizerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(CategorizerRegistry.class);

    private final Map<String, LineCategorizer> categorizers = new TreeMap<String, LineCategorizer>();

    /** Returns a registry with the C family and both Fortran source forms. */
    @Nonnull
    public static CategorizerRegistry createDefault() {
        CategorizerRegistry registry = new CategorizerRegistry();
        registry.register(new CFamilyCategorizer());
        registry.register(new FortranCategorizer(true));
        registry.register(new FortranCategorizer(false));
        return registry;
    }

    /** Registers a categorizer for all of its extensions, replacing any earlier one. */
    public void register(@Nonnull LineCategorizer categorizer) {
        for (String extension : categorizer.getExtensions()) {
            LineCategorizer prev = categorizers.put(extension.toLowerCase(Locale.ROOT), categorizer);
            if (prev != null && prev != categorizer)
                LOG.debug("Extension {} moved from {} to {}", extension, prev, categorizer);
        }
    }

    @CheckForNull
    public LineCategorizer getCategorizer(@Nonnull Path path) {
        Path name = path.getFileName();
        if (name == null)
            return null;
        String extension = FilenameUtils.getExtension(name.toString());
        return categorizers.get(extension.toLowerCase(Locale.ROOT));
    }

    public boolean isSupported(@Nonnull Path path) {
        return getCategorizer(path) != null;
    }

    @Nonnull
    public Map<String, LineCategorizer> getCategorizers() {
        return Collections.unmodifiableMap(categorizers);
    }
}
