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

import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces an {@link Association} to a {@link SetMap} over the member
 * files of a {@link Codebase}.
 */
public class PlatformMapper {

    private static final Logger LOG = LoggerFactory.getLogger(PlatformMapper.class);

    private final Codebase codebase;

    public PlatformMapper(@Nonnull Codebase codebase) {
        this.codebase = codebase;
    }

    @Nonnull
    public SetMap walk(@Nonnull Association association) {
        SetMap setmap = new SetMap();
        for (Path file : association.getFiles()) {
            if (!codebase.isMember(file)) {
                LOG.debug("Not counting {}: not in {}", file, codebase.getRootDir());
                continue;
            }
            for (PSet<String> platforms : association.getLines(file).values())
                setmap.increment(platforms);
        }
        return setmap;
    }
}
