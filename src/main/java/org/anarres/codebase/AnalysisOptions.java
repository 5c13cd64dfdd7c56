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

import javax.annotation.Nonnegative;

/**
 * Tunables of an analysis run.
 */
public class AnalysisOptions {

    public static final int DEFAULT_MAX_INCLUDE_DEPTH = 200;
    public static final int DEFAULT_MAX_EXPANSION_DEPTH = 64;

    private int maxIncludeDepth = DEFAULT_MAX_INCLUDE_DEPTH;
    private int maxExpansionDepth = DEFAULT_MAX_EXPANSION_DEPTH;
    private int threads = Runtime.getRuntime().availableProcessors();
    private boolean debug;

    @Nonnegative
    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    /** Sets how deeply includes may nest before descent stops. */
    public void setMaxIncludeDepth(@Nonnegative int maxIncludeDepth) {
        if (maxIncludeDepth < 1)
            throw new IllegalArgumentException("Include depth must be positive: " + maxIncludeDepth);
        this.maxIncludeDepth = maxIncludeDepth;
    }

    @Nonnegative
    public int getMaxExpansionDepth() {
        return maxExpansionDepth;
    }

    /** Sets how deeply macro expansions may nest before evaluation fails. */
    public void setMaxExpansionDepth(@Nonnegative int maxExpansionDepth) {
        if (maxExpansionDepth < 1)
            throw new IllegalArgumentException("Expansion depth must be positive: " + maxExpansionDepth);
        this.maxExpansionDepth = maxExpansionDepth;
    }

    @Nonnegative
    public int getThreads() {
        return threads;
    }

    public void setThreads(@Nonnegative int threads) {
        if (threads < 1)
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        this.threads = threads;
    }

    public boolean isDebug() {
        return debug;
    }

    /** Logs every walk and every resolved include. */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    @Override
    public String toString() {
        return "AnalysisOptions(maxIncludeDepth=" + maxIncludeDepth
                + ", maxExpansionDepth=" + maxExpansionDepth
                + ", threads=" + threads + ", debug=" + debug + ")";
    }
}
