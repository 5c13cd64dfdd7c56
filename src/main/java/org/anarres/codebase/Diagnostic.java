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
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A problem found while parsing or walking a file.
 *
 * Diagnostics never stop processing; they are reported to a
 * {@link DiagnosticListener} and processing continues.
 */
public final class Diagnostic {

    public enum Kind {
        /** A directive line could not be tokenized. */
        LEX_ERROR,
        /** A directive did not match its grammar. */
        PARSE_ERROR,
        /** A directive was accepted but something on it was ignored. */
        PARSE_WARNING,
        /** An #elif, #else or #endif with no open conditional. */
        UNMATCHED_DIRECTIVE,
        /** A conditional still open at end of file. */
        MISSING_ENDIF,
        /** A condition could not be evaluated; its branch was not taken. */
        EVALUATION_ERROR,
        /** An include was not found on any search path. */
        UNRESOLVED_INCLUDE,
        /** An include would re-enter a file already being walked. */
        CIRCULAR_INCLUDE,
        /** Includes nested deeper than the configured limit. */
        INCLUDE_DEPTH_EXCEEDED,
        /** A file has no registered line categorizer. */
        UNSUPPORTED_FILE_TYPE,
        /** A file could not be read. */
        IO_ERROR,
        /** A configured macro definition could not be parsed. */
        BAD_DEFINE
    }

    private final Kind kind;
    private final Path path;
    private final int line;
    private final String message;
    private final String platform;

    public Diagnostic(@Nonnull Kind kind, @CheckForNull Path path, int line,
            @Nonnull String message, @CheckForNull String platform) {
        this.kind = kind;
        this.path = path;
        this.line = line;
        this.message = message;
        this.platform = platform;
    }

    public Diagnostic(@Nonnull Kind kind, @CheckForNull Path path, int line, @Nonnull String message) {
        this(kind, path, line, message, null);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @CheckForNull
    public Path getPath() {
        return path;
    }

    /** Returns the 1-based line, or 0 if the diagnostic is not tied to a line. */
    public int getLine() {
        return line;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    /** Returns the platform whose walk raised this, or null for parse-time diagnostics. */
    @CheckForNull
    public String getPlatform() {
        return platform;
    }

    /** Returns a copy of this diagnostic attributed to the given platform. */
    @Nonnull
    public Diagnostic forPlatform(@Nonnull String platform) {
        return new Diagnostic(kind, path, line, message, platform);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        if (path != null) {
            buf.append(path);
            if (line > 0)
                buf.append(':').append(line);
            buf.append(": ");
        }
        if (platform != null)
            buf.append('[').append(platform).append("] ");
        buf.append(kind.name().toLowerCase().replace('_', '-'));
        buf.append(": ").append(message);
        return buf.toString();
    }
}
