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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The directive keywords the lexer recognizes after a '#'.
 */
public enum PreprocessorCommand {

    PP_IF("if"),
    PP_IFDEF("ifdef"),
    PP_IFNDEF("ifndef"),
    PP_ELIF("elif"),
    PP_ELSE("else"),
    PP_ENDIF("endif"),
    PP_DEFINE("define"),
    PP_UNDEF("undef"),
    PP_INCLUDE("include"),
    PP_PRAGMA("pragma"),
    PP_ERROR("error"),
    PP_WARNING("warning"),
    PP_LINE("line");

    private static final Map<String, PreprocessorCommand> map;

    static {
        map = new HashMap<String, PreprocessorCommand>();
        for (PreprocessorCommand cmd : PreprocessorCommand.values())
            map.put(cmd.text, cmd);
    }

    private final String text;

    PreprocessorCommand(@Nonnull String text) {
        this.text = text;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    @CheckForNull
    public static PreprocessorCommand forText(@Nonnull String text) {
        return map.get(text);
    }
}
