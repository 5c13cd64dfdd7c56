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
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a compile_commands.json into {@link PlatformConfig}s.
 *
 * Only -D, -I, -isystem, -iquote and -include are interpreted; every other
 * compiler argument is ignored. Relative paths are resolved against the
 * entry's "directory". An entry compiled by a compiler of the
 * {@link CompilerTable} gets that compiler's implicit arguments, and
 * yields one configuration per compiler pass.
 */
public class CompilationDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationDatabase.class);

    private CompilationDatabase() {
    }

    @Nonnull
    public static List<PlatformConfig> load(@Nonnull Path path) throws IOException {
        return load(path, CompilerTable.getDefault());
    }

    @Nonnull
    public static List<PlatformConfig> load(@Nonnull Path path, @Nonnull CompilerTable compilers) throws IOException {
        String text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new IOException("Bad compilation database " + path + ": " + e.getMessage(), e);
        }
        if (!root.isJsonArray())
            throw new IOException("Bad compilation database " + path + ": not a JSON array");

        List<PlatformConfig> out = new ArrayList<PlatformConfig>();
        int index = 0;
        for (JsonElement element : root.getAsJsonArray()) {
            index++;
            if (!element.isJsonObject()) {
                LOG.warn("{}: entry {} is not an object", path, index);
                continue;
            }
            List<PlatformConfig> configs = parseEntry(element.getAsJsonObject(), compilers);
            if (configs.isEmpty()) {
                LOG.warn("{}: entry {} has no \"file\"", path, index);
                continue;
            }
            out.addAll(configs);
        }
        LOG.debug("Loaded {} entries from {}", out.size(), path);
        return out;
    }

    @CheckForNull
    private static String getString(@Nonnull JsonObject object, @Nonnull String name) {
        JsonElement element = object.get(name);
        if (element == null || !element.isJsonPrimitive())
            return null;
        return element.getAsString();
    }

    /** Returns the configurations of one entry, or an empty list if it names no file. */
    @Nonnull
    /* pp */ static List<PlatformConfig> parseEntry(@Nonnull JsonObject entry, @Nonnull CompilerTable compilers) {
        String file = getString(entry, "file");
        if (file == null)
            return Collections.emptyList();
        String directory = getString(entry, "directory");
        Path dir = Paths.get(directory == null ? "" : directory).toAbsolutePath();

        List<String> args;
        JsonElement arguments = entry.get("arguments");
        if (arguments != null && arguments.isJsonArray()) {
            args = new ArrayList<String>();
            for (JsonElement arg : (JsonArray) arguments)
                args.add(arg.getAsString());
        } else {
            String command = getString(entry, "command");
            args = command == null ? new ArrayList<String>() : split(command);
        }

        CompilerTable.Compiler compiler = args.isEmpty() ? null : compilers.getCompiler(args.get(0));
        if (compiler == null)
            return Collections.singletonList(configure(dir, file, args));
        List<PlatformConfig> out = new ArrayList<PlatformConfig>();
        for (List<String> implicit : compiler.getPassArguments(args)) {
            List<String> all = new ArrayList<String>(implicit);
            all.addAll(args);
            out.add(configure(dir, file, all));
        }
        LOG.debug("{} compiles {} in {} passes", compiler.getName(), file, out.size());
        return out;
    }

    @Nonnull
    private static PlatformConfig configure(@Nonnull Path dir, @Nonnull String file, @Nonnull List<String> args) {
        PlatformConfig config = new PlatformConfig(TreeCache.key(dir.resolve(file)));
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            String next = i + 1 < args.size() ? args.get(i + 1) : null;
            if (arg.equals("-D") || arg.equals("-I") || arg.equals("-isystem")
                    || arg.equals("-iquote") || arg.equals("-include")) {
                if (next == null) {
                    LOG.warn("Missing argument to {} compiling {}", arg, file);
                    break;
                }
                i++;
                option(config, dir, arg, next);
            } else if (arg.startsWith("-D")) {
                option(config, dir, "-D", arg.substring(2));
            } else if (arg.startsWith("-I")) {
                option(config, dir, "-I", arg.substring(2));
            } else if (arg.startsWith("-isystem")) {
                option(config, dir, "-I", arg.substring(8));
            } else if (arg.startsWith("-iquote")) {
                option(config, dir, "-I", arg.substring(7));
            }
        }
        return config;
    }

    private static void option(@Nonnull PlatformConfig config, @Nonnull Path dir,
            @Nonnull String option, @Nonnull String value) {
        if (option.equals("-D"))
            config.addDefine(value);
        else if (option.equals("-include"))
            config.addIncludeFile(dir.resolve(value).normalize());
        else
            config.addIncludePath(dir.resolve(value).normalize());
    }

    /**
     * Splits a shell command line into arguments.
     *
     * Single and double quotes group, and a backslash escapes the next
     * character outside single quotes.
     */
    @Nonnull
    /* pp */ static List<String> split(@Nonnull String command) {
        List<String> out = new ArrayList<String>();
        StringBuilder buf = new StringBuilder();
        boolean inArg = false;
        char quote = 0;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (quote == '\'') {
                if (c == '\'')
                    quote = 0;
                else
                    buf.append(c);
            } else if (c == '\\' && i + 1 < command.length()) {
                buf.append(command.charAt(++i));
                inArg = true;
            } else if (quote == '"') {
                if (c == '"')
                    quote = 0;
                else
                    buf.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                inArg = true;
            } else if (Character.isWhitespace(c)) {
                if (inArg) {
                    out.add(buf.toString());
                    buf.setLength(0);
                    inArg = false;
                }
            } else {
                buf.append(c);
                inArg = true;
            }
        }
        if (inArg)
            out.add(buf.toString());
        return out;
    }
}
