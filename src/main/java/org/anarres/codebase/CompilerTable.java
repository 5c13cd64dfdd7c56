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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.io.Resources;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes how known compilers turn a command line into configurations.
 *
 * A compiler is identified by the file name of its executable. It may
 * add implicit arguments, and it may recognize options that select
 * modes and passes. The defines of every selected mode apply to every
 * pass; each pass is analyzed as a configuration of its own, so a
 * translation unit built for several device architectures is analyzed
 * once per architecture.
 *
 * The table is JSON:
 * <pre>
 * { "nvcc": {
 *     "options": [ "-D__NVCC__" ],
 *     "parser": [ { "flags": [ "-fopenmp" ], "action": "append_const", "dest": "modes", "const": "openmp" } ],
 *     "modes": [ { "name": "openmp", "defines": [ "_OPENMP" ] } ],
 *     "passes": [ { "name": "sm_70", "defines": [ "__CUDA_ARCH__=700" ] } ] } }
 * </pre>
 */
public class CompilerTable {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerTable.class);

    /** The name of the bundled table, relative to this class. */
    public static final String RESOURCE = "compilers.json";

    private static class DefaultHolder {

        private static final CompilerTable INSTANCE;

        static {
            try {
                String text = Resources.toString(Resources.getResource(CompilerTable.class, RESOURCE), StandardCharsets.UTF_8);
                INSTANCE = parse(text);
            } catch (IOException e) {
                throw new IllegalStateException("Cannot load bundled " + RESOURCE, e);
            }
        }
    }

    public enum Action {

        /** The flag adds a constant value. */
        APPEND_CONST,
        /** The flag takes a value, and every match of a pattern in it adds a formatted value. */
        EXTEND_MATCH
    }

    public enum Destination {

        MODES,
        PASSES
    }

    /* pp */ static class Rule {

        private final List<String> flags;
        private final Action action;
        private final Destination dest;
        private final String constant;
        private final Pattern pattern;
        private final String format;
        private final List<String> defaults;
        private final boolean override;

        Rule(@Nonnull List<String> flags, @Nonnull Action action, @Nonnull Destination dest,
                @CheckForNull String constant, @CheckForNull Pattern pattern, @CheckForNull String format,
                @Nonnull List<String> defaults, boolean override) {
            this.flags = flags;
            this.action = action;
            this.dest = dest;
            this.constant = constant;
            this.pattern = pattern;
            this.format = format;
            this.defaults = defaults;
            this.override = override;
        }

        /**
         * Applies this rule to the argument at the given index.
         *
         * @return the number of arguments consumed, or 0 if the argument is not one of our flags.
         */
        private int apply(@Nonnull List<String> args, int index, @Nonnull Set<String> values) {
            String arg = args.get(index);
            for (String flag : flags) {
                if (action == Action.APPEND_CONST) {
                    if (arg.equals(flag)) {
                        values.add(constant);
                        return 1;
                    }
                    continue;
                }
                if (arg.equals(flag)) {
                    if (index + 1 >= args.size()) {
                        LOG.warn("Missing argument to {}", flag);
                        return 1;
                    }
                    match(args.get(index + 1), values);
                    return 2;
                }
                if (arg.startsWith(flag + "=")) {
                    match(arg.substring(flag.length() + 1), values);
                    return 1;
                }
            }
            return 0;
        }

        private void match(@Nonnull String value, @Nonnull Set<String> values) {
            Matcher m = pattern.matcher(value);
            while (m.find())
                values.add(format.replace("$value", m.groupCount() > 0 ? m.group(1) : m.group()));
        }
    }

    /** One compiler of the table. */
    public static class Compiler {

        private final String name;
        private final List<String> options;
        private final List<Rule> rules;
        private final Map<String, List<String>> modes;
        private final Map<String, List<String>> passes;

        /* pp */ Compiler(@Nonnull String name, @Nonnull List<String> options, @Nonnull List<Rule> rules,
                @Nonnull Map<String, List<String>> modes, @Nonnull Map<String, List<String>> passes) {
            this.name = name;
            this.options = options;
            this.rules = rules;
            this.modes = modes;
            this.passes = passes;
        }

        @Nonnull
        public String getName() {
            return name;
        }

        /** Returns the arguments this compiler adds to every command line. */
        @Nonnull
        public List<String> getOptions() {
            return options;
        }

        /**
         * Returns the arguments to prepend to a command line, one list per
         * compiler pass.
         *
         * Each list holds the implicit options, then the defines of the
         * selected modes, then the defines of its pass. A command line
         * that selects no pass yields one list.
         */
        @Nonnull
        public List<List<String>> getPassArguments(@Nonnull List<String> args) {
            Map<Rule, Set<String>> found = new LinkedHashMap<Rule, Set<String>>();
            for (Rule rule : rules)
                found.put(rule, new LinkedHashSet<String>());
            for (int i = 0; i < args.size();) {
                int consumed = 0;
                for (Rule rule : rules) {
                    consumed = rule.apply(args, i, found.get(rule));
                    if (consumed > 0)
                        break;
                }
                i += Math.max(consumed, 1);
            }

            Set<String> selectedModes = new LinkedHashSet<String>();
            Set<String> selectedPasses = new LinkedHashSet<String>();
            for (Map.Entry<Rule, Set<String>> e : found.entrySet()) {
                Rule rule = e.getKey();
                Set<String> target = rule.dest == Destination.MODES ? selectedModes : selectedPasses;
                if (e.getValue().isEmpty() || !rule.override)
                    target.addAll(rule.defaults);
                target.addAll(e.getValue());
            }

            List<String> common = new ArrayList<String>(options);
            for (String mode : selectedModes) {
                List<String> defines = modes.get(mode);
                if (defines == null) {
                    LOG.warn("{}: unknown mode {}", name, mode);
                    continue;
                }
                for (String define : defines)
                    common.add("-D" + define);
            }

            List<List<String>> out = new ArrayList<List<String>>();
            for (String pass : selectedPasses) {
                List<String> defines = passes.get(pass);
                if (defines == null) {
                    LOG.warn("{}: unknown pass {}, ignored", name, pass);
                    continue;
                }
                List<String> arguments = new ArrayList<String>(common);
                for (String define : defines)
                    arguments.add("-D" + define);
                out.add(arguments);
            }
            if (out.isEmpty())
                out.add(common);
            return out;
        }

        @Override
        public String toString() {
            return name + "(modes=" + modes.keySet() + ", passes=" + passes.keySet() + ")";
        }
    }

    private final Map<String, Compiler> compilers;

    private CompilerTable(@Nonnull Map<String, Compiler> compilers) {
        this.compilers = compilers;
    }

    /** Returns the table bundled with this library. */
    @Nonnull
    public static CompilerTable getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /** Returns a table that knows no compilers. */
    @Nonnull
    public static CompilerTable empty() {
        return new CompilerTable(Collections.<String, Compiler>emptyMap());
    }

    /**
     * Returns the compiler run by the given executable, or null.
     *
     * @param executable the first word of a command line, with or without a directory.
     */
    @CheckForNull
    public Compiler getCompiler(@Nonnull String executable) {
        String name = FilenameUtils.getName(executable);
        if (name.endsWith(".exe"))
            name = name.substring(0, name.length() - 4);
        return compilers.get(name);
    }

    @Nonnull
    public static CompilerTable parse(@Nonnull String text) throws IOException {
        JsonElement root;
        try {
            root = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw new IOException("Bad compiler table: " + e.getMessage(), e);
        }
        if (!root.isJsonObject())
            throw new IOException("Bad compiler table: not a JSON object");
        Map<String, Compiler> compilers = new LinkedHashMap<String, Compiler>();
        for (Map.Entry<String, JsonElement> e : root.getAsJsonObject().entrySet())
            compilers.put(e.getKey(), compiler(e.getKey(), object(e.getValue(), e.getKey())));
        LOG.debug("Loaded compilers {}", compilers.values());
        return new CompilerTable(Collections.unmodifiableMap(compilers));
    }

    @Nonnull
    private static Compiler compiler(@Nonnull String name, @Nonnull JsonObject object) throws IOException {
        List<Rule> rules = new ArrayList<Rule>();
        for (JsonElement element : array(object, "parser", name))
            rules.add(rule(object(element, name + " parser")));
        return new Compiler(name, strings(object, "options", name), Collections.unmodifiableList(rules),
                definitions(object, "modes", name), definitions(object, "passes", name));
    }

    @Nonnull
    private static Rule rule(@Nonnull JsonObject object) throws IOException {
        List<String> flags = strings(object, "flags", "parser");
        if (flags.isEmpty())
            throw new IOException("Bad compiler table: parser rule without flags");
        Action action = enumValue(Action.class, string(object, "action", "parser"));
        Destination dest = enumValue(Destination.class, string(object, "dest", "parser"));
        List<String> defaults = strings(object, "default", "parser");
        boolean override = object.has("override") && bool(object.get("override"));
        if (action == Action.APPEND_CONST)
            return new Rule(flags, action, dest, string(object, "const", "parser"), null, null, defaults, override);
        Pattern pattern;
        try {
            pattern = Pattern.compile(string(object, "pattern", "parser"));
        } catch (PatternSyntaxException e) {
            throw new IOException("Bad compiler table: " + e.getMessage(), e);
        }
        String format = object.has("format") ? string(object, "format", "parser") : "$value";
        return new Rule(flags, action, dest, null, pattern, format, defaults, override);
    }

    @Nonnull
    private static Map<String, List<String>> definitions(@Nonnull JsonObject object, @Nonnull String name,
            @Nonnull String context) throws IOException {
        Map<String, List<String>> out = new LinkedHashMap<String, List<String>>();
        for (JsonElement element : array(object, name, context)) {
            JsonObject definition = object(element, context + " " + name);
            out.put(string(definition, "name", context + " " + name), strings(definition, "defines", context + " " + name));
        }
        return Collections.unmodifiableMap(out);
    }

    @Nonnull
    private static <E extends Enum<E>> E enumValue(@Nonnull Class<E> type, @Nonnull String value) throws IOException {
        try {
            return Enum.valueOf(type, value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IOException("Bad compiler table: unknown " + type.getSimpleName().toLowerCase() + " " + value, e);
        }
    }

    @Nonnull
    private static JsonObject object(@Nonnull JsonElement element, @Nonnull String context) throws IOException {
        if (!element.isJsonObject())
            throw new IOException("Bad compiler table: " + context + " is not an object");
        return element.getAsJsonObject();
    }

    @Nonnull
    private static JsonArray array(@Nonnull JsonObject object, @Nonnull String name, @Nonnull String context)
            throws IOException {
        JsonElement element = object.get(name);
        if (element == null)
            return new JsonArray();
        if (!element.isJsonArray())
            throw new IOException("Bad compiler table: " + context + "." + name + " is not an array");
        return element.getAsJsonArray();
    }

    @Nonnull
    private static String string(@Nonnull JsonObject object, @Nonnull String name, @Nonnull String context)
            throws IOException {
        JsonElement element = object.get(name);
        if (element == null || !element.isJsonPrimitive())
            throw new IOException("Bad compiler table: " + context + "." + name + " is not a string");
        return element.getAsString();
    }

    @Nonnull
    private static List<String> strings(@Nonnull JsonObject object, @Nonnull String name, @Nonnull String context)
            throws IOException {
        List<String> out = new ArrayList<String>();
        for (JsonElement element : array(object, name, context)) {
            if (!element.isJsonPrimitive())
                throw new IOException("Bad compiler table: " + context + "." + name + " holds a non-string");
            out.add(element.getAsString());
        }
        return Collections.unmodifiableList(out);
    }

    private static boolean bool(@Nonnull JsonElement element) throws IOException {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean())
            throw new IOException("Bad compiler table: override is not a boolean");
        return element.getAsBoolean();
    }
}
