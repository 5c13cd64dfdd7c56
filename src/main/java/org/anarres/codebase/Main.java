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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver.
 *
 * <pre>
 * compute [-S dir] [-o coverage.json] compile_commands.json
 * report [-S dir] -p NAME=compile_commands.json ... [-x pattern] [--format text|json]
 * </pre>
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    /* The platform name under which compute walks its single database. */
    private static final String COVERAGE_PLATFORM = "coverage";

    /** Thrown when a path argument is unacceptable. */
    private static class ValidationException extends Exception {

        ValidationException(String msg) {
            super(msg);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILURE} if an argument is
     * invalid or the analysis fails, or {@link #EXIT_USAGE} if the command
     * line cannot be parsed.
     */
    public static int run(@Nonnull String[] args, @Nonnull PrintStream out, @Nonnull PrintStream err) {
        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.acceptsAll(Arrays.asList("help", "h"),
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");
        OptionSpec<File> sourceDirOption = parser.acceptsAll(Arrays.asList("source-dir", "S"),
                "Sets the root of the codebase.")
                .withRequiredArg().ofType(File.class).describedAs("dir");
        OptionSpec<String> outputOption = parser.acceptsAll(Arrays.asList("output", "o"),
                "Writes coverage to the given .json file instead of stdout.")
                .withRequiredArg().ofType(String.class).describedAs("file");
        OptionSpec<String> platformOption = parser.acceptsAll(Arrays.asList("platform", "p"),
                "Adds a platform compiled by the given compilation database.")
                .withRequiredArg().ofType(String.class).describedAs("name=compile_commands.json");
        OptionSpec<String> excludeOption = parser.acceptsAll(Arrays.asList("exclude", "x"),
                "Excludes files matching the given wildcard from the report.")
                .withRequiredArg().ofType(String.class).describedAs("pattern");
        OptionSpec<String> formatOption = parser.accepts("format",
                "Sets the report format, text or json.")
                .withRequiredArg().ofType(String.class).defaultsTo("text");
        OptionSpec<Integer> threadsOption = parser.accepts("threads",
                "Sets the number of platforms walked in parallel.")
                .withRequiredArg().ofType(Integer.class);
        OptionSpec<Integer> includeDepthOption = parser.accepts("max-include-depth",
                "Sets how deeply includes may nest.")
                .withRequiredArg().ofType(Integer.class).defaultsTo(AnalysisOptions.DEFAULT_MAX_INCLUDE_DEPTH);
        OptionSpec<Integer> expansionDepthOption = parser.accepts("max-expansion-depth",
                "Sets how deeply macro expansions may nest.")
                .withRequiredArg().ofType(Integer.class).defaultsTo(AnalysisOptions.DEFAULT_MAX_EXPANSION_DEPTH);
        OptionSpec<String> commandOption = parser.nonOptions()
                .ofType(String.class).describedAs("compute|report, then arguments");

        OptionSet options;
        AnalysisOptions analysis = new AnalysisOptions();
        try {
            options = parser.parse(args);
            if (options.has(helpOption)) {
                help(parser, out);
                return EXIT_OK;
            }
            if (options.has(threadsOption))
                analysis.setThreads(options.valueOf(threadsOption));
            analysis.setMaxIncludeDepth(options.valueOf(includeDepthOption));
            analysis.setMaxExpansionDepth(options.valueOf(expansionDepthOption));
            analysis.setDebug(options.has(debugOption));
        } catch (OptionException e) {
            err.println("error: " + e.getMessage());
            help(parser, err);
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<String> commands = options.valuesOf(commandOption);
        if (commands.isEmpty()) {
            err.println("error: no command given");
            help(parser, err);
            return EXIT_USAGE;
        }
        String command = commands.get(0);
        List<String> operands = commands.subList(1, commands.size());

        File sourceDir = options.valueOf(sourceDirOption);
        Path rootDir = sourceDir == null ? Paths.get("") : sourceDir.toPath();

        try {
            if ("compute".equals(command)) {
                if (operands.size() != 1 || options.has(platformOption)) {
                    err.println("error: compute takes exactly one compilation database");
                    return EXIT_USAGE;
                }
                String output = options.valueOf(outputOption);
                validate(operands.get(0), "compilation database");
                if (output != null)
                    validate(output, "output");
                return compute(rootDir, operands.get(0), output, analysis, out);
            } else if ("report".equals(command)) {
                if (!operands.isEmpty() || !options.has(platformOption)) {
                    err.println("error: report takes one or more -p NAME=compile_commands.json");
                    return EXIT_USAGE;
                }
                String format = options.valueOf(formatOption).toLowerCase(Locale.ROOT);
                if (!format.equals("text") && !format.equals("json")) {
                    err.println("error: unknown format " + format);
                    return EXIT_USAGE;
                }
                Map<String, String> databases = new LinkedHashMap<String, String>();
                for (String platform : options.valuesOf(platformOption)) {
                    int idx = platform.indexOf('=');
                    if (idx <= 0) {
                        err.println("error: expected NAME=compile_commands.json, not " + platform);
                        return EXIT_USAGE;
                    }
                    String path = platform.substring(idx + 1);
                    validate(path, "compilation database");
                    databases.put(platform.substring(0, idx), path);
                }
                return report(rootDir, databases, options.valuesOf(excludeOption), format, analysis, out);
            } else {
                err.println("error: unknown command " + command);
                help(parser, err);
                return EXIT_USAGE;
            }
        } catch (ValidationException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("error: interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            LOG.error("Analysis failed", e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void help(@Nonnull OptionParser parser, @Nonnull PrintStream out) {
        out.println("Usage: compute [options] compile_commands.json");
        out.println("       report [options] -p NAME=compile_commands.json ...");
        try {
            parser.printHelpOn(out);
        } catch (IOException e) {
            LOG.warn("Failed to print help", e);
        }
    }

    /** Rejects paths with an embedded newline or without a .json extension. */
    /* pp */ static void validate(@Nonnull String path, @Nonnull String what) throws ValidationException {
        if (path.indexOf('\n') != -1 || path.indexOf('\r') != -1)
            throw new ValidationException(what + " path contains a newline: " + path.trim());
        if (!FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT).equals("json"))
            throw new ValidationException(what + " must be a .json file: " + path);
    }

    private static int compute(@Nonnull Path rootDir, @Nonnull String database, @CheckForNull String output,
            @Nonnull AnalysisOptions options, @Nonnull PrintStream out) throws IOException, InterruptedException {
        Codebase codebase = new Codebase(rootDir);
        Map<String, List<PlatformConfig>> configuration = Collections.singletonMap(
                COVERAGE_PLATFORM, CompilationDatabase.load(Paths.get(database)));

        DefaultDiagnosticListener listener = new DefaultDiagnosticListener();
        Association association = analyze(codebase, configuration, options, listener);
        String json = Coverage.toJson(Coverage.compute(codebase, association));
        if (output == null)
            out.println(json);
        else
            FileUtils.writeStringToFile(new File(output), json + "\n", StandardCharsets.UTF_8);
        LOG.info("{}", listener);
        return EXIT_OK;
    }

    private static int report(@Nonnull Path rootDir, @Nonnull Map<String, String> databases,
            @Nonnull List<String> excludes, @Nonnull String format,
            @Nonnull AnalysisOptions options, @Nonnull PrintStream out) throws IOException, InterruptedException {
        Codebase codebase = new Codebase(rootDir);
        for (String pattern : excludes)
            codebase.addExcludePattern(pattern);
        Map<String, List<PlatformConfig>> configuration = new LinkedHashMap<String, List<PlatformConfig>>();
        for (Map.Entry<String, String> e : databases.entrySet())
            configuration.put(e.getKey(), CompilationDatabase.load(Paths.get(e.getValue())));

        DefaultDiagnosticListener listener = new DefaultDiagnosticListener();
        Association association = analyze(codebase, configuration, options, listener);
        SetMap setmap = new PlatformMapper(codebase).walk(association);
        Set<String> platforms = configuration.keySet();

        if (format.equals("json")) {
            JsonObject json = new JsonObject();
            json.add("setmap", setmap.toJson());
            JsonObject counts = new JsonObject();
            for (String platform : platforms)
                counts.addProperty(platform, setmap.getPlatformCount(platform));
            json.add("platforms", counts);
            json.addProperty("total", setmap.getTotal());
            json.addProperty("divergence", setmap.divergence(platforms));
            out.println(new GsonBuilder().setPrettyPrinting().create().toJson(json));
        } else {
            out.print(Report.summary(setmap, platforms));
        }
        LOG.info("{}", listener);
        return EXIT_OK;
    }

    @Nonnull
    private static Association analyze(@Nonnull Codebase codebase,
            @Nonnull Map<String, List<PlatformConfig>> configuration,
            @Nonnull AnalysisOptions options,
            @Nonnull DiagnosticListener listener) throws InterruptedException {
        TreeCache cache = new TreeCache(new FileParser(CategorizerRegistry.createDefault(), listener));
        if (options.isDebug())
            LOG.debug("Analyzing {} with {}", codebase, options);
        return Finder.find(codebase, configuration, cache, options, listener);
    }
}
