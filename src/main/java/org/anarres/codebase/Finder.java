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
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.pcollections.ConsPStack;
import org.pcollections.PStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.codebase.Token.*;

/**
 * Walks the translation unit of one platform and records the lines it
 * compiles.
 *
 * The walk is depth-first in file order. Macro definitions take effect
 * from the point they are reached, and only the first matching branch of
 * each conditional group is entered.
 */
public class Finder {

    private static final Logger LOG = LoggerFactory.getLogger(Finder.class);

    private final String platform;
    private final PlatformConfig config;
    private final TreeCache cache;
    private final AnalysisOptions options;
    private final DiagnosticListener listener;

    private MacroEnvironment environment;
    private ExpressionEvaluator evaluator;
    private Set<Path> once;
    private PStack<Path> includeStack;
    private SortedMap<Path, SortedSet<Integer>> reached;

    public Finder(@Nonnull String platform, @Nonnull PlatformConfig config, @Nonnull TreeCache cache,
            @Nonnull AnalysisOptions options, @Nonnull DiagnosticListener listener) {
        this.platform = platform;
        this.config = config;
        this.cache = cache;
        this.options = options;
        this.listener = listener;
    }

    @Nonnull
    public String getPlatform() {
        return platform;
    }

    @Nonnull
    public PlatformConfig getConfig() {
        return config;
    }

    private void diagnostic(@Nonnull Diagnostic.Kind kind, @CheckForNull Path path, int line, @Nonnull String message) {
        listener.handleDiagnostic(new Diagnostic(kind, path, line, message, platform));
    }

    /**
     * Walks the entry file of this translation unit.
     *
     * Every call starts from a fresh macro environment seeded from the
     * configured defines.
     *
     * @return the lines reached, per file.
     * @throws IOException if the entry file cannot be read.
     * @throws UnsupportedFileTypeException if the entry file cannot be categorized.
     */
    @Nonnull
    public SortedMap<Path, SortedSet<Integer>> walk() throws IOException, UnsupportedFileTypeException {
        environment = new MacroEnvironment();
        for (String define : config.getDefines()) {
            try {
                environment.define(define);
            } catch (ParseException e) {
                diagnostic(Diagnostic.Kind.BAD_DEFINE, null, 0,
                        "Ignoring bad definition '" + define + "': " + e.getMessage());
            }
        }
        evaluator = new ExpressionEvaluator(environment, options.getMaxExpansionDepth());
        once = new HashSet<Path>();
        reached = new TreeMap<Path, SortedSet<Integer>>();

        Path entry = TreeCache.key(config.getFile());
        SourceTree tree = cache.get(entry);
        if (options.isDebug())
            LOG.debug("[{}] Walking {}", platform, entry);
        includeStack = ConsPStack.singleton(entry);
        walk(tree, tree.getRoot().getChildren());
        return reached;
    }

    private void walk(@Nonnull SourceTree tree, @Nonnull List<Node> nodes) {
        for (Node node : nodes) {
            switch (node.getKind()) {
                case CODE:
                    code(tree.getPath(), (CodeNode) node);
                    break;
                case DEFINE:
                    environment.define(((DefineNode) node).getMacro());
                    break;
                case UNDEF:
                    environment.undefine(((UndefNode) node).getName());
                    break;
                case CONDITIONAL_GROUP: {
                    Branch branch = select(tree, (ConditionalGroup) node);
                    if (branch != null)
                        walk(tree, branch.getChildren());
                    break;
                }
                case INCLUDE:
                    include(tree, (IncludeNode) node);
                    break;
                case PRAGMA:
                    if (((PragmaNode) node).isOnce())
                        once.add(tree.getPath());
                    break;
                case ERROR:
                case WARNING:
                case UNRECOGNIZED:
                    break;
                case FILE:
                case IF:
                case IFDEF:
                case IFNDEF:
                case ELIF:
                case ELSE:
                case ENDIF:
                    throw new IllegalStateException("Unexpected " + node.getKind() + " in " + tree.getPath());
                default:
                    throw new IllegalStateException("Unknown node kind " + node.getKind());
            }
        }
    }

    private void code(@Nonnull Path path, @Nonnull CodeNode node) {
        int[] lines = node.getSlocLines();
        if (lines.length == 0)
            return;
        SortedSet<Integer> out = reached.get(path);
        if (out == null) {
            out = new TreeSet<Integer>();
            reached.put(path, out);
        }
        for (int line : lines)
            out.add(line);
    }

    /** Returns the first branch whose condition holds, or null. */
    @CheckForNull
    private Branch select(@Nonnull SourceTree tree, @Nonnull ConditionalGroup group) {
        for (Branch branch : group.getBranches()) {
            ConditionNode condition = branch.getCondition();
            /* Reported when the file was parsed. */
            if (!condition.isValid())
                continue;
            switch (condition.getKind()) {
                case IFDEF:
                    if (environment.isDefined(condition.getText()))
                        return branch;
                    break;
                case IFNDEF:
                    if (!environment.isDefined(condition.getText()))
                        return branch;
                    break;
                case IF:
                case ELIF:
                    try {
                        if (evaluator.isTrue(condition.getTokens()))
                            return branch;
                    } catch (EvaluationException e) {
                        diagnostic(Diagnostic.Kind.EVALUATION_ERROR, tree.getPath(), condition.getStartLine(),
                                "#" + condition.describe() + ": " + e.getMessage());
                    }
                    break;
                case ELSE:
                    return branch;
                default:
                    throw new IllegalStateException("Bad branch " + condition.getKind());
            }
        }
        return null;
    }

    private void include(@Nonnull SourceTree tree, @Nonnull IncludeNode node) {
        int line = node.getStartLine();
        String name;
        boolean quoted;
        switch (node.getHeaderKind()) {
            case QUOTED:
                name = node.getName();
                quoted = true;
                break;
            case ANGLED:
                name = node.getName();
                quoted = false;
                break;
            case COMPUTED: {
                List<Token> tokens;
                try {
                    tokens = new MacroExpander(environment, options.getMaxExpansionDepth()).expand(node.getTokens());
                } catch (EvaluationException e) {
                    diagnostic(Diagnostic.Kind.EVALUATION_ERROR, tree.getPath(), line,
                            "Cannot expand #include: " + e.getMessage());
                    return;
                }
                if (tokens.size() == 1 && tokens.get(0).getType() == STRING) {
                    name = (String) tokens.get(0).getValue();
                    quoted = true;
                } else if (tokens.size() > 2 && tokens.get(0).getType() == '<'
                        && tokens.get(tokens.size() - 1).getType() == '>') {
                    StringBuilder buf = new StringBuilder();
                    for (Token tok : tokens.subList(1, tokens.size() - 1))
                        buf.append(tok.getText());
                    name = buf.toString();
                    quoted = false;
                } else {
                    diagnostic(Diagnostic.Kind.UNRESOLVED_INCLUDE, tree.getPath(), line,
                            "#include expands to neither \"file\" nor <file>: " + tokens);
                    return;
                }
                break;
            }
            default:
                throw new IllegalStateException("Bad include kind " + node.getHeaderKind());
        }

        Path resolved = resolve(tree.getPath(), name, quoted);
        if (resolved == null) {
            diagnostic(Diagnostic.Kind.UNRESOLVED_INCLUDE, tree.getPath(), line,
                    "File not found: " + (quoted ? "\"" + name + "\"" : "<" + name + ">"));
            return;
        }
        if (once.contains(resolved))
            return;
        if (includeStack.contains(resolved)) {
            diagnostic(Diagnostic.Kind.CIRCULAR_INCLUDE, tree.getPath(), line,
                    "Circular include of " + resolved);
            return;
        }
        if (includeStack.size() >= options.getMaxIncludeDepth()) {
            diagnostic(Diagnostic.Kind.INCLUDE_DEPTH_EXCEEDED, tree.getPath(), line,
                    "Not including " + resolved + ": includes nest deeper than " + options.getMaxIncludeDepth());
            return;
        }

        SourceTree child;
        try {
            child = cache.get(resolved);
        } catch (UnsupportedFileTypeException e) {
            diagnostic(Diagnostic.Kind.UNSUPPORTED_FILE_TYPE, tree.getPath(), line, e.getMessage());
            return;
        } catch (IOException e) {
            diagnostic(Diagnostic.Kind.IO_ERROR, tree.getPath(), line,
                    "Failed to read " + resolved + ": " + e.getMessage());
            return;
        }

        if (options.isDebug())
            LOG.debug("[{}] {}:{} includes {}", platform, tree.getPath(), line, resolved);
        PStack<Path> saved = includeStack;
        includeStack = includeStack.plus(resolved);
        try {
            walk(child, child.getRoot().getChildren());
        } finally {
            includeStack = saved;
        }
    }

    /**
     * Finds the file an #include names.
     *
     * Explicit include files are tried first, then an absolute name, then
     * the directory of the including file for a quoted name, then each
     * include path in order.
     */
    @CheckForNull
    private Path resolve(@Nonnull Path current, @Nonnull String name, boolean quoted) {
        Path spec;
        try {
            spec = Paths.get(name).normalize();
        } catch (InvalidPathException e) {
            LOG.debug("Bad include name {}: {}", name, e.getMessage());
            return null;
        }
        if (spec.toString().isEmpty())
            return null;

        for (Path file : config.getIncludeFiles()) {
            Path normalized = file.normalize();
            if (normalized.equals(spec) || normalized.endsWith(spec))
                return TreeCache.key(file);
        }
        if (spec.isAbsolute())
            return Files.isRegularFile(spec) ? TreeCache.key(spec) : null;
        if (quoted) {
            Path dir = current.getParent();
            if (dir != null && Files.isRegularFile(dir.resolve(spec)))
                return TreeCache.key(dir.resolve(spec));
        }
        for (Path dir : config.getIncludePaths()) {
            Path candidate = dir.resolve(spec);
            if (Files.isRegularFile(candidate))
                return TreeCache.key(candidate);
        }
        return null;
    }

    /**
     * Walks every translation unit of every platform, and merges the lines
     * reached into one {@link Association}.
     *
     * Walks run in parallel on {@link AnalysisOptions#getThreads()} threads.
     * Results are merged in platform name order and then configuration
     * order, so the outcome does not depend on scheduling. A translation
     * unit whose entry file cannot be read or categorized is logged and
     * skipped. Afterwards, every source line of every member file that no
     * platform reached is recorded with the empty platform set.
     */
    @Nonnull
    public static Association find(@Nonnull Codebase codebase,
            @Nonnull Map<String, List<PlatformConfig>> configuration,
            @Nonnull TreeCache cache,
            @Nonnull AnalysisOptions options,
            @Nonnull DiagnosticListener listener) throws InterruptedException {
        List<String> platforms = new ArrayList<String>(configuration.keySet());
        Collections.sort(platforms);

        List<Finder> finders = new ArrayList<Finder>();
        for (String platform : platforms)
            for (PlatformConfig config : configuration.get(platform))
                finders.add(new Finder(platform, config, cache, options, listener));

        Association association = new Association();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(options.getThreads(), finders.size())));
        try {
            List<Future<SortedMap<Path, SortedSet<Integer>>>> futures = new ArrayList<Future<SortedMap<Path, SortedSet<Integer>>>>();
            for (final Finder finder : finders) {
                futures.add(executor.submit(new Callable<SortedMap<Path, SortedSet<Integer>>>() {
                    @Override
                    public SortedMap<Path, SortedSet<Integer>> call() throws Exception {
                        return finder.walk();
                    }
                }));
            }

            for (int i = 0; i < finders.size(); i++) {
                Finder finder = finders.get(i);
                SortedMap<Path, SortedSet<Integer>> reached;
                try {
                    reached = futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof IOException || cause instanceof UnsupportedFileTypeException) {
                        LOG.error("[{}] Skipping {}: {}", finder.getPlatform(),
                                finder.getConfig().getFile(), cause.getMessage());
                        continue;
                    }
                    if (cause instanceof RuntimeException)
                        throw (RuntimeException) cause;
                    if (cause instanceof Error)
                        throw (Error) cause;
                    throw new IllegalStateException("Walk failed for " + finder.getConfig().getFile(), cause);
                }
                for (Map.Entry<Path, SortedSet<Integer>> e : reached.entrySet())
                    association.addAll(e.getKey(), e.getValue(), finder.getPlatform());
            }
        } finally {
            executor.shutdownNow();
        }

        addUnreached(codebase, cache, association);
        return association;
    }

    /** Walks with a fresh cache over the default categorizers. */
    @Nonnull
    public static Association find(@Nonnull Codebase codebase,
            @Nonnull Map<String, List<PlatformConfig>> configuration,
            @Nonnull AnalysisOptions options,
            @Nonnull DiagnosticListener listener) throws InterruptedException {
        TreeCache cache = new TreeCache(new FileParser(CategorizerRegistry.createDefault(), listener));
        return find(codebase, configuration, cache, options, listener);
    }

    @Nonnull
    public static Association find(@Nonnull Codebase codebase,
            @Nonnull Map<String, List<PlatformConfig>> configuration) throws InterruptedException {
        return find(codebase, configuration, new AnalysisOptions(), new DefaultDiagnosticListener());
    }

    private static void addUnreached(@Nonnull Codebase codebase, @Nonnull TreeCache cache, @Nonnull Association association) {
        CategorizerRegistry registry = cache.getParser().getRegistry();
        Set<Path> files = new TreeSet<Path>(association.getFiles());
        for (Path file : codebase.getFiles())
            if (registry.isSupported(file))
                files.add(file);

        for (Path file : files) {
            if (!codebase.isMember(file))
                continue;
            SourceTree tree;
            try {
                tree = cache.get(file);
            } catch (IOException e) {
                LOG.debug("Not counting {}: {}", file, e.getMessage());
                continue;
            } catch (UnsupportedFileTypeException e) {
                LOG.debug("Not counting {}: {}", file, e.getMessage());
                continue;
            }
            addUnreached(association, file, tree.getRoot().getChildren());
        }
    }

    private static void addUnreached(@Nonnull Association association, @Nonnull Path file, @Nonnull List<Node> nodes) {
        for (Node node : nodes) {
            switch (node.getKind()) {
                case CODE:
                    for (int line : ((CodeNode) node).getSlocLines())
                        association.addStructural(file, line);
                    break;
                case CONDITIONAL_GROUP:
                    for (Branch branch : ((ConditionalGroup) node).getBranches())
                        addUnreached(association, file, branch.getChildren());
                    break;
                default:
                    break;
            }
        }
    }
}
